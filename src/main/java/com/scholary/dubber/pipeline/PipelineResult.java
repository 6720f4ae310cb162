package com.scholary.dubber.pipeline;

import com.scholary.dubber.export.ExportResult;
import java.nio.file.Path;

/**
 * Outcome of dubbing one target language.
 *
 * @param languageCode target language
 * @param finalAudioPath exported final mix, null on failure
 * @param transcriptText source transcript
 * @param translatedText translations of all speech segments that succeeded
 * @param voiceOnlyPath exported voice-only track, null on failure
 * @param captionsPath exported SRT captions, null on failure
 * @param transcriptJsonPath exported transcript JSON, null on failure
 * @param bundlePath exported zip bundle, null on failure
 * @param mixedWithBackground whether the final audio contains the background bed
 * @param failedSegments speech segments that were replaced by silence
 * @param failure why the language failed, null on success
 */
public record PipelineResult(
    String languageCode,
    Path finalAudioPath,
    String transcriptText,
    String translatedText,
    Path voiceOnlyPath,
    Path captionsPath,
    Path transcriptJsonPath,
    Path bundlePath,
    boolean mixedWithBackground,
    int failedSegments,
    PipelineFailure failure) {

  public static PipelineResult failed(
      String languageCode, String transcriptText, PipelineFailure failure) {
    return new PipelineResult(
        languageCode, null, transcriptText, null, null, null, null, null, false, 0, failure);
  }

  /** The exported files, or null when the language failed. */
  public ExportResult export() {
    if (!isSuccess()) {
      return null;
    }
    return new ExportResult(
        finalAudioPath, voiceOnlyPath, captionsPath, transcriptJsonPath, bundlePath);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
