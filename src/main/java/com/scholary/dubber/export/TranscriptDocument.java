package com.scholary.dubber.export;

import java.util.List;

/**
 * Machine-readable record of a dubbed language, exported as JSON next to the audio.
 *
 * @param jobId job the language belongs to
 * @param sourceLanguage language of the original recording
 * @param targetLanguage dubbed language
 * @param transcript source transcript
 * @param translatedText concatenated translations of all speech segments
 * @param segments the timeline as it was rendered
 */
public record TranscriptDocument(
    String jobId,
    String sourceLanguage,
    String targetLanguage,
    String transcript,
    String translatedText,
    List<Entry> segments) {

  /**
   * One rendered timeline segment.
   *
   * @param fallback true when a speech segment was replaced by silence
   */
  public record Entry(
      int index,
      double start,
      double end,
      boolean silence,
      String speakerId,
      String voiceId,
      String sourceText,
      String translatedText,
      boolean fallback) {}
}
