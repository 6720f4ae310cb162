package com.scholary.dubber.transcription;

import java.nio.file.Path;

/**
 * Speech recognition service.
 *
 * <p>Implementations call an external recognizer. The pipeline only depends on this interface so
 * providers can be swapped and tests can supply canned utterances.
 */
public interface Transcriber {

  /**
   * Transcribe an audio file.
   *
   * @param audioPath the audio to transcribe
   * @param language source language code, e.g. {@code en}
   * @param diarize whether to attribute utterances to speakers
   * @return the transcription with utterances ordered by start time
   * @throws TranscriptionException if recognition fails
   */
  TranscriptionResult transcribe(Path audioPath, String language, boolean diarize);
}
