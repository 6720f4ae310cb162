package com.scholary.dubber.transcription;

import java.util.List;

/**
 * Output of a transcription call.
 *
 * @param transcript full transcript text
 * @param confidence overall confidence
 * @param durationSeconds audio duration reported by the recognizer
 * @param utterances diarized utterances ordered by start time
 */
public record TranscriptionResult(
    String transcript, double confidence, double durationSeconds, List<Utterance> utterances) {

  public TranscriptionResult {
    utterances = List.copyOf(utterances);
  }
}
