package com.scholary.dubber.transcription;

/**
 * A contiguous span of speech attributed to one speaker.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param text recognized text
 * @param speakerId diarization label
 * @param confidence recognizer confidence in {@code [0, 1]}
 */
public record Utterance(
    double start, double end, String text, String speakerId, double confidence) {

  public Utterance {
    if (start < 0) {
      throw new IllegalArgumentException("Utterance start must be non-negative: " + start);
    }
    if (end < start) {
      throw new IllegalArgumentException(
          String.format("Utterance end (%s) must be >= start (%s)", end, start));
    }
  }

  public double duration() {
    return end - start;
  }
}
