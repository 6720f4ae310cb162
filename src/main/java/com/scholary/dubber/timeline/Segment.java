package com.scholary.dubber.timeline;

/**
 * One slot of the dubbing timeline: either silence or speech by one speaker.
 *
 * @param start start time in seconds
 * @param end end time in seconds
 * @param duration {@code end - start}
 * @param silence whether the slot carries no speech
 * @param text source text, empty for silence
 * @param speakerId diarization label, null for silence
 * @param voiceId synthetic voice chosen for the speaker, null until assigned
 */
public record Segment(
    double start,
    double end,
    double duration,
    boolean silence,
    String text,
    String speakerId,
    String voiceId) {

  public Segment {
    if (end < start) {
      throw new IllegalArgumentException(
          String.format("Segment end (%s) must be >= start (%s)", end, start));
    }
    if (!silence && (text == null || text.isBlank())) {
      throw new IllegalArgumentException("Speech segment must carry text");
    }
  }

  public static Segment silence(double start, double end) {
    return new Segment(start, end, end - start, true, "", null, null);
  }

  public static Segment speech(double start, double end, String text, String speakerId) {
    return new Segment(start, end, end - start, false, text, speakerId, null);
  }

  public Segment withVoice(String voiceId) {
    return new Segment(start, end, duration, silence, text, speakerId, voiceId);
  }
}
