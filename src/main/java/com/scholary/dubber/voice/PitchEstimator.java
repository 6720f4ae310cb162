package com.scholary.dubber.voice;

import java.nio.file.Path;

/** Estimates the mean fundamental frequency of a speech sample. */
public interface PitchEstimator {

  /**
   * Estimate pitch.
   *
   * @param sample canonical WAV file holding one speaker's speech
   * @return mean f0 of voiced frames in Hz, or 0.0 when no voiced frame was found or the sample
   *     could not be read
   */
  double estimatePitch(Path sample);
}
