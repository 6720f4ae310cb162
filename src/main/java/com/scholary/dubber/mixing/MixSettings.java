package com.scholary.dubber.mixing;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Gains and ducking parameters for the final mix.
 *
 * @param voiceGain linear gain applied to the dubbed voice
 * @param backgroundGain linear gain applied to the background bed
 * @param duckingEnabled whether to lower the background while the voice is active
 * @param duckingThreshold voice RMS above which a window counts as active
 * @param duckedGain extra gain applied to the background in active windows
 * @param duckingWindowMs RMS window length
 * @param headroom peak level the mix is scaled to when it would clip
 */
public record MixSettings(
    @PositiveOrZero double voiceGain,
    @PositiveOrZero double backgroundGain,
    boolean duckingEnabled,
    @PositiveOrZero double duckingThreshold,
    @PositiveOrZero @DecimalMax("1.0") double duckedGain,
    @Positive int duckingWindowMs,
    @Positive @DecimalMax("1.0") double headroom) {

  public MixSettings withoutDucking() {
    return new MixSettings(
        voiceGain,
        backgroundGain,
        false,
        duckingThreshold,
        duckedGain,
        duckingWindowMs,
        headroom);
  }
}
