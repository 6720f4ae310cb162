package com.scholary.dubber.voice;

import com.scholary.dubber.audio.PcmAudio;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PitchEstimator} using the YIN algorithm (de Cheveigné and Kawahara, 2002).
 *
 * <p>The sample is downmixed to mono and decimated to roughly {@value #ANALYSIS_RATE} Hz, then
 * analysed frame by frame:
 *
 * <ol>
 *   <li>Frames quieter than {@value #SILENCE_RMS} RMS are skipped
 *   <li>The cumulative mean normalized difference function is computed over the lag range covering
 *       {@value #MIN_PITCH_HZ} to {@value #MAX_PITCH_HZ} Hz
 *   <li>The first dip below {@value #THRESHOLD} is refined to its local minimum and interpolated
 *   <li>Frames without such a dip count as unvoiced
 * </ol>
 *
 * <p>The estimate is the mean f0 over voiced frames.
 */
@Component
public class YinPitchEstimator implements PitchEstimator {

  private static final Logger LOGGER = LoggerFactory.getLogger(YinPitchEstimator.class);

  static final double MIN_PITCH_HZ = 65.4;
  static final double MAX_PITCH_HZ = 2093.0;
  static final double THRESHOLD = 0.1;
  static final double SILENCE_RMS = 0.01;
  static final int ANALYSIS_RATE = 11025;
  private static final int WINDOW = 512;
  private static final int HOP = 256;

  @Override
  public double estimatePitch(Path sample) {
    PcmAudio audio;
    try {
      audio = PcmAudio.read(sample);
    } catch (IOException e) {
      LOGGER.warn("Pitch sample could not be read: {}", e.getMessage());
      return 0.0;
    }
    return estimate(audio.toMono(), audio.sampleRate());
  }

  /** Estimate the mean pitch of mono samples. */
  double estimate(float[] mono, int sampleRate) {
    int factor = Math.max(1, sampleRate / ANALYSIS_RATE);
    float[] signal = decimate(mono, factor);
    double rate = (double) sampleRate / factor;

    int minLag = Math.max(2, (int) Math.floor(rate / MAX_PITCH_HZ));
    int maxLag = (int) Math.ceil(rate / MIN_PITCH_HZ);
    int frameLength = WINDOW + maxLag + 1;

    double sum = 0.0;
    int voiced = 0;
    double[] difference = new double[maxLag + 1];
    for (int offset = 0; offset + frameLength <= signal.length; offset += HOP) {
      if (rms(signal, offset, WINDOW) < SILENCE_RMS) {
        continue;
      }
      double lag = detectLag(signal, offset, minLag, maxLag, difference);
      if (lag > 0) {
        sum += rate / lag;
        voiced++;
      }
    }

    if (voiced == 0) {
      return 0.0;
    }
    return sum / voiced;
  }

  /** Returns the refined period in samples, or -1 when the frame is unvoiced. */
  private static double detectLag(
      float[] signal, int offset, int minLag, int maxLag, double[] difference) {
    for (int tau = 1; tau <= maxLag; tau++) {
      double d = 0.0;
      for (int j = 0; j < WINDOW; j++) {
        double delta = signal[offset + j] - signal[offset + j + tau];
        d += delta * delta;
      }
      difference[tau] = d;
    }

    // cumulative mean normalized difference, in place
    difference[0] = 1.0;
    double running = 0.0;
    for (int tau = 1; tau <= maxLag; tau++) {
      running += difference[tau];
      difference[tau] = running == 0.0 ? 1.0 : difference[tau] * tau / running;
    }

    for (int tau = minLag; tau <= maxLag; tau++) {
      if (difference[tau] < THRESHOLD) {
        while (tau + 1 <= maxLag && difference[tau + 1] < difference[tau]) {
          tau++;
        }
        return interpolate(difference, tau, maxLag);
      }
    }
    return -1;
  }

  private static double interpolate(double[] values, int tau, int maxLag) {
    if (tau <= 1 || tau >= maxLag) {
      return tau;
    }
    double left = values[tau - 1];
    double centre = values[tau];
    double right = values[tau + 1];
    double denominator = left - 2 * centre + right;
    if (denominator == 0.0) {
      return tau;
    }
    return tau + 0.5 * (left - right) / denominator;
  }

  private static float[] decimate(float[] samples, int factor) {
    if (factor == 1) {
      return samples;
    }
    float[] out = new float[samples.length / factor];
    for (int i = 0; i < out.length; i++) {
      float acc = 0f;
      for (int k = 0; k < factor; k++) {
        acc += samples[i * factor + k];
      }
      out[i] = acc / factor;
    }
    return out;
  }

  private static double rms(float[] signal, int offset, int length) {
    double acc = 0.0;
    for (int i = offset; i < offset + length; i++) {
      acc += signal[i] * signal[i];
    }
    return Math.sqrt(acc / length);
  }
}
