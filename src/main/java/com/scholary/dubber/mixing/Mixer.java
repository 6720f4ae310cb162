package com.scholary.dubber.mixing;

import com.scholary.dubber.audio.AudioToolException;
import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.audio.PcmAudio;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mixes the dubbed voice track with an optional background bed.
 *
 * <p>Both inputs are first normalized to the canonical format. The voice length is authoritative:
 * the background is looped when shorter and cut when longer, and the voice is never looped. After
 * gains (and optional ducking) the two are summed. If the sum would clip, it is scaled down so the
 * peak sits at the configured headroom; quiet mixes are never amplified.
 *
 * <p>Why is the voice length authoritative? Because the voice track was rebuilt segment by segment
 * to the exact source timeline. Cutting or padding it to fit the background would break the sync
 * with the original picture and captions.
 *
 * <p>Why scale instead of clamping? Because clamping flattens every peak above full scale into a
 * square edge, which is audible as distortion. One gain for the whole mix keeps the waveform
 * shape and the balance between voice and background.
 */
@Component
public class Mixer {

  private static final Logger LOGGER = LoggerFactory.getLogger(Mixer.class);

  private final AudioToolRunner audioTools;

  public Mixer(AudioToolRunner audioTools) {
    this.audioTools = audioTools;
  }

  /**
   * Produce the final mix.
   *
   * @param voice dubbed voice track
   * @param background background bed, or null for a voice-only mix
   * @param output canonical output file
   * @return {@code output}
   * @throws MixingException if an input cannot be decoded or the mix cannot be written
   */
  public Path mix(Path voice, Path background, Path output, MixSettings settings) {
    Path voiceCanonical = output.resolveSibling(output.getFileName() + ".voice.wav");
    Path backgroundCanonical = output.resolveSibling(output.getFileName() + ".background.wav");
    try {
      // Step 1: decode the voice and apply its gain into a fresh buffer
      PcmAudio voiceAudio = load(voice, voiceCanonical, "voice");
      PcmAudio mixedAudio =
          new PcmAudio(
              scaled(voiceAudio.samples(), (float) settings.voiceGain()),
              voiceAudio.sampleRate(),
              voiceAudio.channels());
      float[] mixed = mixedAudio.samples();

      // Step 2: add the background, looped or cut to the voice length
      // Both sides were normalized by the same tool, so a format mismatch means a broken input
      if (background != null) {
        PcmAudio backgroundAudio = load(background, backgroundCanonical, "background");
        if (backgroundAudio.sampleRate() != voiceAudio.sampleRate()
            || backgroundAudio.channels() != voiceAudio.channels()) {
          throw new MixingException("Voice and background formats differ after normalization");
        }
        addBackground(mixed, voiceAudio, backgroundAudio, settings);
      }

      // Step 3: bring the peak back under full scale only when the sum would clip
      float peak = mixedAudio.peak();
      if (peak > 1.0f) {
        float factor = (float) (settings.headroom() / peak);
        for (int i = 0; i < mixed.length; i++) {
          mixed[i] *= factor;
        }
        LOGGER.info("Mix peak {} above full scale, scaled by {}", peak, factor);
      }

      mixedAudio.write(output);
      LOGGER.info(
          "Mixed {}s of audio: background={}, ducking={}",
          String.format("%.2f", voiceAudio.durationSeconds()),
          background != null,
          background != null && settings.duckingEnabled());
      return output;

    } catch (IOException e) {
      throw new MixingException("Mix could not be written", e);
    } finally {
      deleteQuietly(voiceCanonical);
      deleteQuietly(backgroundCanonical);
    }
  }

  private PcmAudio load(Path input, Path canonical, String role) {
    try {
      audioTools.normalize(input, canonical);
      return PcmAudio.read(canonical);
    } catch (AudioToolException | IOException e) {
      throw new MixingException("The " + role + " track could not be decoded", e);
    }
  }

  private static void addBackground(
      float[] mixed, PcmAudio voice, PcmAudio background, MixSettings settings) {
    int channels = voice.channels();
    int frames = voice.frames();
    int backgroundFrames = background.frames();
    if (backgroundFrames == 0) {
      return;
    }

    float[] mask = settings.duckingEnabled() ? duckingMask(voice, settings) : null;
    float[] backgroundSamples = background.samples();
    float gain = (float) settings.backgroundGain();

    for (int frame = 0; frame < frames; frame++) {
      // loop the bed when it is shorter than the voice
      int source = frame % backgroundFrames;
      float frameGain = mask == null ? gain : gain * mask[frame];
      for (int c = 0; c < channels; c++) {
        mixed[frame * channels + c] += backgroundSamples[source * channels + c] * frameGain;
      }
    }
  }

  /**
   * Per-frame background gain multiplier: {@code duckedGain} where the voice is active, 1.0
   * elsewhere.
   *
   * <p>Voice activity comes from an RMS envelope over non-overlapping windows, linearly
   * interpolated between window centres.
   *
   * <p>Why an envelope and not the raw samples? Because a single sample crosses zero hundreds of
   * times per second. Gating on it would pump the background in and out within each syllable.
   */
  static float[] duckingMask(PcmAudio voice, MixSettings settings) {
    float[] mono = voice.toMono();
    int window = Math.max(1, voice.sampleRate() * settings.duckingWindowMs() / 1000);
    int windows = Math.max(1, (mono.length + window - 1) / window);

    // RMS per window; the last window may be partial
    double[] rms = new double[windows];
    for (int w = 0; w < windows; w++) {
      int from = w * window;
      int to = Math.min(mono.length, from + window);
      double acc = 0.0;
      for (int i = from; i < to; i++) {
        acc += mono[i] * mono[i];
      }
      rms[w] = to > from ? Math.sqrt(acc / (to - from)) : 0.0;
    }

    // Interpolate the envelope at each frame, holding the first and last window flat at the edges
    float[] mask = new float[mono.length];
    for (int frame = 0; frame < mono.length; frame++) {
      double position = (frame - window / 2.0) / window;
      int left = (int) Math.floor(position);
      double fraction = position - left;
      double envelope;
      if (left < 0) {
        envelope = rms[0];
      } else if (left >= windows - 1) {
        envelope = rms[windows - 1];
      } else {
        envelope = rms[left] * (1 - fraction) + rms[left + 1] * fraction;
      }
      mask[frame] = envelope > settings.duckingThreshold() ? (float) settings.duckedGain() : 1.0f;
    }
    return mask;
  }

  private static float[] scaled(float[] samples, float gain) {
    float[] out = new float[samples.length];
    for (int i = 0; i < samples.length; i++) {
      out[i] = samples[i] * gain;
    }
    return out;
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete intermediate file {}: {}", path.getFileName(), e.getMessage());
    }
  }
}
