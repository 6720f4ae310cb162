package com.scholary.dubber.audio;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

/**
 * Decoded 16-bit PCM audio held in memory as interleaved float samples in {@code [-1, 1]}.
 *
 * <p>Only used on canonical WAV intermediates, which the {@link AudioToolRunner} produces. Sample
 * level work (mixing, pitch estimation) happens here instead of in an external tool.
 */
public final class PcmAudio {

  private static final float FULL_SCALE = 32768f;

  private final float[] samples;
  private final int sampleRate;
  private final int channels;

  public PcmAudio(float[] samples, int sampleRate, int channels) {
    if (sampleRate <= 0 || channels <= 0) {
      throw new IllegalArgumentException("Sample rate and channel count must be positive");
    }
    if (samples.length % channels != 0) {
      throw new IllegalArgumentException("Sample count is not a multiple of the channel count");
    }
    this.samples = samples;
    this.sampleRate = sampleRate;
    this.channels = channels;
  }

  /** Create silent audio lasting {@code frames} frames. */
  public static PcmAudio silence(int frames, int sampleRate, int channels) {
    return new PcmAudio(new float[frames * channels], sampleRate, channels);
  }

  /**
   * Read a WAV file.
   *
   * @throws IOException if the file cannot be read or is not 16-bit PCM
   */
  public static PcmAudio read(Path file) throws IOException {
    try (AudioInputStream stream = AudioSystem.getAudioInputStream(file.toFile())) {
      AudioFormat format = stream.getFormat();
      if (format.getEncoding() != AudioFormat.Encoding.PCM_SIGNED
          || format.getSampleSizeInBits() != 16) {
        throw new IOException("Expected 16-bit signed PCM, got " + format);
      }

      byte[] bytes = stream.readAllBytes();
      boolean bigEndian = format.isBigEndian();
      float[] samples = new float[bytes.length / 2];
      for (int i = 0; i < samples.length; i++) {
        int lo = bytes[2 * i + (bigEndian ? 1 : 0)] & 0xff;
        int hi = bytes[2 * i + (bigEndian ? 0 : 1)];
        samples[i] = (short) ((hi << 8) | lo) / FULL_SCALE;
      }
      int channels = format.getChannels();
      int usable = samples.length - samples.length % channels;
      if (usable != samples.length) {
        float[] trimmed = new float[usable];
        System.arraycopy(samples, 0, trimmed, 0, usable);
        samples = trimmed;
      }
      return new PcmAudio(samples, (int) format.getSampleRate(), channels);
    } catch (UnsupportedAudioFileException e) {
      throw new IOException("Not a readable WAV file", e);
    }
  }

  /** Write as a 16-bit little-endian WAV file, clamping samples to full scale. */
  public void write(Path file) throws IOException {
    byte[] bytes = new byte[samples.length * 2];
    for (int i = 0; i < samples.length; i++) {
      float clamped = Math.max(-1f, Math.min(1f, samples[i]));
      int value = Math.round(clamped * (FULL_SCALE - 1));
      bytes[2 * i] = (byte) value;
      bytes[2 * i + 1] = (byte) (value >> 8);
    }

    AudioFormat format = new AudioFormat(sampleRate, 16, channels, true, false);
    try (AudioInputStream stream =
        new AudioInputStream(new ByteArrayInputStream(bytes), format, frames())) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, file.toFile());
    }
  }

  public float[] samples() {
    return samples;
  }

  public int sampleRate() {
    return sampleRate;
  }

  public int channels() {
    return channels;
  }

  public int frames() {
    return samples.length / channels;
  }

  public double durationSeconds() {
    return (double) frames() / sampleRate;
  }

  /** Largest absolute sample value. */
  public float peak() {
    float peak = 0f;
    for (float sample : samples) {
      peak = Math.max(peak, Math.abs(sample));
    }
    return peak;
  }

  /** Average the channels of each frame. */
  public float[] toMono() {
    if (channels == 1) {
      return samples.clone();
    }
    float[] mono = new float[frames()];
    for (int frame = 0; frame < mono.length; frame++) {
      float sum = 0f;
      for (int c = 0; c < channels; c++) {
        sum += samples[frame * channels + c];
      }
      mono[frame] = sum / channels;
    }
    return mono;
  }
}
