package com.scholary.dubber.audio;

import java.nio.file.Path;
import java.util.List;

/**
 * The single boundary between the pipeline and external audio tooling.
 *
 * <p>Every operation reads its inputs, writes exactly one output file and leaves the inputs
 * untouched. Unless stated otherwise, outputs are in the canonical intermediate format (16-bit PCM
 * WAV at the configured sample rate and channel layout).
 *
 * <p>All operations are blocking and bounded by a timeout. Failures surface as {@link
 * AudioToolException}, timeouts as {@link AudioToolTimeoutException}.
 */
public interface AudioToolRunner {

  /** Inspect a media file without modifying it. */
  MediaInfo probe(Path input);

  /**
   * Extract the audio track of a media file.
   *
   * @param format {@code wav} (canonical PCM), {@code mp3} (high quality VBR), or anything else
   *     for a stream copy
   */
  void extractAudio(Path input, Path output, String format);

  /** Re-encode any audio input to the canonical format. */
  void normalize(Path input, Path output);

  /** Cut {@code [start, start + duration)} out of the input. */
  void extractClip(Path input, double startSeconds, double durationSeconds, Path output);

  /** Change tempo by {@code factor} without changing pitch. A factor above 1 shortens the audio. */
  void stretchTempo(Path input, double factor, Path output);

  /** Append trailing silence so the output lasts exactly {@code durationSeconds}. */
  void padToDuration(Path input, double durationSeconds, Path output);

  /** Keep only the first {@code durationSeconds} of the input. */
  void trimToDuration(Path input, double durationSeconds, Path output);

  /** Write pure silence of the given duration. */
  void generateSilence(double durationSeconds, Path output);

  /** Concatenate inputs in list order. */
  void concatenate(List<Path> inputs, Path output);

  /**
   * Encode a canonical file into a delivery format.
   *
   * @param format container/extension such as {@code m4a}, {@code mp3} or {@code wav}
   * @param bitrate target bitrate for lossy formats, e.g. {@code 192k}
   */
  void encode(Path input, Path output, String format, String bitrate);

  /** Convenience accessor for the probed duration. */
  default double durationOf(Path input) {
    return probe(input).durationSeconds();
  }
}
