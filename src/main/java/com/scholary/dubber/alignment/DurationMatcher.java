package com.scholary.dubber.alignment;

import com.scholary.dubber.audio.AudioToolRunner;
import com.scholary.dubber.logging.StructuredLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Re-times synthesized speech to the duration of the segment it replaces.
 *
 * <p>Rules, applied in order:
 *
 * <ol>
 *   <li>target at or below the tolerance: pure silence of the target duration
 *   <li>within tolerance of the target: pass through, format-normalized only
 *   <li>shorter than the target: pad with trailing silence
 *   <li>longer, with {@code actual / target <= maxSpeedFactor}: pitch-preserving tempo change, then
 *       a hard trim to absorb rounding
 *   <li>longer than that: hard trim only, logged as a degradation
 * </ol>
 *
 * <p>Why never slow speech down? Because a drawn-out voice sounds wrong far sooner than a short
 * pause at the end of a sentence. Short speech is padded instead.
 *
 * <p>Why cap the speed-up? Because past {@code maxSpeedFactor} the tempo filter makes speech hard
 * to follow. Losing the end of a long sentence is the smaller defect, and it is logged so the
 * segment can be reviewed.
 *
 * <p>The output always lasts the target duration within the tolerance. Tool failures propagate
 * as {@link com.scholary.dubber.audio.AudioToolException} for the caller to isolate.
 */
@Component
public class DurationMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(DurationMatcher.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final AudioToolRunner audioTools;
  private final double tolerance;
  private final double maxSpeedFactor;

  public DurationMatcher(
      AudioToolRunner audioTools,
      @Value("${dubbing.duration.tolerance}") double tolerance,
      @Value("${dubbing.duration.maxSpeedFactor}") double maxSpeedFactor) {
    this.audioTools = audioTools;
    this.tolerance = tolerance;
    this.maxSpeedFactor = maxSpeedFactor;
  }

  /**
   * Re-time {@code input} to {@code targetDuration}, writing {@code output}.
   *
   * @param input decodable audio clip
   * @param targetDuration desired duration in seconds
   * @param output canonical output file
   */
  public DurationMatch matchDuration(Path input, double targetDuration, Path output) {
    // A slot too short to hold any speech is rendered as silence; the input is not even read
    if (targetDuration <= tolerance) {
      audioTools.generateSilence(targetDuration, output);
      return result(output, 0.0, MatchStrategy.SILENCE);
    }

    // Close enough already: only bring it to the canonical format
    double actual = audioTools.durationOf(input);
    if (Math.abs(actual - targetDuration) <= tolerance) {
      audioTools.normalize(input, output);
      return result(output, actual, MatchStrategy.PASS_THROUGH);
    }

    // Too short: keep natural pacing and fill the rest with silence
    if (actual < targetDuration) {
      audioTools.padToDuration(input, targetDuration, output);
      return result(output, actual, MatchStrategy.PAD);
    }

    // Too long but within the speed-up limit
    // The tempo filter rounds, so the stretched clip is trimmed to the exact target afterwards
    double factor = actual / targetDuration;
    if (factor <= maxSpeedFactor) {
      Path stretched = output.resolveSibling(output.getFileName() + ".stretched.wav");
      try {
        audioTools.stretchTempo(input, factor, stretched);
        audioTools.trimToDuration(stretched, targetDuration, output);
      } finally {
        deleteQuietly(stretched);
      }
      return result(output, actual, MatchStrategy.STRETCH);
    }

    // Too long even at full speed-up: cut the tail
    STRUCTURED_LOGGER.logDurationDegraded(actual, targetDuration, factor);
    audioTools.trimToDuration(input, targetDuration, output);
    return result(output, actual, MatchStrategy.TRIM);
  }

  private DurationMatch result(Path output, double inputDuration, MatchStrategy strategy) {
    return new DurationMatch(output, inputDuration, audioTools.durationOf(output), strategy);
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete intermediate file {}: {}", path.getFileName(), e.getMessage());
    }
  }
}
