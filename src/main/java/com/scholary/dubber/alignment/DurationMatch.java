package com.scholary.dubber.alignment;

import java.nio.file.Path;

/**
 * Result of re-timing a clip.
 *
 * @param output the re-timed canonical file
 * @param inputDuration duration of the clip before re-timing
 * @param outputDuration measured duration of {@code output}
 * @param strategy what was done to the clip
 */
public record DurationMatch(
    Path output, double inputDuration, double outputDuration, MatchStrategy strategy) {}
