package com.scholary.dubber.timeline;

import java.nio.file.Path;

/**
 * Rendered audio for one timeline segment.
 *
 * @param segmentIndex position of the segment in the timeline
 * @param filePath canonical audio file
 * @param actualDuration measured duration of the file
 */
public record ProcessedSegmentAudio(int segmentIndex, Path filePath, double actualDuration) {}
