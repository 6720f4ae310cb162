package com.scholary.dubber.pipeline;

import com.scholary.dubber.PipelineStage;

/**
 * Result of one per-segment step: a value, or the stage that failed and why.
 *
 * <p>Failures here are expected and recoverable; the segment is rendered as silence instead.
 */
public record SegmentOutcome<T>(T value, PipelineStage failedStage, String error) {

  public static <T> SegmentOutcome<T> success(T value) {
    return new SegmentOutcome<>(value, null, null);
  }

  public static <T> SegmentOutcome<T> failure(PipelineStage stage, String error) {
    return new SegmentOutcome<>(null, stage, error);
  }

  public boolean isSuccess() {
    return failedStage == null;
  }
}
