package com.scholary.dubber.api;

import java.util.Map;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a dubbing job, its progress overall and per target language, and
 * the per-language results once the job has finished.
 */
public record JobStatusResponse(
    String jobId,
    Status status,
    Integer progress,
    Map<String, Integer> languageProgress,
    Map<String, LanguageResultResponse> results,
    String error) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
