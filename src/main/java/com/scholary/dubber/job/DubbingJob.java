package com.scholary.dubber.job;

import com.scholary.dubber.api.DubbingRequest;
import com.scholary.dubber.api.JobStatusResponse.Status;
import com.scholary.dubber.api.LanguageResultResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents an async dubbing job.
 *
 * <p>Tracks the job's state, overall and per-language progress, and the per-language results.
 * Progress is written from the language worker threads while API threads read it, so all mutable
 * state is either volatile or held in concurrent maps.
 */
public class DubbingJob {

  /** Share of the overall progress reached once the shared stages are done. */
  static final int SHARED_STAGES_PERCENT = 20;

  private final String jobId;
  private final DubbingRequest request;
  private final Instant createdAt;
  private final Map<String, Integer> languageProgress = new ConcurrentHashMap<>();
  private final Map<String, LanguageResultResponse> results = new ConcurrentHashMap<>();

  private volatile Status status;
  private volatile int progress; // 0-100
  private volatile String error;

  public DubbingJob(String jobId, DubbingRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.createdAt = Instant.now();
    this.status = Status.PENDING;
    this.progress = 0;
  }

  public String getJobId() {
    return jobId;
  }

  public DubbingRequest getRequest() {
    return request;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public int getProgress() {
    return progress;
  }

  public String getError() {
    return error;
  }

  public void setError(String error) {
    this.error = error;
  }

  /** Record progress of the stages shared by all languages. Progress never moves backwards. */
  public synchronized void updateSharedProgress(int percent) {
    int scaled = Math.min(SHARED_STAGES_PERCENT, percent);
    progress = Math.max(progress, scaled);
  }

  /**
   * Record progress of one language and recompute the overall progress as the shared share plus
   * the average of all target languages over the remainder.
   */
  public synchronized void updateLanguageProgress(String language, int percent) {
    languageProgress.merge(language, percent, Math::max);
    List<String> targets = request.targetLanguages();
    double sum = 0;
    for (String target : targets) {
      sum += languageProgress.getOrDefault(target, 0);
    }
    double average = targets.isEmpty() ? 0 : sum / targets.size();
    int overall =
        (int) Math.round(SHARED_STAGES_PERCENT + (100 - SHARED_STAGES_PERCENT) * average / 100.0);
    progress = Math.max(progress, Math.min(100, overall));
  }

  /** Mark the job finished; a completed job always reports 100%. */
  public synchronized void complete() {
    status = Status.COMPLETED;
    progress = 100;
  }

  public void fail(String error) {
    this.error = error;
    this.status = Status.FAILED;
  }

  public Map<String, Integer> getLanguageProgress() {
    return new LinkedHashMap<>(languageProgress);
  }

  public void putResult(LanguageResultResponse result) {
    results.put(result.language(), result);
  }

  /** Results in the order the languages were requested. */
  public Map<String, LanguageResultResponse> getResults() {
    Map<String, LanguageResultResponse> ordered = new LinkedHashMap<>();
    for (String language : request.targetLanguages()) {
      LanguageResultResponse result = results.get(language);
      if (result != null) {
        ordered.put(language, result);
      }
    }
    return ordered;
  }
}
