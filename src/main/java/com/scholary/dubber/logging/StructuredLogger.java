package com.scholary.dubber.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Event methods put their fields into the MDC for the duration of a single log call, so log
 * shippers can index them. Run context ({@code jobId}, {@code language}) is set once per worker
 * thread and cleared by the caller.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a segment that went through translation, synthesis and re-timing. */
  public void logSegmentProcessed(
      int segmentIndex,
      String speakerId,
      String voiceId,
      String strategy,
      double targetDuration,
      double actualDuration) {
    try {
      MDC.put("event_type", "segment_processed");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("speakerId", speakerId);
      MDC.put("voiceId", voiceId);
      MDC.put("strategy", strategy);
      MDC.put("targetDuration", String.valueOf(targetDuration));
      MDC.put("actualDuration", String.valueOf(actualDuration));

      logger.debug(
          "Segment processed: index={}, speaker={}, voice={}, strategy={}, target={}s, actual={}s",
          segmentIndex,
          speakerId,
          voiceId,
          strategy,
          targetDuration,
          actualDuration);
    } finally {
      clearEventFields();
    }
  }

  /** Log a speech segment replaced by silence after a failure. */
  public void logSegmentFallback(
      int segmentIndex, String stage, String errorType, String message) {
    try {
      MDC.put("event_type", "segment_fallback");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("stage", stage);
      MDC.put("errorType", errorType);

      logger.warn(
          "Segment replaced by silence: index={}, stage={}, error={}, message={}",
          segmentIndex,
          stage,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log speech that was too long to stretch and had to be cut. */
  public void logDurationDegraded(double actualDuration, double targetDuration, double factor) {
    try {
      MDC.put("event_type", "duration_degraded");
      MDC.put("actualDuration", String.valueOf(actualDuration));
      MDC.put("targetDuration", String.valueOf(targetDuration));
      MDC.put("factor", String.valueOf(factor));

      logger.warn(
          "Speech exceeds stretch ceiling, trimming: actual={}s, target={}s, factor={}",
          actualDuration,
          targetDuration,
          factor);
    } finally {
      clearEventFields();
    }
  }

  /** Log a speaker to voice assignment. */
  public void logVoiceAssigned(String speakerId, double pitchHz, String voiceId) {
    try {
      MDC.put("event_type", "voice_assigned");
      MDC.put("speakerId", speakerId);
      MDC.put("pitchHz", String.valueOf(pitchHz));
      MDC.put("voiceId", voiceId);

      logger.info("Voice assigned: speaker={}, pitch={}Hz, voice={}", speakerId, pitchHz, voiceId);
    } finally {
      clearEventFields();
    }
  }

  /** Log a retry of an external provider call. */
  public void logProviderRetry(
      String provider, int attempt, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "provider_retry");
      MDC.put("provider", provider);
      MDC.put("attempt", String.valueOf(attempt));
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.warn(
          "Provider retry: provider={}, attempt={}/{}, error={}, message={}",
          provider,
          attempt,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log an external provider call that ran out of retries. */
  public void logProviderFailed(
      String provider, int maxRetries, String errorType, String message) {
    try {
      MDC.put("event_type", "provider_failed");
      MDC.put("provider", provider);
      MDC.put("maxRetries", String.valueOf(maxRetries));
      MDC.put("errorType", errorType);

      logger.error(
          "Provider failed: provider={}, maxRetries={}, error={}, message={}",
          provider,
          maxRetries,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Log pipeline progress. */
  public void logStageProgress(String jobId, String language, String stage, int percentComplete) {
    try {
      MDC.put("event_type", "stage_progress");
      MDC.put("stage", stage);
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Pipeline progress: jobId={}, language={}, stage={}, progress={}%",
          jobId,
          language,
          stage,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId) {
    MDC.put("jobId", jobId);
  }

  /** Set target language context in MDC. */
  public static void setLanguageContext(String language) {
    MDC.put("language", language);
  }

  /** Clear job and language context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("language");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_index");
    MDC.remove("speakerId");
    MDC.remove("voiceId");
    MDC.remove("strategy");
    MDC.remove("targetDuration");
    MDC.remove("actualDuration");
    MDC.remove("stage");
    MDC.remove("errorType");
    MDC.remove("factor");
    MDC.remove("pitchHz");
    MDC.remove("provider");
    MDC.remove("attempt");
    MDC.remove("maxRetries");
    MDC.remove("percentComplete");
  }
}
