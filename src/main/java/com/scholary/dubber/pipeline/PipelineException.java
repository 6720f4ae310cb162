package com.scholary.dubber.pipeline;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/**
 * Thrown when a stage shared by every target language fails, which aborts the whole job.
 *
 * <p>Carries the job id and failed stage; the message stays user-facing.
 */
public class PipelineException extends DubbingException {

  private final String jobId;

  public PipelineException(String jobId, PipelineStage stage, String message, Throwable cause) {
    super(stage, message, cause);
    this.jobId = jobId;
  }

  public String getJobId() {
    return jobId;
  }
}
