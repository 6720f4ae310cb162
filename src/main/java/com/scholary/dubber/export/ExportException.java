package com.scholary.dubber.export;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Exception thrown when deliverables cannot be written or published. */
public class ExportException extends DubbingException {

  public ExportException(PipelineStage stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
