package com.scholary.dubber.timeline;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Exception thrown when the dubbed voice track cannot be assembled. */
public class ReconstructionException extends DubbingException {

  public ReconstructionException(String message) {
    super(PipelineStage.RECONSTRUCTION, message);
  }

  public ReconstructionException(String message, Throwable cause) {
    super(PipelineStage.RECONSTRUCTION, message, cause);
  }
}
