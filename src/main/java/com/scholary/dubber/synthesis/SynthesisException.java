package com.scholary.dubber.synthesis;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Exception thrown when speech cannot be synthesized. */
public class SynthesisException extends DubbingException {

  public SynthesisException(String message) {
    super(PipelineStage.SYNTHESIS, message);
  }

  public SynthesisException(String message, Throwable cause) {
    super(PipelineStage.SYNTHESIS, message, cause);
  }
}
