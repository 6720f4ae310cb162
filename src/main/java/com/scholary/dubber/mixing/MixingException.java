package com.scholary.dubber.mixing;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Exception thrown when the voice and background cannot be mixed. */
public class MixingException extends DubbingException {

  public MixingException(String message) {
    super(PipelineStage.MIXING, message);
  }

  public MixingException(String message, Throwable cause) {
    super(PipelineStage.MIXING, message, cause);
  }
}
