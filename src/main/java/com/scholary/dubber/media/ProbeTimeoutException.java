package com.scholary.dubber.media;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Thrown when probing or audio extraction exceeds its timeout. */
public class ProbeTimeoutException extends DubbingException {

  public ProbeTimeoutException(PipelineStage stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
