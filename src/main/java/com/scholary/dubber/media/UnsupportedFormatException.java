package com.scholary.dubber.media;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Thrown when a media input cannot be decoded or carries no audio stream. */
public class UnsupportedFormatException extends DubbingException {

  public UnsupportedFormatException(PipelineStage stage, String message) {
    super(stage, message);
  }

  public UnsupportedFormatException(PipelineStage stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
