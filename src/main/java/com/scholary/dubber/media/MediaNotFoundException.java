package com.scholary.dubber.media;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Thrown when a media input does not exist or is not a readable file. */
public class MediaNotFoundException extends DubbingException {

  public MediaNotFoundException(String message) {
    super(PipelineStage.PROBE, message);
  }
}
