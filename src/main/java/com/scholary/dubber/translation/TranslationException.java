package com.scholary.dubber.translation;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Exception thrown when text cannot be translated. */
public class TranslationException extends DubbingException {

  public TranslationException(String message) {
    super(PipelineStage.TRANSLATION, message);
  }

  public TranslationException(String message, Throwable cause) {
    super(PipelineStage.TRANSLATION, message, cause);
  }
}
