package com.scholary.dubber.transcription;

import com.scholary.dubber.DubbingException;
import com.scholary.dubber.PipelineStage;

/** Exception thrown when speech recognition fails. */
public class TranscriptionException extends DubbingException {

  public TranscriptionException(String message) {
    super(PipelineStage.TRANSCRIPTION, message);
  }

  public TranscriptionException(String message, Throwable cause) {
    super(PipelineStage.TRANSCRIPTION, message, cause);
  }
}
