package com.scholary.dubber;

/**
 * Root of the dubbing error taxonomy.
 *
 * <p>Every subclass names the {@link PipelineStage} it belongs to, so callers can report where a
 * run stopped without parsing messages. Messages are meant to be shown to users and must not carry
 * filesystem paths or credentials; details belong in the cause and in the logs.
 */
public class DubbingException extends RuntimeException {

  private final PipelineStage stage;

  public DubbingException(PipelineStage stage, String message) {
    super(message);
    this.stage = stage;
  }

  public DubbingException(PipelineStage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  public PipelineStage getStage() {
    return stage;
  }
}
