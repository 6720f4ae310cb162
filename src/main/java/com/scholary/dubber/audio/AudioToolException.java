package com.scholary.dubber.audio;

/**
 * Exception thrown when an audio tool invocation fails.
 *
 * <p>Covers non-zero exit codes, unreadable output and I/O errors around the subprocess. Callers
 * translate it into the error of the stage they were running.
 */
public class AudioToolException extends RuntimeException {

  public AudioToolException(String message) {
    super(message);
  }

  public AudioToolException(String message, Throwable cause) {
    super(message, cause);
  }
}
