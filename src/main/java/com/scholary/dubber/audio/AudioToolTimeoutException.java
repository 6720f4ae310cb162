package com.scholary.dubber.audio;

/** Thrown when an audio tool does not finish within its configured timeout. */
public class AudioToolTimeoutException extends AudioToolException {

  public AudioToolTimeoutException(String message) {
    super(message);
  }
}
