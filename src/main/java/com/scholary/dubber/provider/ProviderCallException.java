package com.scholary.dubber.provider;

/**
 * Exception thrown when an HTTP call to a provider fails for good.
 *
 * <p>Adapters catch it and rethrow the error type of their own stage.
 */
public class ProviderCallException extends RuntimeException {

  private final int statusCode;

  public ProviderCallException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public ProviderCallException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /** HTTP status of the last response, or -1 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
