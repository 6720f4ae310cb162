package com.scholary.dubber.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>A runtime exception: a missing bucket or bad credentials are not something the caller can
 * repair, so it only needs to report the failure.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
