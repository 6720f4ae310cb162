package com.scholary.dubber.objectstore;

import java.io.InputStream;

/**
 * Abstraction for object storage operations.
 *
 * <p>Job inputs are downloaded from, and deliverables uploaded to, an S3-compatible store. The
 * interface keeps the job service independent of the storage backend and easy to mock.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object from a stream.
   *
   * @param contentLength the size of the object in bytes
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(
      String bucket, String key, InputStream data, long contentLength, String contentType);
}
