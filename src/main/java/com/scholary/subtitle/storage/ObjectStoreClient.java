package com.scholary.subtitle.storage;

import java.io.InputStream;

/**
 * Abstraction for object storage operations.
 *
 * <p>Subtitle files and voice tracks can be read from and written to a bucket instead of the local
 * filesystem. Implementations exist for S3 and S3-compatible stores such as MinIO.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object as a stream. The caller is responsible for closing the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String bucket, String key);

  /**
   * Store an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);
}
