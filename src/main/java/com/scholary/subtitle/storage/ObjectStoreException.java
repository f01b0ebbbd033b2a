package com.scholary.subtitle.storage;

import com.scholary.subtitle.exception.ResourceException;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Missing buckets or bad credentials cannot be fixed by the pipeline, so this is unchecked and
 * fatal for the task that hit it.
 */
public class ObjectStoreException extends ResourceException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
