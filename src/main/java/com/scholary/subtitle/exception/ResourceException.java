package com.scholary.subtitle.exception;

/** Thrown when a caller-supplied location cannot be read or written. */
public class ResourceException extends SubtitleEngineException {

  public ResourceException(String message) {
    super(message);
  }

  public ResourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
