package com.scholary.subtitle.exception;

/**
 * Thrown when an external collaborator (audio extraction, speech-to-text, audio encoding) fails.
 *
 * <p>Fatal for the owning pipeline: the task ends with an error event.
 */
public class ExternalServiceException extends SubtitleEngineException {

  public ExternalServiceException(String message) {
    super(message);
  }

  public ExternalServiceException(String message, Throwable cause) {
    super(message, cause);
  }
}
