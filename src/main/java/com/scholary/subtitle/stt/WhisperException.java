package com.scholary.subtitle.stt;

import com.scholary.subtitle.exception.ExternalServiceException;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses.
 */
public class WhisperException extends ExternalServiceException {

  public WhisperException(String message) {
    super(message);
  }

  public WhisperException(String message, Throwable cause) {
    super(message, cause);
  }
}
