package com.scholary.subtitle.audio;

import com.scholary.subtitle.exception.SubtitleEngineException;

/** Thrown when a voice track would grow past its configured maximum length. */
public class TimelineTooLongException extends SubtitleEngineException {

  public TimelineTooLongException(String message) {
    super(message);
  }

  public TimelineTooLongException(String message, Throwable cause) {
    super(message, cause);
  }
}
