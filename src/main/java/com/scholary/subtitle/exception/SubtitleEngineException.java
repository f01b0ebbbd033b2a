package com.scholary.subtitle.exception;

/**
 * Base class for failures raised by the subtitle engine.
 *
 * <p>Unchecked, like the object store and Whisper exceptions it grew out of: a pipeline either
 * recovers locally (per-segment fallbacks) or lets the failure end the task.
 */
public class SubtitleEngineException extends RuntimeException {

  public SubtitleEngineException(String message) {
    super(message);
  }

  public SubtitleEngineException(String message, Throwable cause) {
    super(message, cause);
  }
}
