package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.exception.SubtitleEngineException;

/** Thrown inside a pipeline when its task has been cancelled. */
public class TaskCancelledException extends SubtitleEngineException {

  public static final String MESSAGE = "Task cancelled";

  public TaskCancelledException() {
    super(MESSAGE);
  }
}
