package com.scholary.subtitle.pipeline;

/**
 * Observer of a {@link PipelineTask}.
 *
 * <p>Receives zero or more progress messages, then exactly one of {@link #onSuccess} or {@link
 * #onFailure}. Calls arrive on the task's worker thread.
 */
public interface TaskEventListener<T> {

  void onProgress(String message);

  void onSuccess(T result);

  /**
   * The task ended with an error.
   *
   * @param message the error message shown to the user
   * @param cause the exception behind it, a {@link TaskCancelledException} after cancellation
   */
  void onFailure(String message, Throwable cause);
}
