package com.scholary.subtitle.pipeline;

/**
 * What a pipeline sees of the task running it: a progress channel and the cancellation flag.
 *
 * <p>Pipelines call {@link #checkCancelled()} between segments and stages, never in the middle of
 * a backend call.
 */
public interface TaskContext extends ProgressChannel {

  boolean isCancelled();

  /**
   * Stop here if cancellation was requested.
   *
   * @throws TaskCancelledException if the task was cancelled
   */
  default void checkCancelled() {
    if (isCancelled()) {
      throw new TaskCancelledException();
    }
  }
}
