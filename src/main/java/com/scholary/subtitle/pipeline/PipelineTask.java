package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.logging.StructuredLogger;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one pipeline off the caller's thread and reports what happens to a listener.
 *
 * <p>A task is single-use: {@link #start} may be called once. The listener gets progress
 * messages, then exactly one terminal event. A listener that throws from a terminal callback is
 * logged and does not cause a second terminal event.
 *
 * <p>{@link #cancel()} only sets a flag. The pipeline notices it at its next checkpoint and the
 * task ends with the failure message {@value TaskCancelledException#MESSAGE}.
 */
public final class PipelineTask<T> implements TaskContext {

  private static final Logger LOGGER = LoggerFactory.getLogger(PipelineTask.class);

  private final String jobId;
  private final String pipelineName;
  private final TaskBody<T> body;
  private final TaskEventListener<T> listener;

  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean terminated = new AtomicBoolean();
  private volatile boolean cancelled;

  public PipelineTask(
      String jobId, String pipelineName, TaskBody<T> body, TaskEventListener<T> listener) {
    this.jobId = jobId;
    this.pipelineName = pipelineName;
    this.body = body;
    this.listener = listener;
  }

  /**
   * Submit the task to an executor.
   *
   * @throws IllegalStateException if the task was already started
   */
  public void start(Executor executor) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Task " + jobId + " has already been started");
    }
    try {
      executor.execute(this::run);
    } catch (RejectedExecutionException e) {
      LOGGER.error("Task rejected: jobId={}, pipeline={}", jobId, pipelineName, e);
      fail("Task rejected: too many pipelines running", e);
    }
  }

  /** Request cooperative cancellation. */
  public void cancel() {
    if (!cancelled) {
      LOGGER.info("Cancellation requested: jobId={}, pipeline={}", jobId, pipelineName);
    }
    cancelled = true;
  }

  @Override
  public boolean isCancelled() {
    return cancelled;
  }

  public boolean isFinished() {
    return terminated.get();
  }

  public String jobId() {
    return jobId;
  }

  @Override
  public void progress(String message) {
    if (terminated.get()) {
      return;
    }
    LOGGER.info("Progress: {}", message);
    try {
      listener.onProgress(message);
    } catch (RuntimeException e) {
      LOGGER.warn("Progress listener failed: {}", e.getMessage(), e);
    }
  }

  private void run() {
    StructuredLogger.setJobContext(jobId, pipelineName);
    try {
      LOGGER.info("Task started: jobId={}, pipeline={}", jobId, pipelineName);
      checkCancelled();
      T result = body.run(this);
      succeed(result);
    } catch (TaskCancelledException e) {
      LOGGER.info("Task cancelled: jobId={}, pipeline={}", jobId, pipelineName);
      fail(e.getMessage(), e);
    } catch (Exception e) {
      LOGGER.error("Task failed: jobId={}, pipeline={}", jobId, pipelineName, e);
      fail(messageOf(e), e);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void succeed(T result) {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    LOGGER.info("Task completed: jobId={}, pipeline={}", jobId, pipelineName);
    try {
      listener.onSuccess(result);
    } catch (RuntimeException e) {
      LOGGER.error("Success listener failed: jobId={}", jobId, e);
    }
  }

  private void fail(String message, Throwable cause) {
    if (!terminated.compareAndSet(false, true)) {
      return;
    }
    try {
      listener.onFailure(message, cause);
    } catch (RuntimeException e) {
      LOGGER.error("Failure listener failed: jobId={}", jobId, e);
    }
  }

  private static String messageOf(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
