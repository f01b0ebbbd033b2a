package com.scholary.subtitle.job;

import com.scholary.subtitle.pipeline.PipelineTask;
import com.scholary.subtitle.pipeline.TaskCancelledException;
import com.scholary.subtitle.pipeline.TaskEventListener;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents an async pipeline job.
 *
 * <p>Records the task's progress messages, status, result and error as they arrive. Stored in
 * memory using Caffeine cache.
 */
public class PipelineJob<T> implements TaskEventListener<T> {

  private final String jobId;
  private final String pipeline;
  private final Instant createdAt;
  private final List<String> progress = new ArrayList<>();

  private PipelineTask<T> task;
  private JobStatus status;
  private T result;
  private String error;
  private Instant finishedAt;

  public PipelineJob(String jobId, String pipeline) {
    this.jobId = jobId;
    this.pipeline = pipeline;
    this.createdAt = Instant.now();
    this.status = JobStatus.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public String getPipeline() {
    return pipeline;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized JobStatus getStatus() {
    return status;
  }

  public synchronized List<String> getProgress() {
    return List.copyOf(progress);
  }

  public synchronized T getResult() {
    return result;
  }

  public synchronized String getError() {
    return error;
  }

  public synchronized Instant getFinishedAt() {
    return finishedAt;
  }

  synchronized void attach(PipelineTask<T> task) {
    this.task = task;
  }

  /** Ask the running task to stop. Has no effect once the job has finished. */
  public synchronized void cancel() {
    if (task != null && !status.isTerminal()) {
      task.cancel();
    }
  }

  synchronized void markRunning() {
    if (status == JobStatus.PENDING) {
      status = JobStatus.RUNNING;
    }
  }

  @Override
  public synchronized void onProgress(String message) {
    progress.add(message);
  }

  @Override
  public synchronized void onSuccess(T value) {
    result = value;
    status = JobStatus.COMPLETED;
    finishedAt = Instant.now();
  }

  @Override
  public synchronized void onFailure(String message, Throwable cause) {
    error = message;
    status = cause instanceof TaskCancelledException ? JobStatus.CANCELLED : JobStatus.FAILED;
    progress.add(message);
    finishedAt = Instant.now();
  }
}
