package com.scholary.subtitle.api;

import com.scholary.subtitle.job.JobStatus;
import com.scholary.subtitle.job.PipelineJob;
import java.time.Instant;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job, every progress message so far, and the result once
 * the job has completed.
 */
public record JobStatusResponse(
    String jobId,
    String pipeline,
    JobStatus status,
    List<String> progress,
    Object result,
    String error,
    Instant createdAt,
    Instant finishedAt) {

  public static JobStatusResponse from(PipelineJob<?> job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getPipeline(),
        job.getStatus(),
        job.getProgress(),
        job.getResult(),
        job.getError(),
        job.getCreatedAt(),
        job.getFinishedAt());
  }
}
