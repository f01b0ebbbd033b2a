package com.scholary.subtitle.api;

import com.scholary.subtitle.job.JobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** Status polling and cancellation for async jobs. */
@RestController
@Tag(name = "Jobs", description = "Async job status and cancellation")
public class JobController {

  private final JobService jobService;

  public JobController(JobService jobService) {
    this.jobService = jobService;
  }

  /**
   * Get job status.
   *
   * <p>Returns the current state of an async job. If the job is completed, includes the full
   * result.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobService
        .find(id)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @DeleteMapping("/api/jobs/{id}")
  @Operation(
      summary = "Cancel job",
      description = "Request cancellation. The job stops at its next segment boundary.")
  public ResponseEntity<Void> cancel(@PathVariable String id) {
    return jobService.cancel(id)
        ? ResponseEntity.accepted().build()
        : ResponseEntity.notFound().build();
  }
}
