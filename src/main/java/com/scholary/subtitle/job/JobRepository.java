package com.scholary.subtitle.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for pipeline jobs.
 *
 * <p>Uses Caffeine cache so finished jobs are evicted after a while and the job count stays
 * bounded. A running job that gets evicted keeps running; only its status becomes unreachable.
 */
@Repository
public class JobRepository {

  private final Cache<String, PipelineJob<?>> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(PipelineJob<?> job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<PipelineJob<?>> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
