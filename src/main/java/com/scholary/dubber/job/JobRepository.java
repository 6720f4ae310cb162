package com.scholary.dubber.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for dubbing jobs.
 *
 * <p>Backed by a Caffeine cache so finished jobs are evicted after a while and the number of
 * tracked jobs stays bounded. Jobs are mutable and updated in place; {@link #save} only needs to be
 * called once when a job is created.
 */
@Repository
public class JobRepository {

  private final Cache<String, DubbingJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(DubbingJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<DubbingJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
