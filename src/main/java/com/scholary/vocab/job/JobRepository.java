package com.scholary.vocab.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.vocab.pipeline.PipelineRun;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for runs started over REST.
 *
 * <p>Entries expire some time after submission, so finished runs do not pile up.
 */
@Repository
public class JobRepository {

  private final Cache<String, PipelineRun> cache;

  public JobRepository(
      @Value("${jobstore.maxSize:100}") int maxSize,
      @Value("${jobstore.expireAfterMinutes:1440}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(PipelineRun run) {
    cache.put(run.getRunId(), run);
  }

  public Optional<PipelineRun> findById(String runId) {
    return Optional.ofNullable(cache.getIfPresent(runId));
  }

  public void delete(String runId) {
    cache.invalidate(runId);
  }
}
