package com.scholary.scribe.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.scribe.api.JobStatusResponse.Status;
import com.scholary.scribe.service.ScribeRequest;
import com.scholary.scribe.service.ScribeResult;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of note jobs, backed by a Caffeine cache.
 *
 * <p>A job never expires while it is pending or processing. Once it reaches a finished status it
 * expires {@code retainFinished} after the save that recorded that status. The size bound applies
 * to all jobs. Nothing survives a restart.
 */
@Repository
public class NoteJobRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(NoteJobRepository.class);

  private final Cache<String, NoteJob> cache;

  @Autowired
  public NoteJobRepository(NoteJobProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  NoteJobRepository(NoteJobProperties properties, Ticker ticker) {
    long retainNanos = properties.retainFinished().toNanos();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.maxStored())
            .expireAfter(new FinishedJobExpiry(retainNanos))
            .ticker(ticker)
            .executor(Runnable::run)
            .build();
  }

  /** Register a new pending job for {@code request}. */
  public NoteJob create(ScribeRequest request) {
    NoteJob job = new NoteJob(UUID.randomUUID().toString(), request);
    cache.put(job.getJobId(), job);
    LOGGER.info("Created note job: {}", job.getJobId());
    return job;
  }

  /** Record a status transition; a finished status starts the retention clock. */
  public void save(NoteJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<NoteJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /** Result of a job that completed, empty while it runs or when it failed. */
  public Optional<ScribeResult> findCompletedResult(String jobId) {
    return findById(jobId)
        .filter(job -> job.getStatus() == Status.COMPLETED)
        .map(NoteJob::getResult);
  }

  /**
   * Signal cancellation to a job.
   *
   * <p>A pending job stops before it uploads or submits anything, a processing job at its next
   * status check. Cancelling a finished job has no effect.
   */
  public Optional<NoteJob> requestCancellation(String jobId) {
    Optional<NoteJob> job = findById(jobId);
    job.filter(j -> !j.getStatus().isFinished())
        .ifPresent(
            j -> {
              j.getCancellation().cancel();
              LOGGER.info("Cancellation requested for job: {} ({})", jobId, j.getStatus());
            });
    return job;
  }

  private static final class FinishedJobExpiry implements Expiry<String, NoteJob> {

    private final long retainNanos;

    private FinishedJobExpiry(long retainNanos) {
      this.retainNanos = retainNanos;
    }

    @Override
    public long expireAfterCreate(String jobId, NoteJob job, long currentTime) {
      return lifetime(job);
    }

    @Override
    public long expireAfterUpdate(
        String jobId, NoteJob job, long currentTime, long currentDuration) {
      return lifetime(job);
    }

    @Override
    public long expireAfterRead(
        String jobId, NoteJob job, long currentTime, long currentDuration) {
      return currentDuration;
    }

    private long lifetime(NoteJob job) {
      return job.getStatus().isFinished() ? retainNanos : Long.MAX_VALUE;
    }
  }
}
