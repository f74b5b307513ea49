package com.scholary.scribe.job;

import com.scholary.scribe.api.JobStatusResponse.Status;
import com.scholary.scribe.assemblyai.PollCancelledException;
import com.scholary.scribe.assemblyai.PollTimeoutException;
import com.scholary.scribe.config.NoteJobConfig;
import com.scholary.scribe.logging.StructuredLogger;
import com.scholary.scribe.service.ScribeOrchestrator;
import com.scholary.scribe.service.ScribeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs note jobs on the async executor.
 *
 * <p>The job status is updated as processing progresses; a failure is recorded on the job with
 * its type so the status endpoint can tell timeouts and cancellations from failures.
 */
@Service
public class NoteJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(NoteJobRunner.class);

  private final ScribeOrchestrator orchestrator;
  private final NoteJobRepository jobRepository;

  public NoteJobRunner(ScribeOrchestrator orchestrator, NoteJobRepository jobRepository) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
  }

  @Async(NoteJobConfig.NOTE_JOB_EXECUTOR)
  public void runAsync(NoteJob job) {
    run(job);
  }

  public void run(NoteJob job) {
    StructuredLogger.setJobContext(job.getJobId(), job.getRequest().format().label());
    LOGGER.info("Starting async processing for job: {}", job.getJobId());

    try {
      job.setStatus(Status.PROCESSING);
      jobRepository.save(job);

      ScribeResult result = orchestrator.process(job.getRequest(), job.getCancellation());

      job.setResult(result);
      job.setStatus(Status.COMPLETED);
      jobRepository.save(job);

      LOGGER.info("Completed async processing for job: {}", job.getJobId());

    } catch (PollCancelledException e) {
      LOGGER.info("Job cancelled: {}", job.getJobId());
      job.fail(Status.CANCELLED, e);
      jobRepository.save(job);
    } catch (PollTimeoutException e) {
      LOGGER.warn("Job timed out: {}: {}", job.getJobId(), e.getMessage());
      job.fail(Status.TIMED_OUT, e);
      jobRepository.save(job);
    } catch (RuntimeException e) {
      LOGGER.error("Async processing failed for job: {}", job.getJobId(), e);
      job.fail(Status.FAILED, e);
      jobRepository.save(job);
    } finally {
      StructuredLogger.clearJobContext();
    }
  }
}
