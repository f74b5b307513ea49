package com.scholary.scribe.config;

import com.scholary.scribe.job.NoteJobProperties;
import java.util.Map;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the executor that runs async note jobs.
 *
 * <p>A full queue rejects the job instead of running it on the caller, since a job blocks for as
 * long as its transcript takes. On shutdown running jobs are interrupted, which ends their poll as
 * cancelled, and the pool waits up to {@code shutdownGraceSeconds} for them to record it.
 */
@Configuration
@EnableConfigurationProperties(NoteJobProperties.class)
public class NoteJobConfig {

  public static final String NOTE_JOB_EXECUTOR = "noteJobExecutor";

  private static final Logger LOGGER = LoggerFactory.getLogger(NoteJobConfig.class);

  @Bean(name = NOTE_JOB_EXECUTOR)
  public Executor noteJobExecutor(NoteJobProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("note-job-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.setAwaitTerminationSeconds(properties.shutdownGraceSeconds());
    executor.setTaskDecorator(NoteJobConfig::withCallerMdc);
    executor.initialize();

    LOGGER.info(
        "Note job executor: threads={}, queueCapacity={}",
        properties.executorThreads(),
        properties.queueCapacity());
    return executor;
  }

  /** Carry the submitting thread's MDC (correlation fields) into the job thread. */
  static Runnable withCallerMdc(Runnable task) {
    Map<String, String> callerContext = MDC.getCopyOfContextMap();
    return () -> {
      Map<String, String> previous = MDC.getCopyOfContextMap();
      if (callerContext != null) {
        MDC.setContextMap(callerContext);
      }
      try {
        task.run();
      } finally {
        if (previous != null) {
          MDC.setContextMap(previous);
        } else {
          MDC.clear();
        }
      }
    };
  }
}
