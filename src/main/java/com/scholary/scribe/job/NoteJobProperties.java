package com.scholary.scribe.job;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for async note jobs.
 *
 * <p>Each running job holds an executor thread for as long as its transcript is polled, so
 * {@code executorThreads} is the number of jobs in flight and {@code queueCapacity} the number
 * waiting. Finished jobs stay readable for {@code retainFinished}; jobs still running are only
 * evicted by the {@code maxStored} bound.
 */
@ConfigurationProperties(prefix = "jobs")
@Validated
public record NoteJobProperties(
    @Positive int executorThreads,
    @PositiveOrZero int queueCapacity,
    @PositiveOrZero int shutdownGraceSeconds,
    @Positive int maxStored,
    @NotNull Duration retainFinished) {}
