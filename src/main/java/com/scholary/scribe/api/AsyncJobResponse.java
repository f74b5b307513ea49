package com.scholary.scribe.api;

/** Response for an async note request: the job id to poll. */
public record AsyncJobResponse(String jobId) {}
