package com.scholary.scribe.assemblyai;

/**
 * Lifecycle of an asynchronous transcription job: upload, submit, poll.
 *
 * <p>This abstraction keeps the orchestrator independent of the HTTP details of the provider.
 */
public interface TranscriptionService {

  /**
   * Upload raw audio bytes. Single attempt, no retry.
   *
   * @return the URL the service assigned to the uploaded audio
   * @throws TransportException on a non-2xx response or network failure
   */
  String upload(byte[] audio);

  /**
   * Submit a transcription job with punctuation, text formatting and language detection on.
   *
   * @return the job id
   * @throws TransportException on a non-2xx response or network failure
   */
  String submit(String audioUrl, boolean speakerLabels);

  /**
   * Block until the job reaches a terminal status.
   *
   * @return the completed job
   * @throws JobFailedException if the service reports an error
   * @throws PollTimeoutException if the maximum poll duration elapses first
   * @throws PollCancelledException if the token is cancelled or the thread interrupted
   * @throws TransportException if a status check fails
   */
  TranscriptionJob poll(String transcriptId, CancellationToken cancellation);

  default TranscriptionJob poll(String transcriptId) {
    return poll(transcriptId, CancellationToken.create());
  }
}
