package com.scholary.scribe.assemblyai;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation signal for a blocking status poll.
 *
 * <p>Cancelling wakes a poller that is waiting between status checks, so cancellation takes effect
 * without waiting out the poll interval.
 */
public final class CancellationToken {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  public static CancellationToken create() {
    return new CancellationToken();
  }

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /**
   * Wait up to {@code timeout} for cancellation.
   *
   * @return true if the token was cancelled before the timeout elapsed
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitCancellation(Duration timeout) throws InterruptedException {
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
