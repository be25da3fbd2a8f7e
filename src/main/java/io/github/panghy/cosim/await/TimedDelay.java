package io.github.panghy.cosim.await;

import io.github.panghy.cosim.core.Continuation;
import io.github.panghy.cosim.scheduler.SimScheduler;

import java.time.Duration;
import java.util.Objects;

/**
 * Suspends a continuation for a span of simulated time. A non-positive delay does not
 * suspend at all.
 */
public final class TimedDelay implements Awaitable<Void> {

  private final long delayMillis;

  /**
   * Creates a delay.
   *
   * @param delayMillis the delay in milliseconds
   */
  public TimedDelay(long delayMillis) {
    this.delayMillis = delayMillis;
  }

  /**
   * Creates a delay from a duration, truncated to milliseconds.
   *
   * @param duration the delay
   * @return the awaitable
   */
  public static TimedDelay of(Duration duration) {
    Objects.requireNonNull(duration, "duration cannot be null");
    return new TimedDelay(duration.toMillis());
  }

  public long getDelayMillis() {
    return delayMillis;
  }

  @Override
  public boolean isReady() {
    return delayMillis <= 0;
  }

  @Override
  public void suspend(SimScheduler scheduler, Continuation continuation) {
    scheduler.scheduleAfter(delayMillis, continuation);
  }

  @Override
  public Void result() {
    return null;
  }

  @Override
  public String toString() {
    return "TimedDelay{" + delayMillis + "ms}";
  }
}
