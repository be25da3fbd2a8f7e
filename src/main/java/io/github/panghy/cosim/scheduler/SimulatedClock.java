package io.github.panghy.cosim.scheduler;

/**
 * Simulated time in milliseconds. Time only moves when the scheduler (or its caller) moves
 * it; there is no relation to wall-clock time.
 *
 * <p>Neither {@link #advanceTime(long)} nor {@link #setCurrentTime(long)} validates its
 * argument, so both can move time backwards. Keeping time monotonic is the caller's job.</p>
 */
public class SimulatedClock {

  // The current simulated time in milliseconds
  private long currentTimeMillis;

  /**
   * Creates a clock at time zero.
   */
  public SimulatedClock() {
    this(0);
  }

  /**
   * Creates a clock at the given time.
   *
   * @param startTimeMillis the initial time
   */
  public SimulatedClock(long startTimeMillis) {
    this.currentTimeMillis = startTimeMillis;
  }

  /**
   * Gets the current simulated time in milliseconds.
   *
   * @return Current simulated time in milliseconds
   */
  public long currentTimeMillis() {
    return currentTimeMillis;
  }

  /**
   * Returns the current time in seconds.
   *
   * @return Current simulated time in seconds
   */
  public double currentTimeSeconds() {
    return currentTimeMillis / 1000.0;
  }

  /**
   * Adds the given delta to the current time.
   *
   * @param millis The number of milliseconds to add
   * @return The new current time
   */
  public long advanceTime(long millis) {
    currentTimeMillis += millis;
    return currentTimeMillis;
  }

  /**
   * Sets the current time to a specific value.
   *
   * @param timeMillis The time to set in milliseconds
   */
  public void setCurrentTime(long timeMillis) {
    currentTimeMillis = timeMillis;
  }
}
