package io.github.panghy.cosim;

import io.github.panghy.cosim.await.Awaitable;
import io.github.panghy.cosim.core.Routine;
import io.github.panghy.cosim.core.SimContext;
import io.github.panghy.cosim.core.Task;
import io.github.panghy.cosim.scheduler.EventKey;
import io.github.panghy.cosim.scheduler.SimScheduler;

import java.time.Duration;

/**
 * Static entry points for code running inside a continuation.
 *
 * <p>Every method looks up the {@link SimContext} of the continuation executing on the
 * calling thread, so helper methods deep inside a routine can suspend without having the
 * context passed down to them. Suspension methods called outside of a continuation throw
 * {@link IllegalStateException}: only a continuation can be suspended.</p>
 *
 * <pre>{@code
 * Task avc = Sim.start(scheduler, ctx -> {
 *   while (true) {
 *     VoltageReading reading = Sim.waitFor(VOLTAGE_CHANGE);
 *     if (reading.voltage() < 0.95) {
 *       Sim.delay(Duration.ofMillis(200)); // breaker operating time
 *       Sim.scheduler().triggerEvent(CAPACITOR_BANK_IN);
 *     }
 *   }
 * });
 * }</pre>
 */
public final class Sim {

  private Sim() {
    // Utility class should not be instantiated
  }

  /**
   * Starts a routine bound to the given scheduler.
   *
   * @param scheduler the scheduler
   * @param routine   the routine
   * @return the task owning the new continuation
   */
  public static Task start(SimScheduler scheduler, Routine routine) {
    return Task.start(scheduler, routine);
  }

  /**
   * Checks if the current thread is executing a continuation.
   *
   * @return true inside a continuation
   */
  public static boolean isInSimContext() {
    return SimContext.current() != null;
  }

  /**
   * Gets the context of the running continuation.
   *
   * @return the context
   * @throws IllegalStateException if called outside of a continuation
   */
  public static SimContext context() {
    return requireContext("context");
  }

  /**
   * Gets the scheduler the running continuation is bound to.
   *
   * @return the scheduler, or null if unbound
   * @throws IllegalStateException if called outside of a continuation
   */
  public static SimScheduler scheduler() {
    return requireContext("scheduler").scheduler();
  }

  /**
   * Gets the simulated time of the running continuation's scheduler.
   *
   * @return the time in milliseconds
   * @throws IllegalStateException if called outside of a continuation or unbound
   */
  public static long now() {
    return requireContext("now").now();
  }

  /**
   * Suspends the running continuation for the given number of milliseconds.
   *
   * @param millis the delay
   */
  public static void delay(long millis) {
    requireContext("delay").delay(millis);
  }

  /**
   * Suspends the running continuation for the given duration.
   *
   * @param duration the delay
   */
  public static void delay(Duration duration) {
    requireContext("delay").delay(duration);
  }

  /**
   * Suspends the running continuation until the event fires.
   *
   * @param key the event
   * @param <T> the payload type
   * @return the payload
   */
  public static <T> T waitFor(EventKey<T> key) {
    return requireContext("waitFor").waitFor(key);
  }

  /**
   * Suspends the running continuation until the event with the given id fires.
   *
   * @param eventId the event id
   */
  public static void waitFor(long eventId) {
    requireContext("waitFor").waitFor(eventId);
  }

  /**
   * Suspends the running continuation on an arbitrary awaitable.
   *
   * @param awaitable the awaitable
   * @param <T>       the result type
   * @return the result
   */
  public static <T> T await(Awaitable<T> awaitable) {
    return requireContext("await").await(awaitable);
  }

  private static SimContext requireContext(String operation) {
    SimContext context = SimContext.current();
    if (context == null) {
      throw new IllegalStateException(operation + " called outside of a continuation");
    }
    return context;
  }
}
