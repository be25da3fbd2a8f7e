package io.github.panghy.cosim.core;

import io.github.panghy.cosim.await.Awaitable;
import io.github.panghy.cosim.await.EventWait;
import io.github.panghy.cosim.await.TimedDelay;
import io.github.panghy.cosim.scheduler.EventKey;
import io.github.panghy.cosim.scheduler.SimScheduler;
import io.github.panghy.cosim.scheduler.UnboundSuspensionPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

import static io.github.panghy.cosim.util.LoggingUtil.warn;

/**
 * The execution context of one continuation: which continuation is running and which
 * scheduler it is bound to.
 *
 * <p>A context is handed to every {@link Routine} and is the only way to suspend. Binding is
 * explicit and per continuation, so several schedulers can be alive at the same time; each
 * continuation keeps suspending on the scheduler that started it. Once that scheduler is
 * closed the continuation is unbound and suspensions follow the configured
 * {@link UnboundSuspensionPolicy}.</p>
 */
public final class SimContext {
  private static final Logger LOGGER = Logger.getLogger(SimContext.class.getName());

  /**
   * Context of the continuation running on the current thread, if any.
   */
  static final ThreadLocal<SimContext> CURRENT = new ThreadLocal<>();

  private final ThreadContinuation continuation;
  private final SimScheduler scheduler;
  private final UnboundSuspensionPolicy unboundPolicy;

  SimContext(ThreadContinuation continuation, SimScheduler scheduler,
             UnboundSuspensionPolicy unboundPolicy) {
    this.continuation = continuation;
    this.scheduler = scheduler;
    this.unboundPolicy = unboundPolicy;
  }

  /**
   * Returns the context of the continuation executing on the calling thread.
   *
   * @return the current context, or null when called outside any continuation
   */
  public static SimContext current() {
    return CURRENT.get();
  }

  /**
   * Gets the continuation this context belongs to.
   *
   * @return the continuation
   */
  public Continuation continuation() {
    return continuation;
  }

  /**
   * Gets the scheduler this continuation is bound to.
   *
   * @return the scheduler, or null if the continuation is unbound or its scheduler was closed
   */
  public SimScheduler scheduler() {
    if (scheduler == null || scheduler.isClosed()) {
      return null;
    }
    return scheduler;
  }

  /**
   * Returns whether suspensions will be registered with a live scheduler.
   *
   * @return true if bound to an open scheduler
   */
  public boolean isBound() {
    return scheduler() != null;
  }

  /**
   * Gets the simulated time of the bound scheduler.
   *
   * @return the current simulated time in milliseconds
   * @throws IllegalStateException if the continuation is unbound
   */
  public long now() {
    SimScheduler s = scheduler();
    if (s == null) {
      throw new IllegalStateException("continuation " + continuation.getId() +
          " is not bound to a scheduler");
    }
    return s.now();
  }

  /**
   * Suspends the current continuation on the given awaitable and returns its result.
   *
   * <p>If the awaitable is ready nothing is suspended. Otherwise the awaitable registers its
   * wake condition with the bound scheduler and the continuation yields until that
   * condition resumes it.</p>
   *
   * @param awaitable the suspension primitive
   * @param <T>       the result type
   * @return the value produced by the awaitable on resumption
   * @throws IllegalStateException if called from a thread other than this continuation's
   */
  public <T> T await(Awaitable<T> awaitable) {
    Objects.requireNonNull(awaitable, "awaitable cannot be null");
    if (!continuation.isCurrentThread()) {
      throw new IllegalStateException("await called outside of continuation " + continuation.getId());
    }
    if (awaitable.isReady()) {
      return awaitable.result();
    }
    SimScheduler s = scheduler();
    if (s == null) {
      if (unboundPolicy == UnboundSuspensionPolicy.FAIL) {
        throw new IllegalStateException("continuation " + continuation.getId() +
            " suspended on " + awaitable + " without a scheduler");
      }
      warn(LOGGER, "continuation " + continuation.getId() + " has no scheduler, " +
          awaitable + " resumes immediately");
      return awaitable.result();
    }
    awaitable.suspend(s, continuation);
    continuation.suspend();
    return awaitable.result();
  }

  /**
   * Suspends for the given simulated duration.
   *
   * @param millis the delay in milliseconds; zero or negative does not suspend
   */
  public void delay(long millis) {
    await(new TimedDelay(millis));
  }

  /**
   * Suspends for the given simulated duration.
   *
   * @param duration the delay; zero or negative does not suspend
   */
  public void delay(Duration duration) {
    await(TimedDelay.of(duration));
  }

  /**
   * Suspends until the event is triggered and returns its payload.
   *
   * @param key the event to wait for
   * @param <T> the payload type
   * @return the payload, or the key's default value if the event fired without data
   */
  public <T> T waitFor(EventKey<T> key) {
    return await(new EventWait<>(key));
  }

  /**
   * Suspends until the event with the given id is triggered, ignoring any payload.
   *
   * @param eventId the event id
   */
  public void waitFor(long eventId) {
    await(EventWait.untyped(eventId));
  }

  @Override
  public String toString() {
    return "SimContext{" +
        "continuation=" + continuation.getId() +
        ", bound=" + isBound() +
        '}';
  }
}
