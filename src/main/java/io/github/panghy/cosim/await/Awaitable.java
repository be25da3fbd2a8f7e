package io.github.panghy.cosim.await;

import io.github.panghy.cosim.core.Continuation;
import io.github.panghy.cosim.scheduler.SimScheduler;

/**
 * A suspension primitive. Evaluated by {@link io.github.panghy.cosim.core.SimContext#await}
 * in three steps: {@link #isReady()} decides whether to pause at all, {@link #suspend}
 * registers the wake condition, and {@link #result()} produces the value once resumed.
 *
 * @param <T> the result type
 */
public interface Awaitable<T> {

  /**
   * Returns true if the continuation can proceed without suspending.
   *
   * @return whether the result is already available
   */
  boolean isReady();

  /**
   * Registers a wake condition for the continuation that is about to suspend. Called at most
   * once, and only when {@link #isReady()} returned false.
   *
   * @param scheduler    the scheduler the continuation is bound to
   * @param continuation the continuation to resume when the condition is met
   */
  void suspend(SimScheduler scheduler, Continuation continuation);

  /**
   * Produces the result after resumption, or immediately when ready or unbound.
   *
   * @return the result
   */
  T result();
}
