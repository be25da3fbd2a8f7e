package io.github.panghy.cosim.core;

import io.github.panghy.cosim.scheduler.SchedulerConfig;
import io.github.panghy.cosim.scheduler.SimScheduler;

import java.util.Objects;

/**
 * Exclusive owner of one {@link Continuation}.
 *
 * <p>Ownership cannot be duplicated, only moved with {@link #transfer()} or given up with
 * {@link #detach()}. Closing a task that still owns an unfinished continuation destroys it:
 * the routine is unwound from its suspension point and its {@code finally} blocks run. A
 * detached continuation is no longer destroyed by anyone; the caller must make sure it
 * completes or accept that it stays suspended forever.</p>
 *
 * <p>Every continuation runs on its own daemon thread, which only exits when the routine
 * completes, fails or is destroyed. A task that is never closed, or a detached continuation
 * that never finishes, therefore leaks that thread (and everything its stack references)
 * until the JVM exits. Daemon threads do not keep the JVM alive, but long-running embedders
 * that start many endless routines should close their tasks.</p>
 *
 * <pre>{@code
 * try (Task sensor = scheduler.start(ctx -> {
 *   ctx.delay(10_000);
 *   ctx.scheduler().triggerEvent(VOLTAGE, new VoltageReading(0.92, ctx.now()));
 * })) {
 *   scheduler.runUntil(30_000);
 * }
 * }</pre>
 */
public final class Task implements AutoCloseable {

  private ThreadContinuation continuation;

  private Task(ThreadContinuation continuation) {
    this.continuation = continuation;
  }

  /**
   * Starts a routine bound to the given scheduler. The routine runs up to its first
   * suspension before this method returns.
   *
   * @param scheduler the scheduler the routine suspends on
   * @param routine   the routine to run
   * @return the task owning the new continuation
   */
  public static Task start(SimScheduler scheduler, Routine routine) {
    Objects.requireNonNull(scheduler, "scheduler cannot be null");
    return launch(routine, scheduler, scheduler.getConfig());
  }

  /**
   * Starts a routine that is not bound to any scheduler. Its suspensions follow the
   * {@link io.github.panghy.cosim.scheduler.UnboundSuspensionPolicy} of the configuration.
   *
   * @param routine the routine to run
   * @param config  supplies the fault handler and unbound policy
   * @return the task owning the new continuation
   */
  public static Task startUnbound(Routine routine, SchedulerConfig config) {
    return launch(routine, null, Objects.requireNonNull(config, "config cannot be null"));
  }

  private static Task launch(Routine routine, SimScheduler scheduler, SchedulerConfig config) {
    Objects.requireNonNull(routine, "routine cannot be null");
    ThreadContinuation continuation = new ThreadContinuation(routine, scheduler, config);
    Task task = new Task(continuation);
    continuation.start();
    return task;
  }

  /**
   * Resumes the owned continuation if it is still running; no-op otherwise.
   */
  public void resume() {
    if (continuation != null) {
      continuation.resume();
    }
  }

  /**
   * Returns whether the continuation has finished or no continuation is owned.
   *
   * @return true if done or empty
   */
  public boolean isDone() {
    return continuation == null || continuation.isDone();
  }

  /**
   * Returns whether this task still owns a continuation.
   *
   * @return true if a continuation is owned
   */
  public boolean isOwning() {
    return continuation != null;
  }

  /**
   * Gets the owned continuation, for handing to
   * {@link SimScheduler#schedule(Continuation)} and friends. Ownership is not transferred.
   *
   * @return the continuation, or null if this task is empty
   */
  public Continuation getContinuation() {
    return continuation;
  }

  /**
   * Releases ownership without destroying the continuation.
   *
   * @return the released continuation, or null if this task was empty
   */
  public Continuation detach() {
    Continuation released = continuation;
    continuation = null;
    return released;
  }

  /**
   * Moves ownership into a new task, leaving this one empty.
   *
   * @return the new owner
   */
  public Task transfer() {
    Task moved = new Task(continuation);
    continuation = null;
    return moved;
  }

  /**
   * Destroys the continuation if it is still owned and unfinished, then empties this task.
   *
   * @throws IllegalStateException if the continuation is running, i.e. a routine tried to
   *                               close its own task
   */
  @Override
  public void close() {
    ThreadContinuation owned = continuation;
    if (owned != null && !owned.isDone()) {
      owned.destroy();
    }
    continuation = null;
  }

  @Override
  public String toString() {
    return "Task{" +
        "continuation=" + continuation +
        '}';
  }
}
