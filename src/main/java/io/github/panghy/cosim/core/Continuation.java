package io.github.panghy.cosim.core;

/**
 * A suspended or running unit of execution that can be resumed from the point
 * where it last paused.
 *
 * <p>Continuations are created by {@link Task#start} (or
 * {@link io.github.panghy.cosim.scheduler.SimScheduler#start}) and start eagerly: the
 * routine runs up to its first suspension before the creating call returns. The
 * scheduler only ever sees this handle; ownership lives in the {@link Task} wrapper.</p>
 */
public interface Continuation {

  /**
   * Resumes the continuation from its last suspension point. The call returns when the
   * continuation suspends again or finishes. Resuming a finished continuation is a no-op.
   *
   * @throws IllegalStateException if the continuation is currently running
   */
  void resume();

  /**
   * Returns whether the routine has finished, either normally, by a fault, or because it
   * was destroyed.
   *
   * @return true if the continuation can no longer be resumed
   */
  boolean isDone();

  /**
   * Gets the unique id of this continuation (for debugging).
   *
   * @return the id
   */
  long getId();
}
