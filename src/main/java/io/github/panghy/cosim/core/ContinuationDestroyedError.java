package io.github.panghy.cosim.core;

/**
 * Raised at the suspension point of a continuation that is being destroyed by its owning
 * {@link Task}. It unwinds the routine so that {@code finally} blocks run. Routines must
 * not catch it; if they do, every further suspension raises it again.
 */
public class ContinuationDestroyedError extends Error {

  /**
   * Creates a new error for the given continuation.
   *
   * @param continuationId the id of the continuation being destroyed
   */
  public ContinuationDestroyedError(long continuationId) {
    super("continuation " + continuationId + " destroyed", null, false, false);
  }
}
