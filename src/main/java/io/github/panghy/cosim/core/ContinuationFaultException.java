package io.github.panghy.cosim.core;

/**
 * Thrown from {@link Continuation#resume()} by {@link FaultHandler#PROPAGATE} when a routine
 * fails with an exception.
 */
public class ContinuationFaultException extends RuntimeException {

  private final long continuationId;

  /**
   * Creates a new fault exception.
   *
   * @param continuationId the id of the continuation that failed
   * @param cause          the exception that escaped the routine
   */
  public ContinuationFaultException(long continuationId, Throwable cause) {
    super("continuation " + continuationId + " failed: " + cause, cause);
    this.continuationId = continuationId;
  }

  /**
   * Gets the id of the continuation that failed.
   *
   * @return the continuation id
   */
  public long getContinuationId() {
    return continuationId;
  }
}
