package io.github.panghy.cosim.core;

import java.util.logging.Logger;

import static io.github.panghy.cosim.util.LoggingUtil.error;

/**
 * Decides what happens when an exception escapes a routine.
 *
 * <p>A fault is fatal for the continuation: it is marked done and never resumed again. The
 * handler runs on the thread that resumed the continuation (normally the thread driving the
 * scheduler), after control has returned to it.</p>
 */
@FunctionalInterface
public interface FaultHandler {

  /**
   * Process exit status used by {@link #TERMINATE}.
   */
  int EXIT_STATUS = 70;

  /**
   * Logs the fault and terminates the JVM. This is the default for every scheduler.
   */
  FaultHandler TERMINATE = (continuation, fault) -> {
    error(Logger.getLogger(FaultHandler.class.getName()),
        "continuation " + continuation.getId() + " failed, terminating", fault);
    System.exit(EXIT_STATUS);
  };

  /**
   * Rethrows the fault as a {@link ContinuationFaultException} from the resuming call.
   */
  FaultHandler PROPAGATE = (continuation, fault) -> {
    throw new ContinuationFaultException(continuation.getId(), fault);
  };

  /**
   * Handles a fault raised by a routine.
   *
   * @param continuation the failed continuation
   * @param fault        the exception that escaped the routine
   */
  void onFault(Continuation continuation, Throwable fault);
}
