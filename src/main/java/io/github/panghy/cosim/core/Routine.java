package io.github.panghy.cosim.core;

/**
 * A suspendable routine. The routine receives the context of the continuation that runs
 * it and may suspend through {@link SimContext#delay} or {@link SimContext#waitFor}.
 */
@FunctionalInterface
public interface Routine {

  /**
   * Runs the routine body.
   *
   * @param ctx the context of the continuation executing this routine
   * @throws Exception any exception escaping the routine is a fault, see {@link FaultHandler}
   */
  void run(SimContext ctx) throws Exception;
}
