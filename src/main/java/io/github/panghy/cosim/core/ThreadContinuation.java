package io.github.panghy.cosim.core;

import io.github.panghy.cosim.scheduler.SchedulerConfig;
import io.github.panghy.cosim.scheduler.SimScheduler;

import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

import static io.github.panghy.cosim.util.LoggingUtil.debug;
import static io.github.panghy.cosim.util.LoggingUtil.warn;

/**
 * A {@link Continuation} backed by a dedicated daemon thread.
 *
 * <p>The routine thread and the thread that resumes it never run at the same time. Control
 * is passed back and forth through a single monitor: {@link #resume()} hands the turn to the
 * routine and blocks until the routine gives it back by suspending or finishing. Because the
 * resuming thread is simply parked while the routine runs, nested resumptions (a routine
 * that triggers an event which resumes another routine) stack up exactly like nested calls
 * on one thread.</p>
 *
 * <p>Hand-off waits ignore interrupts; an interrupt received while waiting is re-asserted
 * once the turn comes back.</p>
 */
final class ThreadContinuation implements Continuation {
  private static final Logger LOGGER = Logger.getLogger(ThreadContinuation.class.getName());

  // Continuation ID counter
  private static final AtomicLong ID_COUNTER = new AtomicLong(0);

  /**
   * Continuation state.
   */
  enum State {
    CREATED,
    RUNNING,
    SUSPENDED,
    COMPLETED,
    FAILED,
    DESTROYED
  }

  private final long id;
  private final Thread thread;
  private final SimContext context;
  private final FaultHandler faultHandler;

  /**
   * Guards {@link #routineTurn}; every hand-off goes through it.
   */
  private final Object monitor = new Object();

  /**
   * True while the routine thread owns the turn.
   */
  private boolean routineTurn;

  private volatile State state = State.CREATED;
  private volatile boolean destroyRequested;

  /**
   * Fault raised by the routine, reported once by the resuming thread.
   */
  private Throwable fault;

  ThreadContinuation(Routine routine, SimScheduler scheduler, SchedulerConfig config) {
    this.id = ID_COUNTER.incrementAndGet();
    this.faultHandler = config.getFaultHandler();
    this.context = new SimContext(this, scheduler, config.getUnboundSuspensionPolicy());
    this.thread = new Thread(() -> body(routine), config.getName() + "-continuation-" + id);
    this.thread.setDaemon(true);
  }

  /**
   * Runs the routine up to its first suspension (or to completion).
   */
  void start() {
    if (state != State.CREATED) {
      throw new IllegalStateException("continuation " + id + " already started");
    }
    debug(LOGGER, "continuation " + id + " starting");
    state = State.RUNNING;
    synchronized (monitor) {
      routineTurn = true;
      thread.start();
      awaitTurnReturned();
    }
    reportFault();
  }

  @Override
  public void resume() {
    if (isDone()) {
      return;
    }
    if (state == State.RUNNING) {
      throw new IllegalStateException("continuation " + id + " is already running");
    }
    state = State.RUNNING;
    handOffToRoutine();
    reportFault();
  }

  /**
   * Destroys a suspended continuation by unwinding its routine with a
   * {@link ContinuationDestroyedError}.
   */
  void destroy() {
    if (isDone()) {
      return;
    }
    if (state == State.RUNNING) {
      throw new IllegalStateException("cannot destroy running continuation " + id);
    }
    debug(LOGGER, "destroying continuation " + id);
    destroyRequested = true;
    state = State.RUNNING;
    handOffToRoutine();
    reportFault();
  }

  /**
   * Gives the turn back to whoever resumed this continuation and parks the routine thread
   * until it is resumed again. Must be called from the routine thread.
   */
  void suspend() {
    if (!isCurrentThread()) {
      throw new IllegalStateException("continuation " + id + " can only suspend itself");
    }
    if (destroyRequested) {
      throw new ContinuationDestroyedError(id);
    }
    state = State.SUSPENDED;
    synchronized (monitor) {
      routineTurn = false;
      monitor.notifyAll();
      boolean interrupted = false;
      while (!routineTurn) {
        try {
          monitor.wait();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    if (destroyRequested) {
      throw new ContinuationDestroyedError(id);
    }
  }

  private void handOffToRoutine() {
    synchronized (monitor) {
      routineTurn = true;
      monitor.notifyAll();
      awaitTurnReturned();
    }
  }

  // Caller must hold the monitor.
  private void awaitTurnReturned() {
    boolean interrupted = false;
    while (routineTurn) {
      try {
        monitor.wait();
      } catch (InterruptedException e) {
        interrupted = true;
      }
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
  }

  private void body(Routine routine) {
    SimContext.CURRENT.set(context);
    try {
      routine.run(context);
      state = State.COMPLETED;
      debug(LOGGER, "continuation " + id + " completed");
    } catch (ContinuationDestroyedError e) {
      state = State.DESTROYED;
      debug(LOGGER, "continuation " + id + " unwound");
    } catch (Throwable t) {
      if (destroyRequested) {
        warn(LOGGER, "continuation " + id + " failed while being destroyed", t);
        state = State.DESTROYED;
      } else {
        fault = t;
        state = State.FAILED;
      }
    } finally {
      SimContext.CURRENT.remove();
      synchronized (monitor) {
        routineTurn = false;
        monitor.notifyAll();
      }
    }
  }

  private void reportFault() {
    Throwable t = fault;
    if (t != null) {
      fault = null;
      faultHandler.onFault(this, t);
    }
  }

  boolean isCurrentThread() {
    return Thread.currentThread() == thread;
  }

  Thread getThread() {
    return thread;
  }

  State getState() {
    return state;
  }

  SimContext getContext() {
    return context;
  }

  @Override
  public boolean isDone() {
    State s = state;
    return s == State.COMPLETED || s == State.FAILED || s == State.DESTROYED;
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public String toString() {
    return "Continuation{" +
        "id=" + id +
        ", state=" + state +
        '}';
  }
}
