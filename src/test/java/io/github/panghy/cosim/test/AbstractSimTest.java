package io.github.panghy.cosim.test;

import io.github.panghy.cosim.core.FaultHandler;
import io.github.panghy.cosim.core.Routine;
import io.github.panghy.cosim.core.Task;
import io.github.panghy.cosim.scheduler.SchedulerConfig;
import io.github.panghy.cosim.scheduler.SimScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Abstract base class for tests that drive routines on a simulated scheduler.
 * Faults propagate out of the run loop instead of terminating the JVM, and every task
 * started through {@link #start(Routine)} is closed after the test.
 */
public abstract class AbstractSimTest {

  /**
   * The scheduler under test.
   */
  protected SimScheduler scheduler;

  /**
   * Timeline written by routines, in execution order.
   */
  protected final List<String> events = Collections.synchronizedList(new ArrayList<>());

  private final List<Task> startedTasks = new ArrayList<>();

  @BeforeEach
  void setUpScheduler() {
    scheduler = new SimScheduler(schedulerConfig());
    onSetUp();
  }

  /**
   * Configuration used for the scheduler. Subclasses may override.
   *
   * @return the configuration
   */
  protected SchedulerConfig schedulerConfig() {
    return SchedulerConfig.builder()
        .name("test")
        .faultHandler(FaultHandler.PROPAGATE)
        .build();
  }

  /**
   * Hook method for subclasses to perform additional setup after scheduler initialization.
   */
  protected void onSetUp() {
    // Default implementation does nothing
  }

  @AfterEach
  void tearDownScheduler() {
    onTearDown();
    for (Task task : startedTasks) {
      task.close();
    }
    startedTasks.clear();
    scheduler.close();
  }

  /**
   * Hook method for subclasses to perform additional tear down before scheduler cleanup.
   */
  protected void onTearDown() {
    // Default implementation does nothing
  }

  /**
   * Starts a routine on the test scheduler and closes it after the test.
   *
   * @param routine the routine
   * @return the owning task
   */
  protected Task start(Routine routine) {
    Task task = scheduler.start(routine);
    startedTasks.add(task);
    return task;
  }

  /**
   * Appends an entry stamped with the scheduler's simulated time.
   *
   * @param what the entry
   */
  protected void record(String what) {
    events.add(scheduler.now() + ":" + what);
  }

  /**
   * Gets the current simulation time in milliseconds.
   *
   * @return The current time in milliseconds
   */
  protected long currentTimeMillis() {
    return scheduler.now();
  }
}
