package io.github.panghy.cosim.scheduler;

import io.github.panghy.cosim.core.FaultHandler;

import java.util.Objects;

/**
 * Configuration options for the {@link SimScheduler}.
 */
public class SchedulerConfig {

  /** The default name used for logging and continuation threads. */
  private static final String DEFAULT_NAME = "cosim";

  /** Name used for logging and continuation threads. */
  private final String name;

  /** Simulated time the scheduler starts at. */
  private final long startTimeMillis;

  /** What happens when a routine fails. */
  private final FaultHandler faultHandler;

  /** What a suspension does without a live scheduler. */
  private final UnboundSuspensionPolicy unboundSuspensionPolicy;

  /** The default scheduler configuration. */
  public static final SchedulerConfig DEFAULT = builder().build();

  /**
   * Creates a new scheduler configuration.
   *
   * @param name                    Name used for logging and continuation threads
   * @param startTimeMillis         Simulated start time
   * @param faultHandler            Handler for routine faults
   * @param unboundSuspensionPolicy Behaviour of suspensions without a scheduler
   */
  public SchedulerConfig(String name, long startTimeMillis, FaultHandler faultHandler,
                         UnboundSuspensionPolicy unboundSuspensionPolicy) {
    this.name = Objects.requireNonNull(name, "name cannot be null");
    if (name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    this.startTimeMillis = startTimeMillis;
    this.faultHandler = Objects.requireNonNull(faultHandler, "faultHandler cannot be null");
    this.unboundSuspensionPolicy = Objects.requireNonNull(unboundSuspensionPolicy,
        "unboundSuspensionPolicy cannot be null");
  }

  public String getName() {
    return name;
  }

  public long getStartTimeMillis() {
    return startTimeMillis;
  }

  public FaultHandler getFaultHandler() {
    return faultHandler;
  }

  public UnboundSuspensionPolicy getUnboundSuspensionPolicy() {
    return unboundSuspensionPolicy;
  }

  /**
   * Creates a builder pre-filled with this configuration.
   *
   * @return A new builder
   */
  public Builder toBuilder() {
    return new Builder()
        .name(name)
        .startTimeMillis(startTimeMillis)
        .faultHandler(faultHandler)
        .unboundSuspensionPolicy(unboundSuspensionPolicy);
  }

  /**
   * Creates a new builder for scheduler configuration.
   *
   * @return A new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "SchedulerConfig{" +
        "name='" + name + '\'' +
        ", startTimeMillis=" + startTimeMillis +
        ", unboundSuspensionPolicy=" + unboundSuspensionPolicy +
        '}';
  }

  /**
   * Builder for scheduler configuration.
   */
  public static class Builder {
    private String name = DEFAULT_NAME;
    private long startTimeMillis = 0;
    private FaultHandler faultHandler = FaultHandler.TERMINATE;
    private UnboundSuspensionPolicy unboundSuspensionPolicy =
        UnboundSuspensionPolicy.RESUME_IMMEDIATELY;

    /**
     * Sets the scheduler name.
     *
     * @param name The name
     * @return This builder
     */
    public Builder name(String name) {
      this.name = name;
      return this;
    }

    /**
     * Sets the simulated start time.
     *
     * @param startTimeMillis The start time in milliseconds
     * @return This builder
     */
    public Builder startTimeMillis(long startTimeMillis) {
      this.startTimeMillis = startTimeMillis;
      return this;
    }

    /**
     * Sets the fault handler.
     *
     * @param faultHandler The handler
     * @return This builder
     */
    public Builder faultHandler(FaultHandler faultHandler) {
      this.faultHandler = faultHandler;
      return this;
    }

    /**
     * Sets the behaviour of suspensions issued without a scheduler.
     *
     * @param unboundSuspensionPolicy The policy
     * @return This builder
     */
    public Builder unboundSuspensionPolicy(UnboundSuspensionPolicy unboundSuspensionPolicy) {
      this.unboundSuspensionPolicy = unboundSuspensionPolicy;
      return this;
    }

    /**
     * Builds a new scheduler configuration.
     *
     * @return A new configuration
     */
    public SchedulerConfig build() {
      return new SchedulerConfig(name, startTimeMillis, faultHandler, unboundSuspensionPolicy);
    }
  }
}
