package io.github.panghy.cosim.scheduler;

import io.github.panghy.cosim.core.Continuation;
import io.github.panghy.cosim.core.Routine;
import io.github.panghy.cosim.core.Task;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.logging.Logger;

import static io.github.panghy.cosim.util.LoggingUtil.debug;
import static io.github.panghy.cosim.util.LoggingUtil.info;

/**
 * Discrete-event scheduler that owns simulated time and resumes continuations in a
 * deterministic order.
 *
 * <p>Three registries feed the scheduler:</p>
 * <ul>
 *   <li>a FIFO ready queue of continuations to resume as soon as possible,</li>
 *   <li>a timed queue ordered by wake time, insertion order breaking ties,</li>
 *   <li>an {@link EventRegistry} of one-shot handlers per event id.</li>
 * </ul>
 *
 * <p>Nothing runs unless the caller drives the scheduler with {@link #runOneStep()} or
 * {@link #runUntil(long)}. Within one stepping operation the ready queue always has
 * priority over the timed queue. Resumption is synchronous: a resumed continuation runs on
 * the caller's behalf until it suspends again, and anything it schedules or triggers along
 * the way is applied immediately.</p>
 *
 * <p>The scheduler is not thread-safe. It must be driven by one logical flow of control,
 * which includes the continuations it resumes.</p>
 */
public class SimScheduler implements AutoCloseable {
  private static final Logger LOGGER = Logger.getLogger(SimScheduler.class.getName());

  private final SchedulerConfig config;

  /**
   * The clock holding simulated time
   */
  private final SimulatedClock clock;

  /**
   * Continuations awaiting immediate resumption
   */
  private final Deque<Continuation> readyTasks = new ArrayDeque<>();

  /**
   * Continuations waiting for a wake time
   * Map from wake time to continuations in insertion order
   */
  private final NavigableMap<Long, List<Continuation>> timerTasks = new TreeMap<>();

  /**
   * Number of entries across all timerTasks lists
   */
  private int timerTaskCount;

  /**
   * One-shot handlers per event id
   */
  private final EventRegistry eventRegistry = new EventRegistry();

  private boolean closed;

  /**
   * Creates a scheduler with the default configuration.
   */
  public SimScheduler() {
    this(SchedulerConfig.DEFAULT);
  }

  /**
   * Creates a scheduler with the given configuration.
   *
   * @param config the configuration
   */
  public SimScheduler(SchedulerConfig config) {
    this.config = Objects.requireNonNull(config, "config cannot be null");
    this.clock = new SimulatedClock(config.getStartTimeMillis());
    debug(LOGGER, "created scheduler " + config);
  }

  public SchedulerConfig getConfig() {
    return config;
  }

  public SimulatedClock getClock() {
    return clock;
  }

  /**
   * Gets the current simulated time.
   *
   * @return the time in milliseconds
   */
  public long now() {
    return clock.currentTimeMillis();
  }

  /**
   * Sets the simulated time. Not validated; moving time backwards is the caller's problem.
   *
   * @param timeMillis the new time
   */
  public void setTime(long timeMillis) {
    clock.setCurrentTime(timeMillis);
  }

  /**
   * Adds a delta to the simulated time without processing any queue. Not validated.
   *
   * @param deltaMillis the delta in milliseconds
   */
  public void advanceTime(long deltaMillis) {
    clock.advanceTime(deltaMillis);
  }

  /**
   * Starts a routine bound to this scheduler. The routine runs up to its first suspension
   * before this method returns.
   *
   * @param routine the routine
   * @return the task owning the new continuation
   */
  public Task start(Routine routine) {
    return Task.start(this, routine);
  }

  /**
   * Appends a continuation to the ready queue.
   *
   * @param continuation the continuation
   */
  public void schedule(Continuation continuation) {
    Objects.requireNonNull(continuation, "continuation cannot be null");
    readyTasks.addLast(continuation);
  }

  /**
   * Queues a continuation to wake at {@code now() + delayMillis}. The wake time saturates at
   * {@link Long#MAX_VALUE} and {@link Long#MIN_VALUE} instead of overflowing.
   *
   * @param delayMillis  the delay in milliseconds
   * @param continuation the continuation
   */
  public void scheduleAfter(long delayMillis, Continuation continuation) {
    Objects.requireNonNull(continuation, "continuation cannot be null");
    long wakeTime = wakeTimeAfter(clock.currentTimeMillis(), delayMillis);
    timerTasks.computeIfAbsent(wakeTime, $ -> new ArrayList<>()).add(continuation);
    timerTaskCount++;
  }

  /**
   * Queues a continuation to wake after the given duration.
   *
   * @param delay        the delay, truncated to milliseconds
   * @param continuation the continuation
   */
  public void scheduleAfter(Duration delay, Continuation continuation) {
    scheduleAfter(delay.toMillis(), continuation);
  }

  /**
   * Declares the payload type of an event id without registering a handler.
   *
   * @param key the typed key
   * @throws EventTypeMismatchException if the id is already declared with another type
   */
  public void declareEvent(EventKey<?> key) {
    eventRegistry.declare(key);
  }

  /**
   * Registers a one-shot handler that receives the raw payload.
   *
   * @param eventId the event id
   * @param handler the handler
   */
  public void registerEventHandler(long eventId, EventHandler<Object> handler) {
    Objects.requireNonNull(handler, "handler cannot be null");
    eventRegistry.register(eventId, handler);
  }

  /**
   * Registers a one-shot handler for a typed (or untyped) key. A typed key declares its
   * payload type for the id. Untyped handlers always receive null.
   *
   * @param key     the event key
   * @param handler the handler
   * @param <T>     the payload type
   * @throws EventTypeMismatchException if the id is already declared with another type
   */
  public <T> void registerEventHandler(EventKey<T> key, EventHandler<? super T> handler) {
    Objects.requireNonNull(key, "key cannot be null");
    Objects.requireNonNull(handler, "handler cannot be null");
    eventRegistry.declare(key);
    eventRegistry.register(key.getId(), payload -> handler.onEvent(key.decode(payload)));
  }

  /**
   * Fires an event without data.
   *
   * @param eventId the event id
   */
  public void triggerEvent(long eventId) {
    fire(eventId, null);
  }

  /**
   * Fires an event with a payload.
   *
   * @param eventId the event id
   * @param payload the payload
   * @throws EventTypeMismatchException if the payload does not match the declared type
   */
  public void triggerEvent(long eventId, Object payload) {
    eventRegistry.checkPayload(eventId, payload);
    fire(eventId, payload);
  }

  /**
   * Fires an event without data.
   *
   * @param key the event key
   */
  public void triggerEvent(EventKey<?> key) {
    Objects.requireNonNull(key, "key cannot be null");
    eventRegistry.declare(key);
    fire(key.getId(), null);
  }

  /**
   * Fires a typed event.
   *
   * @param key     the event key
   * @param payload the payload
   * @param <T>     the payload type
   * @throws EventTypeMismatchException if the key or payload does not match the declared type
   */
  public <T> void triggerEvent(EventKey<T> key, T payload) {
    Objects.requireNonNull(key, "key cannot be null");
    eventRegistry.declare(key);
    eventRegistry.checkPayload(key.getId(), payload);
    fire(key.getId(), payload);
  }

  /**
   * Takes every handler for the id before invoking any of them. Handlers registered by the
   * invocations below land in a new list and wait for the next trigger.
   */
  private void fire(long eventId, Object payload) {
    List<EventHandler<Object>> handlers = eventRegistry.take(eventId);
    if (handlers.isEmpty()) {
      debug(LOGGER, clock.currentTimeMillis(),
          "event " + Long.toUnsignedString(eventId) + " dropped, no handlers");
      return;
    }
    debug(LOGGER, clock.currentTimeMillis(),
        "event " + Long.toUnsignedString(eventId) + " firing " + handlers.size() + " handler(s)");
    for (EventHandler<Object> handler : handlers) {
      handler.onEvent(payload);
    }
  }

  /**
   * Performs one unit of work: resumes the head of the ready queue, or, if the ready queue
   * is empty, advances time to the earliest wake time and moves every due timed entry to
   * the ready queue without resuming it.
   *
   * @return true if work was done, false if the scheduler is idle
   */
  public boolean runOneStep() {
    if (!readyTasks.isEmpty()) {
      Continuation continuation = readyTasks.pollFirst();
      if (!continuation.isDone()) {
        continuation.resume();
      }
      return true;
    }
    if (!timerTasks.isEmpty()) {
      clock.setCurrentTime(timerTasks.firstKey());
      moveDueTimerTasks();
      return true;
    }
    return false;
  }

  /**
   * Runs until simulated time reaches {@code endTimeMillis} or no ready or timed work
   * remains. Timed entries waking at or after {@code endTimeMillis} are left queued, and
   * the time always ends at {@code endTimeMillis} (unless it already was past it).
   *
   * @param endTimeMillis the time horizon
   */
  public void runUntil(long endTimeMillis) {
    debug(LOGGER, clock.currentTimeMillis(), "running until " + endTimeMillis + "ms");
    while (clock.currentTimeMillis() < endTimeMillis &&
        (!readyTasks.isEmpty() || !timerTasks.isEmpty())) {
      // Entries added while draining are picked up by the same pass
      while (!readyTasks.isEmpty()) {
        Continuation continuation = readyTasks.pollFirst();
        if (!continuation.isDone()) {
          continuation.resume();
        }
      }

      if (!timerTasks.isEmpty()) {
        long nextWakeTime = timerTasks.firstKey();
        if (nextWakeTime >= endTimeMillis) {
          clock.setCurrentTime(endTimeMillis);
          break;
        }
        clock.setCurrentTime(nextWakeTime);
        moveDueTimerTasks();
      }
    }
    if (clock.currentTimeMillis() < endTimeMillis) {
      clock.setCurrentTime(endTimeMillis);
    }
  }

  /**
   * Runs for the given span of simulated time from now.
   *
   * @param durationMillis the span in milliseconds
   */
  public void runFor(long durationMillis) {
    runUntil(wakeTimeAfter(clock.currentTimeMillis(), durationMillis));
  }

  // Saturating now + delay
  private static long wakeTimeAfter(long now, long delayMillis) {
    if (delayMillis > 0 && now > Long.MAX_VALUE - delayMillis) {
      return Long.MAX_VALUE;
    }
    if (delayMillis < 0 && now < Long.MIN_VALUE - delayMillis) {
      return Long.MIN_VALUE;
    }
    return now + delayMillis;
  }

  private int moveDueTimerTasks() {
    int moved = 0;
    long now = clock.currentTimeMillis();
    while (!timerTasks.isEmpty()) {
      Map.Entry<Long, List<Continuation>> entry = timerTasks.firstEntry();
      if (entry.getKey() > now) {
        break;
      }
      timerTasks.pollFirstEntry();
      for (Continuation continuation : entry.getValue()) {
        readyTasks.addLast(continuation);
        moved++;
      }
    }
    timerTaskCount -= moved;
    return moved;
  }

  /**
   * Returns whether the ready queue, the timed queue and the event registry are all empty.
   *
   * @return true if nothing is pending
   */
  public boolean isEmpty() {
    return readyTasks.isEmpty() && timerTasks.isEmpty() && eventRegistry.isEmpty();
  }

  public int readyCount() {
    return readyTasks.size();
  }

  public int timedCount() {
    return timerTaskCount;
  }

  /**
   * Gets the number of handlers waiting for an event id.
   *
   * @param eventId the event id
   * @return the handler count
   */
  public int pendingHandlerCount(long eventId) {
    return eventRegistry.pendingCount(eventId);
  }

  /**
   * Gets the earliest wake time in the timed queue.
   *
   * @return the time in milliseconds, or {@link Long#MAX_VALUE} if the timed queue is empty
   */
  public long nextWakeTime() {
    return timerTasks.isEmpty() ? Long.MAX_VALUE : timerTasks.firstKey();
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Closes the scheduler. Queued work is dropped and continuations bound to this scheduler
   * become unbound. Suspended continuations are not destroyed; their owning tasks do that.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    info(LOGGER, clock.currentTimeMillis(), "closing scheduler " + config.getName() +
        " (ready=" + readyTasks.size() + ", timed=" + timerTaskCount +
        ", handlers=" + eventRegistry.size() + ")");
    readyTasks.clear();
    timerTasks.clear();
    timerTaskCount = 0;
    eventRegistry.clear();
  }

  @Override
  public String toString() {
    return "SimScheduler{" +
        "name=" + config.getName() +
        ", now=" + clock.currentTimeMillis() +
        ", ready=" + readyTasks.size() +
        ", timed=" + timerTaskCount +
        ", handlers=" + eventRegistry.size() +
        '}';
  }
}
