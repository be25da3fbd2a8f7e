package io.github.panghy.cosim.await;

import io.github.panghy.cosim.core.Continuation;
import io.github.panghy.cosim.scheduler.EventKey;
import io.github.panghy.cosim.scheduler.SimScheduler;

import java.util.Objects;

/**
 * Suspends a continuation until an event is triggered. Always suspends.
 *
 * <p>The one-shot handler registered on suspension copies the payload into this object and
 * then resumes the continuation, so the payload outlives the trigger call. An event fired
 * without data leaves the key's default value in place. Waits on an untyped key
 * ({@link EventKey#untyped(long)}) yield nothing.</p>
 *
 * @param <T> the payload type
 */
public final class EventWait<T> implements Awaitable<T> {

  private final EventKey<T> key;
  private T payload;
  private boolean fired;

  /**
   * Creates a wait on the given event.
   *
   * @param key the event to wait for
   */
  public EventWait(EventKey<T> key) {
    this.key = Objects.requireNonNull(key, "key cannot be null");
    this.payload = key.getDefaultValue();
  }

  /**
   * Creates a wait that ignores the payload.
   *
   * @param eventId the event id
   * @return the awaitable
   */
  public static EventWait<Void> untyped(long eventId) {
    return new EventWait<>(EventKey.untyped(eventId));
  }

  public EventKey<T> getKey() {
    return key;
  }

  /**
   * Returns whether the event has been delivered to this wait.
   *
   * @return true once the handler has run
   */
  public boolean hasFired() {
    return fired;
  }

  @Override
  public boolean isReady() {
    return false;
  }

  @Override
  public void suspend(SimScheduler scheduler, Continuation continuation) {
    scheduler.registerEventHandler(key, data -> {
      if (data != null) {
        payload = data;
      }
      fired = true;
      continuation.resume();
    });
  }

  @Override
  public T result() {
    return payload;
  }

  @Override
  public String toString() {
    return "EventWait{" + key + "}";
  }
}
