package io.github.panghy.cosim.scheduler;

/**
 * A one-shot callback invoked when an event fires.
 *
 * @param <T> the payload type
 */
@FunctionalInterface
public interface EventHandler<T> {

  /**
   * Called once when the event this handler was registered for is triggered.
   *
   * @param payload the event payload, or null if the event fired without data
   */
  void onEvent(T payload);
}
