package io.github.panghy.cosim.scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-event-id lists of one-shot handlers, plus the payload type declared for each id.
 *
 * <p>Handlers for one id are kept in registration order. {@link #take(long)} removes the
 * whole list for an id and hands it to the caller, so handlers registered while that list is
 * being invoked start a fresh list for the next firing.</p>
 */
public class EventRegistry {

  /**
   * Handlers waiting for each event id
   */
  private final Map<Long, List<EventHandler<Object>>> handlers = new HashMap<>();

  /**
   * Payload type declared for each event id
   */
  private final Map<Long, Class<?>> declaredTypes = new HashMap<>();

  /**
   * Declares the payload type of a typed key's id. Untyped keys are ignored.
   *
   * @param key the key
   * @throws EventTypeMismatchException if the id was declared with another type
   */
  public void declare(EventKey<?> key) {
    if (!key.isTyped()) {
      return;
    }
    Class<?> existing = declaredTypes.putIfAbsent(key.getId(), key.getPayloadType());
    if (existing != null && existing != key.getPayloadType()) {
      throw new EventTypeMismatchException(key.getId(), existing, key.getPayloadType());
    }
  }

  /**
   * Gets the declared payload type of an id.
   *
   * @param eventId the event id
   * @return the declared type or null if undeclared
   */
  public Class<?> getDeclaredType(long eventId) {
    return declaredTypes.get(eventId);
  }

  /**
   * Checks a payload against the declared type of its id.
   *
   * @param eventId the event id
   * @param payload the payload, null always passes
   * @throws EventTypeMismatchException if the payload does not match
   */
  public void checkPayload(long eventId, Object payload) {
    Class<?> declared = declaredTypes.get(eventId);
    if (declared != null && payload != null && !declared.isInstance(payload)) {
      throw new EventTypeMismatchException(eventId, declared, payload.getClass());
    }
  }

  /**
   * Appends a handler for an id.
   *
   * @param eventId the event id
   * @param handler the handler
   */
  public void register(long eventId, EventHandler<Object> handler) {
    handlers.computeIfAbsent(eventId, $ -> new ArrayList<>()).add(handler);
  }

  /**
   * Removes and returns every handler registered for an id.
   *
   * @param eventId the event id
   * @return the handlers in registration order, empty if none
   */
  public List<EventHandler<Object>> take(long eventId) {
    List<EventHandler<Object>> taken = handlers.remove(eventId);
    return taken == null ? Collections.emptyList() : taken;
  }

  /**
   * Gets the number of handlers waiting for an id.
   *
   * @param eventId the event id
   * @return the handler count
   */
  public int pendingCount(long eventId) {
    List<EventHandler<Object>> pending = handlers.get(eventId);
    return pending == null ? 0 : pending.size();
  }

  /**
   * Gets the total number of waiting handlers.
   *
   * @return the handler count across all ids
   */
  public int size() {
    int total = 0;
    for (List<EventHandler<Object>> pending : handlers.values()) {
      total += pending.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return handlers.isEmpty();
  }

  /**
   * Drops every waiting handler. Declarations are kept.
   */
  public void clear() {
    handlers.clear();
  }
}
