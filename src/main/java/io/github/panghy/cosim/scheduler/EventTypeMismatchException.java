package io.github.panghy.cosim.scheduler;

/**
 * Thrown when an event payload, or a second declaration of an event id, does not agree with
 * the payload type declared for that id.
 */
public class EventTypeMismatchException extends IllegalArgumentException {

  private final long eventId;

  /**
   * Creates a new mismatch exception.
   *
   * @param eventId  the event id
   * @param declared the declared payload type
   * @param actual   the offending type
   */
  public EventTypeMismatchException(long eventId, Class<?> declared, Class<?> actual) {
    super("event " + Long.toUnsignedString(eventId) + " carries " + declared.getName() +
        ", not " + actual.getName());
    this.eventId = eventId;
  }

  public long getEventId() {
    return eventId;
  }
}
