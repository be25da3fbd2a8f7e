package io.github.panghy.cosim.scheduler;

import java.util.Objects;

/**
 * Identifies a class of named occurrences together with the type of payload it carries.
 *
 * <p>The id is an opaque 64-bit key, treated as unsigned when printed. A typed key declares
 * the payload type of its id on the scheduler the first time it is used there; later uses of
 * the same id with a different type are rejected with {@link EventTypeMismatchException}.
 * An untyped key never declares anything and its waiters ignore the payload.</p>
 *
 * <pre>{@code
 * static final EventKey<VoltageReading> VOLTAGE_CHANGE =
 *     EventKey.of(10_000, VoltageReading.class);
 * static final EventKey<Void> GENERATOR_READY = EventKey.untyped(1_001);
 * }</pre>
 *
 * @param <T> the payload type
 */
public final class EventKey<T> {

  private final long id;
  private final Class<T> payloadType;
  private final T defaultValue;

  private EventKey(long id, Class<T> payloadType, T defaultValue) {
    this.id = id;
    this.payloadType = payloadType;
    this.defaultValue = defaultValue;
  }

  /**
   * Creates a typed key whose waiters get null when the event fires without data.
   *
   * @param id          the event id
   * @param payloadType the payload type, a reference type
   * @param <T>         the payload type
   * @return the key
   */
  public static <T> EventKey<T> of(long id, Class<T> payloadType) {
    return of(id, payloadType, null);
  }

  /**
   * Creates a typed key with a default value for events fired without data.
   *
   * @param id           the event id
   * @param payloadType  the payload type, a reference type
   * @param defaultValue the value waiters get when the event carries no data
   * @param <T>          the payload type
   * @return the key
   */
  public static <T> EventKey<T> of(long id, Class<T> payloadType, T defaultValue) {
    Objects.requireNonNull(payloadType, "payloadType cannot be null");
    if (payloadType.isPrimitive()) {
      throw new IllegalArgumentException("payload type must be a reference type, got " +
          payloadType.getName());
    }
    return new EventKey<>(id, payloadType, defaultValue);
  }

  /**
   * Creates an untyped key.
   *
   * @param id the event id
   * @return the key
   */
  public static EventKey<Void> untyped(long id) {
    return new EventKey<>(id, null, null);
  }

  public long getId() {
    return id;
  }

  /**
   * Gets the payload type.
   *
   * @return the type, or null for an untyped key
   */
  public Class<T> getPayloadType() {
    return payloadType;
  }

  public T getDefaultValue() {
    return defaultValue;
  }

  public boolean isTyped() {
    return payloadType != null;
  }

  /**
   * Converts a raw payload delivered by the registry into this key's type.
   *
   * @param payload the raw payload, may be null
   * @return the typed payload, the default value if {@code payload} is null, or null for an
   * untyped key
   */
  T decode(Object payload) {
    if (payloadType == null) {
      return null;
    }
    if (payload == null) {
      return defaultValue;
    }
    return payloadType.cast(payload);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    EventKey<?> eventKey = (EventKey<?>) o;
    return id == eventKey.id && Objects.equals(payloadType, eventKey.payloadType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, payloadType);
  }

  @Override
  public String toString() {
    return "EventKey{" +
        "id=" + Long.toUnsignedString(id) +
        ", type=" + (payloadType == null ? "untyped" : payloadType.getSimpleName()) +
        '}';
  }
}
