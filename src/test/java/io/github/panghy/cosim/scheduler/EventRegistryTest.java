package io.github.panghy.cosim.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventRegistryTest {

  private EventRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new EventRegistry();
  }

  @Test
  void testTakeRemovesHandlersInOrder() {
    EventHandler<Object> first = payload -> {
    };
    EventHandler<Object> second = payload -> {
    };
    registry.register(1, first);
    registry.register(1, second);
    registry.register(2, first);
    assertEquals(3, registry.size());
    assertEquals(2, registry.pendingCount(1));

    List<EventHandler<Object>> taken = registry.take(1);
    assertThat(taken).containsExactly(first, second);
    assertEquals(0, registry.pendingCount(1));
    assertEquals(1, registry.size());
  }

  @Test
  void testTakeUnknownIdIsEmpty() {
    assertThat(registry.take(99)).isEmpty();
    assertTrue(registry.isEmpty());
  }

  @Test
  void testRegisterAfterTakeStartsFreshList() {
    EventHandler<Object> handler = payload -> {
    };
    registry.register(1, handler);
    List<EventHandler<Object>> taken = registry.take(1);
    registry.register(1, handler);
    assertEquals(1, taken.size());
    assertEquals(1, registry.pendingCount(1));
  }

  @Test
  void testDeclarationsAreSticky() {
    registry.declare(EventKey.of(3, String.class));
    registry.declare(EventKey.of(3, String.class, "x"));
    registry.declare(EventKey.untyped(3));
    assertSame(String.class, registry.getDeclaredType(3));
    assertNull(registry.getDeclaredType(4));

    EventTypeMismatchException e = assertThrows(EventTypeMismatchException.class,
        () -> registry.declare(EventKey.of(3, Integer.class)));
    assertEquals(3, e.getEventId());
  }

  @Test
  void testCheckPayload() {
    registry.declare(EventKey.of(3, Number.class));
    registry.checkPayload(3, 1);
    registry.checkPayload(3, 2.5);
    registry.checkPayload(3, null);
    registry.checkPayload(4, "undeclared ids accept anything");

    assertThatThrownBy(() -> registry.checkPayload(3, "text"))
        .isInstanceOf(EventTypeMismatchException.class)
        .hasMessage("event 3 carries java.lang.Number, not java.lang.String");
  }

  @Test
  void testClearKeepsDeclarations() {
    registry.declare(EventKey.of(3, String.class));
    registry.register(3, payload -> {
    });
    registry.clear();
    assertTrue(registry.isEmpty());
    assertSame(String.class, registry.getDeclaredType(3));
  }
}
