package io.github.panghy.cosim.await;

import io.github.panghy.cosim.core.Continuation;
import io.github.panghy.cosim.core.Task;
import io.github.panghy.cosim.scheduler.EventKey;
import io.github.panghy.cosim.test.AbstractSimTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link EventWait}.
 */
class EventWaitTest extends AbstractSimTest {

  private static final EventKey<Double> VOLTAGE = EventKey.of(10_000, Double.class, 1.0);

  @Test
  void testNeverReady() {
    assertFalse(new EventWait<>(VOLTAGE).isReady());
    assertFalse(EventWait.untyped(1).isReady());
  }

  @Test
  void testHandlerStoresPayloadThenResumes() {
    Continuation continuation = mock(Continuation.class);
    EventWait<Double> wait = new EventWait<>(VOLTAGE);
    wait.suspend(scheduler, continuation);
    assertEquals(1, scheduler.pendingHandlerCount(VOLTAGE.getId()));
    verify(continuation, never()).resume();

    scheduler.triggerEvent(VOLTAGE, 0.92);
    verify(continuation).resume();
    assertTrue(wait.hasFired());
    assertEquals(0.92, wait.result());
  }

  @Test
  void testDefaultPayloadWhenFiredWithoutData() {
    Continuation continuation = mock(Continuation.class);
    EventWait<Double> wait = new EventWait<>(VOLTAGE);
    assertEquals(1.0, wait.result());
    wait.suspend(scheduler, continuation);

    scheduler.triggerEvent(VOLTAGE.getId());
    assertTrue(wait.hasFired());
    assertEquals(1.0, wait.result());
  }

  @Test
  void testUntypedWaitYieldsNothing() {
    Continuation continuation = mock(Continuation.class);
    EventWait<Void> wait = EventWait.untyped(77);
    wait.suspend(scheduler, continuation);

    scheduler.triggerEvent(77, "payload");
    verify(continuation).resume();
    assertNull(wait.result());
  }

  @Test
  void testEventDeliveredToWaitingRoutine() {
    Task task = start(ctx -> {
      double voltage = ctx.waitFor(VOLTAGE);
      record("voltage " + voltage);
    });
    assertFalse(task.isDone());

    scheduler.triggerEvent(VOLTAGE, 1.01);
    assertTrue(task.isDone());
    assertThat(events).containsExactly("0:voltage 1.01");
  }

  @Test
  void testRoutineLoopSeesOneDeliveryPerTrigger() {
    start(ctx -> {
      for (int i = 0; i < 3; i++) {
        ctx.waitFor(VOLTAGE);
        record("delivery " + i);
      }
    });

    scheduler.triggerEvent(VOLTAGE, 0.9);
    assertThat(events).containsExactly("0:delivery 0");
    assertEquals(1, scheduler.pendingHandlerCount(VOLTAGE.getId()));

    scheduler.triggerEvent(VOLTAGE, 0.95);
    assertThat(events).containsExactly("0:delivery 0", "0:delivery 1");
  }

  @Test
  void testSeveralWaitersWakeInRegistrationOrder() {
    start(ctx -> {
      ctx.waitFor(4L);
      record("a");
    });
    start(ctx -> {
      ctx.waitFor(4L);
      record("b");
    });
    assertEquals(2, scheduler.pendingHandlerCount(4L));

    scheduler.triggerEvent(4L);
    assertThat(events).containsExactly("0:a", "0:b");
    assertTrue(scheduler.isEmpty());
  }
}
