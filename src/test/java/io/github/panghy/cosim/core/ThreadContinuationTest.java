package io.github.panghy.cosim.core;

import io.github.panghy.cosim.scheduler.EventKey;
import io.github.panghy.cosim.test.AbstractSimTest;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for the hand-off protocol of {@link ThreadContinuation}.
 */
class ThreadContinuationTest extends AbstractSimTest {

  private static final EventKey<Integer> VALUE = EventKey.of(3, Integer.class);

  @Test
  void testStatesAcrossLifecycle() {
    Task task = start(ctx -> ctx.delay(10));
    ThreadContinuation continuation = (ThreadContinuation) task.getContinuation();
    assertEquals(ThreadContinuation.State.SUSPENDED, continuation.getState());

    scheduler.runUntil(20);
    assertEquals(ThreadContinuation.State.COMPLETED, continuation.getState());
  }

  @Test
  void testContinuationsHaveDistinctIds() {
    Task a = start(ctx -> ctx.delay(1));
    Task b = start(ctx -> ctx.delay(1));
    assertNotEquals(a.getContinuation().getId(), b.getContinuation().getId());
  }

  @Test
  void testResumingRunningContinuationIsRejected() {
    start(ctx -> {
      try {
        ctx.continuation().resume();
      } catch (IllegalStateException e) {
        record("rejected");
      }
    });
    assertThat(events).containsExactly("0:rejected");
  }

  @Test
  void testAwaitFromForeignThreadIsRejected() {
    AtomicReference<SimContext> captured = new AtomicReference<>();
    start(ctx -> {
      captured.set(ctx);
      ctx.waitFor(1L);
    });

    assertThatThrownBy(() -> captured.get().delay(10))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("outside of continuation");
  }

  @Test
  void testNestedResumptionRunsInsideTrigger() {
    start(ctx -> {
      int value = ctx.waitFor(VALUE);
      record("waiter got " + value);
    });
    start(ctx -> {
      ctx.delay(100);
      record("trigger before");
      ctx.scheduler().triggerEvent(VALUE, 42);
      record("trigger after");
    });

    scheduler.runUntil(200);
    assertThat(events).containsExactly(
        "100:trigger before",
        "100:waiter got 42",
        "100:trigger after");
  }

  @Test
  void testChainOfNestedResumptions() {
    // a wakes b, which wakes c, all inside the first trigger call
    start(ctx -> {
      ctx.waitFor(2L);
      record("c");
    });
    start(ctx -> {
      ctx.waitFor(1L);
      record("b");
      ctx.scheduler().triggerEvent(2L);
      record("b done");
    });

    scheduler.triggerEvent(1L);
    assertThat(events).containsExactly("0:b", "0:c", "0:b done");
    assertTrue(scheduler.isEmpty());
  }

  @Test
  void testRoutineStartsAnotherRoutine() {
    AtomicReference<Task> child = new AtomicReference<>();
    start(ctx -> {
      ctx.delay(50);
      record("parent before start");
      child.set(ctx.scheduler().start(childCtx -> {
        record("child first step");
        childCtx.delay(10);
        record("child woke");
      }));
      record("parent after start");
      ctx.delay(100);
      record("parent woke");
    });

    scheduler.runUntil(200);
    assertThat(events).containsExactly(
        "50:parent before start",
        "50:child first step",
        "50:parent after start",
        "60:child woke",
        "150:parent woke");
    assertTrue(child.get().isDone());
  }

  @Test
  void testChildStartedDuringTriggerRunsNested() {
    start(ctx -> {
      ctx.waitFor(VALUE);
      ctx.scheduler().start(childCtx -> {
        record("child");
        childCtx.scheduler().triggerEvent(8L);
      }).detach();
      record("waiter done");
    });
    start(ctx -> {
      ctx.waitFor(8L);
      record("grandchild event");
    });

    scheduler.triggerEvent(VALUE, 1);
    assertThat(events).containsExactly("0:child", "0:grandchild event", "0:waiter done");
    assertTrue(scheduler.isEmpty());
  }

  @Test
  void testDestroyedRoutineCannotKeepSuspending() {
    Task task = start(ctx -> {
      try {
        ctx.delay(10);
      } catch (ContinuationDestroyedError e) {
        record("caught");
        try {
          ctx.delay(10);
        } catch (ContinuationDestroyedError again) {
          record("caught again");
          throw again;
        }
      }
    });

    task.close();
    assertThat(events).containsExactly("0:caught", "0:caught again");
    assertTrue(task.isDone());
  }

  @Test
  void testClosingReleasesThreadButDetachingKeepsItParked() throws InterruptedException {
    Task closed = start(ctx -> ctx.waitFor(11L));
    Task detached = start(ctx -> {
      while (true) {
        ctx.waitFor(12L);
      }
    });
    Thread closedThread = ((ThreadContinuation) closed.getContinuation()).getThread();
    ThreadContinuation leaked = (ThreadContinuation) detached.detach();

    closed.close();
    closedThread.join(5_000);
    assertFalse(closedThread.isAlive());

    scheduler.triggerEvent(12L);
    assertTrue(leaked.getThread().isAlive());
    assertEquals(ThreadContinuation.State.SUSPENDED, leaked.getState());

    // No task owns it any more, so unwind it by hand
    leaked.destroy();
    leaked.getThread().join(5_000);
    assertFalse(leaked.getThread().isAlive());
  }

  @Test
  void testInterruptDuringResumeIsRestored() {
    Task task = start(ctx -> ctx.delay(10));
    Thread.currentThread().interrupt();
    try {
      scheduler.runUntil(20);
      assertTrue(Thread.currentThread().isInterrupted());
      assertTrue(task.isDone());
    } finally {
      Thread.interrupted();
    }
  }
}
