package io.github.panghy.cosim.scheduler;

/**
 * What a suspension does when the continuation has no live scheduler to register with.
 */
public enum UnboundSuspensionPolicy {
  /**
   * Resume at once: a delay becomes zero and an event wait yields its default payload.
   * A warning is logged each time.
   */
  RESUME_IMMEDIATELY,
  /**
   * Throw {@link IllegalStateException} from the suspending call.
   */
  FAIL
}
