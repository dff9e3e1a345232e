package io.b2mash.hms.hmsadmin.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs secondary side effects (audit writes, fast-store cleanup) that must never fail the primary
 * operation. A failure is logged at WARN and reported through the return value only.
 */
public final class BestEffort {

  private static final Logger log = LoggerFactory.getLogger(BestEffort.class);

  private BestEffort() {}

  /**
   * Runs {@code action}, absorbing any {@link RuntimeException}.
   *
   * @param description short label used in the warning, e.g. {@code "audit tenant.created"}
   * @param action the side effect
   * @return {@code true} if the action completed, {@code false} if it failed
   */
  public static boolean run(String description, Runnable action) {
    try {
      action.run();
      return true;
    } catch (RuntimeException e) {
      log.warn("Best-effort side effect failed: {} ({})", description, e.getMessage(), e);
      return false;
    }
  }
}
