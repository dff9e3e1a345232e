package io.b2mash.hms.hmsadmin.feature;

/**
 * Deterministic 0-99 bucket for percentage rollouts: the sum of the identifier's UTF-16 code units,
 * modulo 100. The value depends only on the identifier, so a tenant stays in or out of a rollout
 * across restarts.
 */
public final class RolloutBucket {

  private RolloutBucket() {}

  public static int of(String identifier) {
    int sum = 0;
    for (int i = 0; i < identifier.length(); i++) {
      sum += identifier.charAt(i);
    }
    return Math.floorMod(sum, 100);
  }
}
