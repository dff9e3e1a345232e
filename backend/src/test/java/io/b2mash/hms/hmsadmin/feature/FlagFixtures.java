package io.b2mash.hms.hmsadmin.feature;

import java.time.Instant;
import java.util.List;

final class FlagFixtures {

  static final Instant CREATED_AT = Instant.parse("2024-05-01T00:00:00Z");

  private FlagFixtures() {}

  static FeatureFlag flag(String key, FlagStatus status) {
    return targeted(key, status, null, null, null, null);
  }

  static FeatureFlag targeted(
      String key,
      FlagStatus status,
      List<String> allow,
      List<String> deny,
      List<String> plans,
      Integer rollout) {
    return new FeatureFlag(
        "ff_" + key,
        key,
        key.replace('_', ' '),
        null,
        "general",
        FlagScope.GLOBAL,
        status,
        allow,
        deny,
        plans,
        rollout,
        CREATED_AT,
        CREATED_AT);
  }
}
