package io.b2mash.hms.hmsadmin.feature;

/** Result of evaluating a flag, together with the rule that decided it. */
public record FlagDecision(boolean enabled, Rule rule) {

  public enum Rule {
    FLAG_MISSING,
    FLAG_DISABLED,
    DENY_LIST,
    ALLOW_LIST,
    PLAN_NOT_ENTITLED,
    ROLLOUT,
    STATUS
  }

  static FlagDecision of(boolean enabled, Rule rule) {
    return new FlagDecision(enabled, rule);
  }
}
