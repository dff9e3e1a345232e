package io.b2mash.hms.hmsadmin.common;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/** Generates prefixed identifiers of the form {@code <prefix>_<epochMillis>_<9 random chars>}. */
public final class IdGenerator {

  private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
  private static final int RANDOM_LENGTH = 9;

  private IdGenerator() {}

  public static String generate(String prefix, Clock clock) {
    var random = ThreadLocalRandom.current();
    var suffix = new StringBuilder(RANDOM_LENGTH);
    for (int i = 0; i < RANDOM_LENGTH; i++) {
      suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
    }
    return prefix + "_" + clock.millis() + "_" + suffix;
  }
}
