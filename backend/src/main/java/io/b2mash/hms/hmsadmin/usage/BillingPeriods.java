package io.b2mash.hms.hmsadmin.usage;

import io.b2mash.hms.hmsadmin.exception.InvalidStateException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.regex.Pattern;

/** Billing periods are calendar months in UTC, written {@code yyyy-MM}. */
public final class BillingPeriods {

  private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
  private static final Pattern PERIOD = Pattern.compile("^\\d{4}-(0[1-9]|1[0-2])$");

  private BillingPeriods() {}

  public static String current(Clock clock) {
    return of(LocalDate.now(clock));
  }

  public static String of(LocalDate date) {
    return YearMonth.from(date).format(FORMAT);
  }

  public static String requireValid(String period) {
    if (period == null || !PERIOD.matcher(period).matches()) {
      throw new InvalidStateException(
          "Invalid billing period", "Period must be formatted yyyy-MM, got '" + period + "'");
    }
    return period;
  }
}
