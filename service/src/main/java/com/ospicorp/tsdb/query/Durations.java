package com.ospicorp.tsdb.query;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Durations written as {@code <int><unit>}, e.g. {@code 15m} or {@code 1d}. Parsed durations
 * always fit in a {@code long} of milliseconds.
 */
public final class Durations {

  public static final String DURATION_PATTERN = "([0-9]+)(u|ms|s|m|h|d|w)";
  private static final Pattern DURATION = Pattern.compile(DURATION_PATTERN);

  private Durations() {
  }

  public static boolean isDuration(String text) {
    return DURATION.matcher(text).matches();
  }

  public static Duration parse(String text) {
    Matcher match = DURATION.matcher(text);
    if (!match.matches()) {
      throw new IllegalArgumentException("Invalid duration '" + text + "'");
    }
    try {
      long amount = Long.parseLong(match.group(1));
      Duration duration = switch (match.group(2)) {
        case "u" -> Duration.of(amount, ChronoUnit.MICROS);
        case "ms" -> Duration.ofMillis(amount);
        case "s" -> Duration.ofSeconds(amount);
        case "m" -> Duration.ofMinutes(amount);
        case "h" -> Duration.ofHours(amount);
        case "d" -> Duration.ofDays(amount);
        case "w" -> Duration.ofDays(Math.multiplyExact(amount, 7));
        default -> throw new IllegalArgumentException("Invalid duration unit in '" + text + "'");
      };
      // Throws when the duration does not fit in milliseconds.
      duration.toMillis();
      return duration;
    } catch (ArithmeticException | NumberFormatException ex) {
      throw new IllegalArgumentException("Duration '" + text + "' is out of range", ex);
    }
  }
}
