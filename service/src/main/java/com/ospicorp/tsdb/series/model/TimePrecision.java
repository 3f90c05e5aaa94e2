package com.ospicorp.tsdb.series.model;

import java.util.Locale;

/** Unit of the {@code time} values a client sends and receives. */
public enum TimePrecision {
  S(1000, 1),
  MS(1, 1),
  U(1, 1000);

  private final long millisPerUnit;
  private final long unitsPerMilli;

  TimePrecision(long millisPerUnit, long unitsPerMilli) {
    this.millisPerUnit = millisPerUnit;
    this.unitsPerMilli = unitsPerMilli;
  }

  /**
   * Converts a client time to epoch milliseconds.
   *
   * @throws IllegalArgumentException if the result does not fit in a long
   */
  public long toMillis(long value) {
    if (unitsPerMilli > 1) {
      return Math.floorDiv(value, unitsPerMilli);
    }
    return scale(value, millisPerUnit);
  }

  /**
   * Converts epoch milliseconds to this precision.
   *
   * @throws IllegalArgumentException if the result does not fit in a long
   */
  public long fromMillis(long millis) {
    if (millisPerUnit > 1) {
      return Math.floorDiv(millis, millisPerUnit);
    }
    return scale(millis, unitsPerMilli);
  }

  private long scale(long value, long factor) {
    try {
      return Math.multiplyExact(value, factor);
    } catch (ArithmeticException ex) {
      throw new IllegalArgumentException("Time " + value + " is out of range for precision "
          + name().toLowerCase(Locale.ROOT), ex);
    }
  }

  public static TimePrecision parse(String value) {
    return TimePrecision.valueOf(value.toUpperCase(Locale.ROOT));
  }
}
