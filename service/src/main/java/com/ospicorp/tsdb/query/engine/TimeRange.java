package com.ospicorp.tsdb.query.engine;

/** Inclusive range of epoch milliseconds. */
public record TimeRange(long from, long to) {

  public static final TimeRange UNBOUNDED = new TimeRange(Long.MIN_VALUE, Long.MAX_VALUE);

  public boolean hasLowerBound() {
    return from != Long.MIN_VALUE;
  }

  public boolean hasUpperBound() {
    return to != Long.MAX_VALUE;
  }

  public boolean isEmpty() {
    return from > to;
  }

  public boolean contains(long time) {
    return time >= from && time <= to;
  }

  public TimeRange intersect(TimeRange other) {
    return new TimeRange(Math.max(from, other.from), Math.min(to, other.to));
  }

  public TimeRange withFrom(long newFrom) {
    return new TimeRange(newFrom, to);
  }

  public TimeRange withTo(long newTo) {
    return new TimeRange(from, newTo);
  }
}
