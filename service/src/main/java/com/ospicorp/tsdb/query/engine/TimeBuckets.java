package com.ospicorp.tsdb.query.engine;

/** Epoch-aligned bucketing for {@code group_by time(...)}. */
public final class TimeBuckets {

  private TimeBuckets() {
  }

  public static long bucketStart(long time, long width) {
    return time - Math.floorMod(time, width);
  }

  /** Number of buckets between the buckets of {@code from} and {@code to}, both included. */
  public static long count(long from, long to, long width) {
    if (from > to) {
      return 0;
    }
    long first = bucketStart(from, width);
    long last = bucketStart(to, width);
    return (last - first) / width + 1;
  }
}
