package com.ospicorp.tsdb.series.model;

import java.util.Comparator;
import java.util.Map;

/**
 * A stored point: epoch-millisecond time, store-assigned sequence number and column values.
 * A sequence number of {@code 0} marks a point the store has not numbered yet.
 */
public record DataPoint(long time, long sequenceNumber, Map<String, Object> fields) {

  public static final Comparator<DataPoint> CHRONOLOGICAL = Comparator
      .comparingLong(DataPoint::time)
      .thenComparingLong(DataPoint::sequenceNumber);

  public Object get(String column) {
    return fields.get(column);
  }

  public DataPoint withSequenceNumber(long sequenceNumber) {
    return new DataPoint(time, sequenceNumber, fields);
  }
}
