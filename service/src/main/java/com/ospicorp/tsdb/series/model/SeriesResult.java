package com.ospicorp.tsdb.series.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * A named result series. Inside the engine every {@code time} column holds epoch milliseconds;
 * {@link #inPrecision(TimePrecision)} converts them for rendering. {@code timeIndex} is the
 * position of the point time the engine appends, which a selected {@code time} field may
 * precede.
 */
public record SeriesResult(
    @JsonProperty("series") String name,
    List<String> columns,
    List<List<Object>> datapoints,
    @JsonIgnore int timeIndex
) {
  public static final String TIME = "time";
  public static final String SEQUENCE_NUMBER = "sequence_number";

  public SeriesResult {
    if (timeIndex < 0 || timeIndex >= columns.size() || !TIME.equals(columns.get(timeIndex))) {
      throw new IllegalArgumentException(
          "Column " + timeIndex + " of " + columns + " is not the point time");
    }
  }

  public SeriesResult inPrecision(TimePrecision precision) {
    if (precision == TimePrecision.MS) {
      return this;
    }
    List<Integer> timeColumns = new ArrayList<>();
    for (int i = 0; i < columns.size(); i++) {
      if (TIME.equals(columns.get(i))) {
        timeColumns.add(i);
      }
    }
    List<List<Object>> converted = new ArrayList<>(datapoints.size());
    for (List<Object> row : datapoints) {
      List<Object> copy = new ArrayList<>(row);
      for (int index : timeColumns) {
        if (copy.get(index) instanceof Long millis) {
          copy.set(index, precision.fromMillis(millis));
        }
      }
      converted.add(copy);
    }
    return new SeriesResult(name, columns, converted, timeIndex);
  }
}
