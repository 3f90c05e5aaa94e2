package com.ospicorp.tsdb.query.ast;

import java.time.Duration;
import java.util.List;

/**
 * @param interval time bucket width, or {@code null} when not grouping by time
 * @param columns column names whose values split the results
 */
public record GroupBy(Duration interval, List<String> columns) {

  public GroupBy {
    columns = List.copyOf(columns);
  }

  public boolean byTime() {
    return interval != null;
  }

  public long intervalMillis() {
    return interval == null ? 0 : interval.toMillis();
  }
}
