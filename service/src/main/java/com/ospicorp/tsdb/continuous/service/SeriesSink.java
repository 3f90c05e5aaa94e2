package com.ospicorp.tsdb.continuous.service;

import com.ospicorp.tsdb.continuous.model.ContinuousQuery;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.engine.TimeBuckets;
import com.ospicorp.tsdb.query.engine.TimeRange;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.repository.PointStore;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces the points of the {@code into} series inside the run window with the run's rows.
 * {@code :series_name} in the target stands for the name of each result series.
 */
class SeriesSink implements ContinuousQuerySink {

  static final String SERIES_NAME_PLACEHOLDER = ":series_name";

  private final PointStore store;

  SeriesSink(PointStore store) {
    this.store = store;
  }

  static String target(String into, String seriesName) {
    return into.replace(SERIES_NAME_PLACEHOLDER, seriesName);
  }

  @Override
  public boolean accept(ContinuousQuery query, List<SeriesResult> results, TimeRange window) {
    SelectStatement statement = query.statement();
    for (SeriesResult result : results) {
      String target = target(statement.into(), result.name());
      query.targets().add(target);
      if (window != null) {
        long from = statement.groupedByTime()
            ? TimeBuckets.bucketStart(window.from(), statement.groupBy().intervalMillis())
            : window.from();
        store.deleteRange(query.database(), target, from, window.to());
      }
      List<DataPoint> points = toPoints(result);
      if (!points.isEmpty()) {
        store.write(query.database(), target, points);
      }
    }
    return true;
  }

  private static List<DataPoint> toPoints(SeriesResult result) {
    int timeIndex = result.timeIndex();
    List<DataPoint> points = new ArrayList<>(result.datapoints().size());
    for (List<Object> row : result.datapoints()) {
      Map<String, Object> fields = new LinkedHashMap<>();
      for (int i = 0; i < result.columns().size(); i++) {
        String column = result.columns().get(i);
        if (SeriesResult.TIME.equals(column) || SeriesResult.SEQUENCE_NUMBER.equals(column)
            || row.get(i) == null) {
          continue;
        }
        fields.putIfAbsent(column, row.get(i));
      }
      points.add(new DataPoint(((Number) row.get(timeIndex)).longValue(), 0, fields));
    }
    return points;
  }
}
