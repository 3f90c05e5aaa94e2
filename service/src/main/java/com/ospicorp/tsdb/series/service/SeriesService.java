package com.ospicorp.tsdb.series.service;

import com.ospicorp.tsdb.database.service.DatabaseService;
import com.ospicorp.tsdb.query.ast.DeleteStatement;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.engine.EvaluationContext;
import com.ospicorp.tsdb.query.engine.QueryEngine;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.model.SeriesWrite;
import com.ospicorp.tsdb.series.model.TimePrecision;
import com.ospicorp.tsdb.series.model.WriteSummary;
import com.ospicorp.tsdb.series.repository.PointStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SeriesService {
  private static final Logger log = LoggerFactory.getLogger(SeriesService.class);

  private final PointStore store;
  private final QueryEngine engine;
  private final DatabaseService databases;
  private final Clock clock;
  private final Counter pointsWritten;

  public SeriesService(PointStore store, QueryEngine engine, DatabaseService databases,
      Clock clock, MeterRegistry meterRegistry) {
    this.store = store;
    this.engine = engine;
    this.databases = databases;
    this.clock = clock;
    this.pointsWritten = meterRegistry.counter("tsdb.points.written");
  }

  /** Validates the whole body before storing any of it. */
  public WriteSummary write(String database, List<SeriesWrite> writes, TimePrecision precision) {
    databases.require(database);
    if (writes == null) {
      throw new IllegalArgumentException("Request body must be an array of series");
    }
    long now = clock.millis();
    Map<String, List<DataPoint>> bySeries = new LinkedHashMap<>();
    for (SeriesWrite write : writes) {
      if (write == null) {
        throw new IllegalArgumentException("Series entries must not be null");
      }
      bySeries.computeIfAbsent(write.series(), key -> new ArrayList<>())
          .addAll(PointParser.parse(write, precision, now));
    }
    int points = 0;
    for (Map.Entry<String, List<DataPoint>> entry : bySeries.entrySet()) {
      if (entry.getValue().isEmpty()) {
        continue;
      }
      points += store.write(database, entry.getKey(), entry.getValue()).size();
    }
    pointsWritten.increment(points);
    log.debug("Wrote {} points to {} series in database {}", points, bySeries.size(), database);
    return new WriteSummary(bySeries.size(), points);
  }

  public List<SeriesResult> query(String database, SelectStatement statement,
      TimePrecision precision) {
    databases.require(database);
    EvaluationContext context = EvaluationContext.at(clock.millis(), precision);
    return engine.select(database, statement, context).stream()
        .map(result -> result.inPrecision(precision))
        .toList();
  }

  public List<SeriesInfo> list(String database) {
    databases.require(database);
    return store.listSeries(database);
  }

  public long delete(String database, DeleteStatement statement, TimePrecision precision) {
    databases.require(database);
    return engine.delete(database, statement, EvaluationContext.at(clock.millis(), precision));
  }
}
