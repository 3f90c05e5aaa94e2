package com.ospicorp.tsdb.continuous.service;

import com.ospicorp.tsdb.config.TsdbProperties;
import com.ospicorp.tsdb.continuous.model.ContinuousQuery;
import com.ospicorp.tsdb.continuous.model.ContinuousQueryKind;
import com.ospicorp.tsdb.continuous.model.ContinuousQueryView;
import com.ospicorp.tsdb.database.DatabaseDroppedEvent;
import com.ospicorp.tsdb.database.service.DatabaseService;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.engine.EvaluationContext;
import com.ospicorp.tsdb.query.engine.QueryEngine;
import com.ospicorp.tsdb.query.engine.TimeBuckets;
import com.ospicorp.tsdb.query.engine.TimeRange;
import com.ospicorp.tsdb.query.parser.QueryParser;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.model.SeriesWrite;
import com.ospicorp.tsdb.series.model.TimePrecision;
import com.ospicorp.tsdb.series.repository.PointStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Registry and runner of continuous queries.
 *
 * <p>A query with {@code into} first covers everything from its lower bound (or the epoch) up
 * to now, then on every run the span since the previous one: from the start of the current
 * bucket when grouped by time, from just after the previous run otherwise. A stream
 * subscription starts with the query's default window and then proceeds the same way.
 */
@Service
public class ContinuousQueryService {
  private static final Logger log = LoggerFactory.getLogger(ContinuousQueryService.class);

  private final PointStore store;
  private final QueryEngine engine;
  private final DatabaseService databases;
  private final TsdbProperties.ContinuousQueries properties;
  private final Clock clock;
  private final Counter runCounter;
  private final Counter failureCounter;
  private final Map<Long, Registration> registry = new ConcurrentHashMap<>();
  private final AtomicLong ids = new AtomicLong();

  public ContinuousQueryService(PointStore store, QueryEngine engine, DatabaseService databases,
      TsdbProperties properties, Clock clock, MeterRegistry meterRegistry) {
    this.store = store;
    this.engine = engine;
    this.databases = databases;
    this.properties = properties.continuousQueries();
    this.clock = clock;
    this.runCounter = meterRegistry.counter("tsdb.continuous_queries.runs", "outcome", "success");
    this.failureCounter =
        meterRegistry.counter("tsdb.continuous_queries.runs", "outcome", "failure");
  }

  public ContinuousQueryView register(String database, String query, TimePrecision precision) {
    return register(database, QueryParser.parseSelect(query), query, precision);
  }

  /** Registers a query with {@code into} and runs it once before returning. */
  public ContinuousQueryView register(String database, SelectStatement statement, String query,
      TimePrecision precision) {
    databases.require(database);
    if (!statement.isContinuous()) {
      throw new IllegalArgumentException("A continuous query needs an into clause");
    }
    if (QueryEngine.isAggregated(statement) && !statement.groupedByTime()) {
      throw new IllegalArgumentException(
          "A continuous query must be a raw query or group by time(...)");
    }
    String sample = SeriesSink.target(statement.into(), "x");
    if (!sample.matches(SeriesWrite.SERIES_NAME_REGEX)) {
      throw new IllegalArgumentException("Invalid into target: " + statement.into());
    }
    ContinuousQuery continuousQuery = new ContinuousQuery(ids.incrementAndGet(), database, query,
        statement, ContinuousQueryKind.SERIES, clock.instant());
    Registration registration =
        new Registration(continuousQuery, new SeriesSink(store), precision);
    start(registration);
    log.info("Registered continuous query {} on database {} into {}", continuousQuery.id(),
        database, statement.into());
    return continuousQuery.view();
  }

  /** Opens a subscription that receives the query's results as server-sent events. */
  public SseEmitter subscribe(String database, SelectStatement statement, String query,
      TimePrecision precision) {
    databases.require(database);
    if (statement.isContinuous()) {
      throw new IllegalArgumentException("A streamed query cannot use into");
    }
    SseEmitter emitter = new SseEmitter(properties.streamTimeout().toMillis());
    ContinuousQuery continuousQuery = new ContinuousQuery(ids.incrementAndGet(), database, query,
        statement, ContinuousQueryKind.STREAM, clock.instant());
    long id = continuousQuery.id();
    emitter.onCompletion(() -> remove(id));
    emitter.onTimeout(() -> {
      log.debug("Stream {} timed out", id);
      remove(id);
      emitter.complete();
    });
    emitter.onError(ex -> remove(id));
    start(new Registration(continuousQuery, new EmitterSink(emitter, precision), precision));
    log.info("Opened stream {} on database {}", id, database);
    return emitter;
  }

  public List<ContinuousQueryView> list(String database) {
    databases.require(database);
    return registry.values().stream()
        .map(Registration::query)
        .filter(query -> query.database().equals(database))
        .sorted(Comparator.comparingLong(ContinuousQuery::id))
        .map(ContinuousQuery::view)
        .toList();
  }

  public void stop(String database, long id) {
    Registration registration = registry.get(id);
    if (registration == null || !registration.query().database().equals(database)) {
      throw new NoSuchElementException("Continuous query not found: " + id);
    }
    stop(registration);
    log.info("Stopped continuous query {} on database {}", id, database);
  }

  /** Runs every registered query once; failures are logged and do not stop the others. */
  public void runAll() {
    Instant now = clock.instant();
    for (Registration registration : List.copyOf(registry.values())) {
      try {
        run(registration, now);
      } catch (RuntimeException ex) {
        failureCounter.increment();
        log.warn("Continuous query {} on database {} failed: {}",
            registration.query().id(), registration.query().database(), ex.getMessage());
      }
    }
  }

  public int size() {
    return registry.size();
  }

  @EventListener
  public void onDatabaseDropped(DatabaseDroppedEvent event) {
    List<Registration> dropped = registry.values().stream()
        .filter(registration -> registration.query().database().equals(event.database()))
        .toList();
    dropped.forEach(this::stop);
    if (!dropped.isEmpty()) {
      log.info("Stopped {} continuous queries of dropped database {}", dropped.size(),
          event.database());
    }
  }

  private void start(Registration registration) {
    registry.put(registration.query().id(), registration);
    try {
      run(registration, clock.instant());
    } catch (RuntimeException ex) {
      registry.remove(registration.query().id());
      registration.query().stop();
      throw ex;
    }
  }

  private void run(Registration registration, Instant at) {
    ContinuousQuery query = registration.query();
    synchronized (query) {
      if (query.stopped()) {
        return;
      }
      long now = at.toEpochMilli();
      SelectStatement statement = query.statement().withoutInto();
      if (query.kind() == ContinuousQueryKind.SERIES && statement.limit() == null) {
        statement = statement.withLimit(Integer.MAX_VALUE);
      }
      EvaluationContext context = EvaluationContext.at(now, registration.precision());
      TimeRange window = window(query, statement, context);

      List<SeriesResult> results = window != null && window.isEmpty()
          ? List.of()
          : engine.select(query.database(), statement,
              window == null ? context : context.withWindow(window));
      List<SeriesResult> fresh = results.stream()
          .filter(result -> !query.targets().contains(result.name()))
          .toList();
      boolean open = registration.sink().accept(query, fresh, window);

      long resumeFrom = statement.groupedByTime()
          ? TimeBuckets.bucketStart(now, statement.groupBy().intervalMillis())
          : now + 1;
      query.completed(at, resumeFrom);
      runCounter.increment();
      log.debug("Continuous query {} ran over {} and produced {} series", query.id(), window,
          fresh.size());
      if (!open) {
        stop(registration);
      }
    }
  }

  private TimeRange window(ContinuousQuery query, SelectStatement statement,
      EvaluationContext context) {
    if (query.kind() == ContinuousQueryKind.STREAM && !query.started()) {
      return null;
    }
    TimeRange bounds = engine.bounds(statement, context);
    long from;
    if (query.started()) {
      from = Math.max(query.resumeFrom(), bounds.from());
    } else {
      from = bounds.hasLowerBound() ? bounds.from() : 0;
    }
    return new TimeRange(from, Math.min(context.now(), bounds.to()));
  }

  private void remove(long id) {
    Registration registration = registry.remove(id);
    if (registration != null) {
      registration.query().stop();
    }
  }

  private void stop(Registration registration) {
    registry.remove(registration.query().id());
    registration.query().stop();
    registration.sink().close();
  }

  private record Registration(ContinuousQuery query, ContinuousQuerySink sink,
      TimePrecision precision) {}
}
