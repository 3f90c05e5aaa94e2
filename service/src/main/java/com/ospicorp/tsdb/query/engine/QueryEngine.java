package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.config.TsdbProperties;
import com.ospicorp.tsdb.query.Functions;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.DeleteStatement;
import com.ospicorp.tsdb.query.ast.Expr;
import com.ospicorp.tsdb.query.ast.FieldRef;
import com.ospicorp.tsdb.query.ast.Fill;
import com.ospicorp.tsdb.query.ast.GroupBy;
import com.ospicorp.tsdb.query.ast.JoinSource;
import com.ospicorp.tsdb.query.ast.MergeSource;
import com.ospicorp.tsdb.query.ast.NumberLiteral;
import com.ospicorp.tsdb.query.ast.RegexSource;
import com.ospicorp.tsdb.query.ast.SelectField;
import com.ospicorp.tsdb.query.ast.SelectStatement;
import com.ospicorp.tsdb.query.ast.SeriesSource;
import com.ospicorp.tsdb.query.ast.Source;
import com.ospicorp.tsdb.query.ast.Star;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.repository.PointStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Evaluates parsed statements against the {@link PointStore}.
 *
 * <p>Result times are epoch milliseconds; rendering in the client's precision happens at the
 * HTTP layer.
 */
@Service
public class QueryEngine {

  public static final String ORIGIN_COLUMN = "_orig_series";

  private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

  private final PointStore store;
  private final TsdbProperties.Query defaults;
  private final Counter selects;
  private final Counter deletes;

  public QueryEngine(PointStore store, TsdbProperties properties, MeterRegistry meterRegistry) {
    this.store = store;
    this.defaults = properties.query();
    this.selects = meterRegistry.counter("tsdb.queries", "type", "select");
    this.deletes = meterRegistry.counter("tsdb.queries", "type", "delete");
  }

  public List<SeriesResult> select(String database, SelectStatement statement,
      EvaluationContext context) {
    selects.increment();
    TimeRange range = scanRange(statement, context);
    boolean aggregated = isAggregated(statement);
    List<SeriesResult> results = new ArrayList<>();
    for (SeriesStream stream : streams(database, statement, range)) {
      List<DataPoint> points = new ArrayList<>(stream.points().size());
      for (DataPoint point : stream.points()) {
        if (ExpressionEvaluator.matches(statement.where(), point, context)) {
          points.add(point);
        }
      }
      if (points.isEmpty() && statement.source() instanceof RegexSource) {
        continue;
      }
      results.add(aggregated
          ? aggregate(stream, points, statement, range, context)
          : raw(stream, points, statement, context));
    }
    log.debug("Query on {} over [{}, {}] returned {} series", database, range.from(), range.to(),
        results.size());
    return results;
  }

  public long delete(String database, DeleteStatement statement, EvaluationContext context) {
    deletes.increment();
    TimeRange range = TimeExpressions.strictRange(statement.where(), context);
    if (range.isEmpty()) {
      return 0;
    }
    List<String> targets;
    if (statement.source() instanceof SeriesSource named) {
      requireSeries(database, named.name());
      targets = List.of(named.name());
    } else {
      RegexSource regex = (RegexSource) statement.source();
      targets = store.listSeries(database).stream()
          .map(SeriesInfo::name)
          .filter(regex::matches)
          .toList();
    }
    long deleted = 0;
    for (String series : targets) {
      deleted += store.deleteRange(database, series, range.from(), range.to());
    }
    log.info("Deleted {} points from {} series in database {}", deleted, targets.size(), database);
    return deleted;
  }

  /** Bounds written in the query itself, without the default window. */
  public TimeRange bounds(SelectStatement statement, EvaluationContext context) {
    return TimeExpressions.range(statement.where(), context);
  }

  public static boolean isAggregated(SelectStatement statement) {
    return statement.groupBy() != null || statement.fields().stream()
        .anyMatch(field -> Functions.containsAggregate(field.expr()));
  }

  TimeRange scanRange(SelectStatement statement, EvaluationContext context) {
    TimeRange range = bounds(statement, context);
    if (context.window() != null) {
      return range.intersect(context.window());
    }
    if (!range.hasLowerBound()) {
      range = range.withFrom(context.now() - defaults.defaultWindow().toMillis());
    }
    return range;
  }

  private List<SeriesStream> streams(String database, SelectStatement statement,
      TimeRange range) {
    Source source = statement.source();
    if (source instanceof SeriesSource named) {
      SeriesInfo info = requireSeries(database, named.name());
      return List.of(new SeriesStream(info.name(), info.columns(), scan(database, info, range)));
    }
    if (source instanceof RegexSource regex) {
      List<SeriesStream> streams = new ArrayList<>();
      for (SeriesInfo info : store.listSeries(database)) {
        if (regex.matches(info.name())) {
          streams.add(new SeriesStream(info.name(), info.columns(), scan(database, info, range)));
        }
      }
      return streams;
    }
    if (source instanceof MergeSource merge) {
      return List.of(merge(database, merge, range));
    }
    return List.of(join(database, (JoinSource) source, statement.groupBy(), range));
  }

  private SeriesStream merge(String database, MergeSource merge, TimeRange range) {
    Set<String> columns = new LinkedHashSet<>();
    List<DataPoint> points = new ArrayList<>();
    for (String name : merge.series()) {
      SeriesInfo info = requireSeries(database, name);
      columns.addAll(info.columns());
      for (DataPoint point : scan(database, info, range)) {
        Map<String, Object> fields = new LinkedHashMap<>(point.fields());
        fields.put(ORIGIN_COLUMN, name);
        points.add(new DataPoint(point.time(), point.sequenceNumber(), fields));
      }
    }
    columns.add(ORIGIN_COLUMN);
    points.sort(DataPoint.CHRONOLOGICAL);
    return new SeriesStream(merge.resultName(), List.copyOf(columns), points);
  }

  /**
   * Pairs the latest point of each side per timestamp, or per time bucket when the query
   * groups by time. Keys missing on either side are dropped.
   */
  private SeriesStream join(String database, JoinSource join, GroupBy groupBy, TimeRange range) {
    SeriesInfo left = requireSeries(database, join.left());
    SeriesInfo right = requireSeries(database, join.right());
    long width = groupBy == null ? 0 : groupBy.intervalMillis();
    Map<Long, DataPoint> leftPoints = latestPerKey(scan(database, left, range), width);
    Map<Long, DataPoint> rightPoints = latestPerKey(scan(database, right, range), width);

    List<String> columns = new ArrayList<>();
    left.columns().forEach(column -> columns.add(join.leftAlias() + "." + column));
    right.columns().forEach(column -> columns.add(join.rightAlias() + "." + column));

    List<DataPoint> points = new ArrayList<>();
    leftPoints.forEach((key, leftPoint) -> {
      DataPoint rightPoint = rightPoints.get(key);
      if (rightPoint == null) {
        return;
      }
      Map<String, Object> fields = new LinkedHashMap<>();
      leftPoint.fields().forEach(
          (column, value) -> fields.put(join.leftAlias() + "." + column, value));
      rightPoint.fields().forEach(
          (column, value) -> fields.put(join.rightAlias() + "." + column, value));
      long sequence = Math.max(leftPoint.sequenceNumber(), rightPoint.sequenceNumber());
      points.add(new DataPoint(key, sequence, fields));
    });
    return new SeriesStream(join.resultName(), columns, points);
  }

  private static Map<Long, DataPoint> latestPerKey(List<DataPoint> points, long width) {
    Map<Long, DataPoint> latest = new TreeMap<>();
    for (DataPoint point : points) {
      long key = width > 0 ? TimeBuckets.bucketStart(point.time(), width) : point.time();
      latest.put(key, point);
    }
    return latest;
  }

  private SeriesResult raw(SeriesStream stream, List<DataPoint> points,
      SelectStatement statement, EvaluationContext context) {
    List<String> columns = new ArrayList<>();
    List<Expr> expressions = new ArrayList<>();
    List<SelectField> fields = statement.fields();
    for (int i = 0; i < fields.size(); i++) {
      SelectField field = fields.get(i);
      if (field.expr() instanceof Star) {
        for (String column : stream.columns()) {
          columns.add(column);
          expressions.add(new FieldRef(column));
        }
      } else {
        columns.add(ColumnNames.of(field, i));
        expressions.add(field.expr());
      }
    }
    int timeIndex = columns.size();
    columns.add(SeriesResult.TIME);
    columns.add(SeriesResult.SEQUENCE_NUMBER);

    List<DataPoint> ordered = new ArrayList<>(points);
    if (!statement.ascending()) {
      Collections.reverse(ordered);
    }
    int limit = limit(statement);
    List<List<Object>> rows = new ArrayList<>(Math.min(limit, ordered.size()));
    for (DataPoint point : ordered) {
      if (rows.size() >= limit) {
        break;
      }
      ExpressionEvaluator.Scope scope = ExpressionEvaluator.pointScope(point);
      List<Object> row = new ArrayList<>(columns.size());
      for (Expr expr : expressions) {
        row.add(ExpressionEvaluator.evaluate(expr, scope, context));
      }
      row.add(point.time());
      row.add(point.sequenceNumber());
      rows.add(row);
    }
    return new SeriesResult(stream.name(), columns, rows, timeIndex);
  }

  private SeriesResult aggregate(SeriesStream stream, List<DataPoint> points,
      SelectStatement statement, TimeRange range, EvaluationContext context) {
    List<SelectField> fields = statement.fields();
    for (SelectField field : fields) {
      if (field.expr() instanceof Star) {
        throw new IllegalArgumentException("* cannot be selected in an aggregated query");
      }
    }
    GroupBy groupBy = statement.groupBy();
    List<String> groupColumns = groupBy == null ? List.of() : groupBy.columns();
    long width = groupBy == null ? 0 : groupBy.intervalMillis();

    Map<List<Object>, List<DataPoint>> groups = new LinkedHashMap<>();
    for (DataPoint point : points) {
      List<Object> key = new ArrayList<>(groupColumns.size());
      for (String column : groupColumns) {
        key.add(point.get(column));
      }
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(point);
    }
    Call top = topCall(fields);
    if (top != null) {
      groups = top(groups, top, context);
    }

    Fill fill = statement.fill();
    NavigableSet<Long> span = new TreeSet<>();
    if (width > 0 && fill.mode() != Fill.Mode.NONE) {
      if (groups.isEmpty() && groupColumns.isEmpty()) {
        groups.put(new ArrayList<>(), new ArrayList<>());
      }
      span = fillSpan(points, range, width, context, groups.size());
    }

    List<Row> rows = new ArrayList<>();
    for (Map.Entry<List<Object>, List<DataPoint>> group : groups.entrySet()) {
      List<Object> key = group.getKey();
      List<DataPoint> members = group.getValue();
      if (width == 0) {
        long time = members.get(members.size() - 1).time();
        rows.add(new Row(time, key, evaluate(fields, groupColumns, key, time, members, context)));
        continue;
      }
      TreeMap<Long, List<DataPoint>> buckets = new TreeMap<>();
      for (DataPoint point : members) {
        buckets.computeIfAbsent(TimeBuckets.bucketStart(point.time(), width),
            bucket -> new ArrayList<>()).add(point);
      }
      NavigableSet<Long> times = new TreeSet<>(span);
      times.addAll(buckets.keySet());
      List<Object> previous = null;
      for (long time : times) {
        List<DataPoint> bucket = buckets.get(time);
        List<Object> values = bucket != null
            ? evaluate(fields, groupColumns, key, time, bucket, context)
            : filled(fill, previous, fields.size());
        previous = values;
        rows.add(new Row(time, key, values));
      }
    }

    Comparator<Row> order = Comparator.comparingLong(Row::time);
    if (!statement.ascending()) {
      order = order.reversed();
    }
    rows.sort(order.thenComparing(Row::group, QueryEngine::compareGroups));

    List<String> columns = new ArrayList<>();
    for (int i = 0; i < fields.size(); i++) {
      columns.add(ColumnNames.of(fields.get(i), i));
    }
    int timeIndex = columns.size();
    columns.add(SeriesResult.TIME);
    columns.addAll(groupColumns);

    int limit = limit(statement);
    List<List<Object>> datapoints = new ArrayList<>(Math.min(limit, rows.size()));
    for (Row row : rows.subList(0, Math.min(limit, rows.size()))) {
      List<Object> datapoint = new ArrayList<>(columns.size());
      datapoint.addAll(row.values());
      datapoint.add(row.time());
      datapoint.addAll(row.group());
      datapoints.add(datapoint);
    }
    return new SeriesResult(stream.name(), columns, datapoints, timeIndex);
  }

  private List<Object> evaluate(List<SelectField> fields, List<String> groupColumns,
      List<Object> key, long time, List<DataPoint> members, EvaluationContext context) {
    DataPoint latest = members.get(members.size() - 1);
    ExpressionEvaluator.Scope scope = new ExpressionEvaluator.Scope() {
      @Override
      public Object column(String name) {
        int index = groupColumns.indexOf(name);
        return index >= 0 ? key.get(index) : latest.get(name);
      }

      @Override
      public long time() {
        return time;
      }

      @Override
      public Object aggregate(Call call) {
        return Aggregators.compute(call, members, context);
      }
    };
    List<Object> values = new ArrayList<>(fields.size());
    for (SelectField field : fields) {
      values.add(ExpressionEvaluator.evaluate(field.expr(), scope, context));
    }
    return values;
  }

  private static Call topCall(List<SelectField> fields) {
    for (SelectField field : fields) {
      if (field.expr() instanceof Call call && Functions.TOP.equals(call.name())) {
        return call;
      }
    }
    return null;
  }

  /** Keeps the groups ranked highest by the aggregate of {@code top(n, aggregate)}. */
  private static Map<List<Object>, List<DataPoint>> top(Map<List<Object>, List<DataPoint>> groups,
      Call top, EvaluationContext context) {
    long n = ((NumberLiteral) top.argument(0)).value().longValue();
    Call aggregate = (Call) top.argument(1);
    Map<List<Object>, Object> scores = new LinkedHashMap<>();
    groups.forEach((key, members) ->
        scores.put(key, Aggregators.compute(aggregate, members, context)));
    List<List<Object>> ranked = new ArrayList<>(groups.keySet());
    ranked.sort((a, b) -> {
      Object scoreA = scores.get(a);
      Object scoreB = scores.get(b);
      if (scoreA == null || scoreB == null) {
        return scoreA == null ? (scoreB == null ? compareGroups(a, b) : 1) : -1;
      }
      int byScore = Values.compare(scoreB, scoreA);
      return byScore != 0 ? byScore : compareGroups(a, b);
    });
    Map<List<Object>, List<DataPoint>> kept = new LinkedHashMap<>();
    for (List<Object> key : ranked.subList(0, (int) Math.min(n, ranked.size()))) {
      kept.put(key, groups.get(key));
    }
    return kept;
  }

  private NavigableSet<Long> fillSpan(List<DataPoint> points, TimeRange range, long width,
      EvaluationContext context, int groupCount) {
    if (!range.hasLowerBound() && points.isEmpty()) {
      return new TreeSet<>();
    }
    long from = range.hasLowerBound() || points.isEmpty() ? range.from() : points.get(0).time();
    long to = Math.min(range.to(), context.now());
    long buckets = TimeBuckets.count(from, to, width);
    if (buckets * Math.max(1, groupCount) > defaults.maxBuckets()) {
      throw new IllegalArgumentException("fill() would produce "
          + buckets * Math.max(1, groupCount) + " rows, more than the allowed "
          + defaults.maxBuckets() + "; narrow the time range");
    }
    NavigableSet<Long> span = new TreeSet<>();
    if (buckets > 0) {
      for (long time = TimeBuckets.bucketStart(from, width); time <= to; time += width) {
        span.add(time);
      }
    }
    return span;
  }

  private static List<Object> filled(Fill fill, List<Object> previous, int size) {
    return switch (fill.mode()) {
      case PREVIOUS -> previous != null ? previous : Collections.nCopies(size, null);
      case VALUE -> Collections.nCopies(size, fill.value());
      default -> Collections.nCopies(size, null);
    };
  }

  private static int compareGroups(List<Object> a, List<Object> b) {
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      int result = Values.compare(a.get(i), b.get(i));
      if (result != 0) {
        return result;
      }
    }
    return Integer.compare(a.size(), b.size());
  }

  private int limit(SelectStatement statement) {
    return statement.limit() != null ? statement.limit() : defaults.defaultLimit();
  }

  private SeriesInfo requireSeries(String database, String series) {
    return store.series(database, series)
        .orElseThrow(() -> new NoSuchElementException("Series not found: " + series));
  }

  private List<DataPoint> scan(String database, SeriesInfo series, TimeRange range) {
    if (range.isEmpty()) {
      return List.of();
    }
    return store.scan(database, series.name(), range.from(), range.to());
  }

  private record Row(long time, List<Object> group, List<Object> values) {}
}
