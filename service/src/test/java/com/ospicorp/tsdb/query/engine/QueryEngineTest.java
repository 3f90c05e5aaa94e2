package com.ospicorp.tsdb.query.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ospicorp.tsdb.config.TsdbProperties;
import com.ospicorp.tsdb.query.ast.DeleteStatement;
import com.ospicorp.tsdb.query.parser.QueryParser;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.model.TimePrecision;
import com.ospicorp.tsdb.series.repository.InMemoryPointStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryEngineTest {

  private static final String DB = "metrics";
  private static final long NOW = 1_311_836_012_000L;
  private static final long HOUR = Duration.ofHours(1).toMillis();
  private static final long DAY = Duration.ofDays(1).toMillis();

  private InMemoryPointStore store;
  private QueryEngine engine;
  private final EvaluationContext context = EvaluationContext.at(NOW, TimePrecision.S);

  @BeforeEach
  void setUp() {
    store = new InMemoryPointStore();
    store.createDatabase(DB);
    engine = engine(1000, 100_000);
  }

  @Test
  void returnsPointsNewestFirstWithinTheRequestedRange() {
    double[] values = {1.0, 2.0, 3.0, 5.0, 6.0};
    for (int i = 0; i < values.length; i++) {
      write("cpu.idle", NOW - (4 - i) * 1000L, Map.of("value", values[i]));
    }
    write("cpu.idle", NOW - 2 * DAY, Map.of("value", 0.5));

    List<SeriesResult> results = select("select value from cpu.idle where time>now()-1d");

    assertThat(results).hasSize(1);
    SeriesResult result = results.get(0);
    assertThat(result.name()).isEqualTo("cpu.idle");
    assertThat(result.columns()).containsExactly("value", "time", "sequence_number");
    assertThat(result.datapoints()).extracting(row -> row.get(0))
        .containsExactly(6.0, 5.0, 3.0, 2.0, 1.0);
    assertThat(result.datapoints()).extracting(row -> row.get(1))
        .containsExactly(NOW, NOW - 1000, NOW - 2000, NOW - 3000, NOW - 4000);
  }

  @Test
  void selectedTimeConvertsAlongWithThePointTime() {
    write("cpu", NOW, Map.of("value", 1.0));

    SeriesResult result = select("select time, value from cpu").get(0);

    assertThat(result.columns()).containsExactly("time", "value", "time", "sequence_number");
    assertThat(result.timeIndex()).isEqualTo(2);
    SeriesResult seconds = result.inPrecision(TimePrecision.S);
    assertThat(seconds.datapoints().get(0)).containsExactly(NOW / 1000, 1.0, NOW / 1000, 1L);
  }

  @Test
  void orderAscReturnsOldestFirst() {
    write("cpu.idle", NOW - 2000, Map.of("value", 1.0));
    write("cpu.idle", NOW - 1000, Map.of("value", 2.0));

    SeriesResult result = select("select value from cpu.idle where time>now()-1d order asc")
        .get(0);

    assertThat(result.datapoints()).extracting(row -> row.get(0)).containsExactly(1.0, 2.0);
  }

  @Test
  void appliesDefaultWindowWithoutLowerBound() {
    write("cpu.idle", NOW - 2 * HOUR, Map.of("value", 1.0));
    write("cpu.idle", NOW - HOUR / 2, Map.of("value", 2.0));

    SeriesResult result = select("select value from cpu.idle").get(0);

    assertThat(result.datapoints()).extracting(row -> row.get(0)).containsExactly(2.0);
  }

  @Test
  void appliesDefaultLimit() {
    engine = engine(2, 100_000);
    for (int i = 0; i < 5; i++) {
      write("cpu.idle", NOW - i * 1000L, Map.of("value", (double) i));
    }

    SeriesResult result = select("select value from cpu.idle where time>now()-1d").get(0);

    assertThat(result.datapoints()).hasSize(2);
  }

  @Test
  void splitsGroupsByColumnValueAndTimeBucket() {
    write("users.events", NOW, Map.of("email", "paul@errplane.com", "type", "click"));
    write("users.events", NOW, Map.of("email", "todd@errplane.com", "type", "click"));
    write("users.events", NOW - 2 * DAY, Map.of("email", "paul@errplane.com", "type", "click"));

    SeriesResult result = select("select count(*) from users.events "
        + "group_by email,time(1h) where time>now()-7d").get(0);

    long current = TimeBuckets.bucketStart(NOW, HOUR);
    long older = TimeBuckets.bucketStart(NOW - 2 * DAY, HOUR);
    assertThat(result.columns()).containsExactly("count", "time", "email");
    assertThat(result.datapoints()).containsExactly(
        List.of(1L, current, "paul@errplane.com"),
        List.of(1L, current, "todd@errplane.com"),
        List.of(1L, older, "paul@errplane.com"));
  }

  @Test
  void topKeepsTheHighestRankedGroups() {
    String[] emails = {"a@x.io", "a@x.io", "a@x.io", "b@x.io", "b@x.io", "c@x.io"};
    for (int i = 0; i < emails.length; i++) {
      write("users.events", NOW - i * 1000L, Map.of("email", emails[i]));
    }

    SeriesResult result = select("select top(2, count(*)) from users.events "
        + "group_by email where time>now()-1d").get(0);

    assertThat(result.columns()).containsExactly("count", "time", "email");
    assertThat(result.datapoints()).extracting(row -> row.get(2))
        .containsExactlyInAnyOrder("a@x.io", "b@x.io");
    assertThat(result.datapoints()).extracting(row -> row.get(0))
        .containsExactlyInAnyOrder(3L, 2L);
  }

  @Test
  void regexSourceReturnsOneResultPerMatchingSeries() {
    write("cpu.idle", NOW - 2000, Map.of("value", 5.0));
    write("cpu.idle", NOW - 1000, Map.of("value", 6.0));
    write("mem.used", NOW - 500, Map.of("value", 42L));
    write("stale", NOW - 2 * DAY, Map.of("value", 1L));

    List<SeriesResult> results = select("select last(value) from /.*/ limit 1");

    assertThat(results).extracting(SeriesResult::name).containsExactly("cpu.idle", "mem.used");
    assertThat(results.get(0).columns()).containsExactly("value", "time");
    assertThat(results.get(0).datapoints()).containsExactly(List.of(6.0, NOW - 1000));
    assertThat(results.get(1).datapoints()).containsExactly(List.of(42L, NOW - 500));
  }

  @Test
  void mergeCombinesSeriesIntoOne() {
    write("newsletter.signups", NOW - 1000, Map.of("value", 1L));
    write("newsletter.signups", NOW - 500, Map.of("value", 1L));
    write("user.signups", NOW - 2000, Map.of("value", 1L));

    SeriesResult counted = select("select count(*) from merge(newsletter.signups,user.signups) "
        + "group_by time(1h) where time>now()-1d").get(0);
    assertThat(counted.name()).isEqualTo("newsletter.signups_merge_user.signups");
    assertThat(counted.datapoints())
        .containsExactly(List.of(3L, TimeBuckets.bucketStart(NOW, HOUR)));

    SeriesResult raw = select("select * from merge(newsletter.signups,user.signups) "
        + "where time>now()-1d").get(0);
    assertThat(raw.columns())
        .containsExactly("value", QueryEngine.ORIGIN_COLUMN, "time", "sequence_number");
    assertThat(raw.datapoints()).extracting(row -> row.get(1))
        .containsExactly("newsletter.signups", "newsletter.signups", "user.signups");
  }

  @Test
  void innerJoinPairsBucketsAndDiffsValues() {
    long minute = Duration.ofMinutes(1).toMillis();
    write("memory.total", NOW - minute, Map.of("value", 100L));
    write("memory.total", NOW, Map.of("value", 100L));
    write("memory.used", NOW - minute, Map.of("value", 40L));
    write("memory.used", NOW, Map.of("value", 55L));
    write("memory.used", NOW - 10 * minute, Map.of("value", 10L));

    SeriesResult result = select("select diff(t1.value, t2.value) "
        + "from inner_join(memory.total, t1, memory.used, t2) group_by time(1m) "
        + "where time>now()-6h").get(0);

    assertThat(result.name()).isEqualTo("memory.total_join_memory.used");
    assertThat(result.columns()).containsExactly("diff", "time");
    assertThat(result.datapoints()).containsExactly(
        List.of(45L, TimeBuckets.bucketStart(NOW, minute)),
        List.of(60L, TimeBuckets.bucketStart(NOW - minute, minute)));
  }

  @Test
  void countsDistinctValues() {
    write("user.events", NOW - 2000, Map.of("email", "paul@errplane.com"));
    write("user.events", NOW - 1000, Map.of("email", "todd@errplane.com"));
    write("user.events", NOW, Map.of("email", "paul@errplane.com"));

    SeriesResult result = select("select count(distinct(email)) from user.events "
        + "where time>now()-1d group_by time(15m)").get(0);

    assertThat(result.columns()).containsExactly("count", "time");
    assertThat(result.datapoints()).extracting(row -> row.get(0)).containsExactly(2L);
  }

  @Test
  void computesNearestRankPercentile() {
    for (int i = 1; i <= 100; i++) {
      write("response_times", NOW - i * 1000L, Map.of("value", (long) i));
    }

    SeriesResult result = select("select percentile(95, value) from response_times "
        + "group_by time(10m) where time>now()-6h").get(0);

    assertThat(result.columns()).containsExactly("percentile", "time");
    assertThat(result.datapoints()).extracting(row -> row.get(0)).containsExactly(95L);
  }

  @Test
  void filtersOnStringColumns() {
    write("events", NOW - 3000, Map.of("email", "paul@errplane.com", "type", "login"));
    write("events", NOW - 2000, Map.of("email", "todd@errplane.com", "type", "click"));
    write("events", NOW - 1000, Map.of("email", "todd@errplane.com", "type", "login"));

    SeriesResult result = select("select count(*) from events where type='login'").get(0);

    assertThat(result.datapoints()).containsExactly(List.of(2L, NOW - 1000));
  }

  @Test
  void appliesScalarArithmeticToEveryPoint() {
    write("cpu.idle", NOW - 1000, Map.of("value", 5.0));
    write("cpu.idle", NOW, Map.of("value", 6.0));

    SeriesResult result = select("select value * 2 from cpu.idle where time>now()-1d").get(0);

    assertThat(result.columns()).containsExactly("expr0", "time", "sequence_number");
    assertThat(result.datapoints()).extracting(row -> row.get(0)).containsExactly(12.0, 10.0);
  }

  @Test
  void fillsEmptyBucketsInsideTheRange() {
    write("cpu.idle", NOW, Map.of("value", 1.0));

    SeriesResult result = select("select count(*) from cpu.idle group_by time(1m) fill(0) "
        + "where time>now()-5m").get(0);

    assertThat(result.datapoints()).hasSize(6);
    assertThat(result.datapoints().get(0)).containsExactly(1L,
        TimeBuckets.bucketStart(NOW, Duration.ofMinutes(1).toMillis()));
    assertThat(result.datapoints().subList(1, 6)).extracting(row -> row.get(0))
        .containsOnly(0L);
  }

  @Test
  void refusesFillBeyondTheBucketLimit() {
    engine = engine(1000, 10);
    write("cpu.idle", NOW, Map.of("value", 1.0));

    assertThatThrownBy(() -> select("select count(*) from cpu.idle group_by time(1s) "
        + "fill(null) where time>now()-1h"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("fill()");
  }

  @Test
  void unknownSeriesIsReported() {
    assertThatThrownBy(() -> select("select value from nosuch"))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessageContaining("nosuch");
  }

  @Test
  void deletesTimeRangeOfNamedSeries() {
    for (int i = 0; i < 5; i++) {
      write("cpu.idle", NOW - i * 1000L, Map.of("value", (double) i));
    }

    long deleted = delete("delete from cpu.idle where time < now() - 2s");

    assertThat(deleted).isEqualTo(2);
    assertThat(store.scan(DB, "cpu.idle", Long.MIN_VALUE, Long.MAX_VALUE))
        .extracting(DataPoint::time)
        .containsExactly(NOW - 2000, NOW - 1000, NOW);
  }

  @Test
  void deletesEverythingFromSeriesMatchingRegex() {
    write("cpu.idle", NOW, Map.of("value", 1.0));
    write("cpu.user", NOW, Map.of("value", 2.0));
    write("mem.used", NOW, Map.of("value", 3.0));

    long deleted = delete("delete from /^cpu\\./");

    assertThat(deleted).isEqualTo(2);
    assertThat(store.listSeries(DB)).extracting(SeriesInfo::name).containsExactly("mem.used");
  }

  @Test
  void deleteAcceptsOnlyTimeConditions() {
    write("cpu.idle", NOW, Map.of("value", 1.0));

    assertThatThrownBy(() -> delete("delete from cpu.idle where value > 0"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private QueryEngine engine(int defaultLimit, int maxBuckets) {
    TsdbProperties properties = new TsdbProperties(
        new TsdbProperties.Query(defaultLimit, Duration.ofHours(1), maxBuckets),
        new TsdbProperties.ContinuousQueries(Duration.ofSeconds(10), Duration.ofMinutes(30)),
        new TsdbProperties.Security(""),
        new TsdbProperties.Storage("memory"));
    return new QueryEngine(store, properties, new SimpleMeterRegistry());
  }

  private void write(String series, long time, Map<String, Object> fields) {
    store.write(DB, series, List.of(new DataPoint(time, 0, fields)));
  }

  private List<SeriesResult> select(String query) {
    return engine.select(DB, QueryParser.parseSelect(query), context);
  }

  private long delete(String query) {
    return engine.delete(DB, (DeleteStatement) QueryParser.parse(query), context);
  }
}
