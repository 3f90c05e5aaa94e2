package com.ospicorp.tsdb.series.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesWrite;
import com.ospicorp.tsdb.series.model.TimePrecision;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PointParserTest {

  private static final long NOW = 1_311_836_012_000L;
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void readsRowsAgainstExtraColumns() throws Exception {
    SeriesWrite write = new SeriesWrite("users.events", null, List.of("email", "type"),
        rows("[[1311836012, \"paul@errplane.com\", \"click\"],"
            + "[1311836012, \"todd@errplane.com\", \"click\"]]"));

    List<DataPoint> points = PointParser.parse(write, TimePrecision.S, NOW);

    assertThat(points).hasSize(2);
    assertThat(points.get(0).time()).isEqualTo(1_311_836_012_000L);
    assertThat(points.get(0).sequenceNumber()).isZero();
    assertThat(points.get(0).fields())
        .containsExactly(Map.entry("email", "paul@errplane.com"), Map.entry("type", "click"));
  }

  @Test
  void readsTimeValuePairsWithoutColumnNames() throws Exception {
    SeriesWrite write = new SeriesWrite("cpu.idle", null, null, rows("[[1311836008, 1.5]]"));

    DataPoint point = PointParser.parse(write, TimePrecision.S, NOW).get(0);

    assertThat(point.time()).isEqualTo(1_311_836_008_000L);
    assertThat(point.fields()).containsExactly(Map.entry("value", 1.5));
  }

  @Test
  void readsObjectRowsAndDefaultsTimeToNow() throws Exception {
    SeriesWrite write = new SeriesWrite("users.events", null, null,
        rows("[{\"email\": \"paul@errplane.com\", \"count\": 3, \"ok\": true, \"skip\": null}]"));

    DataPoint point = PointParser.parse(write, TimePrecision.S, NOW).get(0);

    assertThat(point.time()).isEqualTo(NOW);
    assertThat(point.fields()).containsEntry("count", 3L)
        .containsEntry("ok", true)
        .doesNotContainKey("skip");
  }

  @Test
  void positionalColumnsMayCarryTimeAndSequenceNumber() throws Exception {
    SeriesWrite write = new SeriesWrite("cpu", List.of("value", "time", "sequence_number"),
        null, rows("[[0.5, 1311836012345, 7]]"));

    DataPoint point = PointParser.parse(write, TimePrecision.MS, NOW).get(0);

    assertThat(point.time()).isEqualTo(1_311_836_012_345L);
    assertThat(point.sequenceNumber()).isEqualTo(7);
    assertThat(point.fields()).containsOnlyKeys("value");
  }

  @Test
  void acceptsTimestampStrings() throws Exception {
    SeriesWrite write = new SeriesWrite("cpu", null, List.of("value"),
        rows("[[\"2011-07-28T06:53:32Z\", 1]]"));

    DataPoint point = PointParser.parse(write, TimePrecision.S, NOW).get(0);

    assertThat(point.time()).isEqualTo(1_311_836_012_000L);
  }

  @Test
  void timesThatOverflowMillisecondsAreRejected() throws Exception {
    SeriesWrite seconds = new SeriesWrite("cpu", null, List.of("value"),
        rows("[[9300000000000000, 1]]"));
    assertThatThrownBy(() -> PointParser.parse(seconds, TimePrecision.S, NOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("point 0")
        .hasMessageContaining("out of range");

    SeriesWrite fractional = new SeriesWrite("cpu", null, List.of("value"),
        rows("[[1.0e30, 1]]"));
    assertThatThrownBy(() -> PointParser.parse(fractional, TimePrecision.MS, NOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("out of range");
  }

  @Test
  void rejectsMalformedInput() throws Exception {
    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("bad name", null, null, rows("[]")), TimePrecision.S, NOW))
        .isInstanceOf(IllegalArgumentException.class);

    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("cpu", List.of("a"), List.of("b"), rows("[]")), TimePrecision.S, NOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("not both");

    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("cpu", null, List.of("time"), rows("[]")), TimePrecision.S, NOW))
        .hasMessageContaining("reserved");

    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("cpu", List.of("a", "a"), null, rows("[]")), TimePrecision.S, NOW))
        .hasMessageContaining("duplicate");

    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("cpu", null, List.of("a", "b"), rows("[[1, 2]]")),
        TimePrecision.S, NOW))
        .hasMessageContaining("point 0");

    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("cpu", null, List.of("a"), rows("[[1, {\"x\": 1}]]")),
        TimePrecision.S, NOW))
        .hasMessageContaining("nested");

    assertThatThrownBy(() -> PointParser.parse(
        new SeriesWrite("cpu", List.of("sequence_number", "a"), null, rows("[[-1, 2]]")),
        TimePrecision.S, NOW))
        .hasMessageContaining("sequence_number");
  }

  private List<JsonNode> rows(String json) throws Exception {
    JsonNode array = mapper.readTree(json);
    return mapper.convertValue(array, mapper.getTypeFactory()
        .constructCollectionType(List.class, JsonNode.class));
  }
}
