package com.ospicorp.tsdb.series.controller;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SeriesControllerTest {
  private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
      new ParameterizedTypeReference<>() {};

  @Autowired
  private TestRestTemplate rest;

  private String db;
  private long now;

  @BeforeEach
  void createDatabase() {
    db = "series_" + System.nanoTime();
    now = Instant.now().getEpochSecond();
    ResponseEntity<Map> created = rest.postForEntity("/db", Map.of("name", db), Map.class);
    assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
  }

  @Test
  void writesAndQueriesNewestFirst() {
    ResponseEntity<Void> written = postPoints("""
        [{"series": "cpu.idle", "columns": ["time", "value"],
          "points": [[%d, 1.5], [%d, 2.5], [%d, 3.5]]}]
        """.formatted(now - 30, now - 20, now - 10));
    assertThat(written.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

    ResponseEntity<List<Map<String, Object>>> response = query("select value from cpu.idle");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).hasSize(1);
    Map<String, Object> series = response.getBody().get(0);
    assertThat(series).containsEntry("series", "cpu.idle");
    assertThat(series.get("columns")).isEqualTo(List.of("value", "time", "sequence_number"));
    List<List<Object>> datapoints = datapoints(series);
    assertThat(datapoints).extracting(row -> row.get(0)).containsExactly(3.5, 2.5, 1.5);
    assertThat(((Number) datapoints.get(0).get(1)).longValue()).isEqualTo(now - 10);
  }

  @Test
  void writeSummaryCountsSeriesAndPoints() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    String body = """
        [{"series": "events", "extra_columns": ["email", "type"],
          "points": [[%d, "a@x.io", "login"], [null, "b@x.io", "logout"]]},
         {"series": "cpu.idle", "columns": ["value"], "points": [[1]]}]
        """.formatted(now - 1);

    ResponseEntity<Map> response = rest.postForEntity("/db/{db}/points?summary=true",
        new HttpEntity<>(body, headers), Map.class, db);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).containsEntry("series", 2).containsEntry("points", 3);
  }

  @Test
  void millisecondPrecisionIsKeptInResults() {
    long nowMillis = now * 1000 + 123;
    postPoints("""
        [{"series": "latency", "columns": ["time", "value"], "points": [[%d, 7]]}]
        """.formatted(nowMillis), "ms");

    ResponseEntity<List<Map<String, Object>>> response = rest.exchange(
        "/db/{db}/series?q={q}&time_precision=ms", HttpMethod.GET, null, ROWS, db,
        "select value from latency");

    List<List<Object>> datapoints = datapoints(response.getBody().get(0));
    assertThat(((Number) datapoints.get(0).get(1)).longValue()).isEqualTo(nowMillis);
  }

  @Test
  void groupsByTimeAndColumn() {
    long yesterday = now - now % 86_400 - 86_400 + 3_600;
    postPoints("""
        [{"series": "users.events", "columns": ["time", "email"],
          "points": [[%d, "a@x.io"], [%d, "a@x.io"], [%d, "b@x.io"]]}]
        """.formatted(yesterday, yesterday + 60, yesterday + 120));

    ResponseEntity<List<Map<String, Object>>> response = query(
        "select count(email) from users.events group by time(1d), email "
            + "where time > now() - 3d");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    Map<String, Object> series = response.getBody().get(0);
    assertThat(series.get("columns")).isEqualTo(List.of("count", "time", "email"));
    assertThat(datapoints(series)).extracting(row -> row.get(0)).containsExactlyInAnyOrder(2, 1);
  }

  @Test
  void csvFormatFlattensRows() {
    postPoints("""
        [{"series": "cpu.idle", "columns": ["time", "value"], "points": [[%d, 4]]}]
        """.formatted(now - 5));

    ResponseEntity<String> response = rest.getForEntity("/db/{db}/series?q={q}&format=csv",
        String.class, db, "select value from cpu.idle");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getHeaders().getContentType().toString()).startsWith("text/csv");
    assertThat(response.getBody()).startsWith("series,value,time,sequence_number");
    assertThat(response.getBody()).contains("cpu.idle,4," + (now - 5) + ",");
  }

  @Test
  void selectedTimeIsRenderedInRequestPrecision() {
    postPoints("""
        [{"series": "cpu", "columns": ["time", "value"], "points": [[%d, 1]]}]
        """.formatted(now - 5));

    Map<String, Object> series = query("select time, value from cpu").getBody().get(0);

    assertThat(series.get("columns"))
        .isEqualTo(List.of("time", "value", "time", "sequence_number"));
    List<Object> row = datapoints(series).get(0);
    assertThat(((Number) row.get(0)).longValue()).isEqualTo(now - 5);
    assertThat(((Number) row.get(2)).longValue()).isEqualTo(now - 5);

    ResponseEntity<String> csv = rest.getForEntity("/db/{db}/series?q={q}&format=csv",
        String.class, db, "select time, value from cpu");
    assertThat(csv.getBody()).startsWith("series,time,value,time_2,sequence_number")
        .contains("cpu," + (now - 5) + ",1," + (now - 5) + ",");
  }

  @Test
  void timeOutsideTheMillisecondRangeIsBadRequest() {
    postPoints("""
        [{"series": "cpu", "columns": ["time", "value"], "points": [[%d, 1]]}]
        """.formatted(now - 5));
    ResponseEntity<Void> written = postPoints("""
        [{"series": "cpu", "columns": ["time", "value"], "points": [[9300000000000000, 2]]}]
        """);

    assertThat(written.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(datapoints(query("select value from cpu").getBody().get(0))).hasSize(1);
    assertThat(rest.getForEntity("/db/{db}/series?q={q}", String.class, db,
        "select value from cpu where time > 9300000000000000").getStatusCode())
        .isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  void acceptHeaderSelectsCsv() {
    postPoints("""
        [{"series": "cpu.idle", "columns": ["time", "value"], "points": [[%d, 4]]}]
        """.formatted(now - 5));
    HttpHeaders headers = new HttpHeaders();
    headers.set(HttpHeaders.ACCEPT, "text/csv");

    ResponseEntity<String> response = rest.exchange("/db/{db}/series?q={q}", HttpMethod.GET,
        new HttpEntity<>(headers), String.class, db, "select value from cpu.idle");

    assertThat(response.getBody()).startsWith("series,");
  }

  @Test
  void withoutQueryListsSeries() {
    postPoints("""
        [{"series": "b.series", "columns": ["value"], "points": [[1]]},
         {"series": "a.series", "columns": ["value", "host"], "points": [[1, "h1"]]}]
        """);

    ResponseEntity<List<Map<String, Object>>> response = rest.exchange("/db/{db}/series",
        HttpMethod.GET, null, ROWS, db);

    assertThat(response.getBody()).extracting(series -> series.get("name"))
        .containsExactly("a.series", "b.series");
  }

  @Test
  void deleteQueryRemovesPoints() {
    postPoints("""
        [{"series": "cpu.idle", "columns": ["time", "value"],
          "points": [[%d, 1], [%d, 2], [%d, 3]]}]
        """.formatted(now - 300, now - 200, now - 10));

    ResponseEntity<Map> deleted = rest.exchange("/db/{db}/series?q={q}", HttpMethod.DELETE, null,
        Map.class, db, "delete from cpu.idle where time < now() - 1m");

    assertThat(deleted.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(deleted.getBody()).containsEntry("deleted", 2);
    assertThat(datapoints(query("select value from cpu.idle").getBody().get(0)))
        .extracting(row -> row.get(0)).containsExactly(3);
  }

  @Test
  void intoQueryRegistersContinuousQuery() {
    postPoints("""
        [{"series": "cpu.idle", "columns": ["time", "value"], "points": [[%d, 1]]}]
        """.formatted(now - 5));

    ResponseEntity<Map> response = rest.getForEntity("/db/{db}/series?q={q}", Map.class, db,
        "select count(value) from cpu.idle group by time(1m) into cpu.idle.1m");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
    assertThat(response.getHeaders().getLocation().toString())
        .startsWith("/db/" + db + "/continuous_queries/");
    assertThat(response.getBody()).containsEntry("kind", "series")
        .containsEntry("into", "cpu.idle.1m");
    ResponseEntity<List<Map<String, Object>>> rollup = query("select * from cpu.idle.1m");
    assertThat(rollup.getBody().get(0).get("columns"))
        .asInstanceOf(InstanceOfAssertFactories.LIST)
        .contains("count");
    assertThat(datapoints(rollup.getBody().get(0))).hasSize(1);
  }

  @Test
  void malformedQueryIsProblemWithPosition() {
    ResponseEntity<Map> response = rest.getForEntity("/db/{db}/series?q={q}", Map.class, db,
        "select value frm cpu");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getHeaders().getContentType().toString())
        .contains("application/problem+json");
    assertThat(response.getBody()).containsEntry("title", "Invalid query")
        .containsKey("position");
  }

  @Test
  void unknownSeriesIsNotFound() {
    ResponseEntity<Map> response = rest.getForEntity("/db/{db}/series?q={q}", Map.class, db,
        "select value from nothing.here");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.getBody()).containsEntry("status", 404);
  }

  @Test
  void unknownDatabaseIsNotFound() {
    ResponseEntity<Map> response = rest.getForEntity("/db/{db}/series?q={q}", Map.class,
        "missing_" + System.nanoTime(), "select value from cpu");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
  }

  @Test
  void invalidTimePrecisionCarriesErrorCode() {
    ResponseEntity<Map> response = rest.getForEntity(
        "/db/{db}/series?q={q}&time_precision=h", Map.class, db, "select value from cpu");

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 1001)
        .containsEntry("moreInfo", "https://docs.ospicorp.com/tsdb/errors/1001");
  }

  @Test
  void malformedPointsAreRejected() {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    String body = """
        [{"series": "cpu.idle", "columns": ["time", "value"], "points": [[1]]}]
        """;

    ResponseEntity<Map> response = rest.postForEntity("/db/{db}/points",
        new HttpEntity<>(body, headers), Map.class, db);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat((String) response.getBody().get("detail")).contains("point 0");
  }

  @Test
  void readKeyCannotWrite() {
    ResponseEntity<Map> key = rest.postForEntity("/db/{db}/keys",
        Map.of("key", "reader-key-1", "permission", "read"), Map.class, db);
    assertThat(key.getStatusCode()).isEqualTo(HttpStatus.CREATED);

    ResponseEntity<Map> anonymous = rest.getForEntity("/db/{db}/series", Map.class, db);
    assertThat(anonymous.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);

    ResponseEntity<String> reader = rest.getForEntity("/db/{db}/series?api_key=reader-key-1",
        String.class, db);
    assertThat(reader.getStatusCode()).isEqualTo(HttpStatus.OK);

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.set("X-Api-Key", "reader-key-1");
    ResponseEntity<Map> write = rest.postForEntity("/db/{db}/points",
        new HttpEntity<>("[{\"series\": \"x\", \"columns\": [\"value\"], \"points\": [[1]]}]",
            headers), Map.class, db);
    assertThat(write.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
  }

  private ResponseEntity<Void> postPoints(String json) {
    return postPoints(json, "s");
  }

  private ResponseEntity<Void> postPoints(String json, String precision) {
    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    return rest.exchange("/db/{db}/points?time_precision={precision}", HttpMethod.POST,
        new HttpEntity<>(json, headers), Void.class, db, precision);
  }

  private ResponseEntity<List<Map<String, Object>>> query(String q) {
    return rest.exchange("/db/{db}/series?q={q}", HttpMethod.GET, null, ROWS, db, q);
  }

  @SuppressWarnings("unchecked")
  private static List<List<Object>> datapoints(Map<String, Object> series) {
    return (List<List<Object>>) series.get("datapoints");
  }
}
