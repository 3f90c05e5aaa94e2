package com.ospicorp.tsdb.series.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Points in PostgreSQL; field values are kept as a JSONB document per point. */
@Repository
@ConditionalOnProperty(name = "tsdb.storage.type", havingValue = "jdbc")
public class JdbcPointStore implements PointStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcPointStore.class);

  private static final TypeReference<Map<String, Object>> FIELDS = new TypeReference<>() {};
  private static final TypeReference<List<String>> COLUMNS = new TypeReference<>() {};

  private final JdbcTemplate jdbc;
  private final ObjectMapper objectMapper;
  private final ObjectReader reader;

  public JdbcPointStore(JdbcTemplate jdbc, ObjectMapper objectMapper) {
    this.jdbc = jdbc;
    this.objectMapper = objectMapper;
    this.reader = objectMapper.reader(DeserializationFeature.USE_LONG_FOR_INTS);
  }

  @Override
  public void createDatabase(String database) {
    // The databases row inserted by JdbcDatabaseRepository is what series reference.
  }

  @Override
  @Transactional
  public List<DataPoint> write(String database, String series, List<DataPoint> points) {
    jdbc.update("""
        INSERT INTO series (database, name)
        SELECT name, ? FROM databases WHERE name = ?
        ON CONFLICT (database, name) DO NOTHING
        """, series, database);
    String stored = jdbc.query("""
        SELECT columns::text FROM series WHERE database = ? AND name = ? FOR UPDATE
        """, (rs, i) -> rs.getString(1), database, series).stream()
        .findFirst()
        .orElseThrow(() -> new NoSuchElementException("Database not found: " + database));
    LinkedHashSet<String> columns = new LinkedHashSet<>(read(stored, COLUMNS));
    int known = columns.size();

    List<DataPoint> numbered = new ArrayList<>(points.size());
    List<Object[]> batch = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      DataPoint stamped = point.sequenceNumber() > 0
          ? point
          : point.withSequenceNumber(nextSequence());
      numbered.add(stamped);
      columns.addAll(stamped.fields().keySet());
      batch.add(new Object[] {database, series, stamped.time(), stamped.sequenceNumber(),
          write(stamped.fields())});
    }
    jdbc.batchUpdate("""
        INSERT INTO points (database, series, time, sequence_number, fields)
        VALUES (?, ?, ?, ?, ?::jsonb)
        ON CONFLICT (database, series, time, sequence_number)
        DO UPDATE SET fields = EXCLUDED.fields
        """, batch);
    if (columns.size() != known) {
      jdbc.update("UPDATE series SET columns = ?::jsonb WHERE database = ? AND name = ?",
          write(List.copyOf(columns)), database, series);
    }
    return numbered;
  }

  @Override
  public List<DataPoint> scan(String database, String series, long from, long to) {
    if (from > to) {
      return List.of();
    }
    return jdbc.query("""
        SELECT time, sequence_number, fields::text
        FROM points
        WHERE database = ? AND series = ? AND time BETWEEN ? AND ?
        ORDER BY time, sequence_number
        """, (rs, i) -> new DataPoint(rs.getLong(1), rs.getLong(2), read(rs.getString(3), FIELDS)),
        database, series, from, to);
  }

  @Override
  public Optional<SeriesInfo> series(String database, String series) {
    return jdbc.query("SELECT name, columns::text FROM series WHERE database = ? AND name = ?",
        (rs, i) -> new SeriesInfo(rs.getString(1), read(rs.getString(2), COLUMNS)),
        database, series).stream().findFirst();
  }

  @Override
  public List<SeriesInfo> listSeries(String database) {
    return jdbc.query("SELECT name, columns::text FROM series WHERE database = ? ORDER BY name",
        (rs, i) -> new SeriesInfo(rs.getString(1), read(rs.getString(2), COLUMNS)),
        database);
  }

  @Override
  @Transactional
  public long deleteRange(String database, String series, long from, long to) {
    if (from > to) {
      return 0;
    }
    int removed = jdbc.update(
        "DELETE FROM points WHERE database = ? AND series = ? AND time BETWEEN ? AND ?",
        database, series, from, to);
    int dropped = jdbc.update("""
        DELETE FROM series s
        WHERE s.database = ? AND s.name = ?
          AND NOT EXISTS (
            SELECT 1 FROM points p WHERE p.database = s.database AND p.series = s.name)
        """, database, series);
    if (dropped > 0) {
      log.debug("Dropped empty series {} from database {}", series, database);
    }
    return removed;
  }

  @Override
  public void dropDatabase(String database) {
    int dropped = jdbc.update("DELETE FROM series WHERE database = ?", database);
    log.info("Dropped {} series of database {}", dropped, database);
  }

  private long nextSequence() {
    Long value = jdbc.queryForObject("SELECT nextval('point_sequence')", Long.class);
    if (value == null) {
      throw new DataRetrievalFailureException("point_sequence returned no value");
    }
    return value;
  }

  private String write(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Cannot encode point fields", ex);
    }
  }

  private <T> T read(String json, TypeReference<T> type) {
    try {
      return reader.forType(type).readValue(json);
    } catch (JsonProcessingException ex) {
      throw new DataRetrievalFailureException("Corrupt JSON column: " + json, ex);
    }
  }
}
