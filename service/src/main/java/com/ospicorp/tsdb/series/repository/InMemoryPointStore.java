package com.ospicorp.tsdb.series.repository;

import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "tsdb.storage.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryPointStore implements PointStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPointStore.class);

  private final Map<String, Namespace> namespaces = new ConcurrentHashMap<>();

  @Override
  public void createDatabase(String database) {
    namespaces.putIfAbsent(database, new Namespace(database));
  }

  @Override
  public List<DataPoint> write(String database, String series, List<DataPoint> points) {
    Namespace namespace = namespaces.get(database);
    if (namespace == null) {
      throw new NoSuchElementException("Database not found: " + database);
    }
    List<DataPoint> numbered = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      numbered.add(point.sequenceNumber() > 0
          ? point
          : point.withSequenceNumber(namespace.sequence.incrementAndGet()));
    }
    // Insert under the map's lock so deleteRange cannot drop the series in between.
    namespace.series.compute(series, (key, current) -> {
      SeriesData data = current;
      if (data == null) {
        log.debug("Created series {} in database {}", key, database);
        data = new SeriesData(key);
      }
      data.put(numbered);
      return data;
    });
    return numbered;
  }

  @Override
  public List<DataPoint> scan(String database, String series, long from, long to) {
    SeriesData data = lookup(database, series);
    return data == null ? List.of() : data.range(from, to);
  }

  @Override
  public Optional<SeriesInfo> series(String database, String series) {
    SeriesData data = lookup(database, series);
    return data == null ? Optional.empty() : Optional.of(new SeriesInfo(series, data.columns()));
  }

  @Override
  public List<SeriesInfo> listSeries(String database) {
    Namespace namespace = namespaces.get(database);
    if (namespace == null) {
      return List.of();
    }
    return namespace.series.values().stream()
        .map(data -> new SeriesInfo(data.name(), data.columns()))
        .sorted(Comparator.comparing(SeriesInfo::name))
        .toList();
  }

  @Override
  public long deleteRange(String database, String series, long from, long to) {
    Namespace namespace = namespaces.get(database);
    if (namespace == null) {
      return 0;
    }
    long[] removed = new long[1];
    namespace.series.computeIfPresent(series, (key, current) -> {
      removed[0] = current.removeRange(from, to);
      if (current.isEmpty()) {
        log.debug("Dropped empty series {} from database {}", key, database);
        return null;
      }
      return current;
    });
    return removed[0];
  }

  @Override
  public void dropDatabase(String database) {
    Namespace removed = namespaces.remove(database);
    if (removed != null) {
      log.info("Dropped {} series of database {}", removed.series.size(), removed.name);
    }
  }

  private SeriesData lookup(String database, String series) {
    Namespace namespace = namespaces.get(database);
    return namespace == null ? null : namespace.series.get(series);
  }

  /** Series of one database plus its sequence counter. */
  private static final class Namespace {
    private final String name;
    private final Map<String, SeriesData> series = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    Namespace(String name) {
      this.name = name;
    }
  }
}
