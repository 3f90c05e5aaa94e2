package com.ospicorp.tsdb.series.repository;

import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesInfo;
import java.util.List;
import java.util.Optional;

/**
 * Storage of series points, partitioned by database.
 *
 * <p>Points are keyed by {@code (time, sequence_number)} inside a series; writing a key that
 * already exists replaces the stored point. Points written with sequence number {@code 0} get
 * the next number of the database's counter.
 */
public interface PointStore {

  /** Opens storage for a new database. Writes to a database never created here fail. */
  void createDatabase(String database);

  /**
   * Appends points to a series, creating it on first write.
   *
   * @return the stored points with their sequence numbers
   * @throws java.util.NoSuchElementException if the database was never created or was dropped
   */
  List<DataPoint> write(String database, String series, List<DataPoint> points);

  /** Points with {@code from <= time <= to}, oldest first. */
  List<DataPoint> scan(String database, String series, long from, long to);

  Optional<SeriesInfo> series(String database, String series);

  List<SeriesInfo> listSeries(String database);

  /**
   * Removes points with {@code from <= time <= to}. A series left empty is dropped.
   *
   * @return number of points removed
   */
  long deleteRange(String database, String series, long from, long to);

  void dropDatabase(String database);
}
