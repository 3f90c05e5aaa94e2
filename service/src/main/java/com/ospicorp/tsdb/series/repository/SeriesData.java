package com.ospicorp.tsdb.series.repository;

import com.ospicorp.tsdb.series.model.DataPoint;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/** Buffered points and known columns of one series. */
final class SeriesData {

  private final String name;
  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final NavigableMap<PointKey, DataPoint> points = new TreeMap<>();
  private final LinkedHashSet<String> columns = new LinkedHashSet<>();

  SeriesData(String name) {
    this.name = name;
  }

  String name() {
    return name;
  }

  void put(List<DataPoint> batch) {
    lock.writeLock().lock();
    try {
      for (DataPoint point : batch) {
        points.put(new PointKey(point.time(), point.sequenceNumber()), point);
        columns.addAll(point.fields().keySet());
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  List<DataPoint> range(long from, long to) {
    if (from > to) {
      return List.of();
    }
    lock.readLock().lock();
    try {
      return new ArrayList<>(points.subMap(
          new PointKey(from, Long.MIN_VALUE), true,
          new PointKey(to, Long.MAX_VALUE), true).values());
    } finally {
      lock.readLock().unlock();
    }
  }

  long removeRange(long from, long to) {
    if (from > to) {
      return 0;
    }
    lock.writeLock().lock();
    try {
      NavigableMap<PointKey, DataPoint> doomed = points.subMap(
          new PointKey(from, Long.MIN_VALUE), true,
          new PointKey(to, Long.MAX_VALUE), true);
      long removed = doomed.size();
      doomed.clear();
      return removed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  boolean isEmpty() {
    lock.readLock().lock();
    try {
      return points.isEmpty();
    } finally {
      lock.readLock().unlock();
    }
  }

  List<String> columns() {
    lock.readLock().lock();
    try {
      return List.copyOf(columns);
    } finally {
      lock.readLock().unlock();
    }
  }

  private record PointKey(long time, long sequenceNumber) implements Comparable<PointKey> {
    @Override
    public int compareTo(PointKey other) {
      int byTime = Long.compare(time, other.time);
      return byTime != 0 ? byTime : Long.compare(sequenceNumber, other.sequenceNumber);
    }
  }
}
