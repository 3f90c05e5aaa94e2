package com.ospicorp.tsdb.series.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.ospicorp.tsdb.query.engine.TimeExpressions;
import com.ospicorp.tsdb.series.model.DataPoint;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.model.SeriesWrite;
import com.ospicorp.tsdb.series.model.TimePrecision;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns one element of a points body into {@link DataPoint}s.
 *
 * <p>Rows are positional arrays over {@code columns}, arrays shaped {@code [time, extra...]}
 * when {@code extra_columns} is given, objects keyed by column, or {@code [time, value]} pairs.
 * A missing or null time means {@code now}.
 */
public final class PointParser {

  public static final String VALUE_COLUMN = "value";

  private static final Pattern SERIES_NAME = Pattern.compile(SeriesWrite.SERIES_NAME_REGEX);
  private static final Pattern COLUMN_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private PointParser() {
  }

  public static List<DataPoint> parse(SeriesWrite write, TimePrecision precision, long now) {
    if (write.series() == null || !SERIES_NAME.matcher(write.series()).matches()) {
      throw new IllegalArgumentException("Invalid series name: " + write.series());
    }
    if (write.columns() != null && write.extraColumns() != null) {
      throw new IllegalArgumentException(
          "Series " + write.series() + ": use either columns or extra_columns, not both");
    }
    if (write.columns() != null) {
      validateColumns(write, write.columns(), true);
    }
    if (write.extraColumns() != null) {
      validateColumns(write, write.extraColumns(), false);
    }
    if (write.points() == null) {
      throw new IllegalArgumentException("Series " + write.series() + ": points are required");
    }

    List<DataPoint> points = new ArrayList<>(write.points().size());
    for (int i = 0; i < write.points().size(); i++) {
      JsonNode row = write.points().get(i);
      try {
        points.add(parseRow(write, row, precision, now));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(
            "Series " + write.series() + ", point " + i + ": " + ex.getMessage(), ex);
      }
    }
    return points;
  }

  private static DataPoint parseRow(SeriesWrite write, JsonNode row, TimePrecision precision,
      long now) {
    if (row == null || row.isNull()) {
      throw new IllegalArgumentException("point must not be null");
    }
    if (row.isObject()) {
      return objectRow(row, precision, now);
    }
    if (!row.isArray()) {
      throw new IllegalArgumentException("point must be an array or an object");
    }
    if (write.columns() != null) {
      return positionalRow(write.columns(), row, precision, now);
    }
    if (write.extraColumns() != null) {
      List<String> columns = new ArrayList<>(write.extraColumns().size() + 1);
      columns.add(SeriesResult.TIME);
      columns.addAll(write.extraColumns());
      return positionalRow(columns, row, precision, now);
    }
    if (row.size() != 2) {
      throw new IllegalArgumentException(
          "without columns a point must be [time, value] or an object, got " + row.size()
              + " values");
    }
    return positionalRow(List.of(SeriesResult.TIME, VALUE_COLUMN), row, precision, now);
  }

  private static DataPoint objectRow(JsonNode row, TimePrecision precision, long now) {
    long time = now;
    long sequenceNumber = 0;
    Map<String, Object> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> entries = row.fields();
    while (entries.hasNext()) {
      Map.Entry<String, JsonNode> entry = entries.next();
      String column = entry.getKey();
      if (SeriesResult.TIME.equals(column)) {
        time = time(entry.getValue(), precision, now);
      } else if (SeriesResult.SEQUENCE_NUMBER.equals(column)) {
        sequenceNumber = sequenceNumber(entry.getValue());
      } else {
        requireColumnName(column);
        putValue(fields, column, entry.getValue());
      }
    }
    return new DataPoint(time, sequenceNumber, fields);
  }

  private static DataPoint positionalRow(List<String> columns, JsonNode row,
      TimePrecision precision, long now) {
    if (row.size() != columns.size()) {
      throw new IllegalArgumentException(
          "expected " + columns.size() + " values but got " + row.size());
    }
    long time = now;
    long sequenceNumber = 0;
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      String column = columns.get(i);
      JsonNode value = row.get(i);
      if (SeriesResult.TIME.equals(column)) {
        time = time(value, precision, now);
      } else if (SeriesResult.SEQUENCE_NUMBER.equals(column)) {
        sequenceNumber = sequenceNumber(value);
      } else {
        putValue(fields, column, value);
      }
    }
    return new DataPoint(time, sequenceNumber, fields);
  }

  private static long time(JsonNode value, TimePrecision precision, long now) {
    if (value == null || value.isNull()) {
      return now;
    }
    if (value.isIntegralNumber() && value.canConvertToLong()) {
      return precision.toMillis(value.longValue());
    }
    if (value.isNumber()) {
      return precision.toMillis(TimeExpressions.wholeUnits(value.doubleValue()));
    }
    if (value.isTextual()) {
      return TimeExpressions.parseTimestamp(value.textValue());
    }
    throw new IllegalArgumentException("time must be a number or a timestamp string");
  }

  private static long sequenceNumber(JsonNode value) {
    if (value == null || value.isNull()) {
      return 0;
    }
    if (!value.isIntegralNumber() || !value.canConvertToLong() || value.longValue() < 1) {
      throw new IllegalArgumentException("sequence_number must be a positive integer");
    }
    return value.longValue();
  }

  private static void putValue(Map<String, Object> fields, String column, JsonNode value) {
    if (value == null || value.isNull()) {
      return;
    }
    if (value.isContainerNode()) {
      throw new IllegalArgumentException("column " + column + " holds a nested value");
    }
    if (value.isIntegralNumber()) {
      fields.put(column,
          value.canConvertToLong() ? (Object) value.longValue() : value.doubleValue());
    } else if (value.isNumber()) {
      fields.put(column, value.doubleValue());
    } else if (value.isBoolean()) {
      fields.put(column, value.booleanValue());
    } else {
      fields.put(column, value.asText());
    }
  }

  private static void validateColumns(SeriesWrite write, List<String> columns,
      boolean reservedAllowed) {
    List<String> seen = new ArrayList<>(columns.size());
    for (String column : columns) {
      boolean reserved = SeriesResult.TIME.equals(column)
          || SeriesResult.SEQUENCE_NUMBER.equals(column);
      if (reserved && !reservedAllowed) {
        throw new IllegalArgumentException(
            "Series " + write.series() + ": " + column + " is a reserved column name");
      }
      if (!reserved) {
        requireColumnName(column);
      }
      if (seen.contains(column)) {
        throw new IllegalArgumentException(
            "Series " + write.series() + ": duplicate column " + column);
      }
      seen.add(column);
    }
  }

  private static void requireColumnName(String column) {
    if (column == null || !COLUMN_NAME.matcher(column).matches()) {
      throw new IllegalArgumentException("Invalid column name: " + column);
    }
  }
}
