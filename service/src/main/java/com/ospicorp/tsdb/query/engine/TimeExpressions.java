package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.query.ast.BinaryExpr;
import com.ospicorp.tsdb.query.ast.DurationLiteral;
import com.ospicorp.tsdb.query.ast.Expr;
import com.ospicorp.tsdb.query.ast.FieldRef;
import com.ospicorp.tsdb.query.ast.Forever;
import com.ospicorp.tsdb.query.ast.Now;
import com.ospicorp.tsdb.query.ast.NumberLiteral;
import com.ospicorp.tsdb.query.ast.Operator;
import com.ospicorp.tsdb.query.ast.StringLiteral;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

/**
 * Time conditions: evaluating the right-hand side of {@code time > now() - 1d} and collecting
 * the scan range from the conditions joined by {@code and} at the top of a where clause.
 */
public final class TimeExpressions {

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSS]");
  private static final List<Function<String, Instant>> LAYOUTS = List.of(
      Instant::parse,
      text -> LocalDateTime.parse(text, DATE_TIME).toInstant(ZoneOffset.UTC),
      text -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());

  private TimeExpressions() {
  }

  public static boolean isTimeComparison(Expr expr) {
    return expr instanceof BinaryExpr binary
        && binary.operator().isComparison()
        && (isTime(binary.left()) || isTime(binary.right()));
  }

  static boolean isTime(Expr expr) {
    return expr instanceof FieldRef ref && ref.isTime();
  }

  /** Floor of a fractional time, rejecting values outside the long range. */
  public static long wholeUnits(double value) {
    double floor = Math.floor(value);
    if (Double.isNaN(floor) || floor >= 0x1p63 || floor < -0x1p63) {
      throw new IllegalArgumentException("Time " + value + " is out of range");
    }
    return (long) floor;
  }

  /**
   * Epoch milliseconds denoted by a time expression.
   *
   * @throws IllegalArgumentException if a literal time does not fit in epoch milliseconds
   */
  public static long resolve(Expr expr, EvaluationContext context) {
    if (expr instanceof Now) {
      return context.now();
    }
    if (expr instanceof Forever) {
      return Long.MAX_VALUE;
    }
    if (expr instanceof NumberLiteral number) {
      long value = number.value() instanceof Long integral
          ? integral
          : wholeUnits(number.value().doubleValue());
      return context.precision().toMillis(value);
    }
    if (expr instanceof StringLiteral string) {
      return parseTimestamp(string.value());
    }
    if (expr instanceof DurationLiteral duration) {
      return duration.duration().toMillis();
    }
    if (expr instanceof BinaryExpr binary
        && (binary.operator() == Operator.ADD || binary.operator() == Operator.SUB)) {
      long left = resolve(binary.left(), context);
      long right = resolve(binary.right(), context);
      try {
        return binary.operator() == Operator.ADD
            ? Math.addExact(left, right)
            : Math.subtractExact(left, right);
      } catch (ArithmeticException ex) {
        return (binary.operator() == Operator.ADD) == (right > 0) ? Long.MAX_VALUE : Long.MIN_VALUE;
      }
    }
    throw new IllegalArgumentException("Invalid time expression " + expr);
  }

  public static long parseTimestamp(String text) {
    DateTimeParseException failure = null;
    for (Function<String, Instant> layout : LAYOUTS) {
      try {
        return layout.apply(text).toEpochMilli();
      } catch (DateTimeParseException ex) {
        failure = ex;
      }
    }
    throw new IllegalArgumentException("Invalid timestamp '" + text + "'", failure);
  }

  /**
   * Range implied by the time comparisons among the top-level {@code and} terms. Other terms
   * are ignored here and left to the row filter.
   */
  public static TimeRange range(Expr where, EvaluationContext context) {
    if (where == null) {
      return TimeRange.UNBOUNDED;
    }
    if (where instanceof BinaryExpr binary && binary.operator() == Operator.AND) {
      return range(binary.left(), context).intersect(range(binary.right(), context));
    }
    if (isTimeComparison(where)) {
      return comparisonRange((BinaryExpr) where, context);
    }
    return TimeRange.UNBOUNDED;
  }

  /**
   * Like {@link #range} but rejects anything that is not a time comparison, as required by
   * {@code delete}.
   */
  public static TimeRange strictRange(Expr where, EvaluationContext context) {
    if (where == null) {
      return TimeRange.UNBOUNDED;
    }
    if (where instanceof BinaryExpr binary && binary.operator() == Operator.AND) {
      return strictRange(binary.left(), context).intersect(strictRange(binary.right(), context));
    }
    if (!isTimeComparison(where)) {
      throw new IllegalArgumentException(
          "delete accepts only time conditions joined by 'and'");
    }
    return comparisonRange((BinaryExpr) where, context);
  }

  private static TimeRange comparisonRange(BinaryExpr comparison, EvaluationContext context) {
    Operator operator = comparison.operator();
    Expr bound = comparison.right();
    if (!isTime(comparison.left())) {
      operator = operator.mirrored();
      bound = comparison.left();
    }
    long value = resolve(bound, context);
    return switch (operator) {
      case GT -> new TimeRange(value == Long.MAX_VALUE ? value : value + 1, Long.MAX_VALUE);
      case GE -> new TimeRange(value, Long.MAX_VALUE);
      case LT -> new TimeRange(Long.MIN_VALUE, value == Long.MIN_VALUE ? value : value - 1);
      case LE -> new TimeRange(Long.MIN_VALUE, value);
      case EQ -> new TimeRange(value, value);
      default -> TimeRange.UNBOUNDED;
    };
  }
}
