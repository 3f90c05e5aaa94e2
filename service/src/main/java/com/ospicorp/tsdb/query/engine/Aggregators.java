package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.query.Functions;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.Expr;
import com.ospicorp.tsdb.query.ast.NumberLiteral;
import com.ospicorp.tsdb.query.ast.Star;
import com.ospicorp.tsdb.series.model.DataPoint;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Aggregate functions over the points of one group, which arrive oldest first. */
final class Aggregators {

  private Aggregators() {
  }

  static Object compute(Call call, List<DataPoint> points, EvaluationContext context) {
    return switch (call.name()) {
      case "count" -> count(call.argument(0), points, context);
      case "sum" -> sum(numbers(call.argument(0), points, context));
      case "mean", "avg" -> mean(numbers(call.argument(0), points, context));
      case "min" -> extreme(numbers(call.argument(0), points, context), -1);
      case "max" -> extreme(numbers(call.argument(0), points, context), 1);
      case "first" -> first(values(call.argument(0), points, context));
      case "last" -> last(values(call.argument(0), points, context));
      case "median" -> median(numbers(call.argument(0), points, context));
      case "stddev" -> stddev(numbers(call.argument(0), points, context));
      case "percentile" -> percentile(call, points, context);
      case Functions.TOP -> compute((Call) call.argument(1), points, context);
      default -> throw new IllegalArgumentException("Unknown aggregate " + call.name() + "()");
    };
  }

  private static long count(Expr argument, List<DataPoint> points, EvaluationContext context) {
    if (argument instanceof Star) {
      return points.size();
    }
    if (argument instanceof Call distinct && Functions.DISTINCT.equals(distinct.name())) {
      Set<Object> seen = new HashSet<>(values(distinct.argument(0), points, context));
      return seen.size();
    }
    return values(argument, points, context).size();
  }

  /** Non-null values of the argument, oldest point first. */
  private static List<Object> values(Expr argument, List<DataPoint> points,
      EvaluationContext context) {
    List<Object> values = new ArrayList<>(points.size());
    for (DataPoint point : points) {
      Object value = ExpressionEvaluator.evaluate(argument,
          ExpressionEvaluator.pointScope(point), context);
      if (value != null) {
        values.add(value);
      }
    }
    return values;
  }

  private static List<Number> numbers(Expr argument, List<DataPoint> points,
      EvaluationContext context) {
    List<Number> numbers = new ArrayList<>(points.size());
    for (Object value : values(argument, points, context)) {
      if (value instanceof Number number) {
        numbers.add(number);
      }
    }
    return numbers;
  }

  private static Number sum(List<Number> numbers) {
    if (numbers.isEmpty()) {
      return null;
    }
    if (numbers.stream().allMatch(Long.class::isInstance)) {
      return numbers.stream().mapToLong(Number::longValue).sum();
    }
    return numbers.stream().mapToDouble(Number::doubleValue).sum();
  }

  private static Double mean(List<Number> numbers) {
    if (numbers.isEmpty()) {
      return null;
    }
    return numbers.stream().mapToDouble(Number::doubleValue).sum() / numbers.size();
  }

  private static Number extreme(List<Number> numbers, int direction) {
    Number best = null;
    for (Number number : numbers) {
      if (best == null || Values.compare(number, best) * direction > 0) {
        best = number;
      }
    }
    return best;
  }

  private static Object first(List<Object> values) {
    return values.isEmpty() ? null : values.get(0);
  }

  private static Object last(List<Object> values) {
    return values.isEmpty() ? null : values.get(values.size() - 1);
  }

  private static Number median(List<Number> numbers) {
    if (numbers.isEmpty()) {
      return null;
    }
    List<Number> sorted = sorted(numbers);
    int middle = sorted.size() / 2;
    if (sorted.size() % 2 == 1) {
      return sorted.get(middle);
    }
    return (sorted.get(middle - 1).doubleValue() + sorted.get(middle).doubleValue()) / 2;
  }

  private static Double stddev(List<Number> numbers) {
    if (numbers.size() < 2) {
      return null;
    }
    double mean = mean(numbers);
    double squares = 0;
    for (Number number : numbers) {
      double delta = number.doubleValue() - mean;
      squares += delta * delta;
    }
    return Math.sqrt(squares / (numbers.size() - 1));
  }

  /** Nearest-rank percentile; the rank argument may come first or second. */
  private static Number percentile(Call call, List<DataPoint> points, EvaluationContext context) {
    boolean rankFirst = call.argument(0) instanceof NumberLiteral;
    double rank = ((NumberLiteral) call.argument(rankFirst ? 0 : 1)).value().doubleValue();
    if (rank < 0 || rank > 100) {
      throw new IllegalArgumentException("percentile must be between 0 and 100, got " + rank);
    }
    List<Number> numbers = numbers(call.argument(rankFirst ? 1 : 0), points, context);
    if (numbers.isEmpty()) {
      return null;
    }
    List<Number> sorted = sorted(numbers);
    int index = (int) Math.ceil(rank / 100 * sorted.size()) - 1;
    return sorted.get(Math.max(0, Math.min(index, sorted.size() - 1)));
  }

  private static List<Number> sorted(List<Number> numbers) {
    List<Number> sorted = new ArrayList<>(numbers);
    sorted.sort(Values::compare);
    return sorted;
  }
}
