package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.query.ast.Operator;
import java.util.Comparator;
import java.util.Objects;

/** Arithmetic and ordering over column values (longs, doubles, strings, booleans, null). */
final class Values {

  /** Nulls first, numbers by value, mixed types by their string form. */
  static final Comparator<Object> NATURAL = Values::compare;

  private Values() {
  }

  static Object arithmetic(Operator operator, Object left, Object right) {
    if (!(left instanceof Number a) || !(right instanceof Number b)) {
      return null;
    }
    if (a instanceof Long x && b instanceof Long y && operator != Operator.DIV) {
      return switch (operator) {
        case ADD -> x + y;
        case SUB -> x - y;
        case MUL -> x * y;
        default -> throw new IllegalStateException("Unexpected operator " + operator);
      };
    }
    double x = a.doubleValue();
    double y = b.doubleValue();
    return switch (operator) {
      case ADD -> x + y;
      case SUB -> x - y;
      case MUL -> x * y;
      case DIV -> y == 0 ? null : x / y;
      default -> throw new IllegalStateException("Unexpected operator " + operator);
    };
  }

  static boolean comparison(Operator operator, Object left, Object right) {
    if (left == null || right == null) {
      return operator == Operator.NE && !(left == null && right == null);
    }
    boolean comparable = (left instanceof Number && right instanceof Number)
        || (left instanceof String && right instanceof String)
        || (left instanceof Boolean && right instanceof Boolean);
    if (!comparable) {
      return operator == Operator.NE;
    }
    int result = compare(left, right);
    return switch (operator) {
      case EQ -> result == 0;
      case NE -> result != 0;
      case LT -> result < 0;
      case LE -> result <= 0;
      case GT -> result > 0;
      case GE -> result >= 0;
      default -> throw new IllegalStateException("Unexpected operator " + operator);
    };
  }

  static int compare(Object left, Object right) {
    if (left == null || right == null) {
      return left == null ? (right == null ? 0 : -1) : 1;
    }
    if (left instanceof Number a && right instanceof Number b) {
      if (a instanceof Long x && b instanceof Long y) {
        return Long.compare(x, y);
      }
      return Double.compare(a.doubleValue(), b.doubleValue());
    }
    if (left instanceof String a && right instanceof String b) {
      return a.compareTo(b);
    }
    if (left instanceof Boolean a && right instanceof Boolean b) {
      return a.compareTo(b);
    }
    return Objects.toString(left).compareTo(Objects.toString(right));
  }

  static Double toDouble(Object value) {
    return value instanceof Number number ? number.doubleValue() : null;
  }

  static boolean truthy(Object value) {
    return Boolean.TRUE.equals(value);
  }
}
