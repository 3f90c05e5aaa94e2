package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.query.Functions;
import com.ospicorp.tsdb.query.ast.BinaryExpr;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.DurationLiteral;
import com.ospicorp.tsdb.query.ast.Expr;
import com.ospicorp.tsdb.query.ast.FieldRef;
import com.ospicorp.tsdb.query.ast.Forever;
import com.ospicorp.tsdb.query.ast.Now;
import com.ospicorp.tsdb.query.ast.NumberLiteral;
import com.ospicorp.tsdb.query.ast.Operator;
import com.ospicorp.tsdb.query.ast.RegexLiteral;
import com.ospicorp.tsdb.query.ast.Star;
import com.ospicorp.tsdb.query.ast.StringLiteral;
import com.ospicorp.tsdb.series.model.DataPoint;
import java.util.Objects;

/**
 * Evaluates expressions against a {@link Scope}: a single point for raw rows and filters, a
 * group of points for aggregated rows.
 */
final class ExpressionEvaluator {

  /** Supplies the values behind column references and aggregate calls. */
  interface Scope {

    Object column(String name);

    /** Time of the row, used by {@code time} comparisons. */
    long time();

    default Object aggregate(Call call) {
      throw new IllegalArgumentException(
          "Aggregate " + call.name() + "() is not allowed here");
    }
  }

  private ExpressionEvaluator() {
  }

  static Scope pointScope(DataPoint point) {
    return new Scope() {
      @Override
      public Object column(String name) {
        return point.get(name);
      }

      @Override
      public long time() {
        return point.time();
      }
    };
  }

  static boolean matches(Expr predicate, DataPoint point, EvaluationContext context) {
    return predicate == null || Values.truthy(evaluate(predicate, pointScope(point), context));
  }

  static Object evaluate(Expr expr, Scope scope, EvaluationContext context) {
    if (expr instanceof FieldRef ref) {
      return ref.isTime() ? scope.time() : scope.column(ref.name());
    }
    if (expr instanceof NumberLiteral number) {
      return number.value();
    }
    if (expr instanceof StringLiteral string) {
      return string.value();
    }
    if (expr instanceof DurationLiteral duration) {
      return duration.duration().toMillis();
    }
    if (expr instanceof Now) {
      return context.now();
    }
    if (expr instanceof Forever) {
      return Long.MAX_VALUE;
    }
    if (expr instanceof BinaryExpr binary) {
      return binary(binary, scope, context);
    }
    if (expr instanceof Call call) {
      if (Functions.isAggregate(call)) {
        return scope.aggregate(call);
      }
      return scalar(call, scope, context);
    }
    if (expr instanceof Star) {
      throw new IllegalArgumentException("* can only be selected on its own or in count(*)");
    }
    if (expr instanceof RegexLiteral) {
      throw new IllegalArgumentException("A regular expression must follow =~ or !~");
    }
    throw new IllegalArgumentException("Unsupported expression " + expr);
  }

  private static Object binary(BinaryExpr binary, Scope scope, EvaluationContext context) {
    Operator operator = binary.operator();
    switch (operator) {
      case AND:
        return Values.truthy(evaluate(binary.left(), scope, context))
            && Values.truthy(evaluate(binary.right(), scope, context));
      case OR:
        return Values.truthy(evaluate(binary.left(), scope, context))
            || Values.truthy(evaluate(binary.right(), scope, context));
      case MATCH:
      case NOT_MATCH: {
        Object value = evaluate(binary.left(), scope, context);
        boolean found = value != null && ((RegexLiteral) binary.right()).pattern()
            .matcher(Objects.toString(value)).find();
        return operator == Operator.MATCH ? found : !found;
      }
      default:
        break;
    }
    if (operator.isComparison() && TimeExpressions.isTimeComparison(binary)) {
      boolean timeOnLeft = TimeExpressions.isTime(binary.left());
      Expr bound = timeOnLeft ? binary.right() : binary.left();
      long value = TimeExpressions.resolve(bound, context);
      return Values.comparison(timeOnLeft ? operator : operator.mirrored(), scope.time(), value);
    }
    Object left = evaluate(binary.left(), scope, context);
    Object right = evaluate(binary.right(), scope, context);
    if (operator.isArithmetic()) {
      return Values.arithmetic(operator, left, right);
    }
    return Values.comparison(operator, left, right);
  }

  private static Object scalar(Call call, Scope scope, EvaluationContext context) {
    switch (call.name()) {
      case "diff":
        return Values.arithmetic(Operator.SUB,
            evaluate(call.argument(0), scope, context),
            evaluate(call.argument(1), scope, context));
      case "abs": {
        Object value = evaluate(call.argument(0), scope, context);
        if (value instanceof Long l) {
          return Math.abs(l);
        }
        return value instanceof Number n ? Math.abs(n.doubleValue()) : null;
      }
      default:
        throw new IllegalArgumentException(call.name() + "() cannot be used here");
    }
  }
}
