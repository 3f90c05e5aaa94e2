package com.ospicorp.tsdb.query;

import com.ospicorp.tsdb.query.ast.BinaryExpr;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.Expr;
import java.util.Set;

/** Names of the functions the query language knows. */
public final class Functions {

  public static final Set<String> AGGREGATES = Set.of(
      "count", "sum", "mean", "avg", "min", "max", "first", "last", "median", "percentile",
      "stddev");

  /** Aggregates whose column takes the name of the field they read. */
  public static final Set<String> SELECTORS = Set.of("first", "last", "min", "max");

  public static final Set<String> SCALARS = Set.of("diff", "abs");

  public static final String TOP = "top";
  public static final String DISTINCT = "distinct";
  public static final String NOW = "now";

  private Functions() {
  }

  public static boolean isKnown(String name) {
    return AGGREGATES.contains(name) || SCALARS.contains(name) || TOP.equals(name)
        || DISTINCT.equals(name) || NOW.equals(name);
  }

  public static boolean isAggregate(Call call) {
    return AGGREGATES.contains(call.name()) || TOP.equals(call.name());
  }

  /** Whether the expression contains an aggregate anywhere. */
  public static boolean containsAggregate(Expr expr) {
    if (expr instanceof Call call) {
      return isAggregate(call) || call.arguments().stream().anyMatch(Functions::containsAggregate);
    }
    if (expr instanceof BinaryExpr binary) {
      return containsAggregate(binary.left()) || containsAggregate(binary.right());
    }
    return false;
  }
}
