package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.series.model.TimePrecision;

/**
 * Per-request inputs of query evaluation.
 *
 * @param now evaluation time in epoch milliseconds, the value of {@code now()}
 * @param precision unit of integer time literals
 * @param window when set, replaces the default window and narrows the query's own bounds;
 *     continuous queries use it to read only what is new since their last run
 */
public record EvaluationContext(long now, TimePrecision precision, TimeRange window) {

  public static EvaluationContext at(long now, TimePrecision precision) {
    return new EvaluationContext(now, precision, null);
  }

  public EvaluationContext withWindow(TimeRange newWindow) {
    return new EvaluationContext(now, precision, newWindow);
  }
}
