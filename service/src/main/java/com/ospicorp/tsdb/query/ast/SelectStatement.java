package com.ospicorp.tsdb.query.ast;

import java.util.List;

/**
 * A parsed {@code select}. Optional clauses are {@code null} when absent, except {@code fill}
 * which defaults to {@link Fill#NONE}.
 */
public record SelectStatement(
    List<SelectField> fields,
    Source source,
    Expr where,
    GroupBy groupBy,
    Fill fill,
    Integer limit,
    boolean ascending,
    String into
) implements Statement {

  public SelectStatement {
    fields = List.copyOf(fields);
    if (fill == null) {
      fill = Fill.NONE;
    }
  }

  public boolean groupedByTime() {
    return groupBy != null && groupBy.byTime();
  }

  public boolean isContinuous() {
    return into != null;
  }

  public SelectStatement withoutInto() {
    return new SelectStatement(fields, source, where, groupBy, fill, limit, ascending, null);
  }

  public SelectStatement withLimit(Integer newLimit) {
    return new SelectStatement(fields, source, where, groupBy, fill, newLimit, ascending, into);
  }
}
