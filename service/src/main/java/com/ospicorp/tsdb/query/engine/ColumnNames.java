package com.ospicorp.tsdb.query.engine;

import com.ospicorp.tsdb.query.Functions;
import com.ospicorp.tsdb.query.ast.Call;
import com.ospicorp.tsdb.query.ast.Expr;
import com.ospicorp.tsdb.query.ast.FieldRef;
import com.ospicorp.tsdb.query.ast.SelectField;

/** Result column name of a selected expression. */
final class ColumnNames {

  private ColumnNames() {
  }

  static String of(SelectField field, int index) {
    if (field.alias() != null) {
      return field.alias();
    }
    String name = of(field.expr());
    return name != null ? name : "expr" + index;
  }

  private static String of(Expr expr) {
    if (expr instanceof FieldRef ref) {
      return ref.name();
    }
    if (expr instanceof Call call) {
      if (Functions.TOP.equals(call.name())) {
        return of(call.argument(1));
      }
      if (Functions.SELECTORS.contains(call.name()) && call.argument(0) instanceof FieldRef ref) {
        return ref.name();
      }
      return call.name();
    }
    return null;
  }
}
