package com.ospicorp.tsdb.query.ast;

import java.util.List;
import java.util.Locale;

/** Function application; {@code name} is lower case. */
public record Call(String name, List<Expr> arguments) implements Expr {

  public Call {
    name = name.toLowerCase(Locale.ROOT);
    arguments = List.copyOf(arguments);
  }

  public Expr argument(int index) {
    return arguments.get(index);
  }
}
