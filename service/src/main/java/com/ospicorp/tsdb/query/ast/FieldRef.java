package com.ospicorp.tsdb.query.ast;

public record FieldRef(String name) implements Expr {

  public boolean isTime() {
    return "time".equalsIgnoreCase(name);
  }
}
