package com.ospicorp.tsdb.query.ast;

/** {@code inner_join(left, leftAlias, right, rightAlias)}. */
public record JoinSource(String left, String leftAlias, String right, String rightAlias)
    implements Source {

  public String resultName() {
    return left + "_join_" + right;
  }
}
