package com.ospicorp.tsdb.query.ast;

import java.util.regex.Pattern;

public record RegexLiteral(Pattern pattern) implements Expr {

  @Override
  public boolean equals(Object other) {
    return other instanceof RegexLiteral that && pattern.pattern().equals(that.pattern.pattern());
  }

  @Override
  public int hashCode() {
    return pattern.pattern().hashCode();
  }
}
