package com.ospicorp.tsdb.query.ast;

import java.util.regex.Pattern;

/** Every series whose whole name matches {@code pattern}. */
public record RegexSource(Pattern pattern) implements Source {

  public boolean matches(String series) {
    return pattern.matcher(series).matches();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof RegexSource that && pattern.pattern().equals(that.pattern.pattern());
  }

  @Override
  public int hashCode() {
    return pattern.pattern().hashCode();
  }
}
