package com.ospicorp.tsdb.query.ast;

/** How empty time buckets are rendered. */
public record Fill(Mode mode, Number value) {

  public static final Fill NONE = new Fill(Mode.NONE, null);

  public enum Mode {
    NONE,
    NULL,
    PREVIOUS,
    VALUE
  }
}
