package com.ospicorp.tsdb.continuous.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ContinuousQueryKind {
  /** Writes results into the series named by {@code into}. */
  SERIES,
  /** Pushes results to a server-sent-event subscriber. */
  STREAM;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
