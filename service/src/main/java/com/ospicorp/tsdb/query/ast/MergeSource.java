package com.ospicorp.tsdb.query.ast;

import java.util.List;

public record MergeSource(List<String> series) implements Source {

  public MergeSource {
    series = List.copyOf(series);
  }

  public String resultName() {
    return String.join("_merge_", series);
  }
}
