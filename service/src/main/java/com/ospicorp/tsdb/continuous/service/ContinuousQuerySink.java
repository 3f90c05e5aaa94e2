package com.ospicorp.tsdb.continuous.service;

import com.ospicorp.tsdb.continuous.model.ContinuousQuery;
import com.ospicorp.tsdb.query.engine.TimeRange;
import com.ospicorp.tsdb.series.model.SeriesResult;
import java.util.List;

/** Destination of the results of each continuous query run. */
interface ContinuousQuerySink {

  /**
   * @param window range the run read, or {@code null} when it used the query's defaults
   * @return {@code false} once the sink cannot take more results
   */
  boolean accept(ContinuousQuery query, List<SeriesResult> results, TimeRange window);

  default void close() {
  }
}
