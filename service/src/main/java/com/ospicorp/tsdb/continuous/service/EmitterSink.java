package com.ospicorp.tsdb.continuous.service;

import com.ospicorp.tsdb.continuous.model.ContinuousQuery;
import com.ospicorp.tsdb.query.engine.TimeRange;
import com.ospicorp.tsdb.series.model.SeriesResult;
import com.ospicorp.tsdb.series.model.TimePrecision;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/** Sends non-empty results as {@code series} events. */
class EmitterSink implements ContinuousQuerySink {

  static final String EVENT_NAME = "series";

  private static final Logger log = LoggerFactory.getLogger(EmitterSink.class);

  private final SseEmitter emitter;
  private final TimePrecision precision;

  EmitterSink(SseEmitter emitter, TimePrecision precision) {
    this.emitter = emitter;
    this.precision = precision;
  }

  @Override
  public boolean accept(ContinuousQuery query, List<SeriesResult> results, TimeRange window) {
    if (results.isEmpty()) {
      return true;
    }
    List<SeriesResult> rendered = results.stream()
        .map(result -> result.inPrecision(precision))
        .toList();
    try {
      emitter.send(SseEmitter.event()
          .name(EVENT_NAME)
          .id(query.id() + "-" + (query.runs() + 1))
          .data(rendered, MediaType.APPLICATION_JSON));
      return true;
    } catch (IOException | IllegalStateException ex) {
      log.debug("Subscriber of continuous query {} went away: {}", query.id(), ex.getMessage());
      return false;
    }
  }

  @Override
  public void close() {
    emitter.complete();
  }
}
