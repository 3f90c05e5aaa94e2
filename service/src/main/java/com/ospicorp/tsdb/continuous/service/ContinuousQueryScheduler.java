package com.ospicorp.tsdb.continuous.service;

import com.ospicorp.tsdb.config.TsdbProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Ticks the registered continuous queries at {@code tsdb.continuous-queries.interval}. */
@Component
public class ContinuousQueryScheduler {
  private static final Logger log = LoggerFactory.getLogger(ContinuousQueryScheduler.class);

  private final ContinuousQueryService service;
  private final ScheduledExecutorService executor;
  private final Duration interval;

  public ContinuousQueryScheduler(ContinuousQueryService service,
      @Qualifier("continuousQueryExecutor") ScheduledExecutorService executor,
      TsdbProperties properties) {
    this.service = service;
    this.executor = executor;
    this.interval = properties.continuousQueries().interval();
  }

  @PostConstruct
  public void start() {
    long millis = interval.toMillis();
    executor.scheduleWithFixedDelay(this::tick, millis, millis, TimeUnit.MILLISECONDS);
    log.info("Continuous queries run every {}", interval);
  }

  @PreDestroy
  public void stop() {
    executor.shutdownNow();
  }

  void tick() {
    try {
      service.runAll();
    } catch (RuntimeException ex) {
      // an exception escaping here would cancel the schedule
      log.error("Continuous query tick failed", ex);
    }
  }
}
