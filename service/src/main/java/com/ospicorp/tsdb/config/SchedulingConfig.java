package com.ospicorp.tsdb.config;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

@Configuration
public class SchedulingConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(destroyMethod = "shutdownNow")
  public ScheduledExecutorService continuousQueryExecutor() {
    return Executors.newSingleThreadScheduledExecutor(
        new CustomizableThreadFactory("continuous-query-"));
  }
}
