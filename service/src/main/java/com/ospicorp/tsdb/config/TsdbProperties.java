package com.ospicorp.tsdb.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("tsdb")
@Validated
public record TsdbProperties(
    @Valid @DefaultValue Query query,
    @Valid @DefaultValue ContinuousQueries continuousQueries,
    @DefaultValue Security security,
    @DefaultValue Storage storage
) {

  /**
   * Defaults applied by the query engine when a query leaves them out.
   *
   * @param defaultLimit rows returned per result series without a {@code limit} clause
   * @param defaultWindow how far back a query reaches without a lower time bound
   * @param maxBuckets upper bound on the buckets {@code fill(...)} may generate
   */
  public record Query(
      @Min(1) @DefaultValue("1000") int defaultLimit,
      @NotNull @DefaultValue("1h") Duration defaultWindow,
      @Min(1) @DefaultValue("100000") int maxBuckets
  ) {}

  public record ContinuousQueries(
      @NotNull @DefaultValue("10s") Duration interval,
      @NotNull @DefaultValue("30m") Duration streamTimeout
  ) {}

  /**
   * @param adminKey key required by administration endpoints; blank leaves them open
   */
  public record Security(
      @DefaultValue("") String adminKey
  ) {}

  /**
   * @param type {@code memory} or {@code jdbc}; read by the storage conditions
   */
  public record Storage(
      @DefaultValue("memory") String type
  ) {}
}
