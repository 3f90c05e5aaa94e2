package com.ospicorp.tsdb.continuous.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContinuousQueryView(
    long id,
    String query,
    ContinuousQueryKind kind,
    String into,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("last_run_at") Instant lastRunAt,
    long runs
) {}
