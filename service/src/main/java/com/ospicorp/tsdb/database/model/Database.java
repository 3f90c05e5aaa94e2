package com.ospicorp.tsdb.database.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record Database(
    String name,
    @JsonProperty("created_at") Instant createdAt
) {
  public static final String NAME_REGEX = "^[A-Za-z0-9_-]{1,64}$";
}
