package com.ospicorp.tsdb.database.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record AccessKey(
    String key,
    Permission permission,
    @JsonProperty("created_at") Instant createdAt
) {}
