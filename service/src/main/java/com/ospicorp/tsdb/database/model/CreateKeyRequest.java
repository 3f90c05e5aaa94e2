package com.ospicorp.tsdb.database.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/** Key to add to a database; a missing {@code key} is generated. */
public record CreateKeyRequest(
    @Pattern(regexp = "^[A-Za-z0-9_-]{8,128}$") String key,
    @NotNull Permission permission
) {}
