package com.ospicorp.tsdb.database.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record CreateDatabaseRequest(
    @NotBlank @Pattern(regexp = Database.NAME_REGEX) String name
) {}
