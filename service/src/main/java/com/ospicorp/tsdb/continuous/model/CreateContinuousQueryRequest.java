package com.ospicorp.tsdb.continuous.model;

import jakarta.validation.constraints.NotBlank;

public record CreateContinuousQueryRequest(@NotBlank String query) {}
