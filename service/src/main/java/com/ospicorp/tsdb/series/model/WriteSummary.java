package com.ospicorp.tsdb.series.model;

public record WriteSummary(int series, int points) {}
