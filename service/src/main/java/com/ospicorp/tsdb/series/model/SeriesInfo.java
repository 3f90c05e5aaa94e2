package com.ospicorp.tsdb.series.model;

import java.util.List;

public record SeriesInfo(String name, List<String> columns) {}
