package com.ospicorp.tsdb.query.ast;

public record SeriesSource(String name) implements Source {}
