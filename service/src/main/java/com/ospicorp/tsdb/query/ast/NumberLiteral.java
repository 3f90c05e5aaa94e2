package com.ospicorp.tsdb.query.ast;

/** Integral literals hold a {@link Long}, the rest a {@link Double}. */
public record NumberLiteral(Number value) implements Expr {}
