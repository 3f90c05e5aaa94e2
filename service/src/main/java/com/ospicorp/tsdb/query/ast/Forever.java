package com.ospicorp.tsdb.query.ast;

/** The open upper end of time, as in {@code where time < forever}. */
public record Forever() implements Expr {}
