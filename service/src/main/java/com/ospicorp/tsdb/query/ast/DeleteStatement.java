package com.ospicorp.tsdb.query.ast;

/** {@code delete from <source> [where <time conditions>]}; {@code where} may be null. */
public record DeleteStatement(Source source, Expr where) implements Statement {}
