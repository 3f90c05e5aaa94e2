package com.ospicorp.tsdb.query.ast;

public record Now() implements Expr {}
