package com.ospicorp.tsdb.query.ast;

public record Star() implements Expr {}
