package com.ospicorp.tsdb.query.ast;

public record StringLiteral(String value) implements Expr {}
