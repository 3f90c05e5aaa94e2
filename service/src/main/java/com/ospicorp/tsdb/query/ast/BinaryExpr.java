package com.ospicorp.tsdb.query.ast;

public record BinaryExpr(Operator operator, Expr left, Expr right) implements Expr {}
