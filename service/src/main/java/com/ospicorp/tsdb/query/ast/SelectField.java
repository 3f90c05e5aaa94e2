package com.ospicorp.tsdb.query.ast;

/** A selected expression with its optional {@code as} alias. */
public record SelectField(Expr expr, String alias) {}
