package com.ospicorp.tsdb.query.ast;

/** Node of a parsed expression. */
public sealed interface Expr
    permits FieldRef, Star, NumberLiteral, StringLiteral, RegexLiteral, DurationLiteral, Now,
    Forever, BinaryExpr, Call {
}
