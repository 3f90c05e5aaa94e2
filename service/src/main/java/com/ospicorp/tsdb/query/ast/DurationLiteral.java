package com.ospicorp.tsdb.query.ast;

import java.time.Duration;

public record DurationLiteral(Duration duration) implements Expr {}
