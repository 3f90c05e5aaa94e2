package com.ospicorp.tsdb.query.ast;

public sealed interface Statement permits SelectStatement, DeleteStatement {
}
