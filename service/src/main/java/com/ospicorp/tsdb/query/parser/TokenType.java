package com.ospicorp.tsdb.query.parser;

enum TokenType {
  IDENTIFIER,
  NUMBER,
  DURATION,
  STRING,
  OPERATOR,
  LPAREN,
  RPAREN,
  COMMA,
  STAR,
  EOF
}
