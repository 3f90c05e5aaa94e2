package com.ospicorp.tsdb.query.parser;

import java.util.Locale;

record Token(TokenType type, String text, int position) {

  boolean is(TokenType expected) {
    return type == expected;
  }

  boolean isKeyword(String keyword) {
    return type == TokenType.IDENTIFIER && text.equalsIgnoreCase(keyword);
  }

  boolean isOperator(String symbol) {
    return type == TokenType.OPERATOR && text.equals(symbol);
  }

  String lower() {
    return text.toLowerCase(Locale.ROOT);
  }

  String describe() {
    return type == TokenType.EOF ? "end of query" : "'" + text + "'";
  }
}
