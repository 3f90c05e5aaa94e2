package com.ospicorp.tsdb.query.parser;

/** A query that does not follow the grammar; {@code position} is the 0-based offset. */
public class QueryParseException extends RuntimeException {

  private final int position;

  public QueryParseException(String message, int position) {
    super(message + " at position " + position);
    this.position = position;
  }

  public int getPosition() {
    return position;
  }
}
