package com.ospicorp.tsdb.database;

public class DatabaseExistsException extends RuntimeException {

  public DatabaseExistsException(String message) {
    super(message);
  }
}
