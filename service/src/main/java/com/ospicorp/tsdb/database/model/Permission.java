package com.ospicorp.tsdb.database.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Permission {
  READ,
  WRITE;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static Permission fromCode(String code) {
    for (Permission permission : values()) {
      if (permission.code().equalsIgnoreCase(code)) {
        return permission;
      }
    }
    throw new IllegalArgumentException(
        "Unknown permission '" + code + "'. Supported values: read,write.");
  }
}
