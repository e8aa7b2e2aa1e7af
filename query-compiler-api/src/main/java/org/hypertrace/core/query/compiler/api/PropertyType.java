package org.hypertrace.core.query.compiler.api;

import java.util.Arrays;
import java.util.Optional;

public enum PropertyType {
  NUMBER("number"),
  STRING("string"),
  BOOLEAN("boolean"),
  DATE_TIME("dateTime"),
  DYNAMIC("dynamic"),
  FUNCTION("function"),
  INTERVAL("interval");

  private final String wireName;

  PropertyType(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  public static Optional<PropertyType> fromWireName(String wireName) {
    return Arrays.stream(values())
        .filter(type -> type.wireName.equalsIgnoreCase(wireName))
        .findFirst();
  }
}
