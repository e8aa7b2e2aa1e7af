package org.hypertrace.core.query.compiler.api;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A comparison or unary test. Single valued operators carry at most one entry in {@code values};
 * multi valued operators (e.g. {@code in}) set {@code multiValue} and render as a list.
 */
@Value
@Builder(toBuilder = true)
public class Operator {
  String name;
  @Singular List<String> values;
  boolean multiValue;

  /** The single value of this operator, or null if none was provided. */
  public String getValue() {
    return values.isEmpty() ? null : values.get(0);
  }
}
