package org.hypertrace.core.query.compiler.api;

import lombok.Builder;
import lombok.Value;

/** Reference to a column, table, interval or function by name. */
@Value
@Builder(toBuilder = true)
public class PropertyExpression implements Expression {
  String name;
  @Builder.Default PropertyType type = PropertyType.STRING;

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.PROPERTY;
  }
}
