package org.hypertrace.core.query.compiler.api;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class OperatorExpression implements Expression {
  PropertyExpression property;
  Operator operator;

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.OPERATOR;
  }
}
