package org.hypertrace.core.query.compiler.api;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ReduceExpression implements Expression {
  PropertyExpression property;
  String reduceFunc;
  @Singular List<ReduceParameter> parameters;

  public boolean hasParameters() {
    return !parameters.isEmpty();
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.REDUCE;
  }
}
