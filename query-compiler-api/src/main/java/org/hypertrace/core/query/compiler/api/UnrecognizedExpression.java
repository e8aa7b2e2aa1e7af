package org.hypertrace.core.query.compiler.api;

import lombok.Value;

/** Placeholder for a node that could not be classified; carries its raw type tag if any. */
@Value
public class UnrecognizedExpression implements Expression {
  String type;

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.UNRECOGNIZED;
  }
}
