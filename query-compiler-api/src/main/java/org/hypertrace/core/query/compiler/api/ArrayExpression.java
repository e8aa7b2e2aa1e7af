package org.hypertrace.core.query.compiler.api;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** Boolean combination of child expressions. Child order is preserved in the output. */
@Value
@Builder(toBuilder = true)
public class ArrayExpression implements Expression {
  @NonNull Combinator combinator;
  @Singular List<Expression> expressions;

  public static ArrayExpression empty() {
    return ArrayExpression.builder().combinator(Combinator.AND).build();
  }

  public boolean isEmpty() {
    return expressions.isEmpty();
  }

  @Override
  public ExpressionKind getKind() {
    return combinator == Combinator.OR ? ExpressionKind.OR : ExpressionKind.AND;
  }
}
