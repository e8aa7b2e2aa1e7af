package org.hypertrace.core.query.compiler;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.Expression;
import org.hypertrace.core.query.compiler.api.ExpressionKind;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.PropertyExpression;
import org.hypertrace.core.query.compiler.api.ReduceExpression;

/** Accessors over the sections of a query expression, skipping nodes of other kinds. */
public class ExpressionUtil {

  public static List<ReduceExpression> getReduceExpressions(ArrayExpression reduce) {
    return reduce.getExpressions().stream()
        .filter(expression -> expression.getKind() == ExpressionKind.REDUCE)
        .map(ReduceExpression.class::cast)
        .collect(Collectors.toUnmodifiableList());
  }

  public static List<GroupByExpression> getGroupByExpressions(ArrayExpression groupBy) {
    return groupBy.getExpressions().stream()
        .filter(expression -> expression.getKind() == ExpressionKind.GROUP_BY)
        .map(GroupByExpression.class::cast)
        .collect(Collectors.toUnmodifiableList());
  }

  /** Only the first interval bearing group by defines the time bin. */
  public static Optional<GroupByExpression> getFirstIntervalGroupBy(ArrayExpression groupBy) {
    return getGroupByExpressions(groupBy).stream()
        .filter(GroupByExpression::hasInterval)
        .findFirst();
  }

  public static boolean hasPropertyName(PropertyExpression property) {
    return property != null && StringUtils.isNotEmpty(property.getName());
  }

  public static boolean isArrayExpression(Expression expression) {
    return expression != null
        && (expression.getKind() == ExpressionKind.AND
            || expression.getKind() == ExpressionKind.OR);
  }
}
