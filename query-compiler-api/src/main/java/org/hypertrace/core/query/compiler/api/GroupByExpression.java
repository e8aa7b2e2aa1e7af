package org.hypertrace.core.query.compiler.api;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

/** Grouping column. When {@code interval} is set this is the binned time dimension. */
@Value
@Builder(toBuilder = true)
public class GroupByExpression implements Expression {
  PropertyExpression property;
  String interval;

  public boolean hasInterval() {
    return StringUtils.isNotEmpty(interval);
  }

  @Override
  public ExpressionKind getKind() {
    return ExpressionKind.GROUP_BY;
  }
}
