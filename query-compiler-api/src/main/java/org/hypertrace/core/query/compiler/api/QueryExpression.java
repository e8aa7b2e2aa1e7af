package org.hypertrace.core.query.compiler.api;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Root of a visual editor query: source table, filters, aggregations, grouping and the optional
 * time shift and smoothing settings.
 */
@Value
@Builder(toBuilder = true)
public class QueryExpression {
  PropertyExpression from;
  @NonNull @Builder.Default ArrayExpression where = ArrayExpression.empty();
  @NonNull @Builder.Default ArrayExpression reduce = ArrayExpression.empty();
  @NonNull @Builder.Default ArrayExpression groupBy = ArrayExpression.empty();
  PropertyExpression timeshift;
  PropertyExpression smoothing;
  /* ordinal weight index picked in the editor, "0" (low) to "3" (max) */
  String smoothingWeight;
}
