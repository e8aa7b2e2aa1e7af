package org.hypertrace.core.query.compiler.api;

import lombok.Builder;
import lombok.Value;

/** Extra argument of an aggregation, e.g. the rank of a percentile. */
@Value
@Builder
public class ReduceParameter {
  String value;
  @Builder.Default PropertyType fieldType = PropertyType.STRING;
}
