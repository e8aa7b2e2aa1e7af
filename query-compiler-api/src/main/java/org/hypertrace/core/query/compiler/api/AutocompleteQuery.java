package org.hypertrace.core.query.compiler.api;

import lombok.Builder;
import lombok.Value;

/**
 * Request for distinct values of {@code search.property}, evaluated against the filters of {@code
 * expression} with {@code search} spliced in at the dash separated {@code index} path of the where
 * tree.
 */
@Value
@Builder
public class AutocompleteQuery {
  QueryExpression expression;
  String index;
  OperatorExpression search;
}
