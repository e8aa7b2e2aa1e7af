package org.hypertrace.core.query.compiler.stage;

import java.util.List;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/**
 * Lowers one part of a query expression into zero or more pipeline stages. Builders run in
 * ascending priority and never read the stages produced by another builder.
 */
public interface QueryStageBuilder extends Comparable<QueryStageBuilder> {
  void appendStages(CompilerContext context, QueryExpression expression, List<String> stages);

  int getPriority();

  @Override
  default int compareTo(QueryStageBuilder other) {
    return Integer.compare(this.getPriority(), other.getPriority());
  }
}
