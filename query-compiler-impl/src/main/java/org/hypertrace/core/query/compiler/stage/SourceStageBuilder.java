package org.hypertrace.core.query.compiler.stage;

import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/** Emits the source table, the first stage of every program. */
@Singleton
public class SourceStageBuilder implements QueryStageBuilder {

  @Inject
  SourceStageBuilder() {}

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    if (ExpressionUtil.hasPropertyName(expression.getFrom())) {
      stages.add(expression.getFrom().getName());
    }
  }

  @Override
  public int getPriority() {
    return StagePriority.SOURCE;
  }
}
