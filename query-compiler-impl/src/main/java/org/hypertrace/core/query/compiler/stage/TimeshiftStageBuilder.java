package org.hypertrace.core.query.compiler.stage;

import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/** Moves a shifted series forward again so it lines up with the current time range. */
@Singleton
public class TimeshiftStageBuilder implements QueryStageBuilder {

  @Inject
  TimeshiftStageBuilder() {}

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    if (context.getTimeColumn().isEmpty() || context.getTimeshift().isEmpty()) {
      return;
    }
    String column = context.getTimeColumn().get();
    stages.add(
        String.format("extend %s = %s + %s", column, column, context.getTimeshift().get()));
  }

  @Override
  public int getPriority() {
    return StagePriority.TIMESHIFT;
  }
}
