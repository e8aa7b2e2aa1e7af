package org.hypertrace.core.query.compiler.stage;

import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/** Sorts raw rows and time binned results ascending by the time column. */
@Singleton
public class OrderByStageBuilder implements QueryStageBuilder {

  @Inject
  OrderByStageBuilder() {}

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    if (context.getTimeColumn().isEmpty()) {
      return;
    }

    boolean rawRows = expression.getGroupBy().isEmpty() && expression.getReduce().isEmpty();
    boolean timeBinned =
        ExpressionUtil.getFirstIntervalGroupBy(expression.getGroupBy()).isPresent();
    if (rawRows || timeBinned) {
      stages.add(String.format("order by %s asc", context.getTimeColumn().get()));
    }
  }

  @Override
  public int getPriority() {
    return StagePriority.ORDER_BY;
  }
}
