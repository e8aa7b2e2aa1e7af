package org.hypertrace.core.query.compiler.stage;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/**
 * Invokes each registered stage builder in priority order, collecting the stages each of them
 * appends. Builders registered with equal priority keep their registration order.
 */
@Singleton
public class QueryStagePipeline {
  private final List<QueryStageBuilder> stageBuilders;

  @Inject
  public QueryStagePipeline(Set<QueryStageBuilder> stageBuilders) {
    this.stageBuilders = ImmutableList.sortedCopyOf(Ordering.natural(), stageBuilders);
  }

  public List<String> build(CompilerContext context, QueryExpression expression) {
    List<String> stages = new ArrayList<>();
    for (QueryStageBuilder stageBuilder : stageBuilders) {
      stageBuilder.appendStages(context, expression, stages);
    }
    return stages;
  }
}
