package org.hypertrace.core.query.compiler.stage;

import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.QueryCompilerConfig;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.api.ReduceExpression;
import org.hypertrace.core.query.compiler.smoothing.SmoothingAlgorithm;

/**
 * Emits the series smoothing stages. {@code ewma} and {@code auto} rebuild the aggregation as a
 * make-series which replaces the summarize stage, {@code median} evaluates a rolling percentile
 * over the summarized rows.
 */
@Singleton
public class SmoothingStageBuilder implements QueryStageBuilder {

  private static final String SERIES_COLUMN = "a";
  private static final String SMOOTHED_COLUMN = "b";
  private static final int MOVING_AVERAGE_WINDOW = 10;
  private static final int MEDIAN_PERCENTILE = 50;

  private final String defaultWeight;

  @Inject
  SmoothingStageBuilder(QueryCompilerConfig config) {
    this.defaultWeight = config.getSmoothingConfig().getDefaultWeight();
  }

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    if (context.getSmoothingAlgorithm().isEmpty() || context.getTimeColumn().isEmpty()) {
      return;
    }
    SmoothingAlgorithm algorithm = context.getSmoothingAlgorithm().get();
    String timeColumn = context.getTimeColumn().get();

    // presence of both is checked when the algorithm is detected
    ReduceExpression reduce = ExpressionUtil.getReduceExpressions(expression.getReduce()).get(0);
    String interval =
        ExpressionUtil.getFirstIntervalGroupBy(expression.getGroupBy()).get().getInterval();

    String reduceFunc = reduce.getReduceFunc();
    String reduceColumn = context.castIfDynamic(reduce.getProperty().getName());
    List<String> groupByParts = getGroupByParts(context, expression);
    String groups = String.join(", ", groupByParts);

    switch (algorithm) {
      case EWMA:
      case AUTO:
        String makeSeries =
            String.format(
                "make-series %s=%s(%s) on %s from $__timeFrom to $__timeTo step %s",
                SERIES_COLUMN, reduceFunc, reduceColumn, timeColumn, interval);
        stages.add(groupByParts.isEmpty() ? makeSeries : makeSeries + " by " + groups);

        if (algorithm == SmoothingAlgorithm.EWMA) {
          stages.add(
              String.format(
                  "extend %s=series_exp_smoothing_udf(%s, %s)",
                  SMOOTHED_COLUMN, SERIES_COLUMN, resolveWeight(algorithm, expression)));
        } else {
          stages.add(
              String.format(
                  "extend %s=series_moving_avg_udf(%s, %d, false)",
                  SMOOTHED_COLUMN, SERIES_COLUMN, MOVING_AVERAGE_WINDOW));
        }

        stages.add(
            String.format(
                "mv-expand %s to typeof(datetime), %s to typeof(real)",
                timeColumn, SMOOTHED_COLUMN));
        String project = String.format("project %s, %s", timeColumn, SMOOTHED_COLUMN);
        stages.add(groupByParts.isEmpty() ? project : project + ", " + groups);
        return;
      case MEDIAN:
        String rollingPercentile =
            String.format(
                "evaluate rolling_percentile(%s_%s, %d, %s, %s, %s",
                reduceFunc,
                reduceColumn,
                MEDIAN_PERCENTILE,
                timeColumn,
                interval,
                resolveWeight(algorithm, expression));
        if (groupByParts.isEmpty()) {
          stages.add(rollingPercentile + ")");
        } else {
          stages.add(rollingPercentile + ", " + groups + ")");
        }
        return;
      default:
        throw new UnsupportedOperationException("Unsupported smoothing algorithm " + algorithm);
    }
  }

  @Override
  public int getPriority() {
    return StagePriority.SMOOTHING;
  }

  private String resolveWeight(SmoothingAlgorithm algorithm, QueryExpression expression) {
    String weightIndex =
        StringUtils.isNotBlank(expression.getSmoothingWeight())
            ? expression.getSmoothingWeight()
            : defaultWeight;
    return algorithm.translateWeight(weightIndex);
  }

  private List<String> getGroupByParts(CompilerContext context, QueryExpression expression) {
    List<String> groupByParts = new ArrayList<>();
    for (GroupByExpression groupBy :
        ExpressionUtil.getGroupByExpressions(expression.getGroupBy())) {
      if (groupBy.hasInterval() || !ExpressionUtil.hasPropertyName(groupBy.getProperty())) {
        continue;
      }
      groupByParts.add(context.castIfDynamic(groupBy.getProperty().getName()));
    }
    return groupByParts;
  }
}
