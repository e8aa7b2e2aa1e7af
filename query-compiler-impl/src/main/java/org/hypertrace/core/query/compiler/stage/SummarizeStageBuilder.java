package org.hypertrace.core.query.compiler.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.api.ReduceExpression;
import org.hypertrace.core.query.compiler.format.ValueFormatter;
import org.hypertrace.core.query.compiler.smoothing.SmoothingAlgorithm;

/**
 * Lowers aggregations and groupings into a {@code summarize} stage, or into a {@code project} of
 * the referenced columns when only {@code none} reductions are present. Runs only without smoothing
 * or with the rolling median.
 */
@Slf4j
@Singleton
public class SummarizeStageBuilder implements QueryStageBuilder {

  static final String COUNT_FUNCTION = "count";
  static final String NONE_FUNCTION = "none";

  @Inject
  SummarizeStageBuilder() {}

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    if (isSeriesSmoothingRequested(expression)) {
      return;
    }

    List<String> reduceParts = new ArrayList<>();
    List<String> columns = new ArrayList<>();
    boolean countAddedInReduce = false;

    for (ReduceExpression reduce : ExpressionUtil.getReduceExpressions(expression.getReduce())) {
      String func = reduce.getReduceFunc();
      if (StringUtils.isEmpty(func)) {
        log.debug("Skipping aggregation without function {}", reduce);
        continue;
      }

      boolean hasColumn = ExpressionUtil.hasPropertyName(reduce.getProperty());
      String column = hasColumn ? context.castIfDynamic(reduce.getProperty().getName()) : null;
      if (hasColumn) {
        columns.add(column);
      }

      List<String> parameters = formatParameters(context, reduce);

      // count does not need a column
      if (COUNT_FUNCTION.equals(func) && parameters.isEmpty()) {
        if (!countAddedInReduce) {
          countAddedInReduce = true;
          reduceParts.add("count()");
        }
        continue;
      }

      if (!hasColumn) {
        log.debug("Skipping aggregation without column {}", reduce);
        continue;
      }

      if (!parameters.isEmpty()) {
        reduceParts.add(String.format("%s(%s, %s)", func, column, String.join(", ", parameters)));
        continue;
      }

      if (!NONE_FUNCTION.equals(func)) {
        reduceParts.add(String.format("%s(%s)", func, column));
      }
    }

    List<String> groupByParts = getGroupByParts(context, expression);

    if (!reduceParts.isEmpty()) {
      if (!groupByParts.isEmpty()) {
        stages.add(
            String.format(
                "summarize %s by %s",
                String.join(", ", reduceParts), String.join(", ", groupByParts)));
        return;
      }
      stages.add("summarize " + String.join(", ", reduceParts));
      return;
    }

    if (!groupByParts.isEmpty()) {
      stages.add("summarize by " + String.join(", ", groupByParts));
      return;
    }

    if (!columns.isEmpty()) {
      stages.add("project " + String.join(", ", columns));
    }
  }

  @Override
  public int getPriority() {
    return StagePriority.SUMMARIZE;
  }

  /** Binned time dimension first, then the plain group by columns in order. */
  private List<String> getGroupByParts(CompilerContext context, QueryExpression expression) {
    List<String> groupByParts = new ArrayList<>();
    boolean binAdded = false;

    for (GroupByExpression groupBy :
        ExpressionUtil.getGroupByExpressions(expression.getGroupBy())) {
      if (!ExpressionUtil.hasPropertyName(groupBy.getProperty())) {
        continue;
      }
      String column = context.castIfDynamic(groupBy.getProperty().getName());

      if (groupBy.hasInterval()) {
        if (binAdded) {
          log.warn(
              "Only the first time bin is used, ignoring bin of {} by {}",
              column,
              groupBy.getInterval());
          continue;
        }
        binAdded = true;
        groupByParts.add(0, String.format("bin(%s, %s)", column, groupBy.getInterval()));
        continue;
      }

      groupByParts.add(column);
    }
    return groupByParts;
  }

  /** Any smoothing other than the rolling median replaces the aggregation. */
  private boolean isSeriesSmoothingRequested(QueryExpression expression) {
    return ExpressionUtil.hasPropertyName(expression.getSmoothing())
        && !SmoothingAlgorithm.MEDIAN.getName().equals(expression.getSmoothing().getName());
  }

  /** Parameters without a value are left out. */
  private List<String> formatParameters(CompilerContext context, ReduceExpression reduce) {
    ValueFormatter formatter = context.getValueFormatter();
    return reduce.getParameters().stream()
        .filter(parameter -> parameter.getValue() != null)
        .map(parameter -> formatter.format(parameter.getValue(), parameter.getFieldType()))
        .collect(Collectors.toList());
  }
}
