package org.hypertrace.core.query.compiler;

import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.PropertyExpression;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.column.ColumnResolver;
import org.hypertrace.core.query.compiler.format.ValueFormatter;
import org.hypertrace.core.query.compiler.smoothing.SmoothingAlgorithm;
import org.hypertrace.core.query.compiler.utils.TimeUtil;

/**
 * Wrapper class to hold what the stage builders share during a single compile call: the resolved
 * time column, the dynamic column cast and the detected time shift and smoothing settings.
 */
@Slf4j
public class CompilerContext {

  private final ColumnResolver columnResolver;
  private final ValueFormatter valueFormatter;
  private final Optional<String> timeColumn;
  private final Optional<String> timeshift;
  private final Optional<SmoothingAlgorithm> smoothingAlgorithm;

  CompilerContext(
      ColumnResolver columnResolver,
      ValueFormatter valueFormatter,
      Optional<String> timeColumn,
      Optional<String> timeshift,
      Optional<SmoothingAlgorithm> smoothingAlgorithm) {
    this.columnResolver = columnResolver;
    this.valueFormatter = valueFormatter;
    this.timeColumn = timeColumn;
    this.timeshift = timeshift;
    this.smoothingAlgorithm = smoothingAlgorithm;
  }

  public static CompilerContext create(
      QueryExpression expression, List<ColumnSchema> tableSchema, ValueFormatter valueFormatter) {
    ColumnResolver columnResolver = new ColumnResolver(tableSchema);
    Optional<String> timeColumn = columnResolver.resolveTimeColumn(expression);
    return new CompilerContext(
        columnResolver,
        valueFormatter,
        timeColumn,
        detectTimeshift(timeColumn, expression.getTimeshift()),
        detectSmoothing(timeColumn, expression));
  }

  public Optional<String> getTimeColumn() {
    return timeColumn;
  }

  /** Validated time shift such as "1d", only present if a time column was resolved. */
  public Optional<String> getTimeshift() {
    return timeshift;
  }

  /**
   * Smoothing algorithm to apply. Only present when the query has an aggregation, a binned time
   * group by and a resolved time column to build the series from.
   */
  public Optional<SmoothingAlgorithm> getSmoothingAlgorithm() {
    return smoothingAlgorithm;
  }

  public String castIfDynamic(String column) {
    return columnResolver.castIfDynamic(column);
  }

  public ValueFormatter getValueFormatter() {
    return valueFormatter;
  }

  private static Optional<String> detectTimeshift(
      Optional<String> timeColumn, PropertyExpression timeshift) {
    if (timeColumn.isEmpty() || !ExpressionUtil.hasPropertyName(timeshift)) {
      return Optional.empty();
    }
    if (!TimeUtil.isValidTimeSpan(timeshift.getName())) {
      log.debug("Ignoring invalid time shift {}", timeshift.getName());
      return Optional.empty();
    }
    return Optional.of(timeshift.getName());
  }

  private static Optional<SmoothingAlgorithm> detectSmoothing(
      Optional<String> timeColumn, QueryExpression expression) {
    if (!ExpressionUtil.hasPropertyName(expression.getSmoothing())) {
      return Optional.empty();
    }
    String name = expression.getSmoothing().getName();
    Optional<SmoothingAlgorithm> algorithm = SmoothingAlgorithm.fromName(name);
    if (algorithm.isEmpty()) {
      log.warn("Ignoring unknown smoothing algorithm {}", name);
      return Optional.empty();
    }
    boolean hasReduce =
        ExpressionUtil.getReduceExpressions(expression.getReduce()).stream()
            .findFirst()
            .filter(
                reduce ->
                    ExpressionUtil.hasPropertyName(reduce.getProperty())
                        && StringUtils.isNotEmpty(reduce.getReduceFunc()))
            .isPresent();
    boolean hasTimeBin =
        ExpressionUtil.getFirstIntervalGroupBy(expression.getGroupBy()).isPresent();
    if (!hasReduce || !hasTimeBin || timeColumn.isEmpty()) {
      log.debug(
          "Smoothing {} needs an aggregation, a time bin and a time column, skipping", name);
      return Optional.empty();
    }
    return algorithm;
  }
}
