package org.hypertrace.core.query.compiler.stage;

import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.column.ColumnResolver;

/**
 * Restricts the source to the dashboard time range. A shifted query widens the range backwards by
 * the shift; dynamic columns get an explicit range since the time filter macro can not unwrap them.
 */
@Singleton
public class TimeFilterStageBuilder implements QueryStageBuilder {

  @Inject
  TimeFilterStageBuilder() {}

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    Optional<String> timeColumn = context.getTimeColumn();
    if (timeColumn.isEmpty()) {
      return;
    }
    String column = timeColumn.get();

    Optional<String> timeshift = context.getTimeshift();
    if (timeshift.isPresent()) {
      stages.add(
          String.format(
              "where %s between (($__timeFrom - %s) .. ($__timeTo - %s))",
              column, timeshift.get(), timeshift.get()));
      return;
    }

    if (ColumnResolver.isDynamic(column)) {
      stages.add(String.format("where %s between ($__timeFrom .. $__timeTo)", column));
      return;
    }

    stages.add(String.format("where $__timeFilter(%s)", column));
  }

  @Override
  public int getPriority() {
    return StagePriority.TIME_FILTER;
  }
}
