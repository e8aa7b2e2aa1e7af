package org.hypertrace.core.query.compiler;

import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.AutocompleteQuery;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.OperatorExpression;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.autocomplete.WhereTreeSplicer;
import org.hypertrace.core.query.compiler.format.ValueFormatter;
import org.hypertrace.core.query.compiler.stage.DistinctSearchStageBuilder;
import org.hypertrace.core.query.compiler.stage.QueryStagePipeline;
import org.hypertrace.core.query.compiler.stage.SourceStageBuilder;
import org.hypertrace.core.query.compiler.stage.TimeFilterStageBuilder;
import org.hypertrace.core.query.compiler.stage.WhereStageBuilder;

@Singleton
@Slf4j
class KustoQueryCompiler implements QueryCompiler {

  static final String STAGE_SEPARATOR = "\n| ";

  private final QueryStagePipeline stagePipeline;
  private final ValueFormatter valueFormatter;
  private final SourceStageBuilder sourceStageBuilder;
  private final TimeFilterStageBuilder timeFilterStageBuilder;
  private final WhereStageBuilder whereStageBuilder;
  private final DistinctSearchStageBuilder distinctSearchStageBuilder;

  @Inject
  KustoQueryCompiler(
      QueryStagePipeline stagePipeline,
      ValueFormatter valueFormatter,
      SourceStageBuilder sourceStageBuilder,
      TimeFilterStageBuilder timeFilterStageBuilder,
      WhereStageBuilder whereStageBuilder,
      DistinctSearchStageBuilder distinctSearchStageBuilder) {
    this.stagePipeline = stagePipeline;
    this.valueFormatter = valueFormatter;
    this.sourceStageBuilder = sourceStageBuilder;
    this.timeFilterStageBuilder = timeFilterStageBuilder;
    this.whereStageBuilder = whereStageBuilder;
    this.distinctSearchStageBuilder = distinctSearchStageBuilder;
  }

  @Override
  public String compile(QueryExpression expression, List<ColumnSchema> tableSchema) {
    if (expression == null || !ExpressionUtil.hasPropertyName(expression.getFrom())) {
      return "";
    }

    CompilerContext context = CompilerContext.create(expression, tableSchema, valueFormatter);
    String query = String.join(STAGE_SEPARATOR, stagePipeline.build(context, expression));
    log.debug("Compiled query: {}", query);
    return query;
  }

  @Override
  public String compileAutocomplete(AutocompleteQuery query, List<ColumnSchema> tableSchema) {
    if (query == null
        || query.getExpression() == null
        || !ExpressionUtil.hasPropertyName(query.getExpression().getFrom())
        || query.getSearch() == null
        || !ExpressionUtil.hasPropertyName(query.getSearch().getProperty())) {
      return "";
    }

    OperatorExpression search = query.getSearch();
    ArrayExpression where =
        WhereTreeSplicer.splice(query.getExpression().getWhere(), query.getIndex(), search);
    // the suggested values are not shifted in time
    QueryExpression expression =
        query.getExpression().toBuilder().where(where).timeshift(null).build();
    CompilerContext context = CompilerContext.create(expression, tableSchema, valueFormatter);

    List<String> stages = new ArrayList<>();
    sourceStageBuilder.appendStages(context, expression, stages);
    timeFilterStageBuilder.appendStages(context, expression, stages);
    whereStageBuilder.appendStages(context, expression, stages);
    distinctSearchStageBuilder.appendStages(context, search, stages);

    String autocompleteQuery = String.join(STAGE_SEPARATOR, stages);
    log.debug("Compiled autocomplete query: {}", autocompleteQuery);
    return autocompleteQuery;
  }
}
