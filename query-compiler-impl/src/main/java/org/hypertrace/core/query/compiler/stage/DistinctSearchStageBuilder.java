package org.hypertrace.core.query.compiler.stage;

import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.QueryCompilerConfig;
import org.hypertrace.core.query.compiler.QueryCompilerConfig.AutocompleteConfig;
import org.hypertrace.core.query.compiler.api.OperatorExpression;

/**
 * Tail of an autocomplete query: bounds the scanned rows, then lists the distinct values of the
 * searched column. Not part of the regular pipeline.
 */
@Singleton
public class DistinctSearchStageBuilder {

  private final AutocompleteConfig autocompleteConfig;

  @Inject
  DistinctSearchStageBuilder(QueryCompilerConfig config) {
    this.autocompleteConfig = config.getAutocompleteConfig();
  }

  public void appendStages(
      CompilerContext context, OperatorExpression search, List<String> stages) {
    stages.add("take " + autocompleteConfig.getScanLimit());
    stages.add("distinct " + context.castIfDynamic(search.getProperty().getName()));
    stages.add("take " + autocompleteConfig.getResultLimit());
  }
}
