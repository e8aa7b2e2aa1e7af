package org.hypertrace.core.query.compiler;

import java.util.List;
import org.hypertrace.core.query.compiler.api.AutocompleteQuery;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/**
 * Compiles visual editor expressions into pipe staged query programs. An empty string means there
 * is nothing to run yet. The table schema may be null when it has not been loaded.
 */
public interface QueryCompiler {

  String compile(QueryExpression expression, List<ColumnSchema> tableSchema);

  /**
   * Compiles a query listing the distinct values of the searched column which satisfy the other
   * filters of the expression.
   */
  String compileAutocomplete(AutocompleteQuery query, List<ColumnSchema> tableSchema);
}
