package org.hypertrace.core.query.compiler.column;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/**
 * Resolves columns against the table schema of a single compile call: picks the time column and
 * unwraps nested (dynamic) columns into cast chains such as {@code
 * tostring(todynamic(Tags).region)}.
 */
public class ColumnResolver {

  private static final String PATH_SEPARATOR = ".";
  private static final String TO_DYNAMIC = "todynamic";
  private static final String DATETIME_TYPE = "datetime";
  private static final Splitter PATH_SPLITTER = Splitter.on(PATH_SEPARATOR);

  private final Optional<List<ColumnSchema>> tableSchema;

  public ColumnResolver(List<ColumnSchema> tableSchema) {
    this.tableSchema = Optional.ofNullable(tableSchema);
  }

  /**
   * Picks the column the time filter and ordering apply to: the binned date time group by if any,
   * else the first top level datetime column of the schema, else the first nested one.
   */
  public Optional<String> resolveTimeColumn(QueryExpression expression) {
    Optional<GroupByExpression> groupByTimeColumn =
        ExpressionUtil.getGroupByExpressions(expression.getGroupBy()).stream()
            .filter(
                groupBy ->
                    ExpressionUtil.hasPropertyName(groupBy.getProperty())
                        && groupBy.getProperty().getType() == PropertyType.DATE_TIME
                        && groupBy.hasInterval())
            .findFirst();
    if (groupByTimeColumn.isPresent()) {
      return Optional.of(castIfDynamic(groupByTimeColumn.get().getProperty().getName()));
    }

    if (tableSchema.isEmpty()) {
      return Optional.empty();
    }

    Optional<ColumnSchema> firstLevelColumn =
        tableSchema.get().stream()
            .filter(column -> isDateTime(column) && !column.getName().contains(PATH_SEPARATOR))
            .findFirst();
    if (firstLevelColumn.isPresent()) {
      return Optional.of(firstLevelColumn.get().getName());
    }

    return tableSchema.get().stream()
        .filter(this::isDateTime)
        .findFirst()
        .map(column -> castIfDynamic(column.getName()));
  }

  /** A column is dynamic if it addresses a nested path or is already cast to dynamic. */
  public static boolean isDynamic(String column) {
    return column != null && (column.contains(PATH_SEPARATOR) || column.contains(TO_DYNAMIC));
  }

  /**
   * Folds a nested column into its cast chain using the schema type of the column. Columns which
   * are not dynamic or not part of the schema are returned as is.
   */
  public String castIfDynamic(String column) {
    if (!isDynamic(column) || tableSchema.isEmpty()) {
      return column;
    }
    return tableSchema.get().stream()
        .filter(schema -> column.equals(schema.getName()))
        .findFirst()
        .map(ColumnResolver::toDynamic)
        .orElse(column);
  }

  private static String toDynamic(ColumnSchema column) {
    List<String> parts = PATH_SPLITTER.splitToList(column.getName());
    StringBuilder result = new StringBuilder();
    for (int index = 0; index < parts.size(); index++) {
      String part = parts.get(index);
      if (index == 0) {
        result.append(TO_DYNAMIC).append("(").append(part).append(")");
        continue;
      }
      String cast =
          index == parts.size() - 1 ? "to" + column.getQueryLanguageType() : TO_DYNAMIC;
      result.insert(0, cast + "(").append(PATH_SEPARATOR).append(part).append(")");
    }
    return result.toString();
  }

  private boolean isDateTime(ColumnSchema column) {
    return DATETIME_TYPE.equals(column.getQueryLanguageType()) && column.getName() != null;
  }
}
