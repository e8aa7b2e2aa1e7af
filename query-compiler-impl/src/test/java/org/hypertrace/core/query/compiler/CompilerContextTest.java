package org.hypertrace.core.query.compiler;

import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createAndExpression;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createProperty;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createReduceExpression;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createStringProperty;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createTimeBinGroupByExpression;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import java.util.Optional;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.DefinedTemplateVariables;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.format.ValueFormatter;
import org.hypertrace.core.query.compiler.smoothing.SmoothingAlgorithm;
import org.junit.jupiter.api.Test;

class CompilerContextTest {

  private static final List<ColumnSchema> SCHEMA =
      List.of(ColumnSchema.of("Timestamp", "datetime"), ColumnSchema.of("Value", "real"));
  private static final ValueFormatter VALUE_FORMATTER =
      new ValueFormatter(DefinedTemplateVariables.none());

  @Test
  void detectsValidTimeshift() {
    QueryExpression expression = baseExpression().timeshift(createStringProperty("1d")).build();

    CompilerContext context = CompilerContext.create(expression, SCHEMA, VALUE_FORMATTER);

    assertEquals(Optional.of("Timestamp"), context.getTimeColumn());
    assertEquals(Optional.of("1d"), context.getTimeshift());
  }

  @Test
  void ignoresMalformedTimeshift() {
    QueryExpression expression =
        baseExpression().timeshift(createStringProperty("yesterday")).build();

    assertEquals(
        Optional.empty(),
        CompilerContext.create(expression, SCHEMA, VALUE_FORMATTER).getTimeshift());
  }

  @Test
  void ignoresTimeshiftWithoutTimeColumn() {
    QueryExpression expression = baseExpression().timeshift(createStringProperty("1h")).build();

    CompilerContext context = CompilerContext.create(expression, null, VALUE_FORMATTER);

    assertEquals(Optional.empty(), context.getTimeColumn());
    assertEquals(Optional.empty(), context.getTimeshift());
  }

  @Test
  void detectsSmoothingWithAggregationAndTimeBin() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression("avg", createProperty("Value", PropertyType.NUMBER))))
            .groupBy(createAndExpression(createTimeBinGroupByExpression("Timestamp", "1m")))
            .smoothing(createStringProperty("median"))
            .build();

    assertEquals(
        Optional.of(SmoothingAlgorithm.MEDIAN),
        CompilerContext.create(expression, SCHEMA, VALUE_FORMATTER).getSmoothingAlgorithm());
  }

  @Test
  void skipsSmoothingWithoutTimeBin() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression("avg", createProperty("Value", PropertyType.NUMBER))))
            .smoothing(createStringProperty("ewma"))
            .build();

    assertEquals(
        Optional.empty(),
        CompilerContext.create(expression, SCHEMA, VALUE_FORMATTER).getSmoothingAlgorithm());
  }

  @Test
  void skipsUnknownSmoothingAlgorithm() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression("avg", createProperty("Value", PropertyType.NUMBER))))
            .groupBy(createAndExpression(createTimeBinGroupByExpression("Timestamp", "1m")))
            .smoothing(createStringProperty("loess"))
            .build();

    assertEquals(
        Optional.empty(),
        CompilerContext.create(expression, SCHEMA, VALUE_FORMATTER).getSmoothingAlgorithm());
  }

  private static QueryExpression.QueryExpressionBuilder baseExpression() {
    return QueryExpression.builder().from(createStringProperty("Metrics"));
  }
}
