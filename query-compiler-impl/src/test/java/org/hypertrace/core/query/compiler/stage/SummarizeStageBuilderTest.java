package org.hypertrace.core.query.compiler.stage;

import static org.hypertrace.core.query.compiler.stage.StageTestUtil.SCHEMA;
import static org.hypertrace.core.query.compiler.stage.StageTestUtil.appendStages;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createAndExpression;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createGroupByExpression;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createNumberParameter;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createProperty;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createReduceExpression;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createStringProperty;
import static org.hypertrace.core.query.compiler.util.QueryExpressionUtil.createTimeBinGroupByExpression;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.hypertrace.core.query.compiler.api.PropertyExpression;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.api.ReduceExpression;
import org.hypertrace.core.query.compiler.api.ReduceParameter;
import org.junit.jupiter.api.Test;

class SummarizeStageBuilderTest {

  private final SummarizeStageBuilder summarizeStageBuilder = new SummarizeStageBuilder();

  @Test
  void deduplicatesCountAndPrependsTimeBin() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    ReduceExpression.builder().reduceFunc("count").build(),
                    createReduceExpression("count", createStringProperty("Level")),
                    createReduceExpression("avg", valueProperty())))
            .groupBy(
                createAndExpression(
                    createGroupByExpression(createStringProperty("Level")),
                    createTimeBinGroupByExpression("Timestamp", "5m")))
            .build();

    assertEquals(
        List.of("summarize count(), avg(Value) by bin(Timestamp, 5m), Level"),
        appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  @Test
  void formatsAggregationParametersByFieldType() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression(
                        "percentile", valueProperty(), createNumberParameter("95"))))
            .build();

    assertEquals(
        List.of("summarize percentile(Value, 95)"),
        appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  @Test
  void castsDynamicColumns() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression("dcount", createStringProperty("Tags.region"))))
            .groupBy(
                createAndExpression(
                    createGroupByExpression(createStringProperty("Tags.region"))))
            .build();

    assertEquals(
        List.of(
            "summarize dcount(tostring(todynamic(Tags).region))"
                + " by tostring(todynamic(Tags).region)"),
        appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  @Test
  void projectsColumnsOfNoneAggregations() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression("none", createStringProperty("Level")),
                    createReduceExpression("none", createStringProperty("Tags.region"))))
            .build();

    assertEquals(
        List.of("project Level, tostring(todynamic(Tags).region)"),
        appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  @Test
  void summarizesByGroupsOnly() {
    QueryExpression expression =
        baseExpression()
            .groupBy(createAndExpression(createGroupByExpression(createStringProperty("Level"))))
            .build();

    assertEquals(
        List.of("summarize by Level"), appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  @Test
  void usesOnlyFirstTimeBin() {
    QueryExpression expression =
        baseExpression()
            .reduce(createAndExpression(ReduceExpression.builder().reduceFunc("count").build()))
            .groupBy(
                createAndExpression(
                    createTimeBinGroupByExpression("Timestamp", "5m"),
                    createTimeBinGroupByExpression("Ingested", "1h")))
            .build();

    assertEquals(
        List.of("summarize count() by bin(Timestamp, 5m)"),
        appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  @Test
  void emitsNothingWithoutAggregationsOrGroups() {
    assertTrue(appendStages(summarizeStageBuilder, baseExpression().build(), SCHEMA).isEmpty());
  }

  @Test
  void yieldsToSeriesSmoothing() {
    assertTrue(appendStages(summarizeStageBuilder, smoothedExpression("ewma"), SCHEMA).isEmpty());
  }

  @Test
  void keepsSummarizeForMedianSmoothing() {
    assertEquals(
        List.of("summarize avg(Value) by bin(Timestamp, 1m)"),
        appendStages(summarizeStageBuilder, smoothedExpression("median"), SCHEMA));
  }

  @Test
  void yieldsToSmoothingOtherThanMedian() {
    assertTrue(appendStages(summarizeStageBuilder, smoothedExpression("auto"), SCHEMA).isEmpty());
    assertTrue(appendStages(summarizeStageBuilder, smoothedExpression("loess"), SCHEMA).isEmpty());
  }

  @Test
  void yieldsToSmoothingWithoutTimeBin() {
    QueryExpression expression =
        baseExpression()
            .reduce(createAndExpression(createReduceExpression("avg", valueProperty())))
            .groupBy(createAndExpression(createGroupByExpression(createStringProperty("Level"))))
            .smoothing(createStringProperty("ewma"))
            .build();

    assertTrue(appendStages(summarizeStageBuilder, expression, SCHEMA).isEmpty());
  }

  @Test
  void skipsAggregationParametersWithoutValue() {
    QueryExpression expression =
        baseExpression()
            .reduce(
                createAndExpression(
                    createReduceExpression(
                        "percentile",
                        valueProperty(),
                        ReduceParameter.builder().fieldType(PropertyType.NUMBER).build()),
                    createReduceExpression(
                        "percentiles",
                        valueProperty(),
                        createNumberParameter("50"),
                        ReduceParameter.builder().fieldType(PropertyType.BOOLEAN).build()),
                    ReduceExpression.builder()
                        .reduceFunc("count")
                        .parameter(ReduceParameter.builder().fieldType(PropertyType.NUMBER).build())
                        .build()))
            .build();

    assertEquals(
        List.of("summarize percentile(Value), percentiles(Value, 50), count()"),
        appendStages(summarizeStageBuilder, expression, SCHEMA));
  }

  private static QueryExpression smoothedExpression(String algorithm) {
    return baseExpression()
        .reduce(createAndExpression(createReduceExpression("avg", valueProperty())))
        .groupBy(createAndExpression(createTimeBinGroupByExpression("Timestamp", "1m")))
        .smoothing(createStringProperty(algorithm))
        .build();
  }

  private static QueryExpression.QueryExpressionBuilder baseExpression() {
    return QueryExpression.builder().from(createStringProperty("Logs"));
  }

  private static PropertyExpression valueProperty() {
    return createProperty("Value", PropertyType.NUMBER);
  }
}
