package org.hypertrace.core.query.compiler.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.ExpressionKind;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.OperatorExpression;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.api.ReduceExpression;
import org.junit.jupiter.api.Test;

public class QueryExpressionUtilTest {

  @Test
  public void testCreateTimeBinGroupBy() {
    GroupByExpression groupBy =
        QueryExpressionUtil.createTimeBinGroupByExpression("Timestamp", "5m");
    assertEquals(ExpressionKind.GROUP_BY, groupBy.getKind());
    assertEquals(PropertyType.DATE_TIME, groupBy.getProperty().getType());
    assertTrue(groupBy.hasInterval());
    assertFalse(
        QueryExpressionUtil.createGroupByExpression(
                QueryExpressionUtil.createStringProperty("Level"))
            .hasInterval());
  }

  @Test
  public void testCreateOperatorExpressions() {
    OperatorExpression single =
        QueryExpressionUtil.createOperatorExpression(
            QueryExpressionUtil.createStringProperty("Level"), "==", "error");
    assertEquals("error", single.getOperator().getValue());
    assertFalse(single.getOperator().isMultiValue());

    OperatorExpression multi =
        QueryExpressionUtil.createMultiValueOperatorExpression(
            QueryExpressionUtil.createStringProperty("Level"), "in", "error", "warn");
    assertEquals(List.of("error", "warn"), multi.getOperator().getValues());
    assertTrue(multi.getOperator().isMultiValue());

    OperatorExpression unary =
        QueryExpressionUtil.createUnaryOperatorExpression(
            QueryExpressionUtil.createStringProperty("Level"), "isnotempty");
    assertNull(unary.getOperator().getValue());
  }

  @Test
  public void testArrayExpressionKinds() {
    ArrayExpression or = QueryExpressionUtil.createOrExpression();
    assertEquals(ExpressionKind.OR, or.getKind());
    assertEquals(ExpressionKind.AND, QueryExpressionUtil.createAndExpression().getKind());
    assertTrue(ArrayExpression.empty().isEmpty());
  }

  @Test
  public void testCreateReduceWithParameters() {
    ReduceExpression percentile =
        QueryExpressionUtil.createReduceExpression(
            "percentile",
            QueryExpressionUtil.createProperty("Duration", PropertyType.NUMBER),
            QueryExpressionUtil.createNumberParameter("95"));
    assertTrue(percentile.hasParameters());
    assertEquals(PropertyType.NUMBER, percentile.getParameters().get(0).getFieldType());
  }

  @Test
  public void testQueryExpressionDefaultsToEmptySections() {
    QueryExpression expression = QueryExpression.builder().build();
    assertTrue(expression.getWhere().isEmpty());
    assertTrue(expression.getReduce().isEmpty());
    assertTrue(expression.getGroupBy().isEmpty());
    assertThrows(
        NullPointerException.class, () -> QueryExpression.builder().where(null).build());
  }

  @Test
  public void testPropertyTypeFromWireName() {
    assertEquals(PropertyType.DATE_TIME, PropertyType.fromWireName("dateTime").get());
    assertEquals(PropertyType.NUMBER, PropertyType.fromWireName("NUMBER").get());
    assertTrue(PropertyType.fromWireName("timespan").isEmpty());
  }
}
