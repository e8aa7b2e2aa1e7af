package org.hypertrace.core.query.compiler.util;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.Combinator;
import org.hypertrace.core.query.compiler.api.Expression;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.Operator;
import org.hypertrace.core.query.compiler.api.OperatorExpression;
import org.hypertrace.core.query.compiler.api.PropertyExpression;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.ReduceExpression;
import org.hypertrace.core.query.compiler.api.ReduceParameter;

/**
 * Utility methods to easily create {@link org.hypertrace.core.query.compiler.api.QueryExpression}
 * trees, its filters, aggregations and groupings.
 */
public class QueryExpressionUtil {

  public static PropertyExpression createProperty(String name, PropertyType type) {
    return PropertyExpression.builder().name(name).type(type).build();
  }

  public static PropertyExpression createStringProperty(String name) {
    return createProperty(name, PropertyType.STRING);
  }

  public static OperatorExpression createOperatorExpression(
      PropertyExpression property, String operator, String value) {
    return OperatorExpression.builder()
        .property(property)
        .operator(Operator.builder().name(operator).value(value).build())
        .build();
  }

  public static OperatorExpression createMultiValueOperatorExpression(
      PropertyExpression property, String operator, String... values) {
    return OperatorExpression.builder()
        .property(property)
        .operator(
            Operator.builder()
                .name(operator)
                .values(Arrays.asList(values))
                .multiValue(true)
                .build())
        .build();
  }

  /** Creates an operator expression without operand, e.g. {@code isnotempty(column)}. */
  public static OperatorExpression createUnaryOperatorExpression(
      PropertyExpression property, String operator) {
    return OperatorExpression.builder()
        .property(property)
        .operator(Operator.builder().name(operator).build())
        .build();
  }

  public static ArrayExpression createAndExpression(Expression... expressions) {
    return createArrayExpression(Combinator.AND, ImmutableList.copyOf(expressions));
  }

  public static ArrayExpression createOrExpression(Expression... expressions) {
    return createArrayExpression(Combinator.OR, ImmutableList.copyOf(expressions));
  }

  public static ArrayExpression createArrayExpression(
      Combinator combinator, List<Expression> expressions) {
    return ArrayExpression.builder().combinator(combinator).expressions(expressions).build();
  }

  public static ReduceExpression createReduceExpression(
      String reduceFunc, PropertyExpression property) {
    return ReduceExpression.builder().reduceFunc(reduceFunc).property(property).build();
  }

  public static ReduceExpression createReduceExpression(
      String reduceFunc, PropertyExpression property, ReduceParameter... parameters) {
    return ReduceExpression.builder()
        .reduceFunc(reduceFunc)
        .property(property)
        .parameters(Arrays.asList(parameters))
        .build();
  }

  public static ReduceParameter createNumberParameter(String value) {
    return ReduceParameter.builder().value(value).fieldType(PropertyType.NUMBER).build();
  }

  public static GroupByExpression createGroupByExpression(PropertyExpression property) {
    return GroupByExpression.builder().property(property).build();
  }

  /** Creates a group by on a date time column binned by the given interval, e.g. "5m". */
  public static GroupByExpression createTimeBinGroupByExpression(String column, String interval) {
    return GroupByExpression.builder()
        .property(createProperty(column, PropertyType.DATE_TIME))
        .interval(interval)
        .build();
  }
}
