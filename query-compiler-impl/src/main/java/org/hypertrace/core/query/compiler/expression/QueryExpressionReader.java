package org.hypertrace.core.query.compiler.expression;

import static org.hypertrace.core.query.compiler.expression.ExpressionClassifier.EXPRESSIONS;
import static org.hypertrace.core.query.compiler.expression.ExpressionClassifier.OPERATOR;
import static org.hypertrace.core.query.compiler.expression.ExpressionClassifier.PROPERTY;
import static org.hypertrace.core.query.compiler.expression.ExpressionClassifier.REDUCE;
import static org.hypertrace.core.query.compiler.expression.ExpressionClassifier.TYPE;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.AutocompleteQuery;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.Combinator;
import org.hypertrace.core.query.compiler.api.Expression;
import org.hypertrace.core.query.compiler.api.ExpressionKind;
import org.hypertrace.core.query.compiler.api.GroupByExpression;
import org.hypertrace.core.query.compiler.api.Operator;
import org.hypertrace.core.query.compiler.api.OperatorExpression;
import org.hypertrace.core.query.compiler.api.PropertyExpression;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.api.ReduceExpression;
import org.hypertrace.core.query.compiler.api.ReduceParameter;
import org.hypertrace.core.query.compiler.api.UnrecognizedExpression;

/**
 * Reads the JSON documents stored by the visual query editor into the expression model, and the
 * table schema returned by the query service. Nodes which cannot be classified are kept as {@link
 * UnrecognizedExpression} so the compiler skips them.
 */
@Slf4j
public class QueryExpressionReader {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private static final String NAME = "name";
  private static final String VALUE = "value";
  private static final String INTERVAL = "interval";
  private static final String PARAMETERS = "parameters";
  private static final String FIELD_TYPE = "fieldType";

  private static final String FROM = "from";
  private static final String WHERE = "where";
  private static final String GROUP_BY = "groupBy";
  private static final String TIMESHIFT = "timeshift";
  private static final String SMOOTHING = "smoothing";
  private static final String SMOOTHING_WEIGHT = "smoothingWeight";

  private static final String EXPRESSION = "expression";
  private static final String INDEX = "index";
  private static final String SEARCH = "search";

  private static final String SCHEMA_NAME = "Name";
  private static final String SCHEMA_TYPE = "CslType";

  public QueryExpression readQueryExpression(String json) {
    return toQueryExpression(readObject(json));
  }

  public AutocompleteQuery readAutocompleteQuery(String json) {
    JsonNode node = readObject(json);
    AutocompleteQuery.AutocompleteQueryBuilder builder =
        AutocompleteQuery.builder().index(textOrNull(node.path(INDEX)));
    if (node.path(EXPRESSION).isObject()) {
      builder.expression(toQueryExpression(node.get(EXPRESSION)));
    }
    JsonNode search = node.path(SEARCH);
    if (ExpressionClassifier.classify(search) == ExpressionKind.OPERATOR) {
      builder.search(toOperatorExpression(search));
    } else {
      log.debug("Autocomplete search is not an operator expression: {}", search);
    }
    return builder.build();
  }

  public List<ColumnSchema> readColumnSchema(String json) {
    JsonNode node = readTree(json);
    if (!node.isArray()) {
      throw new IllegalArgumentException("Table schema must be a JSON array");
    }
    List<ColumnSchema> columns = new ArrayList<>();
    for (JsonNode column : node) {
      columns.add(
          ColumnSchema.of(
              textOrNull(column.path(SCHEMA_NAME)), textOrNull(column.path(SCHEMA_TYPE))));
    }
    return columns;
  }

  private QueryExpression toQueryExpression(JsonNode node) {
    return QueryExpression.builder()
        .from(toOptionalProperty(node.path(FROM)))
        .where(toArrayExpression(node.path(WHERE)))
        .reduce(toArrayExpression(node.path(REDUCE)))
        .groupBy(toArrayExpression(node.path(GROUP_BY)))
        .timeshift(toOptionalProperty(node.path(TIMESHIFT)))
        .smoothing(toOptionalProperty(node.path(SMOOTHING)))
        .smoothingWeight(textOrNull(node.path(SMOOTHING_WEIGHT)))
        .build();
  }

  private Expression toExpression(JsonNode node) {
    ExpressionKind kind = ExpressionClassifier.classify(node);
    switch (kind) {
      case PROPERTY:
        return toProperty(node.get(PROPERTY));
      case OPERATOR:
        return toOperatorExpression(node);
      case AND:
      case OR:
        return toArrayExpression(node);
      case REDUCE:
        return toReduceExpression(node);
      case GROUP_BY:
        return toGroupByExpression(node);
      case UNRECOGNIZED:
      default:
        log.debug("Unrecognized expression node {}", node);
        return new UnrecognizedExpression(textOrNull(node.path(TYPE)));
    }
  }

  /** Sections which are absent or malformed read as an empty conjunction. */
  private ArrayExpression toArrayExpression(JsonNode node) {
    ExpressionKind kind = ExpressionClassifier.classify(node);
    if (kind != ExpressionKind.AND && kind != ExpressionKind.OR) {
      return ArrayExpression.empty();
    }
    ArrayExpression.ArrayExpressionBuilder builder =
        ArrayExpression.builder()
            .combinator(kind == ExpressionKind.OR ? Combinator.OR : Combinator.AND);
    node.get(EXPRESSIONS).forEach(child -> builder.expression(toExpression(child)));
    return builder.build();
  }

  private OperatorExpression toOperatorExpression(JsonNode node) {
    JsonNode operatorNode = node.get(OPERATOR);
    Operator.OperatorBuilder operator =
        Operator.builder().name(textOrNull(operatorNode.path(NAME)));
    JsonNode value = operatorNode.path(VALUE);
    if (value.isArray()) {
      operator.multiValue(true);
      value.forEach(element -> operator.value(element.asText()));
    } else if (value.isValueNode() && !value.isNull()) {
      operator.value(value.asText());
    }
    return OperatorExpression.builder()
        .property(toProperty(node.get(PROPERTY)))
        .operator(operator.build())
        .build();
  }

  private ReduceExpression toReduceExpression(JsonNode node) {
    ReduceExpression.ReduceExpressionBuilder builder =
        ReduceExpression.builder()
            .property(toProperty(node.get(PROPERTY)))
            .reduceFunc(textOrNull(node.get(REDUCE).path(NAME)));
    for (JsonNode parameter : node.path(PARAMETERS)) {
      builder.parameter(
          ReduceParameter.builder()
              .value(textOrNull(parameter.path(VALUE)))
              .fieldType(toPropertyType(parameter.path(FIELD_TYPE)))
              .build());
    }
    return builder.build();
  }

  private GroupByExpression toGroupByExpression(JsonNode node) {
    return GroupByExpression.builder()
        .property(toProperty(node.get(PROPERTY)))
        .interval(textOrNull(node.path(INTERVAL).path(NAME)))
        .build();
  }

  private PropertyExpression toOptionalProperty(JsonNode node) {
    if (ExpressionClassifier.classify(node) != ExpressionKind.PROPERTY) {
      return null;
    }
    return toProperty(node.get(PROPERTY));
  }

  private PropertyExpression toProperty(JsonNode node) {
    return PropertyExpression.builder()
        .name(textOrNull(node.path(NAME)))
        .type(toPropertyType(node.path(TYPE)))
        .build();
  }

  private PropertyType toPropertyType(JsonNode node) {
    return PropertyType.fromWireName(node.asText()).orElse(PropertyType.STRING);
  }

  private static String textOrNull(JsonNode node) {
    return node.isValueNode() && !node.isNull() ? node.asText() : null;
  }

  private static JsonNode readObject(String json) {
    JsonNode node = readTree(json);
    if (!node.isObject()) {
      throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
    }
    return node;
  }

  private static JsonNode readTree(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON document must not be null");
    }
    try {
      return OBJECT_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON document", e);
    }
  }
}
