package org.hypertrace.core.query.compiler.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hypertrace.core.query.compiler.api.ExpressionKind;

/**
 * Determines the kind of an editor expression node from its {@code type} tag and required members.
 * Nodes which are missing the tag, carry an unknown one or lack a required member are {@link
 * ExpressionKind#UNRECOGNIZED}.
 */
public class ExpressionClassifier {

  static final String TYPE = "type";
  static final String PROPERTY = "property";
  static final String OPERATOR = "operator";
  static final String EXPRESSIONS = "expressions";
  static final String REDUCE = "reduce";

  private ExpressionClassifier() {}

  public static ExpressionKind classify(JsonNode node) {
    if (node == null || !node.isObject() || !node.path(TYPE).isTextual()) {
      return ExpressionKind.UNRECOGNIZED;
    }

    switch (node.get(TYPE).asText()) {
      case "property":
        return hasObject(node, PROPERTY) ? ExpressionKind.PROPERTY : ExpressionKind.UNRECOGNIZED;
      case "operator":
        return hasObject(node, PROPERTY) && hasObject(node, OPERATOR)
            ? ExpressionKind.OPERATOR
            : ExpressionKind.UNRECOGNIZED;
      case "and":
        return node.path(EXPRESSIONS).isArray()
            ? ExpressionKind.AND
            : ExpressionKind.UNRECOGNIZED;
      case "or":
        return node.path(EXPRESSIONS).isArray() ? ExpressionKind.OR : ExpressionKind.UNRECOGNIZED;
      case "reduce":
        return hasObject(node, PROPERTY) && hasObject(node, REDUCE)
            ? ExpressionKind.REDUCE
            : ExpressionKind.UNRECOGNIZED;
      case "groupBy":
        return hasObject(node, PROPERTY) ? ExpressionKind.GROUP_BY : ExpressionKind.UNRECOGNIZED;
      default:
        return ExpressionKind.UNRECOGNIZED;
    }
  }

  private static boolean hasObject(JsonNode node, String field) {
    return node.path(field).isObject();
  }
}
