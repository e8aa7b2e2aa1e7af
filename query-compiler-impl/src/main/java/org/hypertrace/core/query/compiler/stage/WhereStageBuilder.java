package org.hypertrace.core.query.compiler.stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.QueryCompilerConfig;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.Expression;
import org.hypertrace.core.query.compiler.api.Operator;
import org.hypertrace.core.query.compiler.api.OperatorExpression;
import org.hypertrace.core.query.compiler.api.PropertyExpression;
import org.hypertrace.core.query.compiler.api.QueryExpression;

/**
 * Lowers the filter tree. Every child of the top level {@code and} becomes its own {@code where}
 * stage; an {@code or} becomes a single stage joining its children.
 */
@Slf4j
@Singleton
public class WhereStageBuilder implements QueryStageBuilder {

  private static final String WHERE_PREFIX = "where";
  private static final String AND_DELIMITER = " and ";
  private static final String OR_DELIMITER = " or ";

  private final Set<String> unaryOperators;

  @Inject
  WhereStageBuilder(QueryCompilerConfig config) {
    this.unaryOperators = config.getUnaryOperators();
  }

  @Override
  public void appendStages(
      CompilerContext context, QueryExpression expression, List<String> stages) {
    appendWhere(context, expression.getWhere(), stages, WHERE_PREFIX);
  }

  @Override
  public int getPriority() {
    return StagePriority.WHERE;
  }

  /**
   * @param prefix stage keyword, null while lowering the children of an {@code or} which are
   *     joined into a single stage
   */
  private void appendWhere(
      CompilerContext context, Expression expression, List<String> parts, String prefix) {
    if (expression == null) {
      return;
    }

    switch (expression.getKind()) {
      case AND:
        ArrayExpression and = (ArrayExpression) expression;
        if (prefix == null) {
          appendNestedGroup(context, and, AND_DELIMITER, parts);
          return;
        }
        and.getExpressions().forEach(child -> appendWhere(context, child, parts, prefix));
        return;
      case OR:
        ArrayExpression or = (ArrayExpression) expression;
        if (prefix == null) {
          appendNestedGroup(context, or, OR_DELIMITER, parts);
          return;
        }
        List<String> orParts = lowerChildren(context, or);
        if (orParts.isEmpty()) {
          return;
        }
        parts.add(withPrefix(String.join(OR_DELIMITER, orParts), prefix));
        return;
      case OPERATOR:
        appendOperator((OperatorExpression) expression, context, parts, prefix);
        return;
      default:
        log.debug("Skipping {} expression in where clause", expression.getKind());
    }
  }

  private void appendNestedGroup(
      CompilerContext context, ArrayExpression group, String delimiter, List<String> parts) {
    List<String> groupParts = lowerChildren(context, group);
    if (groupParts.isEmpty()) {
      return;
    }
    if (groupParts.size() == 1) {
      parts.add(groupParts.get(0));
      return;
    }
    parts.add("(" + String.join(delimiter, groupParts) + ")");
  }

  private List<String> lowerChildren(CompilerContext context, ArrayExpression group) {
    List<String> childParts = new ArrayList<>();
    group.getExpressions().forEach(child -> appendWhere(context, child, childParts, null));
    return childParts;
  }

  private void appendOperator(
      OperatorExpression expression, CompilerContext context, List<String> parts, String prefix) {
    PropertyExpression property = expression.getProperty();
    Operator operator = expression.getOperator();

    if (!ExpressionUtil.hasPropertyName(property)
        || operator == null
        || StringUtils.isEmpty(operator.getName())) {
      log.debug("Skipping incomplete filter {}", expression);
      return;
    }

    if (unaryOperators.contains(operator.getName())) {
      parts.add(withPrefix(operator.getName() + "(" + property.getName() + ")", prefix));
      return;
    }

    if (operator.getValues().isEmpty()) {
      log.debug("Skipping filter without value {}", expression);
      return;
    }

    String value = context.getValueFormatter().format(operator, property.getType());
    parts.add(withPrefix(property.getName() + " " + operator.getName() + " " + value, prefix));
  }

  private static String withPrefix(String value, String prefix) {
    if (prefix != null) {
      return prefix + " " + value;
    }
    return value;
  }
}
