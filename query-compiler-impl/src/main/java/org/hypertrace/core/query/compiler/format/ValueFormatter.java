package org.hypertrace.core.query.compiler.format;

import java.util.List;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.hypertrace.core.query.compiler.api.Operator;
import org.hypertrace.core.query.compiler.api.PropertyType;
import org.hypertrace.core.query.compiler.api.TemplateVariableLookup;

/**
 * Renders literals as KQL text. Numbers and booleans are emitted raw, everything else is single
 * quoted. Embedded quotes are not escaped.
 */
@Singleton
public class ValueFormatter {

  private static final String TEMPLATE_VARIABLE_PREFIX = "$";

  private final TemplateVariableLookup templateVariables;

  @Inject
  public ValueFormatter(TemplateVariableLookup templateVariables) {
    this.templateVariables = templateVariables;
  }

  /** Formats the operand of an operator, as a parenthesized list for multi valued operators. */
  public String format(Operator operator, PropertyType type) {
    if (operator.isMultiValue()) {
      return format(operator.getValues(), type);
    }
    return format(operator.getValue(), type);
  }

  public String format(List<String> values, PropertyType type) {
    return values.stream()
        .map(value -> format(value, type))
        .collect(Collectors.joining(", ", "(", ")"));
  }

  public String format(String value, PropertyType type) {
    if (isTemplateVariable(value)) {
      return value;
    }
    if (type == null) {
      return quote(value);
    }
    switch (type) {
      case NUMBER:
      case BOOLEAN:
        return value;
      default:
        return quote(value);
    }
  }

  public boolean isTemplateVariable(String value) {
    return value != null
        && value.startsWith(TEMPLATE_VARIABLE_PREFIX)
        && templateVariables.exists(value.substring(TEMPLATE_VARIABLE_PREFIX.length()));
  }

  private String quote(String value) {
    return "'" + value + "'";
  }
}
