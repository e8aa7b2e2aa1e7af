package org.hypertrace.core.query.compiler.api;

import java.util.Set;

/**
 * Read-only view of the dashboard template variables defined by the caller. A literal equal to
 * {@code $name} of a defined variable is emitted verbatim instead of being quoted.
 */
public interface TemplateVariableLookup {
  Set<String> listDefinedVariables();

  default boolean exists(String name) {
    return listDefinedVariables().contains(name);
  }
}
