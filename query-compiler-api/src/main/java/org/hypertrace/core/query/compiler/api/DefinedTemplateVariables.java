package org.hypertrace.core.query.compiler.api;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Set;

/** Fixed set of template variable names. */
public class DefinedTemplateVariables implements TemplateVariableLookup {
  private static final DefinedTemplateVariables NONE = new DefinedTemplateVariables(Set.of());

  private final Set<String> names;

  private DefinedTemplateVariables(Collection<String> names) {
    this.names = ImmutableSet.copyOf(names);
  }

  public static DefinedTemplateVariables of(String... names) {
    return new DefinedTemplateVariables(ImmutableSet.copyOf(names));
  }

  public static DefinedTemplateVariables of(Collection<String> names) {
    return new DefinedTemplateVariables(names);
  }

  public static DefinedTemplateVariables none() {
    return NONE;
  }

  @Override
  public Set<String> listDefinedVariables() {
    return names;
  }
}
