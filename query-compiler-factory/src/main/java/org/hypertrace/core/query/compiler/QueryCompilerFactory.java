package org.hypertrace.core.query.compiler;

import com.google.inject.Guice;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.hypertrace.core.query.compiler.api.TemplateVariableLookup;

public class QueryCompilerFactory {

  private static final String COMPILER_CONFIG_PATH = "compiler";

  /**
   * Builds a compiler from the {@code compiler} block of the given config. Settings missing from
   * it fall back to the bundled reference configuration.
   */
  public static QueryCompiler build(Config config, TemplateVariableLookup templateVariableLookup) {
    Config compilerConfig =
        config
            .withFallback(ConfigFactory.defaultReference())
            .resolve()
            .getConfig(COMPILER_CONFIG_PATH);
    return Guice.createInjector(new QueryCompilerModule(compilerConfig, templateVariableLookup))
        .getInstance(QueryCompiler.class);
  }

  public static QueryCompiler build(TemplateVariableLookup templateVariableLookup) {
    return build(ConfigFactory.load(), templateVariableLookup);
  }
}
