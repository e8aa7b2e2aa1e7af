package org.hypertrace.core.query.compiler;

import com.google.inject.AbstractModule;
import com.typesafe.config.Config;
import org.hypertrace.core.query.compiler.api.TemplateVariableLookup;
import org.hypertrace.core.query.compiler.stage.StageModule;

public class QueryCompilerModule extends AbstractModule {

  private final QueryCompilerConfig config;
  private final TemplateVariableLookup templateVariableLookup;

  public QueryCompilerModule(Config config, TemplateVariableLookup templateVariableLookup) {
    this.config = new QueryCompilerConfig(config);
    this.templateVariableLookup = templateVariableLookup;
  }

  @Override
  protected void configure() {
    bind(QueryCompilerConfig.class).toInstance(this.config);
    bind(TemplateVariableLookup.class).toInstance(this.templateVariableLookup);
    bind(QueryCompiler.class).to(KustoQueryCompiler.class);
    install(new StageModule());
  }
}
