package org.hypertrace.core.query.compiler.stage;

import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.List;
import org.hypertrace.core.query.compiler.CompilerContext;
import org.hypertrace.core.query.compiler.QueryCompilerConfig;
import org.hypertrace.core.query.compiler.api.ColumnSchema;
import org.hypertrace.core.query.compiler.api.DefinedTemplateVariables;
import org.hypertrace.core.query.compiler.api.QueryExpression;
import org.hypertrace.core.query.compiler.format.ValueFormatter;

class StageTestUtil {

  static final List<ColumnSchema> SCHEMA =
      List.of(
          ColumnSchema.of("Timestamp", "datetime"),
          ColumnSchema.of("Level", "string"),
          ColumnSchema.of("Value", "real"),
          ColumnSchema.of("Tags.region", "string"));

  static QueryCompilerConfig defaultConfig() {
    return new QueryCompilerConfig(ConfigFactory.defaultReference().getConfig("compiler"));
  }

  static List<String> appendStages(
      QueryStageBuilder stageBuilder, QueryExpression expression, List<ColumnSchema> schema) {
    CompilerContext context =
        CompilerContext.create(
            expression, schema, new ValueFormatter(DefinedTemplateVariables.of("env")));
    List<String> stages = new ArrayList<>();
    stageBuilder.appendStages(context, expression, stages);
    return stages;
  }
}
