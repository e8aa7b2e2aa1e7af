package org.hypertrace.core.query.compiler.stage;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class StageModule extends AbstractModule {

  @Override
  protected void configure() {
    Multibinder<QueryStageBuilder> stageBuilders =
        Multibinder.newSetBinder(binder(), QueryStageBuilder.class);
    stageBuilders.addBinding().to(SourceStageBuilder.class);
    stageBuilders.addBinding().to(TimeFilterStageBuilder.class);
    stageBuilders.addBinding().to(WhereStageBuilder.class);
    stageBuilders.addBinding().to(TimeshiftStageBuilder.class);
    stageBuilders.addBinding().to(SummarizeStageBuilder.class);
    stageBuilders.addBinding().to(SmoothingStageBuilder.class);
    stageBuilders.addBinding().to(OrderByStageBuilder.class);
  }
}
