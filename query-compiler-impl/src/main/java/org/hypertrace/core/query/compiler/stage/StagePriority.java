package org.hypertrace.core.query.compiler.stage;

/** Position of each builder in the generated pipeline. */
final class StagePriority {
  static final int SOURCE = 0;
  static final int TIME_FILTER = 10;
  static final int WHERE = 20;
  static final int TIMESHIFT = 30;
  static final int SUMMARIZE = 40;
  static final int SMOOTHING = 50;
  static final int ORDER_BY = 60;

  private StagePriority() {}
}
