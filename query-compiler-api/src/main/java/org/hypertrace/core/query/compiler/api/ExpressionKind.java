package org.hypertrace.core.query.compiler.api;

/** Closed set of expression variants understood by the compiler. */
public enum ExpressionKind {
  PROPERTY,
  OPERATOR,
  AND,
  OR,
  REDUCE,
  GROUP_BY,
  /** Malformed or unknown node; skipped by every stage builder. */
  UNRECOGNIZED
}
