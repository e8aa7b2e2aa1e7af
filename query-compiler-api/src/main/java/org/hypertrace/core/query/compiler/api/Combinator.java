package org.hypertrace.core.query.compiler.api;

public enum Combinator {
  AND,
  OR
}
