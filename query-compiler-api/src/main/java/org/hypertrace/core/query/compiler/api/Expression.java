package org.hypertrace.core.query.compiler.api;

/** A node of the editor expression tree. */
public interface Expression {
  ExpressionKind getKind();
}
