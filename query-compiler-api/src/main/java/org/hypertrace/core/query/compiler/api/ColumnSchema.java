package org.hypertrace.core.query.compiler.api;

import lombok.AllArgsConstructor;
import lombok.Value;

/** A column as reported by the query service schema, e.g. {@code Tags.region: string}. */
@Value
@AllArgsConstructor(staticName = "of")
public class ColumnSchema {
  String name;
  String queryLanguageType;
}
