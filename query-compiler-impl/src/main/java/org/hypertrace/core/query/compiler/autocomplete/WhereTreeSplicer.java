package org.hypertrace.core.query.compiler.autocomplete;

import com.google.common.base.Splitter;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.query.compiler.ExpressionUtil;
import org.hypertrace.core.query.compiler.api.ArrayExpression;
import org.hypertrace.core.query.compiler.api.Expression;

/**
 * Places the expression being completed into a copy of the filter tree. The position is a dash
 * separated path of child indexes, e.g. {@code "1-0"} addresses the first child of the second top
 * level filter group.
 */
@Slf4j
public class WhereTreeSplicer {

  private static final Splitter INDEX_SPLITTER = Splitter.on('-');

  private WhereTreeSplicer() {}

  /**
   * Returns a new tree with {@code replacement} at {@code index}. An index at or beyond the end of
   * a group appends to it. A segment that does not address a group keeps the walk at the current
   * level, so the last index is applied there. The given tree is never modified and is returned
   * as is for a malformed path.
   */
  public static ArrayExpression splice(
      ArrayExpression where, String index, Expression replacement) {
    Optional<List<Integer>> path = parsePath(index);
    if (path.isEmpty()) {
      log.warn("Ignoring malformed autocomplete index '{}'", index);
      return where;
    }
    return splice(where, path.get(), 0, replacement);
  }

  private static ArrayExpression splice(
      ArrayExpression node, List<Integer> path, int depth, Expression replacement) {
    int key = path.get(depth);
    List<Expression> children = new ArrayList<>(node.getExpressions());

    if (depth < path.size() - 1) {
      if (key < children.size() && ExpressionUtil.isArrayExpression(children.get(key))) {
        children.set(
            key, splice((ArrayExpression) children.get(key), path, depth + 1, replacement));
        return node.toBuilder().clearExpressions().expressions(children).build();
      }
      // no group to descend into, the rest of the path applies to this level
      return splice(node, path, depth + 1, replacement);
    }

    if (key >= children.size()) {
      children.add(replacement);
    } else {
      children.set(key, replacement);
    }

    return node.toBuilder().clearExpressions().expressions(children).build();
  }

  private static Optional<List<Integer>> parsePath(String index) {
    if (StringUtils.isBlank(index)) {
      return Optional.empty();
    }
    List<Integer> path = new ArrayList<>();
    for (String segment : INDEX_SPLITTER.split(index.trim())) {
      Integer key = Ints.tryParse(segment);
      if (key == null || key < 0) {
        return Optional.empty();
      }
      path.add(key);
    }
    return Optional.of(path);
  }
}
