/*
 * Copyright 2024 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.javascript.jsbundle;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;

/**
 * A depth-first walk over a graph given by an adjacency function. Each node is visited at most
 * once per walk, so cycles terminate. Children are visited in the order the adjacency function
 * returns them.
 */
final class GraphTraversal<N, C> implements TraversalActions {
  private final Function<? super N, ? extends Iterable<? extends N>> children;
  private final Function<? super N, ?> key;
  private final GraphVisitor<N, C> visitor;
  private final Set<Object> visited = new HashSet<>();
  private boolean skipped = false;
  private boolean stopped = false;

  private GraphTraversal(
      Function<? super N, ? extends Iterable<? extends N>> children,
      Function<? super N, ?> key,
      GraphVisitor<N, C> visitor) {
    this.children = children;
    this.key = key;
    this.visitor = visitor;
  }

  /**
   * Walks the graph from each root in turn.
   *
   * @param key identifies a node for the visited set
   * @return the context in effect when the visitor called {@link #stop}, or null if the walk ran
   *     to completion
   */
  static <N, C> @Nullable C traverse(
      Iterable<? extends N> roots,
      Function<? super N, ? extends Iterable<? extends N>> children,
      Function<? super N, ?> key,
      GraphVisitor<N, C> visitor,
      @Nullable C startContext) {
    GraphTraversal<N, C> traversal = new GraphTraversal<>(children, key, visitor);
    for (N root : roots) {
      if (!traversal.visited.add(key.apply(root))) {
        continue;
      }
      C result = traversal.walk(root, startContext);
      if (traversal.stopped) {
        return result;
      }
    }
    return null;
  }

  private @Nullable C walk(N node, @Nullable C context) {
    skipped = false;
    C entered = visitor.enter(node, context, this);
    if (entered != null) {
      context = entered;
    }
    if (stopped) {
      return context;
    }
    if (skipped) {
      skipped = false;
      return null;
    }

    for (N child : children.apply(node)) {
      if (!visited.add(key.apply(child))) {
        continue;
      }
      C result = walk(child, context);
      if (stopped) {
        return result;
      }
    }

    C exited = visitor.exit(node, context, this);
    if (exited != null) {
      context = exited;
    }
    return stopped ? context : null;
  }

  @Override
  public void skipChildren() {
    skipped = true;
  }

  @Override
  public void stop() {
    stopped = true;
  }
}
