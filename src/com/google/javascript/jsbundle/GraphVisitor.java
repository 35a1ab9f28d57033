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

import org.jspecify.annotations.Nullable;

/**
 * Callbacks of a depth-first graph traversal.
 *
 * <p>{@link #enter} is called before a node's children and {@link #exit} after them. The context
 * returned by {@code enter} is passed to the node's children and to its {@code exit}; returning
 * null keeps the parent's context.
 *
 * @param <N> the node type
 * @param <C> the context type
 */
public interface GraphVisitor<N, C> {

  @Nullable C enter(N node, @Nullable C context, TraversalActions actions);

  default @Nullable C exit(N node, @Nullable C context, TraversalActions actions) {
    return null;
  }

  /** A single callback, as passed to {@link #of}. */
  @FunctionalInterface
  interface Callback<N, C> {
    @Nullable C visit(N node, @Nullable C context, TraversalActions actions);
  }

  /** A visitor with an enter callback only. */
  static <N, C> GraphVisitor<N, C> of(Callback<N, C> enter) {
    return enter::visit;
  }

  static <N, C> GraphVisitor<N, C> of(Callback<N, C> enter, Callback<N, C> exit) {
    return new GraphVisitor<N, C>() {
      @Override
      public @Nullable C enter(N node, @Nullable C context, TraversalActions actions) {
        return enter.visit(node, context, actions);
      }

      @Override
      public @Nullable C exit(N node, @Nullable C context, TraversalActions actions) {
        return exit.visit(node, context, actions);
      }
    };
  }
}
