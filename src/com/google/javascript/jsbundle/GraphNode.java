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

import static com.google.common.base.Preconditions.checkState;

import org.jspecify.annotations.Nullable;

/** A node of the asset graph as seen by a traversal: either an asset or a dependency. */
public final class GraphNode {
  /** The kind of graph node. */
  public enum Kind {
    ASSET,
    DEPENDENCY
  }

  private final Kind kind;
  private final @Nullable Asset asset;
  private final @Nullable Dependency dependency;

  private GraphNode(Kind kind, @Nullable Asset asset, @Nullable Dependency dependency) {
    this.kind = kind;
    this.asset = asset;
    this.dependency = dependency;
  }

  public static GraphNode of(Asset asset) {
    return new GraphNode(Kind.ASSET, asset, null);
  }

  public static GraphNode of(Dependency dependency) {
    return new GraphNode(Kind.DEPENDENCY, null, dependency);
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isAsset() {
    return kind == Kind.ASSET;
  }

  public boolean isDependency() {
    return kind == Kind.DEPENDENCY;
  }

  public Asset getAsset() {
    checkState(asset != null, "Not an asset: %s", this);
    return asset;
  }

  public Dependency getDependency() {
    checkState(dependency != null, "Not a dependency: %s", this);
    return dependency;
  }

  /** A key distinguishing assets from dependencies with the same id. */
  String getKey() {
    return isAsset() ? "asset:" + getAsset().getId() : "dependency:" + getDependency().getId();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof GraphNode && ((GraphNode) o).getKey().equals(getKey());
  }

  @Override
  public int hashCode() {
    return getKey().hashCode();
  }

  @Override
  public String toString() {
    return kind + "(" + (isAsset() ? asset : dependency) + ")";
  }
}
