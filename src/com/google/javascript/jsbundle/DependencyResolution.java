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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** What a dependency resolved to in the asset graph. */
public final class DependencyResolution {
  /** The resolution state of a dependency. */
  public enum State {
    UNRESOLVED,
    /** Bound to one or more assets, the first being the primary one. */
    RESOLVED,
    /** Deliberately left out of the build, e.g. a node builtin in a browser build. */
    EXCLUDED,
    /** An optional dependency that could not be resolved. Treated like {@link #EXCLUDED}. */
    OPTIONAL_FAILED
  }

  private static final DependencyResolution UNRESOLVED =
      new DependencyResolution(State.UNRESOLVED, ImmutableList.of(), null);
  private static final DependencyResolution EXCLUDED =
      new DependencyResolution(State.EXCLUDED, ImmutableList.of(), null);

  private final State state;
  private final ImmutableList<String> assetIds;
  private final @Nullable Diagnostic failure;

  private DependencyResolution(
      State state, ImmutableList<String> assetIds, @Nullable Diagnostic failure) {
    this.state = state;
    this.assetIds = assetIds;
    this.failure = failure;
  }

  static DependencyResolution unresolved() {
    return UNRESOLVED;
  }

  static DependencyResolution resolved(Iterable<String> assetIds) {
    ImmutableList<String> ids = ImmutableList.copyOf(assetIds);
    checkArgument(!ids.isEmpty(), "A dependency must resolve to at least one asset");
    return new DependencyResolution(State.RESOLVED, ids, null);
  }

  static DependencyResolution excluded() {
    return EXCLUDED;
  }

  static DependencyResolution optionalFailed(Diagnostic failure) {
    return new DependencyResolution(State.OPTIONAL_FAILED, ImmutableList.of(), failure);
  }

  public State getState() {
    return state;
  }

  public ImmutableList<String> getAssetIds() {
    return assetIds;
  }

  public boolean isResolved() {
    return state == State.RESOLVED;
  }

  /** Whether the dependency is left out of the build. */
  public boolean isExcluded() {
    return state == State.EXCLUDED || state == State.OPTIONAL_FAILED;
  }

  /** The reason an optional dependency failed to resolve. */
  public @Nullable Diagnostic getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("state", state)
        .add("assets", assetIds.isEmpty() ? null : assetIds)
        .add("failure", failure)
        .toString();
  }
}
