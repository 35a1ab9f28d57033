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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/** An event delivered to {@link Reporter}s while a build runs. */
public final class BuildEvent {
  /** The kind of event. */
  public enum Kind {
    BUILD_START,
    BUILD_PROGRESS,
    BUILD_SUCCESS,
    BUILD_FAILURE
  }

  /** The phase a progress event reports on. */
  public enum Phase {
    TRANSFORMING,
    VALIDATING,
    BUNDLING,
    NAMING,
    PACKAGING,
    OPTIMIZING
  }

  private final Kind kind;
  private final @Nullable Phase phase;
  private final @Nullable String message;
  private final @Nullable BundleGraph bundleGraph;
  private final @Nullable Duration buildTime;
  private final ImmutableList<Diagnostic> diagnostics;

  private BuildEvent(
      Kind kind,
      @Nullable Phase phase,
      @Nullable String message,
      @Nullable BundleGraph bundleGraph,
      @Nullable Duration buildTime,
      ImmutableList<Diagnostic> diagnostics) {
    this.kind = kind;
    this.phase = phase;
    this.message = message;
    this.bundleGraph = bundleGraph;
    this.buildTime = buildTime;
    this.diagnostics = diagnostics;
  }

  public static BuildEvent buildStart() {
    return new BuildEvent(Kind.BUILD_START, null, null, null, null, ImmutableList.of());
  }

  public static BuildEvent progress(Phase phase, String message) {
    return new BuildEvent(Kind.BUILD_PROGRESS, phase, message, null, null, ImmutableList.of());
  }

  public static BuildEvent success(
      BundleGraph bundleGraph, Duration buildTime, Iterable<Diagnostic> warnings) {
    return new BuildEvent(
        Kind.BUILD_SUCCESS, null, null, bundleGraph, buildTime, ImmutableList.copyOf(warnings));
  }

  public static BuildEvent failure(Iterable<Diagnostic> diagnostics) {
    return new BuildEvent(
        Kind.BUILD_FAILURE, null, null, null, null, ImmutableList.copyOf(diagnostics));
  }

  public Kind getKind() {
    return kind;
  }

  public @Nullable Phase getPhase() {
    return phase;
  }

  public @Nullable String getMessage() {
    return message;
  }

  /** The sealed bundle graph of a successful build. */
  public BundleGraph getBundleGraph() {
    checkState(bundleGraph != null, "No bundle graph on %s event", kind);
    return bundleGraph;
  }

  public @Nullable Duration getBuildTime() {
    return buildTime;
  }

  /** The errors of a failed build, or the warnings of a successful one. */
  public ImmutableList<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("kind", kind)
        .add("phase", phase)
        .add("message", message)
        .add("buildTime", buildTime)
        .toString();
  }
}
