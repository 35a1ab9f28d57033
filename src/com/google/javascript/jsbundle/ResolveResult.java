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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** What a {@link Resolver} found for a dependency. */
@AutoValue
public abstract class ResolveResult {

  /** The resolved file, null when the dependency is excluded. */
  public abstract @Nullable String getFilePath();

  public abstract boolean isExcluded();

  /** Overrides the side effects flag of the resolved asset, e.g. from package metadata. */
  public abstract @Nullable Boolean getSideEffects();

  /** Overrides the pipeline the resolved file is transformed with. */
  public abstract @Nullable String getPipeline();

  /** Virtual content of the resolved file, used instead of reading it. */
  public abstract @Nullable String getCode();

  public abstract ImmutableList<Diagnostic> getDiagnostics();

  public static ResolveResult resolved(String filePath) {
    return builder().setFilePath(filePath).build();
  }

  public static ResolveResult excluded() {
    return builder().setExcluded(true).build();
  }

  public static Builder builder() {
    return new AutoValue_ResolveResult.Builder().setExcluded(false);
  }

  /** Builder for {@link ResolveResult}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFilePath(@Nullable String filePath);

    public abstract Builder setExcluded(boolean excluded);

    public abstract Builder setSideEffects(@Nullable Boolean sideEffects);

    public abstract Builder setPipeline(@Nullable String pipeline);

    public abstract Builder setCode(@Nullable String code);

    abstract ImmutableList.Builder<Diagnostic> diagnosticsBuilder();

    public Builder addDiagnostic(Diagnostic diagnostic) {
      diagnosticsBuilder().add(diagnostic);
      return this;
    }

    public abstract ResolveResult build();
  }
}
