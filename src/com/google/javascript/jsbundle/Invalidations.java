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

import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.util.Set;

/**
 * The external inputs an asset's transformation read, so that an incremental build knows which
 * assets to redo.
 */
@Immutable
public final class Invalidations implements Serializable {
  private static final long serialVersionUID = 1L;

  private static final Invalidations NONE =
      new Invalidations(ImmutableSet.of(), ImmutableSet.of(), ImmutableSet.of(), false);

  private final ImmutableSet<String> files;
  private final ImmutableSet<String> envVars;
  private final ImmutableSet<String> options;
  private final boolean onStartup;

  private Invalidations(
      ImmutableSet<String> files,
      ImmutableSet<String> envVars,
      ImmutableSet<String> options,
      boolean onStartup) {
    this.files = files;
    this.envVars = envVars;
    this.options = options;
    this.onStartup = onStartup;
  }

  public static Invalidations none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ImmutableSet<String> getFiles() {
    return files;
  }

  public ImmutableSet<String> getEnvVars() {
    return envVars;
  }

  public ImmutableSet<String> getOptions() {
    return options;
  }

  public boolean isInvalidatedOnStartup() {
    return onStartup;
  }

  /** Whether any of the given changes affects an input recorded here. */
  public boolean isInvalidatedBy(
      Set<String> changedFiles,
      Set<String> changedEnvVars,
      Set<String> changedOptions,
      boolean isStartup) {
    if (isStartup && onStartup) {
      return true;
    }
    return intersects(files, changedFiles)
        || intersects(envVars, changedEnvVars)
        || intersects(options, changedOptions);
  }

  private static boolean intersects(ImmutableSet<String> recorded, Set<String> changed) {
    for (String key : changed) {
      if (recorded.contains(key)) {
        return true;
      }
    }
    return false;
  }

  /** Collects invalidations while an asset is transformed. */
  public static final class Builder {
    private final ImmutableSet.Builder<String> files = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> envVars = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> options = ImmutableSet.builder();
    private boolean onStartup = false;

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder invalidateOnFileChange(String filePath) {
      files.add(filePath);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder invalidateOnEnvChange(String name) {
      envVars.add(name);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder invalidateOnOptionChange(String option) {
      options.add(option);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder invalidateOnStartup() {
      onStartup = true;
      return this;
    }

    public Invalidations build() {
      return new Invalidations(files.build(), envVars.build(), options.build(), onStartup);
    }
  }
}
