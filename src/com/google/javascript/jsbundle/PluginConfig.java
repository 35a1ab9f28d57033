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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/** The plugins of a build, an ordered list per phase. */
@AutoValue
public abstract class PluginConfig {

  public abstract ImmutableList<Resolver> getResolvers();

  public abstract ImmutableList<Transformer> getTransformers();

  public abstract Bundler getBundler();

  public abstract ImmutableList<Namer> getNamers();

  /** Packagers by bundle type. */
  public abstract ImmutableMap<String, Packager> getPackagers();

  public abstract ImmutableList<Optimizer> getOptimizers();

  public abstract ImmutableList<Validator> getValidators();

  public abstract ImmutableList<Reporter> getReporters();

  public @Nullable Packager getPackager(String bundleType) {
    return getPackagers().get(bundleType);
  }

  public static Builder builder() {
    return new AutoValue_PluginConfig.Builder();
  }

  /** Builder for {@link PluginConfig}. Plugins run in the order they are added. */
  @AutoValue.Builder
  public abstract static class Builder {
    abstract ImmutableList.Builder<Resolver> resolversBuilder();

    abstract ImmutableList.Builder<Transformer> transformersBuilder();

    public abstract Builder setBundler(Bundler bundler);

    abstract ImmutableList.Builder<Namer> namersBuilder();

    abstract ImmutableMap.Builder<String, Packager> packagersBuilder();

    abstract ImmutableList.Builder<Optimizer> optimizersBuilder();

    abstract ImmutableList.Builder<Validator> validatorsBuilder();

    abstract ImmutableList.Builder<Reporter> reportersBuilder();

    @CanIgnoreReturnValue
    public Builder addResolver(Resolver resolver) {
      resolversBuilder().add(resolver);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addTransformer(Transformer transformer) {
      transformersBuilder().add(transformer);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addNamer(Namer namer) {
      namersBuilder().add(namer);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putPackager(String bundleType, Packager packager) {
      packagersBuilder().put(bundleType, packager);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addOptimizer(Optimizer optimizer) {
      optimizersBuilder().add(optimizer);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addValidator(Validator validator) {
      validatorsBuilder().add(validator);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addReporter(Reporter reporter) {
      reportersBuilder().add(reporter);
      return this;
    }

    public abstract PluginConfig build();
  }
}
