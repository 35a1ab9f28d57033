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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A transformed source file. Assets are immutable once committed to an {@link AssetGraph}; their
 * content lives in the build cache under {@link #getContentKey}, {@link #getAstKey} and {@link
 * #getMapKey} and is read through a {@link CommittedAsset}.
 */
public final class Asset implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String id;
  private final String filePath;
  private final String type;
  private final Environment env;
  private final boolean isSource;
  private final boolean sideEffects;
  private final BundleBehavior bundleBehavior;
  private final boolean bundleSplittable;
  private final @Nullable String pipeline;
  private final @Nullable String uniqueKey;
  private final ImmutableSymbols symbols;
  private final ImmutableList<Dependency> dependencies;
  private final @Nullable String contentKey;
  private final @Nullable String astKey;
  private final @Nullable String mapKey;
  private final @Nullable String astGeneratorType;
  private final @Nullable String astGeneratorVersion;
  private final ImmutableMap<String, String> meta;
  private final AssetStats stats;
  private final Invalidations invalidations;

  private Asset(Builder builder) {
    this.filePath = builder.filePath;
    this.type = builder.type;
    this.env = builder.env;
    this.isSource = builder.isSource;
    this.sideEffects = builder.sideEffects;
    this.bundleBehavior = builder.bundleBehavior;
    this.bundleSplittable = builder.bundleSplittable;
    this.pipeline = builder.pipeline;
    this.uniqueKey = builder.uniqueKey;
    this.symbols = ImmutableSymbols.copyOf(builder.symbols);
    this.contentKey = builder.contentKey;
    this.astKey = builder.astKey;
    this.mapKey = builder.mapKey;
    this.astGeneratorType = builder.astGeneratorType;
    this.astGeneratorVersion = builder.astGeneratorVersion;
    this.meta = ImmutableMap.copyOf(builder.meta);
    this.stats = builder.stats;
    this.invalidations = builder.invalidations;
    this.id =
        builder.id != null
            ? builder.id
            : Ids.digest(filePath, type, env.getId(), pipeline, uniqueKey);

    ImmutableList.Builder<Dependency> deps = ImmutableList.builder();
    for (Dependency.Builder dep : builder.dependencies) {
      deps.add(dep.setSource(id, filePath).build());
    }
    this.dependencies = deps.build();
  }

  /** Returns a builder for an asset of the given file and type, with side effects. */
  public static Builder builder(String filePath, String type, Environment env) {
    return new Builder(filePath, type, env);
  }

  public String getId() {
    return id;
  }

  public String getFilePath() {
    return filePath;
  }

  /** The file type of the content, e.g. {@code js} or {@code css}. */
  public String getType() {
    return type;
  }

  public Environment getEnv() {
    return env;
  }

  /** Whether the file is project source rather than a third-party package. */
  public boolean isSource() {
    return isSource;
  }

  public boolean hasSideEffects() {
    return sideEffects;
  }

  public BundleBehavior getBundleBehavior() {
    return bundleBehavior;
  }

  public boolean isBundleSplittable() {
    return bundleSplittable;
  }

  public @Nullable String getPipeline() {
    return pipeline;
  }

  public @Nullable String getUniqueKey() {
    return uniqueKey;
  }

  public Symbols getSymbols() {
    return symbols;
  }

  public ImmutableList<Dependency> getDependencies() {
    return dependencies;
  }

  public @Nullable String getContentKey() {
    return contentKey;
  }

  public @Nullable String getAstKey() {
    return astKey;
  }

  public @Nullable String getMapKey() {
    return mapKey;
  }

  /** The parser type that produced the cached AST, if any. */
  public @Nullable String getAstGeneratorType() {
    return astGeneratorType;
  }

  public @Nullable String getAstGeneratorVersion() {
    return astGeneratorVersion;
  }

  public ImmutableMap<String, String> getMeta() {
    return meta;
  }

  public AssetStats getStats() {
    return stats;
  }

  public Invalidations getInvalidations() {
    return invalidations;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("id", id)
        .add("filePath", filePath)
        .add("type", type)
        .add("pipeline", pipeline)
        .toString();
  }

  /** Builder for {@link Asset}. */
  public static final class Builder {
    private @Nullable String id;
    private final String filePath;
    private final String type;
    private final Environment env;
    private boolean isSource = true;
    private boolean sideEffects = true;
    private BundleBehavior bundleBehavior = BundleBehavior.NONE;
    private boolean bundleSplittable = true;
    private @Nullable String pipeline;
    private @Nullable String uniqueKey;
    private final MutableSymbols symbols = new MutableSymbols();
    private final List<Dependency.Builder> dependencies = new ArrayList<>();
    private @Nullable String contentKey;
    private @Nullable String astKey;
    private @Nullable String mapKey;
    private @Nullable String astGeneratorType;
    private @Nullable String astGeneratorVersion;
    private final Map<String, String> meta = new LinkedHashMap<>();
    private AssetStats stats = AssetStats.EMPTY;
    private Invalidations invalidations = Invalidations.none();

    private Builder(String filePath, String type, Environment env) {
      this.filePath = checkNotNull(filePath);
      this.type = checkNotNull(type);
      this.env = checkNotNull(env);
    }

    /** Overrides the id otherwise derived from file path, type, environment and pipeline. */
    @CanIgnoreReturnValue
    public Builder setId(String id) {
      this.id = checkNotNull(id);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSource(boolean isSource) {
      this.isSource = isSource;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSideEffects(boolean sideEffects) {
      this.sideEffects = sideEffects;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBundleBehavior(BundleBehavior bundleBehavior) {
      this.bundleBehavior = checkNotNull(bundleBehavior);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setBundleSplittable(boolean bundleSplittable) {
      this.bundleSplittable = bundleSplittable;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPipeline(@Nullable String pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setUniqueKey(@Nullable String uniqueKey) {
      this.uniqueKey = uniqueKey;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSymbol(String exportSymbol, String local, @Nullable SourceLocation loc) {
      symbols.set(exportSymbol, local, loc);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSymbol(String exportSymbol, String local) {
      return setSymbol(exportSymbol, local, null);
    }

    /** Marks the export table as unknown, e.g. for a module that assigns to {@code exports}. */
    @CanIgnoreReturnValue
    public Builder clearSymbols() {
      symbols.clear();
      return this;
    }

    /** Adds a dependency; its source asset is filled in when the asset is built. */
    @CanIgnoreReturnValue
    public Builder addDependency(Dependency.Builder dependency) {
      dependencies.add(checkNotNull(dependency));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setContentKey(@Nullable String contentKey) {
      this.contentKey = contentKey;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAstKey(@Nullable String astKey) {
      this.astKey = astKey;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setMapKey(@Nullable String mapKey) {
      this.mapKey = mapKey;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setAstGenerator(String type, String version) {
      this.astGeneratorType = checkNotNull(type);
      this.astGeneratorVersion = checkNotNull(version);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putMeta(String key, String value) {
      meta.put(key, value);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setStats(AssetStats stats) {
      this.stats = checkNotNull(stats);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setInvalidations(Invalidations invalidations) {
      this.invalidations = checkNotNull(invalidations);
      return this;
    }

    public Asset build() {
      return new Asset(this);
    }
  }
}
