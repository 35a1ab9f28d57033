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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * An import of one module by another, or an entry point of the build.
 *
 * <p>Everything but the symbol table is fixed at construction. The symbol table records the names
 * the importer uses from the imported module and is updated by analysis passes.
 */
public final class Dependency implements Serializable {
  private static final long serialVersionUID = 1L;

  private final String id;
  private final String specifier;
  private final SpecifierType specifierType;
  private final Priority priority;
  private final boolean entry;
  private final boolean optional;
  private final boolean weak;
  private final boolean needsStableName;
  private final Environment env;
  private final @Nullable Target target;
  private final @Nullable String pipeline;
  private final @Nullable SourceLocation loc;
  private final @Nullable String sourceAssetId;
  private final @Nullable String sourcePath;
  private final ImmutableMap<String, String> meta;
  private final MutableSymbols symbols;

  private Dependency(Builder builder) {
    this.specifier = builder.specifier;
    this.specifierType = builder.specifierType;
    this.priority = builder.priority;
    this.entry = builder.entry;
    this.optional = builder.optional;
    this.weak = builder.weak;
    this.needsStableName = builder.needsStableName;
    this.env = builder.env;
    this.target = builder.target;
    this.pipeline = builder.pipeline;
    this.loc = builder.loc;
    this.sourceAssetId = builder.sourceAssetId;
    this.sourcePath = builder.sourcePath;
    this.meta = ImmutableMap.copyOf(builder.meta);
    this.symbols = new MutableSymbols();
    this.symbols.merge(builder.symbols);
    this.id =
        Ids.digest(
            sourceAssetId,
            specifier,
            env.getId(),
            target == null ? null : target.getName() + ":" + target.getDistDir(),
            pipeline,
            specifierType.name(),
            priority.name());
  }

  public static Builder builder(String specifier, Environment env) {
    return new Builder(specifier, env);
  }

  public String getId() {
    return id;
  }

  public String getSpecifier() {
    return specifier;
  }

  public SpecifierType getSpecifierType() {
    return specifierType;
  }

  public Priority getPriority() {
    return priority;
  }

  /** Whether the imported module is loaded on demand. */
  public boolean isAsync() {
    return priority == Priority.LAZY;
  }

  /** Whether the imported module is loaded alongside the importer, in its own bundle. */
  public boolean isIsolated() {
    return priority == Priority.PARALLEL;
  }

  /** Whether the target of this dependency lives in a different bundle than the importer. */
  public boolean crossesBundleBoundary() {
    return isAsync() || isIsolated() || isURL();
  }

  public boolean isURL() {
    return specifierType == SpecifierType.URL;
  }

  public boolean isEntry() {
    return entry;
  }

  public boolean isOptional() {
    return optional;
  }

  public boolean isWeak() {
    return weak;
  }

  public boolean needsStableName() {
    return needsStableName;
  }

  public Environment getEnv() {
    return env;
  }

  public @Nullable Target getTarget() {
    return target;
  }

  public @Nullable String getPipeline() {
    return pipeline;
  }

  public @Nullable SourceLocation getLoc() {
    return loc;
  }

  /** The id of the importing asset, or null for an entry dependency. */
  public @Nullable String getSourceAssetId() {
    return sourceAssetId;
  }

  public @Nullable String getSourcePath() {
    return sourcePath;
  }

  public ImmutableMap<String, String> getMeta() {
    return meta;
  }

  public MutableSymbols getSymbols() {
    return symbols;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("specifier", specifier)
        .add("from", sourcePath)
        .add("priority", priority)
        .toString();
  }

  /** Builder for {@link Dependency}. */
  public static final class Builder {
    private final String specifier;
    private Environment env;
    private SpecifierType specifierType = SpecifierType.ESM;
    private Priority priority = Priority.SYNC;
    private boolean entry = false;
    private boolean optional = false;
    private boolean weak = false;
    private boolean needsStableName = false;
    private @Nullable Target target;
    private @Nullable String pipeline;
    private @Nullable SourceLocation loc;
    private @Nullable String sourceAssetId;
    private @Nullable String sourcePath;
    private final Map<String, String> meta = new LinkedHashMap<>();
    private final MutableSymbols symbols = new MutableSymbols();

    private Builder(String specifier, Environment env) {
      this.specifier = checkNotNull(specifier);
      this.env = checkNotNull(env);
    }

    @CanIgnoreReturnValue
    public Builder setEnv(Environment env) {
      this.env = checkNotNull(env);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSpecifierType(SpecifierType specifierType) {
      this.specifierType = checkNotNull(specifierType);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPriority(Priority priority) {
      this.priority = checkNotNull(priority);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setEntry(boolean entry) {
      this.entry = entry;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setOptional(boolean optional) {
      this.optional = optional;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setWeak(boolean weak) {
      this.weak = weak;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setNeedsStableName(boolean needsStableName) {
      this.needsStableName = needsStableName;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setTarget(@Nullable Target target) {
      this.target = target;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setPipeline(@Nullable String pipeline) {
      this.pipeline = pipeline;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLoc(@Nullable SourceLocation loc) {
      this.loc = loc;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder putMeta(String key, String value) {
      meta.put(key, value);
      return this;
    }

    /** Records that the importer binds {@code exportSymbol} of the target to {@code local}. */
    @CanIgnoreReturnValue
    public Builder setSymbol(String exportSymbol, String local, @Nullable SourceLocation loc) {
      symbols.set(exportSymbol, local, loc);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSymbol(String exportSymbol, String local) {
      return setSymbol(exportSymbol, local, null);
    }

    @CanIgnoreReturnValue
    public Builder clearSymbols() {
      symbols.clear();
      return this;
    }

    @CanIgnoreReturnValue
    Builder setSource(String assetId, String filePath) {
      this.sourceAssetId = assetId;
      this.sourcePath = filePath;
      return this;
    }

    public Dependency build() {
      return new Dependency(this);
    }
  }
}
