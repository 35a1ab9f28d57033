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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.UUID;

/**
 * Options shared by every phase of a build. Built once before the build starts and never changed
 * afterwards.
 */
@AutoValue
public abstract class BuildOptions {
  public static final String DEVELOPMENT = "development";
  public static final String PRODUCTION = "production";

  /** The build mode, usually {@link #DEVELOPMENT} or {@link #PRODUCTION}. */
  public abstract String getMode();

  /** Environment variables visible to plugins. */
  public abstract ImmutableMap<String, String> getEnv();

  public abstract String getProjectRoot();

  /** Whether bundle file names carry a hash of their contents. */
  public abstract boolean isContentHashEnabled();

  public abstract boolean isSourceMapsEnabled();

  public abstract Cache getCache();

  public abstract AstSerializer getAstSerializer();

  public abstract CodeGenerator getCodeGenerator();

  /** Distinguishes concurrent builds sharing a cache. */
  public abstract String getInstanceId();

  /** The number of threads used to load asset content ahead of packaging. */
  public abstract int getPrefetchThreadCount();

  public boolean isProduction() {
    return getMode().equals(PRODUCTION);
  }

  public abstract Builder toBuilder();

  public static Builder builder() {
    return new AutoValue_BuildOptions.Builder()
        .setMode(DEVELOPMENT)
        .setEnv(ImmutableMap.of())
        .setProjectRoot(".")
        .setContentHashEnabled(false)
        .setSourceMapsEnabled(true)
        .setCache(new InMemoryCache())
        .setAstSerializer(new JavaSerializationAstSerializer())
        .setCodeGenerator(CodeGenerator.unsupported())
        .setInstanceId(UUID.randomUUID().toString())
        .setPrefetchThreadCount(Runtime.getRuntime().availableProcessors());
  }

  /** Builder for {@link BuildOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMode(String mode);

    public abstract Builder setEnv(Map<String, String> env);

    public abstract Builder setProjectRoot(String projectRoot);

    public abstract Builder setContentHashEnabled(boolean contentHashEnabled);

    public abstract Builder setSourceMapsEnabled(boolean sourceMapsEnabled);

    public abstract Builder setCache(Cache cache);

    public abstract Builder setAstSerializer(AstSerializer astSerializer);

    public abstract Builder setCodeGenerator(CodeGenerator codeGenerator);

    public abstract Builder setInstanceId(String instanceId);

    public abstract Builder setPrefetchThreadCount(int prefetchThreadCount);

    abstract BuildOptions autoBuild();

    public BuildOptions build() {
      BuildOptions options = autoBuild();
      checkState(!options.getMode().isEmpty(), "mode must not be empty");
      checkState(
          options.getPrefetchThreadCount() > 0,
          "prefetchThreadCount must be positive, was %s",
          options.getPrefetchThreadCount());
      return options;
    }
  }
}
