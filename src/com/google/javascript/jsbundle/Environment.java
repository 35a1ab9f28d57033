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
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.Immutable;
import java.io.Serializable;
import java.util.Map;

/**
 * The runtime an asset, dependency or bundle is built for. Two environments are interchangeable
 * only if every field matches.
 */
@AutoValue
@Immutable
public abstract class Environment implements Serializable {

  public abstract EnvironmentContext getContext();

  /** Engine name to version range, e.g. {@code browsers -> "> 0.25%"}. */
  public abstract ImmutableMap<String, String> getEngines();

  public abstract IncludeNodeModules getIncludeNodeModules();

  public abstract OutputFormat getOutputFormat();

  public abstract boolean isLibrary();

  public abstract boolean isMinifyEnabled();

  public abstract boolean isScopeHoistEnabled();

  public boolean shouldMinify() {
    return isMinifyEnabled();
  }

  public boolean shouldScopeHoist() {
    return isScopeHoistEnabled();
  }

  public boolean isBrowser() {
    return getContext().isBrowser();
  }

  public boolean isNode() {
    return getContext().isNode();
  }

  public boolean isElectron() {
    return getContext().isElectron();
  }

  public boolean isWorker() {
    return getContext().isWorker();
  }

  public boolean isIsolated() {
    return getContext().isIsolated();
  }

  public boolean includesNodeModule(String packageName) {
    return getIncludeNodeModules().includes(packageName);
  }

  /** A stable digest of every field, used as part of asset and bundle identity. */
  public String getId() {
    return Ids.digest(
        getContext().getName(),
        getEngines().toString(),
        getIncludeNodeModules().getMode().name(),
        getIncludeNodeModules().getPackages().toString(),
        getOutputFormat().name(),
        String.valueOf(isLibrary()),
        String.valueOf(isMinifyEnabled()),
        String.valueOf(isScopeHoistEnabled()));
  }

  public abstract Builder toBuilder();

  /** Returns a builder for a plain browser environment. */
  public static Builder builder() {
    return new AutoValue_Environment.Builder()
        .setContext(EnvironmentContext.BROWSER)
        .setEngines(ImmutableMap.of())
        .setIncludeNodeModules(IncludeNodeModules.all())
        .setOutputFormat(OutputFormat.GLOBAL)
        .setLibrary(false)
        .setMinifyEnabled(false)
        .setScopeHoistEnabled(false);
  }

  /** Builder for {@link Environment}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setContext(EnvironmentContext context);

    public abstract Builder setEngines(Map<String, String> engines);

    public abstract Builder setIncludeNodeModules(IncludeNodeModules includeNodeModules);

    public abstract Builder setOutputFormat(OutputFormat outputFormat);

    public abstract Builder setLibrary(boolean library);

    public abstract Builder setMinifyEnabled(boolean minifyEnabled);

    public abstract Builder setScopeHoistEnabled(boolean scopeHoistEnabled);

    public abstract Environment build();
  }
}
