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
 * Which packages under {@code node_modules} are bundled rather than left as external imports.
 *
 * <p>A policy either includes everything, nothing, an allow-list of package names, or an explicit
 * per-package map where packages missing from the map are included.
 */
@AutoValue
@Immutable
public abstract class IncludeNodeModules implements Serializable {
  /** Describes how the package list is interpreted. */
  public enum Mode {
    ALL,
    NONE,
    /** Only the listed packages are included. */
    ONLY,
    /** Listed packages follow their flag, the rest are included. */
    MAP
  }

  public abstract Mode getMode();

  public abstract ImmutableMap<String, Boolean> getPackages();

  public static IncludeNodeModules all() {
    return new AutoValue_IncludeNodeModules(Mode.ALL, ImmutableMap.of());
  }

  public static IncludeNodeModules none() {
    return new AutoValue_IncludeNodeModules(Mode.NONE, ImmutableMap.of());
  }

  public static IncludeNodeModules only(Iterable<String> packageNames) {
    ImmutableMap.Builder<String, Boolean> packages = ImmutableMap.builder();
    for (String name : packageNames) {
      packages.put(name, true);
    }
    return new AutoValue_IncludeNodeModules(Mode.ONLY, packages.buildKeepingLast());
  }

  public static IncludeNodeModules fromMap(Map<String, Boolean> packages) {
    return new AutoValue_IncludeNodeModules(Mode.MAP, ImmutableMap.copyOf(packages));
  }

  /** Returns whether the package named {@code packageName} is bundled. */
  public boolean includes(String packageName) {
    switch (getMode()) {
      case ALL:
        return true;
      case NONE:
        return false;
      case ONLY:
        return getPackages().containsKey(packageName);
      case MAP:
        return getPackages().getOrDefault(packageName, true);
    }
    throw new AssertionError(getMode());
  }
}
