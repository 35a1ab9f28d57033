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

/** The runtime an {@link Environment} targets. */
public enum EnvironmentContext {
  BROWSER("browser"),
  WEB_WORKER("web-worker"),
  SERVICE_WORKER("service-worker"),
  WORKLET("worklet"),
  NODE("node"),
  ELECTRON_MAIN("electron-main"),
  ELECTRON_RENDERER("electron-renderer");

  private final String name;

  EnvironmentContext(String name) {
    this.name = name;
  }

  public boolean isBrowser() {
    return this == BROWSER
        || this == WEB_WORKER
        || this == SERVICE_WORKER
        || this == WORKLET
        || this == ELECTRON_RENDERER;
  }

  public boolean isNode() {
    return this == NODE || this == ELECTRON_MAIN || this == ELECTRON_RENDERER;
  }

  public boolean isElectron() {
    return this == ELECTRON_MAIN || this == ELECTRON_RENDERER;
  }

  public boolean isWorker() {
    return this == WEB_WORKER || this == SERVICE_WORKER;
  }

  public boolean isWorklet() {
    return this == WORKLET;
  }

  /** Whether code in this context cannot share module state with the page that loads it. */
  public boolean isIsolated() {
    return isWorker() || isWorklet();
  }

  /** The lower-case name used in configuration, e.g. {@code web-worker}. */
  public String getName() {
    return name;
  }

  public static EnvironmentContext fromName(String name) {
    for (EnvironmentContext context : values()) {
      if (context.name.equals(name)) {
        return context;
      }
    }
    throw new IllegalArgumentException("Unknown environment context: " + name);
  }
}
