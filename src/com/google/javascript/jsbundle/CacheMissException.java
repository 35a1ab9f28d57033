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

import java.io.IOException;

/** Thrown when a key is not present in the {@link Cache}. */
public final class CacheMissException extends IOException {
  private static final long serialVersionUID = 1L;

  private final String key;

  public CacheMissException(String key) {
    super("No cache entry for key " + key);
    this.key = key;
  }

  public String getKey() {
    return key;
  }
}
