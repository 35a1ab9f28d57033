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

import java.io.Serializable;

/**
 * Build statistics of an asset.
 *
 * @param time Milliseconds spent transforming the asset.
 * @param size Size of the transformed content in bytes.
 */
public record AssetStats(long time, long size) implements Serializable {
  public static final AssetStats EMPTY = new AssetStats(0, 0);
}
