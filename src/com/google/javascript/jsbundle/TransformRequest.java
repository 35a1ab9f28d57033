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
import org.jspecify.annotations.Nullable;

/** A resolved file to be transformed into assets. */
@AutoValue
public abstract class TransformRequest {

  public abstract String getFilePath();

  public abstract Environment getEnv();

  public abstract @Nullable String getPipeline();

  public abstract boolean getSideEffects();

  /** Content supplied by the resolver; transformers read the file when this is null. */
  public abstract @Nullable String getCode();

  public static TransformRequest create(
      String filePath,
      Environment env,
      @Nullable String pipeline,
      boolean sideEffects,
      @Nullable String code) {
    return new AutoValue_TransformRequest(filePath, env, pipeline, sideEffects, code);
  }

  /** Requests with the same key produce the same assets and are transformed once. */
  String getKey() {
    return Ids.digest(getFilePath(), getEnv().getId(), getPipeline(), getCode());
  }
}
