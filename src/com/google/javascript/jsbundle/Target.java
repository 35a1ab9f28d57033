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
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** A named output destination of a build, e.g. the browser build of a library. */
@AutoValue
public abstract class Target implements Serializable {

  public abstract String getName();

  public abstract String getDistDir();

  /** The file name of the entry bundle, when the target has a fixed one. */
  public abstract @Nullable String getDistEntry();

  public abstract Environment getEnv();

  public abstract String getPublicUrl();

  public abstract @Nullable SourceLocation getLoc();

  public static Builder builder(String name, String distDir, Environment env) {
    return new AutoValue_Target.Builder()
        .setName(name)
        .setDistDir(distDir)
        .setEnv(env)
        .setPublicUrl("/");
  }

  /** Builder for {@link Target}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String name);

    public abstract Builder setDistDir(String distDir);

    public abstract Builder setDistEntry(@Nullable String distEntry);

    public abstract Builder setEnv(Environment env);

    public abstract Builder setPublicUrl(String publicUrl);

    public abstract Builder setLoc(@Nullable SourceLocation loc);

    public abstract Target build();
  }
}
