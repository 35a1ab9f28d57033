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

/**
 * Options of {@link MutableBundleGraph#createBundle}. A bundle is created either for an entry
 * asset, from which its type and environment are taken, or for a unique key with an explicit
 * type and environment.
 */
@AutoValue
public abstract class CreateBundleOptions {

  public abstract @Nullable Asset getEntryAsset();

  public abstract @Nullable String getUniqueKey();

  public abstract Target getTarget();

  public abstract @Nullable String getType();

  public abstract @Nullable Environment getEnv();

  public abstract boolean isEntry();

  public abstract boolean isInline();

  /** Defaults to the entry asset's splittable flag, or true. */
  public abstract @Nullable Boolean getSplittable();

  public abstract @Nullable String getPipeline();

  public static Builder builder(Target target) {
    return new AutoValue_CreateBundleOptions.Builder()
        .setTarget(target)
        .setEntry(false)
        .setInline(false);
  }

  /** Options for a bundle grown from {@code entryAsset}. */
  public static CreateBundleOptions forEntryAsset(Asset entryAsset, Target target) {
    return builder(target).setEntryAsset(entryAsset).build();
  }

  /** Builder for {@link CreateBundleOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setEntryAsset(@Nullable Asset entryAsset);

    public abstract Builder setUniqueKey(@Nullable String uniqueKey);

    public abstract Builder setTarget(Target target);

    public abstract Builder setType(@Nullable String type);

    public abstract Builder setEnv(@Nullable Environment env);

    public abstract Builder setEntry(boolean entry);

    public abstract Builder setInline(boolean inline);

    public abstract Builder setSplittable(@Nullable Boolean splittable);

    public abstract Builder setPipeline(@Nullable String pipeline);

    public abstract CreateBundleOptions build();
  }
}
