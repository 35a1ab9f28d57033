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
 * Options of {@link MutableBundleGraph#createAssetReference}: {@code fromDependency} now refers to
 * {@code toAsset} as a separately loaded asset. The reference can be limited to one bundle, named
 * either by {@code ofBundle} or by {@code inBundle}.
 */
@AutoValue
public abstract class ReferenceOptions {

  public abstract Dependency getFromDependency();

  public abstract Asset getToAsset();

  public abstract @Nullable Bundle getOfBundle();

  public abstract @Nullable Bundle getInBundle();

  public static Builder builder(Dependency fromDependency, Asset toAsset) {
    return new AutoValue_ReferenceOptions.Builder()
        .setFromDependency(fromDependency)
        .setToAsset(toAsset);
  }

  /** Builder for {@link ReferenceOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFromDependency(Dependency fromDependency);

    public abstract Builder setToAsset(Asset toAsset);

    public abstract Builder setOfBundle(@Nullable Bundle ofBundle);

    public abstract Builder setInBundle(@Nullable Bundle inBundle);

    public abstract ReferenceOptions build();
  }
}
