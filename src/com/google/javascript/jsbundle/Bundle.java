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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A deployable output file. A bundle has a unique id and a set of assets held by the {@link
 * BundleGraph} it belongs to; its name and file path are filled in by the namers.
 */
public final class Bundle {
  private static final String HASH_REF_PREFIX = "HASH_REF_";

  private final String id;
  private final String hashReference;
  private final String type;
  private final Environment env;
  private final Target target;
  private final boolean entry;
  private final boolean inline;
  private final boolean splittable;
  private final @Nullable String pipeline;

  /** Entry asset ids, in the order they were added. Maintained by the bundle graph. */
  private final List<String> entryAssetIds = new ArrayList<>();
  private @Nullable String mainEntryId;

  private @Nullable String name;
  private @Nullable String filePath;

  Bundle(
      String id,
      String type,
      Environment env,
      Target target,
      boolean entry,
      boolean inline,
      boolean splittable,
      @Nullable String pipeline) {
    this.id = checkNotNull(id);
    this.hashReference = HASH_REF_PREFIX + id;
    this.type = checkNotNull(type);
    this.env = checkNotNull(env);
    this.target = checkNotNull(target);
    this.entry = entry;
    this.inline = inline;
    this.splittable = splittable;
    this.pipeline = pipeline;
  }

  public String getId() {
    return id;
  }

  /**
   * A placeholder that stands for the content hash of this bundle in file names and in the code of
   * other bundles, until the hash is known.
   */
  public String getHashReference() {
    return hashReference;
  }

  public String getType() {
    return type;
  }

  public Environment getEnv() {
    return env;
  }

  public Target getTarget() {
    return target;
  }

  public boolean isEntry() {
    return entry;
  }

  public boolean isInline() {
    return inline;
  }

  public boolean isSplittable() {
    return splittable;
  }

  public @Nullable String getPipeline() {
    return pipeline;
  }

  public ImmutableList<String> getEntryAssetIds() {
    return ImmutableList.copyOf(entryAssetIds);
  }

  public @Nullable String getMainEntryId() {
    return mainEntryId;
  }

  void addEntryAssetId(String assetId) {
    if (!entryAssetIds.contains(assetId)) {
      entryAssetIds.add(assetId);
    }
    if (mainEntryId == null) {
      mainEntryId = assetId;
    }
  }

  void removeEntryAssetId(String assetId) {
    entryAssetIds.remove(assetId);
    if (assetId.equals(mainEntryId)) {
      mainEntryId = entryAssetIds.isEmpty() ? null : entryAssetIds.get(0);
    }
  }

  public @Nullable String getName() {
    return name;
  }

  void setName(String name) {
    this.name = name;
  }

  /** The output path, null until the bundle is named. */
  public @Nullable String getFilePath() {
    return filePath;
  }

  void setFilePath(String filePath) {
    this.filePath = filePath;
  }

  @Override
  public String toString() {
    return name != null ? name : type + " bundle " + id;
  }
}
