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

package com.google.javascript.jsbundle.sourcemap;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** A decoded version 3 source map. */
public final class SourceMap {
  public static final int VERSION = 3;

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

  private final @Nullable String file;
  private final @Nullable String sourceRoot;
  private final ImmutableList<String> sources;
  private final List<@Nullable String> sourcesContent;
  private final ImmutableList<String> names;
  private final ImmutableList<Mapping> mappings;

  SourceMap(
      @Nullable String file,
      @Nullable String sourceRoot,
      List<String> sources,
      List<@Nullable String> sourcesContent,
      List<String> names,
      List<Mapping> mappings) {
    this.file = file;
    this.sourceRoot = sourceRoot;
    this.sources = ImmutableList.copyOf(sources);
    this.sourcesContent = Collections.unmodifiableList(new ArrayList<>(sourcesContent));
    this.names = ImmutableList.copyOf(names);
    this.mappings =
        ImmutableList.sortedCopyOf(
            Comparator.comparingInt(Mapping::generatedLine)
                .thenComparingInt(Mapping::generatedColumn),
            mappings);
  }

  public static SourceMap parse(byte[] json) throws SourceMapParseException {
    return SourceMapParser.parse(new String(json, UTF_8));
  }

  public static SourceMap parse(String json) throws SourceMapParseException {
    return SourceMapParser.parse(json);
  }

  public static Builder builder() {
    return new Builder();
  }

  public @Nullable String getFile() {
    return file;
  }

  public @Nullable String getSourceRoot() {
    return sourceRoot;
  }

  public ImmutableList<String> getSources() {
    return sources;
  }

  /** The embedded content of each source, null where it was not embedded. */
  public List<@Nullable String> getSourcesContent() {
    return sourcesContent;
  }

  public ImmutableList<String> getNames() {
    return names;
  }

  /** Every mapping, ordered by generated position. */
  public ImmutableList<Mapping> getMappings() {
    return mappings;
  }

  /**
   * Returns the mapping covering the given generated position: the last mapping on {@code line}
   * that starts at or before {@code column}, or null if there is none.
   */
  public @Nullable Mapping getMappingFor(int line, int column) {
    Mapping found = null;
    for (Mapping mapping : mappings) {
      if (mapping.generatedLine() > line) {
        break;
      }
      if (mapping.generatedLine() == line && mapping.generatedColumn() <= column) {
        found = mapping;
      }
    }
    return found;
  }

  /** Encodes the mappings into the VLQ {@code mappings} field. */
  String encodeMappings() {
    Map<String, Integer> sourceIndex = indexOf(sources);
    Map<String, Integer> nameIndex = indexOf(names);
    StringBuilder out = new StringBuilder();
    int line = 0;
    int previousColumn = 0;
    int previousSource = 0;
    int previousOriginalLine = 0;
    int previousOriginalColumn = 0;
    int previousName = 0;
    boolean firstOnLine = true;
    for (Mapping mapping : mappings) {
      while (line < mapping.generatedLine()) {
        out.append(';');
        line++;
        previousColumn = 0;
        firstOnLine = true;
      }
      if (!firstOnLine) {
        out.append(',');
      }
      firstOnLine = false;
      Base64VLQ.encode(out, mapping.generatedColumn() - previousColumn);
      previousColumn = mapping.generatedColumn();
      if (mapping.source() == null) {
        continue;
      }
      int source = sourceIndex.get(mapping.source());
      Base64VLQ.encode(out, source - previousSource);
      previousSource = source;
      Base64VLQ.encode(out, mapping.originalLine() - previousOriginalLine);
      previousOriginalLine = mapping.originalLine();
      Base64VLQ.encode(out, mapping.originalColumn() - previousOriginalColumn);
      previousOriginalColumn = mapping.originalColumn();
      if (mapping.name() != null) {
        int name = nameIndex.get(mapping.name());
        Base64VLQ.encode(out, name - previousName);
        previousName = name;
      }
    }
    return out.toString();
  }

  private static Map<String, Integer> indexOf(List<String> values) {
    Map<String, Integer> index = new LinkedHashMap<>();
    for (int i = 0; i < values.size(); i++) {
      index.putIfAbsent(values.get(i), i);
    }
    return index;
  }

  public String toJson() {
    JsonObject root = new JsonObject();
    root.add("version", new JsonPrimitive(VERSION));
    if (file != null) {
      root.add("file", new JsonPrimitive(file));
    }
    if (sourceRoot != null) {
      root.add("sourceRoot", new JsonPrimitive(sourceRoot));
    }
    JsonArray sourcesArray = new JsonArray();
    for (String source : sources) {
      sourcesArray.add(source);
    }
    root.add("sources", sourcesArray);
    if (sourcesContent.stream().anyMatch(c -> c != null)) {
      JsonArray contentArray = new JsonArray();
      for (String content : sourcesContent) {
        contentArray.add(content == null ? JsonNull.INSTANCE : new JsonPrimitive(content));
      }
      root.add("sourcesContent", contentArray);
    }
    JsonArray namesArray = new JsonArray();
    for (String name : names) {
      namesArray.add(name);
    }
    root.add("names", namesArray);
    root.add("mappings", new JsonPrimitive(encodeMappings()));
    return GSON.toJson(root);
  }

  /** The JSON encoding of this map as UTF-8 bytes, as stored in the build cache. */
  public byte[] toBuffer() {
    return toJson().getBytes(UTF_8);
  }

  @Override
  public String toString() {
    return toJson();
  }

  /** Collects mappings; sources and names are registered in first-use order. */
  public static final class Builder {
    private @Nullable String file;
    private @Nullable String sourceRoot;
    private final List<String> sources = new ArrayList<>();
    private final List<@Nullable String> sourcesContent = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final List<Mapping> mappings = new ArrayList<>();

    private Builder() {}

    @CanIgnoreReturnValue
    public Builder setFile(@Nullable String file) {
      this.file = file;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setSourceRoot(@Nullable String sourceRoot) {
      this.sourceRoot = sourceRoot;
      return this;
    }

    /** Registers a source and its content ahead of any mapping that uses it. */
    @CanIgnoreReturnValue
    public Builder addSource(String source, @Nullable String content) {
      int index = sources.indexOf(source);
      if (index == -1) {
        sources.add(source);
        sourcesContent.add(content);
      } else if (content != null) {
        sourcesContent.set(index, content);
      }
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addMapping(Mapping mapping) {
      if (mapping.source() != null && !sources.contains(mapping.source())) {
        addSource(mapping.source(), null);
      }
      if (mapping.name() != null && !names.contains(mapping.name())) {
        names.add(mapping.name());
      }
      mappings.add(mapping);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder addMapping(
        int generatedLine,
        int generatedColumn,
        String source,
        int originalLine,
        int originalColumn,
        @Nullable String name) {
      return addMapping(
          new Mapping(generatedLine, generatedColumn, source, originalLine, originalColumn, name));
    }

    @CanIgnoreReturnValue
    Builder addName(String name) {
      names.add(name);
      return this;
    }

    public SourceMap build() {
      return new SourceMap(file, sourceRoot, sources, sourcesContent, names, mappings);
    }
  }
}
