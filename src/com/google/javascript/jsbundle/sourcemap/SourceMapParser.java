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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Decodes the JSON form of a version 3 source map. */
final class SourceMapParser {
  private static final int MAX_ENTRY_VALUES = 5;

  static SourceMap parse(String contents) throws SourceMapParseException {
    JsonObject root;
    try {
      root = new Gson().fromJson(contents, JsonObject.class);
    } catch (JsonParseException ex) {
      throw new SourceMapParseException("JSON parse exception: " + ex.getMessage(), ex);
    }
    if (root == null) {
      throw new SourceMapParseException("Empty source map");
    }
    if (!root.has("version") || root.get("version").getAsInt() != SourceMap.VERSION) {
      throw new SourceMapParseException("Unsupported source map version: " + root.get("version"));
    }
    if (root.has("sections")) {
      throw new SourceMapParseException("Index maps with 'sections' are not supported");
    }

    List<String> sources = getStrings(root.get("sources"));
    List<@Nullable String> sourcesContent = getNullableStrings(root.get("sourcesContent"));
    while (sourcesContent.size() < sources.size()) {
      sourcesContent.add(null);
    }
    List<String> names = getStrings(root.get("names"));
    String mappings = getStringOrNull(root, "mappings");

    SourceMap.Builder builder =
        SourceMap.builder()
            .setFile(getStringOrNull(root, "file"))
            .setSourceRoot(getStringOrNull(root, "sourceRoot"));
    for (int i = 0; i < sources.size(); i++) {
      builder.addSource(sources.get(i), sourcesContent.get(i));
    }
    for (String name : names) {
      builder.addName(name);
    }
    if (mappings != null) {
      new MappingDecoder(mappings, sources, names, builder).decode();
    }
    return builder.build();
  }

  /** Decodes the {@code mappings} field, line by line. */
  private static final class MappingDecoder implements Base64VLQ.CharIterator {
    private final String content;
    private final List<String> sources;
    private final List<String> names;
    private final SourceMap.Builder builder;
    private int position = 0;
    private int line = 0;
    private int previousCol = 0;
    private int previousSrcId = 0;
    private int previousSrcLine = 0;
    private int previousSrcColumn = 0;
    private int previousNameId = 0;

    MappingDecoder(
        String content, List<String> sources, List<String> names, SourceMap.Builder builder) {
      this.content = content;
      this.sources = sources;
      this.names = names;
      this.builder = builder;
    }

    void decode() throws SourceMapParseException {
      int[] temp = new int[MAX_ENTRY_VALUES];
      while (hasNext()) {
        // ';' denotes a new line.
        if (tryConsumeToken(';')) {
          line++;
          previousCol = 0;
        } else if (tryConsumeToken(',')) {
          continue;
        } else {
          int entryValues = 0;
          while (!entryComplete()) {
            if (entryValues == MAX_ENTRY_VALUES) {
              throw new SourceMapParseException("Too many values in segment at line " + line);
            }
            try {
              temp[entryValues] = Base64VLQ.decode(this);
            } catch (IllegalArgumentException e) {
              throw new SourceMapParseException("Invalid mappings at line " + line, e);
            }
            entryValues++;
          }
          builder.addMapping(decodeEntry(temp, entryValues));
        }
      }
    }

    private Mapping decodeEntry(int[] values, int count) throws SourceMapParseException {
      switch (count) {
        case 1:
          previousCol += values[0];
          return Mapping.unmapped(line, previousCol);
        case 4:
        case 5:
          previousCol += values[0];
          previousSrcId += values[1];
          previousSrcLine += values[2];
          previousSrcColumn += values[3];
          if (previousSrcId < 0 || previousSrcId >= sources.size()) {
            throw new SourceMapParseException("Source index out of range: " + previousSrcId);
          }
          String name = null;
          if (count == 5) {
            previousNameId += values[4];
            if (previousNameId < 0 || previousNameId >= names.size()) {
              throw new SourceMapParseException("Name index out of range: " + previousNameId);
            }
            name = names.get(previousNameId);
          }
          return new Mapping(
              line,
              previousCol,
              sources.get(previousSrcId),
              previousSrcLine,
              previousSrcColumn,
              name);
        default:
          throw new SourceMapParseException(
              "Unexpected number of values for segment at line " + line + ": " + count);
      }
    }

    private boolean tryConsumeToken(char token) {
      if (hasNext() && content.charAt(position) == token) {
        position++;
        return true;
      }
      return false;
    }

    private boolean entryComplete() {
      if (!hasNext()) {
        return true;
      }
      char c = content.charAt(position);
      return c == ';' || c == ',';
    }

    @Override
    public boolean hasNext() {
      return position < content.length();
    }

    @Override
    public char next() {
      return content.charAt(position++);
    }
  }

  private static @Nullable String getStringOrNull(JsonObject object, String key) {
    return object.has(key) && !object.get(key).isJsonNull() ? object.get(key).getAsString() : null;
  }

  private static List<String> getStrings(@Nullable JsonElement element)
      throws SourceMapParseException {
    List<String> result = new ArrayList<>();
    for (String value : getNullableStrings(element)) {
      if (value == null) {
        throw new SourceMapParseException("Unexpected null in " + element);
      }
      result.add(value);
    }
    return result;
  }

  private static List<@Nullable String> getNullableStrings(@Nullable JsonElement element) {
    List<@Nullable String> result = new ArrayList<>();
    if (element == null || element.isJsonNull()) {
      return result;
    }
    JsonArray array = element.getAsJsonArray();
    for (JsonElement each : array) {
      result.add(each.isJsonNull() ? null : each.getAsString());
    }
    return result;
  }

  private SourceMapParser() {}
}
