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

import static java.util.Objects.requireNonNull;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/**
 * A build diagnostic.
 *
 * @param type The kind of diagnostic.
 * @param description The formatted message.
 * @param location Where the problem was found, if known.
 * @param defaultLevel The level of {@code type} unless the builder overrode it.
 */
public record Diagnostic(
    DiagnosticType type,
    String description,
    @Nullable SourceLocation location,
    CheckLevel defaultLevel)
    implements Serializable {
  public Diagnostic {
    requireNonNull(type, "type");
    requireNonNull(description, "description");
    requireNonNull(defaultLevel, "defaultLevel");
  }

  /**
   * Creates a Diagnostic with no source information
   *
   * @param type The DiagnosticType
   * @param arguments Arguments to be incorporated into the message
   */
  public static Diagnostic make(DiagnosticType type, Object... arguments) {
    return builder(type, arguments).build();
  }

  /** Creates a Diagnostic at a given source location. */
  public static Diagnostic make(
      @Nullable SourceLocation location, DiagnosticType type, Object... arguments) {
    return builder(type, arguments).setLocation(location).build();
  }

  public static Builder builder(DiagnosticType type, Object... arguments) {
    return new Builder(type, arguments);
  }

  public @Nullable String sourceName() {
    return location == null ? null : location.filePath();
  }

  public int lineNumber() {
    return location == null ? -1 : location.startLine();
  }

  public int column() {
    return location == null ? -1 : location.startColumn();
  }

  /** Returns a copy of this diagnostic reported at {@code level}. */
  public Diagnostic withLevel(CheckLevel level) {
    return new Diagnostic(type, description, location, level);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(type.key).append(". ").append(description);
    if (location != null) {
      sb.append(" at ")
          .append(location.filePath())
          .append(" line ")
          .append(location.startLine())
          .append(" : ")
          .append(location.startColumn());
    }
    return sb.toString();
  }

  /** Builder for {@link Diagnostic}. */
  public static final class Builder {
    private final DiagnosticType type;
    private final String description;
    private @Nullable SourceLocation location;
    private CheckLevel level;

    private Builder(DiagnosticType type, Object... arguments) {
      this.type = requireNonNull(type, "type");
      this.description = type.format(arguments);
      this.level = type.level;
    }

    @CanIgnoreReturnValue
    public Builder setLocation(@Nullable SourceLocation location) {
      this.location = location;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder setLevel(CheckLevel level) {
      this.level = requireNonNull(level, "level");
      return this;
    }

    public Diagnostic build() {
      return new Diagnostic(type, description, location, level);
    }
  }
}
