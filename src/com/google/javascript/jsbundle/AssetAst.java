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

/**
 * A parsed program, opaque to the graph. The type and version identify the parser that produced
 * it so that a code generator can check it understands the payload.
 */
@AutoValue
public abstract class AssetAst implements Serializable {

  public abstract String getType();

  public abstract String getVersion();

  public abstract Serializable getProgram();

  public static AssetAst create(String type, String version, Serializable program) {
    return new AutoValue_AssetAst(type, version, program);
  }
}
