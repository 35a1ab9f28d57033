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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;

/** An {@link AstSerializer} using Java object serialization of the AST payload. */
public final class JavaSerializationAstSerializer implements AstSerializer {

  @Override
  public byte[] serialize(AssetAst ast) throws IOException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
      out.writeObject(ast);
    }
    return bytes.toByteArray();
  }

  @Override
  public AssetAst deserialize(byte[] bytes) throws IOException {
    try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
      Object ast = in.readObject();
      if (!(ast instanceof AssetAst)) {
        throw new InvalidObjectException("Not an AST: " + ast);
      }
      return (AssetAst) ast;
    } catch (ClassNotFoundException e) {
      throw new IOException("Cannot deserialize AST", e);
    }
  }
}
