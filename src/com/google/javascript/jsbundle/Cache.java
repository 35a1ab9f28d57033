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

import com.google.common.util.concurrent.ListenableFuture;
import java.io.IOException;
import java.io.InputStream;

/**
 * The build cache holding asset content, ASTs and source maps by key. A missing key fails with
 * {@link CacheMissException}.
 */
public interface Cache {

  /** Fetches the blob stored under {@code key}. */
  ListenableFuture<byte[]> getBlob(String key);

  /** Opens a stream over the blob stored under {@code key}. */
  InputStream getStream(String key) throws IOException;

  void setBlob(String key, byte[] contents) throws IOException;

  boolean has(String key);
}
