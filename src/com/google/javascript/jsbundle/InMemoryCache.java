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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/** A {@link Cache} held in memory. Counts reads per key. */
public final class InMemoryCache implements Cache {
  private final ConcurrentMap<String, byte[]> blobs = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, AtomicInteger> reads = new ConcurrentHashMap<>();

  @Override
  public ListenableFuture<byte[]> getBlob(String key) {
    countRead(key);
    byte[] blob = blobs.get(key);
    if (blob == null) {
      return Futures.immediateFailedFuture(new CacheMissException(key));
    }
    return Futures.immediateFuture(blob.clone());
  }

  @Override
  public InputStream getStream(String key) throws CacheMissException {
    countRead(key);
    byte[] blob = blobs.get(key);
    if (blob == null) {
      throw new CacheMissException(key);
    }
    return new ByteArrayInputStream(blob);
  }

  @Override
  public void setBlob(String key, byte[] contents) {
    blobs.put(checkNotNull(key), contents.clone());
  }

  @Override
  public boolean has(String key) {
    return blobs.containsKey(key);
  }

  /** The number of {@link #getBlob} and {@link #getStream} calls made for {@code key}. */
  public int getReadCount(String key) {
    AtomicInteger count = reads.get(key);
    return count == null ? 0 : count.get();
  }

  private void countRead(String key) {
    reads.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
  }
}
