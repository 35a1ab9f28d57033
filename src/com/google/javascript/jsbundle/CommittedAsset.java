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

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteSource;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.Uninterruptibles;
import com.google.javascript.jsbundle.sourcemap.SourceMap;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Lazily materialized content of a committed {@link Asset}: its code, AST and source map, read
 * from the build {@link Cache} on first use.
 *
 * <p>Every slot is memoized. The first caller starts the fetch or the regeneration from the AST,
 * and concurrent callers share the pending future, so each cache key is read at most once per
 * asset and the AST is printed at most once. An abandoned future does not cancel the underlying
 * work.
 */
public final class CommittedAsset {
  private static final Logger logger = Logger.getLogger(CommittedAsset.class.getName());

  private final Asset value;
  private final BuildOptions options;

  // Guarded by this.
  private @Nullable ListenableFuture<byte[]> content = null;
  private @Nullable ListenableFuture<GenerateResult> generated = null;
  private @Nullable ListenableFuture<byte @Nullable []> mapBuffer = null;
  private @Nullable ListenableFuture<@Nullable SourceMap> map = null;
  private @Nullable ListenableFuture<AssetAst> ast = null;

  public CommittedAsset(Asset value, BuildOptions options) {
    this.value = value;
    this.options = options;
  }

  public Asset getAsset() {
    return value;
  }

  /**
   * Returns a source over the asset's content without waiting for it. Reading the source waits
   * for content that is still being fetched or generated.
   *
   * @throws NoContentException if the asset has neither a content key nor an AST key
   */
  public synchronized ByteSource getContent() {
    if (content != null) {
      return new PendingByteSource(content);
    }
    String contentKey = value.getContentKey();
    if (contentKey != null) {
      Cache cache = options.getCache();
      return new ByteSource() {
        @Override
        public InputStream openStream() throws IOException {
          return cache.getStream(contentKey);
        }
      };
    }
    if (value.getAstKey() != null) {
      return new PendingByteSource(generatedContent());
    }
    throw new NoContentException(value);
  }

  /** The content decoded as UTF-8. */
  public ListenableFuture<String> getCode() {
    return Futures.transform(materialize(), bytes -> new String(bytes, UTF_8), directExecutor());
  }

  /** A copy of the content, owned by the caller. */
  public ListenableFuture<byte[]> getBuffer() {
    return Futures.transform(materialize(), byte[]::clone, directExecutor());
  }

  /** Opens the content. The stream waits on the first read if the content is still pending. */
  public InputStream getStream() throws IOException {
    return getContent().openStream();
  }

  /**
   * Returns the cached source map bytes, or null if the asset has no map. If the map is missing
   * from the cache and the asset has an AST, the map is regenerated together with the code.
   */
  public synchronized ListenableFuture<byte @Nullable []> getMapBuffer() {
    String mapKey = value.getMapKey();
    if (mapKey == null) {
      return Futures.immediateFuture(null);
    }
    if (mapBuffer == null) {
      mapBuffer =
          Futures.catchingAsync(
              options.getCache().getBlob(mapKey),
              CacheMissException.class,
              miss -> {
                if (value.getAstKey() == null) {
                  throw miss;
                }
                logger.fine(() -> "Regenerating source map of " + value.getFilePath());
                return Futures.transform(
                    generate(),
                    result -> result.map() == null ? null : result.map().toBuffer(),
                    directExecutor());
              },
              directExecutor());
    }
    return mapBuffer;
  }

  /** The decoded source map, or null if the asset has none. */
  public synchronized ListenableFuture<@Nullable SourceMap> getMap() {
    if (map == null) {
      map =
          Futures.transformAsync(
              getMapBuffer(),
              bytes -> Futures.immediateFuture(bytes == null ? null : SourceMap.parse(bytes)),
              directExecutor());
    }
    return map;
  }

  /** The cached AST, or null if the asset has no AST key. */
  public synchronized ListenableFuture<@Nullable AssetAst> getAst() {
    String astKey = value.getAstKey();
    if (astKey == null) {
      return Futures.immediateFuture(null);
    }
    if (ast == null) {
      AstSerializer serializer = options.getAstSerializer();
      ast =
          Futures.transformAsync(
              options.getCache().getBlob(astKey),
              bytes -> Futures.immediateFuture(serializer.deserialize(bytes)),
              directExecutor());
    }
    return ast;
  }

  public ImmutableList<Dependency> getDependencies() {
    return value.getDependencies();
  }

  /** The memoized content. Callers must not modify the returned bytes. */
  synchronized ListenableFuture<byte[]> materialize() {
    if (content == null) {
      String contentKey = value.getContentKey();
      if (contentKey != null) {
        content = options.getCache().getBlob(contentKey);
      } else if (value.getAstKey() != null) {
        return generatedContent();
      } else {
        throw new NoContentException(value);
      }
    }
    return content;
  }

  /** Starts code generation from the AST once, and memoizes its output as the content. */
  private synchronized ListenableFuture<byte[]> generatedContent() {
    if (content == null) {
      content =
          Futures.transformAsync(
              generate(),
              result -> Futures.immediateFuture(result.content().read()),
              directExecutor());
    }
    return content;
  }

  private synchronized ListenableFuture<GenerateResult> generate() {
    if (generated == null) {
      logger.fine(() -> "Generating code from the AST of " + value.getFilePath());
      CodeGenerator generator = options.getCodeGenerator();
      generated =
          Futures.transformAsync(
              getAst(), tree -> generator.generate(value, tree), directExecutor());
    }
    return generated;
  }

  @Override
  public String toString() {
    return "CommittedAsset(" + value.getFilePath() + ")";
  }

  /** A source over bytes that may not have been produced yet. */
  private static final class PendingByteSource extends ByteSource {
    private final Future<byte[]> bytes;

    PendingByteSource(Future<byte[]> bytes) {
      this.bytes = bytes;
    }

    @Override
    public InputStream openStream() {
      return new PendingInputStream(bytes);
    }
  }

  /** Waits for the bytes on the first read. */
  private static final class PendingInputStream extends InputStream {
    private final Future<byte[]> pending;
    private @Nullable InputStream delegate;

    PendingInputStream(Future<byte[]> pending) {
      this.pending = pending;
    }

    private InputStream delegate() throws IOException {
      if (delegate == null) {
        try {
          delegate = new ByteArrayInputStream(Uninterruptibles.getUninterruptibly(pending));
        } catch (ExecutionException e) {
          Throwable cause = e.getCause();
          Throwables.throwIfInstanceOf(cause, IOException.class);
          Throwables.throwIfUnchecked(cause);
          throw new IOException(cause);
        }
      }
      return delegate;
    }

    @Override
    public int read() throws IOException {
      return delegate().read();
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      return delegate().read(b, off, len);
    }

    @Override
    public int available() throws IOException {
      return pending.isDone() ? delegate().available() : 0;
    }

    @Override
    public void close() throws IOException {
      if (delegate != null) {
        delegate.close();
      }
    }
  }
}
