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

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.io.ByteSource;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.javascript.jsbundle.sourcemap.Mapping;
import com.google.javascript.jsbundle.sourcemap.SourceMap;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link CommittedAsset}. */
@RunWith(JUnit4.class)
public final class CommittedAssetTest {
  private static final String CODE = "export const helper = 42;";

  private final AtomicInteger generations = new AtomicInteger();
  private InMemoryCache cache;
  private BuildOptions options;
  private ExecutorService executor;

  @Before
  public void setUp() throws Exception {
    cache = new InMemoryCache();
    options =
        BuildOptions.builder()
            .setCache(cache)
            .setCodeGenerator(this::generate)
            .setPrefetchThreadCount(2)
            .build();
    executor = Executors.newFixedThreadPool(8);
  }

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  private ListenableFuture<GenerateResult> generate(Asset asset, AssetAst ast) {
    generations.incrementAndGet();
    SourceMap map =
        SourceMap.builder()
            .addMapping(new Mapping(0, 0, asset.getFilePath(), 0, 0, null))
            .build();
    byte[] code = ((String) ast.getProgram()).getBytes(UTF_8);
    return Futures.immediateFuture(new GenerateResult(ByteSource.wrap(code), map));
  }

  private void putAst(String key, String program) throws IOException {
    AssetAst ast = AssetAst.create("test", "1", program);
    cache.setBlob(key, options.getAstSerializer().serialize(ast));
  }

  private CommittedAsset committed(Asset.Builder asset) {
    return new CommittedAsset(asset.build(), options);
  }

  @Test
  public void testConcurrentGetCodeFetchesOnce() throws Exception {
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));

    CountDownLatch start = new CountDownLatch(1);
    List<Future<String>> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      Callable<String> read =
          () -> {
            start.await();
            return asset.getCode().get();
          };
      results.add(executor.submit(read));
    }
    start.countDown();

    for (Future<String> result : results) {
      assertThat(result.get()).isEqualTo(CODE);
    }
    assertThat(cache.getReadCount("content")).isEqualTo(1);
  }

  @Test
  public void testBufferFromAstGeneratesOnce() throws Exception {
    putAst("ast", CODE);
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setAstKey("ast"));

    assertThat(new String(asset.getBuffer().get(), UTF_8)).isEqualTo(CODE);
    assertThat(generations.get()).isEqualTo(1);

    assertThat(new String(asset.getBuffer().get(), UTF_8)).isEqualTo(CODE);
    assertThat(asset.getCode().get()).isEqualTo(CODE);
    assertThat(generations.get()).isEqualTo(1);
    assertThat(cache.getReadCount("ast")).isEqualTo(1);
  }

  @Test
  public void testConcurrentBufferFromAstGeneratesOnce() throws Exception {
    putAst("ast", CODE);
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setAstKey("ast"));

    List<Future<byte[]>> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      results.add(executor.submit(() -> asset.getBuffer().get()));
    }
    for (Future<byte[]> result : results) {
      assertThat(new String(result.get(), UTF_8)).isEqualTo(CODE);
    }
    assertThat(generations.get()).isEqualTo(1);
  }

  @Test
  public void testEmptyContent() throws Exception {
    cache.setBlob("empty", new byte[0]);
    CommittedAsset asset = committed(GraphFixture.asset("src/empty.js").setContentKey("empty"));

    assertThat(asset.getBuffer().get()).isEmpty();
    assertThat(asset.getCode().get()).isEmpty();
  }

  @Test
  public void testBufferIsACopy() throws Exception {
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));

    byte[] first = asset.getBuffer().get();
    first[0] = 'X';

    assertThat(asset.getCode().get()).isEqualTo(CODE);
  }

  @Test
  public void testNoContent() {
    CommittedAsset asset = committed(GraphFixture.asset("src/missing.js"));

    NoContentException e = assertThrows(NoContentException.class, asset::getBuffer);
    assertThat(e.getFilePath()).isEqualTo("src/missing.js");
    assertThrows(NoContentException.class, asset::getContent);
  }

  @Test
  public void testStreamBeforeContentIsLoaded() throws Exception {
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));

    try (InputStream in = asset.getStream()) {
      assertThat(new String(in.readAllBytes(), UTF_8)).isEqualTo(CODE);
    }
  }

  @Test
  public void testStreamFromAst() throws Exception {
    putAst("ast", CODE);
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setAstKey("ast"));

    try (InputStream in = asset.getStream()) {
      assertThat(new String(in.readAllBytes(), UTF_8)).isEqualTo(CODE);
    }
    assertThat(asset.getCode().get()).isEqualTo(CODE);
    assertThat(generations.get()).isEqualTo(1);
  }

  @Test
  public void testStreamAfterContentIsLoaded() throws Exception {
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));
    asset.getCode().get();

    try (InputStream in = asset.getStream()) {
      assertThat(new String(in.readAllBytes(), UTF_8)).isEqualTo(CODE);
    }
    assertThat(cache.getReadCount("content")).isEqualTo(1);
  }

  @Test
  public void testStreamFromMissingAstThrowsCacheMiss() throws Exception {
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setAstKey("ast"));

    try (InputStream in = asset.getStream()) {
      assertThrows(CacheMissException.class, in::read);
    }
    assertThat(generations.get()).isEqualTo(0);
  }

  @Test
  public void testStreamAfterFailedFetchThrowsCacheMiss() throws Exception {
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));
    ExecutionException e = assertThrows(ExecutionException.class, () -> asset.getCode().get());
    assertThat(e).hasCauseThat().isInstanceOf(CacheMissException.class);

    try (InputStream in = asset.getStream()) {
      CacheMissException miss = assertThrows(CacheMissException.class, in::read);
      assertThat(miss).isSameInstanceAs(e.getCause());
    }
  }

  @Test
  public void testMapFromCache() throws Exception {
    SourceMap map =
        SourceMap.builder().addMapping(2, 4, "src/util.ts", 1, 0, "helper").build();
    cache.setBlob("map", map.toBuffer());
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset =
        committed(GraphFixture.asset("src/util.js").setContentKey("content").setMapKey("map"));

    SourceMap decoded = asset.getMap().get();

    assertThat(decoded.getMappings())
        .containsExactly(new Mapping(2, 4, "src/util.ts", 1, 0, "helper"));
    assertThat(asset.getMap().get()).isSameInstanceAs(decoded);
    assertThat(cache.getReadCount("map")).isEqualTo(1);
  }

  @Test
  public void testMissingMapRegeneratedFromAst() throws Exception {
    putAst("ast", CODE);
    CommittedAsset asset =
        committed(GraphFixture.asset("src/util.js").setAstKey("ast").setMapKey("map"));

    SourceMap map = asset.getMap().get();

    assertThat(map).isNotNull();
    assertThat(map.getSources()).containsExactly("src/util.js");
    assertThat(asset.getCode().get()).isEqualTo(CODE);
    assertThat(generations.get()).isEqualTo(1);
  }

  @Test
  public void testMissingMapWithoutAstFails() throws Exception {
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset =
        committed(GraphFixture.asset("src/util.js").setContentKey("content").setMapKey("map"));

    ExecutionException e =
        assertThrows(ExecutionException.class, () -> asset.getMapBuffer().get());
    assertThat(e).hasCauseThat().isInstanceOf(CacheMissException.class);
  }

  @Test
  public void testOtherCacheErrorsPropagate() throws Exception {
    IOException failure = new IOException("disk on fire");
    Cache failing =
        new Cache() {
          @Override
          public ListenableFuture<byte[]> getBlob(String key) {
            return key.equals("map") ? Futures.immediateFailedFuture(failure) : cache.getBlob(key);
          }

          @Override
          public InputStream getStream(String key) throws IOException {
            return cache.getStream(key);
          }

          @Override
          public void setBlob(String key, byte[] contents) {
            cache.setBlob(key, contents);
          }

          @Override
          public boolean has(String key) {
            return cache.has(key);
          }
        };
    putAst("ast", CODE);
    CommittedAsset asset =
        new CommittedAsset(
            GraphFixture.asset("src/util.js").setAstKey("ast").setMapKey("map").build(),
            options.toBuilder().setCache(failing).build());

    ExecutionException e = assertThrows(ExecutionException.class, () -> asset.getMap().get());
    assertThat(e).hasCauseThat().isSameInstanceAs(failure);
    assertThat(generations.get()).isEqualTo(0);
  }

  @Test
  public void testNoMap() throws Exception {
    cache.setBlob("content", CODE.getBytes(UTF_8));
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));

    assertThat(asset.getMapBuffer().get()).isNull();
    assertThat(asset.getMap().get()).isNull();
  }

  @Test
  public void testAstIsMemoized() throws Exception {
    putAst("ast", CODE);
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setAstKey("ast"));

    AssetAst ast = asset.getAst().get();

    assertThat(ast.getType()).isEqualTo("test");
    assertThat(ast.getProgram()).isEqualTo(CODE);
    assertThat(asset.getAst().get()).isSameInstanceAs(ast);
    assertThat(cache.getReadCount("ast")).isEqualTo(1);
  }

  @Test
  public void testNoAst() throws Exception {
    CommittedAsset asset = committed(GraphFixture.asset("src/util.js").setContentKey("content"));

    assertThat(asset.getAst().get()).isNull();
  }

  @Test
  public void testDependencies() {
    Asset value =
        GraphFixture.asset("src/index.js")
            .setContentKey("content")
            .addDependency(GraphFixture.dep("./a"))
            .addDependency(GraphFixture.dep("./b"))
            .build();
    CommittedAsset asset = new CommittedAsset(value, options);

    assertThat(asset.getDependencies()).containsExactlyElementsIn(value.getDependencies());
    assertThat(asset.getDependencies()).hasSize(2);
  }
}
