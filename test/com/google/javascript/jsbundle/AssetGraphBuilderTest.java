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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link AssetGraphBuilder}. */
@RunWith(JUnit4.class)
public final class AssetGraphBuilderTest {
  private static final String OPTIONAL = "?";

  // File path to the specifiers it imports. Optional imports start with OPTIONAL.
  private final Map<String, List<String>> files = new HashMap<>();
  private final AtomicInteger transforms = new AtomicInteger();
  private final List<String> transformed = new ArrayList<>();
  private SortingErrorManager errorManager;
  private BuildOptions options;

  @Before
  public void setUp() {
    errorManager = new SortingErrorManager();
    options = BuildOptions.builder().setPrefetchThreadCount(1).build();
  }

  private void file(String path, String... imports) {
    files.put(path, ImmutableList.copyOf(imports));
  }

  private static String resolvePath(Dependency dependency) {
    String specifier = dependency.getSpecifier();
    if (!specifier.startsWith("./") || dependency.getSourcePath() == null) {
      return specifier;
    }
    String from = dependency.getSourcePath();
    return from.substring(0, from.lastIndexOf('/') + 1) + specifier.substring(2) + ".js";
  }

  private final Resolver fileResolver =
      (dependency, options) -> {
        String path = resolvePath(dependency);
        if (!files.containsKey(path)) {
          throw new IOException("Cannot find module '" + dependency.getSpecifier() + "'");
        }
        return ResolveResult.resolved(path);
      };

  private final Transformer jsTransformer =
      new Transformer() {
        @Override
        public boolean canTransform(TransformRequest request) {
          return request.getFilePath().endsWith(".js");
        }

        @Override
        public ImmutableList<Asset> transform(TransformRequest request, BuildOptions options) {
          transforms.incrementAndGet();
          transformed.add(request.getFilePath());
          Asset.Builder asset =
              Asset.builder(request.getFilePath(), "js", request.getEnv())
                  .setSideEffects(request.getSideEffects())
                  .setContentKey(request.getFilePath());
          for (String specifier : files.get(request.getFilePath())) {
            boolean optional = specifier.startsWith(OPTIONAL);
            asset.addDependency(
                Dependency.builder(optional ? specifier.substring(1) : specifier, request.getEnv())
                    .setOptional(optional));
          }
          return ImmutableList.of(asset.build());
        }
      };

  private PluginConfig.Builder plugins() {
    return PluginConfig.builder().setBundler((bundleGraph, options) -> {});
  }

  private AssetGraph build(PluginConfig plugins, String... entries) throws BuildException {
    ImmutableList.Builder<Dependency> dependencies = ImmutableList.builder();
    for (String entry : entries) {
      dependencies.add(Dependency.builder(entry, GraphFixture.ENV).setEntry(true).build());
    }
    return new AssetGraphBuilder(options, plugins, errorManager).build(dependencies.build());
  }

  private AssetGraph build(String... entries) throws BuildException {
    PluginConfig plugins =
        plugins().addResolver(fileResolver).addTransformer(jsTransformer).build();
    return build(plugins, entries);
  }

  private static Asset assetAt(AssetGraph graph, String path) {
    for (Asset asset : graph.getAssets()) {
      if (asset.getFilePath().equals(path)) {
        return asset;
      }
    }
    throw new AssertionError("No asset at " + path);
  }

  @Test
  public void testBuildsEverythingReachable() throws Exception {
    file("src/index.js", "./a", "./b");
    file("src/a.js", "./b");
    file("src/b.js");
    file("src/unused.js");

    AssetGraph graph = build("src/index.js");

    assertThat(graph.getAssetCount()).isEqualTo(3);
    assertThat(graph.getUnresolvedDependencies()).isEmpty();
    assertThat(transformed).containsExactly("src/index.js", "src/a.js", "src/b.js").inOrder();
    Asset b = assetAt(graph, "src/b.js");
    assertThat(graph.getIncomingDependencies(b)).hasSize(2);
  }

  @Test
  public void testSameFileIsTransformedOnce() throws Exception {
    file("src/index.js", "./a", "./b");
    file("src/a.js", "./shared");
    file("src/b.js", "./shared");
    file("src/shared.js");

    build("src/index.js");

    assertThat(transforms.get()).isEqualTo(4);
  }

  @Test
  public void testCyclesAreBuilt() throws Exception {
    file("src/a.js", "./b");
    file("src/b.js", "./a");

    AssetGraph graph = build("src/a.js");

    assertThat(graph.getAssetCount()).isEqualTo(2);
    assertThat(graph.getUnresolvedDependencies()).isEmpty();
  }

  @Test
  public void testRequiredDependencyFailureAbortsTheBuild() {
    file("src/index.js", "./missing");

    UnresolvedDependencyException e =
        assertThrows(UnresolvedDependencyException.class, () -> build("src/index.js"));

    assertThat(e.getDependency().getSpecifier()).isEqualTo("./missing");
    assertThat(e).hasMessageThat().contains("Cannot find module './missing'");
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testOptionalDependencyFailureIsExcluded() throws Exception {
    file("src/index.js", OPTIONAL + "./missing", "./a");
    file("src/a.js");

    AssetGraph graph = build("src/index.js");

    Dependency missing = GraphFixture.dependencyOf(assetAt(graph, "src/index.js"), "./missing");
    assertThat(graph.isDependencyExcluded(missing)).isTrue();
    assertThat(graph.getAssetCount()).isEqualTo(2);
    assertThat(errorManager.getErrorCount()).isEqualTo(0);
    assertThat(errorManager.getWarnings()).hasSize(1);
  }

  @Test
  public void testResolversAreTriedInOrder() throws Exception {
    file("src/index.js", "fs", "./a");
    file("src/a.js");
    Resolver builtins =
        (dependency, options) ->
            dependency.getSpecifier().equals("fs") ? ResolveResult.excluded() : null;

    AssetGraph graph =
        build(
            plugins()
                .addResolver(builtins)
                .addResolver(fileResolver)
                .addTransformer(jsTransformer)
                .build(),
            "src/index.js");

    Asset index = assetAt(graph, "src/index.js");
    assertThat(graph.isDependencyExcluded(GraphFixture.dependencyOf(index, "fs"))).isTrue();
    assertThat(graph.getResolvedAsset(GraphFixture.dependencyOf(index, "./a"))).isNotNull();
  }

  @Test
  public void testNoResolverHandlesTheDependency() {
    Resolver none = (dependency, options) -> null;

    UnresolvedDependencyException e =
        assertThrows(
            UnresolvedDependencyException.class,
            () ->
                build(
                    plugins().addResolver(none).addTransformer(jsTransformer).build(),
                    "src/index.js"));

    assertThat(e).hasMessageThat().contains("no resolver handled it");
  }

  @Test
  public void testResolverDiagnosticsAreReported() throws Exception {
    file("src/index.js");
    DiagnosticType deprecated = DiagnosticType.warning("TEST_DEPRECATED", "{0} is deprecated");
    Resolver warning =
        (dependency, options) ->
            ResolveResult.builder()
                .setFilePath(dependency.getSpecifier())
                .addDiagnostic(Diagnostic.make(deprecated, dependency.getSpecifier()))
                .build();

    build(plugins().addResolver(warning).addTransformer(jsTransformer).build(), "src/index.js");

    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).description())
        .isEqualTo("src/index.js is deprecated");
  }

  @Test
  public void testResolverSideEffectsReachTheTransformer() throws Exception {
    file("src/index.js");
    Resolver pure =
        (dependency, options) ->
            ResolveResult.builder()
                .setFilePath(dependency.getSpecifier())
                .setSideEffects(false)
                .build();

    AssetGraph graph =
        build(plugins().addResolver(pure).addTransformer(jsTransformer).build(), "src/index.js");

    assertThat(assetAt(graph, "src/index.js").hasSideEffects()).isFalse();
  }

  @Test
  public void testTransformerFailure() {
    file("src/index.js");
    Transformer broken =
        new Transformer() {
          @Override
          public boolean canTransform(TransformRequest request) {
            return true;
          }

          @Override
          public ImmutableList<Asset> transform(TransformRequest request, BuildOptions options)
              throws IOException {
            throw new IOException("Unexpected token");
          }
        };

    BuildException e =
        assertThrows(
            BuildException.class,
            () ->
                build(
                    plugins().addResolver(fileResolver).addTransformer(broken).build(),
                    "src/index.js"));

    assertThat(e.getDiagnostics()).hasSize(1);
    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(AssetGraphBuilder.TRANSFORM_FAILED);
    assertThat(e).hasMessageThat().contains("Unexpected token");
    assertThat(e).hasCauseThat().isInstanceOf(IOException.class);
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
  }

  @Test
  public void testNoTransformer() {
    file("src/style.css");

    BuildException e = assertThrows(BuildException.class, () -> build("src/style.css"));

    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(AssetGraphBuilder.NO_TRANSFORMER);
  }

  @Test
  public void testUpdateTransformsChangedFilesAgain() throws Exception {
    file("src/index.js", "./a");
    file("src/a.js", "./b");
    file("src/b.js");
    AssetGraphBuilder builder =
        new AssetGraphBuilder(
            options,
            plugins().addResolver(fileResolver).addTransformer(jsTransformer).build(),
            errorManager);
    AssetGraph graph =
        builder.build(
            ImmutableList.of(Dependency.builder("src/index.js", GraphFixture.ENV).build()));
    transformed.clear();

    file("src/a.js", "./b", "./c");
    file("src/c.js");
    ImmutableSet<Asset> invalidated =
        builder.update(ImmutableSet.of("src/a.js"), ImmutableSet.of(), ImmutableSet.of());

    assertThat(invalidated).hasSize(1);
    assertThat(invalidated.iterator().next().getFilePath()).isEqualTo("src/a.js");
    assertThat(transformed).containsExactly("src/a.js", "src/c.js").inOrder();
    assertThat(graph.getAssetCount()).isEqualTo(4);
    assertThat(graph.getUnresolvedDependencies()).isEmpty();
    Asset a = assetAt(graph, "src/a.js");
    assertThat(graph.getDependencies(a)).hasSize(2);
  }

  @Test
  public void testUpdateOfAssetsThatImportEachOther() throws Exception {
    file("src/index.js", "./a", "./b");
    file("src/a.js");
    file("src/b.js", "./a");
    AssetGraphBuilder builder =
        new AssetGraphBuilder(
            options,
            plugins().addResolver(fileResolver).addTransformer(jsTransformer).build(),
            errorManager);
    AssetGraph graph =
        builder.build(
            ImmutableList.of(Dependency.builder("src/index.js", GraphFixture.ENV).build()));
    transformed.clear();

    ImmutableSet<Asset> invalidated =
        builder.update(
            ImmutableSet.of("src/a.js", "src/b.js"), ImmutableSet.of(), ImmutableSet.of());

    assertThat(invalidated).hasSize(2);
    assertThat(transformed).containsExactly("src/a.js", "src/b.js");
    assertThat(graph.getAssetCount()).isEqualTo(3);
    assertThat(graph.getUnresolvedDependencies()).isEmpty();
    Asset a = assetAt(graph, "src/a.js");
    Asset b = assetAt(graph, "src/b.js");
    assertThat(graph.getDependencies(b)).hasSize(1);
    assertThat(graph.getDependencyAssets(graph.getDependencies(b).get(0))).containsExactly(a);
    assertThat(graph.getIncomingDependencies(a)).hasSize(2);
  }

  @Test
  public void testBuildTwiceFails() throws Exception {
    file("src/index.js");
    AssetGraphBuilder builder =
        new AssetGraphBuilder(
            options,
            plugins().addResolver(fileResolver).addTransformer(jsTransformer).build(),
            errorManager);
    ImmutableList<Dependency> entries =
        ImmutableList.of(Dependency.builder("src/index.js", GraphFixture.ENV).build());
    builder.build(entries);

    assertThrows(IllegalStateException.class, () -> builder.build(entries));
  }
}
