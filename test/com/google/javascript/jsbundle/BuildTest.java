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
import static com.google.javascript.jsbundle.GraphFixture.ENV;
import static com.google.javascript.jsbundle.GraphFixture.TARGET;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.common.io.ByteSource;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End to end tests for {@link Build} with small in-memory plugins. */
@RunWith(JUnit4.class)
public final class BuildTest {
  private static final String LAZY = "lazy:";
  private static final String OPTIONAL = "?";

  private static final DiagnosticType LINT_ERROR =
      DiagnosticType.error("TEST_LINT_ERROR", "Lint error in {0}");
  private static final DiagnosticType LINT_WARNING =
      DiagnosticType.warning("TEST_LINT_WARNING", "Lint warning in {0}");

  private final Map<String, String> code = new HashMap<>();
  private final Map<String, List<String>> imports = new HashMap<>();
  private final List<BuildEvent> events = Collections.synchronizedList(new ArrayList<>());
  private SortingErrorManager errorManager;
  private BuildOptions.Builder options;

  @Before
  public void setUp() {
    errorManager = new SortingErrorManager();
    options = BuildOptions.builder().setPrefetchThreadCount(2);
    file("src/index.js", "index", "./a", LAZY + "./page");
    file("src/a.js", "a");
    file("src/page.js", "page", "./a");
  }

  private void file(String path, String contents, String... specifiers) {
    code.put(path, contents);
    imports.put(path, ImmutableList.copyOf(specifiers));
  }

  private final Resolver fileResolver =
      (dependency, options) -> {
        String specifier = dependency.getSpecifier();
        String path = specifier;
        if (specifier.startsWith("./") && dependency.getSourcePath() != null) {
          String from = dependency.getSourcePath();
          path = from.substring(0, from.lastIndexOf('/') + 1) + specifier.substring(2) + ".js";
        }
        if (!code.containsKey(path)) {
          throw new IOException("Cannot find module '" + specifier + "'");
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
        public ImmutableList<Asset> transform(TransformRequest request, BuildOptions options)
            throws IOException {
          String path = request.getFilePath();
          byte[] contents = code.get(path).getBytes(UTF_8);
          options.getCache().setBlob("content:" + path, contents);
          Asset.Builder asset =
              Asset.builder(path, "js", request.getEnv())
                  .setContentKey("content:" + path)
                  .setStats(new AssetStats(0, contents.length));
          for (String specifier : imports.get(path)) {
            Dependency.Builder dependency;
            if (specifier.startsWith(LAZY)) {
              dependency =
                  Dependency.builder(specifier.substring(LAZY.length()), request.getEnv())
                      .setPriority(Priority.LAZY);
            } else if (specifier.startsWith(OPTIONAL)) {
              dependency =
                  Dependency.builder(specifier.substring(1), request.getEnv()).setOptional(true);
            } else {
              dependency = Dependency.builder(specifier, request.getEnv());
            }
            asset.addDependency(dependency);
          }
          return ImmutableList.of(asset.build());
        }
      };

  /** One bundle per entry and one per lazy import. */
  private static final Bundler SPLIT_AT_LAZY_IMPORTS =
      (bundleGraph, options) -> {
        AssetGraph assetGraph = bundleGraph.getAssetGraph();
        for (Dependency entry : assetGraph.getEntryDependencies()) {
          Asset asset = assetGraph.getResolvedAsset(entry);
          Bundle bundle =
              bundleGraph.createBundle(
                  CreateBundleOptions.builder(TARGET).setEntryAsset(asset).setEntry(true).build());
          bundleGraph.addAssetGraphToBundle(asset, bundle);
        }
        for (Dependency dependency : assetGraph.getAllDependencies()) {
          Asset asset = assetGraph.getResolvedAsset(dependency);
          if (dependency.isAsync() && asset != null) {
            Bundle bundle =
                bundleGraph.createBundle(CreateBundleOptions.forEntryAsset(asset, TARGET));
            bundleGraph.addAssetGraphToBundle(asset, bundle);
            bundleGraph.addBundleReference(dependency, bundle);
          }
        }
      };

  /** Entry bundles keep the entry's name, others get a hash in theirs. */
  private static final Namer NAME_AFTER_ENTRY =
      (bundle, bundleGraph, options) -> {
        Asset main = bundleGraph.getMainEntry(bundle);
        if (main == null) {
          return null;
        }
        String path = main.getFilePath();
        String base = path.substring(path.lastIndexOf('/') + 1, path.lastIndexOf('.'));
        return bundle.isEntry()
            ? base + "." + bundle.getType()
            : base + "." + bundle.getHashReference() + "." + bundle.getType();
      };

  private static final Packager CONCATENATE =
      (bundle, bundleGraph, options) -> {
        StringBuilder out = new StringBuilder();
        for (Asset asset : bundleGraph.getAssets(bundle)) {
          out.append(bundleGraph.getContent(asset).getContent().asCharSource(UTF_8).read());
          out.append('\n');
        }
        for (Bundle loaded : bundleGraph.getReferencedBundles(bundle, ReferenceType.ASYNC)) {
          out.append("import('").append(loaded.getFilePath()).append("');\n");
        }
        return new BundleResult(ByteSource.wrap(out.toString().getBytes(UTF_8)), null);
      };

  private PluginConfig.Builder plugins() {
    return PluginConfig.builder()
        .addResolver(fileResolver)
        .addTransformer(jsTransformer)
        .setBundler(SPLIT_AT_LAZY_IMPORTS)
        .addNamer(NAME_AFTER_ENTRY)
        .putPackager("js", CONCATENATE)
        .addReporter(events::add);
  }

  private BuildResult build(PluginConfig plugins) throws BuildException {
    Dependency entry = Dependency.builder("src/index.js", ENV).setEntry(true).build();
    return new Build(options.build(), plugins, errorManager).run(ImmutableList.of(entry));
  }

  private static String read(PackagedBundle bundle) throws IOException {
    return bundle.contents().asCharSource(UTF_8).read();
  }

  @Test
  public void testBuildsNamesAndPackagesBundles() throws Exception {
    BuildResult result = build(plugins().build());

    assertThat(result.bundles()).hasSize(2);
    PackagedBundle main = result.getBundle("dist/index.js");
    assertThat(main).isNotNull();
    PackagedBundle page = result.bundles().get(1);
    String pageId = page.bundle().getId();
    assertThat(page.hash()).isEqualTo(pageId.substring(0, 8));
    assertThat(page.filePath()).isEqualTo("dist/page." + page.hash() + ".js");
    assertThat(page.bundle().getFilePath()).isEqualTo(page.filePath());
    assertThat(read(main)).isEqualTo("index\na\nimport('" + page.filePath() + "');\n");
    assertThat(read(page)).isEqualTo("page\na\n");
    assertThat(main.size()).isEqualTo((long) read(main).length());
    assertThat(result.bundleGraph().getBundles()).hasSize(2);
    assertThat(result.assetGraph().getAssetCount()).isEqualTo(3);
  }

  @Test
  public void testContentHashes() throws Exception {
    options.setContentHashEnabled(true);

    BuildResult result = build(plugins().build());

    PackagedBundle page = result.bundles().get(1);
    String expected = Hashing.sha256().hashString("page\na\n", UTF_8).toString().substring(0, 8);
    assertThat(page.hash()).isEqualTo(expected);
    assertThat(page.filePath()).isEqualTo("dist/page." + expected + ".js");
    assertThat(read(result.getBundle("dist/index.js"))).contains("dist/page." + expected + ".js");
  }

  @Test
  public void testReportsEveryPhase() throws Exception {
    BuildResult result = build(plugins().build());

    List<BuildEvent.Kind> kinds = new ArrayList<>();
    List<BuildEvent.Phase> phases = new ArrayList<>();
    for (BuildEvent event : events) {
      kinds.add(event.getKind());
      if (event.getPhase() != null) {
        phases.add(event.getPhase());
      }
    }
    assertThat(kinds.get(0)).isEqualTo(BuildEvent.Kind.BUILD_START);
    assertThat(kinds.get(kinds.size() - 1)).isEqualTo(BuildEvent.Kind.BUILD_SUCCESS);
    assertThat(phases)
        .containsExactly(
            BuildEvent.Phase.TRANSFORMING,
            BuildEvent.Phase.VALIDATING,
            BuildEvent.Phase.BUNDLING,
            BuildEvent.Phase.NAMING,
            BuildEvent.Phase.PACKAGING)
        .inOrder();
    BuildEvent success = events.get(events.size() - 1);
    assertThat(success.getBundleGraph()).isSameInstanceAs(result.bundleGraph());
    assertThat(success.getBuildTime()).isEqualTo(result.buildTime());
  }

  @Test
  public void testBundleGraphIsSealedAfterBundling() throws Exception {
    BuildResult result = build(plugins().build());

    assertThat(((MutableBundleGraph) result.bundleGraph()).isSealed()).isTrue();
  }

  @Test
  public void testOptimizersRunInOrder() throws Exception {
    PluginConfig plugins =
        plugins()
            .addOptimizer((bundle, contents, options) -> append(contents, "/*1*/"))
            .addOptimizer((bundle, contents, options) -> append(contents, "/*2*/"))
            .build();

    BuildResult result = build(plugins);

    assertThat(read(result.bundles().get(1))).isEqualTo("page\na\n/*1*//*2*/");
  }

  private static BundleResult append(BundleResult result, String suffix) throws IOException {
    String contents = result.contents().asCharSource(UTF_8).read() + suffix;
    return new BundleResult(ByteSource.wrap(contents.getBytes(UTF_8)), result.map());
  }

  @Test
  public void testValidatorErrorFailsTheBuild() {
    PluginConfig plugins =
        plugins()
            .addValidator(
                (asset, content, options) ->
                    asset.getFilePath().equals("src/a.js")
                        ? ImmutableList.of(Diagnostic.make(LINT_ERROR, asset.getFilePath()))
                        : ImmutableList.of())
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(plugins));

    assertThat(e.getDiagnostics()).hasSize(1);
    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(LINT_ERROR);
    assertThat(e.getDiagnostics().get(0).description()).isEqualTo("Lint error in src/a.js");
    assertThat(errorManager.getErrorCount()).isEqualTo(1);
    BuildEvent last = events.get(events.size() - 1);
    assertThat(last.getKind()).isEqualTo(BuildEvent.Kind.BUILD_FAILURE);
    assertThat(last.getDiagnostics()).isEqualTo(e.getDiagnostics());
  }

  @Test
  public void testValidatorWarningsAreCarriedToSuccess() throws Exception {
    PluginConfig plugins =
        plugins()
            .addValidator(
                (asset, content, options) ->
                    ImmutableList.of(Diagnostic.make(LINT_WARNING, asset.getFilePath())))
            .build();

    build(plugins);

    assertThat(errorManager.getWarningCount()).isEqualTo(3);
    BuildEvent success = events.get(events.size() - 1);
    assertThat(success.getKind()).isEqualTo(BuildEvent.Kind.BUILD_SUCCESS);
    assertThat(success.getDiagnostics()).hasSize(3);
  }

  @Test
  public void testValidatorsSeeCommittedContent() throws Exception {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    PluginConfig plugins =
        plugins()
            .addValidator(
                (asset, content, options) -> {
                  seen.add(content.getContent().asCharSource(UTF_8).read());
                  return ImmutableList.of();
                })
            .build();

    build(plugins);

    assertThat(seen).containsExactly("index", "a", "page");
  }

  @Test
  public void testMissingRequiredDependencyFailsTheBuild() {
    file("src/a.js", "a", "./missing");

    BuildException e = assertThrows(BuildException.class, () -> build(plugins().build()));

    assertThat(e).isInstanceOf(UnresolvedDependencyException.class);
    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(AssetGraph.DEPENDENCY_NOT_RESOLVED);
    assertThat(events.get(events.size() - 1).getKind()).isEqualTo(BuildEvent.Kind.BUILD_FAILURE);
  }

  @Test
  public void testMissingOptionalDependencyIsAWarning() throws Exception {
    file("src/a.js", "a", OPTIONAL + "./missing");

    BuildResult result = build(plugins().build());

    assertThat(result.bundles()).hasSize(2);
    assertThat(errorManager.getWarnings()).hasSize(1);
    assertThat(errorManager.getWarnings().get(0).type())
        .isEqualTo(AssetGraph.OPTIONAL_DEPENDENCY_NOT_RESOLVED);
    Dependency missing = null;
    for (Dependency dependency : result.assetGraph().getAllDependencies()) {
      if (dependency.getSpecifier().equals("./missing")) {
        missing = dependency;
      }
    }
    assertThat(missing).isNotNull();
    assertThat(missing.isOptional()).isTrue();
    assertThat(result.bundleGraph().isDependencyExcluded(missing)).isTrue();
  }

  @Test
  public void testBundlerFailure() {
    PluginConfig plugins =
        plugins()
            .setBundler(
                (bundleGraph, options) -> {
                  throw new IllegalStateException("boom");
                })
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(plugins));

    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(Build.BUNDLER_FAILED);
    assertThat(e.getDiagnostics().get(0).description()).isEqualTo("The bundler failed: boom");
    assertThat(e).hasCauseThat().isInstanceOf(IllegalStateException.class);
  }

  @Test
  public void testUnnamedBundleFailsTheBuild() {
    PluginConfig plugins =
        PluginConfig.builder()
            .addResolver(fileResolver)
            .addTransformer(jsTransformer)
            .setBundler(SPLIT_AT_LAZY_IMPORTS)
            .putPackager("js", CONCATENATE)
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(plugins));

    assertThat(e.getDiagnostics()).hasSize(2);
    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(BundleNaming.UNNAMED_BUNDLE);
  }

  @Test
  public void testDuplicateBundleNames() {
    PluginConfig clashing =
        PluginConfig.builder()
            .addResolver(fileResolver)
            .addTransformer(jsTransformer)
            .setBundler(SPLIT_AT_LAZY_IMPORTS)
            .addNamer((bundle, bundleGraph, options) -> "out.js")
            .addNamer(NAME_AFTER_ENTRY)
            .putPackager("js", CONCATENATE)
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(clashing));

    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(BundleNaming.DUPLICATE_BUNDLE_NAME);
    assertThat(e.getDiagnostics().get(0).description()).endsWith("both write dist/out.js");
  }

  @Test
  public void testNoPackagerForBundleType() {
    PluginConfig plugins =
        PluginConfig.builder()
            .addResolver(fileResolver)
            .addTransformer(jsTransformer)
            .setBundler(SPLIT_AT_LAZY_IMPORTS)
            .addNamer(NAME_AFTER_ENTRY)
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(plugins));

    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(BundlePackager.NO_PACKAGER);
  }

  @Test
  public void testPackagerFailure() {
    PluginConfig plugins =
        plugins()
            .addOptimizer(
                (bundle, contents, options) -> {
                  throw new IOException("disk full");
                })
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(plugins));

    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(BundlePackager.PACKAGING_FAILED);
    assertThat(e.getDiagnostics().get(0).description())
        .isEqualTo("Failed to package dist/index.js: disk full");
  }

  @Test
  public void testMissingContentFailsPackaging() {
    Transformer withoutContent =
        new Transformer() {
          @Override
          public boolean canTransform(TransformRequest request) {
            return true;
          }

          @Override
          public ImmutableList<Asset> transform(TransformRequest request, BuildOptions options) {
            return ImmutableList.of(
                Asset.builder(request.getFilePath(), "js", request.getEnv())
                    .setContentKey("never-written")
                    .build());
          }
        };
    PluginConfig plugins =
        PluginConfig.builder()
            .addResolver(fileResolver)
            .addTransformer(withoutContent)
            .setBundler(SPLIT_AT_LAZY_IMPORTS)
            .addNamer(NAME_AFTER_ENTRY)
            .putPackager("js", CONCATENATE)
            .build();

    BuildException e = assertThrows(BuildException.class, () -> build(plugins));

    assertThat(e.getDiagnostics().get(0).type()).isEqualTo(BundlePackager.CONTENT_UNAVAILABLE);
    assertThat(e).hasCauseThat().isInstanceOf(CacheMissException.class);
  }
}
