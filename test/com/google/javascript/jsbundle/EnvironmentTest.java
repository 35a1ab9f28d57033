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
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Environment} and the values it is made of. */
@RunWith(JUnit4.class)
public final class EnvironmentTest {

  @Test
  public void testDefaults() {
    Environment env = Environment.builder().build();

    assertThat(env.getContext()).isEqualTo(EnvironmentContext.BROWSER);
    assertThat(env.getOutputFormat()).isEqualTo(OutputFormat.GLOBAL);
    assertThat(env.getEngines()).isEmpty();
    assertThat(env.isLibrary()).isFalse();
    assertThat(env.shouldMinify()).isFalse();
    assertThat(env.shouldScopeHoist()).isFalse();
    assertThat(env.includesNodeModule("react")).isTrue();
  }

  @Test
  public void testEqualEnvironmentsShareAnId() {
    Environment a =
        Environment.builder().setEngines(ImmutableMap.of("browsers", "> 0.25%")).build();
    Environment b =
        Environment.builder().setEngines(ImmutableMap.of("browsers", "> 0.25%")).build();

    assertThat(a).isEqualTo(b);
    assertThat(a.getId()).isEqualTo(b.getId());
  }

  @Test
  public void testEveryFieldIsPartOfTheId() {
    Environment base = Environment.builder().build();

    assertThat(base.toBuilder().setContext(EnvironmentContext.NODE).build().getId())
        .isNotEqualTo(base.getId());
    assertThat(base.toBuilder().setOutputFormat(OutputFormat.ESMODULE).build().getId())
        .isNotEqualTo(base.getId());
    assertThat(base.toBuilder().setMinifyEnabled(true).build().getId())
        .isNotEqualTo(base.getId());
    assertThat(base.toBuilder().setIncludeNodeModules(IncludeNodeModules.none()).build().getId())
        .isNotEqualTo(base.getId());
  }

  @Test
  public void testContexts() {
    assertThat(EnvironmentContext.BROWSER.isBrowser()).isTrue();
    assertThat(EnvironmentContext.BROWSER.isIsolated()).isFalse();
    assertThat(EnvironmentContext.WEB_WORKER.isBrowser()).isTrue();
    assertThat(EnvironmentContext.WEB_WORKER.isIsolated()).isTrue();
    assertThat(EnvironmentContext.SERVICE_WORKER.isWorker()).isTrue();
    assertThat(EnvironmentContext.WORKLET.isWorker()).isFalse();
    assertThat(EnvironmentContext.WORKLET.isIsolated()).isTrue();
    assertThat(EnvironmentContext.NODE.isNode()).isTrue();
    assertThat(EnvironmentContext.NODE.isBrowser()).isFalse();
    assertThat(EnvironmentContext.ELECTRON_RENDERER.isBrowser()).isTrue();
    assertThat(EnvironmentContext.ELECTRON_RENDERER.isNode()).isTrue();
    assertThat(EnvironmentContext.ELECTRON_MAIN.isElectron()).isTrue();
    assertThat(EnvironmentContext.ELECTRON_MAIN.isBrowser()).isFalse();
  }

  @Test
  public void testContextNames() {
    assertThat(EnvironmentContext.fromName("web-worker")).isEqualTo(EnvironmentContext.WEB_WORKER);
    assertThat(EnvironmentContext.ELECTRON_MAIN.getName()).isEqualTo("electron-main");
    assertThrows(IllegalArgumentException.class, () -> EnvironmentContext.fromName("deno"));
  }

  @Test
  public void testIncludeNodeModules() {
    assertThat(IncludeNodeModules.all().includes("lodash")).isTrue();
    assertThat(IncludeNodeModules.none().includes("lodash")).isFalse();

    IncludeNodeModules only = IncludeNodeModules.only(ImmutableList.of("lodash"));
    assertThat(only.includes("lodash")).isTrue();
    assertThat(only.includes("react")).isFalse();

    IncludeNodeModules map = IncludeNodeModules.fromMap(ImmutableMap.of("react", false));
    assertThat(map.includes("react")).isFalse();
    assertThat(map.includes("lodash")).isTrue();
  }

  @Test
  public void testTarget() {
    Environment env = Environment.builder().setContext(EnvironmentContext.NODE).build();
    Target target = Target.builder("server", "dist/server", env).setDistEntry("main.js").build();

    assertThat(target.getName()).isEqualTo("server");
    assertThat(target.getDistDir()).isEqualTo("dist/server");
    assertThat(target.getDistEntry()).isEqualTo("main.js");
    assertThat(target.getPublicUrl()).isEqualTo("/");
    assertThat(target.getEnv().isNode()).isTrue();
    assertThat(target.getLoc()).isNull();
  }
}
