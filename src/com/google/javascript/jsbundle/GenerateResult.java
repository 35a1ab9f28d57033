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

import com.google.common.io.ByteSource;
import com.google.javascript.jsbundle.sourcemap.SourceMap;
import org.jspecify.annotations.Nullable;

/**
 * The output of a {@link CodeGenerator}.
 *
 * @param content The generated code.
 * @param map The source map of the generated code, if one was produced.
 */
public record GenerateResult(ByteSource content, @Nullable SourceMap map) {}
