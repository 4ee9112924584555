/*
 * Copyright 2025 Google LLC
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
 *
 * SPDX-License-Identifier: Apache-2.0
 */

/**
 * The phased interception pipeline.
 *
 * <p>
 * A {@link com.google.conduit.core.pipeline.Pipeline} is an ordered list of
 * {@link com.google.conduit.core.pipeline.PipelinePhase phases}. Phases can be
 * appended or inserted before or after existing ones, and pipelines can be
 * merged into each other. Each phase holds interceptors that run in
 * registration order.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * PipelinePhase before = new PipelinePhase("Before");
 * PipelinePhase call = new PipelinePhase("Call");
 * Pipeline<String, Void> pipeline = new Pipeline<>(before, call);
 *
 * pipeline.intercept(before, (context, subject) -> context.proceedWith(subject.trim()));
 * pipeline.intercept(call, (context, subject) -> context.proceedWith("Hello, " + subject));
 *
 * String result = pipeline.execute(null, "  world "); // "Hello, world"
 * }
 * </pre>
 *
 * @see com.google.conduit.core.pipeline.Pipeline
 * @see com.google.conduit.core.pipeline.PipelineContext
 */
package com.google.conduit.core.pipeline;
