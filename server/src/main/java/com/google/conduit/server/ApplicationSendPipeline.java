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

package com.google.conduit.server;

import com.google.conduit.core.pipeline.Pipeline;
import com.google.conduit.core.pipeline.PipelinePhase;

/**
 * Pipeline run by {@link ApplicationCall#respond(Object)}. The subject starts
 * as the value passed to {@code respond} and must be an
 * {@link com.google.conduit.server.content.OutgoingContent} by the time it
 * reaches {@link #ENGINE}.
 */
public class ApplicationSendPipeline extends Pipeline<Object, ApplicationCall> {

  public static final PipelinePhase BEFORE = new PipelinePhase("Before");

  /** Converts response values into content. */
  public static final PipelinePhase TRANSFORM = new PipelinePhase("Transform");

  /** Sees the final content; used for status handling and metrics. */
  public static final PipelinePhase AFTER = new PipelinePhase("After");

  /** Writes the content through the engine. */
  public static final PipelinePhase ENGINE = new PipelinePhase("Engine");

  public ApplicationSendPipeline() {
    super(BEFORE, TRANSFORM, AFTER, ENGINE);
  }
}
