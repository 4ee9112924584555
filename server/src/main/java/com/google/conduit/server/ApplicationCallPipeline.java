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
 * ApplicationCallPipeline runs once per incoming call, with the request as
 * subject. Its default phases are a contract plugins rely on:
 * {@link #SETUP}, {@link #MONITORING}, {@link #PLUGINS}, {@link #CALL},
 * {@link #FALLBACK}, in that order.
 */
public class ApplicationCallPipeline extends Pipeline<ApplicationRequest, ApplicationCall> {

  /** Prepares the call and its attributes. */
  public static final PipelinePhase SETUP = new PipelinePhase("Setup");

  /** Tracing, logging and error boundaries that wrap the rest of the call. */
  public static final PipelinePhase MONITORING = new PipelinePhase("Monitoring");

  /** Default phase for plugin handlers. */
  public static final PipelinePhase PLUGINS = new PipelinePhase("Plugins");

  /** Request handling proper, such as routing. */
  public static final PipelinePhase CALL = new PipelinePhase("Call");

  /** Handles calls that nothing responded to. */
  public static final PipelinePhase FALLBACK = new PipelinePhase("Fallback");

  private final ApplicationReceivePipeline receivePipeline = new ApplicationReceivePipeline();
  private final ApplicationSendPipeline sendPipeline = new ApplicationSendPipeline();

  public ApplicationCallPipeline() {
    super(SETUP, MONITORING, PLUGINS, CALL, FALLBACK);
  }

  /**
   * Returns the pipeline that turns request bodies into typed values.
   *
   * @return the receive pipeline
   */
  public ApplicationReceivePipeline getReceivePipeline() {
    return receivePipeline;
  }

  /**
   * Returns the pipeline that turns response values into content. Every
   * response runs its own copy merged from this one.
   *
   * @return the send pipeline
   */
  public ApplicationSendPipeline getSendPipeline() {
    return sendPipeline;
  }
}
