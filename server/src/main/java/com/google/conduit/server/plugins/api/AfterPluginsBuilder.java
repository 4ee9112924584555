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

package com.google.conduit.server.plugins.api;

import java.util.List;

import com.google.conduit.core.pipeline.Pipeline;
import com.google.conduit.core.pipeline.PipelinePhase;

/**
 * Registers handlers that run after all handlers of the other plugins.
 */
public final class AfterPluginsBuilder extends RelativePluginBuilder {

  AfterPluginsBuilder(PluginBuilder<?> currentPlugin, List<PluginBuilder<?>> otherPlugins) {
    super(currentPlugin, otherPlugins);
  }

  @Override
  protected PipelinePhase selectBoundary(List<PipelinePhase> phases) {
    return phases.isEmpty() ? null : phases.get(phases.size() - 1);
  }

  @Override
  protected void insertPhase(Pipeline<?, ?> pipeline, PipelinePhase boundary, PipelinePhase phase) {
    pipeline.insertPhaseAfter(boundary, phase);
  }
}
