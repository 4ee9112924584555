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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.pipeline.Pipeline;
import com.google.conduit.core.pipeline.PipelineInterceptor;
import com.google.conduit.core.pipeline.PipelinePhase;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.ApplicationReceivePipeline;
import com.google.conduit.server.ApplicationRequest;
import com.google.conduit.server.ApplicationSendPipeline;
import com.google.conduit.server.ReceiveRequest;
import com.google.conduit.server.plugins.MissingApplicationPluginException;

/**
 * RelativePluginBuilder registers handlers into fresh phases placed relative to
 * the phases other plugins use for the same kind of handler.
 *
 * <p>
 * Placement happens when the plugin is applied: the phases of every other
 * plugin are sorted by their current position in the target pipeline, and the
 * new phase is inserted next to the boundary chosen by
 * {@link #selectBoundary(List)}. Every phase of the other plugins must be
 * present in the target pipeline, otherwise the install fails with a
 * {@link MissingApplicationPluginException} before anything is changed. The boundary is taken over all other plugins
 * at once, so the final position satisfies every listed dependency.
 */
public abstract class RelativePluginBuilder implements PluginBuilderBase {

  private static final Logger logger = LoggerFactory.getLogger(RelativePluginBuilder.class);

  private final PluginBuilder<?> currentPlugin;
  private final List<PluginBuilder<?>> otherPlugins;

  protected RelativePluginBuilder(PluginBuilder<?> currentPlugin, List<PluginBuilder<?>> otherPlugins) {
    this.currentPlugin = currentPlugin;
    this.otherPlugins = new ArrayList<>(otherPlugins);
  }

  /**
   * Picks the phase to insert next to.
   *
   * @param phases
   *            the phases of the other plugins, sorted by pipeline position
   * @return the boundary phase, or null if {@code phases} is empty
   */
  protected abstract PipelinePhase selectBoundary(List<PipelinePhase> phases);

  /**
   * Inserts the phase next to the boundary.
   *
   * @param pipeline
   *            the target pipeline
   * @param boundary
   *            the boundary phase
   * @param phase
   *            the phase to insert
   */
  protected abstract void insertPhase(Pipeline<?, ?> pipeline, PipelinePhase boundary, PipelinePhase phase);

  @Override
  public void onCall(CallHandler<CallContext> handler) {
    PipelineInterceptor<ApplicationRequest, ApplicationCall> interceptor = PluginBuilder.callInterceptor(handler);
    currentPlugin.addCallInterception(
        relative(PluginBuilder::getCallInterceptions, ApplicationCallPipeline.PLUGINS, interceptor));
  }

  @Override
  public void onCallReceive(CallHandler<CallReceiveContext> handler) {
    PipelineInterceptor<ReceiveRequest, ApplicationCall> interceptor = PluginBuilder
        .interceptor(CallReceiveContext::new, handler);
    currentPlugin.addOnReceiveInterception(
        relative(PluginBuilder::getOnReceiveInterceptions, ApplicationReceivePipeline.TRANSFORM, interceptor));
  }

  @Override
  public void onCallRespond(CallHandler<CallRespondContext> handler) {
    PipelineInterceptor<Object, ApplicationCall> interceptor = PluginBuilder.interceptor(CallRespondContext::new,
        handler);
    currentPlugin.addOnResponseInterception(
        relative(PluginBuilder::getOnResponseInterceptions, ApplicationSendPipeline.TRANSFORM, interceptor));
  }

  @Override
  public void onCallRespondAfterTransform(CallHandler<CallRespondAfterTransformContext> handler) {
    PipelineInterceptor<Object, ApplicationCall> interceptor = PluginBuilder
        .interceptor(CallRespondAfterTransformContext::new, handler);
    currentPlugin.addAfterResponseInterception(
        relative(PluginBuilder::getAfterResponseInterceptions, ApplicationSendPipeline.AFTER, interceptor));
  }

  private <T> Interception<T> relative(Function<PluginBuilder<?>, List<Interception<T>>> interceptionsOf,
      PipelinePhase defaultPhase, PipelineInterceptor<T, ApplicationCall> interceptor) {
    PipelinePhase newPhase = currentPlugin.newPhase();
    Consumer<Pipeline<T, ApplicationCall>> check = pipeline -> otherPhases(pipeline, interceptionsOf);
    Consumer<Pipeline<T, ApplicationCall>> action = pipeline -> {
      List<PipelinePhase> otherPhases = otherPhases(pipeline, interceptionsOf);
      otherPhases.sort(Comparator.comparingInt(pipeline::indexOf));
      PipelinePhase boundary = selectBoundary(otherPhases);
      if (boundary == null) {
        boundary = defaultPhase;
      }
      insertPhase(pipeline, boundary, newPhase);
      logger.debug("Placed {} next to {} for plugin {}", newPhase, boundary, currentPlugin.getKey().getName());
      pipeline.intercept(newPhase, interceptor);
    };
    return Interception.placing(newPhase, check, action);
  }

  private <T> List<PipelinePhase> otherPhases(Pipeline<T, ApplicationCall> pipeline,
      Function<PluginBuilder<?>, List<Interception<T>>> interceptionsOf) {
    List<PipelinePhase> phases = new ArrayList<>();
    for (PluginBuilder<?> other : otherPlugins) {
      for (Interception<T> interception : interceptionsOf.apply(other)) {
        PipelinePhase phase = interception.getPhase();
        if (!pipeline.contains(phase)) {
          throw new MissingApplicationPluginException(other.getKey());
        }
        if (!phases.contains(phase)) {
          phases.add(phase);
        }
      }
    }
    return phases;
  }
}
