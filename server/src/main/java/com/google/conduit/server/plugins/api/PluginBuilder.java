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
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.core.pipeline.PipelineContext;
import com.google.conduit.core.pipeline.PipelineInterceptor;
import com.google.conduit.core.pipeline.PipelinePhase;
import com.google.conduit.server.Application;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.ApplicationReceivePipeline;
import com.google.conduit.server.ApplicationRequest;
import com.google.conduit.server.ApplicationSendPipeline;
import com.google.conduit.server.ReceiveRequest;
import com.google.conduit.server.events.ApplicationEvents;
import com.google.conduit.server.plugins.ApplicationPlugin;

/**
 * PluginBuilder is handed to the body of a plugin created with
 * {@link ApplicationPlugins#create}. Handlers registered on it are recorded
 * and applied to the application once the body has run.
 *
 * <pre>{@code
 * ApplicationPlugin<Void, PluginInstance> requestId = ApplicationPlugins.create("RequestId", builder -> {
 *   builder.onCall((context, call) -> call.getAttributes().put(REQUEST_ID, UUID.randomUUID().toString()));
 * });
 * ApplicationPlugin<Void, PluginInstance> audit = ApplicationPlugins.create("Audit", builder -> {
 *   builder.after(requestId).onCall((context, call) -> log(call.getAttributes().get(REQUEST_ID)));
 * });
 * }</pre>
 *
 * @param <TConfig>
 *            the plugin configuration type
 */
public class PluginBuilder<TConfig> implements PluginBuilderBase {

  private static final Logger logger = LoggerFactory.getLogger(PluginBuilder.class);

  private final Application application;
  private final TConfig pluginConfig;
  private final AttributeKey<PluginInstance> key;
  private final List<Interception<ApplicationRequest>> callInterceptions = new ArrayList<>();
  private final List<Interception<ReceiveRequest>> onReceiveInterceptions = new ArrayList<>();
  private final List<Interception<Object>> onResponseInterceptions = new ArrayList<>();
  private final List<Interception<Object>> afterResponseInterceptions = new ArrayList<>();
  private final List<Consumer<Application>> shutdownHooks = new ArrayList<>();
  private int phaseCounter;

  PluginBuilder(Application application, TConfig pluginConfig, AttributeKey<PluginInstance> key) {
    this.application = application;
    this.pluginConfig = pluginConfig;
    this.key = key;
  }

  public Application getApplication() {
    return application;
  }

  public TConfig getPluginConfig() {
    return pluginConfig;
  }

  public AttributeKey<PluginInstance> getKey() {
    return key;
  }

  @Override
  public void onCall(CallHandler<CallContext> handler) {
    onCall(ApplicationCallPipeline.PLUGINS, handler);
  }

  /**
   * Registers a call handler in the given phase of the call pipeline.
   *
   * @param phase
   *            a phase of the application call pipeline
   * @param handler
   *            the handler
   */
  public void onCall(PipelinePhase phase, CallHandler<CallContext> handler) {
    intercept(phase, callInterceptor(handler));
  }

  /**
   * Registers a raw interceptor in the given phase of the call pipeline. Use it
   * when a handler has to wrap the rest of the call, for example to time it.
   * The phase counts as one of this plugin's call phases for plugins placed
   * before or after it.
   *
   * @param phase
   *            a phase of the application call pipeline
   * @param interceptor
   *            the interceptor
   */
  public void intercept(PipelinePhase phase, PipelineInterceptor<ApplicationRequest, ApplicationCall> interceptor) {
    callInterceptions.add(Interception.existing(phase, pipeline -> pipeline.intercept(phase, interceptor)));
  }

  @Override
  public void onCallReceive(CallHandler<CallReceiveContext> handler) {
    PipelineInterceptor<ReceiveRequest, ApplicationCall> interceptor = interceptor(CallReceiveContext::new, handler);
    PipelinePhase phase = ApplicationReceivePipeline.TRANSFORM;
    onReceiveInterceptions.add(Interception.existing(phase, pipeline -> pipeline.intercept(phase, interceptor)));
  }

  @Override
  public void onCallRespond(CallHandler<CallRespondContext> handler) {
    PipelineInterceptor<Object, ApplicationCall> interceptor = interceptor(CallRespondContext::new, handler);
    PipelinePhase phase = ApplicationSendPipeline.TRANSFORM;
    onResponseInterceptions.add(Interception.existing(phase, pipeline -> pipeline.intercept(phase, interceptor)));
  }

  @Override
  public void onCallRespondAfterTransform(CallHandler<CallRespondAfterTransformContext> handler) {
    PipelineInterceptor<Object, ApplicationCall> interceptor = interceptor(CallRespondAfterTransformContext::new,
        handler);
    PipelinePhase phase = ApplicationSendPipeline.AFTER;
    afterResponseInterceptions.add(Interception.existing(phase, pipeline -> pipeline.intercept(phase, interceptor)));
  }

  /**
   * Returns a builder whose handlers run before those of the given plugins.
   *
   * @param plugins
   *            the plugins to run before, already installed
   * @return the relative builder
   * @throws com.google.conduit.server.plugins.MissingApplicationPluginException
   *             if one of the plugins is not installed
   */
  @SafeVarargs
  public final PluginBuilderBase before(ApplicationPlugin<?, PluginInstance>... plugins) {
    return new BeforePluginsBuilder(this, resolve(plugins));
  }

  /**
   * Returns a builder whose handlers run after those of the given plugins.
   *
   * @param plugins
   *            the plugins to run after, already installed
   * @return the relative builder
   * @throws com.google.conduit.server.plugins.MissingApplicationPluginException
   *             if one of the plugins is not installed
   */
  @SafeVarargs
  public final PluginBuilderBase after(ApplicationPlugin<?, PluginInstance>... plugins) {
    return new AfterPluginsBuilder(this, resolve(plugins));
  }

  private List<PluginBuilder<?>> resolve(ApplicationPlugin<?, PluginInstance>[] plugins) {
    List<PluginBuilder<?>> builders = new ArrayList<>(plugins.length);
    for (ApplicationPlugin<?, PluginInstance> plugin : plugins) {
      builders.add(application.plugin(plugin).getBuilder());
    }
    return builders;
  }

  /**
   * Runs the hook when the application stops. The hook is subscribed once the
   * plugin is installed.
   *
   * @param hook
   *            the hook
   */
  public void applicationShutdownHook(Consumer<Application> hook) {
    shutdownHooks.add(hook);
  }

  /**
   * Allocates a phase owned by this plugin. The phase is not added to any
   * pipeline.
   *
   * @return a new phase
   */
  PipelinePhase newPhase() {
    return new PipelinePhase(key.getName() + "Phase" + (++phaseCounter));
  }

  List<Interception<ApplicationRequest>> getCallInterceptions() {
    return Collections.unmodifiableList(callInterceptions);
  }

  List<Interception<ReceiveRequest>> getOnReceiveInterceptions() {
    return Collections.unmodifiableList(onReceiveInterceptions);
  }

  List<Interception<Object>> getOnResponseInterceptions() {
    return Collections.unmodifiableList(onResponseInterceptions);
  }

  List<Interception<Object>> getAfterResponseInterceptions() {
    return Collections.unmodifiableList(afterResponseInterceptions);
  }

  void addCallInterception(Interception<ApplicationRequest> interception) {
    callInterceptions.add(interception);
  }

  void addOnReceiveInterception(Interception<ReceiveRequest> interception) {
    onReceiveInterceptions.add(interception);
  }

  void addOnResponseInterception(Interception<Object> interception) {
    onResponseInterceptions.add(interception);
  }

  void addAfterResponseInterception(Interception<Object> interception) {
    afterResponseInterceptions.add(interception);
  }

  /**
   * Applies every recorded interception. All targets are checked first, so a
   * failing install leaves the application untouched.
   */
  void apply() {
    for (Interception<ApplicationRequest> interception : callInterceptions) {
      interception.checkTarget(application);
    }
    for (Interception<ReceiveRequest> interception : onReceiveInterceptions) {
      interception.checkTarget(application.getReceivePipeline());
    }
    for (Interception<Object> interception : onResponseInterceptions) {
      interception.checkTarget(application.getSendPipeline());
    }
    for (Interception<Object> interception : afterResponseInterceptions) {
      interception.checkTarget(application.getSendPipeline());
    }

    for (Interception<ApplicationRequest> interception : callInterceptions) {
      interception.apply(application);
    }
    for (Interception<ReceiveRequest> interception : onReceiveInterceptions) {
      interception.apply(application.getReceivePipeline());
    }
    for (Interception<Object> interception : onResponseInterceptions) {
      interception.apply(application.getSendPipeline());
    }
    for (Interception<Object> interception : afterResponseInterceptions) {
      interception.apply(application.getSendPipeline());
    }
    for (Consumer<Application> hook : shutdownHooks) {
      application.getEvents().subscribe(ApplicationEvents.APPLICATION_STOPPED, hook);
    }
    logger.debug("Applied {} interceptions of plugin {}", callInterceptions.size() + onReceiveInterceptions.size()
        + onResponseInterceptions.size() + afterResponseInterceptions.size(), key.getName());
  }

  static PipelineInterceptor<ApplicationRequest, ApplicationCall> callInterceptor(CallHandler<CallContext> handler) {
    return (context, subject) -> {
      CallContext callContext = new CallContext(context);
      if (!context.getContext().isHandled()) {
        handler.handle(callContext, context.getContext());
      }
      callContext.proceedIfNeeded();
    };
  }

  static <T, C extends CallHandlingContext<T>> PipelineInterceptor<T, ApplicationCall> interceptor(
      Function<PipelineContext<T, ApplicationCall>, C> contextFactory, CallHandler<C> handler) {
    return (context, subject) -> {
      C handlingContext = contextFactory.apply(context);
      handler.handle(handlingContext, context.getContext());
      handlingContext.proceedIfNeeded();
    };
  }
}
