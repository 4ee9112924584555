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

package com.google.conduit.server.engine;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.core.pipeline.PipelineExecution;
import com.google.conduit.server.Application;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.ApplicationRequest;
import com.google.conduit.server.ApplicationSendPipeline;
import com.google.conduit.server.CannotTransformContentToTypeException;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.HttpStatusCodeContent;
import com.google.conduit.server.content.OutgoingContent;
import com.google.conduit.server.events.ApplicationEvents;

/**
 * BaseApplicationEngine wires an {@link Application} to an
 * {@link EnginePipeline} and a {@link ResponseWriter}.
 *
 * <p>
 * When the application starts, the engine merges its receive and send
 * pipelines into the application and installs the default transformations,
 * the default interceptors (duplicate {@code Host} check, 404 fallback) and
 * the transformation checker (415 on receive failures, 406 when nothing could
 * turn a response value into content).
 */
public class BaseApplicationEngine implements ApplicationEngine {

  private static final Logger logger = LoggerFactory.getLogger(BaseApplicationEngine.class);

  /** Set on a call once its send pipeline has run. */
  public static final AttributeKey<Boolean> SEND_PIPELINE_EXECUTED = new AttributeKey<>("SendPipelineExecuted");

  /** Status a routing layer can leave for the fallback to respond with. */
  public static final AttributeKey<HttpStatusCode> ROUTING_FAILURE_STATUS = new AttributeKey<>(
      "RoutingFailureStatusCode");

  private final EngineOptions options;
  private final ResponseWriter responseWriter;
  private final Consumer<Application> module;
  private final EnginePipeline pipeline;
  private final ApplicationEvents events = new ApplicationEvents();

  private volatile Application application;
  private ExecutorService callExecutor;
  private ScheduledExecutorService timeoutScheduler;
  private boolean firstLoading = true;
  private long initializedStartAt = System.currentTimeMillis();

  /**
   * Creates an engine with the default engine pipeline.
   *
   * @param options
   *            the engine options
   * @param responseWriter
   *            writes committed responses
   * @param module
   *            configures the application on every start
   */
  public BaseApplicationEngine(EngineOptions options, ResponseWriter responseWriter, Consumer<Application> module) {
    this(options, responseWriter, module, EnginePipeline.defaultEnginePipeline());
  }

  public BaseApplicationEngine(EngineOptions options, ResponseWriter responseWriter, Consumer<Application> module,
      EnginePipeline pipeline) {
    this.options = options;
    this.responseWriter = responseWriter;
    this.module = module;
    this.pipeline = pipeline;

    setupSendPipeline(pipeline.getSendPipeline());
    events.subscribe(ApplicationEvents.APPLICATION_STARTING, app -> {
      if (!firstLoading) {
        initializedStartAt = System.currentTimeMillis();
      }
      app.getReceivePipeline().merge(pipeline.getReceivePipeline());
      app.getSendPipeline().merge(pipeline.getSendPipeline());
      DefaultTransformations.installDefaultTransformations(app.getReceivePipeline());
      DefaultTransformations.installDefaultTransformations(app.getSendPipeline());
      installDefaultInterceptors(app);
      installDefaultTransformationChecker(app);
    });
    events.subscribe(ApplicationEvents.APPLICATION_STARTED, app -> {
      double elapsedSeconds = (System.currentTimeMillis() - initializedStartAt) / 1_000.0;
      if (firstLoading) {
        logger.info("Application started in {} seconds.", elapsedSeconds);
        firstLoading = false;
      } else {
        logger.info("Application reloaded in {} seconds.", elapsedSeconds);
      }
    });
  }

  private void setupSendPipeline(ApplicationSendPipeline sendPipeline) {
    sendPipeline.intercept(ApplicationSendPipeline.ENGINE, (context, subject) -> {
      if (!(subject instanceof OutgoingContent)) {
        throw new IllegalArgumentException(
            "Response pipeline couldn't transform '" + subject.getClass().getName() + "' to OutgoingContent");
      }
      OutgoingContent content = (OutgoingContent) subject;
      ApplicationCall call = context.getContext();
      call.getResponse().commit(content);
      responseWriter.write(call, content);
      context.proceed();
    });
  }

  private static void installDefaultInterceptors(Application application) {
    application.intercept(ApplicationCallPipeline.SETUP, (context, request) -> {
      ApplicationCall call = context.getContext();
      call.getResponse().getPipeline().intercept(ApplicationSendPipeline.BEFORE, (sendContext, message) -> {
        call.getAttributes().put(SEND_PIPELINE_EXECUTED, Boolean.TRUE);
        sendContext.proceed();
      });
      context.proceed();
    });

    application.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
      List<String> hostHeaders = request.getHeaders("Host");
      if (hostHeaders.size() > 1) {
        logger.debug("Rejecting {}: {} Host headers", request, hostHeaders.size());
        context.getContext().respond(HttpStatusCode.BAD_REQUEST);
        context.finish();
        return;
      }
      context.proceed();
    });

    application.intercept(ApplicationCallPipeline.FALLBACK, (context, request) -> {
      ApplicationCall call = context.getContext();
      if (!call.getAttributes().contains(SEND_PIPELINE_EXECUTED)) {
        HttpStatusCode status = call.getResponse().getStatus();
        if (status == null) {
          status = call.getAttributes().getOrNull(ROUTING_FAILURE_STATUS);
        }
        if (status == null) {
          status = HttpStatusCode.NOT_FOUND;
        }
        call.respond(status);
      }
      context.proceed();
    });
  }

  private static void installDefaultTransformationChecker(Application application) {
    application.intercept(ApplicationCallPipeline.PLUGINS, (context, request) -> {
      try {
        context.proceed();
      } catch (CannotTransformContentToTypeException e) {
        ApplicationCall call = context.getContext();
        if (call.getResponse().isCommitted()) {
          throw e;
        }
        logger.debug("Cannot receive {} as {}", request, e.getType().getName());
        call.respond(HttpStatusCode.UNSUPPORTED_MEDIA_TYPE);
      }
    });

    application.getSendPipeline().intercept(ApplicationSendPipeline.AFTER, (context, subject) -> {
      if (!(subject instanceof OutgoingContent)) {
        context.proceedWith(new HttpStatusCodeContent(HttpStatusCode.NOT_ACCEPTABLE));
      } else {
        context.proceed();
      }
    });
  }

  @Override
  public Application getApplication() {
    Application current = application;
    if (current == null) {
      throw new IllegalStateException("Engine is not started");
    }
    return current;
  }

  @Override
  public ApplicationEvents getEvents() {
    return events;
  }

  @Override
  public EngineOptions getOptions() {
    return options;
  }

  public EnginePipeline getPipeline() {
    return pipeline;
  }

  @Override
  public synchronized BaseApplicationEngine start() {
    if (application != null) {
      throw new IllegalStateException("Engine is already started");
    }
    Application app = new Application(events, options.isDevelopmentMode());
    events.raise(ApplicationEvents.APPLICATION_STARTING, app);
    module.accept(app);
    callExecutor = Executors.newFixedThreadPool(options.getCallThreads(), threadFactory("conduit-call-"));
    timeoutScheduler = Executors.newSingleThreadScheduledExecutor(threadFactory("conduit-timeout-"));
    application = app;
    events.raise(ApplicationEvents.APPLICATION_STARTED, app);
    return this;
  }

  @Override
  public synchronized void stop() {
    Application app = application;
    if (app == null) {
      return;
    }
    try {
      events.raise(ApplicationEvents.APPLICATION_STOPPING, app);
      events.raise(ApplicationEvents.APPLICATION_STOPPED, app);
    } finally {
      application = null;
      callExecutor.shutdownNow();
      timeoutScheduler.shutdownNow();
      logger.info("Application stopped");
    }
  }

  /**
   * Handles a call on the calling thread.
   *
   * @param request
   *            the request
   * @return the call, responded to
   * @throws Exception
   *             if the engine pipeline fails, for example when writing the
   *             response fails
   */
  public ApplicationCall handle(ApplicationRequest request) throws Exception {
    ApplicationCall call = new ApplicationCall(getApplication(), request);
    pipeline.execute(call, request);
    return call;
  }

  /**
   * Handles a call on the engine's call threads. When a call timeout is
   * configured, the call is cancelled once it runs longer.
   *
   * @param request
   *            the request
   * @return a handle to the running call
   */
  public PipelineExecution<ApplicationRequest, ApplicationCall> handleAsync(ApplicationRequest request) {
    ApplicationCall call = new ApplicationCall(getApplication(), request);
    PipelineExecution<ApplicationRequest, ApplicationCall> execution;
    ScheduledExecutorService scheduler;
    synchronized (this) {
      execution = pipeline.executeAsync(call, request, callExecutor);
      scheduler = timeoutScheduler;
    }
    long timeoutMillis = options.getCallTimeout().toMillis();
    if (timeoutMillis > 0) {
      ScheduledFuture<?> timeout = scheduler.schedule(() -> {
        if (execution.cancel()) {
          logger.warn("Call {} cancelled after {} ms", call, timeoutMillis);
        }
      }, timeoutMillis, TimeUnit.MILLISECONDS);
      execution.toCompletableFuture().whenComplete((result, error) -> timeout.cancel(false));
    }
    return execution;
  }

  private static ThreadFactory threadFactory(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
