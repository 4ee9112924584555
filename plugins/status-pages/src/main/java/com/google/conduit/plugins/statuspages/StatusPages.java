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

package com.google.conduit.plugins.statuspages;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.core.ErrorKind;
import com.google.conduit.core.pipeline.PipelineContext;
import com.google.conduit.server.Application;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.ApplicationRequest;
import com.google.conduit.server.ApplicationSendPipeline;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.OutgoingContent;
import com.google.conduit.server.plugins.ApplicationPlugin;

/**
 * StatusPages turns errors and bare status codes into responses.
 *
 * <p>
 * Exception handlers are registered per {@link ErrorKind}. When a call fails,
 * the kind of the error is walked from the most derived kind up to
 * {@link ErrorKind#ANY} and the first registered handler wins. Cancellations
 * are never handled.
 *
 * <pre>{@code
 * application.install(StatusPages.PLUGIN, config -> config
 *     .exception(ErrorKind.BAD_REQUEST, (call, cause) -> call.respond(HttpStatusCode.BAD_REQUEST))
 *     .status((call, status) -> call.respond(new TextContent("Nothing here", TextContent.TEXT_PLAIN, status)),
 *         HttpStatusCode.NOT_FOUND));
 * }</pre>
 */
public final class StatusPages {

  private static final Logger logger = LoggerFactory.getLogger(StatusPages.class);

  /** The plugin. */
  public static final ApplicationPlugin<Config, StatusPages> PLUGIN = new Plugin();

  private static final AttributeKey<StatusPages> STATUS_HANDLED = new AttributeKey<>("StatusPagesHandled");

  private final Map<ErrorKind, ExceptionHandler> exceptions;
  private final Map<HttpStatusCode, StatusHandler> statuses;

  private StatusPages(Config config) {
    this.exceptions = Collections.unmodifiableMap(new LinkedHashMap<>(config.exceptions));
    this.statuses = Collections.unmodifiableMap(new LinkedHashMap<>(config.statuses));
  }

  /**
   * Handles an error raised by a call.
   */
  @FunctionalInterface
  public interface ExceptionHandler {
    void handle(ApplicationCall call, Throwable cause) throws Exception;
  }

  /**
   * Handles a response carrying one of the registered status codes.
   */
  @FunctionalInterface
  public interface StatusHandler {
    void handle(ApplicationCall call, HttpStatusCode status) throws Exception;
  }

  /**
   * StatusPages configuration.
   */
  public static final class Config {
    private final Map<ErrorKind, ExceptionHandler> exceptions = new LinkedHashMap<>();
    private final Map<HttpStatusCode, StatusHandler> statuses = new LinkedHashMap<>();

    /**
     * Registers a handler for errors of the kind and its descendants.
     *
     * @param kind
     *            the error kind
     * @param handler
     *            the handler
     * @return this config
     */
    public Config exception(ErrorKind kind, ExceptionHandler handler) {
      exceptions.put(kind, handler);
      return this;
    }

    /**
     * Registers a handler for responses with any of the status codes.
     *
     * @param handler
     *            the handler
     * @param codes
     *            the status codes
     * @return this config
     */
    public Config status(StatusHandler handler, HttpStatusCode... codes) {
      for (HttpStatusCode code : codes) {
        statuses.put(code, handler);
      }
      return this;
    }
  }

  ExceptionHandler findHandler(Throwable cause) {
    for (ErrorKind kind : ErrorKind.of(cause).lineage()) {
      ExceptionHandler handler = exceptions.get(kind);
      if (handler != null) {
        return handler;
      }
    }
    return null;
  }

  private void interceptCall(PipelineContext<ApplicationRequest, ApplicationCall> context) throws Exception {
    try {
      context.proceed();
    } catch (CancellationException e) {
      throw e;
    } catch (Exception e) {
      ApplicationCall call = context.getContext();
      ExceptionHandler handler = context.isCancelled() ? null : findHandler(e);
      if (handler == null || call.getResponse().isCommitted()) {
        throw e;
      }
      logger.debug("Handling {} for {}", ErrorKind.of(e), call);
      handler.handle(call, e);
      finishIfResponseSent(context);
    }
  }

  private void interceptResponse(PipelineContext<Object, ApplicationCall> context, Object message) throws Exception {
    ApplicationCall call = context.getContext();
    HttpStatusCode status = null;
    if (message instanceof OutgoingContent) {
      status = ((OutgoingContent) message).getStatus();
    } else if (message instanceof HttpStatusCode) {
      status = (HttpStatusCode) message;
    }
    StatusHandler handler = status != null ? statuses.get(status) : null;
    if (handler == null || call.getAttributes().contains(STATUS_HANDLED)) {
      context.proceed();
      return;
    }
    call.getAttributes().put(STATUS_HANDLED, this);
    logger.debug("Handling status {} for {}", status, call);
    handler.handle(call, status);
    finishIfResponseSent(context);
    if (!context.isFinished()) {
      context.proceed();
    }
  }

  private static void finishIfResponseSent(PipelineContext<?, ApplicationCall> context) {
    if (context.getContext().getResponse().isCommitted()) {
      context.finish();
    }
  }

  private static final class Plugin implements ApplicationPlugin<Config, StatusPages> {

    private final AttributeKey<StatusPages> key = new AttributeKey<>("Status Pages");

    @Override
    public AttributeKey<StatusPages> getKey() {
      return key;
    }

    @Override
    public StatusPages install(Application application, Consumer<Config> configure) {
      Config config = new Config();
      configure.accept(config);
      StatusPages plugin = new StatusPages(config);
      if (!plugin.statuses.isEmpty()) {
        application.getSendPipeline().intercept(ApplicationSendPipeline.AFTER,
            (context, message) -> plugin.interceptResponse(context, message));
      }
      if (!plugin.exceptions.isEmpty()) {
        application.intercept(ApplicationCallPipeline.MONITORING,
            (context, request) -> plugin.interceptCall(context));
      }
      return plugin;
    }
  }
}
