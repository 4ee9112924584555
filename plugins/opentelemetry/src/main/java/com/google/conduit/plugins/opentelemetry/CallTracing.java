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

package com.google.conduit.plugins.opentelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.OutgoingContent;
import com.google.conduit.server.plugins.ApplicationPlugin;
import com.google.conduit.server.plugins.api.ApplicationPlugins;
import com.google.conduit.server.plugins.api.PluginInstance;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

/**
 * CallTracing opens one SERVER span per call. The span covers everything
 * after the setup phase, records errors that escape the call and the status
 * and content type of the final response.
 */
public final class CallTracing {

  private static final Logger logger = LoggerFactory.getLogger(CallTracing.class);

  public static final String DEFAULT_INSTRUMENTATION_NAME = "conduit-server";

  /** The span of the call, available to handlers while the call runs. */
  public static final AttributeKey<Span> SPAN = new AttributeKey<>("CallTracingSpan");

  /** The plugin. */
  public static final ApplicationPlugin<Config, PluginInstance> PLUGIN = ApplicationPlugins.create("CallTracing",
      Config::new, builder -> {
        Tracer tracer = builder.getPluginConfig().openTelemetry
            .getTracer(builder.getPluginConfig().instrumentationName);

        builder.intercept(ApplicationCallPipeline.MONITORING, (context, request) -> {
          ApplicationCall call = context.getContext();
          long startedAt = System.nanoTime();
          Span span = tracer.spanBuilder(request.getMethod() + " " + pathOf(request.getUri()))
              .setSpanKind(SpanKind.SERVER).startSpan();
          span.setAttribute("http.request.method", request.getMethod());
          span.setAttribute("url.path", pathOf(request.getUri()));
          call.getAttributes().put(SPAN, span);
          try (Scope scope = span.makeCurrent()) {
            context.proceed();
          } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage());
            throw e;
          } finally {
            span.end();
            logger.debug("{} {} responded {} in {} ms", request.getMethod(), request.getUri(),
                call.getResponse().getStatus(), (System.nanoTime() - startedAt) / 1_000_000);
          }
        });

        builder.onCallRespondAfterTransform((context, call) -> {
          Span span = call.getAttributes().getOrNull(SPAN);
          if (span == null) {
            return;
          }
          Object body = context.getTransformedBody();
          if (body instanceof OutgoingContent) {
            OutgoingContent content = (OutgoingContent) body;
            HttpStatusCode status = content.getStatus() != null ? content.getStatus() : call.getResponse().getStatus();
            if (status == null) {
              status = HttpStatusCode.OK;
            }
            span.setAttribute("http.response.status_code", status.getValue());
            if (content.getContentType() != null) {
              span.setAttribute("http.response.content_type", content.getContentType());
            }
            if (status.getValue() >= 500) {
              span.setStatus(StatusCode.ERROR);
            }
          }
        });
      });

  private CallTracing() {
  }

  static String pathOf(String uri) {
    int query = uri.indexOf('?');
    return query >= 0 ? uri.substring(0, query) : uri;
  }

  /**
   * CallTracing configuration.
   */
  public static final class Config {
    private OpenTelemetry openTelemetry = GlobalOpenTelemetry.get();
    private String instrumentationName = DEFAULT_INSTRUMENTATION_NAME;

    public Config openTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = openTelemetry;
      return this;
    }

    public Config instrumentationName(String instrumentationName) {
      this.instrumentationName = instrumentationName;
      return this;
    }
  }
}
