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

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.google.conduit.core.pipeline.PhaseNotFoundException;
import com.google.conduit.core.pipeline.PipelinePhase;
import com.google.conduit.server.Application;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.OutgoingContent;
import com.google.conduit.server.content.TextContent;
import com.google.conduit.server.events.ApplicationEvents;
import com.google.conduit.server.plugins.ApplicationPlugin;
import com.google.conduit.server.testing.TestApplicationEngine;

/**
 * Unit tests for PluginBuilder.
 */
class PluginBuilderTest {

  private TestApplicationEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.stop();
    }
  }

  private TestApplicationEngine start(Consumer<Application> module) {
    engine = new TestApplicationEngine(module).start();
    return engine;
  }

  private static final class Greeting {
    private final String name;

    Greeting(String name) {
      this.name = name;
    }
  }

  @Test
  void testOnCallRunsForEveryCall() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Recorder",
        builder -> builder.onCall((context, call) -> seen.add(context.getRequest().getUri())));
    start(app -> app.install(plugin));

    engine.handleRequest(request -> request.uri("/a"));
    engine.handleRequest(request -> request.uri("/b"));

    assertEquals(List.of("/a", "/b"), seen);
  }

  @Test
  void testOnCallInPhase() throws Exception {
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Early",
        builder -> builder.onCall(ApplicationCallPipeline.MONITORING, (context, call) -> call.respond("early")));
    start(app -> app.install(plugin));

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertEquals(HttpStatusCode.OK, call.getResponse().getStatus());
    assertEquals("early", ((TextContent) call.getResponse().getContent()).getText());
  }

  @Test
  void testOnCallSkippedWhenHandled() throws Exception {
    AtomicBoolean late = new AtomicBoolean();
    ApplicationPlugin<Void, PluginInstance> early = ApplicationPlugins.create("Early",
        builder -> builder.onCall(ApplicationCallPipeline.MONITORING, (context, call) -> call.respond("early")));
    ApplicationPlugin<Void, PluginInstance> skipped = ApplicationPlugins.create("Late",
        builder -> builder.onCall((context, call) -> late.set(true)));
    start(app -> {
      app.install(early);
      app.install(skipped);
    });

    engine.handleRequest(request -> request.uri("/"));

    assertFalse(late.get());
    assertEquals(1, engine.getWrittenResponses().size());
  }

  @Test
  void testFinishStopsPipeline() throws Exception {
    AtomicBoolean reachedCall = new AtomicBoolean();
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Stopper", builder -> {
      builder.onCall((context, call) -> {
        call.respond(HttpStatusCode.FORBIDDEN);
        context.finish();
      });
    });
    start(app -> {
      app.install(plugin);
      app.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
        reachedCall.set(true);
        context.proceed();
      });
    });

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertFalse(reachedCall.get());
    assertEquals(HttpStatusCode.FORBIDDEN, call.getResponse().getStatus());
  }

  @Test
  void testOnCallReceiveTransformsBody() throws Exception {
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Numbers", builder -> {
      builder.onCallReceive((context, call) -> {
        if (context.getRequestedType() == Integer.class && context.getBody() instanceof byte[]) {
          context.transformBody(Integer.valueOf(new String((byte[]) context.getBody(), StandardCharsets.UTF_8)));
        }
      });
    });
    start(app -> {
      app.install(plugin);
      app.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
        int value = context.getContext().receive(Integer.class);
        context.getContext().respond(String.valueOf(value * 2));
      });
    });

    ApplicationCall call = engine.handleRequest(request -> request.method("POST").body("21"));

    assertEquals("42", ((TextContent) call.getResponse().getContent()).getText());
  }

  @Test
  void testOnCallRespondTransformsBody() throws Exception {
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Greetings", builder -> {
      builder.onCallRespond((context, call) -> {
        if (context.getBody() instanceof Greeting) {
          context.transformBody(new TextContent("Hello, " + ((Greeting) context.getBody()).name,
              TextContent.TEXT_PLAIN));
        }
      });
    });
    start(app -> {
      app.install(plugin);
      app.intercept(ApplicationCallPipeline.CALL,
          (context, request) -> context.getContext().respond(new Greeting("Ada")));
    });

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertEquals("Hello, Ada", ((TextContent) call.getResponse().getContent()).getText());
  }

  @Test
  void testOnCallRespondAfterTransformSeesContent() throws Exception {
    List<Object> seen = new CopyOnWriteArrayList<>();
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Inspector", builder -> {
      builder.onCallRespondAfterTransform((context, call) -> {
        seen.add(context.getTransformedBody());
        call.getResponse().header("X-Inspected", "true");
      });
    });
    start(app -> {
      app.install(plugin);
      app.intercept(ApplicationCallPipeline.CALL, (context, request) -> context.getContext().respond("text"));
    });

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertEquals(1, seen.size());
    assertTrue(seen.get(0) instanceof OutgoingContent);
    assertEquals(List.of("true"), call.getResponse().getHeaders().get("x-inspected"));
  }

  @Test
  void testFinishInRespondHandlerSkipsEngine() throws Exception {
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Swallow",
        builder -> builder.onCallRespond((context, call) -> context.finish()));
    start(app -> {
      app.install(plugin);
      app.intercept(ApplicationCallPipeline.CALL, (context, request) -> context.getContext().respond("dropped"));
    });

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertFalse(call.isHandled());
    assertTrue(engine.getWrittenResponses().isEmpty());
  }

  @Test
  void testApplicationShutdownHook() {
    AtomicBoolean stopped = new AtomicBoolean();
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Closer",
        builder -> builder.applicationShutdownHook(app -> stopped.set(true)));
    start(app -> app.install(plugin));

    engine.stop();

    assertTrue(stopped.get());
  }

  @Test
  void testPhasesAreNamedAfterPlugin() {
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Named", builder -> {
    });
    Application application = new Application();
    PluginInstance instance = application.install(plugin);

    assertEquals("NamedPhase1", instance.getBuilder().newPhase().getName());
    assertEquals("NamedPhase2", instance.getBuilder().newPhase().getName());
  }

  @Test
  void testFailedInstallLeavesApplicationUntouched() {
    PipelinePhase stray = new PipelinePhase("Stray");
    AtomicBoolean stopped = new AtomicBoolean();
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Partial", builder -> {
      builder.onCall((context, call) -> {
      });
      builder.onCallRespond((context, call) -> {
      });
      builder.applicationShutdownHook(app -> stopped.set(true));
      builder.onCall(stray, (context, call) -> {
      });
    });
    Application application = new Application();

    PhaseNotFoundException exception = assertThrows(PhaseNotFoundException.class, () -> application.install(plugin));

    assertSame(stray, exception.getPhase());
    assertNull(application.pluginOrNull(plugin));
    assertEquals(0, application.getInterceptorCount());
    assertEquals(0, application.getSendPipeline().getInterceptorCount());
    application.getEvents().raise(ApplicationEvents.APPLICATION_STOPPED, application);
    assertFalse(stopped.get());
  }

  @Test
  void testRawInterceptorWrapsTheRestOfTheCall() throws Exception {
    List<String> seen = new CopyOnWriteArrayList<>();
    ApplicationPlugin<Void, PluginInstance> plugin = ApplicationPlugins.create("Timer",
        builder -> builder.intercept(ApplicationCallPipeline.MONITORING, (context, request) -> {
          seen.add("start");
          context.proceed();
          seen.add("end " + context.getContext().getResponse().getStatus());
        }));
    start(app -> {
      app.install(plugin);
      app.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
        seen.add("call");
        context.getContext().respond("ok");
      });
    });

    engine.handleRequest(request -> request.uri("/"));

    assertEquals(List.of("start", "call", "end " + HttpStatusCode.OK), seen);
    assertSame(ApplicationCallPipeline.MONITORING,
        engine.getApplication().plugin(plugin).getBuilder().getCallInterceptions().get(0).getPhase());
  }
}
