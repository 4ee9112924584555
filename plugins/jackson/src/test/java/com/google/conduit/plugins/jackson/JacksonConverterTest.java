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

package com.google.conduit.plugins.jackson;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDate;
import java.util.Map;
import java.util.function.Consumer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.conduit.server.Application;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationCallPipeline;
import com.google.conduit.server.BadRequestException;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.TextContent;
import com.google.conduit.server.testing.TestApplicationEngine;

/**
 * Unit tests for JacksonConverter.
 */
class JacksonConverterTest {

  private TestApplicationEngine engine;

  public static class Item {
    public String name;
    public int quantity;
    public LocalDate due;

    public Item() {
    }

    Item(String name, int quantity, LocalDate due) {
      this.name = name;
      this.quantity = quantity;
      this.due = due;
    }
  }

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.stop();
    }
  }

  private TestApplicationEngine start(Consumer<Application> module) {
    engine = new TestApplicationEngine(app -> {
      app.install(JacksonConverter.PLUGIN);
      module.accept(app);
    }).start();
    return engine;
  }

  private static TextContent content(ApplicationCall call) {
    return (TextContent) call.getResponse().getContent();
  }

  @Test
  void testReceiveJson() throws Exception {
    start(app -> app.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
      Item item = context.getContext().receive(Item.class);
      context.getContext().respond(item.name + " x" + item.quantity + " by " + item.due);
    }));

    ApplicationCall call = engine.handleRequest(request -> request.method("POST")
        .header("Content-Type", "application/json")
        .body("{\"name\":\"bolt\",\"quantity\":3,\"due\":\"2025-03-01\",\"ignored\":true}"));

    assertEquals("bolt x3 by 2025-03-01", content(call).getText());
  }

  @Test
  void testRespondJson() throws Exception {
    start(app -> app.intercept(ApplicationCallPipeline.CALL,
        (context, request) -> context.getContext().respond(new Item("nut", 7, LocalDate.of(2025, 1, 2)))));

    ApplicationCall call = engine.handleRequest(request -> request.uri("/items/nut"));

    TextContent content = content(call);
    assertEquals(JacksonConverter.APPLICATION_JSON, content.getContentType());
    JsonNode json = JacksonConverter.defaultObjectMapper().readTree(content.getText());
    assertEquals("nut", json.get("name").asText());
    assertEquals(7, json.get("quantity").asInt());
    assertEquals("2025-01-02", json.get("due").asText());
    assertEquals(HttpStatusCode.OK, call.getResponse().getStatus());
  }

  @Test
  void testRespondKeepsTextAndStatusCodes() throws Exception {
    start(app -> app.intercept(ApplicationCallPipeline.CALL,
        (context, request) -> context.getContext().respond("plain")));

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertEquals(TextContent.TEXT_PLAIN, content(call).getContentType());
    assertEquals("plain", content(call).getText());
  }

  @Test
  void testMalformedJsonIsBadRequest() throws Exception {
    start(app -> app.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
      try {
        context.getContext().receive(Item.class);
      } catch (BadRequestException e) {
        context.getContext().respond(new TextContent(e.getMessage(), TextContent.TEXT_PLAIN,
            HttpStatusCode.BAD_REQUEST));
      }
    }));

    ApplicationCall call = engine.handleRequest(request -> request.method("POST")
        .header("Content-Type", "application/json").body("{\"name\":"));

    assertEquals(HttpStatusCode.BAD_REQUEST, call.getResponse().getStatus());
    assertTrue(content(call).getText().startsWith("Failed to parse JSON"));
  }

  @Test
  void testNonJsonContentTypeIsUnsupported() throws Exception {
    start(app -> app.intercept(ApplicationCallPipeline.CALL, (context, request) -> {
      context.getContext().receive(Item.class);
      context.getContext().respond("unreachable");
    }));

    ApplicationCall call = engine.handleRequest(request -> request.method("POST")
        .header("Content-Type", "text/plain").body("name=bolt"));

    assertEquals(HttpStatusCode.UNSUPPORTED_MEDIA_TYPE, call.getResponse().getStatus());
  }

  @Test
  void testReceiveStringIsLeftToDefaults() throws Exception {
    start(app -> app.intercept(ApplicationCallPipeline.CALL,
        (context, request) -> context.getContext().respond(context.getContext().receive(String.class))));

    ApplicationCall call = engine.handleRequest(request -> request.method("POST")
        .header("Content-Type", "application/json").body("{\"raw\":true}"));

    assertEquals("{\"raw\":true}", content(call).getText());
  }

  @Test
  void testPrettyPrint() throws Exception {
    engine = new TestApplicationEngine(app -> {
      app.install(JacksonConverter.PLUGIN, config -> config.prettyPrint(true));
      app.intercept(ApplicationCallPipeline.CALL,
          (context, request) -> context.getContext().respond(Map.of("key", "value")));
    }).start();

    ApplicationCall call = engine.handleRequest(request -> request.uri("/"));

    assertTrue(content(call).getText().contains("\n"));
  }

  @Test
  void testIsJson() {
    assertTrue(JacksonConverter.isJson("application/json"));
    assertTrue(JacksonConverter.isJson("Application/JSON; charset=UTF-8"));
    assertTrue(JacksonConverter.isJson("application/problem+json"));
    assertFalse(JacksonConverter.isJson("text/plain"));
    assertFalse(JacksonConverter.isJson(null));
  }
}
