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

package com.google.conduit.server.events;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.conduit.server.Application;
import com.google.conduit.server.engine.EngineOptions;
import com.google.conduit.server.testing.TestApplicationEngine;

/**
 * Unit tests for ApplicationEvents.
 */
class ApplicationEventsTest {

  private ApplicationEvents events;

  @BeforeEach
  void setUp() {
    events = new ApplicationEvents();
  }

  @Test
  void testSubscribeAndRaise() {
    EventDefinition<String> definition = new EventDefinition<>("Test");
    List<String> received = new ArrayList<>();
    events.subscribe(definition, received::add);

    events.raise(definition, "payload");

    assertEquals(List.of("payload"), received);
  }

  @Test
  void testUnsubscribe() {
    EventDefinition<String> definition = new EventDefinition<>("Test");
    List<String> received = new ArrayList<>();
    Runnable unsubscribe = events.subscribe(definition, received::add);

    unsubscribe.run();
    events.raise(definition, "payload");

    assertTrue(received.isEmpty());
  }

  @Test
  void testRaiseWithoutSubscribers() {
    assertDoesNotThrow(() -> events.raise(new EventDefinition<String>("Nobody"), "payload"));
  }

  @Test
  void testAllHandlersRunWhenOneFails() {
    EventDefinition<String> definition = new EventDefinition<>("Test");
    List<String> received = new ArrayList<>();
    IllegalStateException first = new IllegalStateException("first");
    IllegalArgumentException second = new IllegalArgumentException("second");
    events.subscribe(definition, value -> {
      throw first;
    });
    events.subscribe(definition, received::add);
    events.subscribe(definition, value -> {
      throw second;
    });

    IllegalStateException e = assertThrows(IllegalStateException.class, () -> events.raise(definition, "payload"));

    assertSame(first, e);
    assertEquals(List.of("payload"), received);
    assertEquals(1, e.getSuppressed().length);
    assertSame(second, e.getSuppressed()[0]);
  }

  @Test
  void testLifecycleOrder() {
    List<String> order = new ArrayList<>();
    TestApplicationEngine engine = new TestApplicationEngine(EngineOptions.builder().build(),
        app -> order.add("module"));
    ApplicationEvents engineEvents = engine.getEvents();
    engineEvents.subscribe(ApplicationEvents.APPLICATION_STARTING, app -> order.add("starting"));
    engineEvents.subscribe(ApplicationEvents.APPLICATION_STARTED, app -> order.add("started"));
    engineEvents.subscribe(ApplicationEvents.APPLICATION_STOPPING, app -> order.add("stopping"));
    engineEvents.subscribe(ApplicationEvents.APPLICATION_STOPPED, app -> order.add("stopped"));

    engine.start();
    Application application = engine.getApplication();
    engine.stop();

    assertEquals(List.of("starting", "module", "started", "stopping", "stopped"), order);
    assertSame(engineEvents, application.getEvents());
  }
}
