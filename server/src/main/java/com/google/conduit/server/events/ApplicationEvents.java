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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.server.Application;

/**
 * ApplicationEvents dispatches lifecycle events to subscribers.
 */
public class ApplicationEvents {

  private static final Logger logger = LoggerFactory.getLogger(ApplicationEvents.class);

  /** Raised before modules are loaded; engines wire their defaults here. */
  public static final EventDefinition<Application> APPLICATION_STARTING = new EventDefinition<>("ApplicationStarting");

  /** Raised once all modules are loaded. */
  public static final EventDefinition<Application> APPLICATION_STARTED = new EventDefinition<>("ApplicationStarted");

  public static final EventDefinition<Application> APPLICATION_STOPPING = new EventDefinition<>("ApplicationStopping");

  public static final EventDefinition<Application> APPLICATION_STOPPED = new EventDefinition<>("ApplicationStopped");

  private final Map<EventDefinition<?>, List<Consumer<?>>> handlers = new ConcurrentHashMap<>();

  /**
   * Subscribes to an event.
   *
   * @param definition
   *            the event
   * @param handler
   *            the handler
   * @param <T>
   *            the payload type
   * @return a handle that removes the subscription when run
   */
  public <T> Runnable subscribe(EventDefinition<T> definition, Consumer<T> handler) {
    List<Consumer<?>> list = handlers.computeIfAbsent(definition, k -> new CopyOnWriteArrayList<>());
    list.add(handler);
    return () -> list.remove(handler);
  }

  /**
   * Raises an event. Every handler runs even if an earlier one fails; the first
   * failure is re-thrown with the later ones attached as suppressed.
   *
   * @param definition
   *            the event
   * @param value
   *            the payload
   * @param <T>
   *            the payload type
   */
  @SuppressWarnings("unchecked")
  public <T> void raise(EventDefinition<T> definition, T value) {
    List<Consumer<?>> list = handlers.get(definition);
    if (list == null) {
      return;
    }
    RuntimeException failure = null;
    for (Consumer<?> handler : list) {
      try {
        ((Consumer<T>) handler).accept(value);
      } catch (RuntimeException e) {
        logger.error("Event handler for {} failed", definition.getName(), e);
        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }
}
