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

import com.google.conduit.server.Application;
import com.google.conduit.server.events.ApplicationEvents;

/**
 * ApplicationEngine hosts an {@link Application} and feeds calls into it.
 */
public interface ApplicationEngine {

  /**
   * Returns the running application.
   *
   * @return the application
   * @throws IllegalStateException
   *             if the engine is not started
   */
  Application getApplication();

  ApplicationEvents getEvents();

  EngineOptions getOptions();

  /**
   * Creates the application, loads the modules and starts accepting calls.
   *
   * @return this engine
   */
  ApplicationEngine start();

  /**
   * Stops accepting calls and releases the engine's threads.
   */
  void stop();
}
