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

package com.google.conduit.server.plugins;

import java.util.function.Consumer;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.server.Application;

/**
 * ApplicationPlugin is a unit of installable behavior. Installing a plugin
 * registers phases and interceptors on the application; this happens once, at
 * startup, never per call.
 *
 * <p>
 * Most plugins are created with
 * {@link com.google.conduit.server.plugins.api.ApplicationPlugins#create}.
 * Plugins that need full control over the pipelines implement this interface
 * directly.
 *
 * @param <TConfig>
 *            the configuration type
 * @param <TPlugin>
 *            the type of the installed instance
 */
public interface ApplicationPlugin<TConfig, TPlugin> {

  /**
   * Returns the key the installed instance is stored under. The key name is
   * used in error messages.
   *
   * @return the plugin key
   */
  AttributeKey<TPlugin> getKey();

  /**
   * Installs the plugin.
   *
   * @param application
   *            the application to install into
   * @param configure
   *            configures the plugin before installation
   * @return the installed instance
   */
  TPlugin install(Application application, Consumer<TConfig> configure);
}
