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

package com.google.conduit.server;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.Attributes;
import com.google.conduit.server.events.ApplicationEvents;
import com.google.conduit.server.plugins.ApplicationPlugin;
import com.google.conduit.server.plugins.DuplicatePluginException;
import com.google.conduit.server.plugins.MissingApplicationPluginException;

/**
 * Application is the root call pipeline of a server. Plugins are installed into
 * it at startup; installed instances are stored in the application attributes
 * under the plugin key.
 */
public class Application extends ApplicationCallPipeline {

  private static final Logger logger = LoggerFactory.getLogger(Application.class);

  private final ApplicationEvents events;
  private final Attributes attributes = new Attributes();
  private final boolean developmentMode;

  public Application() {
    this(new ApplicationEvents(), false);
  }

  public Application(ApplicationEvents events, boolean developmentMode) {
    this.events = events;
    this.developmentMode = developmentMode;
  }

  public ApplicationEvents getEvents() {
    return events;
  }

  public Attributes getAttributes() {
    return attributes;
  }

  public boolean isDevelopmentMode() {
    return developmentMode;
  }

  /**
   * Installs a plugin with its default configuration.
   *
   * @param plugin
   *            the plugin
   * @param <TPlugin>
   *            the installed instance type
   * @return the installed instance
   */
  public <TConfig, TPlugin> TPlugin install(ApplicationPlugin<TConfig, TPlugin> plugin) {
    return install(plugin, config -> {
    });
  }

  /**
   * Installs a plugin.
   *
   * @param plugin
   *            the plugin
   * @param configure
   *            configures the plugin
   * @param <TConfig>
   *            the configuration type
   * @param <TPlugin>
   *            the installed instance type
   * @return the installed instance
   * @throws DuplicatePluginException
   *             if a plugin with the same key is already installed
   */
  public synchronized <TConfig, TPlugin> TPlugin install(ApplicationPlugin<TConfig, TPlugin> plugin,
      Consumer<TConfig> configure) {
    String name = plugin.getKey().getName();
    if (attributes.contains(plugin.getKey())) {
      throw new DuplicatePluginException(name);
    }
    TPlugin instance;
    try {
      instance = plugin.install(this, configure);
    } catch (RuntimeException e) {
      logger.error("Failed to install plugin: {}", name, e);
      throw e;
    }
    attributes.put(plugin.getKey(), instance);
    logger.info("Installed plugin: {}", name);
    return instance;
  }

  /**
   * Returns the installed instance of a plugin.
   *
   * @param plugin
   *            the plugin
   * @param <TPlugin>
   *            the installed instance type
   * @return the installed instance
   * @throws MissingApplicationPluginException
   *             if the plugin is not installed
   */
  public <TPlugin> TPlugin plugin(ApplicationPlugin<?, TPlugin> plugin) {
    TPlugin instance = pluginOrNull(plugin);
    if (instance == null) {
      throw new MissingApplicationPluginException(plugin.getKey());
    }
    return instance;
  }

  public <TPlugin> TPlugin pluginOrNull(ApplicationPlugin<?, TPlugin> plugin) {
    return attributes.getOrNull(plugin.getKey());
  }
}
