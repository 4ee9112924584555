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

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.server.Application;
import com.google.conduit.server.plugins.ApplicationPlugin;

/**
 * Factory for plugins written against {@link PluginBuilder}.
 */
public final class ApplicationPlugins {

  private ApplicationPlugins() {
  }

  /**
   * Creates a plugin without configuration.
   *
   * @param name
   *            the plugin name, also the name of its key
   * @param body
   *            registers the plugin's handlers
   * @return the plugin
   */
  public static ApplicationPlugin<Void, PluginInstance> create(String name, Consumer<PluginBuilder<Void>> body) {
    return create(name, () -> null, body);
  }

  /**
   * Creates a configurable plugin. The configuration is created anew for every
   * installation and passed to the installer's configure callback before the
   * body runs.
   *
   * @param name
   *            the plugin name, also the name of its key
   * @param createConfiguration
   *            creates the default configuration
   * @param body
   *            registers the plugin's handlers
   * @param <TConfig>
   *            the configuration type
   * @return the plugin
   */
  public static <TConfig> ApplicationPlugin<TConfig, PluginInstance> create(String name,
      Supplier<TConfig> createConfiguration, Consumer<PluginBuilder<TConfig>> body) {
    Objects.requireNonNull(name, "name");
    return new BuilderPlugin<>(new AttributeKey<>(name), createConfiguration, body);
  }

  private static final class BuilderPlugin<TConfig> implements ApplicationPlugin<TConfig, PluginInstance> {

    private final AttributeKey<PluginInstance> key;
    private final Supplier<TConfig> createConfiguration;
    private final Consumer<PluginBuilder<TConfig>> body;

    BuilderPlugin(AttributeKey<PluginInstance> key, Supplier<TConfig> createConfiguration,
        Consumer<PluginBuilder<TConfig>> body) {
      this.key = key;
      this.createConfiguration = createConfiguration;
      this.body = body;
    }

    @Override
    public AttributeKey<PluginInstance> getKey() {
      return key;
    }

    @Override
    public PluginInstance install(Application application, Consumer<TConfig> configure) {
      TConfig config = createConfiguration.get();
      configure.accept(config);
      PluginBuilder<TConfig> builder = new PluginBuilder<>(application, config, key);
      body.accept(builder);
      builder.apply();
      return new PluginInstance(builder);
    }

    @Override
    public String toString() {
      return "ApplicationPlugin(" + key.getName() + ")";
    }
  }
}
