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

/**
 * The installed form of a plugin created with {@link ApplicationPlugins}. It
 * keeps the builder so that plugins installed later can place their handlers
 * relative to this one.
 */
public final class PluginInstance {

  private final PluginBuilder<?> builder;

  PluginInstance(PluginBuilder<?> builder) {
    this.builder = builder;
  }

  PluginBuilder<?> getBuilder() {
    return builder;
  }

  @Override
  public String toString() {
    return "PluginInstance(" + builder.getKey().getName() + ")";
  }
}
