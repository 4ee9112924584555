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

/**
 * Builder API for application plugins.
 *
 * <p>
 * A plugin registers handlers for four kinds of work: every call
 * ({@code onCall}), receiving a body ({@code onCallReceive}), responding
 * ({@code onCallRespond}) and inspecting the final response content
 * ({@code onCallRespondAfterTransform}). Handlers can be placed before or
 * after the handlers of plugins installed earlier with
 * {@link com.google.conduit.server.plugins.api.PluginBuilder#before} and
 * {@link com.google.conduit.server.plugins.api.PluginBuilder#after}.
 */
package com.google.conduit.server.plugins.api;
