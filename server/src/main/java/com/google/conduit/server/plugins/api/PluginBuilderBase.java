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
 * Registration surface shared by every plugin builder variant.
 */
public interface PluginBuilderBase {

  /**
   * Registers a handler that runs for every call.
   *
   * @param handler
   *            the handler
   */
  void onCall(CallHandler<CallContext> handler);

  /**
   * Registers a handler that runs when a call receives its body.
   *
   * @param handler
   *            the handler
   */
  void onCallReceive(CallHandler<CallReceiveContext> handler);

  /**
   * Registers a handler that runs when a call responds, before the response
   * value is written.
   *
   * @param handler
   *            the handler
   */
  void onCallRespond(CallHandler<CallRespondContext> handler);

  /**
   * Registers a handler that runs after the response value has been
   * transformed into its final content.
   *
   * @param handler
   *            the handler
   */
  void onCallRespondAfterTransform(CallHandler<CallRespondAfterTransformContext> handler);
}
