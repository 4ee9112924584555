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

import com.google.conduit.server.ApplicationCall;

/**
 * Handler registered through a {@link PluginBuilderBase}.
 *
 * @param <C>
 *            the handling context type
 */
@FunctionalInterface
public interface CallHandler<C> {

  /**
   * Handles one step of a call. The pipeline continues once the handler
   * returns, unless the handler called {@code finish()}.
   *
   * @param context
   *            the handling context
   * @param call
   *            the call
   * @throws Exception
   *             if handling fails; the error propagates up the pipeline
   */
  void handle(C context, ApplicationCall call) throws Exception;
}
