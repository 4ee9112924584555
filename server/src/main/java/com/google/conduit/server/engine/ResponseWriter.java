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

import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.content.OutgoingContent;

/**
 * Writes committed response content to the transport. This is the only point
 * where an engine touches the wire.
 */
@FunctionalInterface
public interface ResponseWriter {

  /**
   * Writes the content of a call.
   *
   * @param call
   *            the call, already committed
   * @param content
   *            the content
   * @throws Exception
   *             if writing fails
   */
  void write(ApplicationCall call, OutgoingContent content) throws Exception;
}
