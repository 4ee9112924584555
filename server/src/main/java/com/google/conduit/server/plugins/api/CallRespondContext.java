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

import com.google.conduit.core.pipeline.PipelineContext;
import com.google.conduit.server.ApplicationCall;

/**
 * Context of an {@code onCallRespond} handler.
 */
public class CallRespondContext extends CallHandlingContext<Object> {

  CallRespondContext(PipelineContext<Object, ApplicationCall> context) {
    super(context);
  }

  /**
   * Returns the value being responded with.
   *
   * @return the response value
   */
  public Object getBody() {
    return getSubject();
  }

  /**
   * Replaces the response value for the rest of the send pipeline.
   *
   * @param body
   *            the new value, usually an
   *            {@link com.google.conduit.server.content.OutgoingContent}
   */
  public void transformBody(Object body) {
    replaceSubject(body);
  }
}
