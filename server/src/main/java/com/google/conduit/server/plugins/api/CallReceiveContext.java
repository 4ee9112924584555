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
import com.google.conduit.server.ReceiveRequest;

/**
 * Context of an {@code onCallReceive} handler.
 */
public class CallReceiveContext extends CallHandlingContext<ReceiveRequest> {

  CallReceiveContext(PipelineContext<ReceiveRequest, ApplicationCall> context) {
    super(context);
  }

  /**
   * Returns the type the handler of the call asked for.
   *
   * @return the requested type
   */
  public Class<?> getRequestedType() {
    return getSubject().getType();
  }

  /**
   * Returns the body as produced so far, the raw bytes unless an earlier
   * handler transformed it.
   *
   * @return the body
   */
  public Object getBody() {
    return getSubject().getValue();
  }

  /**
   * Replaces the body seen by later receive handlers and by the caller of
   * {@code receive}.
   *
   * @param body
   *            the converted body
   */
  public void transformBody(Object body) {
    replaceSubject(getSubject().withValue(body));
  }
}
