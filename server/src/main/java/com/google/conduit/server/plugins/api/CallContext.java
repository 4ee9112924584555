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
import com.google.conduit.server.ApplicationRequest;

/**
 * Context of an {@code onCall} handler.
 */
public class CallContext extends CallHandlingContext<ApplicationRequest> {

  CallContext(PipelineContext<ApplicationRequest, ApplicationCall> context) {
    super(context);
  }

  public ApplicationRequest getRequest() {
    return getSubject();
  }
}
