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

package com.google.conduit.server.content;

import com.google.conduit.server.HttpStatusCode;

/**
 * Body-less content that only carries a status.
 */
public class HttpStatusCodeContent extends OutgoingContent {

  private static final byte[] EMPTY = new byte[0];

  private final HttpStatusCode status;

  public HttpStatusCodeContent(HttpStatusCode status) {
    this.status = status;
  }

  @Override
  public HttpStatusCode getStatus() {
    return status;
  }

  @Override
  public byte[] bytes() {
    return EMPTY;
  }

  @Override
  public String toString() {
    return "HttpStatusCodeContent(" + status + ")";
  }
}
