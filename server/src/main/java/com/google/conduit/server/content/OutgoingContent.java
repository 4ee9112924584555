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
 * OutgoingContent is the final, wire-ready form of a response. The send
 * pipeline turns whatever value a handler responds with into one of these
 * before the engine writes it.
 */
public abstract class OutgoingContent {

  /**
   * Returns the status this content should be sent with.
   *
   * @return the status, or null to keep the status already set on the response
   */
  public HttpStatusCode getStatus() {
    return null;
  }

  /**
   * Returns the content type.
   *
   * @return the content type, or null if the content has no body
   */
  public String getContentType() {
    return null;
  }

  /**
   * Returns the body bytes.
   *
   * @return the body, empty if there is none
   */
  public abstract byte[] bytes();
}
