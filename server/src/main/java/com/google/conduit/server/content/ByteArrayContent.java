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
 * Content backed by a byte array.
 */
public class ByteArrayContent extends OutgoingContent {

  private final byte[] bytes;
  private final String contentType;
  private final HttpStatusCode status;

  public ByteArrayContent(byte[] bytes, String contentType) {
    this(bytes, contentType, null);
  }

  public ByteArrayContent(byte[] bytes, String contentType, HttpStatusCode status) {
    this.bytes = bytes;
    this.contentType = contentType;
    this.status = status;
  }

  @Override
  public HttpStatusCode getStatus() {
    return status;
  }

  @Override
  public String getContentType() {
    return contentType;
  }

  @Override
  public byte[] bytes() {
    return bytes;
  }
}
