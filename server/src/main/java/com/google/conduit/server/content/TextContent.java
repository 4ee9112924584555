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

import java.nio.charset.StandardCharsets;

import com.google.conduit.server.HttpStatusCode;

/**
 * Text content, encoded as UTF-8.
 */
public class TextContent extends OutgoingContent {

  public static final String TEXT_PLAIN = "text/plain; charset=UTF-8";

  private final String text;
  private final String contentType;
  private final HttpStatusCode status;

  public TextContent(String text, String contentType) {
    this(text, contentType, null);
  }

  public TextContent(String text, String contentType, HttpStatusCode status) {
    this.text = text;
    this.contentType = contentType;
    this.status = status;
  }

  public String getText() {
    return text;
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
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "TextContent[" + contentType + "] \"" + text + "\"";
  }
}
