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

package com.google.conduit.server;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * ApplicationRequest is the already-parsed request handed to the pipeline by
 * the engine. Header names are case-insensitive.
 */
public class ApplicationRequest {

  private final String method;
  private final String uri;
  private final Map<String, List<String>> headers;
  private final byte[] body;

  private ApplicationRequest(Builder builder) {
    this.method = builder.method;
    this.uri = builder.uri;
    Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (Map.Entry<String, List<String>> entry : builder.headers.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    this.headers = Collections.unmodifiableMap(copy);
    this.body = builder.body;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getMethod() {
    return method;
  }

  public String getUri() {
    return uri;
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  /**
   * Returns the first value of the header.
   *
   * @param name
   *            the header name
   * @return the value, or null if the header is absent
   */
  public String getHeader(String name) {
    List<String> values = headers.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  /**
   * Returns all values of the header.
   *
   * @param name
   *            the header name
   * @return the values, empty if the header is absent
   */
  public List<String> getHeaders(String name) {
    List<String> values = headers.get(name);
    return values != null ? values : Collections.emptyList();
  }

  public String getContentType() {
    return getHeader("Content-Type");
  }

  /**
   * Returns the raw body bytes. The array is shared; do not modify it.
   *
   * @return the body, empty if the request has none
   */
  public byte[] getBody() {
    return body;
  }

  @Override
  public String toString() {
    return method + " " + uri;
  }

  /**
   * Builder for ApplicationRequest.
   */
  public static class Builder {
    private String method = "GET";
    private String uri = "/";
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private byte[] body = new byte[0];

    public Builder method(String method) {
      this.method = method;
      return this;
    }

    public Builder uri(String uri) {
      this.uri = uri;
      return this;
    }

    public Builder header(String name, String value) {
      headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
      return this;
    }

    public Builder body(byte[] body) {
      this.body = body != null ? body : new byte[0];
      return this;
    }

    public Builder body(String body) {
      return body(body.getBytes(StandardCharsets.UTF_8));
    }

    public ApplicationRequest build() {
      return new ApplicationRequest(this);
    }
  }
}
