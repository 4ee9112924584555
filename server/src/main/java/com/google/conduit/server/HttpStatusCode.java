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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * HttpStatusCode is an HTTP status value with its reason phrase. Two codes are
 * equal when their numeric values are equal.
 */
public final class HttpStatusCode {

  private static final Map<Integer, HttpStatusCode> KNOWN = new HashMap<>();

  public static final HttpStatusCode OK = known(200, "OK");
  public static final HttpStatusCode CREATED = known(201, "Created");
  public static final HttpStatusCode NO_CONTENT = known(204, "No Content");
  public static final HttpStatusCode FOUND = known(302, "Found");
  public static final HttpStatusCode BAD_REQUEST = known(400, "Bad Request");
  public static final HttpStatusCode UNAUTHORIZED = known(401, "Unauthorized");
  public static final HttpStatusCode FORBIDDEN = known(403, "Forbidden");
  public static final HttpStatusCode NOT_FOUND = known(404, "Not Found");
  public static final HttpStatusCode METHOD_NOT_ALLOWED = known(405, "Method Not Allowed");
  public static final HttpStatusCode NOT_ACCEPTABLE = known(406, "Not Acceptable");
  public static final HttpStatusCode CONFLICT = known(409, "Conflict");
  public static final HttpStatusCode UNSUPPORTED_MEDIA_TYPE = known(415, "Unsupported Media Type");
  public static final HttpStatusCode INTERNAL_SERVER_ERROR = known(500, "Internal Server Error");
  public static final HttpStatusCode SERVICE_UNAVAILABLE = known(503, "Service Unavailable");
  public static final HttpStatusCode GATEWAY_TIMEOUT = known(504, "Gateway Timeout");

  private final int value;
  private final String description;

  public HttpStatusCode(int value, String description) {
    if (value < 100 || value > 999) {
      throw new IllegalArgumentException("Invalid status code: " + value);
    }
    this.value = value;
    this.description = description;
  }

  private static HttpStatusCode known(int value, String description) {
    HttpStatusCode code = new HttpStatusCode(value, description);
    KNOWN.put(value, code);
    return code;
  }

  /**
   * Returns the status for the numeric value.
   *
   * @param value
   *            the status code
   * @return the well-known instance, or a new one with description "Unknown
   *         Status Code"
   */
  public static HttpStatusCode fromValue(int value) {
    HttpStatusCode code = KNOWN.get(value);
    return code != null ? code : new HttpStatusCode(value, "Unknown Status Code");
  }

  public static Map<Integer, HttpStatusCode> allKnown() {
    return Collections.unmodifiableMap(KNOWN);
  }

  public int getValue() {
    return value;
  }

  public String getDescription() {
    return description;
  }

  public boolean isSuccess() {
    return value >= 200 && value < 300;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof HttpStatusCode && ((HttpStatusCode) o).value == value;
  }

  @Override
  public int hashCode() {
    return value;
  }

  @Override
  public String toString() {
    return value + " " + description;
  }
}
