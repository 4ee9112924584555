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

import java.util.Objects;

/**
 * ReceiveRequest is the subject of the {@link ApplicationReceivePipeline}: the
 * type the handler asked for and the value produced so far, which starts as
 * the raw body bytes.
 */
public final class ReceiveRequest {

  private final Class<?> type;
  private final Object value;

  public ReceiveRequest(Class<?> type, Object value) {
    this.type = Objects.requireNonNull(type, "type");
    this.value = value;
  }

  public Class<?> getType() {
    return type;
  }

  public Object getValue() {
    return value;
  }

  /**
   * Returns true while the value is still the raw body.
   *
   * @return true if no transformation has produced a value yet
   */
  public boolean isRaw() {
    return value instanceof byte[];
  }

  public ReceiveRequest withValue(Object value) {
    return new ReceiveRequest(type, value);
  }

  @Override
  public String toString() {
    return "ReceiveRequest(" + type.getSimpleName() + ")";
  }
}
