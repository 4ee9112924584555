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

package com.google.conduit.core;

import java.util.Objects;

/**
 * Typed key for {@link Attributes}. Keys compare by identity, so two keys with
 * the same name address different values.
 *
 * @param <T>
 *            the value type
 */
public final class AttributeKey<T> {

  private final String name;

  public AttributeKey(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "AttributeKey: " + name;
  }
}
