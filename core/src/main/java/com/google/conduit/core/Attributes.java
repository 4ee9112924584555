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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Attributes is a thread-safe typed map used to carry call-scoped and
 * application-scoped data between interceptors that do not know about each
 * other.
 */
public class Attributes {

  private final Map<AttributeKey<?>, Object> values = new ConcurrentHashMap<>();

  /**
   * Returns the value for the key.
   *
   * @param key
   *            the key
   * @param <T>
   *            the value type
   * @return the value
   * @throws IllegalStateException
   *             if no value is set
   */
  public <T> T get(AttributeKey<T> key) {
    T value = getOrNull(key);
    if (value == null) {
      throw new IllegalStateException("No instance for key " + key);
    }
    return value;
  }

  @SuppressWarnings("unchecked")
  public <T> T getOrNull(AttributeKey<T> key) {
    return (T) values.get(key);
  }

  public boolean contains(AttributeKey<?> key) {
    return values.containsKey(key);
  }

  /**
   * Stores a value. Null values are not allowed; use {@link #remove} instead.
   *
   * @param key
   *            the key
   * @param value
   *            the value
   * @param <T>
   *            the value type
   */
  public <T> void put(AttributeKey<T> key, T value) {
    values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
  }

  public void remove(AttributeKey<?> key) {
    values.remove(key);
  }

  /**
   * Returns the value for the key, computing and storing it first when absent.
   *
   * @param key
   *            the key
   * @param supplier
   *            creates the value
   * @param <T>
   *            the value type
   * @return the stored value
   */
  @SuppressWarnings("unchecked")
  public <T> T computeIfAbsent(AttributeKey<T> key, Supplier<T> supplier) {
    return (T) values.computeIfAbsent(key, k -> supplier.get());
  }

  public List<AttributeKey<?>> allKeys() {
    return Collections.unmodifiableList(new ArrayList<>(values.keySet()));
  }
}
