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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for Attributes.
 */
class AttributesTest {

  @Test
  void testPutAndGet() {
    Attributes attributes = new Attributes();
    AttributeKey<String> key = new AttributeKey<>("name");

    attributes.put(key, "value");

    assertTrue(attributes.contains(key));
    assertEquals("value", attributes.get(key));
  }

  @Test
  void testKeysCompareByIdentity() {
    Attributes attributes = new Attributes();
    AttributeKey<String> first = new AttributeKey<>("same");
    AttributeKey<String> second = new AttributeKey<>("same");

    attributes.put(first, "value");

    assertNull(attributes.getOrNull(second));
    assertThrows(IllegalStateException.class, () -> attributes.get(second));
  }

  @Test
  void testComputeIfAbsentKeepsFirstValue() {
    Attributes attributes = new Attributes();
    AttributeKey<Integer> key = new AttributeKey<>("counter");

    assertEquals(1, attributes.computeIfAbsent(key, () -> 1));
    assertEquals(1, attributes.computeIfAbsent(key, () -> 2));

    attributes.remove(key);
    assertFalse(attributes.contains(key));
  }

  @Test
  void testNullValueIsRejected() {
    Attributes attributes = new Attributes();
    AttributeKey<String> key = new AttributeKey<>("name");

    NullPointerException exception = assertThrows(NullPointerException.class, () -> attributes.put(key, null));

    assertEquals("value", exception.getMessage());
    assertFalse(attributes.contains(key));
  }
}
