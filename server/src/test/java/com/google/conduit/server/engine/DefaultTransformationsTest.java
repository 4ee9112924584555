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

package com.google.conduit.server.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for DefaultTransformations.
 */
class DefaultTransformationsTest {

  @Test
  void testCharsetDefaultsToUtf8() {
    assertEquals(StandardCharsets.UTF_8, DefaultTransformations.charsetOf(null));
    assertEquals(StandardCharsets.UTF_8, DefaultTransformations.charsetOf("text/plain"));
  }

  @Test
  void testCharsetParameter() {
    assertEquals(StandardCharsets.ISO_8859_1, DefaultTransformations.charsetOf("text/plain; charset=ISO-8859-1"));
    assertEquals(StandardCharsets.UTF_16, DefaultTransformations.charsetOf("text/plain;Charset=\"UTF-16\""));
  }

  @Test
  void testUnknownCharset() {
    assertEquals(StandardCharsets.UTF_8, DefaultTransformations.charsetOf("text/plain; charset=no-such-charset"));
  }
}
