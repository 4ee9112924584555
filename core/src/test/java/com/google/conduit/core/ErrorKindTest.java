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

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for ErrorKind.
 */
class ErrorKindTest {

  @Test
  void testLineageEndsAtAny() {
    assertEquals(List.of(ErrorKind.CANNOT_TRANSFORM_CONTENT, ErrorKind.BAD_REQUEST, ErrorKind.CONDUIT, ErrorKind.ANY),
        ErrorKind.CANNOT_TRANSFORM_CONTENT.lineage());
    assertEquals(List.of(ErrorKind.ANY), ErrorKind.ANY.lineage());
  }

  @Test
  void testDefinedKindsExtendTheTree() {
    ErrorKind validation = ErrorKind.define("validation", ErrorKind.BAD_REQUEST);

    assertSame(ErrorKind.BAD_REQUEST, validation.getParent());
    assertTrue(validation.isA(ErrorKind.BAD_REQUEST));
    assertTrue(validation.isA(ErrorKind.ANY));
    assertFalse(validation.isA(ErrorKind.PLUGIN));
    assertFalse(ErrorKind.BAD_REQUEST.isA(validation));
  }

  @Test
  void testKindOfThrowable() {
    ErrorKind custom = ErrorKind.define("custom", ErrorKind.CONDUIT);

    assertSame(custom, ErrorKind.of(new ConduitException("boom", custom)));
    assertSame(ErrorKind.CANCELLED, ErrorKind.of(new CancellationException()));
    assertSame(ErrorKind.UNCLASSIFIED, ErrorKind.of(new IOException()));
  }

  @Test
  void testDefineRejectsMissingParent() {
    assertThrows(NullPointerException.class, () -> ErrorKind.define("orphan", null));
  }
}
