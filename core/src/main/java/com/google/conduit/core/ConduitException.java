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

/**
 * ConduitException is the base exception for all Conduit errors. It carries an
 * {@link ErrorKind} used by error boundaries to pick a handler.
 */
public class ConduitException extends RuntimeException {

  private final ErrorKind kind;

  /**
   * Creates a new ConduitException.
   *
   * @param message
   *            the error message
   */
  public ConduitException(String message) {
    this(message, null, ErrorKind.CONDUIT);
  }

  /**
   * Creates a new ConduitException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public ConduitException(String message, Throwable cause) {
    this(message, cause, ErrorKind.CONDUIT);
  }

  /**
   * Creates a new ConduitException of the given kind.
   *
   * @param message
   *            the error message
   * @param kind
   *            the error kind
   */
  public ConduitException(String message, ErrorKind kind) {
    this(message, null, kind);
  }

  /**
   * Creates a new ConduitException of the given kind with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param kind
   *            the error kind, {@link ErrorKind#CONDUIT} when null
   */
  public ConduitException(String message, Throwable cause, ErrorKind kind) {
    super(message, cause);
    this.kind = kind != null ? kind : ErrorKind.CONDUIT;
  }

  /**
   * Returns the kind of this error.
   *
   * @return the error kind, never null
   */
  public ErrorKind getKind() {
    return kind;
  }
}
