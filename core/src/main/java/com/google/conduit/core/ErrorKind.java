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
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * ErrorKind is a tag identifying a family of errors. Kinds form a tree rooted
 * at {@link #ANY}; error boundaries look handlers up by walking a kind's
 * {@link #lineage()} from the most derived kind to the root instead of
 * matching exception classes reflectively.
 *
 * <p>
 * Applications define their own kinds with {@link #define(String, ErrorKind)}
 * and attach them to the exceptions they throw through
 * {@link ConduitException#getKind()}.
 */
public final class ErrorKind {

  /** Root of the hierarchy; matches every error. */
  public static final ErrorKind ANY = new ErrorKind("any", null);

  /** Errors that do not carry a kind of their own. */
  public static final ErrorKind UNCLASSIFIED = new ErrorKind("unclassified", ANY);

  /** Cancellation of a running call. Error boundaries must not handle it. */
  public static final ErrorKind CANCELLED = new ErrorKind("cancelled", ANY);

  /** Base kind of every {@link ConduitException}. */
  public static final ErrorKind CONDUIT = new ErrorKind("conduit", ANY);

  /** Errors in the pipeline structure, such as a missing phase. */
  public static final ErrorKind PIPELINE = new ErrorKind("pipeline", CONDUIT);

  /** Plugin installation errors. */
  public static final ErrorKind PLUGIN = new ErrorKind("plugin", CONDUIT);

  /** Errors caused by the client request. */
  public static final ErrorKind BAD_REQUEST = new ErrorKind("bad-request", CONDUIT);

  /** The request body could not be converted to the requested type. */
  public static final ErrorKind CANNOT_TRANSFORM_CONTENT = new ErrorKind("cannot-transform-content", BAD_REQUEST);

  /** A response was already committed for the call. */
  public static final ErrorKind RESPONSE_ALREADY_SENT = new ErrorKind("response-already-sent", CONDUIT);

  private final String name;
  private final ErrorKind parent;

  private ErrorKind(String name, ErrorKind parent) {
    this.name = name;
    this.parent = parent;
  }

  /**
   * Defines a new kind below the given parent.
   *
   * @param name
   *            the kind name, used in logs only
   * @param parent
   *            the parent kind
   * @return the new kind
   */
  public static ErrorKind define(String name, ErrorKind parent) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(parent, "parent");
    return new ErrorKind(name, parent);
  }

  /**
   * Returns the kind of the given error.
   *
   * @param error
   *            the error
   * @return the kind carried by a {@link ConduitException},
   *         {@link #CANCELLED} for cancellations, otherwise
   *         {@link #UNCLASSIFIED}
   */
  public static ErrorKind of(Throwable error) {
    if (error instanceof ConduitException) {
      return ((ConduitException) error).getKind();
    }
    if (error instanceof CancellationException) {
      return CANCELLED;
    }
    return UNCLASSIFIED;
  }

  public String getName() {
    return name;
  }

  /**
   * Returns the parent kind.
   *
   * @return the parent, or null for {@link #ANY}
   */
  public ErrorKind getParent() {
    return parent;
  }

  /**
   * Returns this kind followed by its ancestors, ending with {@link #ANY}.
   *
   * @return the lineage, most derived first
   */
  public List<ErrorKind> lineage() {
    List<ErrorKind> result = new ArrayList<>();
    for (ErrorKind kind = this; kind != null; kind = kind.parent) {
      result.add(kind);
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Checks whether this kind equals or descends from the given kind.
   *
   * @param other
   *            the candidate ancestor
   * @return true if {@code other} is in this kind's lineage
   */
  public boolean isA(ErrorKind other) {
    for (ErrorKind kind = this; kind != null; kind = kind.parent) {
      if (kind == other) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "ErrorKind(" + name + ")";
  }
}
