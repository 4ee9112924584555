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

package com.google.conduit.core.pipeline;

/**
 * Lifecycle of a single pipeline run.
 */
public enum ExecutionState {
  NOT_STARTED,
  RUNNING,
  /** The chain ran out, was stopped by an interceptor, or was finished. */
  FINISHED,
  /** An exception, including a cancellation, escaped the chain. */
  FAILED;

  public boolean isTerminal() {
    return this == FINISHED || this == FAILED;
  }
}
