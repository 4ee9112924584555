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

import java.util.Objects;

/**
 * PipelinePhase is a named slot in a {@link Pipeline}. Phases compare by
 * identity: two phases with the same name are different phases.
 */
public final class PipelinePhase {

  private final String name;

  /**
   * Creates a new phase.
   *
   * @param name
   *            the human-readable phase name
   */
  public PipelinePhase(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  /**
   * Returns the phase name.
   *
   * @return the name
   */
  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return "Phase('" + name + "')";
  }
}
