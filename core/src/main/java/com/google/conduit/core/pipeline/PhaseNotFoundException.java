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

import com.google.conduit.core.ConduitException;
import com.google.conduit.core.ErrorKind;

/**
 * Thrown when a phase operation references a phase that is not part of the
 * pipeline.
 */
public class PhaseNotFoundException extends ConduitException {

  private final PipelinePhase phase;

  public PhaseNotFoundException(PipelinePhase phase) {
    super("Phase " + phase + " was not registered for this pipeline", ErrorKind.PIPELINE);
    this.phase = phase;
  }

  public PipelinePhase getPhase() {
    return phase;
  }
}
