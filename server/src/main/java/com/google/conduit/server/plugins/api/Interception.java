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

package com.google.conduit.server.plugins.api;

import java.util.function.Consumer;

import com.google.conduit.core.pipeline.PhaseNotFoundException;
import com.google.conduit.core.pipeline.Pipeline;
import com.google.conduit.core.pipeline.PipelinePhase;
import com.google.conduit.server.ApplicationCall;

/**
 * A registration recorded by a plugin builder and applied to the target
 * pipeline when the plugin is installed.
 *
 * @param <TSubject>
 *            the subject type of the target pipeline
 */
public final class Interception<TSubject> {

  private final PipelinePhase phase;
  private final Consumer<Pipeline<TSubject, ApplicationCall>> check;
  private final Consumer<Pipeline<TSubject, ApplicationCall>> action;

  private Interception(PipelinePhase phase, Consumer<Pipeline<TSubject, ApplicationCall>> check,
      Consumer<Pipeline<TSubject, ApplicationCall>> action) {
    this.phase = phase;
    this.check = check;
    this.action = action;
  }

  /** A registration into a phase the target pipeline must already have. */
  static <T> Interception<T> existing(PipelinePhase phase, Consumer<Pipeline<T, ApplicationCall>> action) {
    return new Interception<>(phase, pipeline -> {
      if (!pipeline.contains(phase)) {
        throw new PhaseNotFoundException(phase);
      }
    }, action);
  }

  /**
   * A registration whose action adds its phase to the target pipeline first.
   * The check must throw if the action cannot succeed.
   */
  static <T> Interception<T> placing(PipelinePhase phase, Consumer<Pipeline<T, ApplicationCall>> check,
      Consumer<Pipeline<T, ApplicationCall>> action) {
    return new Interception<>(phase, check, action);
  }

  /**
   * Returns the phase the handler is registered in.
   *
   * @return the phase
   */
  public PipelinePhase getPhase() {
    return phase;
  }

  void checkTarget(Pipeline<TSubject, ApplicationCall> pipeline) {
    check.accept(pipeline);
  }

  void apply(Pipeline<TSubject, ApplicationCall> pipeline) {
    action.accept(pipeline);
  }
}
