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

import java.util.concurrent.CompletionStage;

import com.google.conduit.core.pipeline.PipelineContext;
import com.google.conduit.server.ApplicationCall;

/**
 * Base of the contexts passed to plugin handlers. It exposes the control
 * operations a handler may use without giving it the raw continuation: the
 * plugin API proceeds on the handler's behalf once it returns.
 *
 * @param <TSubject>
 *            the subject type of the underlying pipeline
 */
public abstract class CallHandlingContext<TSubject> {

  private final PipelineContext<TSubject, ApplicationCall> context;
  private TSubject replacement;
  private boolean replaced;

  protected CallHandlingContext(PipelineContext<TSubject, ApplicationCall> context) {
    this.context = context;
  }

  /**
   * Stops the pipeline after this handler. No later handler of the same run is
   * invoked.
   */
  public void finish() {
    context.finish();
  }

  public boolean isFinished() {
    return context.isFinished();
  }

  /**
   * Waits for asynchronous work. The wait is aborted when the call is
   * cancelled.
   *
   * @param stage
   *            the work
   * @param <R>
   *            the result type
   * @return the result
   * @throws Exception
   *             the failure of the work, or a cancellation
   */
  public <R> R await(CompletionStage<R> stage) throws Exception {
    return context.await(stage);
  }

  protected TSubject getSubject() {
    return context.getSubject();
  }

  protected void replaceSubject(TSubject subject) {
    this.replacement = subject;
    this.replaced = true;
  }

  void proceedIfNeeded() throws Exception {
    if (context.isFinished()) {
      return;
    }
    if (replaced) {
      context.proceedWith(replacement);
    } else {
      context.proceed();
    }
  }
}
