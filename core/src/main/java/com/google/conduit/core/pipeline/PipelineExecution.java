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

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * PipelineExecution is a handle to a pipeline run started on an
 * {@link Executor}. The run can be observed through {@link #toCompletableFuture()}
 * and cancelled through {@link #cancel()} or by cancelling the future.
 *
 * @param <TSubject>
 *            the subject type
 * @param <TContext>
 *            the call context type
 */
public final class PipelineExecution<TSubject, TContext> {

  private final PipelineContext<TSubject, TContext> context;
  private final CompletableFuture<TSubject> future = new CompletableFuture<>();

  private PipelineExecution(PipelineContext<TSubject, TContext> context) {
    this.context = context;
  }

  static <TSubject, TContext> PipelineExecution<TSubject, TContext> start(PipelineContext<TSubject, TContext> context,
      Executor executor) {
    PipelineExecution<TSubject, TContext> execution = new PipelineExecution<>(context);
    execution.future.whenComplete((result, error) -> {
      if (error instanceof CancellationException) {
        context.cancel();
      }
    });
    try {
      executor.execute(execution::run);
    } catch (RejectedExecutionException e) {
      execution.future.completeExceptionally(e);
    }
    return execution;
  }

  private void run() {
    try {
      future.complete(context.execute());
    } catch (Throwable t) {
      future.completeExceptionally(t);
    }
  }

  /**
   * Cancels the run. The future completes with a
   * {@link PipelineCancelledException} once the chain has unwound; a run that
   * has not started yet never invokes an interceptor.
   *
   * @return false if the run had already terminated
   */
  public boolean cancel() {
    return context.cancel();
  }

  public CompletableFuture<TSubject> toCompletableFuture() {
    return future;
  }

  public TContext getContext() {
    return context.getContext();
  }

  public ExecutionState getState() {
    return context.getState();
  }

  public boolean isCancelled() {
    return context.isCancelled();
  }
}
