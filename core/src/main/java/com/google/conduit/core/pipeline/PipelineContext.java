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

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PipelineContext is the execution state of a single pipeline run: the
 * flattened interceptor chain, the position in it, the current subject and the
 * call context. A context is created per run and must not be shared between
 * runs; nested runs get contexts of their own.
 *
 * <p>
 * The chain is cooperative. Each interceptor advances it with
 * {@link #proceed()}; once an interceptor returns without proceeding, fails,
 * or calls {@link #finish()}, no further interceptor of this run is invoked.
 *
 * <p>
 * A run executed from inside an interceptor of another run on the same thread
 * is nested in it: cancelling the outer run cancels the nested one too.
 *
 * @param <TSubject>
 *            the subject type
 * @param <TContext>
 *            the call context type
 */
public final class PipelineContext<TSubject, TContext> {

  private static final Logger logger = LoggerFactory.getLogger(PipelineContext.class);

  private static final ThreadLocal<PipelineContext<?, ?>> CURRENT = new ThreadLocal<>();

  private final Object lock = new Object();
  private final List<PipelineInterceptor<TSubject, TContext>> interceptors;
  private final TContext context;
  private TSubject subject;
  private int index;
  private boolean stopped;
  private volatile ExecutionState state = ExecutionState.NOT_STARTED;
  private volatile boolean cancelled;
  private volatile Thread runner;
  private volatile PipelineContext<?, ?> parent;

  PipelineContext(List<PipelineInterceptor<TSubject, TContext>> interceptors, TContext context, TSubject subject) {
    this.interceptors = interceptors;
    this.context = context;
    this.subject = subject;
  }

  /**
   * Runs the chain on the calling thread.
   *
   * @return the subject after the last interceptor that ran
   * @throws Exception
   *             the first exception no interceptor recovered from, or a
   *             {@link PipelineCancelledException} if the run was cancelled
   */
  public TSubject execute() throws Exception {
    synchronized (lock) {
      if (state != ExecutionState.NOT_STARTED) {
        throw new IllegalStateException("Pipeline run already " + state);
      }
      runner = Thread.currentThread();
      parent = CURRENT.get();
      state = ExecutionState.RUNNING;
    }
    CURRENT.set(this);
    try {
      proceed();
      state = ExecutionState.FINISHED;
      return subject;
    } catch (Exception e) {
      state = ExecutionState.FAILED;
      if (isCancelled() && !(e instanceof PipelineCancelledException)) {
        throw new PipelineCancelledException("Pipeline run was cancelled", e);
      }
      throw e;
    } catch (Error e) {
      state = ExecutionState.FAILED;
      throw e;
    } finally {
      if (parent != null) {
        CURRENT.set(parent);
      } else {
        CURRENT.remove();
      }
      synchronized (lock) {
        runner = null;
        if (cancelled) {
          // Drop the interrupt delivered by cancel() so it does not leak into the next task.
          Thread.interrupted();
        }
      }
    }
  }

  /**
   * Invokes the next interceptor with the current subject.
   *
   * @return the subject once the downstream chain has returned
   * @throws Exception
   *             whatever a downstream interceptor throws
   */
  public TSubject proceed() throws Exception {
    checkRunning();
    if (stopped || index >= interceptors.size()) {
      return subject;
    }
    int position = index++;
    try {
      interceptors.get(position).intercept(this, subject);
    } catch (Exception | Error e) {
      stopped = true;
      throw e;
    }
    if (index == position + 1) {
      // The interceptor returned without proceeding.
      stopped = true;
    }
    return subject;
  }

  /**
   * Replaces the subject for the rest of the chain and proceeds.
   *
   * @param subject
   *            the new subject
   * @return the subject once the downstream chain has returned
   * @throws Exception
   *             whatever a downstream interceptor throws
   */
  public TSubject proceedWith(TSubject subject) throws Exception {
    checkRunning();
    this.subject = subject;
    return proceed();
  }

  /**
   * Stops the run: no interceptor that has not started yet will be invoked,
   * in any phase. Interceptors already on the stack still resume after their
   * {@code proceed()} call.
   */
  public void finish() {
    checkRunning();
    stopped = true;
  }

  /**
   * Waits for asynchronous work without giving up the position in the chain.
   * The wait ends early with a {@link PipelineCancelledException} when the run
   * is cancelled.
   *
   * @param stage
   *            the work to wait for
   * @param <R>
   *            the result type
   * @return the result of the work
   * @throws Exception
   *             the failure of the work, or a cancellation
   */
  public <R> R await(CompletionStage<R> stage) throws Exception {
    checkRunning();
    CompletableFuture<R> future = stage.toCompletableFuture();
    try {
      return future.get();
    } catch (InterruptedException e) {
      if (isCancelled()) {
        future.cancel(true);
        throw new PipelineCancelledException("Pipeline run was cancelled while waiting", e);
      }
      Thread.currentThread().interrupt();
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }

  /**
   * Cancels the run. A blocked interceptor is interrupted; the next
   * {@link #proceed()} fails with a {@link PipelineCancelledException}.
   *
   * @return false if the run had already terminated
   */
  public boolean cancel() {
    synchronized (lock) {
      if (state.isTerminal()) {
        return false;
      }
      cancelled = true;
      Thread thread = runner;
      if (thread != null && thread != Thread.currentThread()) {
        thread.interrupt();
      }
    }
    logger.debug("Pipeline run cancelled at position {} of {}", index, interceptors.size());
    return true;
  }

  private void checkRunning() {
    if (isCancelled()) {
      throw new PipelineCancelledException("Pipeline run was cancelled");
    }
    if (state != ExecutionState.RUNNING) {
      throw new IllegalStateException("Pipeline run is " + state);
    }
  }

  public TContext getContext() {
    return context;
  }

  public TSubject getSubject() {
    return subject;
  }

  public ExecutionState getState() {
    return state;
  }

  /**
   * Returns true once no further interceptor of this run will be invoked.
   *
   * @return true if the chain has been stopped or finished
   */
  public boolean isFinished() {
    return stopped || state.isTerminal();
  }

  /**
   * Returns true if this run, or a run it is nested in, has been cancelled.
   *
   * @return true once cancelled
   */
  public boolean isCancelled() {
    if (cancelled) {
      return true;
    }
    PipelineContext<?, ?> outer = parent;
    return outer != null && outer.isCancelled();
  }
}
