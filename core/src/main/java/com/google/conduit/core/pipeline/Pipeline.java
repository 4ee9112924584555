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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pipeline is an ordered list of {@link PipelinePhase phases}, each holding an
 * ordered list of {@link PipelineInterceptor interceptors}. Running the
 * pipeline flattens it into one chain (the interceptors of the first phase,
 * then those of the second, and so on) and drives that chain through a fresh
 * {@link PipelineContext}.
 *
 * <p>
 * Phases and interceptors are meant to be registered while the application is
 * being set up. Mutations are synchronized and every run works on an
 * immutable snapshot of the chain, so registering an interceptor never
 * changes a run that is already in progress.
 *
 * @param <TSubject>
 *            the subject type
 * @param <TContext>
 *            the call context type
 */
public class Pipeline<TSubject, TContext> {

  private static final Logger logger = LoggerFactory.getLogger(Pipeline.class);

  private final List<PhaseContent<TSubject, TContext>> phases = new ArrayList<>();
  private volatile List<PipelineInterceptor<TSubject, TContext>> chain;

  /**
   * Creates a pipeline with the given phases, in order.
   *
   * @param phases
   *            the initial phases
   */
  public Pipeline(PipelinePhase... phases) {
    for (PipelinePhase phase : phases) {
      addPhase(phase);
    }
  }

  /**
   * Returns the phases in pipeline order.
   *
   * @return an unmodifiable snapshot of the phases
   */
  public synchronized List<PipelinePhase> getItems() {
    List<PipelinePhase> result = new ArrayList<>(phases.size());
    for (PhaseContent<TSubject, TContext> content : phases) {
      result.add(content.phase);
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns the position of the phase.
   *
   * @param phase
   *            the phase
   * @return the index of the phase, or -1 if it is not part of this pipeline
   */
  public synchronized int indexOf(PipelinePhase phase) {
    for (int i = 0; i < phases.size(); i++) {
      if (phases.get(i).phase == phase) {
        return i;
      }
    }
    return -1;
  }

  public boolean contains(PipelinePhase phase) {
    return indexOf(phase) >= 0;
  }

  public synchronized boolean isEmpty() {
    return getInterceptorCount() == 0;
  }

  /**
   * Returns the number of interceptors over all phases.
   *
   * @return the interceptor count
   */
  public synchronized int getInterceptorCount() {
    int count = 0;
    for (PhaseContent<TSubject, TContext> content : phases) {
      count += content.interceptors.size();
    }
    return count;
  }

  /**
   * Returns the interceptors registered for the phase.
   *
   * @param phase
   *            the phase
   * @return an unmodifiable snapshot, in registration order
   * @throws PhaseNotFoundException
   *             if the phase is not part of this pipeline
   */
  public synchronized List<PipelineInterceptor<TSubject, TContext>> interceptorsForPhase(PipelinePhase phase) {
    return Collections.unmodifiableList(new ArrayList<>(contentOf(phase).interceptors));
  }

  /**
   * Appends a phase. Adding a phase that is already present does nothing.
   *
   * @param phase
   *            the phase to add
   */
  public synchronized void addPhase(PipelinePhase phase) {
    Objects.requireNonNull(phase, "phase");
    if (indexOf(phase) >= 0) {
      return;
    }
    phases.add(new PhaseContent<>(phase));
    invalidate();
  }

  /**
   * Inserts a phase immediately before the reference phase. A phase that is
   * already present is moved, together with its interceptors.
   *
   * @param reference
   *            the phase to insert before
   * @param phase
   *            the phase to insert
   * @throws PhaseNotFoundException
   *             if the reference phase is not part of this pipeline
   */
  public synchronized void insertPhaseBefore(PipelinePhase reference, PipelinePhase phase) {
    insertRelative(reference, phase, 0);
  }

  /**
   * Inserts a phase immediately after the reference phase. A phase that is
   * already present is moved, together with its interceptors.
   *
   * @param reference
   *            the phase to insert after
   * @param phase
   *            the phase to insert
   * @throws PhaseNotFoundException
   *             if the reference phase is not part of this pipeline
   */
  public synchronized void insertPhaseAfter(PipelinePhase reference, PipelinePhase phase) {
    insertRelative(reference, phase, 1);
  }

  private void insertRelative(PipelinePhase reference, PipelinePhase phase, int offset) {
    Objects.requireNonNull(phase, "phase");
    if (reference == phase) {
      throw new IllegalArgumentException("Cannot insert " + phase + " relative to itself");
    }
    if (indexOf(reference) < 0) {
      throw new PhaseNotFoundException(reference);
    }
    PhaseContent<TSubject, TContext> content;
    int existing = indexOf(phase);
    if (existing >= 0) {
      content = phases.remove(existing);
    } else {
      content = new PhaseContent<>(phase);
    }
    phases.add(indexOf(reference) + offset, content);
    invalidate();
  }

  /**
   * Registers an interceptor for the phase. Interceptors of one phase run in
   * registration order.
   *
   * @param phase
   *            the phase
   * @param interceptor
   *            the interceptor
   * @throws PhaseNotFoundException
   *             if the phase is not part of this pipeline
   */
  public synchronized void intercept(PipelinePhase phase, PipelineInterceptor<TSubject, TContext> interceptor) {
    Objects.requireNonNull(interceptor, "interceptor");
    contentOf(phase).interceptors.add(interceptor);
    invalidate();
    afterIntercepted();
  }

  /**
   * Called after an interceptor has been registered. Subclasses may override to
   * react to new registrations.
   */
  protected void afterIntercepted() {
  }

  /**
   * Merges the phases and interceptors of another pipeline into this one.
   *
   * <p>
   * Every phase of {@code from} that is missing here is inserted right after
   * the closest preceding phase of {@code from} that is present here (or
   * before the closest following one, or at the end), which keeps the relative
   * order of {@code from}. Interceptor lists are unioned by identity, so
   * merging the same pipeline again changes nothing.
   *
   * @param from
   *            the pipeline to merge
   */
  public void merge(Pipeline<TSubject, TContext> from) {
    if (from == this) {
      return;
    }
    List<PhaseContent<TSubject, TContext>> source = from.snapshotContents();
    synchronized (this) {
      for (int i = 0; i < source.size(); i++) {
        PipelinePhase phase = source.get(i).phase;
        if (indexOf(phase) < 0) {
          insertAnchored(source, i);
        }
        List<PipelineInterceptor<TSubject, TContext>> target = contentOf(phase).interceptors;
        List<PipelineInterceptor<TSubject, TContext>> unmatched = new ArrayList<>(target);
        for (PipelineInterceptor<TSubject, TContext> interceptor : source.get(i).interceptors) {
          if (!removeByIdentity(unmatched, interceptor)) {
            target.add(interceptor);
          }
        }
      }
      invalidate();
    }
    logger.debug("Merged {} phases into pipeline, now {}", source.size(), phases.size());
  }

  private void insertAnchored(List<PhaseContent<TSubject, TContext>> source, int position) {
    PipelinePhase phase = source.get(position).phase;
    for (int i = position - 1; i >= 0; i--) {
      int anchor = indexOf(source.get(i).phase);
      if (anchor >= 0) {
        phases.add(anchor + 1, new PhaseContent<>(phase));
        return;
      }
    }
    for (int i = position + 1; i < source.size(); i++) {
      int anchor = indexOf(source.get(i).phase);
      if (anchor >= 0) {
        phases.add(anchor, new PhaseContent<>(phase));
        return;
      }
    }
    phases.add(new PhaseContent<>(phase));
  }

  private static <T> boolean removeByIdentity(List<T> list, T item) {
    for (int i = 0; i < list.size(); i++) {
      if (list.get(i) == item) {
        list.remove(i);
        return true;
      }
    }
    return false;
  }

  private synchronized List<PhaseContent<TSubject, TContext>> snapshotContents() {
    List<PhaseContent<TSubject, TContext>> copy = new ArrayList<>(phases.size());
    for (PhaseContent<TSubject, TContext> content : phases) {
      copy.add(content.copy());
    }
    return copy;
  }

  /**
   * Creates the execution context for one run without starting it.
   *
   * @param context
   *            the call context
   * @param subject
   *            the initial subject
   * @return a context ready to {@link PipelineContext#execute() execute}
   */
  public PipelineContext<TSubject, TContext> createContext(TContext context, TSubject subject) {
    return new PipelineContext<>(chain(), context, subject);
  }

  /**
   * Runs the pipeline on the calling thread.
   *
   * @param context
   *            the call context
   * @param subject
   *            the initial subject
   * @return the subject after the last interceptor that ran
   * @throws Exception
   *             any exception that no interceptor recovered from
   */
  public TSubject execute(TContext context, TSubject subject) throws Exception {
    return createContext(context, subject).execute();
  }

  /**
   * Runs the pipeline on the given executor.
   *
   * @param context
   *            the call context
   * @param subject
   *            the initial subject
   * @param executor
   *            the executor running the chain
   * @return a handle to the run
   */
  public PipelineExecution<TSubject, TContext> executeAsync(TContext context, TSubject subject, Executor executor) {
    return PipelineExecution.start(createContext(context, subject), executor);
  }

  private List<PipelineInterceptor<TSubject, TContext>> chain() {
    List<PipelineInterceptor<TSubject, TContext>> current = chain;
    if (current != null) {
      return current;
    }
    synchronized (this) {
      if (chain == null) {
        List<PipelineInterceptor<TSubject, TContext>> flattened = new ArrayList<>();
        for (PhaseContent<TSubject, TContext> content : phases) {
          flattened.addAll(content.interceptors);
        }
        chain = Collections.unmodifiableList(flattened);
      }
      return chain;
    }
  }

  private PhaseContent<TSubject, TContext> contentOf(PipelinePhase phase) {
    for (PhaseContent<TSubject, TContext> content : phases) {
      if (content.phase == phase) {
        return content;
      }
    }
    throw new PhaseNotFoundException(phase);
  }

  private void invalidate() {
    chain = null;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + getItems();
  }

  private static final class PhaseContent<TSubject, TContext> {
    private final PipelinePhase phase;
    private final List<PipelineInterceptor<TSubject, TContext>> interceptors;

    PhaseContent(PipelinePhase phase) {
      this(phase, new ArrayList<>());
    }

    PhaseContent(PipelinePhase phase, List<PipelineInterceptor<TSubject, TContext>> interceptors) {
      this.phase = phase;
      this.interceptors = interceptors;
    }

    PhaseContent<TSubject, TContext> copy() {
      return new PhaseContent<>(phase, new ArrayList<>(interceptors));
    }
  }
}
