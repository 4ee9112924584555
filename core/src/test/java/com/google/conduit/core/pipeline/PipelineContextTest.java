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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for running the interceptor chain.
 */
class PipelineContextTest {

  private final List<PipelinePhase> phases = new ArrayList<>();
  private Pipeline<String, List<String>> pipeline;
  private List<String> log;

  @BeforeEach
  void setUp() {
    for (int i = 1; i <= 5; i++) {
      phases.add(new PipelinePhase("P" + i));
    }
    pipeline = new Pipeline<>(phases.toArray(new PipelinePhase[0]));
    log = new ArrayList<>();
  }

  private PipelineInterceptor<String, List<String>> recording(String name) {
    return (context, subject) -> {
      context.getContext().add(name);
      context.proceed();
    };
  }

  @Test
  void testEveryInterceptorRunsOnceInPhaseOrder() throws Exception {
    pipeline.intercept(phases.get(2), recording("p3-a"));
    pipeline.intercept(phases.get(0), recording("p1-a"));
    pipeline.intercept(phases.get(2), recording("p3-b"));
    pipeline.intercept(phases.get(1), recording("p2-a"));
    pipeline.intercept(phases.get(0), recording("p1-b"));

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");
    assertEquals(ExecutionState.NOT_STARTED, context.getState());

    String result = context.execute();

    assertEquals("subject", result);
    assertEquals(List.of("p1-a", "p1-b", "p2-a", "p3-a", "p3-b"), log);
    assertEquals(ExecutionState.FINISHED, context.getState());
  }

  @Test
  void testEmptyPipelineReturnsSubject() throws Exception {
    assertEquals("subject", pipeline.execute(log, "subject"));
  }

  @Test
  void testInterceptorThatDoesNotProceedStopsTheChain() throws Exception {
    pipeline.intercept(phases.get(0), recording("first"));
    pipeline.intercept(phases.get(1), (context, subject) -> context.getContext().add("responder"));
    pipeline.intercept(phases.get(2), recording("never"));
    pipeline.intercept(phases.get(4), recording("never-either"));

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");
    context.execute();

    assertEquals(List.of("first", "responder"), log);
    assertEquals(ExecutionState.FINISHED, context.getState());
  }

  @Test
  void testSecondProceedAfterStopDoesNotResumeTheChain() throws Exception {
    pipeline.intercept(phases.get(0), (context, subject) -> {
      context.proceed();
      context.proceed();
    });
    pipeline.intercept(phases.get(1), (context, subject) -> context.getContext().add("responder"));
    pipeline.intercept(phases.get(2), recording("never"));

    pipeline.execute(log, "subject");

    assertEquals(List.of("responder"), log);
  }

  @Test
  void testFinishSkipsLaterPhases() throws Exception {
    pipeline.intercept(phases.get(0), recording("p1"));
    pipeline.intercept(phases.get(1), (context, subject) -> {
      context.getContext().add("p2");
      context.finish();
      context.proceed();
    });
    pipeline.intercept(phases.get(1), recording("p2-later"));
    for (int i = 2; i < 5; i++) {
      pipeline.intercept(phases.get(i), recording("p" + (i + 1)));
    }

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");
    context.execute();

    assertEquals(List.of("p1", "p2"), log);
    assertTrue(context.isFinished());
    assertEquals(ExecutionState.FINISHED, context.getState());
  }

  @Test
  void testOuterInterceptorResumesAfterFinish() throws Exception {
    pipeline.intercept(phases.get(0), (context, subject) -> {
      context.getContext().add("before");
      context.proceed();
      context.getContext().add("after");
    });
    pipeline.intercept(phases.get(1), (context, subject) -> context.finish());
    pipeline.intercept(phases.get(2), recording("never"));

    pipeline.execute(log, "subject");

    assertEquals(List.of("before", "after"), log);
  }

  @Test
  void testProceedWithReplacesSubjectDownstream() throws Exception {
    AtomicReference<String> seenByLast = new AtomicReference<>();
    AtomicReference<String> seenByFirstAfterProceed = new AtomicReference<>();
    pipeline.intercept(phases.get(0), (context, subject) -> {
      seenByFirstAfterProceed.set(context.proceed());
    });
    pipeline.intercept(phases.get(1), (context, subject) -> context.proceedWith(subject.toUpperCase()));
    pipeline.intercept(phases.get(3), (context, subject) -> {
      seenByLast.set(subject);
      context.proceedWith(subject + "!");
    });

    String result = pipeline.execute(log, "hello");

    assertEquals("HELLO", seenByLast.get());
    assertEquals("HELLO!", seenByFirstAfterProceed.get());
    assertEquals("HELLO!", result);
  }

  @Test
  void testExceptionIsVisibleToEarlierInterceptorsOnly() throws Exception {
    AtomicReference<Exception> caughtByEarlier = new AtomicReference<>();
    pipeline.intercept(phases.get(0), (context, subject) -> {
      try {
        context.proceed();
      } catch (IllegalStateException e) {
        caughtByEarlier.set(e);
      }
    });
    pipeline.intercept(phases.get(1), (context, subject) -> {
      throw new IllegalStateException("boom");
    });
    pipeline.intercept(phases.get(2), recording("later"));

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");
    context.execute();

    assertNotNull(caughtByEarlier.get());
    assertEquals("boom", caughtByEarlier.get().getMessage());
    assertTrue(log.isEmpty());
    assertEquals(ExecutionState.FINISHED, context.getState());
  }

  @Test
  void testUncaughtExceptionFailsTheRun() {
    pipeline.intercept(phases.get(0), recording("first"));
    pipeline.intercept(phases.get(3), (context, subject) -> {
      throw new java.io.IOException("disk");
    });

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");

    java.io.IOException exception = assertThrows(java.io.IOException.class, context::execute);
    assertEquals("disk", exception.getMessage());
    assertEquals(ExecutionState.FAILED, context.getState());
  }

  @Test
  void testTerminatedContextCannotBeResumed() throws Exception {
    AtomicReference<PipelineContext<String, List<String>>> leaked = new AtomicReference<>();
    pipeline.intercept(phases.get(0), (context, subject) -> leaked.set(context));

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");
    context.execute();

    assertThrows(IllegalStateException.class, () -> leaked.get().proceed());
    assertThrows(IllegalStateException.class, () -> leaked.get().finish());
    assertThrows(IllegalStateException.class, context::execute);
    assertFalse(context.cancel());
  }

  @Test
  void testNestedRunKeepsParentPosition() throws Exception {
    PipelinePhase inner = new PipelinePhase("Inner");
    Pipeline<String, List<String>> nested = new Pipeline<>(inner);
    nested.intercept(inner, (context, subject) -> {
      context.getContext().add("nested:" + subject);
      context.finish();
    });

    pipeline.intercept(phases.get(0), (context, subject) -> {
      context.getContext().add("outer-1");
      nested.execute(context.getContext(), "x");
      context.proceed();
    });
    pipeline.intercept(phases.get(1), recording("outer-2"));

    pipeline.execute(log, "subject");

    assertEquals(List.of("outer-1", "nested:x", "outer-2"), log);
  }

  @Test
  void testCancelInsideRunUnwindsLikeAnException() {
    List<String> cleanup = new ArrayList<>();
    pipeline.intercept(phases.get(0), (context, subject) -> {
      try {
        context.proceed();
      } finally {
        cleanup.add("released");
      }
    });
    pipeline.intercept(phases.get(1), (context, subject) -> {
      context.cancel();
      context.proceed();
    });
    pipeline.intercept(phases.get(2), recording("never"));

    PipelineContext<String, List<String>> context = pipeline.createContext(log, "subject");

    assertThrows(PipelineCancelledException.class, context::execute);
    assertEquals(List.of("released"), cleanup);
    assertTrue(log.isEmpty());
    assertTrue(context.isCancelled());
    assertEquals(ExecutionState.FAILED, context.getState());
  }
}
