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
 * PipelineInterceptor is a handler bound to a phase of a {@link Pipeline}.
 *
 * <p>
 * An interceptor advances the chain by calling
 * {@link PipelineContext#proceed()} (or
 * {@link PipelineContext#proceedWith(Object)}). Returning without proceeding
 * stops the chain; code after the {@code proceed()} call runs once every
 * downstream interceptor has returned.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * pipeline.intercept(phase, (context, subject) -> {
 * 	logger.info("Before: {}", subject);
 * 	context.proceed();
 * 	logger.info("After: {}", context.getSubject());
 * });
 * }
 * </pre>
 *
 * @param <TSubject>
 *            the subject type
 * @param <TContext>
 *            the call context type
 */
@FunctionalInterface
public interface PipelineInterceptor<TSubject, TContext> {

  /**
   * Handles the subject.
   *
   * @param context
   *            the execution context of the current run
   * @param subject
   *            the current subject
   * @throws Exception
   *             if handling fails; the exception propagates to the
   *             interceptors that proceeded to this one
   */
  void intercept(PipelineContext<TSubject, TContext> context, TSubject subject) throws Exception;
}
