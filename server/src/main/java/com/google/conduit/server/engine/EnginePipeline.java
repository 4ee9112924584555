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

package com.google.conduit.server.engine;

import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.conduit.core.pipeline.Pipeline;
import com.google.conduit.core.pipeline.PipelinePhase;
import com.google.conduit.server.ApplicationCall;
import com.google.conduit.server.ApplicationReceivePipeline;
import com.google.conduit.server.ApplicationRequest;
import com.google.conduit.server.ApplicationSendPipeline;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.HttpStatusCodeContent;

/**
 * EnginePipeline is the outermost pipeline of an engine. Its {@link #CALL}
 * phase runs the application and turns errors nothing else handled into a
 * 500 response.
 */
public class EnginePipeline extends Pipeline<ApplicationRequest, ApplicationCall> {

  private static final Logger logger = LoggerFactory.getLogger(EnginePipeline.class);

  /** Engine-level work before the application runs. */
  public static final PipelinePhase BEFORE = new PipelinePhase("before");

  /** Runs the application. */
  public static final PipelinePhase CALL = new PipelinePhase("call");

  private final ApplicationReceivePipeline receivePipeline = new ApplicationReceivePipeline();
  private final ApplicationSendPipeline sendPipeline = new ApplicationSendPipeline();

  public EnginePipeline() {
    super(BEFORE, CALL);
  }

  /**
   * Creates an engine pipeline that runs the call's application in
   * {@link #CALL}.
   *
   * @return the pipeline
   */
  public static EnginePipeline defaultEnginePipeline() {
    EnginePipeline pipeline = new EnginePipeline();
    pipeline.intercept(CALL, (context, request) -> {
      ApplicationCall call = context.getContext();
      try {
        call.getApplication().execute(call, request);
      } catch (CancellationException e) {
        throw e;
      } catch (Exception e) {
        if (context.isCancelled()) {
          throw e;
        }
        handleFailure(call, e);
      }
      context.proceed();
    });
    return pipeline;
  }

  private static void handleFailure(ApplicationCall call, Exception error) throws Exception {
    logger.error("Unhandled: {}", call.getRequest(), error);
    if (call.getResponse().isCommitted()) {
      return;
    }
    try {
      call.respond(new HttpStatusCodeContent(HttpStatusCode.INTERNAL_SERVER_ERROR));
    } catch (Exception e) {
      error.addSuppressed(e);
      throw error;
    }
  }

  /**
   * Returns the receive pipeline merged into the application at startup.
   *
   * @return the receive pipeline
   */
  public ApplicationReceivePipeline getReceivePipeline() {
    return receivePipeline;
  }

  /**
   * Returns the send pipeline merged into the application at startup.
   *
   * @return the send pipeline
   */
  public ApplicationSendPipeline getSendPipeline() {
    return sendPipeline;
  }
}
