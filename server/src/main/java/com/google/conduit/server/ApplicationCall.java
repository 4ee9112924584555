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

package com.google.conduit.server;

import com.google.conduit.core.Attributes;

/**
 * ApplicationCall is a single request/response exchange. It is the call
 * context of the call, receive and send pipelines and carries call-scoped
 * {@link Attributes} that plugins use to talk to each other.
 */
public class ApplicationCall {

  private final Application application;
  private final ApplicationRequest request;
  private final ApplicationResponse response;
  private final Attributes attributes = new Attributes();

  public ApplicationCall(Application application, ApplicationRequest request) {
    this.application = application;
    this.request = request;
    this.response = new ApplicationResponse(application.getSendPipeline());
  }

  public Application getApplication() {
    return application;
  }

  public ApplicationRequest getRequest() {
    return request;
  }

  public ApplicationResponse getResponse() {
    return response;
  }

  public Attributes getAttributes() {
    return attributes;
  }

  /**
   * Returns true once a response has been committed.
   *
   * @return true if the call was responded to
   */
  public boolean isHandled() {
    return response.isCommitted();
  }

  /**
   * Converts the request body to the given type by running the application's
   * receive pipeline.
   *
   * @param type
   *            the requested type
   * @param <T>
   *            the requested type
   * @return the converted body
   * @throws CannotTransformContentToTypeException
   *             if no transformation produced a value of the type
   * @throws Exception
   *             if a receive interceptor fails
   */
  public <T> T receive(Class<T> type) throws Exception {
    ReceiveRequest result = application.getReceivePipeline().execute(this,
        new ReceiveRequest(type, request.getBody()));
    Object value = result.getValue();
    if (!type.isInstance(value)) {
      throw new CannotTransformContentToTypeException(type);
    }
    return type.cast(value);
  }

  /**
   * Responds with the given value by running this call's send pipeline.
   *
   * @param message
   *            the response value: content, a status code, text, bytes, or
   *            anything an installed plugin knows how to convert
   * @throws ResponseAlreadySentException
   *             if the call was already responded to
   * @throws Exception
   *             if a send interceptor fails
   */
  public void respond(Object message) throws Exception {
    response.getPipeline().execute(this, message);
  }

  @Override
  public String toString() {
    return "ApplicationCall(" + request + ")";
  }
}
