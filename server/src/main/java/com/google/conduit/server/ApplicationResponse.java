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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.conduit.server.content.OutgoingContent;

/**
 * ApplicationResponse is the response side of a call. It owns the send
 * pipeline run by every {@code respond}, merged from the application's send
 * pipeline when the call is created, so interceptors added to it only affect
 * this call.
 */
public class ApplicationResponse {

  private final ApplicationSendPipeline pipeline = new ApplicationSendPipeline();
  private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
  private final AtomicBoolean committed = new AtomicBoolean();
  private volatile HttpStatusCode status;
  private volatile OutgoingContent content;

  public ApplicationResponse(ApplicationSendPipeline applicationSendPipeline) {
    pipeline.merge(applicationSendPipeline);
  }

  public ApplicationSendPipeline getPipeline() {
    return pipeline;
  }

  /**
   * Returns the status set so far.
   *
   * @return the status, or null if none was set
   */
  public HttpStatusCode getStatus() {
    return status;
  }

  public void status(HttpStatusCode status) {
    this.status = status;
  }

  public synchronized void header(String name, String value) {
    headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
  }

  public synchronized Map<String, List<String>> getHeaders() {
    Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
    }
    return Collections.unmodifiableMap(copy);
  }

  public boolean isCommitted() {
    return committed.get();
  }

  /**
   * Returns the committed content.
   *
   * @return the content, or null if nothing was committed yet
   */
  public OutgoingContent getContent() {
    return content;
  }

  /**
   * Marks the response as sent with the given content. The content status, if
   * any, wins over the status set on the response; 200 is used when neither
   * is set.
   *
   * @param content
   *            the final content
   * @throws ResponseAlreadySentException
   *             if the response was already committed
   */
  public void commit(OutgoingContent content) {
    if (!committed.compareAndSet(false, true)) {
      throw new ResponseAlreadySentException();
    }
    if (content.getStatus() != null) {
      status = content.getStatus();
    } else if (status == null) {
      status = HttpStatusCode.OK;
    }
    this.content = content;
  }
}
