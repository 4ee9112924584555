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

import java.time.Duration;

/**
 * EngineOptions contains configuration options for an application engine.
 * Defaults are read from the environment.
 */
public class EngineOptions {

  private final boolean developmentMode;
  private final Duration callTimeout;
  private final int callThreads;

  private EngineOptions(Builder builder) {
    this.developmentMode = builder.developmentMode;
    this.callTimeout = builder.callTimeout;
    this.callThreads = builder.callThreads;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns whether development mode is enabled.
   *
   * @return true if development mode is enabled
   */
  public boolean isDevelopmentMode() {
    return developmentMode;
  }

  /**
   * Returns the time after which an asynchronous call is cancelled.
   *
   * @return the timeout, {@link Duration#ZERO} for none
   */
  public Duration getCallTimeout() {
    return callTimeout;
  }

  /**
   * Returns the number of threads running asynchronous calls.
   *
   * @return the thread count
   */
  public int getCallThreads() {
    return callThreads;
  }

  /**
   * Builder for EngineOptions.
   */
  public static class Builder {
    private boolean developmentMode = isDevelopmentModeFromEnv();
    private Duration callTimeout = getCallTimeoutFromEnv();
    private int callThreads = getCallThreadsFromEnv();

    private static boolean isDevelopmentModeFromEnv() {
      return "dev".equals(System.getenv("CONDUIT_ENV"));
    }

    private static Duration getCallTimeoutFromEnv() {
      String timeout = System.getenv("CONDUIT_CALL_TIMEOUT_MS");
      if (timeout != null) {
        try {
          return Duration.ofMillis(Long.parseLong(timeout));
        } catch (NumberFormatException e) {
          // fall through to default
        }
      }
      return Duration.ZERO;
    }

    private static int getCallThreadsFromEnv() {
      String threads = System.getenv("CONDUIT_CALL_THREADS");
      if (threads != null) {
        try {
          return Integer.parseInt(threads);
        } catch (NumberFormatException e) {
          // fall through to default
        }
      }
      return Math.max(2, Runtime.getRuntime().availableProcessors());
    }

    public Builder developmentMode(boolean developmentMode) {
      this.developmentMode = developmentMode;
      return this;
    }

    public Builder callTimeout(Duration callTimeout) {
      this.callTimeout = callTimeout;
      return this;
    }

    public Builder callThreads(int callThreads) {
      this.callThreads = callThreads;
      return this;
    }

    public EngineOptions build() {
      if (callThreads < 1) {
        throw new IllegalStateException("callThreads must be positive");
      }
      if (callTimeout == null || callTimeout.isNegative()) {
        throw new IllegalStateException("callTimeout must not be negative");
      }
      return new EngineOptions(this);
    }
  }
}
