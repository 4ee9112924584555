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

package com.google.conduit.server.plugins;

import com.google.conduit.core.AttributeKey;
import com.google.conduit.core.ConduitException;
import com.google.conduit.core.ErrorKind;

/**
 * Thrown when a plugin depends on another plugin that is not installed, or
 * whose phases are not part of the pipeline being configured.
 */
public class MissingApplicationPluginException extends ConduitException {

  private final AttributeKey<?> key;

  public MissingApplicationPluginException(AttributeKey<?> key) {
    super("Application plugin " + key.getName() + " is not installed", ErrorKind.PLUGIN);
    this.key = key;
  }

  public AttributeKey<?> getKey() {
    return key;
  }
}
