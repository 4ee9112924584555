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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.google.conduit.server.ApplicationReceivePipeline;
import com.google.conduit.server.ApplicationSendPipeline;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.ByteArrayContent;
import com.google.conduit.server.content.HttpStatusCodeContent;
import com.google.conduit.server.content.TextContent;

/**
 * Transformations every engine installs: text, bytes and status codes become
 * content on respond, and bodies can be received as text or bytes.
 */
public final class DefaultTransformations {

  public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";

  private DefaultTransformations() {
  }

  public static void installDefaultTransformations(ApplicationSendPipeline pipeline) {
    pipeline.intercept(ApplicationSendPipeline.TRANSFORM, (context, subject) -> {
      if (subject instanceof String) {
        context.proceedWith(new TextContent((String) subject, TextContent.TEXT_PLAIN));
      } else if (subject instanceof byte[]) {
        context.proceedWith(new ByteArrayContent((byte[]) subject, APPLICATION_OCTET_STREAM));
      } else if (subject instanceof HttpStatusCode) {
        context.proceedWith(new HttpStatusCodeContent((HttpStatusCode) subject));
      } else {
        context.proceed();
      }
    });
  }

  public static void installDefaultTransformations(ApplicationReceivePipeline pipeline) {
    pipeline.intercept(ApplicationReceivePipeline.TRANSFORM, (context, subject) -> {
      if (subject.isRaw() && subject.getType() == String.class) {
        Charset charset = charsetOf(context.getContext().getRequest().getContentType());
        context.proceedWith(subject.withValue(new String((byte[]) subject.getValue(), charset)));
      } else {
        context.proceed();
      }
    });
  }

  /**
   * Returns the charset named by a content type.
   *
   * @param contentType
   *            the content type, may be null
   * @return the charset parameter, UTF-8 when absent or unknown
   */
  static Charset charsetOf(String contentType) {
    if (contentType == null) {
      return StandardCharsets.UTF_8;
    }
    for (String parameter : contentType.split(";")) {
      String trimmed = parameter.trim();
      if (trimmed.regionMatches(true, 0, "charset=", 0, 8)) {
        String name = trimmed.substring(8).replace("\"", "");
        try {
          return Charset.forName(name);
        } catch (IllegalArgumentException e) {
          return StandardCharsets.UTF_8;
        }
      }
    }
    return StandardCharsets.UTF_8;
  }
}
