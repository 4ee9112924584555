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

package com.google.conduit.plugins.jackson;

import java.io.IOException;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.conduit.core.ConduitException;
import com.google.conduit.server.BadRequestException;
import com.google.conduit.server.HttpStatusCode;
import com.google.conduit.server.content.OutgoingContent;
import com.google.conduit.server.content.TextContent;
import com.google.conduit.server.plugins.ApplicationPlugin;
import com.google.conduit.server.plugins.api.ApplicationPlugins;
import com.google.conduit.server.plugins.api.PluginInstance;

/**
 * JacksonConverter receives JSON request bodies as typed values and responds
 * with JSON for values that are not content already.
 *
 * <pre>{@code
 * application.install(JacksonConverter.PLUGIN, config -> config.prettyPrint(true));
 * }</pre>
 */
public final class JacksonConverter {

  private static final Logger logger = LoggerFactory.getLogger(JacksonConverter.class);

  public static final String APPLICATION_JSON = "application/json; charset=UTF-8";

  /** The plugin. */
  public static final ApplicationPlugin<Config, PluginInstance> PLUGIN = ApplicationPlugins.create("JacksonConverter",
      Config::new, builder -> {
        ObjectMapper objectMapper = builder.getPluginConfig().objectMapper;
        boolean prettyPrint = builder.getPluginConfig().prettyPrint;
        String contentType = builder.getPluginConfig().contentType;

        builder.onCallReceive((context, call) -> {
          Class<?> type = context.getRequestedType();
          if (!(context.getBody() instanceof byte[]) || type == String.class || type == byte[].class
              || !isJson(call.getRequest().getContentType())) {
            return;
          }
          context.transformBody(read(objectMapper, (byte[]) context.getBody(), type));
        });

        builder.onCallRespond((context, call) -> {
          Object body = context.getBody();
          if (body == null || body instanceof OutgoingContent || body instanceof HttpStatusCode
              || body instanceof String || body instanceof byte[]) {
            return;
          }
          context.transformBody(new TextContent(write(objectMapper, body, prettyPrint), contentType));
        });
      });

  private JacksonConverter() {
  }

  /**
   * Creates an ObjectMapper with the settings the converter uses by default:
   * Java time support, ISO dates, and unknown properties ignored.
   *
   * @return a new ObjectMapper
   */
  public static ObjectMapper defaultObjectMapper() {
    ObjectMapper objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    return objectMapper;
  }

  /**
   * Checks whether a content type denotes JSON.
   *
   * @param contentType
   *            the content type, may be null
   * @return true for {@code application/json} and {@code +json} types
   */
  static boolean isJson(String contentType) {
    if (contentType == null) {
      return false;
    }
    String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
    return mediaType.equals("application/json") || mediaType.endsWith("+json");
  }

  private static Object read(ObjectMapper objectMapper, byte[] body, Class<?> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      logger.debug("Rejecting malformed JSON for {}: {}", type.getName(), e.getMessage());
      throw new BadRequestException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  private static String write(ObjectMapper objectMapper, Object value, boolean prettyPrint) {
    try {
      return prettyPrint
          ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
          : objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new ConduitException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * JacksonConverter configuration.
   */
  public static final class Config {
    private ObjectMapper objectMapper = defaultObjectMapper();
    private boolean prettyPrint;
    private String contentType = APPLICATION_JSON;

    public Config objectMapper(ObjectMapper objectMapper) {
      this.objectMapper = objectMapper;
      return this;
    }

    public Config prettyPrint(boolean prettyPrint) {
      this.prettyPrint = prettyPrint;
      return this;
    }

    public Config contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }
  }
}
