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

package dev.tether.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JsonUtils provides JSON serialization and deserialization utilities for
 * Tether. Dates are written as ISO-8601 strings.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.registerModule(new JavaTimeModule());
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws TetherException
   *             if serialization fails
   */
  public static String toJson(Object value) throws TetherException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new TetherException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Pretty prints a JSON object.
   *
   * @param value
   *            the object to print
   * @return the pretty-printed JSON string
   * @throws TetherException
   *             if serialization fails
   */
  public static String toPrettyJson(Object value) throws TetherException {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new TetherException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws TetherException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws TetherException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new TetherException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to the specified type.
   *
   * @param json
   *            the JSON string
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the parsed object
   * @throws TetherException
   *             if parsing fails
   */
  public static <T> T fromJson(String json, Class<T> clazz) throws TetherException {
    try {
      return objectMapper.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new TetherException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }
}
