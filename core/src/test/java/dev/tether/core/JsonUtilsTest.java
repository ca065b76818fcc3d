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

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Unit tests for JsonUtils.
 */
class JsonUtilsTest {

  @Test
  void testGetObjectMapper() {
    ObjectMapper mapper = JsonUtils.getObjectMapper();
    assertNotNull(mapper);
    assertSame(mapper, JsonUtils.getObjectMapper());
  }

  @Test
  void testToJson() {
    String json = JsonUtils.toJson(new TestObject("test", 42));

    assertTrue(json.contains("\"name\":\"test\""));
    assertTrue(json.contains("\"value\":42"));
  }

  @Test
  void testToJsonWithNull() {
    assertEquals("null", JsonUtils.toJson(null));
  }

  @Test
  void testInstantWrittenAsIsoString() {
    Instant instant = Instant.parse("2025-03-01T12:30:00Z");

    assertEquals("\"2025-03-01T12:30:00Z\"", JsonUtils.toJson(instant));
  }

  @Test
  void testToPrettyJsonIsIndented() {
    String json = JsonUtils.toPrettyJson(new TestObject("test", 1));

    assertTrue(json.contains("\n"));
  }

  @Test
  void testParseJson() {
    JsonNode node = JsonUtils.parseJson("{\"name\":\"test\",\"value\":42}");

    assertEquals("test", node.get("name").asText());
    assertEquals(42, node.get("value").asInt());
  }

  @Test
  void testFromJsonIgnoresUnknownProperties() {
    TestObject obj = JsonUtils.fromJson("{\"name\":\"test\",\"value\":42,\"extra\":true}", TestObject.class);

    assertEquals("test", obj.name);
    assertEquals(42, obj.value);
  }

  @Test
  void testInvalidJsonThrowsTetherException() {
    assertThrows(TetherException.class, () -> JsonUtils.parseJson("{not json"));
    assertThrows(TetherException.class, () -> JsonUtils.fromJson("[1, 2", TestObject.class));
  }

  static class TestObject {
    @JsonProperty("name")
    String name;

    @JsonProperty("value")
    int value;

    TestObject() {
    }

    TestObject(String name, int value) {
      this.name = name;
      this.value = value;
    }
  }
}
