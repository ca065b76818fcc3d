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

package dev.tether.core.tracing;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import dev.tether.core.JsonUtils;

/**
 * Unit tests for Span.
 */
class SpanTest {

  @Test
  void testDefaults() {
    Span span = Span.builder().runId("run-1").build();

    assertEquals(16, span.getSpanId().length());
    assertTrue(span.getSpanId().matches("[0-9a-f]{16}"));
    assertNull(span.getParentSpanId());
    assertEquals(Span.DEFAULT_TYPE, span.getSpanType());
    assertEquals(SpanStatus.OK, span.getStatus());
    assertNotNull(span.getTimestamp());
    assertTrue(span.getMetadata().isEmpty());
    assertFalse(span.isClosed());
  }

  @Test
  void testGeneratedIdsAreUnique() {
    assertNotEquals(Span.generateId(), Span.generateId());
  }

  @Test
  void testPreviewTruncation() {
    StringBuilder longText = new StringBuilder();
    for (int i = 0; i < 10_000; i++) {
      longText.append('x');
    }

    Span span = Span.builder().inputPreview(longText.toString()).build();
    span.setOutputPreview(longText.toString());

    assertEquals(203, span.getInputPreview().length());
    assertTrue(span.getInputPreview().endsWith("..."));
    assertEquals(203, span.getOutputPreview().length());
  }

  @Test
  void testShortPreviewUnchanged() {
    String exact = "y".repeat(Span.MAX_PREVIEW_LENGTH);

    assertEquals(exact, Span.truncatePreview(exact));
    assertEquals("hello", Span.truncatePreview("hello"));
    assertNull(Span.truncatePreview(null));
  }

  @Test
  void testInFlightSpanIsClosedOnce() {
    Span span = Span.builder().status(null).model("gpt-4o").build();
    assertNull(span.getStatus());

    span.setCostUsd(0.01);
    span.setDurationMs(42.0);
    span.putMetadata("attempt", 1);
    span.close(SpanStatus.ERROR);

    assertTrue(span.isClosed());
    assertEquals(SpanStatus.ERROR, span.getStatus());
    assertEquals(42.0, span.getDurationMs());
    assertThrows(IllegalStateException.class, () -> span.setCostUsd(0.02));
    assertThrows(IllegalStateException.class, () -> span.putMetadata("attempt", 2));
    assertThrows(IllegalStateException.class, () -> span.close(SpanStatus.OK));
    assertEquals(0.01, span.getCostUsd());
  }

  @Test
  void testJsonShape() {
    Span span = Span.builder()
        .spanId("abcdef0123456789")
        .parentSpanId("0000000000000001")
        .runId("run-1")
        .timestamp(Instant.parse("2025-01-02T03:04:05Z"))
        .spanType("llm_call")
        .model("gpt-4o")
        .inputTokens(10)
        .outputTokens(20)
        .costUsd(0.000225)
        .durationMs(12.5)
        .metadata("estimated_input_tokens", 9)
        .inputPreview("hi")
        .build();

    JsonNode node = JsonUtils.parseJson(JsonUtils.toJson(span));

    assertEquals("abcdef0123456789", node.get("span_id").asText());
    assertEquals("0000000000000001", node.get("parent_span_id").asText());
    assertEquals("run-1", node.get("run_id").asText());
    assertEquals("2025-01-02T03:04:05Z", node.get("timestamp").asText());
    assertEquals(12.5, node.get("duration_ms").asDouble());
    assertEquals("llm_call", node.get("span_type").asText());
    assertEquals("gpt-4o", node.get("model").asText());
    assertEquals(10, node.get("input_tokens").asInt());
    assertEquals(20, node.get("output_tokens").asInt());
    assertEquals(0.000225, node.get("cost_usd").asDouble());
    assertEquals("ok", node.get("status").asText());
    assertEquals(9, node.get("metadata").get("estimated_input_tokens").asInt());
    assertEquals("hi", node.get("input_preview").asText());
    assertTrue(node.has("output_preview"));
    assertFalse(node.has("closed"));
  }
}
