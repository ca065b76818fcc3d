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
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import dev.tether.core.JsonUtils;
import dev.tether.core.budget.BudgetSummary;

/**
 * Unit tests for Trace.
 */
class TraceTest {

  private static BudgetSummary summary(String runId) {
    return new BudgetSummary(runId, 2.0, 0.0, 2.0, 0, Collections.emptyList());
  }

  @Test
  void testEmptyTrace() {
    Trace trace = new Trace("run-1", summary("run-1"));

    assertEquals("run-1", trace.getRunId());
    assertTrue(trace.getSpans().isEmpty());
    assertNull(trace.getEndTime());
    assertEquals(0.0, trace.getTotalCost());
    assertEquals(0, trace.getTotalInputTokens());
    assertEquals(0, trace.getTotalOutputTokens());
  }

  @Test
  void testTotalsSkipMissingValues() {
    Trace trace = new Trace("run-1", summary("run-1"));
    trace.addSpan(Span.builder().costUsd(0.25).inputTokens(100).outputTokens(40).build());
    trace.addSpan(Span.builder().costUsd(0.5).inputTokens(200).build());
    trace.addSpan(Span.builder().status(null).build());

    assertEquals(3, trace.getSpans().size());
    assertEquals(0.75, trace.getTotalCost(), 1e-12);
    assertEquals(300, trace.getTotalInputTokens());
    assertEquals(40, trace.getTotalOutputTokens());
  }

  @Test
  void testSpansKeepInsertionOrderAndAreSnapshots() {
    Trace trace = new Trace("run-1", summary("run-1"));
    Span first = Span.builder().model("a").build();
    Span second = Span.builder().model("b").build();
    trace.addSpan(first);
    trace.addSpan(second);

    assertSame(first, trace.getSpans().get(0));
    assertSame(second, trace.getSpans().get(1));
    assertThrows(UnsupportedOperationException.class, () -> trace.getSpans().clear());
  }

  @Test
  void testEndOnlyOnce() {
    Trace trace = new Trace("run-1", summary("run-1"));
    Instant end = Instant.now();

    trace.end(end);

    assertEquals(end, trace.getEndTime());
    assertThrows(IllegalStateException.class, () -> trace.end(Instant.now()));
  }

  @Test
  void testJsonRoundTripPreservesTotals() {
    Instant start = Instant.parse("2025-01-02T03:04:05Z");
    Trace trace = new Trace("run-1", summary("run-1"), start);
    trace.addSpan(Span.builder().runId("run-1").model("gpt-4o").costUsd(0.0075).inputTokens(1000).outputTokens(500)
        .build());
    trace.addSpan(Span.builder().runId("run-1").model("gpt-4o-mini").costUsd(0.00045).inputTokens(1500)
        .outputTokens(375).build());
    trace.end(start.plusSeconds(3));

    JsonNode node = JsonUtils.parseJson(JsonUtils.toJson(trace));

    assertEquals("run-1", node.get("run_id").asText());
    assertEquals(2, node.get("spans").size());
    assertEquals(2.0, node.get("budget_summary").get("budget_usd").asDouble());
    assertEquals("2025-01-02T03:04:05Z", node.get("start_time").asText());
    assertEquals("2025-01-02T03:04:08Z", node.get("end_time").asText());

    double cost = 0.0;
    long input = 0;
    long output = 0;
    for (JsonNode span : node.get("spans")) {
      cost += span.get("cost_usd").asDouble();
      input += span.get("input_tokens").asLong();
      output += span.get("output_tokens").asLong();
    }
    assertEquals(trace.getTotalCost(), node.get("total_cost").asDouble(), 1e-12);
    assertEquals(trace.getTotalCost(), cost, 1e-12);
    assertEquals(trace.getTotalInputTokens(), node.get("total_input_tokens").asLong());
    assertEquals(trace.getTotalInputTokens(), input);
    assertEquals(trace.getTotalOutputTokens(), node.get("total_output_tokens").asLong());
    assertEquals(trace.getTotalOutputTokens(), output);
  }

  @Test
  void testBudgetSummaryCanBeRefreshed() {
    Trace trace = new Trace("run-1", summary("run-1"));
    BudgetSummary last = new BudgetSummary("run-1", 2.0, 1.5, 0.5, 3, Collections.emptyList());

    trace.setBudgetSummary(last);

    assertSame(last, trace.getBudgetSummary());
  }
}
