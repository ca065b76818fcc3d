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

package dev.tether.core.budget;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import dev.tether.core.BudgetExceededException;
import dev.tether.core.JsonUtils;
import dev.tether.core.TurnLimitException;

/**
 * Unit tests for BudgetTracker.
 */
class BudgetTrackerTest {

  @Test
  void testInitialState() {
    BudgetTracker tracker = new BudgetTracker("run-1", 10.0);

    assertEquals("run-1", tracker.getRunId());
    assertEquals(0.0, tracker.getSpentUsd());
    assertEquals(10.0, tracker.getRemainingUsd());
    assertEquals(0, tracker.getTurnCount());
    assertNull(tracker.getMaxTurns());
    assertFalse(tracker.isExceeded());
  }

  @Test
  void testNegativeCeilingRejected() {
    assertThrows(IllegalArgumentException.class, () -> new BudgetTracker("run-1", -1.0));
    assertThrows(IllegalArgumentException.class, () -> new BudgetTracker("run-1", 1.0, -1));
  }

  @Test
  void testCommitsSumUp() {
    BudgetTracker tracker = new BudgetTracker("run-1", 10.0);
    double[] costs = {0.25, 1.5, 0.0, 3.125, 0.5};

    double sum = 0.0;
    for (double cost : costs) {
      tracker.recordCall(100, 50, "gpt-4o", cost, 12.0);
      sum += cost;
    }

    assertEquals(sum, tracker.getSpentUsd(), 1e-9);
    assertEquals(costs.length, tracker.getTurnCount());
    assertEquals(10.0 - sum, tracker.getRemainingUsd(), 1e-9);
  }

  @Test
  void testOvershootIsClampedToCeiling() {
    BudgetTracker tracker = new BudgetTracker("run-1", 1.0);

    tracker.recordCall(100, 100, "gpt-4o", 0.75, 1.0);
    tracker.recordCall(100, 100, "gpt-4o", 0.75, 1.0);

    assertEquals(1.0, tracker.getSpentUsd());
    assertEquals(0.0, tracker.getRemainingUsd());
    assertEquals(2, tracker.getTurnCount());
    assertTrue(tracker.isExceeded());
    // the ledger keeps the actual cost of each call
    assertEquals(0.75, tracker.getSummary().getCalls().get(1).getCostUsd());
  }

  @ParameterizedTest
  @CsvSource({"0.5, 0.49, false", "0.5, 0.5, true", "0.5, 0.51, true", "0.0, 1.0, true"})
  void testPreCheckBoundary(double spent, double estimate, boolean rejected) {
    BudgetTracker tracker = new BudgetTracker("run-1", 1.0);
    if (spent > 0) {
      tracker.recordCall(1, 1, "gpt-4o", spent, 1.0);
    }

    if (rejected) {
      assertThrows(BudgetExceededException.class, () -> tracker.preCheck(estimate, "gpt-4o"));
    } else {
      assertDoesNotThrow(() -> tracker.preCheck(estimate, "gpt-4o"));
    }
    assertEquals(spent, tracker.getSpentUsd());
  }

  @Test
  void testPreCheckReportsPayload() {
    BudgetTracker tracker = new BudgetTracker("run-42", 1.0);
    tracker.recordCall(1, 1, "gpt-4o", 0.8, 1.0);

    BudgetExceededException e = assertThrows(BudgetExceededException.class,
        () -> tracker.preCheck(0.3, "claude-3-opus"));

    assertEquals("run-42", e.getRunId());
    assertEquals(1.0, e.getBudgetUsd());
    assertEquals(1.1, e.getSpentUsd(), 1e-9);
    assertEquals("claude-3-opus", e.getLastModel());
  }

  @Test
  void testPreCheckWithoutModel() {
    BudgetTracker tracker = new BudgetTracker("run-1", 0.0);

    BudgetExceededException e = assertThrows(BudgetExceededException.class, () -> tracker.preCheck(0.0, null));

    assertEquals("unknown", e.getLastModel());
  }

  @Test
  void testNegativeCostRejectedAndStateUnchanged() {
    BudgetTracker tracker = new BudgetTracker("run-1", 10.0);
    tracker.recordCall(10, 10, "gpt-4o", 1.0, 1.0);

    assertThrows(IllegalArgumentException.class, () -> tracker.recordCall(10, 10, "gpt-4o", -0.01, 1.0));
    assertThrows(IllegalArgumentException.class, () -> tracker.recordCall(10, 10, "gpt-4o", Double.NaN, 1.0));

    assertEquals(1.0, tracker.getSpentUsd());
    assertEquals(1, tracker.getTurnCount());
    assertEquals(1, tracker.getSummary().getCalls().size());
  }

  @Test
  void testTurnLimit() {
    BudgetTracker tracker = new BudgetTracker("run-1", 10.0, 3);
    for (int i = 0; i < 3; i++) {
      tracker.recordCall(10, 10, "gpt-4o", 0.1, 1.0);
    }
    BudgetSummary before = tracker.getSummary();

    TurnLimitException e = assertThrows(TurnLimitException.class,
        () -> tracker.recordCall(10, 10, "gpt-4o", 0.1, 1.0));

    assertEquals(3, e.getMaxTurns());
    assertEquals(4, e.getCurrentTurn());
    assertEquals("run-1", e.getRunId());
    assertEquals(before.getSpentUsd(), tracker.getSpentUsd());
    assertEquals(3, tracker.getTurnCount());
    assertEquals(3, tracker.getSummary().getCalls().size());
  }

  @Test
  void testZeroTurnsRejectsFirstCommit() {
    BudgetTracker tracker = new BudgetTracker("run-1", 10.0, 0);

    TurnLimitException e = assertThrows(TurnLimitException.class,
        () -> tracker.recordCall(1, 1, "gpt-4o", 0.0, 1.0));
    assertEquals(1, e.getCurrentTurn());
  }

  @Test
  void testPreCheckStopsThirdCall() {
    BudgetTracker tracker = new BudgetTracker("run-1", 2.00);

    tracker.preCheck(1.95, "gpt-4o");
    tracker.recordCall(1000, 1000, "gpt-4o", 1.95, 10.0);

    assertThrows(BudgetExceededException.class, () -> tracker.preCheck(0.10, "gpt-4o"));
    assertEquals(1.95, tracker.getSpentUsd(), 1e-9);
    assertEquals(1, tracker.getTurnCount());
  }

  @Test
  void testConcurrentCommits() throws Exception {
    int threads = 8;
    int commitsPerThread = 250;
    double cost = 0.001;
    BudgetTracker tracker = new BudgetTracker("run-1", 100.0);

    ExecutorService executor = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < threads; t++) {
      futures.add(executor.submit(() -> {
        start.await();
        for (int i = 0; i < commitsPerThread; i++) {
          tracker.recordCall(10, 10, "gpt-4o", cost, 1.0);
        }
        return null;
      }));
    }
    start.countDown();
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertEquals(threads * commitsPerThread * cost, tracker.getSpentUsd(), 1e-9);
    assertEquals(threads * commitsPerThread, tracker.getTurnCount());
    assertEquals(threads * commitsPerThread, tracker.getSummary().getCalls().size());
  }

  @Test
  void testConcurrentCommitsClampAtCeiling() throws Exception {
    BudgetTracker tracker = new BudgetTracker("run-1", 0.5);
    ExecutorService executor = Executors.newFixedThreadPool(4);
    List<Future<?>> futures = new ArrayList<>();
    for (int t = 0; t < 4; t++) {
      futures.add(executor.submit(() -> {
        for (int i = 0; i < 100; i++) {
          tracker.recordCall(1, 1, "gpt-4o", 0.01, 1.0);
        }
      }));
    }
    for (Future<?> future : futures) {
      future.get(30, TimeUnit.SECONDS);
    }
    executor.shutdown();

    assertEquals(0.5, tracker.getSpentUsd());
    assertEquals(400, tracker.getTurnCount());
  }

  @Test
  void testSummarySnapshot() {
    BudgetTracker tracker = new BudgetTracker("run-7", 10.0, 5);
    tracker.recordCall(120, 80, "gpt-4o-mini", 0.5, 250.0);

    BudgetSummary summary = tracker.getSummary();
    tracker.recordCall(1, 1, "gpt-4o-mini", 0.5, 1.0);

    assertEquals("run-7", summary.getRunId());
    assertEquals(10.0, summary.getBudgetUsd());
    assertEquals(0.5, summary.getSpentUsd());
    assertEquals(9.5, summary.getRemainingUsd());
    assertEquals(1, summary.getTurnCount());
    assertEquals(1, summary.getCalls().size());
    assertThrows(UnsupportedOperationException.class, () -> summary.getCalls().clear());

    CallRecord call = summary.getCalls().get(0);
    assertEquals(120, call.getInputTokens());
    assertEquals(80, call.getOutputTokens());
    assertEquals("gpt-4o-mini", call.getModel());
    assertEquals(250.0, call.getDurationMs());
  }

  @Test
  void testSummaryJsonUsesSnakeCase() {
    BudgetTracker tracker = new BudgetTracker("run-7", 10.0);
    tracker.recordCall(120, 80, "gpt-4o", 0.5, 250.0);

    String json = JsonUtils.toJson(tracker.getSummary());
    BudgetSummary parsed = JsonUtils.fromJson(json, BudgetSummary.class);

    assertTrue(json.contains("\"run_id\":\"run-7\""));
    assertTrue(json.contains("\"remaining_usd\":9.5"));
    assertTrue(json.contains("\"input_tokens\":120"));
    assertEquals(0.5, parsed.getSpentUsd());
    assertEquals("gpt-4o", parsed.getCalls().get(0).getModel());
  }
}
