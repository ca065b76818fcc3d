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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import dev.tether.core.budget.BudgetSummary;

/**
 * Trace is the ordered collection of spans of one run, together with a
 * snapshot of the run's budget. The snapshot taken when the run starts is
 * replaced with the final ledger when the run is torn down. Insertion order is
 * chronological order.
 */
@JsonPropertyOrder({"run_id", "spans", "budget_summary", "start_time", "end_time", "total_cost",
    "total_input_tokens", "total_output_tokens"})
public class Trace {

  private final String runId;
  private volatile BudgetSummary budgetSummary;
  private final Instant startTime;
  private final List<Span> spans = Collections.synchronizedList(new ArrayList<>());
  private volatile Instant endTime;

  public Trace(String runId, BudgetSummary budgetSummary) {
    this(runId, budgetSummary, Instant.now());
  }

  public Trace(String runId, BudgetSummary budgetSummary, Instant startTime) {
    this.runId = runId;
    this.budgetSummary = budgetSummary;
    this.startTime = startTime;
  }

  @JsonProperty("run_id")
  public String getRunId() {
    return runId;
  }

  /**
   * Returns a snapshot of the spans in insertion order.
   *
   * @return the spans
   */
  @JsonProperty("spans")
  public List<Span> getSpans() {
    synchronized (spans) {
      return List.copyOf(spans);
    }
  }

  @JsonProperty("budget_summary")
  public BudgetSummary getBudgetSummary() {
    return budgetSummary;
  }

  public void setBudgetSummary(BudgetSummary budgetSummary) {
    this.budgetSummary = budgetSummary;
  }

  @JsonProperty("start_time")
  public Instant getStartTime() {
    return startTime;
  }

  /**
   * Returns the end time.
   *
   * @return the end time, or null while the run is still going
   */
  @JsonProperty("end_time")
  public Instant getEndTime() {
    return endTime;
  }

  public void addSpan(Span span) {
    spans.add(span);
  }

  /**
   * Stamps the end time. May be called only once.
   *
   * @param endTime
   *            the end time
   */
  public synchronized void end(Instant endTime) {
    if (this.endTime != null) {
      throw new IllegalStateException("Trace " + runId + " has already ended");
    }
    this.endTime = endTime;
  }

  @JsonProperty("total_cost")
  public double getTotalCost() {
    double total = 0.0;
    for (Span span : getSpans()) {
      Double cost = span.getCostUsd();
      total += cost != null ? cost : 0.0;
    }
    return total;
  }

  @JsonProperty("total_input_tokens")
  public long getTotalInputTokens() {
    long total = 0;
    for (Span span : getSpans()) {
      Integer tokens = span.getInputTokens();
      total += tokens != null ? tokens : 0;
    }
    return total;
  }

  @JsonProperty("total_output_tokens")
  public long getTotalOutputTokens() {
    long total = 0;
    for (Span span : getSpans()) {
      Integer tokens = span.getOutputTokens();
      total += tokens != null ? tokens : 0;
    }
    return total;
  }
}
