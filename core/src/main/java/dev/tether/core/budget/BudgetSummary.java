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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * BudgetSummary is a point-in-time snapshot of a run's ledger.
 */
public final class BudgetSummary {

  @JsonProperty("run_id")
  private final String runId;

  @JsonProperty("budget_usd")
  private final double budgetUsd;

  @JsonProperty("spent_usd")
  private final double spentUsd;

  @JsonProperty("remaining_usd")
  private final double remainingUsd;

  @JsonProperty("turn_count")
  private final int turnCount;

  @JsonProperty("calls")
  private final List<CallRecord> calls;

  @JsonCreator
  public BudgetSummary(@JsonProperty("run_id") String runId, @JsonProperty("budget_usd") double budgetUsd,
      @JsonProperty("spent_usd") double spentUsd, @JsonProperty("remaining_usd") double remainingUsd,
      @JsonProperty("turn_count") int turnCount, @JsonProperty("calls") List<CallRecord> calls) {
    this.runId = runId;
    this.budgetUsd = budgetUsd;
    this.spentUsd = spentUsd;
    this.remainingUsd = remainingUsd;
    this.turnCount = turnCount;
    this.calls = calls != null ? Collections.unmodifiableList(new ArrayList<>(calls)) : List.of();
  }

  public String getRunId() {
    return runId;
  }

  public double getBudgetUsd() {
    return budgetUsd;
  }

  public double getSpentUsd() {
    return spentUsd;
  }

  public double getRemainingUsd() {
    return remainingUsd;
  }

  public int getTurnCount() {
    return turnCount;
  }

  /**
   * Returns the committed calls in commit order.
   *
   * @return an unmodifiable list of call records
   */
  public List<CallRecord> getCalls() {
    return calls;
  }
}
