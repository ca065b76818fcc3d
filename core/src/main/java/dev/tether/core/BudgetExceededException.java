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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * BudgetExceededException is raised when a call would push a run's spend to or
 * past its dollar ceiling. The admission gate raises it before the metered
 * operation executes.
 */
public class BudgetExceededException extends TetherException {

  private final double budgetUsd;
  private final double spentUsd;
  private final String lastModel;

  /**
   * Creates a new BudgetExceededException.
   *
   * @param message
   *            the error message
   * @param runId
   *            the run whose ceiling was hit
   * @param budgetUsd
   *            the run's ceiling
   * @param spentUsd
   *            the projected spend that triggered the rejection
   * @param lastModel
   *            the model of the rejected call
   */
  public BudgetExceededException(String message, String runId, double budgetUsd, double spentUsd,
      String lastModel) {
    super(message, null, TetherErrorCode.BUDGET_EXCEEDED, details(budgetUsd, spentUsd, lastModel), runId);
    this.budgetUsd = budgetUsd;
    this.spentUsd = spentUsd;
    this.lastModel = lastModel;
  }

  private static Map<String, Object> details(double budgetUsd, double spentUsd, String lastModel) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("budget_usd", budgetUsd);
    details.put("spent_usd", spentUsd);
    details.put("last_model", lastModel);
    return details;
  }

  public double getBudgetUsd() {
    return budgetUsd;
  }

  public double getSpentUsd() {
    return spentUsd;
  }

  public String getLastModel() {
    return lastModel;
  }

  @Override
  public String toString() {
    return String.format("Budget exceeded: $%.2f / $%.2f on run %s", spentUsd, budgetUsd, getRunId());
  }
}
