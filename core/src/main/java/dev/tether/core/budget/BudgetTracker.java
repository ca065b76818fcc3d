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
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.core.BudgetExceededException;
import dev.tether.core.TurnLimitException;

/**
 * BudgetTracker is the ledger of one run. It accumulates spend and call count,
 * gates calls before they execute ({@link #preCheck}) and commits them after
 * they complete ({@link #recordCall}).
 *
 * <p>
 * All readers and mutators go through one lock per tracker, so concurrent
 * commits never lose an update and readers never observe a half-applied
 * commit. The lock only covers the ledger mutation itself; callers must not
 * hold it across the metered operation.
 *
 * <p>
 * Invariants:
 * <ul>
 * <li>spent never decreases within a run</li>
 * <li>spent never exceeds the ceiling; an overshooting commit is clamped</li>
 * <li>the turn count grows by exactly one per successful commit</li>
 * <li>remaining is {@code max(0, ceiling - spent)}</li>
 * </ul>
 */
public class BudgetTracker {

  private static final Logger logger = LoggerFactory.getLogger(BudgetTracker.class);

  private final String runId;
  private final double maxUsd;
  private final Integer maxTurns;
  private final Object lock = new Object();
  private final List<CallRecord> calls = new ArrayList<>();
  private double spentUsd;
  private int turnCount;

  /**
   * Creates a tracker without a turn ceiling.
   *
   * @param runId
   *            the run identifier
   * @param maxUsd
   *            the dollar ceiling, zero or positive
   */
  public BudgetTracker(String runId, double maxUsd) {
    this(runId, maxUsd, null);
  }

  /**
   * Creates a tracker.
   *
   * @param runId
   *            the run identifier
   * @param maxUsd
   *            the dollar ceiling, zero or positive
   * @param maxTurns
   *            the maximum number of committed calls, or null for no limit
   */
  public BudgetTracker(String runId, double maxUsd, Integer maxTurns) {
    if (maxUsd < 0 || Double.isNaN(maxUsd)) {
      throw new IllegalArgumentException("maxUsd must be non-negative");
    }
    if (maxTurns != null && maxTurns < 0) {
      throw new IllegalArgumentException("maxTurns must be non-negative");
    }
    this.runId = runId;
    this.maxUsd = maxUsd;
    this.maxTurns = maxTurns;
  }

  public String getRunId() {
    return runId;
  }

  public double getMaxUsd() {
    return maxUsd;
  }

  /**
   * Returns the turn ceiling.
   *
   * @return the maximum number of calls, or null if unlimited
   */
  public Integer getMaxTurns() {
    return maxTurns;
  }

  public double getSpentUsd() {
    synchronized (lock) {
      return spentUsd;
    }
  }

  public double getRemainingUsd() {
    synchronized (lock) {
      return Math.max(0.0, maxUsd - spentUsd);
    }
  }

  public int getTurnCount() {
    synchronized (lock) {
      return turnCount;
    }
  }

  public boolean isExceeded() {
    synchronized (lock) {
      return spentUsd >= maxUsd;
    }
  }

  /**
   * Admission gate. Rejects a call whose estimated cost would take the spend to
   * or past the ceiling. Never mutates the ledger.
   *
   * @param estimatedCost
   *            the estimated cost of the call in USD
   * @param model
   *            the model of the call, reported in the exception
   * @throws BudgetExceededException
   *             if {@code spent + estimatedCost >= ceiling}
   */
  public void preCheck(double estimatedCost, String model) throws BudgetExceededException {
    synchronized (lock) {
      double projected = spentUsd + estimatedCost;
      if (projected >= maxUsd) {
        throw new BudgetExceededException(
            String.format("Budget exceeded: $%.6f >= $%.6f", projected, maxUsd), runId, maxUsd, projected,
            model != null ? model : "unknown");
      }
    }
  }

  /**
   * Commits a completed call to the ledger. Once a call has been admitted the
   * commit never rejects on cost grounds: a cost that overshoots the ceiling is
   * clamped so that spend equals the ceiling.
   *
   * @param inputTokens
   *            input tokens used
   * @param outputTokens
   *            output tokens produced
   * @param model
   *            the model that served the call
   * @param costUsd
   *            the actual cost in USD, non-negative
   * @param durationMs
   *            wall-clock duration of the call
   * @throws IllegalArgumentException
   *             if {@code costUsd} is negative
   * @throws TurnLimitException
   *             if the turn ceiling has already been reached
   */
  public void recordCall(int inputTokens, int outputTokens, String model, double costUsd, double durationMs)
      throws TurnLimitException {
    if (costUsd < 0 || Double.isNaN(costUsd)) {
      throw new IllegalArgumentException("costUsd must be non-negative");
    }

    synchronized (lock) {
      if (maxTurns != null && turnCount >= maxTurns) {
        throw new TurnLimitException("Turn limit exceeded: " + turnCount + " >= " + maxTurns, runId, maxTurns,
            turnCount + 1);
      }

      spentUsd += costUsd;
      turnCount++;

      if (spentUsd > maxUsd) {
        logger.debug("Run {} overshot its ceiling, clamping spend to ${}", runId, maxUsd);
        spentUsd = maxUsd;
      }

      calls.add(new CallRecord(inputTokens, outputTokens, model, costUsd, durationMs));
    }
  }

  /**
   * Returns a consistent snapshot of the ledger.
   *
   * @return the budget summary
   */
  public BudgetSummary getSummary() {
    synchronized (lock) {
      return new BudgetSummary(runId, maxUsd, spentUsd, Math.max(0.0, maxUsd - spentUsd), turnCount, calls);
    }
  }
}
