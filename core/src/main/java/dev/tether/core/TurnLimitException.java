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

import java.util.Map;

/**
 * TurnLimitException is raised when a run has already committed its maximum
 * number of calls. The rejected call is never recorded.
 */
public class TurnLimitException extends TetherException {

  private final int maxTurns;
  private final int currentTurn;

  /**
   * Creates a new TurnLimitException.
   *
   * @param message
   *            the error message
   * @param runId
   *            the run whose turn ceiling was hit
   * @param maxTurns
   *            the configured maximum
   * @param currentTurn
   *            the turn that was attempted
   */
  public TurnLimitException(String message, String runId, int maxTurns, int currentTurn) {
    super(message, null, TetherErrorCode.TURN_LIMIT_EXCEEDED,
        Map.of("max_turns", maxTurns, "current_turn", currentTurn), runId);
    this.maxTurns = maxTurns;
    this.currentTurn = currentTurn;
  }

  public int getMaxTurns() {
    return maxTurns;
  }

  public int getCurrentTurn() {
    return currentTurn;
  }

  @Override
  public String toString() {
    return "Turn limit exceeded: " + currentTurn + " / " + maxTurns + " on run " + getRunId();
  }
}
