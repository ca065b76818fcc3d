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

package dev.tether.samples;

import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.BudgetOptions;
import dev.tether.ExceedPolicy;
import dev.tether.Tether;
import dev.tether.ai.Message;
import dev.tether.ai.ModelRequest;
import dev.tether.ai.ModelResponse;
import dev.tether.ai.intercept.ModelCallSite;
import dev.tether.core.BudgetExceededException;
import dev.tether.core.export.ExportType;

/**
 * Sample application showing a run that is stopped by its budget.
 *
 * <p>
 * This example shows how to:
 * <ul>
 * <li>Route model calls through a call site so they are metered</li>
 * <li>Run an agent loop under a dollar ceiling</li>
 * <li>Handle the budget exception, or have the run return null instead</li>
 * </ul>
 *
 * <p>
 * The model is simulated, so no API key is needed. To run: mvn exec:java
 */
public class BasicBudgetSample {

  private static final Logger logger = LoggerFactory.getLogger(BasicBudgetSample.class);

  private static final Random random = new Random(42);

  public static void main(String[] args) throws Exception {
    ModelCallSite callSite = ModelCallSite.global();

    // =======================================================
    // Example 1: the loop runs until the ceiling stops it
    // =======================================================

    BudgetOptions strict = BudgetOptions.builder().maxUsd(0.05).maxTurns(50).traceExport(ExportType.CONSOLE)
        .build();
    try {
      Tether.enforceBudget(strict, () -> agentLoop(callSite, "Summarize the quarterly report."));
    } catch (BudgetExceededException e) {
      logger.info("Run {} stopped: spent ${} of ${} on {}", e.getRunId(), e.getSpentUsd(), e.getBudgetUsd(),
          e.getLastModel());
    }

    // =======================================================
    // Example 2: the same loop returning null instead of raising
    // =======================================================

    BudgetOptions lenient = BudgetOptions.builder().maxUsd(0.02).onExceed(ExceedPolicy.RETURN_NULL)
        .traceExport(ExportType.NONE).build();
    Integer steps = Tether.enforceBudget(lenient, () -> agentLoop(callSite, "Draft a reply to the customer."));
    logger.info("Second run returned {}", steps);
  }

  private static Integer agentLoop(ModelCallSite callSite, String task) throws Exception {
    int steps = 0;
    String context = task;
    while (true) {
      ModelRequest request = ModelRequest.builder().model("gpt-4o")
          .message(Message.system("You are a careful assistant. Think step by step."))
          .message(Message.user(context)).build();
      ModelResponse response = callSite.call(request, BasicBudgetSample::simulateModel);
      steps++;
      context = context + "\n" + response.getText();
      logger.info("Step {} done", steps);
    }
  }

  private static ModelResponse simulateModel(ModelRequest request) {
    int inputTokens = 0;
    for (Message message : request.getMessages()) {
      inputTokens += message.getContent().length() / 4 + 4;
    }
    int outputTokens = 200 + random.nextInt(400);
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < outputTokens / 8; i++) {
      text.append("step ").append(i).append(". ");
    }
    return ModelResponse.of(text.toString(), inputTokens, outputTokens);
  }
}
