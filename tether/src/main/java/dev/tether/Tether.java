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

package dev.tether;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Tether is the entry point for running work under a spending ceiling.
 *
 * <pre>
 * {@code
 * String answer = Tether.enforceBudget(BudgetOptions.builder().maxUsd(0.50).build(), () -> {
 *   ModelResponse response = ModelCallSite.global().call(request, client::generate);
 *   return response.getText();
 * });
 * }
 * </pre>
 *
 * Model calls made through the call site named in the options, the global one
 * by default, are estimated, admitted, traced and committed to the run's
 * ledger. Each invocation is one run with its own ledger and trace.
 */
public final class Tether {

  private Tether() {
    // Utility class
  }

  /**
   * Runs work once under a budget.
   *
   * @param options
   *            the run options
   * @param work
   *            the unit of work
   * @param <T>
   *            the result type
   * @return the work's result, or null when the budget stopped it under
   *         {@link ExceedPolicy#RETURN_NULL}
   * @throws Exception
   *             whatever the work throws, or the budget exception under
   *             {@link ExceedPolicy#RAISE}
   */
  public static <T> T enforceBudget(BudgetOptions options, UnitOfWork<T> work) throws Exception {
    return new CircuitBreaker(options).run(work);
  }

  /**
   * Runs work once under a dollar ceiling, with every other option taken from
   * the environment.
   *
   * @param maxUsd
   *            the ceiling in USD
   * @param work
   *            the unit of work
   * @param <T>
   *            the result type
   * @return the work's result
   * @throws Exception
   *             whatever the work throws, or the budget exception
   */
  public static <T> T enforceBudget(double maxUsd, UnitOfWork<T> work) throws Exception {
    return enforceBudget(BudgetOptions.builder().maxUsd(maxUsd).build(), work);
  }

  /**
   * Wraps work so that every invocation of the returned unit is a fresh
   * budgeted run.
   *
   * @param options
   *            the run options
   * @param work
   *            the unit of work
   * @param <T>
   *            the result type
   * @return the budgeted unit of work
   */
  public static <T> UnitOfWork<T> wrap(BudgetOptions options, UnitOfWork<T> work) {
    return () -> enforceBudget(options, work);
  }

  /**
   * Runs asynchronous work once under a budget.
   *
   * @param options
   *            the run options
   * @param work
   *            starts the work
   * @param <T>
   *            the result type
   * @return a future with the work's result
   */
  public static <T> CompletableFuture<T> enforceBudgetAsync(BudgetOptions options,
      Supplier<? extends CompletionStage<T>> work) {
    return new CircuitBreaker(options).runAsync(work);
  }
}
