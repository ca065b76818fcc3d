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

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.ai.intercept.ModelCallInterceptor;
import dev.tether.ai.pricing.PricingRegistry;
import dev.tether.ai.tokens.TokenCounter;
import dev.tether.core.BudgetExceededException;
import dev.tether.core.TetherException;
import dev.tether.core.budget.BudgetTracker;
import dev.tether.core.export.ExportType;
import dev.tether.core.export.TraceExporter;
import dev.tether.core.export.TraceExporters;
import dev.tether.core.tracing.Trace;
import dev.tether.core.tracing.TraceCollector;

/**
 * CircuitBreaker protects exactly one invocation of a unit of work with a
 * budget. It moves through {@link RunState#IDLE}, {@link RunState#ARMED},
 * {@link RunState#EXECUTING}, then {@link RunState#COMPLETED} or
 * {@link RunState#ABORTED}, and always ends in {@link RunState#TORN_DOWN}.
 *
 * <p>
 * Arming creates the run's ledger and trace and activates a
 * {@link ModelCallInterceptor} on the configured call site. Teardown runs on
 * every exit path: it deactivates the interceptor, ends the trace and hands it
 * to the export sink. Export failures are logged, never raised.
 */
public class CircuitBreaker {

  private static final Logger logger = LoggerFactory.getLogger(CircuitBreaker.class);

  private final BudgetOptions options;
  private final Object stateLock = new Object();
  private final AtomicBoolean tornDown = new AtomicBoolean(false);

  private RunState state = RunState.IDLE;
  private String runId;
  private BudgetTracker budgetTracker;
  private TraceCollector traceCollector;
  private ModelCallInterceptor interceptor;
  private volatile Trace trace;

  public CircuitBreaker(BudgetOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("options are required");
    }
    this.options = options;
  }

  /**
   * Generates a run identifier: {@code run-} followed by 8 hex characters.
   *
   * @return a new run identifier
   */
  public static String generateRunId() {
    return "run-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
  }

  /**
   * Runs the work under the budget.
   *
   * @param work
   *            the unit of work
   * @param <T>
   *            the result type
   * @return the work's result, or null if the budget stopped it and the policy
   *         is {@link ExceedPolicy#RETURN_NULL}
   * @throws BudgetExceededException
   *             if the budget stopped the work and the policy is
   *             {@link ExceedPolicy#RAISE}
   * @throws TetherException
   *             if this breaker has already been used, or the call site already
   *             carries an interceptor
   * @throws Exception
   *             whatever the work throws, unchanged
   */
  public <T> T run(UnitOfWork<T> work) throws Exception {
    arm();
    try {
      T result = work.run();
      conclude(RunState.COMPLETED);
      return result;
    } catch (Throwable t) {
      conclude(RunState.ABORTED);
      if (swallows(t)) {
        return null;
      }
      throw t;
    } finally {
      tearDown();
    }
  }

  /**
   * Runs asynchronous work under the budget. Teardown happens once the stage
   * returned by the work completes, or when the returned future is cancelled,
   * whichever comes first.
   *
   * @param work
   *            starts the work
   * @param <T>
   *            the result type
   * @return a future with the work's result, or null if the budget stopped it
   *         and the policy is {@link ExceedPolicy#RETURN_NULL}
   * @throws TetherException
   *             if this breaker has already been used, or the call site already
   *             carries an interceptor
   */
  public <T> CompletableFuture<T> runAsync(Supplier<? extends CompletionStage<T>> work) {
    arm();
    CompletableFuture<T> result = new CompletableFuture<>();

    CompletionStage<T> stage;
    try {
      stage = work.get();
    } catch (Throwable t) {
      finishAsync(result, null, t);
      return result;
    }
    if (stage == null) {
      finishAsync(result, null, null);
      return result;
    }

    result.whenComplete((value, error) -> {
      if (result.isCancelled()) {
        conclude(RunState.ABORTED);
        tearDown();
      }
    });
    stage.whenComplete((value, error) -> finishAsync(result, value, error));
    return result;
  }

  /**
   * Records a call whose usage is already known against the running budget.
   *
   * @param model
   *            the model
   * @param inputTokens
   *            input tokens used
   * @param outputTokens
   *            output tokens produced
   * @throws TetherException
   *             if the breaker is not executing
   */
  public void trackCall(String model, int inputTokens, int outputTokens) {
    ModelCallInterceptor current;
    synchronized (stateLock) {
      if (state != RunState.EXECUTING) {
        throw new TetherException("No run is executing, state is " + state);
      }
      current = interceptor;
    }
    current.trackCall(model, inputTokens, outputTokens);
  }

  public RunState getState() {
    synchronized (stateLock) {
      return state;
    }
  }

  /**
   * Returns the run identifier.
   *
   * @return the run identifier, or null before the breaker is armed
   */
  public String getRunId() {
    synchronized (stateLock) {
      return runId;
    }
  }

  /**
   * Returns the run's ledger.
   *
   * @return the ledger, or null before the breaker is armed
   */
  public BudgetTracker getBudgetTracker() {
    synchronized (stateLock) {
      return budgetTracker;
    }
  }

  /**
   * Returns the finished trace.
   *
   * @return the trace, or null until the breaker is torn down
   */
  public Trace getTrace() {
    return trace;
  }

  private void arm() {
    synchronized (stateLock) {
      if (state != RunState.IDLE) {
        throw new TetherException("CircuitBreaker has already been used, state is " + state);
      }

      runId = generateRunId();
      TetherConfig config = options.getConfig();
      budgetTracker = new BudgetTracker(runId, options.getMaxUsd(), options.getMaxTurns());
      TokenCounter tokenCounter = options.getTokenCounter() != null
          ? options.getTokenCounter()
          : new TokenCounter(config.getTokenCounterBackend());
      PricingRegistry pricingRegistry = options.getPricingRegistry() != null
          ? options.getPricingRegistry()
          : new PricingRegistry(config.getPricingSource());
      traceCollector = new TraceCollector();
      interceptor = new ModelCallInterceptor(budgetTracker, tokenCounter, pricingRegistry, traceCollector,
          options.getOutputTokenMultiplier());

      traceCollector.startTrace(runId, budgetTracker.getSummary());
      state = RunState.ARMED;
      try {
        interceptor.activate(options.getCallSite());
      } catch (RuntimeException e) {
        traceCollector.endTrace();
        state = RunState.TORN_DOWN;
        tornDown.set(true);
        throw e;
      }
      state = RunState.EXECUTING;
    }
    logger.debug("Armed run {} with ${} and max turns {}", runId, budgetTracker.getMaxUsd(),
        budgetTracker.getMaxTurns());
  }

  private void conclude(RunState outcome) {
    synchronized (stateLock) {
      if (state == RunState.EXECUTING) {
        state = outcome;
      }
    }
  }

  private <T> void finishAsync(CompletableFuture<T> result, T value, Throwable error) {
    if (error == null) {
      conclude(RunState.COMPLETED);
      tearDown();
      result.complete(value);
      return;
    }
    conclude(RunState.ABORTED);
    tearDown();
    if (swallows(error)) {
      result.complete(null);
    } else {
      result.completeExceptionally(error);
    }
  }

  private boolean swallows(Throwable error) {
    if (options.getOnExceed() != ExceedPolicy.RETURN_NULL) {
      return false;
    }
    BudgetExceededException exceeded = findBudgetExceeded(error);
    if (exceeded == null) {
      return false;
    }
    logger.info("Run {} stopped by its budget, returning null: {}", runId, exceeded.getMessage());
    return true;
  }

  static BudgetExceededException findBudgetExceeded(Throwable error) {
    Throwable current = error;
    while (current != null) {
      if (current instanceof BudgetExceededException) {
        return (BudgetExceededException) current;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return null;
  }

  private void tearDown() {
    if (!tornDown.compareAndSet(false, true)) {
      return;
    }
    try {
      interceptor.deactivate();
    } finally {
      Trace ended = traceCollector.endTrace();
      if (ended != null) {
        ended.setBudgetSummary(budgetTracker.getSummary());
        trace = ended;
        export(ended);
      }
      synchronized (stateLock) {
        state = RunState.TORN_DOWN;
      }
      logger.info("Run {} finished: ${} of ${} spent over {} turns", runId,
          String.format("%.6f", budgetTracker.getSpentUsd()), budgetTracker.getMaxUsd(),
          budgetTracker.getTurnCount());
    }
  }

  private void export(Trace ended) {
    TraceExporter exporter = options.getExporter();
    if (exporter == null) {
      ExportType type = options.getTraceExport();
      if (type == ExportType.NONE) {
        return;
      }
      exporter = TraceExporters.forType(type, options.getTraceExportPath());
    }
    try {
      exporter.export(ended);
    } catch (RuntimeException e) {
      logger.warn("Failed to export trace for run {}", runId, e);
    }
  }
}
