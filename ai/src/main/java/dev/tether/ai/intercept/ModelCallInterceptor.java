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

package dev.tether.ai.intercept;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.ai.Message;
import dev.tether.ai.MeteredResponse;
import dev.tether.ai.ModelRequest;
import dev.tether.ai.Usage;
import dev.tether.ai.pricing.PricingRegistry;
import dev.tether.ai.tokens.TokenCounter;
import dev.tether.core.BudgetExceededException;
import dev.tether.core.TetherException;
import dev.tether.core.TokenCountException;
import dev.tether.core.UnknownModelException;
import dev.tether.core.budget.BudgetTracker;
import dev.tether.core.tracing.Span;
import dev.tether.core.tracing.SpanStatus;
import dev.tether.core.tracing.TraceCollector;

/**
 * ModelCallInterceptor enforces a budget around every model call that passes
 * through it. Each call is estimated and admitted against the
 * {@link BudgetTracker} before it runs, traced as a {@link Span}, and committed
 * to the ledger with its actual usage once it returns.
 *
 * <p>
 * The interceptor wraps calls while it is activated on an
 * {@link InterceptionBoundary}. It can also be driven directly through
 * {@link #intercept(ModelRequest, ModelInvoker)} and
 * {@link #trackCall(String, int, int)}.
 */
public class ModelCallInterceptor implements CallHook, AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(ModelCallInterceptor.class);

  /** Span type of intercepted calls. */
  public static final String SPAN_TYPE = "llm_call";

  /** Model name used when a request does not name one. */
  public static final String UNKNOWN_MODEL = "unknown";

  private final BudgetTracker budgetTracker;
  private final TokenCounter tokenCounter;
  private final PricingRegistry pricingRegistry;
  private final TraceCollector traceCollector;
  private final double outputTokenMultiplier;

  private final Object lifecycleLock = new Object();
  private InterceptionBoundary boundary;

  public ModelCallInterceptor(BudgetTracker budgetTracker, TokenCounter tokenCounter, PricingRegistry pricingRegistry,
      TraceCollector traceCollector) {
    this(budgetTracker, tokenCounter, pricingRegistry, traceCollector, 1.0);
  }

  /**
   * Creates a new interceptor.
   *
   * @param budgetTracker
   *            the ledger calls are admitted against and committed to
   * @param tokenCounter
   *            estimates input tokens
   * @param pricingRegistry
   *            prices calls
   * @param traceCollector
   *            receives one span per call
   * @param outputTokenMultiplier
   *            projected output tokens per estimated input token, non-negative
   */
  public ModelCallInterceptor(BudgetTracker budgetTracker, TokenCounter tokenCounter, PricingRegistry pricingRegistry,
      TraceCollector traceCollector, double outputTokenMultiplier) {
    if (budgetTracker == null || tokenCounter == null || pricingRegistry == null || traceCollector == null) {
      throw new IllegalArgumentException("budgetTracker, tokenCounter, pricingRegistry and traceCollector are required");
    }
    if (outputTokenMultiplier < 0 || Double.isNaN(outputTokenMultiplier)) {
      throw new IllegalArgumentException("outputTokenMultiplier must be non-negative");
    }
    this.budgetTracker = budgetTracker;
    this.tokenCounter = tokenCounter;
    this.pricingRegistry = pricingRegistry;
    this.traceCollector = traceCollector;
    this.outputTokenMultiplier = outputTokenMultiplier;
  }

  public BudgetTracker getBudgetTracker() {
    return budgetTracker;
  }

  public double getOutputTokenMultiplier() {
    return outputTokenMultiplier;
  }

  /**
   * Installs this interceptor on a boundary. Every call issued through the
   * boundary is then budgeted and traced until {@link #deactivate()}.
   *
   * @param target
   *            the boundary to hook
   * @throws TetherException
   *             if this interceptor is already active, or the boundary already
   *             carries another interceptor
   */
  public void activate(InterceptionBoundary target) throws TetherException {
    synchronized (lifecycleLock) {
      if (boundary != null) {
        throw new TetherException("Interceptor is already active", null, null, null, budgetTracker.getRunId());
      }
      target.install(this);
      boundary = target;
    }
    logger.debug("Interceptor activated for run {}", budgetTracker.getRunId());
  }

  /**
   * Removes this interceptor from its boundary. Does nothing if it is not
   * active.
   */
  public void deactivate() {
    synchronized (lifecycleLock) {
      if (boundary == null) {
        return;
      }
      try {
        boundary.uninstall(this);
      } finally {
        boundary = null;
      }
    }
    logger.debug("Interceptor deactivated for run {}", budgetTracker.getRunId());
  }

  public boolean isActive() {
    synchronized (lifecycleLock) {
      return boundary != null;
    }
  }

  @Override
  public void close() {
    deactivate();
  }

  @Override
  public <O> O around(ModelRequest request, ModelInvoker<O> invoker) throws Exception {
    return intercept(request, invoker);
  }

  @Override
  public <O> CompletableFuture<O> aroundAsync(ModelRequest request, AsyncModelInvoker<O> invoker) {
    return interceptAsync(request, invoker);
  }

  /**
   * Runs one synchronous call under budget.
   *
   * @param request
   *            the request
   * @param invoker
   *            performs the call
   * @param <O>
   *            the response type
   * @return the invoker's response, unchanged
   * @throws BudgetExceededException
   *             if the estimated cost does not fit the remaining budget; the
   *             invoker is not called
   * @throws Exception
   *             whatever the invoker throws, after the span is marked as failed
   */
  public <O> O intercept(ModelRequest request, ModelInvoker<O> invoker) throws Exception {
    PendingCall call = admit(request);
    O response;
    try {
      response = invoker.invoke(request);
    } catch (Throwable t) {
      call.fail(t);
      throw t;
    }
    commit(call, response);
    return response;
  }

  /**
   * Runs one asynchronous call under budget. A rejected call yields a future
   * failed with {@link BudgetExceededException} and the invoker is not called.
   *
   * @param request
   *            the request
   * @param invoker
   *            starts the call
   * @param <O>
   *            the response type
   * @return a future completed with the invoker's response once it is committed
   */
  public <O> CompletableFuture<O> interceptAsync(ModelRequest request, AsyncModelInvoker<O> invoker) {
    PendingCall call;
    try {
      call = admit(request);
    } catch (TetherException e) {
      return CompletableFuture.failedFuture(e);
    }

    CompletionStage<O> stage;
    try {
      stage = invoker.invoke(request);
    } catch (RuntimeException e) {
      call.fail(e);
      return CompletableFuture.failedFuture(e);
    }

    CompletableFuture<O> result = new CompletableFuture<>();
    stage.whenComplete((response, error) -> {
      if (error != null) {
        call.fail(error);
        result.completeExceptionally(error);
        return;
      }
      try {
        commit(call, response);
        result.complete(response);
      } catch (RuntimeException e) {
        result.completeExceptionally(e);
      }
    });
    return result;
  }

  /**
   * Records a call whose token counts are already known, for example one made
   * outside any interception boundary.
   *
   * @param model
   *            the model
   * @param inputTokens
   *            input tokens used
   * @param outputTokens
   *            output tokens produced
   * @throws BudgetExceededException
   *             if the cost does not fit the remaining budget; nothing is
   *             recorded
   */
  public void trackCall(String model, int inputTokens, int outputTokens) throws BudgetExceededException {
    String resolvedModel = model != null ? model : UNKNOWN_MODEL;
    double cost = priceOrZero(resolvedModel, inputTokens, outputTokens);
    budgetTracker.preCheck(cost, resolvedModel);

    Span span = Span.builder()
        .runId(budgetTracker.getRunId())
        .spanType(SPAN_TYPE)
        .model(resolvedModel)
        .inputTokens(inputTokens)
        .outputTokens(outputTokens)
        .costUsd(cost)
        .status(null)
        .metadata("manual", true)
        .build();
    traceCollector.addSpan(span);

    try {
      budgetTracker.recordCall(inputTokens, outputTokens, resolvedModel, cost, 0.0);
    } catch (RuntimeException e) {
      span.putMetadata("commit_error", e.getMessage());
      span.close(SpanStatus.ERROR);
      throw e;
    }
    span.close(SpanStatus.OK);
  }

  private PendingCall admit(ModelRequest request) {
    String model = request != null && request.getModel() != null ? request.getModel() : UNKNOWN_MODEL;
    List<Message> messages = request != null && request.getMessages() != null
        ? request.getMessages()
        : Collections.<Message>emptyList();

    long startNanos = System.nanoTime();
    Instant startedAt = Instant.now();

    int estimatedInput = estimateInputTokens(messages, model);
    int estimatedOutput = (int) Math.round(estimatedInput * outputTokenMultiplier);
    double estimatedCost = priceOrZero(model, estimatedInput, estimatedOutput);

    logger.debug("Run {}: {} estimated at {} in / {} out tokens, ${}", budgetTracker.getRunId(), model,
        estimatedInput, estimatedOutput, estimatedCost);
    budgetTracker.preCheck(estimatedCost, model);

    Span span = Span.builder()
        .runId(budgetTracker.getRunId())
        .timestamp(startedAt)
        .spanType(SPAN_TYPE)
        .model(model)
        .inputTokens(estimatedInput)
        .status(null)
        .metadata("estimated_input_tokens", estimatedInput)
        .metadata("estimated_output_tokens", estimatedOutput)
        .metadata("estimated_cost_usd", estimatedCost)
        .inputPreview(firstContent(messages))
        .build();
    traceCollector.addSpan(span);

    return new PendingCall(model, span, startNanos, estimatedInput, estimatedOutput);
  }

  private void commit(PendingCall call, Object response) {
    double durationMs = call.elapsedMs();
    int inputTokens = call.estimatedInput;
    int outputTokens = call.estimatedOutput;
    String outputPreview = null;
    boolean usageReported = false;

    if (response instanceof MeteredResponse) {
      MeteredResponse metered = (MeteredResponse) response;
      Usage usage = metered.getUsage();
      if (usage != null) {
        if (usage.getInputTokens() != null) {
          inputTokens = usage.getInputTokens();
          usageReported = true;
        }
        if (usage.getOutputTokens() != null) {
          outputTokens = usage.getOutputTokens();
          usageReported = true;
        }
      }
      try {
        outputPreview = metered.getText();
      } catch (RuntimeException e) {
        logger.debug("Could not read response text for preview: {}", e.getMessage());
      }
    }
    if (!usageReported) {
      logger.debug("Run {}: {} reported no usage, committing estimates", budgetTracker.getRunId(), call.model);
    }

    double cost = priceOrZero(call.model, inputTokens, outputTokens);

    Span span = call.span;
    span.setInputTokens(inputTokens);
    span.setOutputTokens(outputTokens);
    span.setCostUsd(cost);
    span.setDurationMs(durationMs);
    span.setOutputPreview(outputPreview);
    span.putMetadata("usage_reported", usageReported);

    try {
      budgetTracker.recordCall(inputTokens, outputTokens, call.model, cost, durationMs);
    } catch (RuntimeException e) {
      span.putMetadata("commit_error", e.getMessage());
      span.close(SpanStatus.ERROR);
      throw e;
    }
    span.close(SpanStatus.OK);
  }

  private static String firstContent(List<Message> messages) {
    for (Message message : messages) {
      if (message != null) {
        return message.getContent();
      }
    }
    return null;
  }

  private int estimateInputTokens(List<Message> messages, String model) {
    try {
      return tokenCounter.countMessages(messages, model);
    } catch (TokenCountException e) {
      logger.warn("Token counting failed for model '{}', estimating 0 input tokens: {}", model, e.getMessage());
      return 0;
    }
  }

  private double priceOrZero(String model, int inputTokens, int outputTokens) {
    try {
      return pricingRegistry.estimateCallCost(model, inputTokens, outputTokens);
    } catch (UnknownModelException e) {
      logger.warn("No pricing for model '{}', counting the call as free", model);
      return 0.0;
    }
  }

  /**
   * A call that passed the admission check and is waiting for its result.
   */
  private static final class PendingCall {
    private final String model;
    private final Span span;
    private final long startNanos;
    private final int estimatedInput;
    private final int estimatedOutput;

    PendingCall(String model, Span span, long startNanos, int estimatedInput, int estimatedOutput) {
      this.model = model;
      this.span = span;
      this.startNanos = startNanos;
      this.estimatedInput = estimatedInput;
      this.estimatedOutput = estimatedOutput;
    }

    double elapsedMs() {
      return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    void fail(Throwable error) {
      span.setDurationMs(elapsedMs());
      span.putMetadata("error", error.getClass().getSimpleName() + ": " + error.getMessage());
      span.close(SpanStatus.ERROR);
    }
  }
}
