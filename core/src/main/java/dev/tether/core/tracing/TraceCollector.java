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
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.core.TetherException;
import dev.tether.core.budget.BudgetSummary;

/**
 * TraceCollector owns the single active trace of a run. Spans added while no
 * trace is active are dropped.
 */
public class TraceCollector {

  private static final Logger logger = LoggerFactory.getLogger(TraceCollector.class);

  private final AtomicReference<Trace> currentTrace = new AtomicReference<>();

  /**
   * Starts the active trace.
   *
   * @param runId
   *            the run identifier
   * @param budgetSummary
   *            the ledger snapshot at run start
   * @return the new trace
   * @throws TetherException
   *             if a trace is already active on this collector
   */
  public Trace startTrace(String runId, BudgetSummary budgetSummary) {
    Trace trace = new Trace(runId, budgetSummary);
    if (!currentTrace.compareAndSet(null, trace)) {
      throw new TetherException("A trace is already active: " + currentTrace.get().getRunId());
    }
    logger.debug("Started trace for run {}", runId);
    return trace;
  }

  /**
   * Appends a span to the active trace, or drops it if none is active.
   *
   * @param span
   *            the span to add
   */
  public void addSpan(Span span) {
    Trace trace = currentTrace.get();
    if (trace == null) {
      logger.debug("No active trace, dropping span {}", span.getSpanId());
      return;
    }
    trace.addSpan(span);
  }

  /**
   * Ends the active trace and detaches it from this collector.
   *
   * @return the finished trace, or null if no trace was active
   */
  public Trace endTrace() {
    Trace trace = currentTrace.getAndSet(null);
    if (trace == null) {
      return null;
    }
    trace.end(Instant.now());
    logger.debug("Ended trace for run {} with {} spans", trace.getRunId(), trace.getSpans().size());
    return trace;
  }

  /**
   * Returns the active trace.
   *
   * @return the active trace, or null if none
   */
  public Trace getCurrentTrace() {
    return currentTrace.get();
  }
}
