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

package dev.tether.core.export;

import java.time.Instant;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.core.tracing.Span;
import dev.tether.core.tracing.SpanStatus;
import dev.tether.core.tracing.Trace;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;

/**
 * Replays a finished trace through OpenTelemetry: one root span for the run and
 * one child span per call, keeping the original timestamps and durations. The
 * host application owns the SDK and its exporters.
 */
public class OpenTelemetryTraceExporter implements TraceExporter {

  private static final Logger logger = LoggerFactory.getLogger(OpenTelemetryTraceExporter.class);
  private static final String INSTRUMENTATION_NAME = "tether-java";
  static final String ROOT_SPAN_NAME = "tether.run";

  private final Tracer tracer;

  /**
   * Creates an exporter backed by {@link GlobalOpenTelemetry}.
   */
  public OpenTelemetryTraceExporter() {
    this(GlobalOpenTelemetry.get());
  }

  public OpenTelemetryTraceExporter(OpenTelemetry openTelemetry) {
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_NAME);
  }

  @Override
  public void export(Trace trace) {
    Instant end = trace.getEndTime() != null ? trace.getEndTime() : Instant.now();

    io.opentelemetry.api.trace.Span root = tracer.spanBuilder(ROOT_SPAN_NAME).setSpanKind(SpanKind.INTERNAL)
        .setNoParent().setStartTimestamp(trace.getStartTime()).startSpan();
    root.setAttribute("tether:runId", trace.getRunId());
    root.setAttribute("tether:totalCostUsd", trace.getTotalCost());
    root.setAttribute("tether:totalInputTokens", trace.getTotalInputTokens());
    root.setAttribute("tether:totalOutputTokens", trace.getTotalOutputTokens());
    if (trace.getBudgetSummary() != null) {
      root.setAttribute("tether:budgetUsd", trace.getBudgetSummary().getBudgetUsd());
    }

    Context parent = Context.root().with(root);
    for (Span span : trace.getSpans()) {
      exportSpan(span, parent);
    }

    root.end(end);
    logger.debug("Exported trace {} to OpenTelemetry", trace.getRunId());
  }

  private void exportSpan(Span span, Context parent) {
    io.opentelemetry.api.trace.Span otelSpan = tracer.spanBuilder(span.getSpanType()).setParent(parent)
        .setSpanKind(SpanKind.CLIENT).setStartTimestamp(span.getTimestamp()).startSpan();

    otelSpan.setAttribute("tether:spanId", span.getSpanId());
    otelSpan.setAttribute("tether:runId", span.getRunId());
    if (span.getParentSpanId() != null) {
      otelSpan.setAttribute("tether:parentSpanId", span.getParentSpanId());
    }
    if (span.getModel() != null) {
      otelSpan.setAttribute("tether:model", span.getModel());
    }
    if (span.getInputTokens() != null) {
      otelSpan.setAttribute("tether:inputTokens", span.getInputTokens().longValue());
    }
    if (span.getOutputTokens() != null) {
      otelSpan.setAttribute("tether:outputTokens", span.getOutputTokens().longValue());
    }
    if (span.getCostUsd() != null) {
      otelSpan.setAttribute("tether:costUsd", span.getCostUsd());
    }
    for (Map.Entry<String, Object> entry : span.getMetadata().entrySet()) {
      Object value = entry.getValue();
      String key = "tether:metadata:" + entry.getKey();
      if (value instanceof String) {
        otelSpan.setAttribute(key, (String) value);
      } else if (value instanceof Integer || value instanceof Long) {
        otelSpan.setAttribute(key, ((Number) value).longValue());
      } else if (value instanceof Double) {
        otelSpan.setAttribute(key, (Double) value);
      } else if (value instanceof Boolean) {
        otelSpan.setAttribute(key, (Boolean) value);
      } else if (value != null) {
        otelSpan.setAttribute(key, value.toString());
      }
    }

    if (span.getStatus() == SpanStatus.OK) {
      otelSpan.setStatus(StatusCode.OK);
    } else if (span.getStatus() == SpanStatus.ERROR) {
      otelSpan.setStatus(StatusCode.ERROR);
    }

    long durationNanos = (long) (span.getDurationMs() * 1_000_000L);
    otelSpan.end(span.getTimestamp().plusNanos(durationNanos));
  }
}
