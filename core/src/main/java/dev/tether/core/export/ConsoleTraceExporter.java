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

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import dev.tether.core.tracing.Span;
import dev.tether.core.tracing.Trace;

/**
 * Prints a human-readable summary of a trace: totals first, then one block per
 * span with model, cost and token counts.
 */
public class ConsoleTraceExporter implements TraceExporter {

  private final PrintStream out;

  /**
   * Creates an exporter that prints to standard error.
   */
  public ConsoleTraceExporter() {
    this(System.err);
  }

  public ConsoleTraceExporter(PrintStream out) {
    this.out = out;
  }

  @Override
  public void export(Trace trace) {
    List<Span> spans = trace.getSpans();

    StringBuilder sb = new StringBuilder();
    sb.append("=== Tether Trace: ").append(trace.getRunId()).append(" ===\n");
    sb.append(String.format(Locale.ROOT, "Total Cost: $%.4f%n", trace.getTotalCost()));
    sb.append("Input Tokens: ").append(trace.getTotalInputTokens()).append('\n');
    sb.append("Output Tokens: ").append(trace.getTotalOutputTokens()).append('\n');
    sb.append("Spans: ").append(spans.size()).append("\n\n");

    for (int i = 0; i < spans.size(); i++) {
      Span span = spans.get(i);
      sb.append("  [").append(i + 1).append("] ").append(span.getSpanType()).append(": ")
          .append(span.getModel() != null ? span.getModel() : "N/A");
      if (span.getStatus() != null) {
        sb.append(" (").append(span.getStatus()).append(')');
      }
      sb.append('\n');
      if (span.getCostUsd() != null) {
        sb.append(String.format(Locale.ROOT, "      Cost: $%.6f%n", span.getCostUsd()));
      }
      if (span.getInputTokens() != null && span.getInputTokens() > 0) {
        sb.append("      Input: ").append(span.getInputTokens()).append(" tokens\n");
      }
      if (span.getOutputTokens() != null && span.getOutputTokens() > 0) {
        sb.append("      Output: ").append(span.getOutputTokens()).append(" tokens\n");
      }
      sb.append('\n');
    }

    out.print(sb);
    out.flush();
  }
}
