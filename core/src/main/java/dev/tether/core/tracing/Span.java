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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Span records one call attempt within a run.
 *
 * <p>
 * While the call is in flight its fields may be updated; {@link #close}
 * freezes the span, after which every setter throws
 * {@link IllegalStateException}. Previews longer than
 * {@value #MAX_PREVIEW_LENGTH} characters are cut and suffixed with
 * {@value #ELLIPSIS}.
 */
@JsonPropertyOrder({"span_id", "parent_span_id", "run_id", "timestamp", "duration_ms", "span_type", "model",
    "input_tokens", "output_tokens", "cost_usd", "status", "metadata", "input_preview", "output_preview"})
@JsonInclude(JsonInclude.Include.ALWAYS)
public class Span {

  public static final int MAX_PREVIEW_LENGTH = 200;
  public static final String ELLIPSIS = "...";
  public static final String DEFAULT_TYPE = "call";

  private final String spanId;
  private final String parentSpanId;
  private final String runId;
  private final Instant timestamp;
  private final String spanType;
  private final Map<String, Object> metadata;
  private double durationMs;
  private String model;
  private Integer inputTokens;
  private Integer outputTokens;
  private Double costUsd;
  private SpanStatus status;
  private String inputPreview;
  private String outputPreview;
  private boolean closed;

  private Span(Builder builder) {
    this.spanId = builder.spanId != null ? builder.spanId : generateId();
    this.parentSpanId = builder.parentSpanId;
    this.runId = builder.runId != null ? builder.runId : "";
    this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
    this.spanType = builder.spanType != null ? builder.spanType : DEFAULT_TYPE;
    this.metadata = new LinkedHashMap<>(builder.metadata);
    this.durationMs = builder.durationMs;
    this.model = builder.model;
    this.inputTokens = builder.inputTokens;
    this.outputTokens = builder.outputTokens;
    this.costUsd = builder.costUsd;
    this.status = builder.status;
    this.inputPreview = truncatePreview(builder.inputPreview);
    this.outputPreview = truncatePreview(builder.outputPreview);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Generates a 16 character hex span identifier.
   *
   * @return a new identifier
   */
  public static String generateId() {
    return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
  }

  /**
   * Cuts a preview to {@value #MAX_PREVIEW_LENGTH} characters plus an ellipsis.
   *
   * @param preview
   *            the preview, may be null
   * @return the preview unchanged if short enough, otherwise the truncated form
   */
  public static String truncatePreview(String preview) {
    if (preview != null && preview.length() > MAX_PREVIEW_LENGTH) {
      return preview.substring(0, MAX_PREVIEW_LENGTH) + ELLIPSIS;
    }
    return preview;
  }

  @JsonProperty("span_id")
  public String getSpanId() {
    return spanId;
  }

  @JsonProperty("parent_span_id")
  public String getParentSpanId() {
    return parentSpanId;
  }

  @JsonProperty("run_id")
  public String getRunId() {
    return runId;
  }

  @JsonProperty("timestamp")
  public Instant getTimestamp() {
    return timestamp;
  }

  @JsonProperty("span_type")
  public String getSpanType() {
    return spanType;
  }

  @JsonProperty("duration_ms")
  public synchronized double getDurationMs() {
    return durationMs;
  }

  @JsonProperty("model")
  public synchronized String getModel() {
    return model;
  }

  @JsonProperty("input_tokens")
  public synchronized Integer getInputTokens() {
    return inputTokens;
  }

  @JsonProperty("output_tokens")
  public synchronized Integer getOutputTokens() {
    return outputTokens;
  }

  @JsonProperty("cost_usd")
  public synchronized Double getCostUsd() {
    return costUsd;
  }

  /**
   * Returns the status.
   *
   * @return the status, or null while the call is in flight
   */
  @JsonProperty("status")
  public synchronized SpanStatus getStatus() {
    return status;
  }

  @JsonProperty("metadata")
  public synchronized Map<String, Object> getMetadata() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  @JsonProperty("input_preview")
  public synchronized String getInputPreview() {
    return inputPreview;
  }

  @JsonProperty("output_preview")
  public synchronized String getOutputPreview() {
    return outputPreview;
  }

  @JsonIgnore
  public synchronized boolean isClosed() {
    return closed;
  }

  public synchronized void setDurationMs(double durationMs) {
    checkOpen();
    this.durationMs = durationMs;
  }

  public synchronized void setModel(String model) {
    checkOpen();
    this.model = model;
  }

  public synchronized void setInputTokens(Integer inputTokens) {
    checkOpen();
    this.inputTokens = inputTokens;
  }

  public synchronized void setOutputTokens(Integer outputTokens) {
    checkOpen();
    this.outputTokens = outputTokens;
  }

  public synchronized void setCostUsd(Double costUsd) {
    checkOpen();
    this.costUsd = costUsd;
  }

  public synchronized void setInputPreview(String inputPreview) {
    checkOpen();
    this.inputPreview = truncatePreview(inputPreview);
  }

  public synchronized void setOutputPreview(String outputPreview) {
    checkOpen();
    this.outputPreview = truncatePreview(outputPreview);
  }

  public synchronized void putMetadata(String key, Object value) {
    checkOpen();
    metadata.put(key, value);
  }

  /**
   * Sets the final status and freezes the span.
   *
   * @param status
   *            the outcome of the call
   */
  public synchronized void close(SpanStatus status) {
    checkOpen();
    this.status = status;
    this.closed = true;
  }

  private void checkOpen() {
    if (closed) {
      throw new IllegalStateException("Span " + spanId + " is closed");
    }
  }

  @Override
  public synchronized String toString() {
    return "Span{spanId=" + spanId + ", type=" + spanType + ", model=" + model + ", status=" + status
        + ", costUsd=" + costUsd + "}";
  }

  /**
   * Builder for Span.
   */
  public static class Builder {
    private String spanId;
    private String parentSpanId;
    private String runId;
    private Instant timestamp;
    private double durationMs;
    private String spanType;
    private String model;
    private Integer inputTokens;
    private Integer outputTokens;
    private Double costUsd;
    private SpanStatus status = SpanStatus.OK;
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private String inputPreview;
    private String outputPreview;

    public Builder spanId(String spanId) {
      this.spanId = spanId;
      return this;
    }

    public Builder parentSpanId(String parentSpanId) {
      this.parentSpanId = parentSpanId;
      return this;
    }

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder durationMs(double durationMs) {
      this.durationMs = durationMs;
      return this;
    }

    public Builder spanType(String spanType) {
      this.spanType = spanType;
      return this;
    }

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder inputTokens(Integer inputTokens) {
      this.inputTokens = inputTokens;
      return this;
    }

    public Builder outputTokens(Integer outputTokens) {
      this.outputTokens = outputTokens;
      return this;
    }

    public Builder costUsd(Double costUsd) {
      this.costUsd = costUsd;
      return this;
    }

    /**
     * Sets the status. Defaults to {@link SpanStatus#OK}; pass null to open an
     * in-flight span.
     */
    public Builder status(SpanStatus status) {
      this.status = status;
      return this;
    }

    public Builder metadata(String key, Object value) {
      this.metadata.put(key, value);
      return this;
    }

    public Builder metadata(Map<String, Object> metadata) {
      if (metadata != null) {
        this.metadata.putAll(metadata);
      }
      return this;
    }

    public Builder inputPreview(String inputPreview) {
      this.inputPreview = inputPreview;
      return this;
    }

    public Builder outputPreview(String outputPreview) {
      this.outputPreview = outputPreview;
      return this;
    }

    public Span build() {
      return new Span(this);
    }
  }
}
