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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * CallRecord is the immutable ledger entry for one committed call.
 */
public final class CallRecord {

  @JsonProperty("input_tokens")
  private final int inputTokens;

  @JsonProperty("output_tokens")
  private final int outputTokens;

  @JsonProperty("model")
  private final String model;

  @JsonProperty("cost_usd")
  private final double costUsd;

  @JsonProperty("duration_ms")
  private final double durationMs;

  @JsonCreator
  public CallRecord(@JsonProperty("input_tokens") int inputTokens, @JsonProperty("output_tokens") int outputTokens,
      @JsonProperty("model") String model, @JsonProperty("cost_usd") double costUsd,
      @JsonProperty("duration_ms") double durationMs) {
    this.inputTokens = inputTokens;
    this.outputTokens = outputTokens;
    this.model = model;
    this.costUsd = costUsd;
    this.durationMs = durationMs;
  }

  public int getInputTokens() {
    return inputTokens;
  }

  public int getOutputTokens() {
    return outputTokens;
  }

  public String getModel() {
    return model;
  }

  public double getCostUsd() {
    return costUsd;
  }

  public double getDurationMs() {
    return durationMs;
  }

  @Override
  public String toString() {
    return "CallRecord{model=" + model + ", inputTokens=" + inputTokens + ", outputTokens=" + outputTokens
        + ", costUsd=" + costUsd + ", durationMs=" + durationMs + "}";
  }
}
