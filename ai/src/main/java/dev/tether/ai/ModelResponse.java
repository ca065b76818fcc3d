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

package dev.tether.ai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ModelResponse is a simple metered response carrying the generated message,
 * the reported usage and the latency of the call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelResponse implements MeteredResponse {

  @JsonProperty("message")
  private Message message;

  @JsonProperty("usage")
  private Usage usage;

  @JsonProperty("latencyMs")
  private Long latencyMs;

  public ModelResponse() {
  }

  public ModelResponse(Message message, Usage usage) {
    this.message = message;
    this.usage = usage;
  }

  /**
   * Creates an assistant response with the given text and usage.
   *
   * @param text
   *            the generated text
   * @param inputTokens
   *            the reported input tokens
   * @param outputTokens
   *            the reported output tokens
   * @return the response
   */
  public static ModelResponse of(String text, int inputTokens, int outputTokens) {
    return new ModelResponse(Message.assistant(text), new Usage(inputTokens, outputTokens));
  }

  public Message getMessage() {
    return message;
  }

  public void setMessage(Message message) {
    this.message = message;
  }

  @Override
  public Usage getUsage() {
    return usage;
  }

  public void setUsage(Usage usage) {
    this.usage = usage;
  }

  public Long getLatencyMs() {
    return latencyMs;
  }

  public void setLatencyMs(Long latencyMs) {
    this.latencyMs = latencyMs;
  }

  @Override
  public String getText() {
    return message != null ? message.getContent() : null;
  }
}
