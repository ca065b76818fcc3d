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
 * Usage reports the tokens a model actually consumed and produced for one call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Usage {

  @JsonProperty("inputTokens")
  private Integer inputTokens;

  @JsonProperty("outputTokens")
  private Integer outputTokens;

  @JsonProperty("totalTokens")
  private Integer totalTokens;

  public Usage() {
  }

  public Usage(Integer inputTokens, Integer outputTokens) {
    this(inputTokens, outputTokens,
        inputTokens != null && outputTokens != null ? inputTokens + outputTokens : null);
  }

  public Usage(Integer inputTokens, Integer outputTokens, Integer totalTokens) {
    this.inputTokens = inputTokens;
    this.outputTokens = outputTokens;
    this.totalTokens = totalTokens;
  }

  public Integer getInputTokens() {
    return inputTokens;
  }

  public void setInputTokens(Integer inputTokens) {
    this.inputTokens = inputTokens;
  }

  public Integer getOutputTokens() {
    return outputTokens;
  }

  public void setOutputTokens(Integer outputTokens) {
    this.outputTokens = outputTokens;
  }

  public Integer getTotalTokens() {
    return totalTokens;
  }

  public void setTotalTokens(Integer totalTokens) {
    this.totalTokens = totalTokens;
  }
}
