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

package dev.tether.ai.pricing;

/**
 * Unit prices of a model in USD per 1000 tokens.
 */
public final class ModelPricing {

  private final double inputCostPer1k;
  private final double outputCostPer1k;

  public ModelPricing(double inputCostPer1k, double outputCostPer1k) {
    if (inputCostPer1k < 0 || outputCostPer1k < 0) {
      throw new IllegalArgumentException("Unit costs must be non-negative");
    }
    this.inputCostPer1k = inputCostPer1k;
    this.outputCostPer1k = outputCostPer1k;
  }

  public double getInputCostPer1k() {
    return inputCostPer1k;
  }

  public double getOutputCostPer1k() {
    return outputCostPer1k;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ModelPricing)) {
      return false;
    }
    ModelPricing that = (ModelPricing) o;
    return Double.compare(inputCostPer1k, that.inputCostPer1k) == 0
        && Double.compare(outputCostPer1k, that.outputCostPer1k) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(inputCostPer1k) + Double.hashCode(outputCostPer1k);
  }

  @Override
  public String toString() {
    return "ModelPricing{input=" + inputCostPer1k + ", output=" + outputCostPer1k + "}";
  }
}
