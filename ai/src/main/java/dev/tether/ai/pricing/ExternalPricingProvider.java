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
 * ExternalPricingProvider supplies unit prices for models the bundled table
 * does not know. Implementations are discovered with
 * {@link java.util.ServiceLoader} when none is passed explicitly.
 */
public interface ExternalPricingProvider {

  /**
   * Looks up the unit prices of a model.
   *
   * @param model
   *            the model identifier as passed by the caller
   * @return the prices, or null if the provider does not know the model
   */
  ModelPricing getPricing(String model);
}
