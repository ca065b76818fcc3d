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

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.core.UnknownModelException;

/**
 * PricingRegistry converts token counts into money. Lookups resolve aliases
 * first, then consult the custom overlay, then the bundled table, and finally
 * the external provider when the registry is configured for it.
 *
 * <p>
 * All costs are linear and per 1000 tokens.
 */
public class PricingRegistry {

  private static final Logger logger = LoggerFactory.getLogger(PricingRegistry.class);

  private final PricingSource source;
  private final ExternalPricingProvider externalProvider;
  private final Map<String, ModelPricing> customModels = new ConcurrentHashMap<>();
  private final Map<String, ModelPricing> bundled;

  /**
   * Creates a registry backed by the bundled table only.
   */
  public PricingRegistry() {
    this(PricingSource.BUNDLED, null);
  }

  /**
   * Creates a registry for the given source. With
   * {@link PricingSource#EXTERNAL} the provider is discovered with
   * {@link ServiceLoader}.
   *
   * @param source
   *            the pricing source
   */
  public PricingRegistry(PricingSource source) {
    this(source, source == PricingSource.EXTERNAL ? discoverProvider() : null);
  }

  /**
   * Creates a registry with an explicit external provider.
   *
   * @param source
   *            the pricing source
   * @param externalProvider
   *            the provider consulted when the source is external, may be null
   */
  public PricingRegistry(PricingSource source, ExternalPricingProvider externalProvider) {
    this.source = source != null ? source : PricingSource.BUNDLED;
    this.externalProvider = externalProvider;
    this.bundled = BundledPricing.prices();
  }

  private static ExternalPricingProvider discoverProvider() {
    Iterator<ExternalPricingProvider> it = ServiceLoader.load(ExternalPricingProvider.class).iterator();
    if (it.hasNext()) {
      ExternalPricingProvider provider = it.next();
      logger.debug("Using external pricing provider {}", provider.getClass().getName());
      return provider;
    }
    logger.debug("No external pricing provider found on the classpath");
    return null;
  }

  public PricingSource getSource() {
    return source;
  }

  /**
   * Normalizes a model name and maps known shorthand to its canonical
   * identifier. Unknown names pass through unchanged.
   *
   * @param model
   *            the model name
   * @return the canonical identifier, or the input if it is not an alias
   */
  public String resolveAlias(String model) {
    if (model == null) {
      return null;
    }
    String normalized = model.trim().toLowerCase(Locale.ROOT);
    return BundledPricing.aliases().getOrDefault(normalized, model);
  }

  /**
   * Returns the input unit cost per 1000 tokens.
   *
   * @param model
   *            the model name
   * @return the cost in USD
   * @throws UnknownModelException
   *             if no pricing source knows the model
   */
  public double getInputCost(String model) throws UnknownModelException {
    return lookup(model).getInputCostPer1k();
  }

  /**
   * Returns the output unit cost per 1000 tokens.
   *
   * @param model
   *            the model name
   * @return the cost in USD
   * @throws UnknownModelException
   *             if no pricing source knows the model
   */
  public double getOutputCost(String model) throws UnknownModelException {
    return lookup(model).getOutputCostPer1k();
  }

  /**
   * Computes the cost of a call.
   *
   * @param model
   *            the model name
   * @param inputTokens
   *            input tokens
   * @param outputTokens
   *            output tokens
   * @return the cost in USD
   * @throws UnknownModelException
   *             if no pricing source knows the model
   */
  public double estimateCallCost(String model, int inputTokens, int outputTokens) throws UnknownModelException {
    ModelPricing pricing = lookup(model);
    double inputCost = pricing.getInputCostPer1k() * inputTokens / 1000;
    double outputCost = pricing.getOutputCostPer1k() * outputTokens / 1000;
    return inputCost + outputCost;
  }

  /**
   * Registers or overwrites prices for a model. Custom prices shadow the
   * bundled table and are keyed by the resolved identifier, so an alias and
   * its canonical name share one entry.
   *
   * @param model
   *            the model identifier
   * @param inputCost
   *            input cost per 1000 tokens
   * @param outputCost
   *            output cost per 1000 tokens
   */
  public void registerCustomModel(String model, double inputCost, double outputCost) {
    if (model == null || model.trim().isEmpty()) {
      throw new IllegalArgumentException("model is required");
    }
    customModels.put(resolveAlias(model), new ModelPricing(inputCost, outputCost));
    logger.debug("Registered custom pricing for {}: input={}, output={}", model, inputCost, outputCost);
  }

  /**
   * Returns whether any pricing source knows the model.
   *
   * @param model
   *            the model name
   * @return true if a price can be resolved
   */
  public boolean isKnown(String model) {
    try {
      lookup(model);
      return true;
    } catch (UnknownModelException e) {
      return false;
    }
  }

  private ModelPricing lookup(String model) {
    String resolved = resolveAlias(model);
    if (resolved != null) {
      ModelPricing custom = customModels.get(resolved);
      if (custom != null) {
        return custom;
      }
      ModelPricing pricing = bundled.get(resolved);
      if (pricing != null) {
        return pricing;
      }
    }
    if (source == PricingSource.EXTERNAL) {
      if (externalProvider == null) {
        throw new UnknownModelException("Unknown model: " + model + " (no external pricing provider)", model);
      }
      ModelPricing external = externalProvider.getPricing(model);
      if (external != null) {
        return external;
      }
    }
    throw new UnknownModelException("Unknown model: " + model, model);
  }
}
