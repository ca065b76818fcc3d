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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pricing data shipped with Tether: unit prices per 1000 tokens for common
 * hosted models and the alias table that maps shorthand names to canonical
 * identifiers.
 */
public final class BundledPricing {

  private static final Map<String, ModelPricing> PRICES;
  private static final Map<String, String> ALIASES;

  static {
    Map<String, ModelPricing> prices = new LinkedHashMap<>();
    prices.put("gpt-4.1", new ModelPricing(0.003, 0.012));
    prices.put("gpt-4.1-mini", new ModelPricing(0.0008, 0.0032));
    prices.put("gpt-4.1-nano", new ModelPricing(0.0002, 0.0008));
    prices.put("gpt-4o", new ModelPricing(0.0025, 0.01));
    prices.put("gpt-4o-mini", new ModelPricing(0.00015, 0.0006));
    prices.put("gpt-4-turbo", new ModelPricing(0.01, 0.03));
    prices.put("gpt-4", new ModelPricing(0.03, 0.06));
    prices.put("gpt-3.5-turbo", new ModelPricing(0.0005, 0.002));
    prices.put("claude-3-5-sonnet-20241022", new ModelPricing(0.003, 0.015));
    prices.put("claude-3-5-sonnet", new ModelPricing(0.003, 0.015));
    prices.put("claude-3-opus-20240229", new ModelPricing(0.015, 0.075));
    prices.put("claude-3-opus", new ModelPricing(0.015, 0.075));
    prices.put("claude-3-sonnet-20240229", new ModelPricing(0.003, 0.015));
    prices.put("claude-3-sonnet", new ModelPricing(0.003, 0.015));
    prices.put("claude-3-haiku-20240307", new ModelPricing(0.00025, 0.00125));
    prices.put("claude-3-haiku", new ModelPricing(0.00025, 0.00125));
    prices.put("gemini-1.5-pro", new ModelPricing(0.00125, 0.005));
    prices.put("gemini-1.5-flash", new ModelPricing(0.000075, 0.0003));
    prices.put("gemini-1.5-flash-8b", new ModelPricing(0.0000375, 0.00015));
    prices.put("llama-3-70b", new ModelPricing(0.0008, 0.0008));
    prices.put("llama-3-8b", new ModelPricing(0.0002, 0.0002));
    prices.put("mixtral-8x7b", new ModelPricing(0.00024, 0.00024));
    prices.put("mistral-small", new ModelPricing(0.001, 0.003));
    prices.put("mistral-medium", new ModelPricing(0.0024, 0.0072));
    prices.put("mistral-large", new ModelPricing(0.004, 0.012));
    PRICES = Collections.unmodifiableMap(prices);

    Map<String, String> aliases = new LinkedHashMap<>();
    aliases.put("gpt4o", "gpt-4o");
    aliases.put("gpt-4o", "gpt-4o");
    aliases.put("gpt4o-mini", "gpt-4o-mini");
    aliases.put("gpt-4-turbo", "gpt-4-turbo");
    aliases.put("gpt4", "gpt-4");
    aliases.put("gpt-4", "gpt-4");
    aliases.put("gpt-3.5-turbo", "gpt-3.5-turbo");
    aliases.put("claude-sonnet", "claude-3-5-sonnet-20241022");
    aliases.put("claude-3.5-sonnet", "claude-3-5-sonnet-20241022");
    aliases.put("claude-opus", "claude-3-opus-20240229");
    aliases.put("claude-3-opus", "claude-3-opus-20240229");
    aliases.put("claude-sonnet-20240229", "claude-3-sonnet-20240229");
    aliases.put("claude-3-sonnet-20240229", "claude-3-sonnet-20240229");
    aliases.put("claude-haiku", "claude-3-haiku-20240307");
    aliases.put("claude-3-haiku", "claude-3-haiku-20240307");
    ALIASES = Collections.unmodifiableMap(aliases);
  }

  private BundledPricing() {
    // Utility class
  }

  /**
   * Returns the bundled price table keyed by canonical model identifier.
   *
   * @return an unmodifiable map
   */
  public static Map<String, ModelPricing> prices() {
    return PRICES;
  }

  /**
   * Returns the alias table keyed by lower-case shorthand.
   *
   * @return an unmodifiable map
   */
  public static Map<String, String> aliases() {
    return ALIASES;
  }
}
