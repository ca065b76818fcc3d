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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the registry looks once its bundled and custom tables miss.
 */
public enum PricingSource {
  /** Bundled and custom tables only. */
  BUNDLED("bundled"),
  /** Fall back to an {@link ExternalPricingProvider}. */
  EXTERNAL("external");

  private final String value;

  PricingSource(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static PricingSource fromValue(String value) {
    if (value != null) {
      for (PricingSource source : values()) {
        if (source.value.equalsIgnoreCase(value.trim())) {
          return source;
        }
      }
    }
    throw new IllegalArgumentException("Unknown pricing source: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
