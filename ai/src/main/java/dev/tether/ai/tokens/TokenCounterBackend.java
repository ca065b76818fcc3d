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

package dev.tether.ai.tokens;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Selects how token counts are estimated.
 */
public enum TokenCounterBackend {
  /** The bundled cl100k_base tokenizer. */
  LOCAL("local"),
  /** A model-aware {@link TokenEstimator} found on the classpath. */
  EXTERNAL("external"),
  /** External when an estimator is available, otherwise local. */
  AUTO("auto");

  private final String value;

  TokenCounterBackend(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static TokenCounterBackend fromValue(String value) {
    if (value != null) {
      for (TokenCounterBackend backend : values()) {
        if (backend.value.equalsIgnoreCase(value.trim())) {
          return backend;
        }
      }
    }
    throw new IllegalArgumentException("Unknown token counter backend: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
