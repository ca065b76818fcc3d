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

package dev.tether.core;

/**
 * TokenCountException is raised when a token estimation backend cannot produce
 * a count. Callers on the metered call path recover from it locally.
 */
public class TokenCountException extends TetherException {

  private final String model;

  public TokenCountException(String message) {
    this(message, null, null);
  }

  public TokenCountException(String message, String model) {
    this(message, model, null);
  }

  public TokenCountException(String message, String model, Throwable cause) {
    super(message, cause, TetherErrorCode.TOKEN_COUNT_FAILURE, model, null);
    this.model = model;
  }

  /**
   * Returns the model being counted for.
   *
   * @return the model, or null if the failure is not model specific
   */
  public String getModel() {
    return model;
  }
}
