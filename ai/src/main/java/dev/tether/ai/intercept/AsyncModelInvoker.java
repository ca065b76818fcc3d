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

package dev.tether.ai.intercept;

import java.util.concurrent.CompletionStage;

import dev.tether.ai.ModelRequest;

/**
 * AsyncModelInvoker starts an outbound model call and returns its eventual
 * result.
 *
 * @param <O>
 *            the response type
 */
@FunctionalInterface
public interface AsyncModelInvoker<O> {

  /**
   * Starts the call.
   *
   * @param request
   *            the request
   * @return a stage that completes with the model's response
   */
  CompletionStage<O> invoke(ModelRequest request);
}
