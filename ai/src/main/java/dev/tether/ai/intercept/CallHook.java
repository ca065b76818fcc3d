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

import java.util.concurrent.CompletableFuture;

import dev.tether.ai.ModelRequest;

/**
 * CallHook wraps one outbound model call with work before and after it. A hook
 * is installed on an {@link InterceptionBoundary}.
 */
public interface CallHook {

  /**
   * Runs a synchronous call through the hook.
   *
   * @param request
   *            the request
   * @param invoker
   *            performs the call
   * @param <O>
   *            the response type
   * @return the response returned by the invoker
   * @throws Exception
   *             whatever the invoker or the hook throws
   */
  <O> O around(ModelRequest request, ModelInvoker<O> invoker) throws Exception;

  /**
   * Runs an asynchronous call through the hook.
   *
   * @param request
   *            the request
   * @param invoker
   *            starts the call
   * @param <O>
   *            the response type
   * @return a future completed with the invoker's response
   */
  <O> CompletableFuture<O> aroundAsync(ModelRequest request, AsyncModelInvoker<O> invoker);
}
