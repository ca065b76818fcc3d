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
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.ai.ModelRequest;
import dev.tether.core.TetherException;

/**
 * ModelCallSite is the point through which application code issues model
 * calls. When a hook is installed every call runs through it, otherwise calls
 * go straight to the invoker.
 *
 * <p>
 * {@link #global()} is the process-wide call site. Code that needs independent
 * runs in parallel creates its own call sites.
 *
 * <pre>
 * {@code
 * ModelResponse response = ModelCallSite.global().call(request, req -> client.generate(req));
 * }
 * </pre>
 */
public class ModelCallSite implements InterceptionBoundary {

  private static final Logger logger = LoggerFactory.getLogger(ModelCallSite.class);
  private static final ModelCallSite GLOBAL = new ModelCallSite("global");

  private final String name;
  private final AtomicReference<CallHook> hook = new AtomicReference<>();

  public ModelCallSite(String name) {
    this.name = name;
  }

  /**
   * Returns the process-wide call site.
   *
   * @return the global call site
   */
  public static ModelCallSite global() {
    return GLOBAL;
  }

  public String getName() {
    return name;
  }

  /**
   * Issues a synchronous model call.
   *
   * @param request
   *            the request
   * @param invoker
   *            performs the call
   * @param <O>
   *            the response type
   * @return the response
   * @throws Exception
   *             whatever the invoker or the installed hook throws
   */
  public <O> O call(ModelRequest request, ModelInvoker<O> invoker) throws Exception {
    CallHook current = hook.get();
    if (current == null) {
      return invoker.invoke(request);
    }
    return current.around(request, invoker);
  }

  /**
   * Issues an asynchronous model call.
   *
   * @param request
   *            the request
   * @param invoker
   *            starts the call
   * @param <O>
   *            the response type
   * @return a future completed with the response
   */
  public <O> CompletableFuture<O> callAsync(ModelRequest request, AsyncModelInvoker<O> invoker) {
    CallHook current = hook.get();
    if (current == null) {
      return invoker.invoke(request).toCompletableFuture();
    }
    return current.aroundAsync(request, invoker);
  }

  @Override
  public void install(CallHook callHook) throws TetherException {
    if (!hook.compareAndSet(null, callHook)) {
      throw new TetherException("Call site '" + name + "' already has an active interceptor");
    }
    logger.debug("Installed hook on call site '{}'", name);
  }

  @Override
  public void uninstall(CallHook callHook) {
    if (hook.compareAndSet(callHook, null)) {
      logger.debug("Removed hook from call site '{}'", name);
    }
  }

  @Override
  public boolean isHooked() {
    return hook.get() != null;
  }
}
