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

import dev.tether.core.TetherException;

/**
 * InterceptionBoundary is a place where outbound model calls can be wrapped. At
 * most one hook is installed at a time; installing a second one fails fast.
 */
public interface InterceptionBoundary {

  /**
   * Installs a hook.
   *
   * @param hook
   *            the hook
   * @throws TetherException
   *             if a hook is already installed
   */
  void install(CallHook hook) throws TetherException;

  /**
   * Removes a hook, restoring the unhooked state. Does nothing if the hook is
   * not the installed one.
   *
   * @param hook
   *            the hook
   */
  void uninstall(CallHook hook);

  /**
   * Returns whether a hook is installed.
   *
   * @return true if calls are currently wrapped
   */
  boolean isHooked();
}
