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

package dev.tether.core.export;

import dev.tether.core.tracing.Trace;

/**
 * TraceExporter hands a finished trace to a sink. Implementations must not
 * mutate the trace.
 */
@FunctionalInterface
public interface TraceExporter {

  /**
   * Exports a finished trace.
   *
   * @param trace
   *            the trace to export
   */
  void export(Trace trace);
}
