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
 * The closed set of error kinds raised by Tether.
 */
public enum TetherErrorCode {
  /** Admission or commit would breach the run's dollar ceiling. */
  BUDGET_EXCEEDED,
  /** The run reached its maximum number of calls. */
  TURN_LIMIT_EXCEEDED,
  /** A token estimation backend failed. */
  TOKEN_COUNT_FAILURE,
  /** No pricing source knows the model. */
  UNKNOWN_MODEL
}
