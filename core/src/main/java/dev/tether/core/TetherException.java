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
 * TetherException is the base exception for all Tether errors. It provides
 * structured error information including an error code, details and the run
 * the error belongs to.
 *
 * <p>
 * Lifecycle misuse (for example activating an interceptor twice) is reported
 * with a plain TetherException whose error code is {@code null}. Budget, turn,
 * token counting and pricing conditions use the typed subclasses.
 */
public class TetherException extends RuntimeException {

  private final TetherErrorCode errorCode;
  private final Object details;
  private final String runId;

  /**
   * Creates a new TetherException.
   *
   * @param message
   *            the error message
   */
  public TetherException(String message) {
    this(message, null, null, null, null);
  }

  /**
   * Creates a new TetherException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public TetherException(String message, Throwable cause) {
    this(message, cause, null, null, null);
  }

  /**
   * Creates a new TetherException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   * @param runId
   *            the run the error belongs to
   */
  public TetherException(String message, Throwable cause, TetherErrorCode errorCode, Object details,
      String runId) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
    this.runId = runId;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public TetherErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Returns the run ID for this error.
   *
   * @return the run ID, or null if not set
   */
  public String getRunId() {
    return runId;
  }

  /**
   * Creates a builder for TetherException.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for TetherException.
   */
  public static class Builder {
    private String message;
    private Throwable cause;
    private TetherErrorCode errorCode;
    private Object details;
    private String runId;

    public Builder message(String message) {
      this.message = message;
      return this;
    }

    public Builder cause(Throwable cause) {
      this.cause = cause;
      return this;
    }

    public Builder errorCode(TetherErrorCode errorCode) {
      this.errorCode = errorCode;
      return this;
    }

    public Builder details(Object details) {
      this.details = details;
      return this;
    }

    public Builder runId(String runId) {
      this.runId = runId;
      return this;
    }

    public TetherException build() {
      if (message == null || message.isEmpty()) {
        throw new IllegalStateException("message is required");
      }
      return new TetherException(message, cause, errorCode, details, runId);
    }
  }
}
