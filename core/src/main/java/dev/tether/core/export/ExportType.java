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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ExportType selects the sink a finished trace is handed to.
 */
public enum ExportType {
  CONSOLE("console"), JSON("json"), OTLP("otlp"), NONE("none");

  private final String value;

  ExportType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ExportType fromValue(String value) {
    if (value != null) {
      String normalized = value.trim();
      for (ExportType type : values()) {
        if (type.value.equalsIgnoreCase(normalized)) {
          return type;
        }
      }
      if ("noop".equalsIgnoreCase(normalized)) {
        return NONE;
      }
    }
    throw new IllegalArgumentException("Unknown trace export type: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
