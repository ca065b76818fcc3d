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

/**
 * Factory for the built-in trace sinks.
 */
public final class TraceExporters {

  private TraceExporters() {
    // Utility class
  }

  /**
   * Resolves a sink by name.
   *
   * @param type
   *            {@code console}, {@code json}, {@code otlp}, {@code none} or
   *            {@code noop}
   * @param outputDir
   *            the directory used by the JSON sink
   * @return the exporter
   * @throws IllegalArgumentException
   *             if the name is unknown
   */
  public static TraceExporter forType(String type, String outputDir) {
    return forType(ExportType.fromValue(type), outputDir);
  }

  /**
   * Resolves a sink by type.
   *
   * @param type
   *            the export type
   * @param outputDir
   *            the directory used by the JSON sink
   * @return the exporter
   */
  public static TraceExporter forType(ExportType type, String outputDir) {
    switch (type) {
      case CONSOLE :
        return new ConsoleTraceExporter();
      case JSON :
        return new JsonFileTraceExporter(outputDir);
      case OTLP :
        return new OpenTelemetryTraceExporter();
      case NONE :
      default :
        return NoopTraceExporter.INSTANCE;
    }
  }
}
