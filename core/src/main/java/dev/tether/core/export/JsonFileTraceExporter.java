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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.core.JsonUtils;
import dev.tether.core.TetherException;
import dev.tether.core.tracing.Trace;

/**
 * Writes each trace as {@code <run_id>.json} into an output directory, creating
 * the directory on first use.
 */
public class JsonFileTraceExporter implements TraceExporter {

  private static final Logger logger = LoggerFactory.getLogger(JsonFileTraceExporter.class);

  private final Path outputDir;

  public JsonFileTraceExporter(String outputDir) {
    this(Paths.get(outputDir));
  }

  public JsonFileTraceExporter(Path outputDir) {
    this.outputDir = outputDir;
  }

  public Path getOutputDir() {
    return outputDir;
  }

  @Override
  public void export(Trace trace) {
    Path file = outputDir.resolve(trace.getRunId() + ".json");
    try {
      Files.createDirectories(outputDir);
      Files.writeString(file, JsonUtils.toPrettyJson(trace), StandardCharsets.UTF_8);
      logger.debug("Wrote trace {} to {}", trace.getRunId(), file);
    } catch (IOException e) {
      throw new TetherException("Failed to write trace file " + file + ": " + e.getMessage(), e);
    }
  }
}
