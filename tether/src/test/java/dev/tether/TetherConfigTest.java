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

package dev.tether;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dev.tether.ai.pricing.PricingSource;
import dev.tether.ai.tokens.TokenCounterBackend;
import dev.tether.core.export.ExportType;

/**
 * Unit tests for TetherConfig.
 */
class TetherConfigTest {

  @Test
  void testHardDefaults() {
    TetherConfig config = TetherConfig.fromEnv(Collections.emptyMap());

    assertEquals(10.0, config.getDefaultBudgetUsd());
    assertEquals(50, config.getDefaultMaxTurns());
    assertEquals(TokenCounterBackend.AUTO, config.getTokenCounterBackend());
    assertEquals(PricingSource.BUNDLED, config.getPricingSource());
    assertEquals(ExportType.CONSOLE, config.getTraceExport());
    assertEquals("./traces/", config.getTraceExportPath());
    assertEquals(1.0, config.getOutputTokenMultiplier());
  }

  @Test
  void testEnvironmentOverridesDefaults() {
    Map<String, String> env = new HashMap<>();
    env.put(TetherConfig.ENV_DEFAULT_BUDGET_USD, "2.5");
    env.put(TetherConfig.ENV_DEFAULT_MAX_TURNS, " 7 ");
    env.put(TetherConfig.ENV_TOKEN_COUNTER_BACKEND, "LOCAL");
    env.put(TetherConfig.ENV_PRICING_SOURCE, "external");
    env.put(TetherConfig.ENV_TRACE_EXPORT, "json");
    env.put(TetherConfig.ENV_TRACE_EXPORT_PATH, "/var/tmp/traces");
    env.put(TetherConfig.ENV_OUTPUT_TOKEN_MULTIPLIER, "0.5");

    TetherConfig config = TetherConfig.fromEnv(env);

    assertEquals(2.5, config.getDefaultBudgetUsd());
    assertEquals(7, config.getDefaultMaxTurns());
    assertEquals(TokenCounterBackend.LOCAL, config.getTokenCounterBackend());
    assertEquals(PricingSource.EXTERNAL, config.getPricingSource());
    assertEquals(ExportType.JSON, config.getTraceExport());
    assertEquals("/var/tmp/traces", config.getTraceExportPath());
    assertEquals(0.5, config.getOutputTokenMultiplier());
  }

  @Test
  void testInvalidEnvironmentValuesFallBack() {
    Map<String, String> env = new HashMap<>();
    env.put(TetherConfig.ENV_DEFAULT_BUDGET_USD, "ten dollars");
    env.put(TetherConfig.ENV_DEFAULT_MAX_TURNS, "-3");
    env.put(TetherConfig.ENV_TOKEN_COUNTER_BACKEND, "tiktoken");
    env.put(TetherConfig.ENV_PRICING_SOURCE, "");
    env.put(TetherConfig.ENV_TRACE_EXPORT, "xml");
    env.put(TetherConfig.ENV_TRACE_EXPORT_PATH, "  ");
    env.put(TetherConfig.ENV_OUTPUT_TOKEN_MULTIPLIER, "NaN");

    TetherConfig config = TetherConfig.fromEnv(env);

    assertEquals(10.0, config.getDefaultBudgetUsd());
    assertEquals(50, config.getDefaultMaxTurns());
    assertEquals(TokenCounterBackend.AUTO, config.getTokenCounterBackend());
    assertEquals(PricingSource.BUNDLED, config.getPricingSource());
    assertEquals(ExportType.CONSOLE, config.getTraceExport());
    assertEquals("./traces/", config.getTraceExportPath());
    assertEquals(1.0, config.getOutputTokenMultiplier());
  }

  @Test
  void testExplicitValuesWinOverEnvironment() {
    Map<String, String> env = new HashMap<>();
    env.put(TetherConfig.ENV_DEFAULT_BUDGET_USD, "2.5");
    env.put(TetherConfig.ENV_TRACE_EXPORT, "json");

    TetherConfig config = TetherConfig.builder(env).defaultBudgetUsd(0.75).traceExport("noop")
        .pricingSource("bundled").tokenCounterBackend("local").build();

    assertEquals(0.75, config.getDefaultBudgetUsd());
    assertEquals(ExportType.NONE, config.getTraceExport());
    assertEquals(TokenCounterBackend.LOCAL, config.getTokenCounterBackend());
  }

  @Test
  void testExplicitValuesAreValidated() {
    Map<String, String> env = Collections.emptyMap();

    assertThrows(IllegalArgumentException.class, () -> TetherConfig.builder(env).defaultBudgetUsd(-1).build());
    assertThrows(IllegalArgumentException.class, () -> TetherConfig.builder(env).defaultMaxTurns(-1).build());
    assertThrows(IllegalArgumentException.class,
        () -> TetherConfig.builder(env).outputTokenMultiplier(-0.1).build());
    assertThrows(IllegalArgumentException.class, () -> TetherConfig.builder(env).traceExport("xml"));
    assertThrows(IllegalArgumentException.class, () -> TetherConfig.builder(env).traceExportPath("").build());
  }

  @Test
  void testFromProcessEnvironment() {
    assertNotNull(TetherConfig.fromEnv());
  }
}
