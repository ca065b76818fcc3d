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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.ai.pricing.PricingSource;
import dev.tether.ai.tokens.TokenCounterBackend;
import dev.tether.core.export.ExportType;

/**
 * TetherConfig holds the process-level defaults for budgeted runs. Builder
 * values start from environment variables and fall back to hard defaults when
 * a variable is absent or cannot be parsed.
 *
 * <table>
 * <caption>Environment variables</caption>
 * <tr><td>{@value #ENV_DEFAULT_BUDGET_USD}</td><td>10.0</td></tr>
 * <tr><td>{@value #ENV_DEFAULT_MAX_TURNS}</td><td>50</td></tr>
 * <tr><td>{@value #ENV_TOKEN_COUNTER_BACKEND}</td><td>auto</td></tr>
 * <tr><td>{@value #ENV_PRICING_SOURCE}</td><td>bundled</td></tr>
 * <tr><td>{@value #ENV_TRACE_EXPORT}</td><td>console</td></tr>
 * <tr><td>{@value #ENV_TRACE_EXPORT_PATH}</td><td>./traces/</td></tr>
 * <tr><td>{@value #ENV_OUTPUT_TOKEN_MULTIPLIER}</td><td>1.0</td></tr>
 * </table>
 */
public class TetherConfig {

  private static final Logger logger = LoggerFactory.getLogger(TetherConfig.class);

  public static final String ENV_DEFAULT_BUDGET_USD = "TETHER_DEFAULT_BUDGET_USD";
  public static final String ENV_DEFAULT_MAX_TURNS = "TETHER_DEFAULT_MAX_TURNS";
  public static final String ENV_TOKEN_COUNTER_BACKEND = "TETHER_TOKEN_COUNTER_BACKEND";
  public static final String ENV_PRICING_SOURCE = "TETHER_PRICING_SOURCE";
  public static final String ENV_TRACE_EXPORT = "TETHER_TRACE_EXPORT";
  public static final String ENV_TRACE_EXPORT_PATH = "TETHER_TRACE_EXPORT_PATH";
  public static final String ENV_OUTPUT_TOKEN_MULTIPLIER = "TETHER_OUTPUT_TOKEN_MULTIPLIER";

  public static final double DEFAULT_BUDGET_USD = 10.0;
  public static final int DEFAULT_MAX_TURNS = 50;
  public static final String DEFAULT_TRACE_EXPORT_PATH = "./traces/";
  public static final double DEFAULT_OUTPUT_TOKEN_MULTIPLIER = 1.0;

  private final double defaultBudgetUsd;
  private final int defaultMaxTurns;
  private final TokenCounterBackend tokenCounterBackend;
  private final PricingSource pricingSource;
  private final ExportType traceExport;
  private final String traceExportPath;
  private final double outputTokenMultiplier;

  private TetherConfig(Builder builder) {
    this.defaultBudgetUsd = builder.defaultBudgetUsd;
    this.defaultMaxTurns = builder.defaultMaxTurns;
    this.tokenCounterBackend = builder.tokenCounterBackend;
    this.pricingSource = builder.pricingSource;
    this.traceExport = builder.traceExport;
    this.traceExportPath = builder.traceExportPath;
    this.outputTokenMultiplier = builder.outputTokenMultiplier;
  }

  /**
   * Creates a builder seeded from the process environment.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder(System.getenv());
  }

  /**
   * Creates a builder seeded from the given variables.
   *
   * @param env
   *            environment variables by name
   * @return a new builder
   */
  public static Builder builder(Map<String, String> env) {
    return new Builder(env);
  }

  /**
   * Reads the configuration from the process environment.
   *
   * @return the configuration
   */
  public static TetherConfig fromEnv() {
    return builder().build();
  }

  /**
   * Reads the configuration from the given variables.
   *
   * @param env
   *            environment variables by name
   * @return the configuration
   */
  public static TetherConfig fromEnv(Map<String, String> env) {
    return builder(env).build();
  }

  /**
   * Returns the dollar ceiling used when a run does not set one.
   *
   * @return the default budget in USD
   */
  public double getDefaultBudgetUsd() {
    return defaultBudgetUsd;
  }

  /**
   * Returns the turn ceiling used when a run does not set one.
   *
   * @return the default max turns
   */
  public int getDefaultMaxTurns() {
    return defaultMaxTurns;
  }

  public TokenCounterBackend getTokenCounterBackend() {
    return tokenCounterBackend;
  }

  public PricingSource getPricingSource() {
    return pricingSource;
  }

  public ExportType getTraceExport() {
    return traceExport;
  }

  public String getTraceExportPath() {
    return traceExportPath;
  }

  /**
   * Returns the projected output tokens per estimated input token used for the
   * admission estimate. This is a heuristic, not a measured ratio.
   *
   * @return the multiplier
   */
  public double getOutputTokenMultiplier() {
    return outputTokenMultiplier;
  }

  @Override
  public String toString() {
    return "TetherConfig{defaultBudgetUsd=" + defaultBudgetUsd + ", defaultMaxTurns=" + defaultMaxTurns
        + ", tokenCounterBackend=" + tokenCounterBackend + ", pricingSource=" + pricingSource + ", traceExport="
        + traceExport + ", traceExportPath=" + traceExportPath + ", outputTokenMultiplier=" + outputTokenMultiplier
        + "}";
  }

  /**
   * Builder for TetherConfig.
   */
  public static class Builder {
    private double defaultBudgetUsd;
    private int defaultMaxTurns;
    private TokenCounterBackend tokenCounterBackend;
    private PricingSource pricingSource;
    private ExportType traceExport;
    private String traceExportPath;
    private double outputTokenMultiplier;

    private Builder(Map<String, String> env) {
      this.defaultBudgetUsd = readDouble(env, ENV_DEFAULT_BUDGET_USD, DEFAULT_BUDGET_USD);
      this.defaultMaxTurns = readInt(env, ENV_DEFAULT_MAX_TURNS, DEFAULT_MAX_TURNS);
      this.tokenCounterBackend = readBackend(env);
      this.pricingSource = readPricingSource(env);
      this.traceExport = readExportType(env);
      String path = env.get(ENV_TRACE_EXPORT_PATH);
      this.traceExportPath = path != null && !path.trim().isEmpty() ? path.trim() : DEFAULT_TRACE_EXPORT_PATH;
      this.outputTokenMultiplier = readDouble(env, ENV_OUTPUT_TOKEN_MULTIPLIER, DEFAULT_OUTPUT_TOKEN_MULTIPLIER);
    }

    private static double readDouble(Map<String, String> env, String name, double defaultValue) {
      String raw = env.get(name);
      if (raw != null) {
        try {
          double value = Double.parseDouble(raw.trim());
          if (value >= 0 && !Double.isInfinite(value)) {
            return value;
          }
        } catch (NumberFormatException e) {
          // fall through to default
        }
        logger.warn("Ignoring invalid {}={}, using {}", name, raw, defaultValue);
      }
      return defaultValue;
    }

    private static int readInt(Map<String, String> env, String name, int defaultValue) {
      String raw = env.get(name);
      if (raw != null) {
        try {
          int value = Integer.parseInt(raw.trim());
          if (value >= 0) {
            return value;
          }
        } catch (NumberFormatException e) {
          // fall through to default
        }
        logger.warn("Ignoring invalid {}={}, using {}", name, raw, defaultValue);
      }
      return defaultValue;
    }

    private static TokenCounterBackend readBackend(Map<String, String> env) {
      String raw = env.get(ENV_TOKEN_COUNTER_BACKEND);
      if (raw != null) {
        try {
          return TokenCounterBackend.fromValue(raw);
        } catch (IllegalArgumentException e) {
          logger.warn("Ignoring invalid {}={}, using auto", ENV_TOKEN_COUNTER_BACKEND, raw);
        }
      }
      return TokenCounterBackend.AUTO;
    }

    private static PricingSource readPricingSource(Map<String, String> env) {
      String raw = env.get(ENV_PRICING_SOURCE);
      if (raw != null) {
        try {
          return PricingSource.fromValue(raw);
        } catch (IllegalArgumentException e) {
          logger.warn("Ignoring invalid {}={}, using bundled", ENV_PRICING_SOURCE, raw);
        }
      }
      return PricingSource.BUNDLED;
    }

    private static ExportType readExportType(Map<String, String> env) {
      String raw = env.get(ENV_TRACE_EXPORT);
      if (raw != null) {
        try {
          return ExportType.fromValue(raw);
        } catch (IllegalArgumentException e) {
          logger.warn("Ignoring invalid {}={}, using console", ENV_TRACE_EXPORT, raw);
        }
      }
      return ExportType.CONSOLE;
    }

    public Builder defaultBudgetUsd(double defaultBudgetUsd) {
      this.defaultBudgetUsd = defaultBudgetUsd;
      return this;
    }

    public Builder defaultMaxTurns(int defaultMaxTurns) {
      this.defaultMaxTurns = defaultMaxTurns;
      return this;
    }

    public Builder tokenCounterBackend(TokenCounterBackend tokenCounterBackend) {
      this.tokenCounterBackend = tokenCounterBackend;
      return this;
    }

    public Builder tokenCounterBackend(String tokenCounterBackend) {
      return tokenCounterBackend(TokenCounterBackend.fromValue(tokenCounterBackend));
    }

    public Builder pricingSource(PricingSource pricingSource) {
      this.pricingSource = pricingSource;
      return this;
    }

    public Builder pricingSource(String pricingSource) {
      return pricingSource(PricingSource.fromValue(pricingSource));
    }

    public Builder traceExport(ExportType traceExport) {
      this.traceExport = traceExport;
      return this;
    }

    public Builder traceExport(String traceExport) {
      return traceExport(ExportType.fromValue(traceExport));
    }

    public Builder traceExportPath(String traceExportPath) {
      this.traceExportPath = traceExportPath;
      return this;
    }

    public Builder outputTokenMultiplier(double outputTokenMultiplier) {
      this.outputTokenMultiplier = outputTokenMultiplier;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException
     *             if a numeric value is negative or a required value is
     *             missing
     */
    public TetherConfig build() {
      if (defaultBudgetUsd < 0 || Double.isNaN(defaultBudgetUsd)) {
        throw new IllegalArgumentException("defaultBudgetUsd must be non-negative");
      }
      if (defaultMaxTurns < 0) {
        throw new IllegalArgumentException("defaultMaxTurns must be non-negative");
      }
      if (outputTokenMultiplier < 0 || Double.isNaN(outputTokenMultiplier)) {
        throw new IllegalArgumentException("outputTokenMultiplier must be non-negative");
      }
      if (tokenCounterBackend == null || pricingSource == null || traceExport == null) {
        throw new IllegalArgumentException("tokenCounterBackend, pricingSource and traceExport are required");
      }
      if (traceExportPath == null || traceExportPath.isEmpty()) {
        throw new IllegalArgumentException("traceExportPath is required");
      }
      return new TetherConfig(this);
    }
  }
}
