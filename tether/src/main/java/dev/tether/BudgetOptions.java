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

import dev.tether.ai.intercept.InterceptionBoundary;
import dev.tether.ai.intercept.ModelCallSite;
import dev.tether.ai.pricing.PricingRegistry;
import dev.tether.ai.tokens.TokenCounter;
import dev.tether.core.export.ExportType;
import dev.tether.core.export.TraceExporter;

/**
 * BudgetOptions configures one protected run. Anything left unset falls back
 * to the {@link TetherConfig} the run is created with.
 *
 * <pre>
 * {@code
 * BudgetOptions options = BudgetOptions.builder()
 *     .maxUsd(0.50)
 *     .maxTurns(10)
 *     .onExceed(ExceedPolicy.RETURN_NULL)
 *     .traceExport(ExportType.JSON)
 *     .build();
 * }
 * </pre>
 */
public class BudgetOptions {

  private final Double maxUsd;
  private final Integer maxTurns;
  private final boolean unlimitedTurns;
  private final ExceedPolicy onExceed;
  private final ExportType traceExport;
  private final String traceExportPath;
  private final TraceExporter exporter;
  private final InterceptionBoundary callSite;
  private final Double outputTokenMultiplier;
  private final TokenCounter tokenCounter;
  private final PricingRegistry pricingRegistry;
  private final TetherConfig config;

  private BudgetOptions(Builder builder) {
    this.maxUsd = builder.maxUsd;
    this.maxTurns = builder.maxTurns;
    this.unlimitedTurns = builder.unlimitedTurns;
    this.onExceed = builder.onExceed;
    this.traceExport = builder.traceExport;
    this.traceExportPath = builder.traceExportPath;
    this.exporter = builder.exporter;
    this.callSite = builder.callSite;
    this.outputTokenMultiplier = builder.outputTokenMultiplier;
    this.tokenCounter = builder.tokenCounter;
    this.pricingRegistry = builder.pricingRegistry;
    this.config = builder.config;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns options with every value taken from the environment.
   *
   * @return default options
   */
  public static BudgetOptions defaults() {
    return builder().build();
  }

  /**
   * Returns the configuration used for values this object leaves unset.
   *
   * @return the configuration
   */
  public TetherConfig getConfig() {
    return config;
  }

  /**
   * Returns the dollar ceiling of the run.
   *
   * @return the explicit ceiling, or the configured default
   */
  public double getMaxUsd() {
    return maxUsd != null ? maxUsd : config.getDefaultBudgetUsd();
  }

  /**
   * Returns the turn ceiling of the run.
   *
   * @return the explicit ceiling, the configured default, or null when turns
   *         are unlimited
   */
  public Integer getMaxTurns() {
    if (unlimitedTurns) {
      return null;
    }
    return maxTurns != null ? maxTurns : config.getDefaultMaxTurns();
  }

  public ExceedPolicy getOnExceed() {
    return onExceed;
  }

  public ExportType getTraceExport() {
    return traceExport != null ? traceExport : config.getTraceExport();
  }

  public String getTraceExportPath() {
    return traceExportPath != null ? traceExportPath : config.getTraceExportPath();
  }

  /**
   * Returns an explicit export sink that replaces the one selected by
   * {@link #getTraceExport()}.
   *
   * @return the sink, or null
   */
  public TraceExporter getExporter() {
    return exporter;
  }

  public InterceptionBoundary getCallSite() {
    return callSite;
  }

  public double getOutputTokenMultiplier() {
    return outputTokenMultiplier != null ? outputTokenMultiplier : config.getOutputTokenMultiplier();
  }

  /**
   * Returns the token counter to use instead of one built from the
   * configuration.
   *
   * @return the counter, or null
   */
  public TokenCounter getTokenCounter() {
    return tokenCounter;
  }

  /**
   * Returns the pricing registry to use instead of one built from the
   * configuration.
   *
   * @return the registry, or null
   */
  public PricingRegistry getPricingRegistry() {
    return pricingRegistry;
  }

  /**
   * Builder for BudgetOptions.
   */
  public static class Builder {
    private Double maxUsd;
    private Integer maxTurns;
    private boolean unlimitedTurns;
    private ExceedPolicy onExceed = ExceedPolicy.RAISE;
    private ExportType traceExport;
    private String traceExportPath;
    private TraceExporter exporter;
    private InterceptionBoundary callSite = ModelCallSite.global();
    private Double outputTokenMultiplier;
    private TokenCounter tokenCounter;
    private PricingRegistry pricingRegistry;
    private TetherConfig config;

    public Builder maxUsd(double maxUsd) {
      this.maxUsd = maxUsd;
      return this;
    }

    public Builder maxTurns(int maxTurns) {
      this.maxTurns = maxTurns;
      this.unlimitedTurns = false;
      return this;
    }

    /**
     * Removes the turn ceiling.
     *
     * @return this builder
     */
    public Builder unlimitedTurns() {
      this.maxTurns = null;
      this.unlimitedTurns = true;
      return this;
    }

    public Builder onExceed(ExceedPolicy onExceed) {
      this.onExceed = onExceed;
      return this;
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

    public Builder exporter(TraceExporter exporter) {
      this.exporter = exporter;
      return this;
    }

    public Builder callSite(InterceptionBoundary callSite) {
      this.callSite = callSite;
      return this;
    }

    public Builder outputTokenMultiplier(double outputTokenMultiplier) {
      this.outputTokenMultiplier = outputTokenMultiplier;
      return this;
    }

    public Builder tokenCounter(TokenCounter tokenCounter) {
      this.tokenCounter = tokenCounter;
      return this;
    }

    public Builder pricingRegistry(PricingRegistry pricingRegistry) {
      this.pricingRegistry = pricingRegistry;
      return this;
    }

    public Builder config(TetherConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options
     * @throws IllegalArgumentException
     *             if a ceiling or the multiplier is negative
     */
    public BudgetOptions build() {
      if (maxUsd != null && (maxUsd < 0 || maxUsd.isNaN())) {
        throw new IllegalArgumentException("maxUsd must be non-negative");
      }
      if (maxTurns != null && maxTurns < 0) {
        throw new IllegalArgumentException("maxTurns must be non-negative");
      }
      if (outputTokenMultiplier != null && (outputTokenMultiplier < 0 || outputTokenMultiplier.isNaN())) {
        throw new IllegalArgumentException("outputTokenMultiplier must be non-negative");
      }
      if (onExceed == null) {
        throw new IllegalArgumentException("onExceed is required");
      }
      if (callSite == null) {
        throw new IllegalArgumentException("callSite is required");
      }
      if (config == null) {
        config = TetherConfig.fromEnv();
      }
      return new BudgetOptions(this);
    }
  }
}
