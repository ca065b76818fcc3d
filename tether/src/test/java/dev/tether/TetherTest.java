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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import dev.tether.ai.Message;
import dev.tether.ai.ModelRequest;
import dev.tether.ai.ModelResponse;
import dev.tether.ai.intercept.ModelCallSite;
import dev.tether.core.BudgetExceededException;
import dev.tether.core.tracing.Trace;

/**
 * Unit tests for the Tether entry points.
 */
class TetherTest {

  private ModelCallSite callSite;
  private List<Trace> exported;
  private BudgetOptions options;
  private ModelRequest request;

  @BeforeEach
  void setUp() {
    callSite = new ModelCallSite("test");
    exported = Collections.synchronizedList(new ArrayList<>());
    options = BudgetOptions.builder().config(TetherConfig.fromEnv(Collections.emptyMap())).maxUsd(0.01)
        .callSite(callSite).exporter(exported::add).build();
    request = ModelRequest.builder().model("gpt-4o").message(Message.user("hello")).build();
  }

  private String callModel() throws Exception {
    return callSite.call(request, req -> ModelResponse.of("hi", 1000, 500)).getText();
  }

  @Test
  void testEnforceBudget() throws Exception {
    assertEquals("hi", Tether.enforceBudget(options, this::callModel));
    assertEquals(1, exported.size());
    assertFalse(callSite.isHooked());
  }

  @Test
  void testEnforceBudgetRaises() {
    assertThrows(BudgetExceededException.class, () -> Tether.enforceBudget(options, () -> {
      callModel();
      callModel();
      return callModel();
    }));
  }

  @Test
  void testWrapStartsAFreshRunPerInvocation() throws Exception {
    UnitOfWork<String> budgeted = Tether.wrap(options, this::callModel);

    assertEquals("hi", budgeted.run());
    assertEquals("hi", budgeted.run());

    assertEquals(2, exported.size());
    assertNotEquals(exported.get(0).getRunId(), exported.get(1).getRunId());
    assertEquals(1, exported.get(1).getBudgetSummary().getTurnCount());
  }

  @Test
  void testEnforceBudgetAsync() throws Exception {
    CompletableFuture<String> future = Tether.enforceBudgetAsync(options,
        () -> callSite.callAsync(request, req -> CompletableFuture.completedFuture(ModelResponse.of("hi", 10, 5)))
            .thenApply(ModelResponse::getText));

    assertEquals("hi", future.get(10, TimeUnit.SECONDS));
    assertEquals(1, exported.size());
  }

  @Test
  void testBudgetOptionsFallBackToConfig() {
    TetherConfig config = TetherConfig.builder(Collections.emptyMap()).defaultBudgetUsd(3.0).defaultMaxTurns(4)
        .outputTokenMultiplier(1.5).build();

    BudgetOptions defaults = BudgetOptions.builder().config(config).build();

    assertEquals(3.0, defaults.getMaxUsd());
    assertEquals(4, defaults.getMaxTurns());
    assertEquals(1.5, defaults.getOutputTokenMultiplier());
    assertEquals(ExceedPolicy.RAISE, defaults.getOnExceed());
    assertSame(ModelCallSite.global(), defaults.getCallSite());
    assertEquals("./traces/", defaults.getTraceExportPath());
  }

  @Test
  void testBudgetOptionsValidation() {
    assertThrows(IllegalArgumentException.class, () -> BudgetOptions.builder().maxUsd(-1).build());
    assertThrows(IllegalArgumentException.class, () -> BudgetOptions.builder().maxTurns(-1).build());
    assertThrows(IllegalArgumentException.class, () -> BudgetOptions.builder().onExceed(null).build());
    assertThrows(IllegalArgumentException.class, () -> BudgetOptions.builder().callSite(null).build());
  }
}
