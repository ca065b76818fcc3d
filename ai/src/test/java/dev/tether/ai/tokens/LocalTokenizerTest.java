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

package dev.tether.ai.tokens;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.knuddels.jtokkit.api.EncodingType;

/**
 * Unit tests for LocalTokenizer.
 */
class LocalTokenizerTest {

  @Test
  void testCl100k() {
    LocalTokenizer tokenizer = LocalTokenizer.cl100k();

    assertEquals("cl100k_base", tokenizer.getEncodingName());
    assertEquals(4, tokenizer.count("Hello, world!"));
    assertEquals(0, tokenizer.count(""));
  }

  @Test
  void testEncodingsAreCached() {
    assertSame(LocalTokenizer.forEncoding(EncodingType.CL100K_BASE), LocalTokenizer.cl100k());
  }

  @Test
  void testSpecialTokensAreCountedAsText() {
    assertTrue(LocalTokenizer.cl100k().count("<|im_start|>user\nhi<|im_end|>\n") > 3);
  }
}
