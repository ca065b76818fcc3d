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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

import dev.tether.core.TokenCountException;

/**
 * LocalTokenizer counts tokens with a BPE encoding bundled in JTokkit. Loaded
 * tokenizers are cached for the lifetime of the process.
 */
public final class LocalTokenizer {

  private static final Map<EncodingType, LocalTokenizer> TOKENIZERS = new ConcurrentHashMap<>();
  private static volatile EncodingRegistry registry;

  private final Encoding encoding;

  private LocalTokenizer(Encoding encoding) {
    this.encoding = encoding;
  }

  /**
   * Returns a tokenizer for the cl100k_base encoding.
   *
   * @return the tokenizer
   * @throws TokenCountException
   *             if the encoding cannot be loaded
   */
  public static LocalTokenizer cl100k() {
    return forEncoding(EncodingType.CL100K_BASE);
  }

  /**
   * Returns a tokenizer for the given encoding.
   *
   * @param type
   *            the encoding
   * @return the tokenizer
   * @throws TokenCountException
   *             if the encoding cannot be loaded
   */
  public static LocalTokenizer forEncoding(EncodingType type) {
    try {
      return TOKENIZERS.computeIfAbsent(type, t -> new LocalTokenizer(registry().getEncoding(t)));
    } catch (RuntimeException e) {
      throw new TokenCountException("Failed to load encoding " + type.getName() + ": " + e.getMessage(), null, e);
    }
  }

  private static EncodingRegistry registry() {
    if (registry == null) {
      synchronized (LocalTokenizer.class) {
        if (registry == null) {
          registry = Encodings.newLazyEncodingRegistry();
        }
      }
    }
    return registry;
  }

  public String getEncodingName() {
    return encoding.getName();
  }

  /**
   * Counts tokens, treating special-token markers as ordinary text.
   *
   * @param text
   *            the text
   * @return the token count, 0 for null or empty text
   */
  public int count(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    return encoding.countTokensOrdinary(text);
  }
}
