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

import java.util.List;

import dev.tether.ai.Message;

/**
 * TokenEstimator is the extension point for model-aware token counting, for
 * example a vendor tokenizer or a counting endpoint. Implementations are
 * discovered with {@link java.util.ServiceLoader} by the {@code auto} and
 * {@code external} backends.
 *
 * <p>
 * Both methods must be pure functions of their arguments.
 */
public interface TokenEstimator {

  /**
   * Counts the tokens of a text.
   *
   * @param text
   *            the text, never empty
   * @param model
   *            the model the text is meant for
   * @return the token count
   */
  int countTokens(String text, String model);

  /**
   * Counts the tokens of a conversation, framing overhead included.
   *
   * @param messages
   *            the conversation, never empty
   * @param model
   *            the model the conversation is meant for
   * @return the token count
   */
  int countMessages(List<Message> messages, String model);
}
