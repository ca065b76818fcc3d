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

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dev.tether.ai.Message;
import dev.tether.ai.Role;
import dev.tether.core.TokenCountException;

/**
 * TokenCounter estimates how many tokens a text or a conversation will cost.
 *
 * <p>
 * Counts are advisory: they feed the admission check before a call, while the
 * model's own usage report is authoritative afterwards. The local backend is
 * an OpenAI tokenizer, so counts for other model families are approximations;
 * such models are logged once and listed by {@link #getApproximatedModels()}.
 */
public class TokenCounter {

  private static final Logger logger = LoggerFactory.getLogger(TokenCounter.class);

  static final String DEFAULT_MODEL = "gpt-4o";
  static final int CONVERSATION_OVERHEAD = 3;
  private static final String[] FOREIGN_FAMILIES = {"claude", "gemini", "llama", "mistral", "mixtral"};

  private final TokenCounterBackend backend;
  private final TokenEstimator estimator;
  private final Set<String> approximatedModels = ConcurrentHashMap.newKeySet();
  private volatile LocalTokenizer localTokenizer;

  /**
   * Creates a counter with the {@code auto} backend.
   */
  public TokenCounter() {
    this(TokenCounterBackend.AUTO);
  }

  /**
   * Creates a counter. The {@code auto} and {@code external} backends look for
   * a {@link TokenEstimator} with {@link ServiceLoader}.
   *
   * @param backend
   *            the backend
   * @throws TokenCountException
   *             if the backend is external and no estimator is available, or
   *             the local tokenizer cannot be loaded
   */
  public TokenCounter(TokenCounterBackend backend) {
    this(backend, backend == TokenCounterBackend.LOCAL ? null : discoverEstimator());
  }

  /**
   * Creates a counter with an explicit estimator.
   *
   * @param backend
   *            the backend
   * @param estimator
   *            the external estimator, may be null
   * @throws TokenCountException
   *             if the backend is external and the estimator is null, or the
   *             local tokenizer cannot be loaded
   */
  public TokenCounter(TokenCounterBackend backend, TokenEstimator estimator) {
    TokenCounterBackend requested = backend != null ? backend : TokenCounterBackend.AUTO;
    if (requested == TokenCounterBackend.AUTO) {
      requested = estimator != null ? TokenCounterBackend.EXTERNAL : TokenCounterBackend.LOCAL;
    }
    if (requested == TokenCounterBackend.EXTERNAL && estimator == null) {
      throw new TokenCountException("No external token estimator available");
    }
    this.backend = requested;
    this.estimator = requested == TokenCounterBackend.EXTERNAL ? estimator : null;
    if (requested == TokenCounterBackend.LOCAL) {
      this.localTokenizer = LocalTokenizer.cl100k();
    }
    logger.debug("Token counter using {} backend", this.backend);
  }

  private static TokenEstimator discoverEstimator() {
    Iterator<TokenEstimator> it = ServiceLoader.load(TokenEstimator.class).iterator();
    return it.hasNext() ? it.next() : null;
  }

  /**
   * Counts the tokens of a text with a one-shot counter.
   */
  public static int countTokens(String text, String model, TokenCounterBackend backend) {
    return new TokenCounter(backend).countTokens(text, model);
  }

  /**
   * Counts the tokens of a conversation with a one-shot counter.
   */
  public static int countMessages(List<Message> messages, String model, TokenCounterBackend backend) {
    return new TokenCounter(backend).countMessages(messages, model);
  }

  /**
   * Returns the resolved backend, never {@code auto}.
   *
   * @return the backend in use
   */
  public TokenCounterBackend getBackend() {
    return backend;
  }

  /**
   * Returns the models whose counts were approximated with the local tokenizer.
   *
   * @return an unmodifiable view
   */
  public Set<String> getApproximatedModels() {
    return Collections.unmodifiableSet(approximatedModels);
  }

  public int countTokens(String text) {
    return countTokens(text, DEFAULT_MODEL);
  }

  /**
   * Counts the tokens of a text.
   *
   * @param text
   *            the text
   * @param model
   *            the model the text is meant for
   * @return the token count, 0 for empty text
   * @throws TokenCountException
   *             if the backend fails
   */
  public int countTokens(String text, String model) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    if (backend == TokenCounterBackend.EXTERNAL) {
      try {
        return estimator.countTokens(text, model);
      } catch (RuntimeException e) {
        logger.warn("External token estimator failed for {}, falling back to local tokenizer: {}", model,
            e.getMessage());
      }
    }
    return countLocal(text, model);
  }

  public int countMessages(List<Message> messages) {
    return countMessages(messages, DEFAULT_MODEL);
  }

  /**
   * Counts the tokens of a conversation. Each message is framed with its role
   * markers and a fixed overhead is added per conversation, so the result is
   * always greater than the count of the bare contents. Null entries are
   * skipped.
   *
   * @param messages
   *            the conversation
   * @param model
   *            the model the conversation is meant for
   * @return the token count, 0 for an empty conversation
   * @throws TokenCountException
   *             if the backend fails
   */
  public int countMessages(List<Message> messages, String model) {
    if (messages == null || messages.isEmpty()) {
      return 0;
    }
    if (backend == TokenCounterBackend.EXTERNAL) {
      try {
        return estimator.countMessages(messages, model);
      } catch (RuntimeException e) {
        logger.warn("External token estimator failed for {}, falling back to local tokenizer: {}", model,
            e.getMessage());
      }
    }
    return countMessagesLocal(messages, model);
  }

  private int countLocal(String text, String model) {
    warnIfApproximate(model);
    return tokenizer().count(text);
  }

  private int countMessagesLocal(List<Message> messages, String model) {
    warnIfApproximate(model);
    LocalTokenizer tokenizer = tokenizer();
    int total = 0;
    for (Message message : messages) {
      if (message == null) {
        continue;
      }
      Role role = message.getRole() != null ? message.getRole() : Role.USER;
      String content = message.getContent() != null ? message.getContent() : "";
      total += tokenizer.count("<|im_start|>" + role.getValue() + "\n" + content + "<|im_end|>\n");
    }
    return total + CONVERSATION_OVERHEAD;
  }

  private LocalTokenizer tokenizer() {
    LocalTokenizer tokenizer = localTokenizer;
    if (tokenizer == null) {
      tokenizer = LocalTokenizer.cl100k();
      localTokenizer = tokenizer;
    }
    return tokenizer;
  }

  private void warnIfApproximate(String model) {
    if (model == null || !isForeignFamily(model)) {
      return;
    }
    if (approximatedModels.add(model)) {
      logger.warn("Using the local cl100k_base tokenizer for {}. Token counts for this model family are "
          + "approximate.", model);
    }
  }

  static boolean isForeignFamily(String model) {
    String normalized = model.trim().toLowerCase(Locale.ROOT);
    for (String family : FOREIGN_FAMILIES) {
      if (normalized.startsWith(family)) {
        return true;
      }
    }
    return false;
  }
}
