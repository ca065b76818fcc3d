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

package dev.tether.ai;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ModelRequest describes one outbound model call: the model identifier, the
 * conversation and free-form call options.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelRequest {

  @JsonProperty("model")
  private String model;

  @JsonProperty("messages")
  private List<Message> messages;

  @JsonProperty("config")
  private Map<String, Object> config;

  public ModelRequest() {
    this.messages = new ArrayList<>();
    this.config = new HashMap<>();
  }

  public ModelRequest(String model, List<Message> messages) {
    this.model = model;
    this.messages = messages != null ? new ArrayList<>(messages) : new ArrayList<>();
    this.config = new HashMap<>();
  }

  public static Builder builder() {
    return new Builder();
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public List<Message> getMessages() {
    return messages;
  }

  public void setMessages(List<Message> messages) {
    this.messages = messages;
  }

  public Map<String, Object> getConfig() {
    return config;
  }

  public void setConfig(Map<String, Object> config) {
    this.config = config;
  }

  /**
   * Builder for ModelRequest.
   */
  public static class Builder {
    private String model;
    private final List<Message> messages = new ArrayList<>();
    private final Map<String, Object> config = new HashMap<>();

    public Builder model(String model) {
      this.model = model;
      return this;
    }

    public Builder message(Message message) {
      this.messages.add(message);
      return this;
    }

    public Builder messages(List<Message> messages) {
      if (messages != null) {
        this.messages.addAll(messages);
      }
      return this;
    }

    public Builder config(String key, Object value) {
      this.config.put(key, value);
      return this;
    }

    public ModelRequest build() {
      ModelRequest request = new ModelRequest(model, messages);
      request.setConfig(new HashMap<>(config));
      return request;
    }
  }
}
