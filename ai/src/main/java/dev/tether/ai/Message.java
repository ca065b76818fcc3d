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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Message represents one turn of a conversation sent to a model.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

  @JsonProperty("role")
  private Role role;

  @JsonProperty("content")
  private String content;

  public Message() {
  }

  public Message(Role role, String content) {
    this.role = role;
    this.content = content;
  }

  /**
   * Creates a system message.
   */
  public static Message system(String content) {
    return new Message(Role.SYSTEM, content);
  }

  /**
   * Creates a user message.
   */
  public static Message user(String content) {
    return new Message(Role.USER, content);
  }

  /**
   * Creates an assistant message.
   */
  public static Message assistant(String content) {
    return new Message(Role.ASSISTANT, content);
  }

  /**
   * Creates a tool message.
   */
  public static Message tool(String content) {
    return new Message(Role.TOOL, content);
  }

  public Role getRole() {
    return role;
  }

  public void setRole(Role role) {
    this.role = role;
  }

  public String getContent() {
    return content;
  }

  public void setContent(String content) {
    this.content = content;
  }

  @Override
  public String toString() {
    return "Message{role=" + role + ", content=" + content + "}";
  }
}
