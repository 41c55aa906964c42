/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.tabulary.persistence.api.document;

import static java.util.Objects.requireNonNull;

import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

/**
 * Opaque structured document, used for table metadata, storage profiles and retention policies.
 *
 * <p>The persistence layer stores and returns documents without interpreting their content. The
 * textual form is produced by {@link #serialize()} when writing to the store and parsed back by
 * {@link #parse(String)} when reading.
 */
public record JsonDocument(JsonNode node) {
  static final ObjectMapper MAPPER = JsonMapper.builder().build();

  public JsonDocument {
    requireNonNull(node, "node");
  }

  public static JsonDocument jsonDocument(JsonNode node) {
    return new JsonDocument(node);
  }

  public static JsonDocument emptyObject() {
    return new JsonDocument(MAPPER.createObjectNode());
  }

  /**
   * Parses the given JSON text.
   *
   * @throws InvalidArgumentException if {@code json} is not a single well-formed JSON value
   */
  public static JsonDocument parse(String json) {
    if (json == null) {
      throw new InvalidArgumentException("JSON document must not be null");
    }
    JsonNode node;
    try {
      node = MAPPER.readTree(json);
    } catch (JacksonException e) {
      throw new InvalidArgumentException(
          InvalidArgumentException.TYPE, "Malformed JSON document: " + e.getOriginalMessage(), e);
    }
    if (node == null || node.isMissingNode()) {
      throw new InvalidArgumentException("JSON document must not be empty");
    }
    return new JsonDocument(node);
  }

  public String serialize() {
    return MAPPER.writeValueAsString(node);
  }

  @Override
  public String toString() {
    return serialize();
  }
}
