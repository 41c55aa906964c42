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
package org.apache.tabulary.persistence.api.ids;

import static java.util.Objects.requireNonNull;

import java.util.UUID;

public record NamespaceId(UUID uuid) {
  public NamespaceId {
    requireNonNull(uuid, "uuid");
  }

  public static NamespaceId namespaceId(UUID uuid) {
    return new NamespaceId(uuid);
  }

  public static NamespaceId randomNamespaceId() {
    return new NamespaceId(UUID.randomUUID());
  }

  public static NamespaceId parse(String value) {
    return new NamespaceId(Identifiers.parseUuid(value, "namespace id", "NamespaceIDIsNotUUID"));
  }

  @Override
  public String toString() {
    return uuid.toString();
  }
}
