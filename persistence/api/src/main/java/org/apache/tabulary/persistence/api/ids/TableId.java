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

/** Stable identifier of a table, shared with the table's tabular registry entry. */
public record TableId(UUID uuid) {
  public TableId {
    requireNonNull(uuid, "uuid");
  }

  public static TableId tableId(UUID uuid) {
    return new TableId(uuid);
  }

  public static TableId randomTableId() {
    return new TableId(UUID.randomUUID());
  }

  /**
   * Parses the string representation of a table id.
   *
   * @throws org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException if {@code
   *     value} is not a UUID
   */
  public static TableId parse(String value) {
    return new TableId(Identifiers.parseUuid(value, "table id", "TableIDIsNotUUID"));
  }

  @Override
  public String toString() {
    return uuid.toString();
  }
}
