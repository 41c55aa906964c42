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
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;

/** Identifier of a warehouse, the tenant boundary of the catalog. */
public record WarehouseId(UUID uuid) {
  public WarehouseId {
    requireNonNull(uuid, "uuid");
  }

  public static WarehouseId warehouseId(UUID uuid) {
    return new WarehouseId(uuid);
  }

  public static WarehouseId randomWarehouseId() {
    return new WarehouseId(UUID.randomUUID());
  }

  public static WarehouseId parse(String value) {
    return new WarehouseId(Identifiers.parseUuid(value, "warehouse id", "WarehouseIDIsNotUUID"));
  }

  /**
   * Parses a catalog URL prefix, which for this catalog is the warehouse id.
   *
   * @throws InvalidArgumentException if the prefix is not a UUID
   */
  public static WarehouseId fromPrefix(String prefix) {
    return Identifiers.parseCanonicalUuid(requireNonNull(prefix, "prefix"))
        .map(WarehouseId::new)
        .orElseThrow(
            () ->
                new InvalidArgumentException(
                    "PrefixIsNotWarehouseID",
                    "Provided prefix is not a warehouse id. Expected UUID, got: " + prefix));
  }

  @Override
  public String toString() {
    return uuid.toString();
  }
}
