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
package org.apache.tabulary.persistence.api.directory;

import java.util.Optional;
import java.util.UUID;
import org.apache.tabulary.immutables.TabularyImmutable;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.scope.WarehouseStatus;
import org.immutables.value.Value;

@TabularyImmutable
public interface Warehouse {
  WarehouseId id();

  String name();

  @Value.Default
  default WarehouseStatus status() {
    return WarehouseStatus.ACTIVE;
  }

  JsonDocument storageProfile();

  Optional<UUID> storageSecretId();

  @Value.Check
  default void check() {
    if (name().isBlank()) {
      throw new InvalidArgumentException("Warehouse name must not be empty");
    }
  }

  static ImmutableWarehouse.Builder builder() {
    return ImmutableWarehouse.builder();
  }
}
