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

import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;
import java.time.Instant;
import java.util.Optional;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.ConstraintViolationException;
import org.apache.tabulary.persistence.api.exceptions.NotFoundException;
import org.apache.tabulary.persistence.api.ids.NamespaceId;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.scope.WarehouseStatus;

/**
 * Lifecycle writes for warehouses, namespaces and tables.
 *
 * <p>Creating an entity with an id that already exists, or below a parent that does not exist,
 * fails with {@link ConstraintViolationException}. Updating an entity that does not exist fails
 * with {@link NotFoundException}.
 */
public interface CatalogDirectory {

  void createWarehouse(@Nonnull Warehouse warehouse);

  void setWarehouseStatus(@Nonnull WarehouseId warehouseId, @Nonnull WarehouseStatus status);

  @Nonnull
  Optional<Warehouse> findWarehouse(@Nonnull WarehouseId warehouseId);

  void createNamespace(
      @Nonnull WarehouseId warehouseId, @Nonnull NamespaceId namespaceId, @Nonnull String name);

  /** Creates the registry entry and the metadata row of a table in one transaction. */
  void createTable(
      @Nonnull NamespaceId namespaceId,
      @Nonnull TableId tableId,
      @Nonnull String name,
      @Nonnull JsonDocument metadata,
      @Nullable String metadataLocation);

  /** Replaces the metadata document and the metadata location of a table. */
  void updateTableMetadata(
      @Nonnull TableId tableId, @Nonnull JsonDocument metadata, @Nullable String metadataLocation);

  /** Soft-deletes a table, it stays readable only when deleted tables are requested. */
  void markTableDeleted(@Nonnull TableId tableId, @Nonnull Instant deletedAt);
}
