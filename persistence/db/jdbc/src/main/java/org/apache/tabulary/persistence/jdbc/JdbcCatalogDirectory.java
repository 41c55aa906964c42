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
package org.apache.tabulary.persistence.jdbc;

import static java.util.Objects.requireNonNull;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.FIND_WAREHOUSE;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.INSERT_NAMESPACE;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.INSERT_TABLE;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.INSERT_TABULAR;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.INSERT_WAREHOUSE;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.MARK_TABULAR_DELETED;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.UPDATE_TABLE_METADATA;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.UPDATE_TABULAR_LOCATION;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.UPDATE_WAREHOUSE_STATUS;

import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.apache.tabulary.persistence.api.directory.CatalogDirectory;
import org.apache.tabulary.persistence.api.directory.Warehouse;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.exceptions.NotFoundException;
import org.apache.tabulary.persistence.api.ids.NamespaceId;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.scope.WarehouseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JdbcCatalogDirectory implements CatalogDirectory {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcCatalogDirectory.class);

  private final JdbcOperations operations;

  JdbcCatalogDirectory(JdbcOperations operations) {
    this.operations = operations;
  }

  @Override
  public void createWarehouse(@Nonnull Warehouse warehouse) {
    LOGGER.debug("create warehouse {} '{}'", warehouse.id(), warehouse.name());
    operations.withConnectionVoid(
        "create warehouse",
        conn -> {
          try (var ps = conn.prepareStatement(INSERT_WAREHOUSE)) {
            var idx = 1;
            ps.setString(idx++, warehouse.id().toString());
            ps.setString(idx++, warehouse.name());
            ps.setString(idx++, warehouse.status().value());
            ps.setString(idx++, warehouse.storageProfile().serialize());
            ps.setString(idx, warehouse.storageSecretId().map(UUID::toString).orElse(null));
            ps.executeUpdate();
          }
        });
  }

  @Override
  public void setWarehouseStatus(
      @Nonnull WarehouseId warehouseId, @Nonnull WarehouseStatus status) {
    requireNonNull(status, "status");
    LOGGER.debug("set status of warehouse {} to {}", warehouseId, status.value());
    operations.withConnectionVoid(
        "set warehouse status",
        conn -> {
          try (var ps = conn.prepareStatement(UPDATE_WAREHOUSE_STATUS)) {
            ps.setString(1, status.value());
            ps.setString(2, warehouseId.toString());
            requireUpdated(ps, "Warehouse " + warehouseId);
          }
        });
  }

  @Nonnull
  @Override
  public Optional<Warehouse> findWarehouse(@Nonnull WarehouseId warehouseId) {
    return operations.withConnection(
        true,
        "find warehouse",
        conn -> {
          try (var ps = conn.prepareStatement(FIND_WAREHOUSE)) {
            ps.setString(1, warehouseId.toString());
            try (var rs = ps.executeQuery()) {
              if (!rs.next()) {
                return Optional.empty();
              }
              return Optional.of(
                  Warehouse.builder()
                      .id(WarehouseId.parse(rs.getString(1)))
                      .name(rs.getString(2))
                      .status(WarehouseStatus.fromValue(rs.getString(3)))
                      .storageProfile(JsonDocument.parse(rs.getString(4)))
                      .storageSecretId(Optional.ofNullable(rs.getString(5)).map(UUID::fromString))
                      .build());
            }
          }
        });
  }

  @Override
  public void createNamespace(
      @Nonnull WarehouseId warehouseId, @Nonnull NamespaceId namespaceId, @Nonnull String name) {
    requireName(name, "Namespace");
    LOGGER.debug("create namespace {} '{}' in warehouse {}", namespaceId, name, warehouseId);
    operations.withConnectionVoid(
        "create namespace",
        conn -> {
          try (var ps = conn.prepareStatement(INSERT_NAMESPACE)) {
            ps.setString(1, namespaceId.toString());
            ps.setString(2, warehouseId.toString());
            ps.setString(3, name);
            ps.executeUpdate();
          }
        });
  }

  @Override
  public void createTable(
      @Nonnull NamespaceId namespaceId,
      @Nonnull TableId tableId,
      @Nonnull String name,
      @Nonnull JsonDocument metadata,
      @Nullable String metadataLocation) {
    requireName(name, "Table");
    LOGGER.debug("create table {} '{}' in namespace {}", tableId, name, namespaceId);
    operations.withConnectionVoid(
        "create table",
        conn -> {
          try (var ps = conn.prepareStatement(INSERT_TABULAR)) {
            ps.setString(1, tableId.toString());
            ps.setString(2, namespaceId.toString());
            ps.setString(3, name);
            ps.setString(4, metadataLocation);
            ps.executeUpdate();
          }
          try (var ps = conn.prepareStatement(INSERT_TABLE)) {
            ps.setString(1, tableId.toString());
            ps.setString(2, metadata.serialize());
            ps.executeUpdate();
          }
        });
  }

  @Override
  public void updateTableMetadata(
      @Nonnull TableId tableId, @Nonnull JsonDocument metadata, @Nullable String metadataLocation) {
    operations.withConnectionVoid(
        "update table metadata",
        conn -> {
          try (var ps = conn.prepareStatement(UPDATE_TABLE_METADATA)) {
            ps.setString(1, metadata.serialize());
            ps.setString(2, tableId.toString());
            requireUpdated(ps, "Table " + tableId);
          }
          updateTabular(conn, UPDATE_TABULAR_LOCATION, tableId, metadataLocation);
        });
  }

  @Override
  public void markTableDeleted(@Nonnull TableId tableId, @Nonnull Instant deletedAt) {
    requireNonNull(deletedAt, "deletedAt");
    var deletedAtMicros = JdbcTableMetadataReader.toMicros(deletedAt);
    LOGGER.debug("mark table {} deleted at {}", tableId, deletedAt);
    operations.withConnectionVoid(
        "mark table deleted",
        conn -> {
          try (var ps = conn.prepareStatement(MARK_TABULAR_DELETED)) {
            ps.setLong(1, deletedAtMicros);
            ps.setString(2, tableId.toString());
            requireUpdated(ps, "Table " + tableId);
          }
        });
  }

  private static void updateTabular(
      Connection conn, String sql, TableId tableId, @Nullable String value) throws SQLException {
    try (var ps = conn.prepareStatement(sql)) {
      ps.setString(1, value);
      ps.setString(2, tableId.toString());
      requireUpdated(ps, "Table " + tableId);
    }
  }

  private static void requireUpdated(PreparedStatement ps, String entity) throws SQLException {
    var updated = ps.executeUpdate();
    if (updated == 0) {
      throw new NotFoundException(entity + " does not exist");
    }
  }

  private static void requireName(String name, String entity) {
    if (name == null || name.isBlank()) {
      throw new InvalidArgumentException(entity + " name must not be empty");
    }
  }
}
