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
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.READ_TABLES;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.READ_TABLES_NOT_DELETED;
import static org.apache.tabulary.persistence.jdbc.JdbcOperations.sqlInMultipleMultiple;

import jakarta.annotation.Nonnull;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.ids.NamespaceId;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.tables.TableMetadataReader;
import org.apache.tabulary.persistence.api.tables.TableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JdbcTableMetadataReader implements TableMetadataReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcTableMetadataReader.class);

  private final JdbcOperations operations;

  JdbcTableMetadataReader(JdbcOperations operations) {
    this.operations = operations;
  }

  @Nonnull
  @Override
  public List<TableRecord> readTables(
      @Nonnull WarehouseId warehouseId, @Nonnull Set<TableId> tableIds, boolean includeDeleted) {
    requireNonNull(warehouseId, "warehouseId");
    if (tableIds.isEmpty()) {
      return List.of();
    }

    var sql =
        sqlInMultipleMultiple(
            includeDeleted ? READ_TABLES : READ_TABLES_NOT_DELETED, tableIds.size());
    var records =
        operations.withConnection(
            true,
            "read tables",
            conn -> {
              //noinspection SqlSourceToSinkFlow
              try (var ps = conn.prepareStatement(sql)) {
                var idx = JdbcWarehouseScopeGuard.bindScope(ps, 1, warehouseId);
                for (var tableId : tableIds) {
                  ps.setString(idx++, tableId.toString());
                }
                try (var rs = ps.executeQuery()) {
                  var r = new ArrayList<TableRecord>(tableIds.size());
                  while (rs.next()) {
                    r.add(deserializeTableRecord(rs));
                  }
                  return r;
                }
              }
            });

    LOGGER.debug(
        "Read {} of {} requested tables in warehouse {}",
        records.size(),
        tableIds.size(),
        warehouseId);
    return records;
  }

  static TableRecord deserializeTableRecord(ResultSet rs) throws SQLException {
    var secretId = rs.getString(6);
    var deletedAtMicros = rs.getLong(7);
    var deleted = !rs.wasNull();
    return TableRecord.builder()
        .tableId(TableId.parse(rs.getString(1)))
        .namespaceId(NamespaceId.parse(rs.getString(2)))
        .metadata(JsonDocument.parse(rs.getString(3)))
        .metadataLocation(Optional.ofNullable(rs.getString(4)))
        .storageProfile(JsonDocument.parse(rs.getString(5)))
        .storageSecretId(Optional.ofNullable(secretId).map(UUID::fromString))
        .deletedAt(
            deleted
                ? Optional.of(Instant.EPOCH.plus(deletedAtMicros, ChronoUnit.MICROS))
                : Optional.empty())
        .build();
  }

  /**
   * @throws InvalidArgumentException if {@code instant} is not representable as microseconds since
   *     the epoch in a {@code long}
   */
  static long toMicros(Instant instant) {
    try {
      return ChronoUnit.MICROS.between(Instant.EPOCH, instant);
    } catch (ArithmeticException e) {
      throw new InvalidArgumentException(
          InvalidArgumentException.TYPE, "Timestamp out of the supported range: " + instant, e);
    }
  }
}
