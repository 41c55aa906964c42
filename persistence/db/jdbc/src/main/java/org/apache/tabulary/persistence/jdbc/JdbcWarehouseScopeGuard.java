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
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.FIND_TABLE_WAREHOUSE;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.FIND_WAREHOUSE_STATUS;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.LOCK_TABLE;

import jakarta.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Optional;
import org.apache.tabulary.persistence.api.exceptions.ConstraintViolationException;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.scope.WarehouseScope;
import org.apache.tabulary.persistence.api.scope.WarehouseScopeGuard;
import org.apache.tabulary.persistence.api.scope.WarehouseStatus;

final class JdbcWarehouseScopeGuard implements WarehouseScopeGuard {
  private final JdbcOperations operations;

  JdbcWarehouseScopeGuard(JdbcOperations operations) {
    this.operations = operations;
  }

  @Override
  public void requireActive(@Nonnull WarehouseId warehouseId) {
    requireNonNull(warehouseId, "warehouseId");
    operations.withConnection(
        true,
        "check warehouse status",
        conn -> {
          requireActive(conn, warehouseId);
          return null;
        });
  }

  /** Evaluates the scope check within the caller's transaction. */
  void requireActive(Connection conn, WarehouseId warehouseId) throws SQLException {
    try (var ps = conn.prepareStatement(FIND_WAREHOUSE_STATUS)) {
      ps.setString(1, warehouseId.toString());
      try (var rs = ps.executeQuery()) {
        var status =
            rs.next()
                ? Optional.of(WarehouseStatus.fromValue(rs.getString(1)))
                : Optional.<WarehouseStatus>empty();
        WarehouseScope.checkActive(warehouseId, status);
      }
    }
  }

  /**
   * Prepares a reference write to a table within the caller's transaction: locks the table row,
   * which serializes concurrent reference writers of the table, and requires the warehouse of the
   * table to be active.
   *
   * @param expectedWarehouse when present, the table must belong to this warehouse
   * @throws ConstraintViolationException if the table does not exist or belongs to another
   *     warehouse
   */
  void lockTableForWrite(Connection conn, Optional<WarehouseId> expectedWarehouse, TableId tableId)
      throws SQLException {
    try (var ps = conn.prepareStatement(LOCK_TABLE)) {
      ps.setString(1, tableId.toString());
      try (var rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new ConstraintViolationException("Table " + tableId + " does not exist");
        }
      }
    }

    WarehouseId tableWarehouse;
    WarehouseStatus status;
    try (var ps = conn.prepareStatement(FIND_TABLE_WAREHOUSE)) {
      ps.setString(1, tableId.toString());
      try (var rs = ps.executeQuery()) {
        if (!rs.next()) {
          throw new ConstraintViolationException("Table " + tableId + " does not exist");
        }
        tableWarehouse = WarehouseId.parse(rs.getString(1));
        status = WarehouseStatus.fromValue(rs.getString(2));
      }
    }

    if (expectedWarehouse.isPresent() && !expectedWarehouse.get().equals(tableWarehouse)) {
      throw new ConstraintViolationException(
          "Table " + tableId + " does not belong to warehouse " + expectedWarehouse.get());
    }
    WarehouseScope.checkActive(tableWarehouse, Optional.of(status));
  }

  /** Binds the parameters of the scope predicate, returns the next parameter index. */
  static int bindScope(PreparedStatement ps, int idx, WarehouseId warehouseId)
      throws SQLException {
    ps.setString(idx++, warehouseId.toString());
    ps.setString(idx++, WarehouseStatus.ACTIVE.value());
    return idx;
  }
}
