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
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.DELETE_REFS;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.FIND_REFS;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.INSERT_REF;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.MAX_BATCH_SIZE;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.REF_COLS_LIST;
import static org.apache.tabulary.persistence.jdbc.JdbcConstants.REF_KEY_LIST;
import static org.apache.tabulary.persistence.jdbc.JdbcOperations.sqlInMultipleMultiple;

import com.google.common.collect.Lists;
import jakarta.annotation.Nonnull;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.refs.ReferenceStore;
import org.apache.tabulary.persistence.api.refs.TableReference;
import org.apache.tabulary.persistence.api.refs.TableReferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JdbcReferenceStore implements ReferenceStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcReferenceStore.class);

  private final JdbcOperations operations;
  private final JdbcWarehouseScopeGuard scopeGuard;

  JdbcReferenceStore(JdbcOperations operations, JdbcWarehouseScopeGuard scopeGuard) {
    this.operations = operations;
    this.scopeGuard = scopeGuard;
  }

  @Override
  public void replaceReferences(
      @Nonnull TableId tableId, @Nonnull List<TableReference> references) {
    requireNonNull(tableId, "tableId");
    TableReferences.checkUniqueNames(references);
    if (references.isEmpty()) {
      LOGGER.debug("No references to replace for table {}", tableId);
      return;
    }
    operations.withConnectionVoid(
        "replace references",
        conn -> {
          scopeGuard.lockTableForWrite(conn, Optional.empty(), tableId);
          replaceReferences(conn, tableId, references);
        });
  }

  @Override
  public void replaceReferences(
      @Nonnull WarehouseId warehouseId,
      @Nonnull TableId tableId,
      @Nonnull List<TableReference> references) {
    requireNonNull(warehouseId, "warehouseId");
    requireNonNull(tableId, "tableId");
    TableReferences.checkUniqueNames(references);
    operations.withConnectionVoid(
        "replace references",
        conn -> {
          scopeGuard.requireActive(conn, warehouseId);
          scopeGuard.lockTableForWrite(conn, Optional.of(warehouseId), tableId);
          if (!references.isEmpty()) {
            replaceReferences(conn, tableId, references);
          }
        });
  }

  private void replaceReferences(
      Connection conn, TableId tableId, List<TableReference> references) throws SQLException {
    LOGGER
        .atDebug()
        .addArgument(references::size)
        .addArgument(tableId)
        .log("Replacing {} references of table {}");

    var tableIdString = tableId.toString();
    var databaseSpecific = operations.databaseSpecific();

    for (var chunk : Lists.partition(references, MAX_BATCH_SIZE)) {
      //noinspection SqlSourceToSinkFlow
      try (var ps = conn.prepareStatement(sqlInMultipleMultiple(DELETE_REFS, chunk.size()))) {
        var idx = 1;
        ps.setString(idx++, tableIdString);
        for (var reference : chunk) {
          ps.setString(idx++, reference.name());
        }
        ps.executeUpdate();
      }
    }

    // single statement upsert, a row re-created after the DELETE is overwritten
    var sql = databaseSpecific.wrapUpsert(INSERT_REF, REF_KEY_LIST, REF_COLS_LIST);
    //noinspection SqlSourceToSinkFlow
    try (var psUpsert = conn.prepareStatement(sql)) {
      for (var chunk : Lists.partition(references, MAX_BATCH_SIZE)) {
        for (var reference : chunk) {
          var idx = 1;
          psUpsert.setString(idx++, tableIdString);
          psUpsert.setString(idx++, reference.name());
          psUpsert.setLong(idx++, reference.snapshotId());
          psUpsert.setString(idx, reference.retention().serialize());
          psUpsert.addBatch();
        }

        for (int ru : psUpsert.executeBatch()) {
          // MySQL and MariaDB return '2' for an updated row and '0' for an unchanged one
          if (ru != Statement.SUCCESS_NO_INFO && (ru < 0 || ru > 2)) {
            throw new IllegalStateException(
                "driver returned unexpected value for a batch upsert: " + ru);
          }
        }
      }
    }
  }

  @Nonnull
  @Override
  public List<TableReference> fetchReferences(@Nonnull TableId tableId) {
    requireNonNull(tableId, "tableId");
    return operations.withConnection(
        true,
        "fetch references",
        conn -> {
          try (var ps = conn.prepareStatement(FIND_REFS)) {
            ps.setString(1, tableId.toString());
            try (var rs = ps.executeQuery()) {
              var references = new ArrayList<TableReference>();
              while (rs.next()) {
                references.add(
                    TableReference.tableReference(
                        rs.getString(1), rs.getLong(2), JsonDocument.parse(rs.getString(3))));
              }
              return references;
            }
          }
        });
  }
}
