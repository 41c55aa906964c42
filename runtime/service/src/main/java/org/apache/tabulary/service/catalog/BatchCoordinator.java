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
package org.apache.tabulary.service.catalog;

import static java.util.Objects.requireNonNull;

import jakarta.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.tabulary.persistence.api.CatalogPersistence;
import org.apache.tabulary.persistence.api.exceptions.NotFoundException;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.refs.ReferenceStore;
import org.apache.tabulary.persistence.api.scope.WarehouseScopeGuard;
import org.apache.tabulary.persistence.api.tables.TableMetadataReader;
import org.apache.tabulary.persistence.api.tables.TableRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates caller level requests into calls of the reference store and the table metadata
 * reader.
 *
 * <p>Reference updates are fully validated before anything is sent to the store. Table reads
 * return the records that were found together with the requested ids that were not.
 */
public final class BatchCoordinator {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchCoordinator.class);

  private final ReferenceStore referenceStore;
  private final TableMetadataReader tableMetadataReader;
  private final WarehouseScopeGuard warehouseScopeGuard;

  public BatchCoordinator(
      ReferenceStore referenceStore,
      TableMetadataReader tableMetadataReader,
      WarehouseScopeGuard warehouseScopeGuard) {
    this.referenceStore = requireNonNull(referenceStore, "referenceStore");
    this.tableMetadataReader = requireNonNull(tableMetadataReader, "tableMetadataReader");
    this.warehouseScopeGuard = requireNonNull(warehouseScopeGuard, "warehouseScopeGuard");
  }

  public static BatchCoordinator forPersistence(CatalogPersistence persistence) {
    return new BatchCoordinator(
        persistence.referenceStore(),
        persistence.tableMetadataReader(),
        persistence.warehouseScopeGuard());
  }

  /**
   * Replaces the references named in the request, within the request's warehouse if it has one.
   *
   * @throws org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException if the
   *     request is malformed, nothing has been sent to storage in that case
   */
  public void replaceReferences(@Nonnull ReplaceReferencesRequest request) {
    var references = request.references();
    var tableId = request.tableId();

    LOGGER
        .atDebug()
        .setMessage("Replacing {} reference(s) of table {}")
        .addArgument(references::size)
        .addArgument(tableId)
        .log();

    request
        .warehouseId()
        .ifPresentOrElse(
            warehouseId -> referenceStore.replaceReferences(warehouseId, tableId, references),
            () -> referenceStore.replaceReferences(tableId, references));
  }

  @Nonnull
  public TablesReadResult readTables(@Nonnull ReadTablesRequest request) {
    var records =
        tableMetadataReader.readTables(
            request.warehouseId(), request.tableIds(), request.includeDeleted());

    Map<TableId, TableRecord> found = new LinkedHashMap<>();
    for (var record : records) {
      found.put(record.tableId(), record);
    }
    Set<TableId> missing = new LinkedHashSet<>(request.tableIds());
    missing.removeAll(found.keySet());

    LOGGER.debug(
        "Read {} of {} requested table(s) in warehouse {}",
        found.size(),
        request.tableIds().size(),
        request.warehouseId());

    return TablesReadResult.builder().found(found).missing(missing).build();
  }

  /**
   * Like {@link #readTables(ReadTablesRequest)}, but requires all requested tables to be found.
   *
   * @throws NotFoundException naming the ids that were not found
   */
  @Nonnull
  public TablesReadResult requireTables(@Nonnull ReadTablesRequest request) {
    var result = readTables(request);
    if (!result.missing().isEmpty()) {
      throw new NotFoundException(
          result.missing().stream()
              .map(Object::toString)
              .sorted()
              .collect(
                  Collectors.joining(
                      ", ",
                      "Table(s) not found in warehouse " + request.warehouseId() + ": ",
                      "")));
    }
    return result;
  }

  /**
   * Explicit variant of the scope check that {@link #readTables(ReadTablesRequest)} applies
   * silently.
   *
   * @throws org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException unless the
   *     warehouse exists and is active
   */
  public void ensureActive(@Nonnull WarehouseId warehouseId) {
    warehouseScopeGuard.requireActive(warehouseId);
  }
}
