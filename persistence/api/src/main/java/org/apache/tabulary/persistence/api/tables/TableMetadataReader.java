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
package org.apache.tabulary.persistence.api.tables;

import jakarta.annotation.Nonnull;
import java.util.List;
import java.util.Set;
import org.apache.tabulary.persistence.api.exceptions.StorageUnavailableException;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;

public interface TableMetadataReader {

  /**
   * Reads the records of the given tables with a single storage round trip.
   *
   * <p>Only tables of the given warehouse are returned, and only if that warehouse is active.
   * Soft-deleted tables are omitted unless {@code includeDeleted} is set. Ids without a matching
   * table are silently omitted, the order of the returned list is unspecified.
   *
   * <p>An empty {@code tableIds} returns an empty list without querying storage.
   *
   * @throws StorageUnavailableException if the storage engine failed
   */
  @Nonnull
  List<TableRecord> readTables(
      @Nonnull WarehouseId warehouseId, @Nonnull Set<TableId> tableIds, boolean includeDeleted);
}
