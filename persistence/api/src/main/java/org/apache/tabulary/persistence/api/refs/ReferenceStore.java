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
package org.apache.tabulary.persistence.api.refs;

import jakarta.annotation.Nonnull;
import java.util.List;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.ConstraintViolationException;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.exceptions.StorageUnavailableException;
import org.apache.tabulary.persistence.api.exceptions.UnknownOperationResultException;
import org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;

/**
 * Owns the mapping of {@code (table id, reference name)} to {@code (snapshot id, retention)}.
 *
 * <p>{@code replaceReferences} is the only way to write references. Each call is one atomic unit:
 * all references of the call are written, or none. Existing references of the table whose names
 * are not part of the call are left untouched.
 *
 * <p>Concurrent calls for the same table are safe. A name written by several concurrent calls ends
 * up with the complete tuple of exactly one of them.
 */
public interface ReferenceStore {

  /**
   * Replaces the references of the table that are named in {@code references}.
   *
   * <p>An empty list is a no-op.
   *
   * @throws InvalidArgumentException if {@code references} mentions a name more than once
   * @throws ConstraintViolationException if the table does not exist
   * @throws StorageUnavailableException if the storage engine failed, nothing has been written
   * @throws UnknownOperationResultException if the outcome of the commit is unknown
   */
  void replaceReferences(@Nonnull TableId tableId, @Nonnull List<TableReference> references);

  /**
   * Same as {@link #replaceReferences(TableId, List)}, but first requires, within the same
   * transaction, that the warehouse is active and that the table belongs to it.
   *
   * @throws WarehouseNotActiveException if the warehouse does not exist or is not active
   * @throws ConstraintViolationException if the table does not exist in the warehouse
   */
  void replaceReferences(
      @Nonnull WarehouseId warehouseId,
      @Nonnull TableId tableId,
      @Nonnull List<TableReference> references);

  /**
   * Parallel sequence variant of {@link #replaceReferences(TableId, List)}, the element at index
   * {@code i} of each sequence describes one reference.
   *
   * @throws InvalidArgumentException if the sequences are not of the same length
   */
  default void replaceReferences(
      @Nonnull TableId tableId,
      @Nonnull List<String> names,
      @Nonnull List<Long> snapshotIds,
      @Nonnull List<JsonDocument> retention) {
    replaceReferences(
        tableId, TableReferences.fromParallelSequences(names, snapshotIds, retention));
  }

  /** Returns the references of the table, ordered by name, empty if the table has none. */
  @Nonnull
  List<TableReference> fetchReferences(@Nonnull TableId tableId);
}
