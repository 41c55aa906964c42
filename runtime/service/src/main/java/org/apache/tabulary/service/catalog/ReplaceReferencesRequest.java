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

import java.util.List;
import java.util.Optional;
import org.apache.tabulary.immutables.AllowNulls;
import org.apache.tabulary.immutables.TabularyImmutable;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.refs.TableReference;
import org.apache.tabulary.persistence.api.refs.TableReferences;

/**
 * Reference update of one table as received from a commit: the element at index {@code i} of
 * {@link #names()}, {@link #snapshotIds()} and {@link #retention()} describes one reference.
 *
 * <p>The sequences, including {@code null} elements, are validated by {@link
 * BatchCoordinator#replaceReferences(ReplaceReferencesRequest)}, not when building the request.
 */
@TabularyImmutable
public interface ReplaceReferencesRequest {
  /** When present, the update is confined to this warehouse, which must be active. */
  Optional<WarehouseId> warehouseId();

  TableId tableId();

  @AllowNulls
  List<String> names();

  @AllowNulls
  List<Long> snapshotIds();

  @AllowNulls
  List<JsonDocument> retention();

  /**
   * The references of this request in input order.
   *
   * @throws org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException if the
   *     sequences are of different lengths or contain invalid or duplicate names
   */
  default List<TableReference> references() {
    return TableReferences.fromParallelSequences(names(), snapshotIds(), retention());
  }

  static ImmutableReplaceReferencesRequest.Builder builder() {
    return ImmutableReplaceReferencesRequest.builder();
  }
}
