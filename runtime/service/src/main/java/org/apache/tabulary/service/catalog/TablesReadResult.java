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

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.tabulary.immutables.TabularyImmutable;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.tables.TableRecord;
import org.immutables.value.Value;

/**
 * Outcome of a table read: the records that were found and the requested ids that were not, either
 * because they do not exist, belong to another warehouse, the warehouse is not active, or they are
 * soft-deleted and deleted tables were not requested.
 */
@TabularyImmutable
public interface TablesReadResult {
  Map<TableId, TableRecord> found();

  Set<TableId> missing();

  default Optional<TableRecord> get(TableId tableId) {
    return Optional.ofNullable(found().get(tableId));
  }

  @Value.Check
  default void check() {
    for (var id : missing()) {
      if (found().containsKey(id)) {
        throw new IllegalStateException("Table " + id + " reported as found and missing");
      }
    }
  }

  static ImmutableTablesReadResult.Builder builder() {
    return ImmutableTablesReadResult.builder();
  }
}
