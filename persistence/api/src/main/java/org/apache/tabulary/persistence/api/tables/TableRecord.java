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

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.apache.tabulary.immutables.TabularyImmutable;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.ids.NamespaceId;
import org.apache.tabulary.persistence.api.ids.TableId;

/**
 * Current state of a table as needed to load it: the metadata document, where the metadata file
 * lives and the storage context of the owning warehouse.
 */
@TabularyImmutable
public interface TableRecord {
  TableId tableId();

  NamespaceId namespaceId();

  JsonDocument metadata();

  /** Location of the current metadata file, empty for staged tables. */
  Optional<String> metadataLocation();

  /** Storage profile of the warehouse the table belongs to. */
  JsonDocument storageProfile();

  Optional<UUID> storageSecretId();

  /** Soft-deletion timestamp, only ever present if deleted tables were requested. */
  Optional<Instant> deletedAt();

  default boolean isDeleted() {
    return deletedAt().isPresent();
  }

  static ImmutableTableRecord.Builder builder() {
    return ImmutableTableRecord.builder();
  }
}
