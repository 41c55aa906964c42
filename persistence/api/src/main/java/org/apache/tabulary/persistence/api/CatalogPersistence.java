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
package org.apache.tabulary.persistence.api;

import jakarta.annotation.Nonnull;
import org.apache.tabulary.persistence.api.directory.CatalogDirectory;
import org.apache.tabulary.persistence.api.refs.ReferenceStore;
import org.apache.tabulary.persistence.api.scope.WarehouseScopeGuard;
import org.apache.tabulary.persistence.api.tables.TableMetadataReader;

/** Entry point to the catalog persistence backed by one database. */
public interface CatalogPersistence extends AutoCloseable {

  /** Creates the database tables if they do not exist, validates them otherwise. */
  void setupSchema();

  @Nonnull
  ReferenceStore referenceStore();

  @Nonnull
  TableMetadataReader tableMetadataReader();

  @Nonnull
  WarehouseScopeGuard warehouseScopeGuard();

  @Nonnull
  CatalogDirectory catalogDirectory();

  @Override
  void close();
}
