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

/** Names of the database tables and their columns. */
final class Identifiers {
  private Identifiers() {}

  static final String TABLE_WAREHOUSES = "tabulary_warehouses";
  static final String COL_WAREHOUSE_ID = "warehouse_id";
  static final String COL_WAREHOUSE_NAME = "warehouse_name";
  static final String COL_WAREHOUSE_STATUS = "status";
  static final String COL_WAREHOUSE_STORAGE_PROFILE = "storage_profile";
  static final String COL_WAREHOUSE_STORAGE_SECRET_ID = "storage_secret_id";

  static final String TABLE_NAMESPACES = "tabulary_namespaces";
  static final String COL_NAMESPACE_ID = "namespace_id";
  static final String COL_NAMESPACE_NAME = "namespace_name";

  static final String TABLE_TABULARS = "tabulary_tabulars";
  static final String COL_TABULAR_ID = "tabular_id";
  static final String COL_TABULAR_NAME = "tabular_name";
  static final String COL_TABULAR_METADATA_LOCATION = "metadata_location";
  static final String COL_TABULAR_DELETED_AT = "deleted_at_micros";

  static final String TABLE_TABLES = "tabulary_tables";
  static final String COL_TABLE_ID = "table_id";
  static final String COL_TABLE_METADATA = "metadata";

  static final String TABLE_TABLE_REFS = "tabulary_table_refs";
  static final String COL_REF_TABLE_ID = "table_id";
  static final String COL_REF_NAME = "table_ref_name";
  static final String COL_REF_SNAPSHOT_ID = "snapshot_id";
  static final String COL_REF_RETENTION = "retention";
}
