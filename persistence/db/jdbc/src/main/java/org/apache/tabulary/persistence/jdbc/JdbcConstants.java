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

import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_NAMESPACE_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_NAMESPACE_NAME;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_REF_NAME;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_REF_RETENTION;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_REF_SNAPSHOT_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_REF_TABLE_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_TABLE_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_TABLE_METADATA;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_TABULAR_DELETED_AT;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_TABULAR_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_TABULAR_METADATA_LOCATION;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_TABULAR_NAME;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_WAREHOUSE_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_WAREHOUSE_NAME;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_WAREHOUSE_STATUS;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_WAREHOUSE_STORAGE_PROFILE;
import static org.apache.tabulary.persistence.jdbc.Identifiers.COL_WAREHOUSE_STORAGE_SECRET_ID;
import static org.apache.tabulary.persistence.jdbc.Identifiers.TABLE_NAMESPACES;
import static org.apache.tabulary.persistence.jdbc.Identifiers.TABLE_TABLES;
import static org.apache.tabulary.persistence.jdbc.Identifiers.TABLE_TABLE_REFS;
import static org.apache.tabulary.persistence.jdbc.Identifiers.TABLE_TABULARS;
import static org.apache.tabulary.persistence.jdbc.Identifiers.TABLE_WAREHOUSES;

import java.util.List;

final class JdbcConstants {
  private JdbcConstants() {}

  static final int MAX_BATCH_SIZE = 50;

  // table references

  static final List<String> REF_KEY_LIST = List.of(COL_REF_TABLE_ID, COL_REF_NAME);

  static final List<String> REF_COLS_LIST = List.of(COL_REF_SNAPSHOT_ID, COL_REF_RETENTION);

  static final String DELETE_REFS =
      "DELETE FROM "
          + TABLE_TABLE_REFS
          + " WHERE "
          + COL_REF_TABLE_ID
          + "=? AND "
          + COL_REF_NAME
          + " IN (?)";

  static final String INSERT_REF =
      "INSERT INTO "
          + TABLE_TABLE_REFS
          + " ("
          + COL_REF_TABLE_ID
          + ", "
          + COL_REF_NAME
          + ", "
          + COL_REF_SNAPSHOT_ID
          + ", "
          + COL_REF_RETENTION
          + ") VALUES (?, ?, ?, ?)";

  /** Serializes reference writers of one table, the row lock is held until the transaction ends. */
  static final String LOCK_TABLE =
      "SELECT " + COL_TABLE_ID + " FROM " + TABLE_TABLES + " WHERE " + COL_TABLE_ID + "=? FOR UPDATE";

  static final String FIND_REFS =
      "SELECT "
          + COL_REF_NAME
          + ", "
          + COL_REF_SNAPSHOT_ID
          + ", "
          + COL_REF_RETENTION
          + " FROM "
          + TABLE_TABLE_REFS
          + " WHERE "
          + COL_REF_TABLE_ID
          + "=? ORDER BY "
          + COL_REF_NAME;

  // warehouse scope

  static final String FIND_WAREHOUSE_STATUS =
      "SELECT "
          + COL_WAREHOUSE_STATUS
          + " FROM "
          + TABLE_WAREHOUSES
          + " WHERE "
          + COL_WAREHOUSE_ID
          + "=?";

  /** Scope predicate on the warehouse table aliased {@code w}, binds warehouse id and status. */
  static final String WAREHOUSE_SCOPE_PREDICATE =
      "w." + COL_WAREHOUSE_ID + "=? AND w." + COL_WAREHOUSE_STATUS + "=?";

  static final String TABLE_JOINS =
      " FROM "
          + TABLE_TABLES
          + " tb JOIN "
          + TABLE_TABULARS
          + " ta ON ta."
          + COL_TABULAR_ID
          + "=tb."
          + COL_TABLE_ID
          + " JOIN "
          + TABLE_NAMESPACES
          + " n ON n."
          + COL_NAMESPACE_ID
          + "=ta."
          + COL_NAMESPACE_ID
          + " JOIN "
          + TABLE_WAREHOUSES
          + " w ON w."
          + COL_WAREHOUSE_ID
          + "=n."
          + COL_WAREHOUSE_ID;

  static final String FIND_TABLE_WAREHOUSE =
      "SELECT n."
          + COL_WAREHOUSE_ID
          + ", w."
          + COL_WAREHOUSE_STATUS
          + TABLE_JOINS
          + " WHERE tb."
          + COL_TABLE_ID
          + "=?";

  // table metadata

  static final String READ_TABLES =
      "SELECT tb."
          + COL_TABLE_ID
          + ", ta."
          + COL_NAMESPACE_ID
          + ", tb."
          + COL_TABLE_METADATA
          + ", ta."
          + COL_TABULAR_METADATA_LOCATION
          + ", w."
          + COL_WAREHOUSE_STORAGE_PROFILE
          + ", w."
          + COL_WAREHOUSE_STORAGE_SECRET_ID
          + ", ta."
          + COL_TABULAR_DELETED_AT
          + TABLE_JOINS
          + " WHERE "
          + WAREHOUSE_SCOPE_PREDICATE
          + " AND tb."
          + COL_TABLE_ID
          + " IN (?)";

  static final String READ_TABLES_NOT_DELETED =
      READ_TABLES + " AND ta." + COL_TABULAR_DELETED_AT + " IS NULL";

  // directory

  static final String INSERT_WAREHOUSE =
      "INSERT INTO "
          + TABLE_WAREHOUSES
          + " ("
          + COL_WAREHOUSE_ID
          + ", "
          + COL_WAREHOUSE_NAME
          + ", "
          + COL_WAREHOUSE_STATUS
          + ", "
          + COL_WAREHOUSE_STORAGE_PROFILE
          + ", "
          + COL_WAREHOUSE_STORAGE_SECRET_ID
          + ") VALUES (?, ?, ?, ?, ?)";

  static final String UPDATE_WAREHOUSE_STATUS =
      "UPDATE "
          + TABLE_WAREHOUSES
          + " SET "
          + COL_WAREHOUSE_STATUS
          + "=? WHERE "
          + COL_WAREHOUSE_ID
          + "=?";

  static final String FIND_WAREHOUSE =
      "SELECT "
          + COL_WAREHOUSE_ID
          + ", "
          + COL_WAREHOUSE_NAME
          + ", "
          + COL_WAREHOUSE_STATUS
          + ", "
          + COL_WAREHOUSE_STORAGE_PROFILE
          + ", "
          + COL_WAREHOUSE_STORAGE_SECRET_ID
          + " FROM "
          + TABLE_WAREHOUSES
          + " WHERE "
          + COL_WAREHOUSE_ID
          + "=?";

  static final String INSERT_NAMESPACE =
      "INSERT INTO "
          + TABLE_NAMESPACES
          + " ("
          + COL_NAMESPACE_ID
          + ", "
          + COL_WAREHOUSE_ID
          + ", "
          + COL_NAMESPACE_NAME
          + ") VALUES (?, ?, ?)";

  static final String INSERT_TABULAR =
      "INSERT INTO "
          + TABLE_TABULARS
          + " ("
          + COL_TABULAR_ID
          + ", "
          + COL_NAMESPACE_ID
          + ", "
          + COL_TABULAR_NAME
          + ", "
          + COL_TABULAR_METADATA_LOCATION
          + ") VALUES (?, ?, ?, ?)";

  static final String INSERT_TABLE =
      "INSERT INTO "
          + TABLE_TABLES
          + " ("
          + COL_TABLE_ID
          + ", "
          + COL_TABLE_METADATA
          + ") VALUES (?, ?)";

  static final String UPDATE_TABLE_METADATA =
      "UPDATE " + TABLE_TABLES + " SET " + COL_TABLE_METADATA + "=? WHERE " + COL_TABLE_ID + "=?";

  static final String UPDATE_TABULAR_LOCATION =
      "UPDATE "
          + TABLE_TABULARS
          + " SET "
          + COL_TABULAR_METADATA_LOCATION
          + "=? WHERE "
          + COL_TABULAR_ID
          + "=?";

  static final String MARK_TABULAR_DELETED =
      "UPDATE "
          + TABLE_TABULARS
          + " SET "
          + COL_TABULAR_DELETED_AT
          + "=? WHERE "
          + COL_TABULAR_ID
          + "=?";
}
