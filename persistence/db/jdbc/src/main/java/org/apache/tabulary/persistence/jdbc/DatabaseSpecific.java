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

import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/** Per database product DDL types, SQL dialect and error classification. */
interface DatabaseSpecific {
  String name();

  Map<JdbcColumnType, String> columnTypes();

  /** {@link java.sql.Types} ids of the column types, as reported by the JDBC metadata. */
  Map<JdbcColumnType, Integer> columnTypeIds();

  /** Unique or primary key violation. */
  boolean isConstraintViolation(SQLException e);

  /** A referenced parent row does not exist. */
  boolean isForeignKeyViolation(SQLException e);

  /** Deadlock, serialization failure or lock timeout, the transaction can be retried. */
  boolean isRetryTransaction(SQLException e);

  /** {@code CREATE TABLE} failed, because the table already exists. */
  boolean isAlreadyExists(SQLException e);

  /** Turns an {@code INSERT} into one that silently ignores rows with an existing key. */
  String wrapInsert(String sql);

  /**
   * Turns an {@code INSERT} into a single statement upsert, rows with an existing key get the
   * values of {@code columns} overwritten.
   */
  String wrapUpsert(String sql, List<String> keyCols, List<String> columns);
}
