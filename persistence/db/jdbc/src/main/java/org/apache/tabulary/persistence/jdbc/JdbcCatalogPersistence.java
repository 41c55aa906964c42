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

import static com.google.common.base.Preconditions.checkState;
import static java.lang.String.format;
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
import static org.apache.tabulary.persistence.jdbc.JdbcColumnType.BIGINT;
import static org.apache.tabulary.persistence.jdbc.JdbcColumnType.ID;
import static org.apache.tabulary.persistence.jdbc.JdbcColumnType.JSON;
import static org.apache.tabulary.persistence.jdbc.JdbcColumnType.NAME;
import static org.apache.tabulary.persistence.jdbc.JdbcColumnType.VARCHAR;

import jakarta.annotation.Nonnull;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.JDBCType;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.apache.tabulary.persistence.api.CatalogPersistence;
import org.apache.tabulary.persistence.api.directory.CatalogDirectory;
import org.apache.tabulary.persistence.api.exceptions.StorageUnavailableException;
import org.apache.tabulary.persistence.api.refs.ReferenceStore;
import org.apache.tabulary.persistence.api.scope.WarehouseScopeGuard;
import org.apache.tabulary.persistence.api.tables.TableMetadataReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class JdbcCatalogPersistence implements CatalogPersistence {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcCatalogPersistence.class);

  private static final int MAX_CREATE_TABLE_ATTEMPTS = 3;

  private final JdbcPersistenceConfig persistenceConfig;
  private final DatabaseSpecific databaseSpecific;
  private final JdbcOperations operations;
  private final JdbcWarehouseScopeGuard warehouseScopeGuard;
  private final JdbcReferenceStore referenceStore;
  private final JdbcTableMetadataReader tableMetadataReader;
  private final JdbcCatalogDirectory catalogDirectory;
  private final List<TableDefinition> tableDefinitions;

  JdbcCatalogPersistence(
      JdbcPersistenceConfig persistenceConfig, DatabaseSpecific databaseSpecific) {
    this.persistenceConfig = persistenceConfig;
    this.databaseSpecific = databaseSpecific;
    this.operations = new JdbcOperations(persistenceConfig.dataSource(), databaseSpecific);
    this.warehouseScopeGuard = new JdbcWarehouseScopeGuard(operations);
    this.referenceStore = new JdbcReferenceStore(operations, warehouseScopeGuard);
    this.tableMetadataReader = new JdbcTableMetadataReader(operations);
    this.catalogDirectory = new JdbcCatalogDirectory(operations);
    this.tableDefinitions = buildTableDefinitions(databaseSpecific);
  }

  /** DDL and expected shape of a table, parents before children. */
  record TableDefinition(
      String tableName,
      String createTable,
      Set<String> expectedColumns,
      Map<String, Integer> expectedPrimaryKey) {}

  static List<TableDefinition> buildTableDefinitions(DatabaseSpecific databaseSpecific) {
    var columnTypes = databaseSpecific.columnTypes();
    var idTypeId = databaseSpecific.columnTypeIds().get(ID);
    var nameTypeId = databaseSpecific.columnTypeIds().get(NAME);

    var warehouses =
        new TableDefinition(
            TABLE_WAREHOUSES,
            "CREATE TABLE "
                + TABLE_WAREHOUSES
                + "\n  (\n    "
                + COL_WAREHOUSE_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_WAREHOUSE_NAME
                + " "
                + columnTypes.get(NAME)
                + " NOT NULL,\n    "
                + COL_WAREHOUSE_STATUS
                + " "
                + columnTypes.get(NAME)
                + " NOT NULL,\n    "
                + COL_WAREHOUSE_STORAGE_PROFILE
                + " "
                + columnTypes.get(JSON)
                + " NOT NULL,\n    "
                + COL_WAREHOUSE_STORAGE_SECRET_ID
                + " "
                + columnTypes.get(ID)
                + ",\n    PRIMARY KEY ("
                + COL_WAREHOUSE_ID
                + "),\n    UNIQUE ("
                + COL_WAREHOUSE_NAME
                + ")\n  )",
            Set.of(
                COL_WAREHOUSE_ID,
                COL_WAREHOUSE_NAME,
                COL_WAREHOUSE_STATUS,
                COL_WAREHOUSE_STORAGE_PROFILE,
                COL_WAREHOUSE_STORAGE_SECRET_ID),
            Map.of(COL_WAREHOUSE_ID, idTypeId));

    var namespaces =
        new TableDefinition(
            TABLE_NAMESPACES,
            "CREATE TABLE "
                + TABLE_NAMESPACES
                + "\n  (\n    "
                + COL_NAMESPACE_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_WAREHOUSE_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_NAMESPACE_NAME
                + " "
                + columnTypes.get(NAME)
                + " NOT NULL,\n    PRIMARY KEY ("
                + COL_NAMESPACE_ID
                + "),\n    UNIQUE ("
                + COL_WAREHOUSE_ID
                + ", "
                + COL_NAMESPACE_NAME
                + "),\n    FOREIGN KEY ("
                + COL_WAREHOUSE_ID
                + ") REFERENCES "
                + TABLE_WAREHOUSES
                + " ("
                + COL_WAREHOUSE_ID
                + ")\n  )",
            Set.of(COL_NAMESPACE_ID, COL_WAREHOUSE_ID, COL_NAMESPACE_NAME),
            Map.of(COL_NAMESPACE_ID, idTypeId));

    // Columns ordered to minimize column padding in PostgreSQL, "bigger" columns first.
    var tabulars =
        new TableDefinition(
            TABLE_TABULARS,
            "CREATE TABLE "
                + TABLE_TABULARS
                + "\n  (\n    "
                + COL_TABULAR_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_NAMESPACE_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_TABULAR_NAME
                + " "
                + columnTypes.get(NAME)
                + " NOT NULL,\n    "
                + COL_TABULAR_METADATA_LOCATION
                + " "
                + columnTypes.get(VARCHAR)
                + ",\n    "
                + COL_TABULAR_DELETED_AT
                + " "
                + columnTypes.get(BIGINT)
                + ",\n    PRIMARY KEY ("
                + COL_TABULAR_ID
                + "),\n    FOREIGN KEY ("
                + COL_NAMESPACE_ID
                + ") REFERENCES "
                + TABLE_NAMESPACES
                + " ("
                + COL_NAMESPACE_ID
                + ")\n  )",
            Set.of(
                COL_TABULAR_ID,
                COL_NAMESPACE_ID,
                COL_TABULAR_NAME,
                COL_TABULAR_METADATA_LOCATION,
                COL_TABULAR_DELETED_AT),
            Map.of(COL_TABULAR_ID, idTypeId));

    var tables =
        new TableDefinition(
            TABLE_TABLES,
            "CREATE TABLE "
                + TABLE_TABLES
                + "\n  (\n    "
                + COL_TABLE_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_TABLE_METADATA
                + " "
                + columnTypes.get(JSON)
                + " NOT NULL,\n    PRIMARY KEY ("
                + COL_TABLE_ID
                + "),\n    FOREIGN KEY ("
                + COL_TABLE_ID
                + ") REFERENCES "
                + TABLE_TABULARS
                + " ("
                + COL_TABULAR_ID
                + ")\n  )",
            Set.of(COL_TABLE_ID, COL_TABLE_METADATA),
            Map.of(COL_TABLE_ID, idTypeId));

    var tableRefs =
        new TableDefinition(
            TABLE_TABLE_REFS,
            "CREATE TABLE "
                + TABLE_TABLE_REFS
                + "\n  (\n    "
                + COL_REF_TABLE_ID
                + " "
                + columnTypes.get(ID)
                + " NOT NULL,\n    "
                + COL_REF_NAME
                + " "
                + columnTypes.get(NAME)
                + " NOT NULL,\n    "
                + COL_REF_SNAPSHOT_ID
                + " "
                + columnTypes.get(BIGINT)
                + " NOT NULL,\n    "
                + COL_REF_RETENTION
                + " "
                + columnTypes.get(JSON)
                + " NOT NULL,\n    PRIMARY KEY ("
                + COL_REF_TABLE_ID
                + ", "
                + COL_REF_NAME
                + "),\n    FOREIGN KEY ("
                + COL_REF_TABLE_ID
                + ") REFERENCES "
                + TABLE_TABLES
                + " ("
                + COL_TABLE_ID
                + ")\n  )",
            Set.of(COL_REF_TABLE_ID, COL_REF_NAME, COL_REF_SNAPSHOT_ID, COL_REF_RETENTION),
            Map.of(COL_REF_TABLE_ID, idTypeId, COL_REF_NAME, nameTypeId));

    return List.of(warehouses, namespaces, tabulars, tables, tableRefs);
  }

  @Override
  public void setupSchema() {
    try (var conn = operations.borrowConnection()) {
      var info = new StringBuilder();
      var s = conn.getCatalog();
      if (s != null && !s.isEmpty()) {
        info.append("catalog: ").append(s);
      }
      s = conn.getSchema();
      if (s != null && !s.isEmpty()) {
        if (!info.isEmpty()) {
          info.append(", ");
        }
        info.append("schema: ").append(s);
      }

      for (var tableDefinition : tableDefinitions) {
        if (!info.isEmpty()) {
          info.append(", ");
        }
        info.append(createTableIfNotExists(conn, tableDefinition));
      }

      // DDL is transactional on some databases, Postgres among them
      conn.commit();

      LOGGER.info("Database schema setup for {}: {}", databaseSpecific.name(), info);
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to set up the database schema", e, false);
    }
  }

  /**
   * Creates the table of the definition unless it exists. An existing table must have the expected
   * primary key and at least the expected columns.
   */
  private String createTableIfNotExists(Connection conn, TableDefinition tableDefinition)
      throws SQLException {
    var tableName = storedIdentifier(conn.getMetaData(), tableDefinition.tableName());
    for (int attempt = 1; ; attempt++) {
      if (tableExists(conn, tableName)) {
        verifyExistingTable(conn, tableName, tableDefinition);
        return format("table '%s' verified", tableName);
      }
      try (var st = conn.createStatement()) {
        st.executeUpdate(tableDefinition.createTable());
        return format("table '%s' created", tableName);
      } catch (SQLException e) {
        // another instance created the table in the meantime, verify that one instead
        if (!databaseSpecific.isAlreadyExists(e) || attempt >= MAX_CREATE_TABLE_ATTEMPTS) {
          throw e;
        }
      }
    }
  }

  /** The case in which the database reports the unquoted identifier in its metadata. */
  private static String storedIdentifier(DatabaseMetaData meta, String identifier)
      throws SQLException {
    if (meta.storesLowerCaseIdentifiers()) {
      return identifier.toLowerCase(Locale.ROOT);
    }
    if (meta.storesUpperCaseIdentifiers()) {
      return identifier.toUpperCase(Locale.ROOT);
    }
    return identifier;
  }

  private static boolean tableExists(Connection conn, String tableName) throws SQLException {
    try (var rs =
        conn.getMetaData().getTables(conn.getCatalog(), conn.getSchema(), tableName, null)) {
      return rs.next();
    }
  }

  private static void verifyExistingTable(
      Connection conn, String tableName, TableDefinition tableDefinition) throws SQLException {
    var meta = conn.getMetaData();
    var catalog = conn.getCatalog();
    var schema = conn.getSchema();

    // column name to java.sql.Types ordinal, in the order reported by the database
    var columns = new LinkedHashMap<String, Integer>();
    try (var rs = meta.getColumns(catalog, schema, tableName, null)) {
      while (rs.next()) {
        columns.put(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT), rs.getInt("DATA_TYPE"));
      }
    }
    var primaryKey = new LinkedHashMap<String, Integer>();
    try (var rs = meta.getPrimaryKeys(catalog, schema, tableName)) {
      while (rs.next()) {
        var column = rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT);
        primaryKey.put(column, columns.get(column));
      }
    }

    checkState(
        primaryKey.equals(tableDefinition.expectedPrimaryKey()),
        "Table '%s' has the primary key %s, but %s is required. Table DDL:\n%s",
        tableName,
        describeColumns(primaryKey),
        describeColumns(tableDefinition.expectedPrimaryKey()),
        tableDefinition.createTable());

    var absent = new TreeSet<>(tableDefinition.expectedColumns());
    absent.removeAll(columns.keySet());
    checkState(
        absent.isEmpty(),
        "Table '%s' lacks the columns %s, it has %s. Table DDL:\n%s",
        tableName,
        absent,
        new TreeSet<>(columns.keySet()),
        tableDefinition.createTable());
  }

  /** Renders columns with their JDBC types, for example {@code [table_id VARCHAR(12)]}. */
  private static String describeColumns(Map<String, Integer> columns) {
    return columns.entrySet().stream()
        .map(e -> e.getKey() + " " + jdbcTypeName(e.getValue()) + "(" + e.getValue() + ")")
        .collect(Collectors.joining(", ", "[", "]"));
  }

  private static String jdbcTypeName(Integer type) {
    if (type == null) {
      return "?";
    }
    try {
      return JDBCType.valueOf(type).getName();
    } catch (IllegalArgumentException e) {
      return "vendor type";
    }
  }

  @Nonnull
  @Override
  public ReferenceStore referenceStore() {
    return referenceStore;
  }

  @Nonnull
  @Override
  public TableMetadataReader tableMetadataReader() {
    return tableMetadataReader;
  }

  @Nonnull
  @Override
  public WarehouseScopeGuard warehouseScopeGuard() {
    return warehouseScopeGuard;
  }

  @Nonnull
  @Override
  public CatalogDirectory catalogDirectory() {
    return catalogDirectory;
  }

  @Override
  public void close() {
    if (persistenceConfig.closeDataSource()) {
      try {
        if (persistenceConfig.dataSource() instanceof AutoCloseable ac) {
          ac.close();
        }
      } catch (Exception e) {
        throw new IllegalStateException("Failed to close the data source", e);
      }
    }
  }
}
