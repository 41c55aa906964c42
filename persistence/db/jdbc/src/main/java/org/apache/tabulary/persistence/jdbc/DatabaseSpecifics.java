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

import static com.google.common.base.Preconditions.checkArgument;

import jakarta.annotation.Nonnull;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import javax.sql.DataSource;
import org.apache.tabulary.persistence.api.exceptions.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DatabaseSpecifics {
  private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseSpecifics.class);

  private DatabaseSpecifics() {}

  static DatabaseSpecific detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      var specific = detect(conn);
      LOGGER.info("Using database specifics for {}", specific.name());
      return specific;
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to detect the database product", e, false);
    }
  }

  @Nonnull
  static DatabaseSpecific detect(Connection conn) throws SQLException {
    String productName = conn.getMetaData().getDatabaseProductName().toLowerCase(Locale.ROOT);
    switch (productName) {
      case "h2":
        return new H2DatabaseSpecific();
      case "postgresql":
        try (ResultSet rs = conn.getMetaData().getSchemas(conn.getCatalog(), "crdb_internal")) {
          if (rs.next()) {
            return new CockroachDatabaseSpecific();
          } else {
            return new PostgresDatabaseSpecific();
          }
        }
      case "mysql":
        return new MySqlDatabaseSpecific();
      case "mariadb":
        return new MariaDBDatabaseSpecific();
      default:
        throw new IllegalStateException(
            "Could not select specifics to use for database product '" + productName + "'");
    }
  }

  /**
   * Tests the exception and all exceptions chained to it. Batch executions report the actual
   * failure as the next exception or the cause of a {@link java.sql.BatchUpdateException}.
   */
  static boolean anyInChain(SQLException e, Predicate<SQLException> test) {
    var seen = Collections.<SQLException>newSetFromMap(new IdentityHashMap<>());
    var pending = new ArrayDeque<SQLException>();
    pending.add(e);
    while (!pending.isEmpty()) {
      var current = pending.poll();
      if (!seen.add(current)) {
        continue;
      }
      if (test.test(current)) {
        return true;
      }
      if (current.getNextException() != null) {
        pending.add(current.getNextException());
      }
      if (current.getCause() instanceof SQLException cause) {
        pending.add(cause);
      }
    }
    return false;
  }

  abstract static class BasePostgresDatabaseSpecific implements DatabaseSpecific {

    /** Unique constraint violation error code, as returned by H2, Postgres &amp; Cockroach. */
    private static final String CONSTRAINT_VIOLATION_SQL_CODE = "23505";

    /** Foreign key violation, as returned by Postgres &amp; Cockroach. */
    private static final String FOREIGN_KEY_VIOLATION_SQL_CODE = "23503";

    /** Deadlock error, returned by Postgres. */
    private static final String DEADLOCK_SQL_STATE_POSTGRES = "40P01";

    /** Lock not available, returned by Postgres for lock timeouts. */
    private static final String LOCK_NOT_AVAILABLE_SQL_STATE_POSTGRES = "55P03";

    /** Already exists error, returned by Postgres and Cockroach. */
    private static final String ALREADY_EXISTS_STATE_POSTGRES = "42P07";

    /**
     * Serialization failure, Cockroach "retry, write too old" error, see <a
     * href="https://www.cockroachlabs.com/docs/v21.1/transaction-retry-error-reference.html#retry_write_too_old">Cockroach's
     * Transaction Retry Error Reference</a>.
     */
    private static final String RETRY_SQL_STATE = "40001";

    private final String name;
    private final Map<JdbcColumnType, String> typeMap;
    private final Map<JdbcColumnType, Integer> typeIdMap;

    BasePostgresDatabaseSpecific(String name, String nameType, String jsonType) {
      this.name = name;
      typeMap = new EnumMap<>(JdbcColumnType.class);
      typeIdMap = new EnumMap<>(JdbcColumnType.class);
      typeMap.put(JdbcColumnType.ID, "VARCHAR(36)");
      typeIdMap.put(JdbcColumnType.ID, Types.VARCHAR);
      typeMap.put(JdbcColumnType.NAME, nameType);
      typeIdMap.put(JdbcColumnType.NAME, Types.VARCHAR);
      typeMap.put(JdbcColumnType.VARCHAR, "VARCHAR");
      typeIdMap.put(JdbcColumnType.VARCHAR, Types.VARCHAR);
      typeMap.put(JdbcColumnType.JSON, jsonType);
      typeIdMap.put(JdbcColumnType.JSON, Types.VARCHAR);
      typeMap.put(JdbcColumnType.BIGINT, "BIGINT");
      typeIdMap.put(JdbcColumnType.BIGINT, Types.BIGINT);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Map<JdbcColumnType, String> columnTypes() {
      return typeMap;
    }

    @Override
    public Map<JdbcColumnType, Integer> columnTypeIds() {
      return typeIdMap;
    }

    @Override
    public boolean isConstraintViolation(SQLException e) {
      return CONSTRAINT_VIOLATION_SQL_CODE.equals(e.getSQLState());
    }

    @Override
    public boolean isForeignKeyViolation(SQLException e) {
      return FOREIGN_KEY_VIOLATION_SQL_CODE.equals(e.getSQLState());
    }

    @Override
    public boolean isRetryTransaction(SQLException e) {
      if (e.getSQLState() == null) {
        return false;
      }
      return switch (e.getSQLState()) {
        case DEADLOCK_SQL_STATE_POSTGRES,
            RETRY_SQL_STATE,
            LOCK_NOT_AVAILABLE_SQL_STATE_POSTGRES -> true;
        default -> false;
      };
    }

    @Override
    public boolean isAlreadyExists(SQLException e) {
      return ALREADY_EXISTS_STATE_POSTGRES.equals(e.getSQLState());
    }

    @Override
    public String wrapInsert(String sql) {
      return sql + " ON CONFLICT DO NOTHING";
    }

    @Override
    public String wrapUpsert(String sql, List<String> keyCols, List<String> columns) {
      return sql
          + " ON CONFLICT ("
          + String.join(", ", keyCols)
          + ") DO UPDATE SET "
          + columns.stream().map(c -> c + "=EXCLUDED." + c).collect(Collectors.joining(", "));
    }
  }

  static class H2DatabaseSpecific extends BasePostgresDatabaseSpecific {
    private static final String INSERT_INTO = "INSERT INTO ";

    /** Referential integrity violations, parent missing and child exists. */
    private static final Set<String> FOREIGN_KEY_VIOLATION_SQL_STATES = Set.of("23506", "23503");

    /** Deadlock, lock timeout and concurrent update. */
    private static final Set<String> RETRY_SQL_STATES = Set.of("40001", "HYT00", "90131");

    private static final String ALREADY_EXISTS_SQL_STATE = "42S01";

    H2DatabaseSpecific() {
      super("H2", "VARCHAR", "VARCHAR");
    }

    @Override
    public boolean isForeignKeyViolation(SQLException e) {
      return e.getSQLState() != null
          && FOREIGN_KEY_VIOLATION_SQL_STATES.contains(e.getSQLState());
    }

    @Override
    public boolean isRetryTransaction(SQLException e) {
      return e.getSQLState() != null && RETRY_SQL_STATES.contains(e.getSQLState());
    }

    @Override
    public boolean isAlreadyExists(SQLException e) {
      return ALREADY_EXISTS_SQL_STATE.equals(e.getSQLState()) || super.isAlreadyExists(e);
    }

    /** H2 has no {@code ON CONFLICT ... DO UPDATE}, its {@code MERGE ... KEY} upserts instead. */
    @Override
    public String wrapUpsert(String sql, List<String> keyCols, List<String> columns) {
      checkArgument(sql.startsWith(INSERT_INTO), "Not an INSERT statement: %s", sql);
      var values = sql.indexOf(" VALUES ");
      checkArgument(values > 0, "INSERT statement without VALUES: %s", sql);
      return "MERGE INTO "
          + sql.substring(INSERT_INTO.length(), values)
          + " KEY ("
          + String.join(", ", keyCols)
          + ")"
          + sql.substring(values);
    }
  }

  static class PostgresDatabaseSpecific extends BasePostgresDatabaseSpecific {
    // Use 'ucs_basic' collation for PostgreSQL, reference names must be ordered by their code
    // points. Locale aware collations may collapse multiple spaces and order 'ref-    2' after
    // 'ref-   19'.
    PostgresDatabaseSpecific() {
      super("PostgreSQL", "VARCHAR COLLATE ucs_basic", "TEXT");
    }
  }

  static class CockroachDatabaseSpecific extends BasePostgresDatabaseSpecific {
    CockroachDatabaseSpecific() {
      super("CockroachDB", "VARCHAR", "TEXT");
    }
  }

  abstract static class BaseMariaDBDatabaseSpecific implements DatabaseSpecific {

    private static final String NAME = "VARCHAR(255) CHARACTER SET utf8mb4 COLLATE utf8mb4_bin";
    private static final String TEXT = "TEXT CHARACTER SET utf8mb4 COLLATE utf8mb4_bin";

    private static final String MYSQL_CONSTRAINT_VIOLATION_SQL_STATE = "23000";
    private static final String MYSQL_LOCK_DEADLOCK_SQL_STATE = "40001";
    private static final String MYSQL_ALREADY_EXISTS_SQL_STATE = "42S01";

    /** {@code ER_LOCK_WAIT_TIMEOUT}, reported with the generic SQL state {@code HY000}. */
    private static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;

    /** {@code ER_NO_REFERENCED_ROW}, {@code ER_ROW_IS_REFERENCED} and their {@code _2} twins. */
    private static final Set<Integer> MYSQL_FOREIGN_KEY_ERRORS = Set.of(1216, 1217, 1451, 1452);

    private final String name;
    private final Map<JdbcColumnType, String> typeMap;
    private final Map<JdbcColumnType, Integer> typeIdMap;

    BaseMariaDBDatabaseSpecific(String name) {
      this.name = name;
      typeMap = new EnumMap<>(JdbcColumnType.class);
      typeIdMap = new EnumMap<>(JdbcColumnType.class);
      typeMap.put(JdbcColumnType.ID, "VARCHAR(36)");
      typeIdMap.put(JdbcColumnType.ID, Types.VARCHAR);
      typeMap.put(JdbcColumnType.NAME, NAME);
      typeIdMap.put(JdbcColumnType.NAME, Types.VARCHAR);
      typeMap.put(JdbcColumnType.VARCHAR, TEXT);
      typeIdMap.put(JdbcColumnType.VARCHAR, Types.LONGVARCHAR);
      typeMap.put(JdbcColumnType.JSON, "LONGTEXT");
      typeIdMap.put(JdbcColumnType.JSON, Types.LONGVARCHAR);
      typeMap.put(JdbcColumnType.BIGINT, "BIGINT");
      typeIdMap.put(JdbcColumnType.BIGINT, Types.BIGINT);
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Map<JdbcColumnType, String> columnTypes() {
      return typeMap;
    }

    @Override
    public Map<JdbcColumnType, Integer> columnTypeIds() {
      return typeIdMap;
    }

    @Override
    public boolean isConstraintViolation(SQLException e) {
      // MySQL reports unique and foreign key violations with the same SQL state
      return MYSQL_CONSTRAINT_VIOLATION_SQL_STATE.equals(e.getSQLState())
          && !isForeignKeyViolation(e);
    }

    @Override
    public boolean isForeignKeyViolation(SQLException e) {
      return MYSQL_FOREIGN_KEY_ERRORS.contains(e.getErrorCode());
    }

    @Override
    public boolean isRetryTransaction(SQLException e) {
      return MYSQL_LOCK_DEADLOCK_SQL_STATE.equals(e.getSQLState())
          || e.getErrorCode() == MYSQL_LOCK_WAIT_TIMEOUT;
    }

    @Override
    public boolean isAlreadyExists(SQLException e) {
      return MYSQL_ALREADY_EXISTS_SQL_STATE.equals(e.getSQLState());
    }

    @Override
    public String wrapInsert(String sql) {
      return sql.replace("INSERT INTO", "INSERT IGNORE INTO");
    }
  }

  static class MariaDBDatabaseSpecific extends BaseMariaDBDatabaseSpecific {
    MariaDBDatabaseSpecific() {
      super("MariaDB");
    }

    @Override
    public String wrapUpsert(String sql, List<String> keyCols, List<String> columns) {
      return sql
          + " ON DUPLICATE KEY UPDATE "
          + columns.stream().map(c -> c + "=VALUE(" + c + ')').collect(Collectors.joining(", "));
    }
  }

  static class MySqlDatabaseSpecific extends BaseMariaDBDatabaseSpecific {
    MySqlDatabaseSpecific() {
      super("MySQL");
    }

    @Override
    public String wrapUpsert(String sql, List<String> keyCols, List<String> columns) {
      return sql
          + " AS new ON DUPLICATE KEY UPDATE "
          + columns.stream().map(c -> c + "=new." + c).collect(Collectors.joining(", "));
    }
  }
}
