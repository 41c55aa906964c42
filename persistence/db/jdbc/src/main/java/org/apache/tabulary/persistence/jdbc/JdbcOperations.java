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
import static org.apache.tabulary.persistence.jdbc.DatabaseSpecifics.anyInChain;

import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.apache.tabulary.persistence.api.exceptions.ConstraintViolationException;
import org.apache.tabulary.persistence.api.exceptions.StorageUnavailableException;
import org.apache.tabulary.persistence.api.exceptions.TabularyException;
import org.apache.tabulary.persistence.api.exceptions.UnknownOperationResultException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs units of work in JDBC transactions and translates {@link SQLException}s into {@link
 * TabularyException}s.
 */
final class JdbcOperations {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcOperations.class);

  /** SQL state class of connection exceptions. */
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  private final DataSource dataSource;
  private final DatabaseSpecific databaseSpecific;

  JdbcOperations(DataSource dataSource, DatabaseSpecific databaseSpecific) {
    this.dataSource = dataSource;
    this.databaseSpecific = databaseSpecific;
  }

  DatabaseSpecific databaseSpecific() {
    return databaseSpecific;
  }

  DataSource dataSource() {
    return dataSource;
  }

  @FunctionalInterface
  interface SQLRunnable<R> {
    R run(Connection conn) throws SQLException;
  }

  @FunctionalInterface
  interface SQLRunnableVoid {
    void run(Connection conn) throws SQLException;
  }

  void withConnectionVoid(String operation, SQLRunnableVoid runnable) {
    withConnection(
        false,
        operation,
        conn -> {
          runnable.run(conn);
          return null;
        });
  }

  /**
   * Runs {@code runnable} in a new transaction. Write transactions are committed if {@code
   * runnable} returns normally, all other transactions are rolled back.
   */
  <R> R withConnection(boolean readOnly, String operation, SQLRunnable<R> runnable) {
    Connection conn;
    try {
      conn = borrowConnection();
    } catch (SQLException e) {
      throw translate(operation, e);
    }

    R result;
    try {
      try {
        result = runnable.run(conn);
      } catch (Throwable t) {
        rollback(conn, t);
        throw t;
      }
      if (readOnly) {
        conn.rollback();
      } else {
        commit(conn, operation);
      }
    } catch (SQLException e) {
      close(conn, e);
      throw translate(operation, e);
    } catch (RuntimeException | Error e) {
      close(conn, e);
      throw e;
    }

    // the transaction has ended, a failing close() must not turn a commit into a failure
    try {
      conn.close();
    } catch (SQLException e) {
      LOGGER.warn("Closing the connection after '{}' failed", operation, e);
    }
    return result;
  }

  private void commit(Connection conn, String operation) {
    try {
      conn.commit();
    } catch (SQLException e) {
      if (!isConnectionFailure(e) && anyInChain(e, databaseSpecific::isRetryTransaction)) {
        // the database rejected the commit and rolled back
        throw new StorageUnavailableException(
            operation + " failed: transaction conflict on commit", e, true);
      }
      LOGGER.warn("Commit of '{}' failed, the outcome is unknown", operation, e);
      throw new UnknownOperationResultException(
          operation + " failed: the outcome of the commit is unknown", e);
    }
  }

  private static void close(Connection conn, Throwable failure) {
    try {
      conn.close();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  private static void rollback(Connection conn, Throwable failure) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      failure.addSuppressed(e);
    }
  }

  Connection borrowConnection() throws SQLException {
    var c = dataSource.getConnection();
    c.setAutoCommit(false);
    return c;
  }

  TabularyException translate(String operation, SQLException e) {
    if (anyInChain(e, databaseSpecific::isForeignKeyViolation)) {
      return new ConstraintViolationException(
          operation + " failed: a referenced entity does not exist", e);
    }
    if (anyInChain(e, databaseSpecific::isConstraintViolation)) {
      return new ConstraintViolationException(
          operation + " failed: an entity with the same key already exists", e);
    }
    if (anyInChain(e, databaseSpecific::isRetryTransaction)) {
      LOGGER.debug("'{}' failed with a transient conflict, transaction rolled back", operation);
      return new StorageUnavailableException(operation + " failed: transaction conflict", e, true);
    }
    return new StorageUnavailableException(operation + " failed: unhandled SQL exception", e, false);
  }

  static boolean isConnectionFailure(SQLException e) {
    return anyInChain(
        e, c -> c.getSQLState() != null && c.getSQLState().startsWith(CONNECTION_EXCEPTION_CLASS));
  }

  /** Expands the single {@code (?)} placeholder of {@code sql} to {@code count} placeholders. */
  static String sqlInMultipleMultiple(String sql, int count) {
    checkArgument(count > 0, "count must be positive");
    if (count == 1) {
      return sql;
    }
    var marks = new StringBuilder(sql.length() + 10 + 3 * count);
    var idx = sql.indexOf("(?)");
    checkArgument(idx > 0, "SQL does not contain (?) placeholder: %s", sql);
    marks.append(sql, 0, idx).append("(?");
    for (var i = 1; i < count; i++) {
      marks.append(",?");
    }
    marks.append(')').append(sql, idx + 3, sql.length());
    return marks.toString();
  }
}
