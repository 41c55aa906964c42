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

import static org.apache.tabulary.persistence.jdbc.JdbcConfiguration.DEFAULT_ACQUISITION_TIMEOUT;
import static org.apache.tabulary.persistence.jdbc.JdbcConfiguration.DEFAULT_INITIAL_POOL_SIZE;
import static org.apache.tabulary.persistence.jdbc.JdbcConfiguration.DEFAULT_ISOLATION;
import static org.apache.tabulary.persistence.jdbc.JdbcConfiguration.DEFAULT_MAX_LIFETIME;
import static org.apache.tabulary.persistence.jdbc.JdbcConfiguration.DEFAULT_MAX_POOL_SIZE;
import static org.apache.tabulary.persistence.jdbc.JdbcConfiguration.DEFAULT_MIN_POOL_SIZE;

import io.agroal.api.AgroalDataSource;
import io.agroal.api.configuration.AgroalConnectionFactoryConfiguration;
import io.agroal.api.configuration.supplier.AgroalDataSourceConfigurationSupplier;
import io.agroal.api.security.NamePrincipal;
import io.agroal.api.security.SimplePassword;
import jakarta.annotation.Nonnull;
import java.sql.SQLException;
import org.apache.tabulary.persistence.api.CatalogPersistence;
import org.apache.tabulary.persistence.api.exceptions.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JdbcPersistenceFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcPersistenceFactory.class);

  public static final String NAME = "JDBC";

  @Nonnull
  public String name() {
    return NAME;
  }

  /**
   * Builds the connection pool and the persistence on top of it, then sets up the schema if
   * {@link JdbcConfiguration#setupSchema()} is enabled.
   */
  @Nonnull
  public CatalogPersistence createPersistence(@Nonnull JdbcConfiguration config) {
    var persistence = buildPersistence(buildConfiguration(config));
    if (config.setupSchema()) {
      try {
        persistence.setupSchema();
      } catch (RuntimeException e) {
        try {
          persistence.close();
        } catch (RuntimeException closeFailure) {
          e.addSuppressed(closeFailure);
        }
        throw e;
      }
    }
    return persistence;
  }

  @Nonnull
  public CatalogPersistence buildPersistence(@Nonnull JdbcPersistenceConfig persistenceConfig) {
    DatabaseSpecific databaseSpecific = DatabaseSpecifics.detect(persistenceConfig.dataSource());
    return new JdbcCatalogPersistence(persistenceConfig, databaseSpecific);
  }

  public JdbcPersistenceConfig buildConfiguration(JdbcConfiguration config) {
    var dataSourceConfiguration = new AgroalDataSourceConfigurationSupplier();
    var poolConfiguration = dataSourceConfiguration.connectionPoolConfiguration();
    var connectionFactoryConfiguration = poolConfiguration.connectionFactoryConfiguration();

    // configure pool
    poolConfiguration
        .initialSize(config.initialPoolSize().orElse(DEFAULT_INITIAL_POOL_SIZE))
        .maxSize(config.maxPoolSize().orElse(DEFAULT_MAX_POOL_SIZE))
        .minSize(config.minPoolSize().orElse(DEFAULT_MIN_POOL_SIZE))
        .maxLifetime(config.maxLifetime().orElse(DEFAULT_MAX_LIFETIME))
        .acquisitionTimeout(config.acquisitionTimeout().orElse(DEFAULT_ACQUISITION_TIMEOUT));

    // configure supplier
    connectionFactoryConfiguration.jdbcUrl(config.url());

    config
        .username()
        .ifPresent(
            u -> {
              connectionFactoryConfiguration.credential(new NamePrincipal(u));
              connectionFactoryConfiguration.credential(
                  new SimplePassword(
                      config
                          .password()
                          .orElseThrow(
                              () ->
                                  new IllegalArgumentException(
                                      "Must specify JDBC password if username is provided"))));
            });

    var isolation = config.transactionIsolation().orElse(DEFAULT_ISOLATION);
    connectionFactoryConfiguration.jdbcTransactionIsolation(
        AgroalConnectionFactoryConfiguration.TransactionIsolation.valueOf(isolation.name()));
    connectionFactoryConfiguration.autoCommit(false);

    LOGGER.info(
        "Creating JDBC connection pool, max size {}, isolation {}",
        config.maxPoolSize().orElse(DEFAULT_MAX_POOL_SIZE),
        isolation);

    AgroalDataSource dataSource;
    try {
      dataSource = AgroalDataSource.from(dataSourceConfiguration.get());
    } catch (SQLException e) {
      throw new StorageUnavailableException("Failed to create the JDBC connection pool", e, false);
    }

    return new JdbcPersistenceConfig(dataSource, true);
  }
}
