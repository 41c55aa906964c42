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

import static org.apache.tabulary.persistence.api.refs.TableReference.tableReference;
import static org.apache.tabulary.service.catalog.ReadTablesRequest.readTablesRequest;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.apache.tabulary.persistence.api.CatalogPersistence;
import org.apache.tabulary.persistence.api.directory.Warehouse;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.ConstraintViolationException;
import org.apache.tabulary.persistence.api.exceptions.NotFoundException;
import org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException;
import org.apache.tabulary.persistence.api.ids.NamespaceId;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.scope.WarehouseStatus;
import org.apache.tabulary.persistence.jdbc.JdbcConfiguration;
import org.apache.tabulary.persistence.jdbc.JdbcPersistenceFactory;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.InjectSoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/** Runs the coordinator against the JDBC persistence on an in-memory H2 database. */
@ExtendWith(SoftAssertionsExtension.class)
public class TestBatchCoordinatorWithH2 {
  @InjectSoftAssertions protected SoftAssertions soft;

  private static final JsonDocument EMPTY = JsonDocument.emptyObject();

  private CatalogPersistence persistence;
  private BatchCoordinator coordinator;

  private WarehouseId warehouseId;
  private NamespaceId namespaceId;

  @BeforeEach
  public void setup() {
    var config =
        new SmallRyeConfigBuilder()
            .withMapping(JdbcConfiguration.class)
            .withSources(
                new PropertiesConfigSource(
                    Map.of(
                        "tabulary.persistence.jdbc.url",
                        "jdbc:h2:mem:"
                            + UUID.randomUUID()
                            + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000"),
                    "test",
                    100))
            .build()
            .getConfigMapping(JdbcConfiguration.class);
    persistence = new JdbcPersistenceFactory().createPersistence(config);
    coordinator = BatchCoordinator.forPersistence(persistence);

    warehouseId = WarehouseId.randomWarehouseId();
    namespaceId = NamespaceId.randomNamespaceId();
    var directory = persistence.catalogDirectory();
    directory.createWarehouse(
        Warehouse.builder()
            .id(warehouseId)
            .name("analytics")
            .storageProfile(JsonDocument.parse("{\"type\":\"s3\",\"bucket\":\"analytics\"}"))
            .build());
    directory.createNamespace(warehouseId, namespaceId, "sales");
  }

  @AfterEach
  public void tearDown() {
    if (persistence != null) {
      persistence.close();
    }
  }

  private TableId createTable(String name) {
    var tableId = TableId.randomTableId();
    persistence
        .catalogDirectory()
        .createTable(
            namespaceId,
            tableId,
            name,
            JsonDocument.parse("{\"format-version\":2,\"table-uuid\":\"" + tableId + "\"}"),
            "s3://analytics/" + name + "/metadata/00000.metadata.json");
    return tableId;
  }

  private ReplaceReferencesRequest replace(
      TableId tableId, List<String> names, List<Long> snapshotIds) {
    return ReplaceReferencesRequest.builder()
        .warehouseId(warehouseId)
        .tableId(tableId)
        .names(names)
        .snapshotIds(snapshotIds)
        .retention(names.stream().map(n -> EMPTY).toList())
        .build();
  }

  @Test
  public void commitThenLoad() {
    var tableId = createTable("orders");

    coordinator.replaceReferences(replace(tableId, List.of("main", "audit"), List.of(101L, 5L)));
    coordinator.replaceReferences(replace(tableId, List.of("main"), List.of(102L)));

    soft.assertThat(persistence.referenceStore().fetchReferences(tableId))
        .containsExactly(tableReference("audit", 5L, EMPTY), tableReference("main", 102L, EMPTY));

    var result = coordinator.requireTables(readTablesRequest(warehouseId, Set.of(tableId), false));
    soft.assertThat(result.get(tableId))
        .hasValueSatisfying(
            r -> {
              soft.assertThat(r.namespaceId()).isEqualTo(namespaceId);
              soft.assertThat(r.metadataLocation())
                  .contains("s3://analytics/orders/metadata/00000.metadata.json");
              soft.assertThat(r.storageProfile().serialize())
                  .isEqualTo("{\"type\":\"s3\",\"bucket\":\"analytics\"}");
            });
  }

  @Test
  public void softDeletedTablesAreMissing() {
    var t1 = createTable("t1");
    var t2 = createTable("t2");
    persistence.catalogDirectory().markTableDeleted(t2, Instant.parse("2026-01-01T00:00:00Z"));

    var result = coordinator.readTables(readTablesRequest(warehouseId, Set.of(t1, t2), false));
    soft.assertThat(result.found()).containsOnlyKeys(t1);
    soft.assertThat(result.missing()).containsExactly(t2);

    var withDeleted = coordinator.readTables(readTablesRequest(warehouseId, Set.of(t1, t2), true));
    soft.assertThat(withDeleted.missing()).isEmpty();
    soft.assertThat(withDeleted.get(t2))
        .hasValueSatisfying(r -> soft.assertThat(r.isDeleted()).isTrue());

    soft.assertThatThrownBy(
            () -> coordinator.requireTables(readTablesRequest(warehouseId, Set.of(t1, t2), false)))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining(t2.toString());
  }

  @Test
  public void inactiveWarehouse() {
    var tableId = createTable("orders");
    coordinator.replaceReferences(replace(tableId, List.of("main"), List.of(1L)));

    persistence.catalogDirectory().setWarehouseStatus(warehouseId, WarehouseStatus.INACTIVE);

    soft.assertThat(
            coordinator.readTables(readTablesRequest(warehouseId, Set.of(tableId), false)).found())
        .isEmpty();
    soft.assertThatThrownBy(() -> coordinator.ensureActive(warehouseId))
        .isInstanceOf(WarehouseNotActiveException.class);
    soft.assertThatThrownBy(
            () -> coordinator.replaceReferences(replace(tableId, List.of("main"), List.of(2L))))
        .isInstanceOf(WarehouseNotActiveException.class);
    soft.assertThat(persistence.referenceStore().fetchReferences(tableId))
        .containsExactly(tableReference("main", 1L, EMPTY));
  }

  @Test
  public void tableOfAnotherWarehouse() {
    var tableId = createTable("orders");
    var otherWarehouse = WarehouseId.randomWarehouseId();
    persistence
        .catalogDirectory()
        .createWarehouse(
            Warehouse.builder().id(otherWarehouse).name("other").storageProfile(EMPTY).build());

    soft.assertThatThrownBy(
            () ->
                coordinator.replaceReferences(
                    ReplaceReferencesRequest.builder()
                        .warehouseId(otherWarehouse)
                        .tableId(tableId)
                        .addNames("main")
                        .addSnapshotIds(1L)
                        .addRetention(EMPTY)
                        .build()))
        .isInstanceOf(ConstraintViolationException.class);
    soft.assertThat(
            coordinator
                .readTables(readTablesRequest(otherWarehouse, Set.of(tableId), false))
                .missing())
        .containsExactly(tableId);
  }
}
