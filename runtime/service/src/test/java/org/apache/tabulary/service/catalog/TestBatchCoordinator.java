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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.exceptions.NotFoundException;
import org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException;
import org.apache.tabulary.persistence.api.ids.NamespaceId;
import org.apache.tabulary.persistence.api.ids.TableId;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.refs.ReferenceStore;
import org.apache.tabulary.persistence.api.scope.WarehouseScopeGuard;
import org.apache.tabulary.persistence.api.tables.TableMetadataReader;
import org.apache.tabulary.persistence.api.tables.TableRecord;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.InjectSoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(SoftAssertionsExtension.class)
public class TestBatchCoordinator {
  @InjectSoftAssertions protected SoftAssertions soft;

  private static final JsonDocument KEEP_LAST = JsonDocument.parse("{\"min-snapshots\":1}");
  private static final JsonDocument EMPTY = JsonDocument.emptyObject();

  private ReferenceStore referenceStore;
  private TableMetadataReader reader;
  private WarehouseScopeGuard guard;
  private BatchCoordinator coordinator;

  private final WarehouseId warehouseId = WarehouseId.randomWarehouseId();
  private final TableId tableId = TableId.randomTableId();

  @BeforeEach
  public void setup() {
    referenceStore = mock(ReferenceStore.class);
    reader = mock(TableMetadataReader.class);
    guard = mock(WarehouseScopeGuard.class);
    coordinator = new BatchCoordinator(referenceStore, reader, guard);
  }

  @Test
  public void replaceDispatchesInInputOrder() {
    coordinator.replaceReferences(
        ReplaceReferencesRequest.builder()
            .tableId(tableId)
            .names(List.of("main", "audit"))
            .snapshotIds(List.of(102L, 7L))
            .retention(List.of(KEEP_LAST, EMPTY))
            .build());

    verify(referenceStore)
        .replaceReferences(
            tableId,
            List.of(tableReference("main", 102L, KEEP_LAST), tableReference("audit", 7L, EMPTY)));
    verifyNoMoreInteractions(referenceStore);
    verifyNoInteractions(reader, guard);
  }

  @Test
  public void replaceWithWarehouseUsesGuardedForm() {
    coordinator.replaceReferences(
        ReplaceReferencesRequest.builder()
            .warehouseId(warehouseId)
            .tableId(tableId)
            .names(List.of("main"))
            .snapshotIds(List.of(1L))
            .retention(List.of(EMPTY))
            .build());

    verify(referenceStore)
        .replaceReferences(warehouseId, tableId, List.of(tableReference("main", 1L, EMPTY)));
    verifyNoMoreInteractions(referenceStore);
  }

  @Test
  public void invalidRequestsNeverReachStorage() {
    soft.assertThatThrownBy(
            () ->
                coordinator.replaceReferences(
                    ReplaceReferencesRequest.builder()
                        .tableId(tableId)
                        .names(List.of("main", "dev"))
                        .snapshotIds(List.of(1L))
                        .retention(List.of(EMPTY, EMPTY))
                        .build()))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("same length");
    soft.assertThatThrownBy(
            () ->
                coordinator.replaceReferences(
                    ReplaceReferencesRequest.builder()
                        .warehouseId(warehouseId)
                        .tableId(tableId)
                        .names(List.of("main", "main"))
                        .snapshotIds(List.of(1L, 2L))
                        .retention(List.of(EMPTY, EMPTY))
                        .build()))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("duplicates: [main]");
    soft.assertThatThrownBy(
            () ->
                coordinator.replaceReferences(
                    ReplaceReferencesRequest.builder()
                        .tableId(tableId)
                        .names(List.of(""))
                        .snapshotIds(List.of(1L))
                        .retention(List.of(EMPTY))
                        .build()))
        .isInstanceOf(InvalidArgumentException.class);

    verifyNoInteractions(referenceStore, reader, guard);
  }

  @Test
  public void nullElementsAreInvalidArguments() {
    soft.assertThatThrownBy(
            () ->
                coordinator.replaceReferences(
                    ReplaceReferencesRequest.builder()
                        .tableId(tableId)
                        .names(Arrays.asList("main", null))
                        .snapshotIds(List.of(1L, 2L))
                        .retention(List.of(EMPTY, EMPTY))
                        .build()))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("Element #1 of the reference update contains a null value");
    soft.assertThatThrownBy(
            () ->
                coordinator.replaceReferences(
                    ReplaceReferencesRequest.builder()
                        .warehouseId(warehouseId)
                        .tableId(tableId)
                        .names(List.of("main"))
                        .snapshotIds(Arrays.asList((Long) null))
                        .retention(Arrays.asList((JsonDocument) null))
                        .build()))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("Element #0 of the reference update contains a null value");

    verifyNoInteractions(referenceStore, reader, guard);
  }

  @Test
  public void emptyReplaceIsDispatched() {
    coordinator.replaceReferences(
        ReplaceReferencesRequest.builder().warehouseId(warehouseId).tableId(tableId).build());

    verify(referenceStore).replaceReferences(warehouseId, tableId, List.of());
  }

  @Test
  public void readComputesMissing() {
    var t1 = TableId.randomTableId();
    var t2 = TableId.randomTableId();
    var t3 = TableId.randomTableId();
    var r1 = record(t1);
    var r3 = record(t3);
    var ids = Set.of(t1, t2, t3);
    when(reader.readTables(warehouseId, ids, false)).thenReturn(List.of(r3, r1));

    var result = coordinator.readTables(readTablesRequest(warehouseId, ids, false));

    soft.assertThat(result.found()).containsOnlyKeys(t1, t3);
    soft.assertThat(result.get(t1)).contains(r1);
    soft.assertThat(result.get(t2)).isEmpty();
    soft.assertThat(result.missing()).containsExactly(t2);
  }

  @Test
  public void readPassesDeletedFlag() {
    var ids = Set.of(tableId);
    when(reader.readTables(warehouseId, ids, true)).thenReturn(List.of(record(tableId)));

    var result = coordinator.readTables(readTablesRequest(warehouseId, ids, true));

    soft.assertThat(result.missing()).isEmpty();
    verify(reader).readTables(warehouseId, ids, true);
  }

  @Test
  public void requireTablesNamesMissing() {
    var t1 = TableId.randomTableId();
    var t2 = TableId.randomTableId();
    when(reader.readTables(any(), any(), anyBoolean())).thenReturn(List.of(record(t1)));

    soft.assertThatThrownBy(
            () -> coordinator.requireTables(readTablesRequest(warehouseId, Set.of(t1, t2), false)))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining(t2.toString())
        .hasMessageNotContaining(t1.toString());
    soft.assertThat(
            coordinator
                .requireTables(readTablesRequest(warehouseId, Set.of(t1), false))
                .found())
        .containsOnlyKeys(t1);
  }

  @Test
  public void ensureActiveDelegatesToGuard() {
    coordinator.ensureActive(warehouseId);
    verify(guard).requireActive(warehouseId);

    var other = WarehouseId.randomWarehouseId();
    doThrow(new WarehouseNotActiveException(other, "Warehouse " + other + " is inactive"))
        .when(guard)
        .requireActive(other);
    soft.assertThatThrownBy(() -> coordinator.ensureActive(other))
        .isInstanceOf(WarehouseNotActiveException.class);
  }

  private static TableRecord record(TableId tableId) {
    return TableRecord.builder()
        .tableId(tableId)
        .namespaceId(NamespaceId.randomNamespaceId())
        .metadata(JsonDocument.parse("{\"table-uuid\":\"" + tableId + "\"}"))
        .metadataLocation("s3://bucket/" + tableId + "/metadata.json")
        .storageProfile(JsonDocument.parse("{\"type\":\"s3\"}"))
        .build();
  }
}
