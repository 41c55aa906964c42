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

import org.apache.tabulary.persistence.api.exceptions.TabularyException;
import org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.apache.tabulary.persistence.api.scope.WarehouseStatus;
import org.junit.jupiter.api.Test;

public class TestJdbcWarehouseScopeGuard extends PersistenceTestBase {

  @Test
  public void activeWarehouse() {
    var warehouseId = createWarehouse("active");

    soft.assertThatCode(() -> persistence.warehouseScopeGuard().requireActive(warehouseId))
        .doesNotThrowAnyException();
  }

  @Test
  public void inactiveWarehouse() {
    var warehouseId = createWarehouse("retired");
    persistence.catalogDirectory().setWarehouseStatus(warehouseId, WarehouseStatus.INACTIVE);

    soft.assertThatThrownBy(() -> persistence.warehouseScopeGuard().requireActive(warehouseId))
        .isInstanceOf(WarehouseNotActiveException.class)
        .hasMessage("Warehouse " + warehouseId + " is inactive")
        .satisfies(
            e -> {
              var ex = (WarehouseNotActiveException) e;
              soft.assertThat(ex.warehouseId()).isEqualTo(warehouseId);
              soft.assertThat(ex.toErrorModel().type()).isEqualTo("WarehouseNotActive");
              soft.assertThat(ex.toErrorModel().code()).isEqualTo(409);
            });
  }

  @Test
  public void reactivatedWarehouse() {
    var warehouseId = createWarehouse("back");
    persistence.catalogDirectory().setWarehouseStatus(warehouseId, WarehouseStatus.INACTIVE);
    persistence.catalogDirectory().setWarehouseStatus(warehouseId, WarehouseStatus.ACTIVE);

    soft.assertThatCode(() -> persistence.warehouseScopeGuard().requireActive(warehouseId))
        .doesNotThrowAnyException();
  }

  @Test
  public void unknownWarehouse() {
    var warehouseId = WarehouseId.randomWarehouseId();

    soft.assertThatThrownBy(() -> persistence.warehouseScopeGuard().requireActive(warehouseId))
        .isInstanceOf(WarehouseNotActiveException.class)
        .hasMessage("Warehouse " + warehouseId + " does not exist")
        .extracting(e -> ((TabularyException) e).isRetryable())
        .isEqualTo(false);
  }
}
