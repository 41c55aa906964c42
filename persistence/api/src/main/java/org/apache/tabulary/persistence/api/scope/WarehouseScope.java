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
package org.apache.tabulary.persistence.api.scope;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException;
import org.apache.tabulary.persistence.api.ids.WarehouseId;

public final class WarehouseScope {
  private WarehouseScope() {}

  /**
   * Requires the warehouse status to be {@link WarehouseStatus#ACTIVE}, an empty status means the
   * warehouse does not exist.
   *
   * @throws WarehouseNotActiveException otherwise
   */
  public static void checkActive(WarehouseId warehouseId, Optional<WarehouseStatus> status) {
    requireNonNull(warehouseId, "warehouseId");
    if (status.isEmpty()) {
      throw new WarehouseNotActiveException(
          warehouseId, "Warehouse " + warehouseId + " does not exist");
    }
    if (status.get() != WarehouseStatus.ACTIVE) {
      throw new WarehouseNotActiveException(
          warehouseId, "Warehouse " + warehouseId + " is " + status.get().value());
    }
  }
}
