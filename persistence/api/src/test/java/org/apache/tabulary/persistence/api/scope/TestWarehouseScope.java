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

import java.util.Optional;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.exceptions.WarehouseNotActiveException;
import org.apache.tabulary.persistence.api.ids.WarehouseId;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.InjectSoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(SoftAssertionsExtension.class)
public class TestWarehouseScope {
  @InjectSoftAssertions protected SoftAssertions soft;

  @Test
  public void checkActive() {
    var warehouseId = WarehouseId.randomWarehouseId();

    soft.assertThatCode(
            () -> WarehouseScope.checkActive(warehouseId, Optional.of(WarehouseStatus.ACTIVE)))
        .doesNotThrowAnyException();
    soft.assertThatThrownBy(
            () -> WarehouseScope.checkActive(warehouseId, Optional.of(WarehouseStatus.INACTIVE)))
        .isInstanceOf(WarehouseNotActiveException.class)
        .hasMessageEndingWith("is inactive");
    soft.assertThatThrownBy(() -> WarehouseScope.checkActive(warehouseId, Optional.empty()))
        .isInstanceOf(WarehouseNotActiveException.class)
        .hasMessageEndingWith("does not exist");
  }

  @Test
  public void statusValues() {
    soft.assertThat(WarehouseStatus.ACTIVE.value()).isEqualTo("active");
    soft.assertThat(WarehouseStatus.INACTIVE.value()).isEqualTo("inactive");
    soft.assertThat(WarehouseStatus.fromValue("inactive")).isSameAs(WarehouseStatus.INACTIVE);
    soft.assertThatThrownBy(() -> WarehouseStatus.fromValue("ACTIVE"))
        .isInstanceOf(InvalidArgumentException.class);
  }
}
