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
package org.apache.tabulary.persistence.api.ids;

import java.util.Locale;
import java.util.UUID;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.apache.tabulary.persistence.api.exceptions.TabularyException;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.InjectSoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(SoftAssertionsExtension.class)
public class TestIds {
  @InjectSoftAssertions protected SoftAssertions soft;

  @Test
  public void parseValidIds() {
    var uuid = UUID.randomUUID();

    soft.assertThat(WarehouseId.parse(uuid.toString())).isEqualTo(WarehouseId.warehouseId(uuid));
    soft.assertThat(NamespaceId.parse(uuid.toString())).isEqualTo(NamespaceId.namespaceId(uuid));
    soft.assertThat(TableId.parse(uuid.toString())).isEqualTo(TableId.tableId(uuid));
    soft.assertThat(TableId.tableId(uuid)).hasToString(uuid.toString());
    soft.assertThat(WarehouseId.fromPrefix(uuid.toString()).uuid()).isEqualTo(uuid);
  }

  @Test
  public void parseInvalidIds() {
    soft.assertThatThrownBy(() -> WarehouseId.parse("not-a-uuid"))
        .isInstanceOf(InvalidArgumentException.class)
        .extracting(e -> ((TabularyException) e).type())
        .isEqualTo("WarehouseIDIsNotUUID");
    soft.assertThatThrownBy(() -> NamespaceId.parse("ns"))
        .isInstanceOf(InvalidArgumentException.class)
        .extracting(e -> ((TabularyException) e).type())
        .isEqualTo("NamespaceIDIsNotUUID");
    soft.assertThatThrownBy(() -> TableId.parse(""))
        .isInstanceOf(InvalidArgumentException.class)
        .extracting(e -> ((TabularyException) e).type())
        .isEqualTo("TableIDIsNotUUID");
    soft.assertThatThrownBy(() -> TableId.parse(null))
        .isInstanceOf(InvalidArgumentException.class)
        .extracting(e -> ((TabularyException) e).code())
        .isEqualTo(400);
    soft.assertThatThrownBy(() -> WarehouseId.fromPrefix("my-catalog"))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("my-catalog")
        .extracting(e -> ((TabularyException) e).type())
        .isEqualTo("PrefixIsNotWarehouseID");
  }

  @Test
  public void onlyCanonicalUuids() {
    var uuid = UUID.randomUUID();

    for (var value :
        new String[] {"1-1-1-1-1", uuid.toString().replace("-", ""), "{" + uuid + "}", uuid + " "}) {
      soft.assertThatThrownBy(() -> TableId.parse(value))
          .describedAs(value)
          .isInstanceOf(InvalidArgumentException.class)
          .extracting(e -> ((TabularyException) e).type())
          .isEqualTo("TableIDIsNotUUID");
      soft.assertThatThrownBy(() -> WarehouseId.fromPrefix(value))
          .describedAs(value)
          .isInstanceOf(InvalidArgumentException.class)
          .extracting(e -> ((TabularyException) e).type())
          .isEqualTo("PrefixIsNotWarehouseID");
    }

    soft.assertThat(NamespaceId.parse(uuid.toString().toUpperCase(Locale.ROOT)))
        .isEqualTo(NamespaceId.namespaceId(uuid));
  }

  @Test
  public void randomIdsDiffer() {
    soft.assertThat(TableId.randomTableId()).isNotEqualTo(TableId.randomTableId());
    soft.assertThatNullPointerException().isThrownBy(() -> TableId.tableId(null));
  }
}
