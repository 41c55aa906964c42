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
package org.apache.tabulary.persistence.api.refs;

import static org.apache.tabulary.persistence.api.refs.TableReference.tableReference;

import java.util.Arrays;
import java.util.List;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.InjectSoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(SoftAssertionsExtension.class)
public class TestTableReferences {
  @InjectSoftAssertions protected SoftAssertions soft;

  private static final JsonDocument KEEP_ALL = JsonDocument.parse("{\"type\":\"keep-all\"}");
  private static final JsonDocument EMPTY = JsonDocument.emptyObject();

  @Test
  public void zipPreservesOrder() {
    var refs =
        TableReferences.fromParallelSequences(
            List.of("main", "audit", "v1"), List.of(3L, 1L, 2L), List.of(KEEP_ALL, EMPTY, EMPTY));

    soft.assertThat(refs)
        .containsExactly(
            tableReference("main", 3L, KEEP_ALL),
            tableReference("audit", 1L, EMPTY),
            tableReference("v1", 2L, EMPTY));
  }

  @Test
  public void emptySequences() {
    soft.assertThat(TableReferences.fromParallelSequences(List.of(), List.of(), List.of()))
        .isEmpty();
  }

  @Test
  public void mismatchedLengths() {
    soft.assertThatThrownBy(
            () ->
                TableReferences.fromParallelSequences(
                    List.of("main", "dev"), List.of(1L, 2L), List.of(EMPTY)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage(
            "Names (2), snapshot ids (2) and retention policies (1) must have the same length");
    soft.assertThatThrownBy(
            () -> TableReferences.fromParallelSequences(List.of("main"), List.of(), List.of()))
        .isInstanceOf(InvalidArgumentException.class);
    soft.assertThatThrownBy(() -> TableReferences.fromParallelSequences(null, List.of(), List.of()))
        .isInstanceOf(InvalidArgumentException.class);
  }

  @Test
  public void invalidElements() {
    soft.assertThatThrownBy(
            () ->
                TableReferences.fromParallelSequences(
                    List.of(" "), List.of(1L), List.of(EMPTY)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessage("Reference name must not be empty");
    soft.assertThatThrownBy(
            () ->
                TableReferences.fromParallelSequences(
                    List.of("main"), Arrays.asList((Long) null), List.of(EMPTY)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("#0");
    soft.assertThatThrownBy(() -> tableReference("x".repeat(256), 1L, EMPTY))
        .isInstanceOf(InvalidArgumentException.class);
  }

  @Test
  public void duplicateNames() {
    soft.assertThatThrownBy(
            () ->
                TableReferences.fromParallelSequences(
                    List.of("main", "dev", "main", "dev", "v1"),
                    List.of(1L, 2L, 3L, 4L, 5L),
                    List.of(EMPTY, EMPTY, EMPTY, EMPTY, EMPTY)))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageEndingWith("duplicates: [dev, main]");
    soft.assertThatCode(
            () ->
                TableReferences.checkUniqueNames(
                    List.of(tableReference("main", 1L, EMPTY), tableReference("Main", 1L, EMPTY))))
        .doesNotThrowAnyException();
  }
}
