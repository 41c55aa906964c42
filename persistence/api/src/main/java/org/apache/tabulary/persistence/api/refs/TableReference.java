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

import org.apache.tabulary.immutables.TabularyImmutable;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;
import org.immutables.value.Value;

/**
 * Named pointer of a table, a branch or a tag, to one of the table's snapshots.
 *
 * <p>The {@link #retention() retention policy} is interpreted by table maintenance, never by the
 * persistence layer.
 */
@TabularyImmutable
public interface TableReference {
  int MAX_NAME_LENGTH = 255;

  @Value.Parameter(order = 1)
  String name();

  @Value.Parameter(order = 2)
  long snapshotId();

  @Value.Parameter(order = 3)
  JsonDocument retention();

  @Value.Check
  default void check() {
    if (name().isBlank()) {
      throw new InvalidArgumentException("Reference name must not be empty");
    }
    if (name().length() > MAX_NAME_LENGTH) {
      throw new InvalidArgumentException(
          "Reference name must not be longer than " + MAX_NAME_LENGTH + " characters");
    }
  }

  static TableReference tableReference(String name, long snapshotId, JsonDocument retention) {
    return ImmutableTableReference.of(name, snapshotId, retention);
  }
}
