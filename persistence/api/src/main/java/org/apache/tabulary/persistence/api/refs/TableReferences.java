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

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.TreeSet;
import org.apache.tabulary.persistence.api.document.JsonDocument;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;

public final class TableReferences {
  private TableReferences() {}

  /**
   * Combines parallel sequences of names, snapshot ids and retention policies into a list of
   * references, preserving the input order.
   *
   * @throws InvalidArgumentException if the sequences are of different lengths, contain {@code
   *     null} elements, blank or duplicate names
   */
  public static List<TableReference> fromParallelSequences(
      List<String> names, List<Long> snapshotIds, List<JsonDocument> retention) {
    if (names == null || snapshotIds == null || retention == null) {
      throw new InvalidArgumentException(
          "Names, snapshot ids and retention policies must all be provided");
    }
    if (names.size() != snapshotIds.size() || names.size() != retention.size()) {
      throw new InvalidArgumentException(
          format(
              "Names (%d), snapshot ids (%d) and retention policies (%d) must have the same length",
              names.size(), snapshotIds.size(), retention.size()));
    }

    var references = new ArrayList<TableReference>(names.size());
    for (int i = 0; i < names.size(); i++) {
      var name = names.get(i);
      var snapshotId = snapshotIds.get(i);
      var policy = retention.get(i);
      if (name == null || snapshotId == null || policy == null) {
        throw new InvalidArgumentException(
            format("Element #%d of the reference update contains a null value", i));
      }
      references.add(TableReference.tableReference(name, snapshotId, policy));
    }
    checkUniqueNames(references);
    return references;
  }

  /**
   * Ensures that a batch mentions each reference name at most once.
   *
   * @throws InvalidArgumentException naming the duplicates otherwise
   */
  public static void checkUniqueNames(List<TableReference> references) {
    var seen = new HashSet<String>();
    var duplicates = new TreeSet<String>();
    for (var reference : references) {
      if (!seen.add(reference.name())) {
        duplicates.add(reference.name());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new InvalidArgumentException(
          "Reference names must be unique within one update, duplicates: " + duplicates);
    }
  }
}
