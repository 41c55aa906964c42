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

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;

final class Identifiers {
  private Identifiers() {}

  /** 8-4-4-4-12 hex digits, {@link UUID#fromString(String)} alone also accepts shorter groups. */
  private static final Pattern CANONICAL_UUID =
      Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  static UUID parseUuid(String value, String what, String errorType) {
    if (value == null) {
      throw new InvalidArgumentException(errorType, "Provided " + what + " must not be null");
    }
    return parseCanonicalUuid(value)
        .orElseThrow(
            () ->
                new InvalidArgumentException(
                    errorType, "Provided " + what + " is not a valid UUID"));
  }

  /** Empty unless {@code value} is a UUID in its canonical textual form. */
  static Optional<UUID> parseCanonicalUuid(String value) {
    return CANONICAL_UUID.matcher(value).matches()
        ? Optional.of(UUID.fromString(value))
        : Optional.empty();
  }
}
