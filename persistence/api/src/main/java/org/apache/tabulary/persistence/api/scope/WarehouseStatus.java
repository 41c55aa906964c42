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

import org.apache.tabulary.persistence.api.exceptions.InvalidArgumentException;

public enum WarehouseStatus {
  ACTIVE("active"),
  INACTIVE("inactive"),
  ;

  private final String value;

  WarehouseStatus(String value) {
    this.value = value;
  }

  /** Persisted and serialized representation. */
  public String value() {
    return value;
  }

  public static WarehouseStatus fromValue(String value) {
    for (var status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new InvalidArgumentException("Unknown warehouse status: " + value);
  }
}
