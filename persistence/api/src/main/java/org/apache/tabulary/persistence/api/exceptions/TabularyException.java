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
package org.apache.tabulary.persistence.api.exceptions;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Map;

/** Base class of all failures reported by the catalog persistence. */
public abstract class TabularyException extends RuntimeException {

  protected TabularyException(String message) {
    super(message);
  }

  protected TabularyException(String message, Throwable cause) {
    super(message, cause);
  }

  /** HTTP-like status code. */
  public abstract int code();

  /** Machine readable error type, for example {@code WarehouseNotActive}. */
  public abstract String type();

  public OperationOutcome outcome() {
    return OperationOutcome.NOT_COMMITTED;
  }

  /** Whether the same request can be retried as is, without re-reading any state. */
  public boolean isRetryable() {
    return false;
  }

  public ErrorModel toErrorModel() {
    var stack = new ArrayList<String>();
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    for (var c = getCause(); c != null && seen.put(c, Boolean.TRUE) == null; c = c.getCause()) {
      stack.add(c.toString());
    }
    return ErrorModel.builder()
        .code(code())
        .type(type())
        .message(getMessage())
        .stack(stack)
        .build();
  }
}
