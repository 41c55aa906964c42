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

/**
 * The storage engine failed the operation and rolled back the transaction. The previous state is
 * unchanged.
 */
public class StorageUnavailableException extends TabularyException {
  public static final String TYPE = "StorageUnavailable";

  private final boolean retryable;

  public StorageUnavailableException(String message, Throwable cause, boolean retryable) {
    super(message, cause);
    this.retryable = retryable;
  }

  @Override
  public int code() {
    return 503;
  }

  @Override
  public String type() {
    return TYPE;
  }

  /**
   * {@code true} if the storage engine reported a transient conflict, like a deadlock, a
   * serialization failure or a lock timeout.
   */
  @Override
  public boolean isRetryable() {
    return retryable;
  }
}
