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

import java.util.List;
import org.apache.tabulary.immutables.TabularyImmutable;
import org.immutables.value.Value;

/**
 * Caller facing representation of a {@link TabularyException}, mirrors the error model of the
 * Iceberg REST catalog: an HTTP-like status code, a machine readable type, a human readable message
 * and the messages of the causes.
 */
@TabularyImmutable
public interface ErrorModel {
  int code();

  String type();

  String message();

  List<String> stack();

  @Value.Check
  default void check() {
    if (code() < 400 || code() > 599) {
      throw new IllegalStateException("code must be a 4xx or 5xx status, but is " + code());
    }
  }

  static ImmutableErrorModel.Builder builder() {
    return ImmutableErrorModel.builder();
  }
}
