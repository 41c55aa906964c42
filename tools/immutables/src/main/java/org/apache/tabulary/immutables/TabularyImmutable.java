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
package org.apache.tabulary.immutables;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import org.immutables.value.Value;

/**
 * Meta annotation for value types generated by Immutables, applies the project wide style.
 *
 * <p>Types annotated with this annotation get an {@code Immutable*} implementation with a builder,
 * a lazily computed hash code and, for {@link Value.Parameter} attributes, an {@code of(...)}
 * factory.
 */
@Documented
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.CLASS)
@Value.Immutable
@Value.Style(
    defaults = @Value.Immutable(lazyhash = true),
    clearBuilder = true,
    forceJacksonPropertyNames = false,
    visibility = Value.Style.ImplementationVisibility.PUBLIC)
public @interface TabularyImmutable {}
