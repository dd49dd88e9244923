/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.loopkernel.eval;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;

/** Callable handle to a program that has been registered with an
 * {@link Engine}. */
public interface Handle {
  /** Returns the name under which the program was registered. */
  String name();

  /** Returns the names of the parameters, in sorted order. */
  ImmutableSortedSet<String> parameters();

  /** Returns the program. */
  Program program();

  /**
   * Invokes the program.
   *
   * <p>{@code arguments} must contain a non-null value for each parameter
   * and no other entries. Arrays and lists in the arguments may be
   * modified.
   *
   * @return Values of the function-level variables after the program
   * completes, including the parameters
   * @throws Codes.KernelRuntimeException if an argument is missing or
   * unexpected, or an error occurs while running
   */
  ImmutableSortedMap<String, Object> invoke(Map<String, ?> arguments);
}

// End Handle.java
