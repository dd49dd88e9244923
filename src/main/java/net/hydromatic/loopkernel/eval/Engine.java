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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Execution engine that can turn a {@link Program} into something that can
 * be called. */
public interface Engine {
  /**
   * Registers a program and returns a handle to it.
   *
   * @throws net.hydromatic.loopkernel.compile.CompileException if the program
   * uses a function or form that this engine does not support
   * @throws IllegalArgumentException if a program with the same name is
   * already registered
   */
  Handle register(Program program);

  /** Returns the handle of the program registered under {@code name}, or
   * null. */
  @Nullable Handle lookup(String name);
}

// End Engine.java
