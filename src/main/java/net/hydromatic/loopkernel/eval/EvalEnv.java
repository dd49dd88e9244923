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

import java.util.HashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluation environment; a scope of variables, possibly nested inside
 * another scope.
 *
 * <p>Environments are mutable, because generated programs assign to
 * variables.
 */
public interface EvalEnv {
  /** Returns the binding of {@code name} if bound in this scope or an
   * enclosing scope, null if not. */
  @Nullable Object getOpt(String name);

  /** Binds {@code name} in this scope, hiding any binding in enclosing
   * scopes. */
  void define(String name, Object value);

  /**
   * Assigns a value to a variable.
   *
   * <p>If this scope or an enclosing scope binds {@code name}, changes the
   * innermost such binding; otherwise binds it in this scope.
   */
  default void assign(String name, Object value) {
    if (!assignOpt(name, value)) {
      define(name, value);
    }
  }

  /** Changes the innermost existing binding of {@code name}, and returns
   * whether there was one. */
  boolean assignOpt(String name, Object value);

  /** Creates a scope nested inside this one. */
  default EvalEnv bind() {
    return new EvalEnvs.SubEvalEnv(this);
  }

  /**
   * Visits every variable binding in this environment.
   *
   * <p>Bindings that are obscured by more recent bindings of the same name are
   * visited, but after the more obscuring bindings.
   */
  void visit(BiConsumer<String, Object> consumer);

  /** Returns a map of the values and bindings. */
  default Map<String, Object> valueMap() {
    final Map<String, Object> valueMap = new HashMap<>();
    visit(valueMap::putIfAbsent);
    return valueMap;
  }
}

// End EvalEnv.java
