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

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link EvalEnv}. */
public class EvalEnvs {
  private EvalEnvs() {}

  /** Creates an outermost evaluation environment with the given (name,
   * value) bindings. The map is copied. */
  public static EvalEnv copyOf(Map<String, ?> valueMap) {
    return new MapEvalEnv(valueMap);
  }

  /** Evaluation environment that has no parent. */
  static class MapEvalEnv implements EvalEnv {
    private final Map<String, Object> valueMap = new LinkedHashMap<>();

    MapEvalEnv(Map<String, ?> valueMap) {
      valueMap.forEach((name, value) ->
          this.valueMap.put(name, requireNonNull(value, name)));
    }

    @Override
    public @Nullable Object getOpt(String name) {
      return valueMap.get(name);
    }

    @Override
    public void define(String name, Object value) {
      valueMap.put(name, requireNonNull(value));
    }

    @Override
    public boolean assignOpt(String name, Object value) {
      if (valueMap.containsKey(name)) {
        valueMap.put(name, requireNonNull(value));
        return true;
      }
      return false;
    }

    @Override
    public void visit(BiConsumer<String, Object> consumer) {
      valueMap.forEach(consumer);
    }

    @Override
    public String toString() {
      return valueMap.toString();
    }
  }

  /** Evaluation environment that inherits from a parent environment and can
   * add bindings of its own. */
  static class SubEvalEnv extends MapEvalEnv {
    private final EvalEnv parentEnv;

    SubEvalEnv(EvalEnv parentEnv) {
      super(new LinkedHashMap<>());
      this.parentEnv = requireNonNull(parentEnv);
    }

    @Override
    public @Nullable Object getOpt(String name) {
      final Object value = super.getOpt(name);
      return value != null ? value : parentEnv.getOpt(name);
    }

    @Override
    public boolean assignOpt(String name, Object value) {
      return super.assignOpt(name, value)
          || parentEnv.assignOpt(name, value);
    }

    @Override
    public void visit(BiConsumer<String, Object> consumer) {
      super.visit(consumer);
      parentEnv.visit(consumer);
    }

    @Override
    public String toString() {
      return super.toString() + " <- " + parentEnv;
    }
  }
}

// End EvalEnvs.java
