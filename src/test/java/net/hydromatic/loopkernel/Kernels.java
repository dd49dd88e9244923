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
package net.hydromatic.loopkernel;

import static net.hydromatic.loopkernel.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.compile.Compiler;
import net.hydromatic.loopkernel.compile.Schedule;
import net.hydromatic.loopkernel.compile.Tracer;
import net.hydromatic.loopkernel.compile.Tracers;
import net.hydromatic.loopkernel.eval.Applicable;
import net.hydromatic.loopkernel.eval.Handle;
import net.hydromatic.loopkernel.eval.Interpreter;
import net.hydromatic.loopkernel.eval.Prop;
import org.hamcrest.Matcher;

/** Fluent test helper. */
class Kernels {
  private final Ast.Kernel kernel;
  private final Map<Prop, Object> propMap;
  private final Map<String, Applicable> functions;

  Kernels(Ast.Kernel kernel, Map<Prop, Object> propMap,
      Map<String, Applicable> functions) {
    this.kernel = kernel;
    this.propMap = ImmutableMap.copyOf(propMap);
    this.functions = ImmutableMap.copyOf(functions);
  }

  /** Creates a {@code Kernels}. */
  static Kernels kernel(List<Ast.Instruction> instructions,
      List<Ast.Domain> domains) {
    return new Kernels(ast.kernel(instructions, domains), ImmutableMap.of(),
        ImmutableMap.of());
  }

  /**
   * Runs a task and checks that it throws an exception.
   *
   * @param runnable Task to run
   * @param matcher Checks whether exception is as expected
   */
  static void assertError(Runnable runnable, Matcher<Throwable> matcher) {
    try {
      runnable.run();
      fail("expected error");
    } catch (Throwable e) {
      assertThat(e, matcher);
    }
  }

  Kernels withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Kernels(kernel, map, functions);
  }

  Kernels withFunction(String name, Applicable function) {
    final Map<String, Applicable> map = new LinkedHashMap<>(functions);
    map.put(name, function);
    return new Kernels(kernel, propMap, map);
  }

  private Compiler compiler(Tracer tracer) {
    return new Compiler(propMap, new Interpreter(propMap, functions), tracer);
  }

  @CanIgnoreReturnValue
  Kernels assertSchedule(String expected) {
    final AtomicReference<Schedule> schedule = new AtomicReference<>();
    compiler(Tracers.withOnSchedule(Tracers.empty(), schedule::set))
        .compileToTree(kernel);
    assertThat(schedule.get(), hasToString(expected));
    return this;
  }

  @CanIgnoreReturnValue
  Kernels assertTree(String expected) {
    assertThat(compiler(Tracers.empty()).compileToTree(kernel),
        hasToString(expected));
    return this;
  }

  @CanIgnoreReturnValue
  Kernels assertArguments(String... names) {
    final Handle handle = compiler(Tracers.empty()).compile(kernel);
    assertThat(handle.parameters().asList(),
        is(ImmutableList.copyOf(names)));
    return this;
  }

  /** Compiles the kernel, invokes it with the given arguments, and passes
   * the resulting variables to a consumer. */
  @CanIgnoreReturnValue
  Kernels assertRun(Map<String, ?> arguments,
      Consumer<ImmutableSortedMap<String, Object>> consumer) {
    final Handle handle = compiler(Tracers.empty()).compile(kernel);
    consumer.accept(handle.invoke(arguments));
    return this;
  }

  @CanIgnoreReturnValue
  Kernels assertCompileError(Matcher<Throwable> matcher) {
    assertError(() -> compiler(Tracers.empty()).compile(kernel), matcher);
    return this;
  }

  @CanIgnoreReturnValue
  Kernels assertRunError(Map<String, ?> arguments,
      Matcher<Throwable> matcher) {
    final Handle handle = compiler(Tracers.empty()).compile(kernel);
    assertError(() -> handle.invoke(arguments), matcher);
    return this;
  }
}

// End Kernels.java
