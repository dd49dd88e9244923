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

import static net.hydromatic.loopkernel.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.compile.CompileException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Interpreter} and {@link Codes}. */
public class InterpreterTest {
  private static final Ast.Id R = ast.id("r");

  /** Evaluates an expression by running a program that assigns it to
   * {@code r}. */
  private static Object eval(Ast.Exp exp) {
    final Program program =
        new Program("p", ImmutableList.of(),
            ast.block(ImmutableList.of(ast.assign(R, exp))));
    return new Interpreter(ImmutableMap.of()).register(program)
        .invoke(ImmutableMap.of()).get("r");
  }

  private static Codes.Kind evalFails(Ast.Exp exp) {
    return assertThrows(Codes.KernelRuntimeException.class, () -> eval(exp))
        .kind;
  }

  private static Handle register(Map<Prop, Object> propMap,
      Iterable<String> parameters, Ast.Exp... exps) {
    final Program program =
        new Program("p", parameters, ast.block(Arrays.asList(exps)));
    return new Interpreter(propMap).register(program);
  }

  private static Ast.Exp lit(Object value) {
    return ast.literal(value);
  }

  private static Ast.Exp ref(String name, Object... indexes) {
    final Ast.Exp[] exps = new Ast.Exp[indexes.length];
    for (int i = 0; i < indexes.length; i++) {
      exps[i] = indexes[i] instanceof String
          ? ast.id((String) indexes[i])
          : lit(indexes[i]);
    }
    return ast.ref(ast.id(name), exps);
  }

  @Test
  void testArithmetic() {
    assertThat(eval(ast.call("+", lit(1), lit(2))), is(3));
    assertThat(eval(ast.call("+", lit(1), lit(2L))), is(3L));
    assertThat(eval(ast.call("+", lit(1), lit(2.5))), is(3.5));
    assertThat(eval(ast.call("-", lit(10), lit(4))), is(6));
    assertThat(eval(ast.call("-", lit(5))), is(-5));
    assertThat(eval(ast.call("*", lit(6), lit(7))), is(42));
    // integer division truncates
    assertThat(eval(ast.call("/", lit(7), lit(2))), is(3));
    assertThat(eval(ast.call("/", lit(7.0), lit(2))), is(3.5));
    assertThat(eval(ast.call("%", lit(7), lit(3))), is(1));
    assertThat(eval(ast.call("/", lit(1.0), lit(0))),
        is(Double.POSITIVE_INFINITY));
    assertThat(
        eval(ast.call("+", ast.call("*", lit(2), lit(3)), lit(4))), is(10));
  }

  /** Integer arithmetic that overflows {@code int} gives a {@code long}. */
  @Test
  void testIntegerOverflow() {
    assertThat(eval(ast.call("*", lit(100000), lit(100000))),
        is(10000000000L));
    assertThat(eval(ast.call("+", lit(Integer.MAX_VALUE), lit(1))),
        is(2147483648L));
    assertThat(eval(ast.call("-", lit(Integer.MIN_VALUE), lit(1))),
        is(-2147483649L));
    assertThat(eval(ast.call("-", lit(Integer.MIN_VALUE))),
        is(2147483648L));
    assertThat(eval(ast.call("abs", lit(Integer.MIN_VALUE))),
        is(2147483648L));
    assertThat(eval(ast.call("/", lit(Integer.MIN_VALUE), lit(-1))),
        is(2147483648L));
    // results that fit remain int
    assertThat(eval(ast.call("*", lit(1000), lit(1000))), is(1000000));
    assertThat(eval(ast.call("-", lit(3L), lit(1))), is(2L));
  }

  @Test
  void testComparison() {
    assertThat(eval(ast.call("<", lit(3), lit(4))), is(true));
    assertThat(eval(ast.call("<=", lit(4), lit(4))), is(true));
    assertThat(eval(ast.call(">", lit(3), lit(4.5))), is(false));
    assertThat(eval(ast.call(">=", lit(5L), lit(4))), is(true));
    assertThat(eval(ast.call("==", lit(2.0), lit(2))), is(true));
    assertThat(eval(ast.call("!=", lit(1), lit(2))), is(true));
    assertThat(eval(ast.call("==", lit("a"), lit("a"))), is(true));
  }

  @Test
  void testBuiltInFunctions() {
    assertThat(eval(ast.call("min", lit(3), lit(4.5))), is(3));
    assertThat(eval(ast.call("max", lit(3), lit(4.5))), is(4.5));
    assertThat(eval(ast.call("abs", lit(-3))), is(3));
    assertThat(eval(ast.call("abs", lit(-3L))), is(3L));
    assertThat(eval(ast.call("sqrt", lit(16))), is(4.0));
  }

  @Test
  void testRuntimeErrors() {
    assertThat(evalFails(ast.call("/", lit(1), lit(0))),
        is(Codes.Kind.DIVIDE_BY_ZERO));
    assertThat(evalFails(ast.call("%", lit(1L), lit(0))),
        is(Codes.Kind.DIVIDE_BY_ZERO));
    assertThat(evalFails(ast.call("+", lit(1), lit("a"))),
        is(Codes.Kind.TYPE_MISMATCH));
    assertThat(evalFails(ast.call("abs", lit(1), lit(2))),
        is(Codes.Kind.WRONG_ARITY));
    assertThat(evalFails(ast.id("y")), is(Codes.Kind.UNBOUND_VARIABLE));

    final Codes.KernelRuntimeException e =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> eval(ast.id("y")));
    assertThat(e.getMessage(), is("unbound variable: y"));
    assertThat(e.describeTo(new StringBuilder()).toString(),
        is("uncaught exception unbound variable: y"));
  }

  /** Assignment changes the innermost existing binding; a variable first
   * assigned inside a scope does not outlive the scope. */
  @Test
  void testScopes() {
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of(),
            ast.assign(R, lit(0)),
            ast.let(ast.assign(ast.id("x"), lit(1)),
                ast.block(
                    ImmutableList.of(
                        ast.assign(R, ast.call("+", ast.id("x"), lit(1))),
                        ast.assign(ast.id("local"), lit(5))))));
    final ImmutableSortedMap<String, Object> result =
        handle.invoke(ImmutableMap.of());
    assertThat(result, is(ImmutableSortedMap.<String, Object>of("r", 2)));
  }

  @Test
  void testWhile() {
    final Ast.Id i = ast.id("i");
    final Ast.Id s = ast.id("s");
    final Ast.Exp loop =
        ast.whileLoop(ast.call("<", i, lit(5)),
            ast.block(
                ImmutableList.of(
                    ast.assign(ast.id("t"), ast.call("*", i, lit(2))),
                    ast.update("+=", s, ast.id("t")),
                    ast.update("+=", i, lit(1)))));
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of(),
            ast.assign(i, lit(0)), ast.assign(s, lit(0)), loop);
    assertThat(handle.invoke(ImmutableMap.of()),
        is(ImmutableSortedMap.<String, Object>of("i", 5, "s", 20)));
  }

  @Test
  void testIterationLimit() {
    final Ast.Id i = ast.id("i");
    final Ast.Exp[] exps = {
        ast.assign(i, lit(0)),
        ast.whileLoop(ast.call("<", i, lit(5)),
            ast.update("+=", i, lit(1)))
    };
    final Map<Prop, Object> propMap = new HashMap<>();
    Prop.ITERATION_LIMIT.set(propMap, 5);
    assertThat(register(propMap, ImmutableList.of(), exps)
            .invoke(ImmutableMap.of()).get("i"),
        is(5));

    Prop.ITERATION_LIMIT.set(propMap, 3);
    final Handle handle = register(propMap, ImmutableList.of(), exps);
    final Codes.KernelRuntimeException e =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> handle.invoke(ImmutableMap.of()));
    assertThat(e.kind, is(Codes.Kind.ITERATION_LIMIT));
  }

  @Test
  void testConditionMustBeBoolean() {
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of(),
            ast.whileLoop(lit(1), ast.assign(R, lit(1))));
    final Codes.KernelRuntimeException e =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> handle.invoke(ImmutableMap.of()));
    assertThat(e.kind, is(Codes.Kind.NOT_BOOLEAN));
  }

  @Test
  void testArrays() {
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of("a"),
            ast.assign(ref("a", 2), lit(10)),
            ast.assign(R, ast.call("+", ref("a", 1), ref("a", 2))));
    final int[] a = {1, 2, 3};
    final ImmutableSortedMap<String, Object> result =
        handle.invoke(ImmutableMap.of("a", a));
    assertThat(result.get("r"), is(11));
    assertThat(result.get("a"), sameInstance(a));
    assertThat(a, is(new int[] {1, 10, 3}));
  }

  @Test
  void testIndexBase() {
    final Map<Prop, Object> propMap = new HashMap<>();
    Prop.INDEX_BASE.set(propMap, 0);
    final Handle handle =
        register(propMap, ImmutableList.of("a"),
            ast.assign(ref("a", 0), lit(5)));
    final int[] a = {1, 2};
    handle.invoke(ImmutableMap.of("a", a));
    assertThat(a, is(new int[] {5, 2}));
  }

  @Test
  void testMultipleIndexes() {
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of("a"),
            ast.update("*=", ref("a", 2, 1), lit(3)),
            ast.assign(R, ref("a", 2, 1)));
    final double[][] a = {{1, 2}, {3, 4}};
    assertThat(handle.invoke(ImmutableMap.of("a", a)).get("r"), is(9.0));
    assertThat(a[1][0], is(9.0));
  }

  @Test
  void testLists() {
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of("a"),
            ast.update("+=", ref("a", 1), lit(5)));
    final List<Object> list = new ArrayList<>(Arrays.asList(1, 2, 3));
    handle.invoke(ImmutableMap.of("a", list));
    assertThat(list, is(Arrays.<Object>asList(6, 2, 3)));

    final Codes.KernelRuntimeException e =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> handle.invoke(ImmutableMap.of("a", ImmutableList.of(1))));
    assertThat(e.kind, is(Codes.Kind.NOT_INDEXABLE));
  }

  @Test
  void testIndexErrors() {
    final Handle read =
        register(ImmutableMap.of(), ImmutableList.of("a", "k"),
            ast.assign(R, ref("a", "k")));
    final int[] a = {1, 2, 3};
    assertThat(read.invoke(ImmutableMap.of("a", a, "k", 3)).get("r"), is(3));
    assertThat(
        assertThrows(Codes.KernelRuntimeException.class,
            () -> read.invoke(ImmutableMap.of("a", a, "k", 4))).kind,
        is(Codes.Kind.SUBSCRIPT));
    assertThat(
        assertThrows(Codes.KernelRuntimeException.class,
            () -> read.invoke(ImmutableMap.of("a", a, "k", 0))).kind,
        is(Codes.Kind.SUBSCRIPT));
    assertThat(
        assertThrows(Codes.KernelRuntimeException.class,
            () -> read.invoke(ImmutableMap.of("a", a, "k", 1.5))).kind,
        is(Codes.Kind.TYPE_MISMATCH));
    assertThat(
        assertThrows(Codes.KernelRuntimeException.class,
            () -> read.invoke(ImmutableMap.of("a", 7, "k", 1))).kind,
        is(Codes.Kind.NOT_INDEXABLE));

    final Handle write =
        register(ImmutableMap.of(), ImmutableList.of("a"),
            ast.assign(ref("a", 1), lit(2.5)));
    assertThat(
        assertThrows(Codes.KernelRuntimeException.class,
            () -> write.invoke(ImmutableMap.of("a", new int[1]))).kind,
        is(Codes.Kind.TYPE_MISMATCH));
    final double[] d = new double[1];
    write.invoke(ImmutableMap.of("a", d));
    assertThat(d[0], is(2.5));
  }

  /** Invoke requires a value for each parameter, and no others. */
  @Test
  void testArguments() {
    final Handle handle =
        register(ImmutableMap.of(), ImmutableList.of("n", "a"),
            ast.assign(R, ast.id("n")));
    assertThat(handle.parameters().asList(), is(ImmutableList.of("a", "n")));
    assertThat(handle.invoke(ImmutableMap.of("a", 1, "n", 2)),
        is(ImmutableSortedMap.<String, Object>of("a", 1, "n", 2, "r", 2)));

    final Codes.KernelRuntimeException e1 =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> handle.invoke(ImmutableMap.of("a", 1)));
    assertThat(e1.kind, is(Codes.Kind.MISSING_ARGUMENT));
    assertThat(e1.getMessage(), is("missing argument: n"));

    final Codes.KernelRuntimeException e2 =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> handle.invoke(ImmutableMap.of("a", 1, "n", 2, "z", 3)));
    assertThat(e2.kind, is(Codes.Kind.UNEXPECTED_ARGUMENT));
    assertThat(e2.getMessage(), is("unexpected argument: [z]"));

    // a null value counts as a missing argument
    final Map<String, Object> arguments = new HashMap<>();
    arguments.put("a", 1);
    arguments.put("n", null);
    final Codes.KernelRuntimeException e3 =
        assertThrows(Codes.KernelRuntimeException.class,
            () -> handle.invoke(arguments));
    assertThat(e3.kind, is(Codes.Kind.MISSING_ARGUMENT));
    assertThat(e3.getMessage(), is("missing argument: n"));
  }

  @Test
  void testRegistry() {
    final Interpreter interpreter = new Interpreter(ImmutableMap.of());
    final Program program =
        new Program("k#0", ImmutableList.of(), ast.block(ImmutableList.of()));
    final Handle handle = interpreter.register(program);
    assertThat(handle.name(), is("k#0"));
    assertThat(handle.program(), sameInstance(program));
    assertThat(interpreter.lookup("k#0"), sameInstance(handle));
    assertThat(interpreter.lookup("k#1"), nullValue());
    assertThat(handle.invoke(ImmutableMap.of()).isEmpty(), is(true));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> interpreter.register(program));
    assertThat(e.getMessage(), is("program 'k#0' is already registered"));
  }

  /** Forms the interpreter cannot run are rejected when the program is
   * registered, not when it runs. */
  @Test
  void testUnsupported() {
    final CompileException e1 =
        assertThrows(CompileException.class,
            () -> register(ImmutableMap.of(), ImmutableList.of("x"),
                ast.generic("print", ast.id("x"))));
    assertThat(e1.getMessage(), is("unsupported form 'print' in print(x)"));
    final CompileException e2 =
        assertThrows(CompileException.class,
            () -> register(ImmutableMap.of(), ImmutableList.of("x"),
                ast.assign(ast.call("f", ast.id("x")), lit(1))));
    assertThat(e2.getMessage(), is("cannot assign to f(x)"));
    final CompileException e3 =
        assertThrows(CompileException.class,
            () -> register(ImmutableMap.of(), ImmutableList.of(),
                ast.call("nope")));
    assertThat(e3.getMessage(), is("unknown function 'nope'"));
    final CompileException e4 =
        assertThrows(CompileException.class,
            () -> register(ImmutableMap.of(), ImmutableList.of(),
                ast.generic("while", lit(true))));
    assertThat(e4.getMessage(),
        is("'while' expects 2 arguments: while(true)"));
  }

  @Test
  void testUserFunctions() {
    final Map<String, Applicable> functions =
        ImmutableMap.of("twice", args -> 2 * (Integer) args.get(0),
            "max", args -> "custom");
    final Interpreter interpreter =
        new Interpreter(ImmutableMap.of(), functions);
    final Program program =
        new Program("p", ImmutableList.of(),
            ast.block(
                ImmutableList.of(
                    ast.assign(R, ast.call("twice", lit(21))),
                    ast.assign(ast.id("m"), ast.call("max", lit(1), lit(2))),
                    ast.assign(ast.id("q"),
                        ast.call("+", lit(1), lit(2))))));
    assertThat(interpreter.register(program).invoke(ImmutableMap.of()),
        is(ImmutableSortedMap.<String, Object>of("m", "custom", "q", 3,
            "r", 42)));
  }

  @Test
  void testConstant() {
    final Code code = Codes.constant(5);
    assertThat(code.eval(EvalEnvs.copyOf(ImmutableMap.of())), is(5));
    assertThat(code.toString(), is("constant(5)"));
  }
}

// End InterpreterTest.java
