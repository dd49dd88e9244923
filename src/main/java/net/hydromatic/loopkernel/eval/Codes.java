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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleBinaryOperator;
import java.util.function.LongBinaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Helpers for {@link Code}, and the built-in functions of the
 * interpreter. */
public abstract class Codes {
  private Codes() {}

  /** Returns a Code that evaluates to the same value in all environments. */
  public static Code constant(Object value) {
    requireNonNull(value);
    return new Code() {
      @Override
      public Object eval(EvalEnv env) {
        return value;
      }

      @Override
      public String toString() {
        return "constant(" + value + ")";
      }
    };
  }

  /** Returns a Code that returns the value of a variable. */
  public static Code get(String name) {
    return env -> {
      final Object value = env.getOpt(name);
      if (value == null) {
        throw new KernelRuntimeException(Kind.UNBOUND_VARIABLE, name);
      }
      return value;
    };
  }

  /** Returns a Code that assigns a value to a variable, and returns the
   * value. */
  public static Code assign(String name, Code valueCode) {
    return env -> {
      final Object value = valueCode.eval(env);
      env.assign(name, value);
      return value;
    };
  }

  /** Returns a Code that applies a function to the values of its
   * arguments. */
  public static Code apply(Applicable fn, List<Code> argCodes) {
    final ImmutableList<Code> codes = ImmutableList.copyOf(argCodes);
    return env -> {
      final List<Object> args = new ArrayList<>(codes.size());
      for (Code code : codes) {
        args.add(code.eval(env));
      }
      return fn.apply(args);
    };
  }

  /** Returns a Code that evaluates a list of codes in order and returns the
   * value of the last, or {@link Unit#INSTANCE} if the list is empty. */
  public static Code block(List<Code> codes) {
    final ImmutableList<Code> list = ImmutableList.copyOf(codes);
    if (list.size() == 1) {
      return list.get(0);
    }
    return env -> {
      Object value = Unit.INSTANCE;
      for (Code code : list) {
        value = code.eval(env);
      }
      return value;
    };
  }

  /** Returns a Code that binds a variable in a new scope, then evaluates a
   * body in that scope. */
  public static Code let(String name, Code initCode, Code body) {
    return env -> {
      final EvalEnv env2 = env.bind();
      env2.define(name, initCode.eval(env));
      return body.eval(env2);
    };
  }

  /**
   * Returns a Code that evaluates {@code body} while {@code condition} is
   * true.
   *
   * <p>Each iteration runs in a new scope, so variables first assigned in the
   * body do not survive the iteration.
   *
   * @param limit Maximum number of iterations, or null
   */
  public static Code whileLoop(Code condition, Code body,
      @Nullable Integer limit) {
    return env -> {
      for (int i = 0;; i++) {
        final Object c = condition.eval(env);
        if (!(c instanceof Boolean)) {
          throw new KernelRuntimeException(Kind.NOT_BOOLEAN, String.valueOf(c));
        }
        if (!(Boolean) c) {
          return Unit.INSTANCE;
        }
        if (limit != null && i >= limit) {
          throw new KernelRuntimeException(Kind.ITERATION_LIMIT,
              "loop exceeded " + limit + " iterations");
        }
        body.eval(env.bind());
      }
    };
  }

  /** Returns a Code that reads an element of an array or list. With several
   * indexes, {@code a[i, j]} reads {@code a[i][j]}. */
  public static Code ref(Code base, List<Code> indexes, int indexBase) {
    final ImmutableList<Code> indexCodes = ImmutableList.copyOf(indexes);
    return env -> {
      Object container = base.eval(env);
      for (Code indexCode : indexCodes) {
        container = element(container, indexCode.eval(env), indexBase);
      }
      return container;
    };
  }

  /** Returns a Code that writes an element of an array or list, and returns
   * the value written. */
  public static Code assignRef(Code base, List<Code> indexes, Code valueCode,
      int indexBase) {
    final ImmutableList<Code> indexCodes = ImmutableList.copyOf(indexes);
    final int last = indexCodes.size() - 1;
    return env -> {
      Object container = base.eval(env);
      for (Code indexCode : indexCodes.subList(0, last)) {
        container = element(container, indexCode.eval(env), indexBase);
      }
      final Object index = indexCodes.get(last).eval(env);
      final Object value = valueCode.eval(env);
      setElement(container, index, value, indexBase);
      return value;
    };
  }

  /** Returns the element of an array or list at a given index. */
  static Object element(Object container, Object index, int indexBase) {
    final int i = offset(container, index, indexBase);
    if (container instanceof List) {
      return ((List<?>) container).get(i);
    }
    return Array.get(container, i);
  }

  /** Sets the element of an array or list at a given index. */
  @SuppressWarnings("unchecked")
  static void setElement(Object container, Object index, Object value,
      int indexBase) {
    final int i = offset(container, index, indexBase);
    if (container instanceof List) {
      try {
        ((List<Object>) container).set(i, value);
      } catch (UnsupportedOperationException e) {
        throw new KernelRuntimeException(Kind.NOT_INDEXABLE,
            "list is not modifiable");
      }
      return;
    }
    try {
      Array.set(container, i, value);
    } catch (IllegalArgumentException e) {
      throw new KernelRuntimeException(Kind.TYPE_MISMATCH,
          "cannot store " + value + " in "
              + container.getClass().getComponentType());
    }
  }

  /** Converts an index to a zero-based offset, checking bounds. */
  private static int offset(Object container, Object index, int indexBase) {
    final int size;
    if (container instanceof List) {
      size = ((List<?>) container).size();
    } else if (container.getClass().isArray()) {
      size = Array.getLength(container);
    } else {
      throw new KernelRuntimeException(Kind.NOT_INDEXABLE,
          String.valueOf(container));
    }
    if (!(index instanceof Integer || index instanceof Long)) {
      throw new KernelRuntimeException(Kind.TYPE_MISMATCH,
          "index must be an integer: " + index);
    }
    final long i = ((Number) index).longValue() - indexBase;
    if (i < 0 || i >= size) {
      throw new KernelRuntimeException(Kind.SUBSCRIPT,
          "index " + index + " out of bounds for length " + size);
    }
    return (int) i;
  }

  // ---------------------------------------------------------------------------
  // Built-in functions. They are in alphabetical order.

  /** Implements "abs". */
  private static final Applicable ABS = args -> {
    checkArity("abs", args, 1);
    final Number n = number("abs", args.get(0));
    if (n instanceof Integer) {
      return narrow(Math.abs(n.longValue()));
    }
    if (n instanceof Long) {
      return Math.abs(n.longValue());
    }
    return Math.abs(n.doubleValue());
  };

  /** Implements "/". Integer operands give an integer quotient. */
  private static final Applicable DIVIDE = args -> {
    checkArity("/", args, 2);
    final Number divisor = number("/", args.get(1));
    if (!isFloating(args.get(0), divisor) && divisor.longValue() == 0) {
      throw new KernelRuntimeException(Kind.DIVIDE_BY_ZERO, "/");
    }
    return arithmetic("/", args.get(0), divisor,
        (a, b) -> a / b, (a, b) -> a / b);
  };

  /** Implements "==". */
  private static final Applicable EQ = args -> {
    checkArity("==", args, 2);
    return equal(args.get(0), args.get(1));
  };

  /** Implements ">=". */
  private static final Applicable GE = args -> compare(">=", args) >= 0;

  /** Implements ">". */
  private static final Applicable GT = args -> compare(">", args) > 0;

  /** Implements "<=". */
  private static final Applicable LE = args -> compare("<=", args) <= 0;

  /** Implements "<". */
  private static final Applicable LT = args -> compare("<", args) < 0;

  /** Implements "max". */
  private static final Applicable MAX = args ->
      compare("max", args) >= 0 ? args.get(0) : args.get(1);

  /** Implements "min". */
  private static final Applicable MIN = args ->
      compare("min", args) <= 0 ? args.get(0) : args.get(1);

  /** Implements "-", both binary and unary. */
  private static final Applicable MINUS = args -> {
    if (args.size() == 1) {
      return arithmetic("-", 0, args.get(0),
          (a, b) -> a - b, (a, b) -> a - b);
    }
    checkArity("-", args, 2);
    return arithmetic("-", args.get(0), args.get(1),
        (a, b) -> a - b, (a, b) -> a - b);
  };

  /** Implements "%". */
  private static final Applicable MOD = args -> {
    checkArity("%", args, 2);
    final Number divisor = number("%", args.get(1));
    if (!isFloating(args.get(0), divisor) && divisor.longValue() == 0) {
      throw new KernelRuntimeException(Kind.DIVIDE_BY_ZERO, "%");
    }
    return arithmetic("%", args.get(0), divisor,
        (a, b) -> a % b, (a, b) -> a % b);
  };

  /** Implements "!=". */
  private static final Applicable NE = args -> {
    checkArity("!=", args, 2);
    return !equal(args.get(0), args.get(1));
  };

  /** Implements "+". */
  private static final Applicable PLUS = args -> {
    checkArity("+", args, 2);
    return arithmetic("+", args.get(0), args.get(1),
        Long::sum, Double::sum);
  };

  /** Implements "sqrt". */
  private static final Applicable SQRT = args -> {
    checkArity("sqrt", args, 1);
    return Math.sqrt(number("sqrt", args.get(0)).doubleValue());
  };

  /** Implements "*". */
  private static final Applicable TIMES = args -> {
    checkArity("*", args, 2);
    return arithmetic("*", args.get(0), args.get(1),
        (a, b) -> a * b, (a, b) -> a * b);
  };

  /** Built-in functions, by name. */
  public static final ImmutableMap<String, Applicable> BUILT_IN_MAP =
      ImmutableMap.<String, Applicable>builder()
          .put("!=", NE)
          .put("%", MOD)
          .put("*", TIMES)
          .put("+", PLUS)
          .put("-", MINUS)
          .put("/", DIVIDE)
          .put("<", LT)
          .put("<=", LE)
          .put("==", EQ)
          .put(">", GT)
          .put(">=", GE)
          .put("abs", ABS)
          .put("max", MAX)
          .put("min", MIN)
          .put("sqrt", SQRT)
          .build();

  private static void checkArity(String name, List<Object> args, int n) {
    if (args.size() != n) {
      throw new KernelRuntimeException(Kind.WRONG_ARITY,
          name + " expects " + n + " arguments, got " + args.size());
    }
  }

  private static Number number(String name, Object o) {
    if (o instanceof Integer
        || o instanceof Long
        || o instanceof Double
        || o instanceof Float) {
      return (Number) o;
    }
    throw new KernelRuntimeException(Kind.TYPE_MISMATCH,
        name + " expects a number, got " + o);
  }

  private static boolean isFloating(Object a, Object b) {
    return a instanceof Double || a instanceof Float
        || b instanceof Double || b instanceof Float;
  }

  /** Applies an arithmetic operator, promoting {@code int} to {@code long}
   * and {@code long} to {@code double} as needed.
   *
   * <p>Integral operators are evaluated in {@code long}. If both operands
   * are {@code int} and the result fits, the result is an {@code int};
   * otherwise it is a {@code long}. */
  private static Object arithmetic(String name, Object a, Object b,
      LongBinaryOperator longOp, DoubleBinaryOperator doubleOp) {
    final Number x = number(name, a);
    final Number y = number(name, b);
    if (isFloating(x, y)) {
      return doubleOp.applyAsDouble(x.doubleValue(), y.doubleValue());
    }
    final long result = longOp.applyAsLong(x.longValue(), y.longValue());
    if (x instanceof Long || y instanceof Long) {
      return result;
    }
    return narrow(result);
  }

  /** Returns a {@code long} as an {@code int} if it is in range. */
  private static Number narrow(long value) {
    final int i = (int) value;
    return i == value ? (Number) i : (Number) value;
  }

  private static int compare(String name, List<Object> args) {
    checkArity(name, args, 2);
    final Number x = number(name, args.get(0));
    final Number y = number(name, args.get(1));
    if (isFloating(x, y)) {
      return Double.compare(x.doubleValue(), y.doubleValue());
    }
    return Long.compare(x.longValue(), y.longValue());
  }

  private static boolean equal(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return compare("==", ImmutableList.of(a, b)) == 0;
    }
    return a.equals(b);
  }

  /** Kinds of error that can occur while a program runs. */
  public enum Kind {
    MISSING_ARGUMENT("missing argument"),
    UNEXPECTED_ARGUMENT("unexpected argument"),
    UNBOUND_VARIABLE("unbound variable"),
    WRONG_ARITY("wrong number of arguments"),
    TYPE_MISMATCH("type mismatch"),
    NOT_BOOLEAN("condition is not a boolean"),
    NOT_INDEXABLE("value is not indexable"),
    SUBSCRIPT("subscript out of bounds"),
    DIVIDE_BY_ZERO("division by zero"),
    ITERATION_LIMIT("iteration limit exceeded");

    public final String description;

    Kind(String description) {
      this.description = description;
    }
  }

  /** An error that occurs while a program runs. */
  public static class KernelRuntimeException extends RuntimeException {
    public final Kind kind;

    /** Creates a KernelRuntimeException. */
    public KernelRuntimeException(Kind kind, String detail) {
      super(kind.description + ": " + detail);
      this.kind = requireNonNull(kind);
    }

    public StringBuilder describeTo(StringBuilder buf) {
      return buf.append("uncaught exception ").append(getMessage());
    }
  }
}

// End Codes.java
