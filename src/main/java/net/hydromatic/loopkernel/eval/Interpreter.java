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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.compile.CompileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Engine that runs programs by converting their body to {@link Code} and
 * evaluating it.
 *
 * <p>Functions available to programs are the {@link Codes#BUILT_IN_MAP
 * built-in functions} plus any user functions supplied when the interpreter
 * is created; a user function hides a built-in function of the same name.
 */
public class Interpreter implements Engine {
  private static final Logger LOGGER = LogManager.getLogger();

  private final ImmutableMap<Prop, Object> propMap;
  private final ImmutableMap<String, Applicable> functions;
  private final Map<String, Handle> handles = new HashMap<>();

  /** Creates an Interpreter with built-in functions only. */
  public Interpreter(Map<Prop, Object> propMap) {
    this(propMap, ImmutableMap.of());
  }

  /** Creates an Interpreter with built-in functions and the given user
   * functions. */
  public Interpreter(Map<Prop, Object> propMap,
      Map<String, Applicable> userFunctions) {
    this.propMap = ImmutableMap.copyOf(propMap);
    final Map<String, Applicable> map = new HashMap<>(Codes.BUILT_IN_MAP);
    map.putAll(userFunctions);
    this.functions = ImmutableMap.copyOf(map);
  }

  @Override
  public Handle register(Program program) {
    final Code code = toCode(program.body);
    synchronized (handles) {
      checkArgument(!handles.containsKey(program.name),
          "program '%s' is already registered", program.name);
      final Handle handle = new InterpretedHandle(program, code);
      handles.put(program.name, handle);
      LOGGER.debug("registered {}", program.name);
      return handle;
    }
  }

  @Override
  public @Nullable Handle lookup(String name) {
    synchronized (handles) {
      return handles.get(name);
    }
  }

  /** Converts an expression to code.
   *
   * @throws CompileException if the expression calls an unknown function or
   * contains a form that cannot be evaluated */
  public Code toCode(Ast.Exp exp) {
    Ast.Generic generic;
    switch (exp.op) {
    case ID:
      return Codes.get(((Ast.Id) exp).name);

    case LITERAL:
      return Codes.constant(((Ast.Literal) exp).value);

    case APPLY:
      final Ast.Call call = (Ast.Call) exp;
      return Codes.apply(function(call.callee), toCodes(call.args));

    case ASSIGN:
      final Ast.Assign assign = (Ast.Assign) exp;
      return assignCode(assign.target, toCode(assign.value));

    case PLUS_ASSIGN:
    case MINUS_ASSIGN:
    case TIMES_ASSIGN:
    case DIVIDE_ASSIGN:
      // "s += x" becomes "s = s + x"
      generic = checkArity((Ast.Generic) exp, 2);
      final Applicable fn = function(exp.op.updateOperator().opName);
      final Code current = toCode(generic.args.get(0));
      final Code value = toCode(generic.args.get(1));
      return assignCode(generic.args.get(0),
          Codes.apply(fn, ImmutableList.of(current, value)));

    case BLOCK:
      return Codes.block(toCodes(((Ast.Generic) exp).args));

    case LET:
      generic = checkArity((Ast.Generic) exp, 2);
      if (!(generic.args.get(0) instanceof Ast.Assign)
          || !(((Ast.Assign) generic.args.get(0)).target instanceof Ast.Id)) {
        throw new CompileException("let must bind an identifier: " + exp);
      }
      final Ast.Assign binding = (Ast.Assign) generic.args.get(0);
      return Codes.let(((Ast.Id) binding.target).name,
          toCode(binding.value), toCode(generic.args.get(1)));

    case WHILE:
      generic = checkArity((Ast.Generic) exp, 2);
      return Codes.whileLoop(toCode(generic.args.get(0)),
          toCode(generic.args.get(1)),
          Prop.ITERATION_LIMIT.intValueOpt(propMap));

    case REF:
      generic = (Ast.Generic) exp;
      if (generic.args.size() < 2) {
        throw new CompileException("malformed index: " + exp);
      }
      return Codes.ref(toCode(generic.args.get(0)),
          toCodes(generic.args.subList(1, generic.args.size())), indexBase());

    case GENERIC:
      throw new CompileException("unsupported form '"
          + ((Ast.Generic) exp).tag + "' in " + exp);

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  private ImmutableList<Code> toCodes(List<Ast.Exp> exps) {
    final ImmutableList.Builder<Code> b = ImmutableList.builder();
    exps.forEach(exp -> b.add(toCode(exp)));
    return b.build();
  }

  /** Returns code that assigns a value to a variable or an element. */
  private Code assignCode(Ast.Exp target, Code valueCode) {
    switch (target.op) {
    case ID:
      return Codes.assign(((Ast.Id) target).name, valueCode);
    case REF:
      final Ast.Generic ref = (Ast.Generic) target;
      if (ref.args.size() >= 2) {
        return Codes.assignRef(toCode(ref.args.get(0)),
            toCodes(ref.args.subList(1, ref.args.size())), valueCode,
            indexBase());
      }
      break;
    default:
      break;
    }
    throw new CompileException("cannot assign to " + target);
  }

  private Applicable function(@Nullable String name) {
    final Applicable fn = name == null ? null : functions.get(name);
    if (fn == null) {
      throw new CompileException("unknown function '" + name + "'");
    }
    return fn;
  }

  private int indexBase() {
    return Prop.INDEX_BASE.intValue(propMap);
  }

  private static Ast.Generic checkArity(Ast.Generic generic, int arity) {
    if (generic.args.size() != arity) {
      throw new CompileException("'" + generic.tag + "' expects " + arity
          + " arguments: " + generic);
    }
    return generic;
  }

  /** Handle to a program that has been converted to code. */
  private static class InterpretedHandle implements Handle {
    private final Program program;
    private final Code code;

    InterpretedHandle(Program program, Code code) {
      this.program = requireNonNull(program);
      this.code = requireNonNull(code);
    }

    @Override
    public String name() {
      return program.name;
    }

    @Override
    public ImmutableSortedSet<String> parameters() {
      return program.parameters;
    }

    @Override
    public Program program() {
      return program;
    }

    @Override
    public ImmutableSortedMap<String, Object> invoke(
        Map<String, ?> arguments) {
      for (String parameter : program.parameters) {
        if (arguments.get(parameter) == null) {
          throw new Codes.KernelRuntimeException(
              Codes.Kind.MISSING_ARGUMENT, parameter);
        }
      }
      final Set<String> extra = new HashSet<>(arguments.keySet());
      extra.removeAll(program.parameters);
      if (!extra.isEmpty()) {
        throw new Codes.KernelRuntimeException(
            Codes.Kind.UNEXPECTED_ARGUMENT,
            ImmutableSortedSet.copyOf(extra).toString());
      }
      final EvalEnv env = EvalEnvs.copyOf(arguments);
      code.eval(env);
      return ImmutableSortedMap.copyOf(env.valueMap());
    }

    @Override
    public String toString() {
      return "handle(" + program.name + ")";
    }
  }
}

// End Interpreter.java
