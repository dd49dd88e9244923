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
package net.hydromatic.loopkernel.compile;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Map;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.eval.Engine;
import net.hydromatic.loopkernel.eval.Handle;
import net.hydromatic.loopkernel.eval.Interpreter;
import net.hydromatic.loopkernel.eval.Program;
import net.hydromatic.loopkernel.eval.Prop;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles kernels to programs.
 *
 * <p>Compilation has these stages:
 *
 * <ol>
 *   <li>infer dependencies ({@link DependencyAnalyzer});
 *   <li>build a graph and sort it ({@link DependencyGraph},
 *       {@link Scheduler});
 *   <li>nest loops that share instructions ({@link LoopNester});
 *   <li>lower to an expression tree ({@link Lowering});
 *   <li>wrap the tree in a program whose parameters are the kernel's free
 *       variables ({@link FreeFinder});
 *   <li>register the program with an {@link Engine}.
 * </ol>
 *
 * <p>The kernel is not modified, so compiling the same kernel twice gives
 * the same tree.
 */
public class Compiler {
  private static final Logger LOGGER = LogManager.getLogger();

  private final ImmutableMap<Prop, Object> propMap;
  private final Engine engine;
  private final Tracer tracer;
  private final NameGenerator nameGenerator = new NameGenerator();

  /** Creates a Compiler that registers programs with the given engine. */
  public Compiler(Map<Prop, Object> propMap, Engine engine, Tracer tracer) {
    this.propMap = ImmutableMap.copyOf(propMap);
    this.engine = requireNonNull(engine);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates a Compiler that registers programs with an
   * {@link Interpreter}. */
  public Compiler(Map<Prop, Object> propMap) {
    this(propMap, new Interpreter(propMap), Tracers.empty());
  }

  /** Returns the engine that programs are registered with. */
  public Engine engine() {
    return engine;
  }

  /**
   * Compiles a kernel and registers the result with the engine.
   *
   * @return Handle with which the program can be invoked
   * @throws CompileException if the kernel cannot be compiled, or the engine
   * cannot run the program
   */
  public Handle compile(Ast.Kernel kernel) {
    final Program program = prepare(kernel);
    try {
      return engine.register(program);
    } catch (CompileException e) {
      tracer.onCompileException(e);
      throw e;
    }
  }

  /** Compiles a kernel to a program, but does not register it. */
  public Program prepare(Ast.Kernel kernel) {
    final Ast.Exp tree = compileToTree(kernel);
    final ImmutableSortedSet<String> parameters =
        Compiles.kernelArguments(kernel);
    final Program program = new Program(uniqueName(), parameters, tree);
    LOGGER.debug("prepared {} with parameters {}", program.name, parameters);
    tracer.onProgram(program);
    return program;
  }

  /** Compiles a kernel to an expression tree. */
  public Ast.Exp compileToTree(Ast.Kernel kernel) {
    LOGGER.debug("compiling kernel with {} instructions, {} domains",
        kernel.instructions.size(), kernel.domains.size());
    try {
      final Dependencies dependencies = Compiles.analyze(kernel);
      tracer.onDependencies(dependencies);

      final ImmutableList<Ast.Item> order = Compiles.schedule(dependencies);
      tracer.onOrder(order);

      final Schedule schedule =
          Compiles.nest(dependencies, order,
              Prop.NEST_LOOPS.booleanValue(propMap));
      tracer.onSchedule(schedule);

      final Ast.Exp tree = Compiles.lower(schedule);
      LOGGER.trace("lowered to {}", tree);
      tracer.onTree(tree);
      return tree;
    } catch (CompileException e) {
      LOGGER.debug("compilation failed: {}", e.getMessage());
      tracer.onCompileException(e);
      throw e;
    }
  }

  /** Generates a name that no program registered with the engine has. */
  private String uniqueName() {
    final String prefix = Prop.FUNCTION_PREFIX.stringValue(propMap);
    synchronized (nameGenerator) {
      for (;;) {
        final String name = nameGenerator.get(prefix);
        if (engine.lookup(name) == null) {
          return name;
        }
      }
    }
  }
}

// End Compiler.java
