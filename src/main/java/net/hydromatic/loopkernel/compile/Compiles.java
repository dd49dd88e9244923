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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.List;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.ast.AstNode;

/** Helpers for {@link Compiler}; one method per stage of compilation. */
public abstract class Compiles {
  private Compiles() {}

  /** Infers the dependencies of a kernel's items, and the members of its
   * domains. */
  public static Dependencies analyze(Ast.Kernel kernel) {
    return DependencyAnalyzer.analyze(kernel);
  }

  /**
   * Orders the items of a kernel so that each item comes after its
   * dependencies.
   *
   * @throws ScheduleException if there is a cycle, or a dependency on an
   * item that does not exist
   */
  public static ImmutableList<Ast.Item> schedule(Dependencies dependencies) {
    return Scheduler.order(DependencyGraph.build(dependencies));
  }

  /** Converts a flat order into a tree of loops and statements.
   *
   * @param nestLoops Whether to merge domains that share instructions */
  public static Schedule nest(Dependencies dependencies, List<Ast.Item> order,
      boolean nestLoops) {
    return nestLoops
        ? LoopNester.nest(dependencies, order)
        : LoopNester.flat(dependencies, order);
  }

  /** Lowers a schedule to an expression tree. */
  public static Ast.Exp lower(Schedule schedule) {
    return Lowering.lower(schedule);
  }

  /** Returns the arguments of a kernel: the identifiers it uses but does not
   * assign or bind, in sorted order. */
  public static ImmutableSortedSet<String> kernelArguments(
      Ast.Kernel kernel) {
    return FreeFinder.kernelArguments(kernel);
  }

  /** Returns every identifier that occurs in a node, in order of first
   * occurrence. */
  public static ImmutableSet<String> identifiers(AstNode node) {
    return FreeFinder.identifiers(node);
  }
}

// End Compiles.java
