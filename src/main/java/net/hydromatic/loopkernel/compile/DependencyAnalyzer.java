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
import net.hydromatic.loopkernel.ast.Ast;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the dependencies that a kernel does not declare.
 *
 * <p>There are two passes. The implicit-order pass adds dependencies between
 * instructions, based on their order in the kernel. The loop-reference pass
 * adds dependencies from instructions to the domains whose loop variables
 * they use, and between domains whose bounds or recurrences use each other's
 * loop variables.
 *
 * <p>Each pass returns a new {@link Dependencies}; the kernel is not
 * modified, so analyzing the same kernel twice gives the same result.
 */
public class DependencyAnalyzer {
  private static final Logger LOGGER = LogManager.getLogger();

  private DependencyAnalyzer() {}

  /** Runs both passes over a kernel. */
  public static Dependencies analyze(Ast.Kernel kernel) {
    final Dependencies.Builder b = Dependencies.declared(kernel).toBuilder();
    addImplicitDependencies(kernel, b);
    addLoopDependencies(kernel, b);
    return b.build();
  }

  /** Runs only the implicit-order pass. */
  public static Dependencies implicitOrder(Ast.Kernel kernel) {
    final Dependencies.Builder b = Dependencies.declared(kernel).toBuilder();
    addImplicitDependencies(kernel, b);
    return b.build();
  }

  /** Runs only the loop-reference pass. */
  public static Dependencies loopReferences(Ast.Kernel kernel) {
    final Dependencies.Builder b = Dependencies.declared(kernel).toBuilder();
    addLoopDependencies(kernel, b);
    return b.build();
  }

  /**
   * Adds dependencies between instructions.
   *
   * <p>For each instruction j, and each instruction i that precedes it, j
   * depends on i if j is a function call (a call may have any side effect),
   * or if the variable that j writes occurs in the expression that j reads.
   *
   * <p>The second test looks only at j, not at what i writes. So an
   * instruction such as {@code s = s + y} depends on every instruction
   * before it, and {@code x = y} depends on none of them.
   */
  static void addImplicitDependencies(Ast.Kernel kernel,
      Dependencies.Builder b) {
    final ImmutableList<Ast.Instruction> instructions = kernel.instructions;
    LOGGER.debug("implicit-order pass over {} instructions",
        instructions.size());
    for (int j = 0; j < instructions.size(); j++) {
      final Ast.Instruction instruction = instructions.get(j);
      if (!dependsOnPredecessors(instruction)) {
        continue;
      }
      for (int i = 0; i < j; i++) {
        final Ast.Instruction predecessor = instructions.get(i);
        LOGGER.trace("{} depends on {}", instruction.iname,
            predecessor.iname);
        b.addDependency(instruction, predecessor.iname);
      }
    }
  }

  /** Returns whether an instruction depends on all instructions before
   * it. */
  static boolean dependsOnPredecessors(Ast.Instruction instruction) {
    if (instruction.body instanceof Ast.Call) {
      return true;
    }
    final String target = target(instruction);
    return readExp(instruction).references(target);
  }

  /**
   * Returns the name of the variable that an instruction writes.
   *
   * <p>Descends through compound left-hand sides; for example, returns "a"
   * for {@code a[i] = 0} and "s" for {@code s += x}.
   *
   * @throws CompileException if the body is not an assignment-like form, or
   * its left-hand side does not reduce to an identifier
   */
  static String target(Ast.Instruction instruction) {
    Ast.Exp e = firstOperand(instruction.body);
    if (e == null) {
      throw new CompileException("instruction " + instruction.iname
          + " is neither a call nor an assignment: " + instruction.body);
    }
    while (!(e instanceof Ast.Id)) {
      final Ast.Exp e2 = firstOperand(e);
      if (e2 == null) {
        throw new CompileException("left-hand side of instruction "
            + instruction.iname + " does not reduce to an identifier: "
            + instruction.body);
      }
      e = e2;
    }
    return ((Ast.Id) e).name;
  }

  /** Returns the expression that an instruction reads: the value of an
   * assignment, or the whole body of any other form. */
  static Ast.Exp readExp(Ast.Instruction instruction) {
    if (instruction.body instanceof Ast.Assign) {
      return ((Ast.Assign) instruction.body).value;
    }
    return instruction.body;
  }

  /** Returns the first operand of an assignment or generic form, or null if
   * the expression has no such operand. */
  private static Ast.@Nullable Exp firstOperand(Ast.Exp e) {
    switch (e.op) {
    case ASSIGN:
      return ((Ast.Assign) e).target;
    case ID:
    case LITERAL:
    case APPLY:
      return null;
    default:
      final Ast.Generic generic = (Ast.Generic) e;
      return generic.args.isEmpty() ? null : generic.args.get(0);
    }
  }

  /**
   * Adds dependencies on domains.
   *
   * <p>An instruction that uses a domain's loop variable depends on the
   * domain, and becomes a member of it.
   *
   * <p>For domains d1 and d2, where d1 precedes d2 in the kernel, if d1's
   * recurrence, lower bound or upper bound uses d2's loop variable, then d2
   * depends on d1 and becomes a member of d1.
   */
  static void addLoopDependencies(Ast.Kernel kernel, Dependencies.Builder b) {
    LOGGER.debug("loop-reference pass over {} instructions, {} domains",
        kernel.instructions.size(), kernel.domains.size());
    for (Ast.Instruction instruction : kernel.instructions) {
      for (Ast.Domain domain : kernel.domains) {
        if (instruction.body.references(domain.iname)) {
          LOGGER.trace("{} is inside {}", instruction.iname, domain.iname);
          b.addDependency(instruction, domain.iname);
          b.addMember(domain, instruction);
        }
      }
    }
    final ImmutableList<Ast.Domain> domains = kernel.domains;
    for (int i = 0; i < domains.size(); i++) {
      final Ast.Domain domain1 = domains.get(i);
      for (int j = i + 1; j < domains.size(); j++) {
        final Ast.Domain domain2 = domains.get(j);
        if (domain1.recurrence.references(domain2.iname)
            || domain1.lowerBound.references(domain2.iname)
            || domain1.upperBound.references(domain2.iname)) {
          LOGGER.trace("{} depends on {}", domain2.iname, domain1.iname);
          b.addDependency(domain2, domain1.iname);
          b.addMember(domain1, domain2);
        }
      }
    }
    // TODO: infer dependencies between domains whose instructions depend on
    // each other
  }
}

// End DependencyAnalyzer.java
