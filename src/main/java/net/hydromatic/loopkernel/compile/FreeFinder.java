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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.ast.AstNode;
import net.hydromatic.loopkernel.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Finds the identifiers in expressions and kernels, and the free variables
 * of a kernel. */
class FreeFinder extends Visitor {
  final Consumer<String> consumer;

  private FreeFinder(Consumer<String> consumer) {
    this.consumer = consumer;
  }

  /**
   * Returns the identifiers in an expression or kernel.
   *
   * <p>For a call, includes the identifiers in the arguments but not the name
   * of the function. For an assignment, includes both sides. For a kernel,
   * includes the identifiers in every instruction body, in every domain's
   * recurrence and bounds, and the loop variable of every domain.
   */
  public static ImmutableSet<String> identifiers(AstNode node) {
    final ImmutableSet.Builder<String> set = ImmutableSet.builder();
    node.accept(new FreeFinder(set::add));
    return set.build();
  }

  /**
   * Returns the arguments of a kernel: the identifiers it uses that are
   * neither assigned by an instruction nor the loop variable of a domain.
   *
   * <p>An instruction assigns a name only if its left-hand side is a plain
   * identifier, as in {@code x = ...} or {@code s += ...}. An instruction
   * such as {@code out[i] = ...} does not assign {@code out}, so
   * {@code out} is an argument.
   */
  public static ImmutableSortedSet<String> kernelArguments(Ast.Kernel kernel) {
    final Set<String> defined = new HashSet<>();
    for (Ast.Instruction instruction : kernel.instructions) {
      final Ast.Exp target = assignedExp(instruction.body);
      if (target instanceof Ast.Id) {
        defined.add(((Ast.Id) target).name);
      }
    }
    for (Ast.Domain domain : kernel.domains) {
      defined.add(domain.iname);
    }
    final ImmutableSortedSet.Builder<String> args =
        ImmutableSortedSet.naturalOrder();
    for (String name : identifiers(kernel)) {
      if (!defined.contains(name)) {
        args.add(name);
      }
    }
    return args.build();
  }

  /** Returns the left-hand side of an assignment or updating assignment, or
   * null. */
  private static Ast.@Nullable Exp assignedExp(Ast.Exp body) {
    if (body instanceof Ast.Assign) {
      return ((Ast.Assign) body).target;
    }
    if (body.op.isUpdate() && !((Ast.Generic) body).args.isEmpty()) {
      return ((Ast.Generic) body).args.get(0);
    }
    return null;
  }

  @Override
  protected void visit(Ast.Id id) {
    consumer.accept(id.name);
  }

  @Override
  protected void visit(Ast.Domain domain) {
    super.visit(domain);
    consumer.accept(domain.iname);
  }
}

// End FreeFinder.java
