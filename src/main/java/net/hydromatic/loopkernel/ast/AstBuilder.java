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
package net.hydromatic.loopkernel.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;

/** Builds kernel descriptions. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // expressions

  /** Creates an identifier. */
  public Ast.Id id(String name) {
    return new Ast.Id(name);
  }

  /** Creates a literal. The value is typically an {@link Integer}, a
   * {@link Long}, a {@link Double}, a {@link Boolean} or a {@link String}. */
  public Ast.Literal literal(Object value) {
    return new Ast.Literal(value);
  }

  /** Creates a call to a named function. */
  public Ast.Call call(String callee, Ast.Exp... args) {
    return new Ast.Call(callee, ImmutableList.copyOf(args));
  }

  /** Creates a call to a named function. */
  public Ast.Call call(String callee, List<? extends Ast.Exp> args) {
    return new Ast.Call(callee, ImmutableList.copyOf(args));
  }

  /** Creates an assignment. */
  public Ast.Assign assign(Ast.Exp target, Ast.Exp value) {
    return new Ast.Assign(target, value);
  }

  /** Creates a compound form with a given tag. */
  public Ast.Generic generic(String tag, Ast.Exp... args) {
    return new Ast.Generic(tag, ImmutableList.copyOf(args));
  }

  /** Creates a compound form with a given tag. */
  public Ast.Generic generic(String tag, List<? extends Ast.Exp> args) {
    return new Ast.Generic(tag, ImmutableList.copyOf(args));
  }

  /** Creates an indexing form, "a[i, j]". */
  public Ast.Generic ref(Ast.Exp base, Ast.Exp... indexes) {
    checkArgument(indexes.length > 0, "no indexes");
    return new Ast.Generic(Op.REF.lowerName(),
        ImmutableList.<Ast.Exp>builder().add(base).add(indexes).build());
  }

  /** Creates an updating assignment, such as "s += x".
   *
   * @param opName Operator, one of "+=", "-=", "*=", "/=" */
  public Ast.Generic update(String opName, Ast.Exp target, Ast.Exp value) {
    checkArgument(Op.forTag(opName).isUpdate(), "not an update operator: %s",
        opName);
    return new Ast.Generic(opName, ImmutableList.of(target, value));
  }

  /** Creates a sequence of expressions, "begin a; b end". */
  public Ast.Generic block(List<? extends Ast.Exp> exps) {
    return new Ast.Generic(Op.BLOCK.lowerName(), ImmutableList.copyOf(exps));
  }

  /** Creates a scope that binds a variable, "let i = 1 in body end". */
  public Ast.Generic let(Ast.Assign binding, Ast.Exp body) {
    checkArgument(binding.target instanceof Ast.Id,
        "let must bind an identifier: %s", binding);
    return new Ast.Generic(Op.LET.lowerName(), ImmutableList.of(binding, body));
  }

  /** Creates a loop, "while condition do body end". */
  public Ast.Generic whileLoop(Ast.Exp condition, Ast.Exp body) {
    return new Ast.Generic(Op.WHILE.lowerName(),
        ImmutableList.of(condition, body));
  }

  // kernel

  /** Creates an instruction. */
  public Ast.Instruction instruction(String iname, Ast.Exp body,
      String... dependencies) {
    return new Ast.Instruction(iname, body, ImmutableSet.copyOf(dependencies));
  }

  /** Creates an instruction. */
  public Ast.Instruction instruction(String iname, Ast.Exp body,
      Iterable<String> dependencies) {
    return new Ast.Instruction(iname, body, ImmutableSet.copyOf(dependencies));
  }

  /** Creates a domain. */
  public Ast.Domain domain(String iname, Ast.Exp lowerBound,
      Ast.Exp upperBound, Ast.Exp recurrence,
      List<? extends Ast.Item> instructions, Iterable<String> dependencies) {
    return new Ast.Domain(iname, lowerBound, upperBound, recurrence,
        ImmutableList.copyOf(instructions), ImmutableSet.copyOf(dependencies));
  }

  /** Creates a domain with no declared instructions or dependencies. */
  public Ast.Domain domain(String iname, Ast.Exp lowerBound,
      Ast.Exp upperBound, Ast.Exp recurrence) {
    return domain(iname, lowerBound, upperBound, recurrence,
        ImmutableList.of(), ImmutableSet.of());
  }

  /** Creates a domain whose loop variable starts at {@code lowerBound} and
   * increases by 1 until it exceeds {@code upperBound}. */
  public Ast.Domain range(String iname, Ast.Exp lowerBound,
      Ast.Exp upperBound) {
    return domain(iname, lowerBound, upperBound,
        update("+=", id(iname), literal(1)));
  }

  /** Creates a kernel.
   *
   * @throws IllegalArgumentException if two items have the same name */
  public Ast.Kernel kernel(List<Ast.Instruction> instructions,
      List<Ast.Domain> domains) {
    return new Ast.Kernel(ImmutableList.copyOf(instructions),
        ImmutableList.copyOf(domains));
  }
}

// End AstBuilder.java
