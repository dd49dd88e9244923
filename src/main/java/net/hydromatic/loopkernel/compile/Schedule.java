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
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.loopkernel.ast.Ast;

/**
 * Nested, dependency-respecting arrangement of a kernel's instructions and
 * domains, ready to be lowered.
 *
 * <p>Each {@link Loop} holds the nodes of its body; each {@link Statement}
 * holds an instruction.
 */
public class Schedule {
  public final ImmutableList<Node> nodes;

  Schedule(ImmutableList<Node> nodes) {
    this.nodes = requireNonNull(nodes);
  }

  /** Creates a schedule from a list of top-level items and the body of each
   * domain.
   *
   * @throws CompileException if a domain contains itself */
  static Schedule of(List<Ast.Item> items,
      Map<String, ? extends List<Ast.Item>> bodies) {
    final Set<String> active = new HashSet<>();
    final ImmutableList.Builder<Node> nodes = ImmutableList.builder();
    for (Ast.Item item : items) {
      nodes.add(node(item, bodies, active));
    }
    return new Schedule(nodes.build());
  }

  private static Node node(Ast.Item item,
      Map<String, ? extends List<Ast.Item>> bodies, Set<String> active) {
    if (item instanceof Ast.Instruction) {
      return new Statement((Ast.Instruction) item);
    }
    final Ast.Domain domain = (Ast.Domain) item;
    if (!active.add(domain.iname)) {
      throw new CompileException("domain " + domain.iname
          + " contains itself");
    }
    final ImmutableList.Builder<Node> body = ImmutableList.builder();
    for (Ast.Item member : requireNonNull(bodies.get(domain.iname))) {
      body.add(node(member, bodies, active));
    }
    active.remove(domain.iname);
    return new Loop(domain, body.build());
  }

  /** Returns the names of the top-level items. */
  public ImmutableList<String> names() {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    nodes.forEach(node -> b.add(node.item().iname));
    return b.build();
  }

  /**
   * {@inheritDoc}
   *
   * <p>For example, "[I0, i(j(S), T)]" is an instruction I0 followed by a
   * loop over i, whose body is a loop over j containing S, then T.
   */
  @Override
  public String toString() {
    return describe(new StringBuilder(), nodes).toString();
  }

  private static StringBuilder describe(StringBuilder b, List<Node> nodes) {
    b.append("[");
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      nodes.get(i).describe(b);
    }
    return b.append("]");
  }

  /** Element of a schedule. */
  public abstract static class Node {
    /** Returns the instruction or domain. */
    public abstract Ast.Item item();

    abstract void describe(StringBuilder b);
  }

  /** Schedule node that executes an instruction. */
  public static class Statement extends Node {
    public final Ast.Instruction instruction;

    Statement(Ast.Instruction instruction) {
      this.instruction = requireNonNull(instruction);
    }

    @Override
    public Ast.Instruction item() {
      return instruction;
    }

    @Override
    void describe(StringBuilder b) {
      b.append(instruction.iname);
    }
  }

  /** Schedule node that runs a domain's loop. */
  public static class Loop extends Node {
    public final Ast.Domain domain;
    public final ImmutableList<Node> body;

    Loop(Ast.Domain domain, ImmutableList<Node> body) {
      this.domain = requireNonNull(domain);
      this.body = requireNonNull(body);
    }

    @Override
    public Ast.Domain item() {
      return domain;
    }

    @Override
    void describe(StringBuilder b) {
      b.append(domain.iname).append("(");
      for (int i = 0; i < body.size(); i++) {
        if (i > 0) {
          b.append(", ");
        }
        body.get(i).describe(b);
      }
      b.append(")");
    }
  }
}

// End Schedule.java
