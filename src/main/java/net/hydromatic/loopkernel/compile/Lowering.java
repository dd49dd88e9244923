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

import static net.hydromatic.loopkernel.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.loopkernel.ast.Ast;

/** Lowers a {@link Schedule} to an expression tree that a backend can
 * run. */
public class Lowering {
  private Lowering() {}

  /** Lowers a schedule to a block. */
  public static Ast.Exp lower(Schedule schedule) {
    return lower(schedule.nodes);
  }

  /** Lowers a list of nodes to a block that contains the lowered form of
   * each. */
  public static Ast.Exp lower(List<? extends Schedule.Node> nodes) {
    final ImmutableList.Builder<Ast.Exp> exps = ImmutableList.builder();
    for (Schedule.Node node : nodes) {
      exps.add(lower(node));
    }
    return ast.block(exps.build());
  }

  /**
   * Lowers a node.
   *
   * <p>An instruction lowers to its body. A loop over {@code i} lowers to
   *
   * <blockquote><pre>
   * let i = lowerBound in
   *   while i &lt;= upperBound do
   *     begin body; recurrence end
   *   end
   * end</pre></blockquote>
   */
  public static Ast.Exp lower(Schedule.Node node) {
    if (node instanceof Schedule.Statement) {
      return ((Schedule.Statement) node).instruction.body;
    }
    final Schedule.Loop loop = (Schedule.Loop) node;
    final Ast.Domain domain = loop.domain;
    final ImmutableList.Builder<Ast.Exp> body = ImmutableList.builder();
    for (Schedule.Node member : loop.body) {
      body.add(lower(member));
    }
    body.add(domain.recurrence);
    return ast.let(ast.assign(domain.id(), domain.lowerBound),
        ast.whileLoop(ast.call("<=", domain.id(), domain.upperBound),
            ast.block(body.build())));
  }
}

// End Lowering.java
