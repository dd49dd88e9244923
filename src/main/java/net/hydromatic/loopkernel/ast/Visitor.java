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

/** Visits kernel descriptions.
 *
 * <p>The default implementation of each method visits the children of the
 * node. The callee of a {@link Ast.Call} is a name, not a child, so it is
 * not visited. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // expressions

  protected void visit(Ast.Id id) {}

  protected void visit(Ast.Literal literal) {}

  protected void visit(Ast.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Ast.Assign assign) {
    assign.target.accept(this);
    assign.value.accept(this);
  }

  protected void visit(Ast.Generic generic) {
    generic.args.forEach(this::accept);
  }

  // kernel

  protected void visit(Ast.Instruction instruction) {
    instruction.body.accept(this);
  }

  /** Visits the bounds and recurrence of a domain. Does not visit the
   * domain's instructions; those are visited via the kernel. */
  protected void visit(Ast.Domain domain) {
    domain.recurrence.accept(this);
    domain.lowerBound.accept(this);
    domain.upperBound.accept(this);
  }

  protected void visit(Ast.Kernel kernel) {
    kernel.instructions.forEach(this::accept);
    kernel.domains.forEach(this::accept);
  }
}

// End Visitor.java
