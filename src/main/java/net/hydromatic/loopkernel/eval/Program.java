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

import com.google.common.collect.ImmutableSortedSet;
import java.util.Objects;
import net.hydromatic.loopkernel.ast.Ast;

/**
 * Generated function, ready to be registered with an {@link Engine}.
 *
 * <p>A program has a unique name, a set of parameters (the free variables of
 * the kernel it was compiled from, in sorted order) and a body.
 */
public class Program {
  public final String name;
  public final ImmutableSortedSet<String> parameters;
  public final Ast.Exp body;

  public Program(String name, Iterable<String> parameters, Ast.Exp body) {
    this.name = requireNonNull(name);
    this.parameters = ImmutableSortedSet.copyOf(parameters);
    this.body = requireNonNull(body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, parameters, body);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Program
            && ((Program) o).name.equals(name)
            && ((Program) o).parameters.equals(parameters)
            && ((Program) o).body.equals(body);
  }

  /** Returns e.g. "function kernel#0(n, out) begin ... end". */
  @Override
  public String toString() {
    return "function " + name + "(" + String.join(", ", parameters) + ") "
        + body;
  }
}

// End Program.java
