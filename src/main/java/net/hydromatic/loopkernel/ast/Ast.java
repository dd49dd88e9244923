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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kernel descriptions.
 *
 * <p>Contains the expression tree ({@link Id}, {@link Literal}, {@link Call},
 * {@link Assign}, {@link Generic}) and the kernel model built from it
 * ({@link Instruction}, {@link Domain}, {@link Kernel}). This class functions
 * as a namespace, so that we can keep the class names short.
 *
 * <p>All nodes are immutable.
 */
public class Ast {
  private Ast() {}

  /** Base class of expressions. */
  public abstract static class Exp extends AstNode {
    Exp(Op op) {
      super(op);
    }

    /** Returns whether an identifier or callee called {@code name} occurs
     * anywhere in this expression. */
    public boolean references(String name) {
      final boolean[] found = {false};
      accept(
          new Visitor() {
            @Override
            protected void visit(Id id) {
              found[0] |= id.name.equals(name);
            }

            @Override
            protected void visit(Call call) {
              found[0] |= call.callee.equals(name);
              super.visit(call);
            }
          });
      return found[0];
    }
  }

  /** Identifier. */
  public static class Id extends Exp {
    public final String name;

    Id(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Id && ((Id) o).name.equals(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal, such as {@code 1}, {@code 2.5}, {@code true} or a string. */
  public static class Literal extends Exp {
    public final Object value;

    Literal(Object value) {
      super(Op.LITERAL);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal && ((Literal) o).value.equals(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (value instanceof String) {
        return w.append("\"")
            .append(((String) value).replace("\"", "\\\""))
            .append("\"");
      }
      return w.append(value.toString());
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call of a named function, such as {@code f(x, 1)} or {@code a + b}.
   *
   * <p>The callee is a name, not an expression. */
  public static class Call extends Exp {
    public final String callee;
    public final ImmutableList<Exp> args;

    Call(String callee, ImmutableList<Exp> args) {
      super(Op.APPLY);
      this.callee = requireNonNull(callee);
      this.args = requireNonNull(args);
      checkArgument(!callee.isEmpty(), "empty callee");
    }

    @Override
    public int hashCode() {
      return Objects.hash(callee, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && ((Call) o).callee.equals(callee)
              && ((Call) o).args.equals(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final Op op = Op.binaryOp(callee);
      if (op != null && args.size() == 2) {
        return w.infix(left, args.get(0), op, args.get(1), right);
      }
      return w.apply(callee, args);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Assignment, such as {@code x = a + 1} or {@code out[i] = 0}. */
  public static class Assign extends Exp {
    public final Exp target;
    public final Exp value;

    Assign(Exp target, Exp value) {
      super(Op.ASSIGN);
      this.target = requireNonNull(target);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(target, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Assign
              && ((Assign) o).target.equals(target)
              && ((Assign) o).value.equals(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, target, op, value, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Any other compound form, identified by a tag.
   *
   * <p>Tags with special meaning are "ref" (indexing, {@code a[i]}), the
   * updating assignments "+=", "-=", "*=", "/=", and the forms created by
   * lowering: "block", "let" and "while". See {@link Op#forTag(String)}. */
  public static class Generic extends Exp {
    public final String tag;
    public final ImmutableList<Exp> args;

    Generic(String tag, ImmutableList<Exp> args) {
      super(Op.forTag(tag));
      this.tag = requireNonNull(tag);
      this.args = requireNonNull(args);
      checkArgument(!tag.isEmpty(), "empty tag");
    }

    @Override
    public int hashCode() {
      return Objects.hash(tag, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Generic
              && ((Generic) o).tag.equals(tag)
              && ((Generic) o).args.equals(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      switch (op) {
      case PLUS_ASSIGN:
      case MINUS_ASSIGN:
      case TIMES_ASSIGN:
      case DIVIDE_ASSIGN:
        if (args.size() == 2) {
          return w.infix(left, args.get(0), op, args.get(1), right);
        }
        break;
      case REF:
        if (!args.isEmpty()) {
          w.append(args.get(0), left, 99).append("[");
          return w.appendAll(args.subList(1, args.size()), ", ").append("]");
        }
        break;
      case BLOCK:
        w.append("begin ");
        if (!args.isEmpty()) {
          w.appendAll(args, "; ").append(" ");
        }
        return w.append("end");
      case LET:
        if (args.size() == 2) {
          return w.append("let ").append(args.get(0), 0, 0)
              .append(" in ").append(args.get(1), 0, 0).append(" end");
        }
        break;
      case WHILE:
        if (args.size() == 2) {
          return w.append("while ").append(args.get(0), 0, 0)
              .append(" do ").append(args.get(1), 0, 0).append(" end");
        }
        break;
      default:
        break;
      }
      return w.apply(tag, args);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Schedulable element of a kernel; either an {@link Instruction} or a
   * {@link Domain}.
   *
   * <p>Instructions and domains share one namespace of names. */
  public abstract static class Item extends AstNode {
    /** Unique name. For a domain, also the name of its loop variable. */
    public final String iname;
    /** Names of the items that must be scheduled before this one, as
     * declared by the front end. Analysis adds further dependencies but
     * never modifies this set. */
    public final ImmutableSet<String> dependencies;

    Item(Op op, String iname, ImmutableSet<String> dependencies) {
      super(op);
      this.iname = requireNonNull(iname);
      this.dependencies = requireNonNull(dependencies);
      checkArgument(!iname.isEmpty(), "empty iname");
    }
  }

  /** Instruction; one computational statement. */
  public static class Instruction extends Item {
    /** Body; normally an {@link Assign} or a {@link Call}. */
    public final Exp body;

    Instruction(String iname, Exp body, ImmutableSet<String> dependencies) {
      super(Op.INSTRUCTION, iname, dependencies);
      this.body = requireNonNull(body);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(iname).append(": ").append(body, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Domain; a loop over the variable {@link #iname}, from
   * {@link #lowerBound} while the variable is less than or equal to
   * {@link #upperBound}, applying {@link #recurrence} after each
   * iteration. */
  public static class Domain extends Item {
    public final Exp lowerBound;
    public final Exp upperBound;
    /** Per-iteration update, e.g. {@code i += 1}. */
    public final Exp recurrence;
    /** Instructions and domains that the front end declared to be inside
     * this loop. */
    public final ImmutableList<Item> instructions;

    Domain(String iname, Exp lowerBound, Exp upperBound, Exp recurrence,
        ImmutableList<Item> instructions, ImmutableSet<String> dependencies) {
      super(Op.DOMAIN, iname, dependencies);
      this.lowerBound = requireNonNull(lowerBound);
      this.upperBound = requireNonNull(upperBound);
      this.recurrence = requireNonNull(recurrence);
      this.instructions = requireNonNull(instructions);
    }

    /** Returns the loop variable as an identifier. */
    public Id id() {
      return new Id(iname);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("domain ").append(iname)
          .append(" from ").append(lowerBound, 0, 0)
          .append(" to ").append(upperBound, 0, 0)
          .append(" by ").append(recurrence, 0, 0);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Kernel; the unit of compilation. */
  public static class Kernel extends AstNode {
    public final ImmutableList<Instruction> instructions;
    public final ImmutableList<Domain> domains;

    Kernel(ImmutableList<Instruction> instructions,
        ImmutableList<Domain> domains) {
      super(Op.KERNEL);
      this.instructions = requireNonNull(instructions);
      this.domains = requireNonNull(domains);
      final Set<String> names = new HashSet<>();
      for (Item item : items()) {
        checkArgument(names.add(item.iname), "duplicate iname '%s'",
            item.iname);
      }
    }

    /** Returns the instructions followed by the domains. */
    public ImmutableList<Item> items() {
      return ImmutableList.<Item>builder()
          .addAll(instructions)
          .addAll(domains)
          .build();
    }

    /** Returns the domain with a given name, or null. */
    public @Nullable Domain domain(String iname) {
      for (Domain domain : domains) {
        if (domain.iname.equals(iname)) {
          return domain;
        }
      }
      return null;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("kernel(").appendAll(items(), "; ").append(")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Ast.java
