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

import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.eval.Program;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on the dependencies,
   * then calls the underlying tracer. */
  public static Tracer withOnDependencies(Tracer tracer,
      Consumer<Dependencies> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onDependencies(Dependencies dependencies) {
        consumer.accept(dependencies);
        super.onDependencies(dependencies);
      }
    };
  }

  /** Returns a tracer that performs the given action on the flat order,
   * then calls the underlying tracer. */
  public static Tracer withOnOrder(Tracer tracer,
      Consumer<List<Ast.Item>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onOrder(List<Ast.Item> order) {
        consumer.accept(order);
        super.onOrder(order);
      }
    };
  }

  public static Tracer withOnSchedule(Tracer tracer,
      Consumer<Schedule> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSchedule(Schedule schedule) {
        consumer.accept(schedule);
        super.onSchedule(schedule);
      }
    };
  }

  public static Tracer withOnTree(Tracer tracer, Consumer<Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onTree(Ast.Exp tree) {
        consumer.accept(tree);
        super.onTree(tree);
      }
    };
  }

  public static Tracer withOnProgram(Tracer tracer,
      Consumer<Program> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onProgram(Program program) {
        consumer.accept(program);
        super.onProgram(program);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onCompileException(CompileException e) {
        consumer.accept(e);
        super.onCompileException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onDependencies(Dependencies dependencies) {
    }

    @Override public void onOrder(List<Ast.Item> order) {
    }

    @Override public void onSchedule(Schedule schedule) {
    }

    @Override public void onTree(Ast.Exp tree) {
    }

    @Override public void onProgram(Program program) {
    }

    @Override public void onCompileException(CompileException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onDependencies(Dependencies dependencies) {
      tracer.onDependencies(dependencies);
    }

    @Override public void onOrder(List<Ast.Item> order) {
      tracer.onOrder(order);
    }

    @Override public void onSchedule(Schedule schedule) {
      tracer.onSchedule(schedule);
    }

    @Override public void onTree(Ast.Exp tree) {
      tracer.onTree(tree);
    }

    @Override public void onProgram(Program program) {
      tracer.onProgram(program);
    }

    @Override public void onCompileException(CompileException e) {
      tracer.onCompileException(e);
    }
  }
}

// End Tracers.java
