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
import net.hydromatic.loopkernel.ast.Ast;
import net.hydromatic.loopkernel.eval.Program;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when dependencies have been inferred. */
  void onDependencies(Dependencies dependencies);

  /** Called with the flat order of items. */
  void onOrder(List<Ast.Item> order);

  /** Called when loops have been nested. */
  void onSchedule(Schedule schedule);

  /** Called with the lowered expression tree. */
  void onTree(Ast.Exp tree);

  /** Called when the tree has been wrapped into a program. */
  void onProgram(Program program);

  /**
   * Called with an exception thrown during compilation.
   *
   * <p>The compiler re-throws the exception after this method returns.
   */
  void onCompileException(CompileException e);
}

// End Tracer.java
