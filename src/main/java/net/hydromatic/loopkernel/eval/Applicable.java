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

import java.util.List;

/** A function that the interpreter can call.
 *
 * <p>The interpreter's function table maps names to applicables; a
 * {@link net.hydromatic.loopkernel.ast.Ast.Call} is evaluated by evaluating
 * its arguments and applying the function of the same name. */
@FunctionalInterface
public interface Applicable {
  /** Applies this function to evaluated arguments. */
  Object apply(List<Object> args);
}

// End Applicable.java
