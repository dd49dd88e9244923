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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Thrown when a kernel's items cannot be arranged in a dependency graph,
 * because of a cycle or because a dependency names no item.
 *
 * <p>The two causes are not distinguished. */
public class ScheduleException extends CompileException {
  private final ImmutableList<String> unresolved;

  public ScheduleException(List<String> unresolved) {
    super("items left but dependencies not satisfied: " + unresolved);
    this.unresolved = ImmutableList.copyOf(unresolved);
  }

  /** Returns the names of the items that could not be placed, in kernel
   * order (instructions before domains). */
  public ImmutableList<String> unresolved() {
    return unresolved;
  }
}

// End ScheduleException.java
