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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.loopkernel.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link DependencyGraph} and {@link Scheduler}. */
public class SchedulerTest {
  private static Ast.Instruction instruction(String iname, String target,
      String... dependencies) {
    return ast.instruction(iname,
        ast.assign(ast.id(target), ast.literal(0)), dependencies);
  }

  private static List<String> order(Ast.Kernel kernel) {
    final Dependencies dependencies = DependencyAnalyzer.analyze(kernel);
    return Scheduler.names(
        Scheduler.order(DependencyGraph.build(dependencies)));
  }

  /** Items with no dependencies are children of the root; each other item is
   * a child of each item it depends on. */
  @Test
  void testBuild() {
    final Ast.Kernel kernel =
        ast.kernel(
            ImmutableList.of(instruction("C", "c", "A", "B"),
                instruction("A", "a"),
                instruction("B", "b", "A")),
            ImmutableList.of());
    final DependencyGraph graph =
        DependencyGraph.build(DependencyAnalyzer.analyze(kernel));
    assertThat(graph.size(), is(4));
    assertThat(graph.item(DependencyGraph.ROOT), is((Ast.Item) null));
    assertThat(graph.childNames(DependencyGraph.ROOT),
        is(ImmutableList.of("A")));
    assertThat(graph.childNames(1), is(ImmutableList.of("B", "C")));
    assertThat(graph.childNames(2), is(ImmutableList.of("C")));
    assertThat(graph.parents(3), is(ImmutableList.of(1, 2)));
    assertThat(graph.isConsumed(), is(false));
  }

  @Test
  void testOrderRespectsDependencies() {
    final Ast.Kernel kernel =
        ast.kernel(
            ImmutableList.of(instruction("D", "d", "C"),
                instruction("C", "c", "A", "B"),
                instruction("A", "a"),
                instruction("B", "b", "A")),
            ImmutableList.of());
    assertThat(order(kernel), is(ImmutableList.of("A", "B", "C", "D")));
  }

  /** Items that do not depend on each other keep their order in the kernel,
   * instructions before domains. */
  @Test
  void testIndependentItemsKeepKernelOrder() {
    final Ast.Kernel kernel =
        ast.kernel(
            ImmutableList.of(instruction("X", "x"), instruction("Y", "y")),
            ImmutableList.of(ast.range("i", ast.literal(1), ast.id("n"))));
    assertThat(order(kernel), is(ImmutableList.of("X", "Y", "i")));
  }

  @Test
  void testOrderWithLoops() {
    final Ast.Instruction z = instruction("Z", "s");
    final Ast.Instruction s =
        ast.instruction("S",
            ast.update("+=", ast.id("s"),
                ast.ref(ast.id("x"), ast.id("i"))));
    final Ast.Kernel kernel =
        ast.kernel(ImmutableList.of(z, s),
            ImmutableList.of(ast.range("i", ast.literal(1), ast.id("n"))));
    assertThat(order(kernel), is(ImmutableList.of("Z", "i", "S")));
  }

  @Test
  void testCycle() {
    final Ast.Kernel kernel =
        ast.kernel(
            ImmutableList.of(instruction("X", "x"),
                instruction("A", "a", "B"),
                instruction("B", "b", "A")),
            ImmutableList.of());
    final ScheduleException e =
        assertThrows(ScheduleException.class, () -> order(kernel));
    assertThat(e.unresolved(), is(ImmutableList.of("A", "B")));
    assertThat(e.getMessage(),
        is("items left but dependencies not satisfied: [A, B]"));
  }

  /** A dependency on a name that matches no item is reported the same way as
   * a cycle. */
  @Test
  void testMissingDependency() {
    final Ast.Kernel kernel =
        ast.kernel(
            ImmutableList.of(instruction("A", "a"),
                instruction("B", "b", "nonexistent")),
            ImmutableList.of());
    final ScheduleException e =
        assertThrows(ScheduleException.class, () -> order(kernel));
    assertThat(e.unresolved(), is(ImmutableList.of("B")));
  }

  /** Sorting consumes the graph, so it can be sorted only once. */
  @Test
  void testSortTwice() {
    final Ast.Kernel kernel =
        ast.kernel(ImmutableList.of(instruction("A", "a")),
            ImmutableList.of());
    final DependencyGraph graph =
        DependencyGraph.build(DependencyAnalyzer.analyze(kernel));
    assertThat(Scheduler.names(Scheduler.order(graph)),
        is(ImmutableList.of("A")));
    assertThat(graph.isConsumed(), is(true));
    assertThat(graph.children(DependencyGraph.ROOT).isEmpty(), is(true));
    assertThrows(IllegalStateException.class, () -> Scheduler.order(graph));
  }

  @Test
  void testEmptyKernel() {
    final Ast.Kernel kernel =
        ast.kernel(ImmutableList.of(), ImmutableList.of());
    assertThat(order(kernel).isEmpty(), is(true));
  }
}

// End SchedulerTest.java
