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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import net.hydromatic.loopkernel.ast.Ast;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Sorts a {@link DependencyGraph} into a flat order of items. */
public class Scheduler {
  private static final Logger LOGGER = LogManager.getLogger();

  private Scheduler() {}

  /**
   * Returns the items of a graph in topological order.
   *
   * <p>The sort is breadth-first from the root. A node becomes ready when the
   * last edge from its parents has been consumed, and ready nodes are emitted
   * in the order they became ready; so items that do not depend on each
   * other keep their order in the kernel.
   *
   * <p>Consumes the graph's edges; the graph cannot be sorted again.
   *
   * @throws IllegalStateException if the graph has already been sorted
   */
  public static ImmutableList<Ast.Item> order(DependencyGraph graph) {
    graph.consume();
    final ImmutableList.Builder<Ast.Item> order = ImmutableList.builder();
    final Deque<Integer> sources = new ArrayDeque<>();
    sources.add(DependencyGraph.ROOT);
    while (!sources.isEmpty()) {
      final int node = sources.removeFirst();
      if (node != DependencyGraph.ROOT) {
        order.add(graph.requireItem(node));
      }
      final List<Integer> children = graph.children(node);
      while (!children.isEmpty()) {
        final int child = children.get(0);
        if (graph.removeFirstEdge(node, child)) {
          sources.addLast(child);
        }
      }
    }
    final ImmutableList<Ast.Item> list = order.build();
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("order {}", names(list));
    }
    return list;
  }

  /** Returns the names of a list of items. */
  static ImmutableList<String> names(List<? extends Ast.Item> items) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    items.forEach(item -> b.add(item.iname));
    return b.build();
  }
}

// End Scheduler.java
