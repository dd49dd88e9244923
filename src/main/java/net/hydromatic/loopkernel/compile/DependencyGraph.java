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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.loopkernel.ast.Ast;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Directed acyclic graph of a kernel's items, ordered by dependency.
 *
 * <p>Nodes live in an arena and are addressed by index. Node {@link #ROOT}
 * has no item; every item with no dependencies is a child of the root, and
 * every other item is a child of each item it depends on.
 *
 * <p>A graph can be sorted only once; see {@link Scheduler}.
 */
public class DependencyGraph {
  private static final Logger LOGGER = LogManager.getLogger();

  /** Index of the root node. */
  public static final int ROOT = 0;

  private final List<Ast.@Nullable Item> items = new ArrayList<>();
  private final List<List<Integer>> children = new ArrayList<>();
  private final List<List<Integer>> parents = new ArrayList<>();
  private boolean consumed;

  private DependencyGraph() {
    add(null);
  }

  /**
   * Builds a graph from a kernel's dependencies.
   *
   * <p>Items with no dependencies are placed first, instructions before
   * domains. Then the remaining items are placed, repeatedly choosing the
   * first one all of whose dependencies have been placed.
   *
   * @throws ScheduleException if items remain whose dependencies are never
   * placed, due to a cycle or a name that matches no item
   */
  public static DependencyGraph build(Dependencies dependencies) {
    final DependencyGraph graph = new DependencyGraph();
    final Map<String, Integer> nodes = new HashMap<>();
    final List<Ast.Item> remaining = new ArrayList<>();
    for (Ast.Item item : dependencies.kernel.items()) {
      if (dependencies.dependencies(item).isEmpty()) {
        final int node = graph.add(item);
        graph.link(ROOT, node);
        nodes.put(item.iname, node);
      } else {
        remaining.add(item);
      }
    }

    while (!remaining.isEmpty()) {
      final int i = firstResolved(dependencies, remaining, nodes);
      if (i < 0) {
        final List<String> names = new ArrayList<>();
        remaining.forEach(item -> names.add(item.iname));
        throw new ScheduleException(names);
      }
      final Ast.Item item = remaining.remove(i);
      final int node = graph.add(item);
      for (String dependency : dependencies.dependencies(item)) {
        graph.link(nodes.get(dependency), node);
      }
      nodes.put(item.iname, node);
    }
    LOGGER.debug("built dependency graph with {} nodes", graph.size());
    return graph;
  }

  /** Returns the index of the first item all of whose dependencies are
   * placed, or -1. */
  private static int firstResolved(Dependencies dependencies,
      List<Ast.Item> remaining, Map<String, Integer> nodes) {
    for (int i = 0; i < remaining.size(); i++) {
      if (nodes.keySet()
          .containsAll(dependencies.dependencies(remaining.get(i)))) {
        return i;
      }
    }
    return -1;
  }

  private int add(Ast.@Nullable Item item) {
    items.add(item);
    children.add(new ArrayList<>());
    parents.add(new ArrayList<>());
    return items.size() - 1;
  }

  private void link(int parent, int child) {
    children.get(parent).add(child);
    parents.get(child).add(parent);
  }

  /** Returns the number of nodes, including the root. */
  public int size() {
    return items.size();
  }

  /** Returns the item of a node; null for the root. */
  public Ast.@Nullable Item item(int node) {
    return items.get(node);
  }

  /** Returns the indexes of a node's children. */
  public List<Integer> children(int node) {
    return Collections.unmodifiableList(children.get(node));
  }

  /** Returns the indexes of a node's parents. */
  public List<Integer> parents(int node) {
    return Collections.unmodifiableList(parents.get(node));
  }

  /** Returns the names of the children of a node. */
  public ImmutableList<String> childNames(int node) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (int child : children.get(node)) {
      b.add(requireItem(child).iname);
    }
    return b.build();
  }

  /** Returns whether the graph has been consumed by sorting. */
  public boolean isConsumed() {
    return consumed;
  }

  /** Marks the graph as consumed.
   *
   * @throws IllegalStateException if it was already consumed */
  void consume() {
    checkState(!consumed, "dependency graph has already been sorted");
    consumed = true;
  }

  /** Returns the item of a node that is not the root. */
  Ast.Item requireItem(int node) {
    final Ast.@Nullable Item item = items.get(node);
    if (item == null) {
      throw new IllegalArgumentException("root has no item");
    }
    return item;
  }

  /** Removes the edge from a node to its first child, and returns whether
   * the child now has no parents. */
  boolean removeFirstEdge(int node, int child) {
    children.get(node).remove(0);
    final List<Integer> parentList = parents.get(child);
    parentList.removeIf(p -> p == node);
    return parentList.isEmpty();
  }
}

// End DependencyGraph.java
