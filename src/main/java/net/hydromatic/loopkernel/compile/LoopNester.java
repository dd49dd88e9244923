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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.loopkernel.ast.Ast;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites a flat order of items into a {@link Schedule}, nesting loops that
 * share instructions.
 *
 * <p>If domains D and E have instructions in common, and D comes before E
 * in the order, then the common instructions are removed from D's body and
 * E takes the place of the first of them. E is then reached only through D,
 * and is not emitted at the top level.
 *
 * <p>The kernel is not modified; the nester works on its own copy of each
 * domain's members.
 */
public class LoopNester {
  private static final Logger LOGGER = LogManager.getLogger();

  private final Dependencies dependencies;
  /** Body of each domain, keyed by name; modified as domains merge. */
  private final Map<String, List<Ast.Item>> bodies = new LinkedHashMap<>();
  /** Position of each item in the flat order. */
  private final Map<String, Integer> positions = new HashMap<>();
  /** Whether each domain has been involved in a merge. */
  private final Map<String, Boolean> nestedDomains = new HashMap<>();
  private final List<Ast.Item> result = new ArrayList<>();

  private LoopNester(Dependencies dependencies, List<Ast.Item> order) {
    this.dependencies = dependencies;
    for (Ast.Domain domain : dependencies.kernel.domains) {
      bodies.put(domain.iname, new ArrayList<>(dependencies.members(domain)));
      nestedDomains.put(domain.iname, false);
    }
    for (int i = 0; i < order.size(); i++) {
      positions.put(order.get(i).iname, i);
    }
    for (Ast.Domain domain : dependencies.kernel.domains) {
      checkArgument(positions.containsKey(domain.iname),
          "domain %s is not in the order", domain.iname);
    }
  }

  /**
   * Nests the loops of a flat order.
   *
   * <p>A domain is emitted at the top level unless it has been merged into
   * another domain, or it is already a member of a domain emitted before it.
   * An instruction is emitted at the top level only if it has no
   * dependencies; instructions that depend on something are reached through
   * the bodies of domains.
   *
   * @param dependencies Dependencies of the kernel
   * @param order Flat order, as produced by {@link Scheduler}
   */
  public static Schedule nest(Dependencies dependencies,
      List<Ast.Item> order) {
    final LoopNester nester = new LoopNester(dependencies, order);
    for (Ast.Item item : order) {
      if (item instanceof Ast.Domain) {
        nester.nestDomain((Ast.Domain) item);
      } else if (dependencies.dependencies(item).isEmpty()) {
        nester.result.add(item);
      }
    }
    final Schedule schedule = Schedule.of(nester.result, nester.bodies);
    LOGGER.debug("nested {} items into {} top-level nodes", order.size(),
        schedule.nodes.size());
    return schedule;
  }

  /**
   * Creates a schedule without merging domains.
   *
   * <p>Each domain's body is as dependency analysis left it. A domain is
   * emitted at the top level unless it is a member of another domain; an
   * instruction only if it has no dependencies.
   */
  public static Schedule flat(Dependencies dependencies,
      List<Ast.Item> order) {
    final LoopNester nester = new LoopNester(dependencies, order);
    final Set<String> members = new LinkedHashSet<>();
    nester.bodies.values().forEach(body ->
        body.forEach(item -> members.add(item.iname)));
    for (Ast.Item item : order) {
      if (item instanceof Ast.Domain) {
        if (!members.contains(item.iname)) {
          nester.result.add(item);
        }
      } else if (dependencies.dependencies(item).isEmpty()) {
        nester.result.add(item);
      }
    }
    return Schedule.of(nester.result, nester.bodies);
  }

  private void nestDomain(Ast.Domain domain) {
    boolean nested = false;
    for (Ast.Domain other : dependencies.kernel.domains) {
      if (other.iname.equals(domain.iname)) {
        continue;
      }
      final Set<String> shared =
          shared(bodies.get(other.iname), bodies.get(domain.iname));
      if (shared.isEmpty()) {
        continue;
      }
      nested = true;
      nestedDomains.put(other.iname, true);
      nestedDomains.put(domain.iname, true);
      if (positions.get(domain.iname) < positions.get(other.iname)) {
        merge(domain, other, shared);
        if (!isEmitted(domain)) {
          result.add(domain);
        }
      }
    }
    if (!nested && !nestedDomains.get(domain.iname) && !isEmitted(domain)) {
      // shares no instructions with other loops
      result.add(domain);
    }
  }

  /** Replaces the shared members of {@code domain} by {@code other}, at the
   * position of the first shared member. If {@code other} is already a
   * member, the shared members are just removed. */
  private void merge(Ast.Domain domain, Ast.Domain other,
      Set<String> shared) {
    LOGGER.trace("nesting {} inside {}, replacing {}", other.iname,
        domain.iname, shared);
    final List<Ast.Item> body = bodies.get(domain.iname);
    int first = -1;
    for (int i = 0; i < body.size();) {
      if (shared.contains(body.get(i).iname)) {
        if (first < 0) {
          first = i;
        }
        body.remove(i);
      } else {
        ++i;
      }
    }
    for (Ast.Item item : body) {
      if (item.iname.equals(other.iname)) {
        return;
      }
    }
    body.add(first, other);
  }

  /** Returns whether a domain has been emitted, or is reachable, at any
   * depth, from the body of a domain that has been emitted. */
  private boolean isEmitted(Ast.Domain domain) {
    final Set<String> visited = new HashSet<>();
    for (Ast.Item item : result) {
      if (contains(item, domain.iname, visited)) {
        return true;
      }
    }
    return false;
  }

  /** Returns whether an item is named {@code iname} or, if it is a domain,
   * whether its body contains such an item at any depth. */
  private boolean contains(Ast.Item item, String iname,
      Set<String> visited) {
    if (item.iname.equals(iname)) {
      return true;
    }
    if (!(item instanceof Ast.Domain) || !visited.add(item.iname)) {
      return false;
    }
    for (Ast.Item member : bodies.get(item.iname)) {
      if (contains(member, iname, visited)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the names of the members that two domain bodies have in
   * common, in the order they occur in the first body. */
  static Set<String> shared(List<Ast.Item> body1, List<Ast.Item> body2) {
    final Set<String> shared = new LinkedHashSet<>();
    for (Ast.Item item1 : body1) {
      for (Ast.Item item2 : body2) {
        if (item1.iname.equals(item2.iname)) {
          shared.add(item1.iname);
        }
      }
    }
    return shared;
  }
}

// End LoopNester.java
