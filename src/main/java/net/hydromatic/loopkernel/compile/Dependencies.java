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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.loopkernel.ast.Ast;

/**
 * Dependencies among the items of a kernel, and the members of each domain.
 *
 * <p>A layer over a kernel: the kernel is read-only, and each analysis pass
 * returns a new {@code Dependencies} rather than modifying the kernel's
 * instructions and domains. The layer starts from what the front end
 * declared ({@link #declared(Ast.Kernel)}), and passes add to it.
 */
public class Dependencies {
  public final Ast.Kernel kernel;
  private final ImmutableMap<String, ImmutableSet<String>> dependencyMap;
  private final ImmutableMap<String, ImmutableList<Ast.Item>> memberMap;

  private Dependencies(Ast.Kernel kernel,
      ImmutableMap<String, ImmutableSet<String>> dependencyMap,
      ImmutableMap<String, ImmutableList<Ast.Item>> memberMap) {
    this.kernel = requireNonNull(kernel);
    this.dependencyMap = requireNonNull(dependencyMap);
    this.memberMap = requireNonNull(memberMap);
  }

  /** Creates a Dependencies that contains only what the kernel declares:
   * each item's declared dependencies, and each domain's declared
   * instructions. */
  public static Dependencies declared(Ast.Kernel kernel) {
    final ImmutableMap.Builder<String, ImmutableSet<String>> dependencyMap =
        ImmutableMap.builder();
    for (Ast.Item item : kernel.items()) {
      dependencyMap.put(item.iname, item.dependencies);
    }
    final ImmutableMap.Builder<String, ImmutableList<Ast.Item>> memberMap =
        ImmutableMap.builder();
    for (Ast.Domain domain : kernel.domains) {
      memberMap.put(domain.iname, domain.instructions);
    }
    return new Dependencies(kernel, dependencyMap.build(), memberMap.build());
  }

  /** Returns the names of the items that an item depends on. */
  public ImmutableSet<String> dependencies(String iname) {
    final ImmutableSet<String> set = dependencyMap.get(iname);
    if (set == null) {
      throw new IllegalArgumentException("unknown item " + iname);
    }
    return set;
  }

  /** Returns the names of the items that an item depends on. */
  public ImmutableSet<String> dependencies(Ast.Item item) {
    return dependencies(item.iname);
  }

  /** Returns the instructions and domains inside a domain. */
  public ImmutableList<Ast.Item> members(String domainName) {
    final ImmutableList<Ast.Item> list = memberMap.get(domainName);
    if (list == null) {
      throw new IllegalArgumentException("unknown domain " + domainName);
    }
    return list;
  }

  /** Returns the instructions and domains inside a domain. */
  public ImmutableList<Ast.Item> members(Ast.Domain domain) {
    return members(domain.iname);
  }

  /** Returns a builder initialized with the contents of this
   * Dependencies. */
  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    b.append("dependencies ").append(dependencyMap);
    b.append(", members {");
    int i = 0;
    for (Map.Entry<String, ImmutableList<Ast.Item>> e : memberMap.entrySet()) {
      if (i++ > 0) {
        b.append(", ");
      }
      b.append(e.getKey()).append("=[");
      for (int j = 0; j < e.getValue().size(); j++) {
        if (j > 0) {
          b.append(", ");
        }
        b.append(e.getValue().get(j).iname);
      }
      b.append("]");
    }
    return b.append("}").toString();
  }

  /** Builds a {@link Dependencies}. */
  public static class Builder {
    private final Ast.Kernel kernel;
    private final Map<String, Set<String>> dependencyMap =
        new LinkedHashMap<>();
    private final Map<String, List<Ast.Item>> memberMap =
        new LinkedHashMap<>();

    private Builder(Dependencies dependencies) {
      this.kernel = dependencies.kernel;
      dependencies.dependencyMap.forEach((iname, set) ->
          dependencyMap.put(iname, new LinkedHashSet<>(set)));
      dependencies.memberMap.forEach((iname, list) ->
          memberMap.put(iname, new ArrayList<>(list)));
    }

    /** Records that {@code item} depends on the item called
     * {@code dependency}. */
    @CanIgnoreReturnValue
    public Builder addDependency(Ast.Item item, String dependency) {
      final Set<String> set = dependencyMap.get(item.iname);
      if (set == null) {
        throw new IllegalArgumentException("unknown item " + item.iname);
      }
      set.add(dependency);
      return this;
    }

    /** Records that {@code member} is inside {@code domain}. Does nothing if
     * an item of the same name is already a member. */
    @CanIgnoreReturnValue
    public Builder addMember(Ast.Domain domain, Ast.Item member) {
      final List<Ast.Item> list = memberMap.get(domain.iname);
      if (list == null) {
        throw new IllegalArgumentException("unknown domain " + domain.iname);
      }
      for (Ast.Item item : list) {
        if (item.iname.equals(member.iname)) {
          return this;
        }
      }
      list.add(member);
      return this;
    }

    public Dependencies build() {
      final ImmutableMap.Builder<String, ImmutableSet<String>> dependencies =
          ImmutableMap.builder();
      dependencyMap.forEach((iname, set) ->
          dependencies.put(iname, ImmutableSet.copyOf(set)));
      final ImmutableMap.Builder<String, ImmutableList<Ast.Item>> members =
          ImmutableMap.builder();
      memberMap.forEach((iname, list) ->
          members.put(iname, ImmutableList.copyOf(list)));
      return new Dependencies(kernel, dependencies.build(), members.build());
    }
  }
}

// End Dependencies.java
