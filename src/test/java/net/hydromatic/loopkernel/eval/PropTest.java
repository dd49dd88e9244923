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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.FUNCTION_PREFIX.stringValue(map), is("kernel"));
    assertThat(Prop.INDEX_BASE.intValue(map), is(1));
    assertThat(Prop.ITERATION_LIMIT.intValueOpt(map), nullValue());
    assertThat(Prop.NEST_LOOPS.booleanValue(map), is(true));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.INDEX_BASE.set(map, 0);
    Prop.ITERATION_LIMIT.set(map, 100);
    assertThat(Prop.INDEX_BASE.intValue(map), is(0));
    assertThat(Prop.ITERATION_LIMIT.intValueOpt(map), is(100));
    Prop.ITERATION_LIMIT.set(map, null);
    assertThat(Prop.ITERATION_LIMIT.intValueOpt(map), nullValue());
    assertThat(map.containsKey(Prop.ITERATION_LIMIT), is(false));

    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDEX_BASE.set(map, "zero"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.NEST_LOOPS.set(map, null));
    // asking for the wrong type is an error
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDEX_BASE.booleanValue(map));
  }

  @Test
  void testLookup() {
    assertThat(Prop.lookup("nestLoops"), is(Prop.NEST_LOOPS));
    assertThat(Prop.lookup("NEST_LOOPS"), is(Prop.NEST_LOOPS));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));
    assertThat(Prop.BY_CAMEL_NAME,
        is(
            ImmutableList.of(Prop.FUNCTION_PREFIX, Prop.INDEX_BASE,
                Prop.ITERATION_LIMIT, Prop.NEST_LOOPS)));
  }
}

// End PropTest.java
