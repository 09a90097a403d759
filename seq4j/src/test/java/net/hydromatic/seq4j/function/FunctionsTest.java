/*
// Licensed to Julian Hyde under one or more contributor license
// agreements. See the NOTICE file distributed with this work for
// additional information regarding copyright ownership.
//
// Julian Hyde licenses this file to you under the Apache License,
// Version 2.0 (the "License"); you may not use this file except in
// compliance with the License. You may obtain a copy of the License at:
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
*/
package net.hydromatic.seq4j.function;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

/**
 * Test for {@link Functions}.
 */
class FunctionsTest {
  /** Unit test for {@link Functions#identitySelector()}. */
  @Test void testIdentitySelector() {
    final Function1<String, String> identity = Functions.identitySelector();
    assertThat(identity.apply("x"), is("x"));
    assertThat(Functions.<Integer>identitySelector().apply(3), is(3));
  }

  /** Unit test for {@link Functions#truePredicate1()} and
   * {@link Functions#falsePredicate1()}. */
  @Test void testConstantPredicates() {
    assertThat(Functions.<String>truePredicate1().apply("a"), is(true));
    assertThat(Functions.<String>falsePredicate1().apply("a"), is(false));
    assertThat(Predicate1.TRUE.apply(null), is(true));
    assertThat(Predicate1.FALSE.apply(null), is(false));
  }

  /** Unit test for {@link Functions#nullsFirstComparator()}. */
  @Test void testNullsFirstComparator() {
    final Comparator<String> comparator = Functions.nullsFirstComparator();
    final List<String> list =
        new ArrayList<>(Arrays.asList("b", null, "a", null, "c"));
    list.sort(comparator);
    assertThat(list, hasToString("[null, null, a, b, c]"));
    assertThat(comparator.compare(null, null), is(0));
    assertThat(comparator.compare("a", "a"), is(0));
  }
}

// End FunctionsTest.java
