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
package net.hydromatic.seq4j;

import net.hydromatic.seq4j.SequenceOperatorsTest.Employee;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;

import static net.hydromatic.seq4j.SequenceOperatorsTest.EMPS;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link Enumerable}, its operator methods, and the adapters in
 * {@link Seq4j}.
 */
class EnumerableTest {
  @Test void testChain() {
    final List<String> names =
        Seq4j.asEnumerable(EMPS)
            .filter(e -> e.deptno == 10)
            .sortByDescending(e -> e.name)
            .transform(e -> e.name)
            .toList();
    assertThat(names, hasToString("[Janet, Fred, Eric]"));
  }

  @Test void testChainWithComparator() {
    final Comparator<String> byLength = Comparator.comparing(String::length);
    final List<Integer> empnos =
        Seq4j.asEnumerable(EMPS)
            .sortBy(e -> e.name, byLength)
            .transform(e -> e.empno)
            .toList();
    // Fred, Bill and Eric have 4 letters and keep their input order
    assertThat(empnos, hasToString("[100, 110, 120, 130]"));
    final List<String> names =
        Seq4j.asEnumerable(EMPS)
            .sortByDescending(e -> e.name, byLength)
            .transform(e -> e.name)
            .toList();
    assertThat(names, hasToString("[Janet, Fred, Bill, Eric]"));
  }

  @Test void testChainOverGenerator() {
    final Enumerable<Integer> range = SequenceOperators.generator(10, 1);
    assertThat(range.filter(i -> i % 3 == 0).transform(i -> i * 10).toList(),
        hasToString("[30, 60, 90]"));
    assertThat(range.sortBy(i -> i % 2).toList(),
        hasToString("[2, 4, 6, 8, 10, 1, 3, 5, 7, 9]"));
    assertThat(range.forAll(i -> i > 0), is(true));
    assertThat(range.castTo(Number.class).count(), is(10));
  }

  @Test void testCastToUntyped() {
    final Enumerable<Object> objects = Seq4j.asEnumerable((Object) "a", "bc");
    final Enumerable<String> strings = objects.castTo(String.class);
    assertThat(strings.transform(String::length).toList(),
        hasToString("[1, 2]"));
    final Enumerable<Integer> ints = objects.castTo(Integer.class);
    final Iterator<Integer> iterator = ints.iterator();
    assertThrows(ClassCastException.class, iterator::next);
  }

  @Test void testForLoop() {
    int sum = 0;
    for (int i : SequenceOperators.generator(4, 1)) {
      sum += i;
    }
    assertThat(sum, is(10));

    final List<String> names = new ArrayList<>();
    for (Employee emp : Seq4j.asEnumerable(EMPS).filter(e -> e.deptno > 20)) {
      names.add(emp.name);
    }
    assertThat(names, hasToString("[Bill]"));
  }

  @Test void testIteratorReadsOnDemand() {
    final AtomicInteger calls = new AtomicInteger();
    final Enumerable<Integer> evens =
        SequenceOperators.generator(6, 1).filter(i -> {
          calls.incrementAndGet();
          return i % 2 == 0;
        });
    final Iterator<Integer> iterator = evens.iterator();
    assertThat(calls.get(), is(0));
    assertThat(iterator.hasNext(), is(true));
    assertThat(iterator.hasNext(), is(true));
    assertThat(calls.get(), is(2));
    assertThat(iterator.next(), is(2));
    assertThat(calls.get(), is(2));
    assertThat(iterator.next(), is(4));
    assertThat(iterator.next(), is(6));
    assertThat(iterator.hasNext(), is(false));
    assertThrows(NoSuchElementException.class, iterator::next);
    assertThat(calls.get(), is(6));
  }

  @Test void testAsEnumerableIterable() {
    final Enumerable<Integer> range = SequenceOperators.generator(2, 0);
    assertThat(Seq4j.asEnumerable(range), sameInstance(range));

    final Iterable<String> iterable = Arrays.asList("x", "y")::iterator;
    final Enumerable<String> enumerable = Seq4j.asEnumerable(iterable);
    assertThat(enumerable.count(), is(2));
    assertThat(enumerable.toList(), hasToString("[x, y]"));
  }

  @Test void testAsEnumerableCollectionCountsWithoutIterating() {
    final List<String> list = new ArrayList<String>() {
      @Override public Iterator<String> iterator() {
        throw new AssertionError("iterated");
      }
    };
    list.add("a");
    list.add("b");
    assertThat(Seq4j.asEnumerable(list).count(), is(2));
  }

  @Test void testTypedEnumerable() {
    final Enumerable<String> strings = Seq4j.asEnumerable("a", "b");
    final TypedEnumerable<String> typed =
        Seq4j.typedEnumerable(strings, String.class);
    assertThat(typed.getElementType(), sameInstance(String.class));
    assertThat(typed.toList(), hasToString("[a, b]"));
    assertThat(typed.count(), is(2));
    assertThat(Seq4j.typedEnumerable(typed, String.class),
        sameInstance(typed));
  }

  @Test void testEmpty() {
    final Enumerable<String> empty = Seq4j.emptyEnumerable();
    assertThat(empty.count(), is(0));
    assertThat(empty.iterator().hasNext(), is(false));
    final Enumerator<String> enumerator = Seq4j.emptyEnumerator();
    assertThat(enumerator.moveNext(), is(false));
    assertThrows(NoSuchElementException.class, enumerator::current);
  }

  @Test void testIterableEnumerator() {
    final Enumerator<String> enumerator =
        Seq4j.iterableEnumerator(Arrays.asList("a", "b"));
    assertThrows(NoSuchElementException.class, enumerator::current);
    assertThat(enumerator.moveNext(), is(true));
    assertThat(enumerator.current(), is("a"));
    assertThat(enumerator.moveNext(), is(true));
    assertThat(enumerator.current(), is("b"));
    assertThat(enumerator.moveNext(), is(false));
    assertThrows(NoSuchElementException.class, enumerator::current);
    enumerator.reset();
    assertThat(enumerator.moveNext(), is(true));
    assertThat(enumerator.current(), is("a"));
    enumerator.close();
    enumerator.close();
    assertThat(enumerator.moveNext(), is(false));
  }

  @Test void testEnumeratorsAreIndependent() {
    final Enumerable<Integer> sorted =
        Seq4j.asEnumerable(3, 1, 2).sortBy(i -> i);
    final Enumerator<Integer> e0 = sorted.enumerator();
    final Enumerator<Integer> e1 = sorted.enumerator();
    assertThat(e0.moveNext(), is(true));
    assertThat(e0.moveNext(), is(true));
    assertThat(e1.moveNext(), is(true));
    assertThat(e0.current(), is(2));
    assertThat(e1.current(), is(1));
  }
}

// End EnumerableTest.java
