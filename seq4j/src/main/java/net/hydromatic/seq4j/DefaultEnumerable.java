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

import net.hydromatic.seq4j.function.Function1;
import net.hydromatic.seq4j.function.Predicate1;

import java.util.Comparator;
import java.util.List;

/**
 * Implementation of the {@link Enumerable} interface that implements the
 * operator methods by calling into the {@link SequenceOperators} class.
 *
 * <p>The are two abstract methods:
 * {@link #enumerator()} and {@link #iterator()}.
 * The derived class can implement each separately, or implement one in terms of
 * the other.</p>
 *
 * @param <T> Element type
 */
public abstract class DefaultEnumerable<T> implements Enumerable<T> {

  /**
   * Derived classes might wish to override this method to return the "outer"
   * enumerable.
   */
  protected Enumerable<T> getThis() {
    return this;
  }

  @Override public Enumerable<T> filter(Predicate1<T> predicate) {
    return SequenceOperators.filter(getThis(), predicate);
  }

  @Override public <TResult> Enumerable<TResult> transform(
      Function1<T, TResult> transformer) {
    return SequenceOperators.transform(getThis(), transformer);
  }

  @Override public <TKey> Enumerable<T> sortBy(
      Function1<T, TKey> keySelector) {
    return SequenceOperators.sortBy(getThis(), keySelector);
  }

  @Override public <TKey> Enumerable<T> sortBy(Function1<T, TKey> keySelector,
      Comparator<TKey> comparator) {
    return SequenceOperators.sortBy(getThis(), keySelector, comparator);
  }

  @Override public <TKey> Enumerable<T> sortByDescending(
      Function1<T, TKey> keySelector) {
    return SequenceOperators.sortByDescending(getThis(), keySelector);
  }

  @Override public <TKey> Enumerable<T> sortByDescending(
      Function1<T, TKey> keySelector, Comparator<TKey> comparator) {
    return SequenceOperators.sortByDescending(getThis(), keySelector,
        comparator);
  }

  @Override public <TResult> Enumerable<TResult> castTo(
      Class<TResult> clazz) {
    return SequenceOperators.castTo(getThis(), clazz);
  }

  @Override public boolean forAll(Predicate1<T> predicate) {
    return SequenceOperators.forAll(getThis(), predicate);
  }

  @Override public List<T> toList() {
    return SequenceOperators.toList(getThis());
  }

  @Override public int count() {
    return SequenceOperators.count(getThis());
  }
}

// End DefaultEnumerable.java
