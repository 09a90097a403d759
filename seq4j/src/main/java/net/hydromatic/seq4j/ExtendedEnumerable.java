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
 * Operator methods in {@link Enumerable}.
 *
 * <p>Each method has the same contract as the static method of the same name
 * in {@link SequenceOperators}, with this sequence as the source.</p>
 *
 * @param <TSource> Element type
 */
public interface ExtendedEnumerable<TSource> {

  /**
   * Filters a sequence of values based on a predicate.
   *
   * @see SequenceOperators#filter(Enumerable, Predicate1)
   */
  Enumerable<TSource> filter(Predicate1<TSource> predicate);

  /**
   * Projects each element of a sequence into a new form.
   *
   * @see SequenceOperators#transform(Enumerable, Function1)
   */
  <TResult> Enumerable<TResult> transform(
      Function1<TSource, TResult> transformer);

  /**
   * Sorts the elements of a sequence in ascending order according to a key,
   * using the natural ordering of the key.
   */
  <TKey> Enumerable<TSource> sortBy(Function1<TSource, TKey> keySelector);

  /**
   * Sorts the elements of a sequence in ascending order according to a key,
   * using a specified comparator.
   */
  <TKey> Enumerable<TSource> sortBy(Function1<TSource, TKey> keySelector,
      Comparator<TKey> comparator);

  /**
   * Sorts the elements of a sequence in descending order according to a key,
   * using the natural ordering of the key.
   */
  <TKey> Enumerable<TSource> sortByDescending(
      Function1<TSource, TKey> keySelector);

  /**
   * Sorts the elements of a sequence in descending order according to a key,
   * using a specified comparator.
   */
  <TKey> Enumerable<TSource> sortByDescending(
      Function1<TSource, TKey> keySelector, Comparator<TKey> comparator);

  /**
   * Converts the elements of this sequence to the specified type.
   *
   * @see SequenceOperators#castTo(Iterable, Class)
   */
  <TResult> Enumerable<TResult> castTo(Class<TResult> clazz);

  /**
   * Determines whether all elements of a sequence satisfy a condition.
   */
  boolean forAll(Predicate1<TSource> predicate);

  /**
   * Creates a {@link List} from this sequence.
   */
  List<TSource> toList();

  /**
   * Returns the number of elements in this sequence.
   */
  int count();
}

// End ExtendedEnumerable.java
