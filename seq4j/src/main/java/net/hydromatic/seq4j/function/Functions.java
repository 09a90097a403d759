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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Utilities relating to functions.
 */
public abstract class Functions {
  private Functions() {}

  private static final Function1<Object, Object> IDENTITY_SELECTOR =
      v0 -> v0;

  @SuppressWarnings("rawtypes")
  private static final Comparator NULLS_FIRST_COMPARATOR =
      new NullsFirstComparator();

  /**
   * Returns a function that returns its argument.
   *
   * <p>{@link net.hydromatic.seq4j.SequenceOperators#transform} recognizes
   * this function and returns its source unchanged.</p>
   *
   * @param <T> Type of parameter and result
   * @return Identity function
   */
  @SuppressWarnings("unchecked")
  public static <T> Function1<T, T> identitySelector() {
    return (Function1<T, T>) IDENTITY_SELECTOR;
  }

  /**
   * A predicate with one parameter that always returns {@code true}.
   *
   * @param <T> First parameter type
   *
   * @return A predicate that always returns {@code true}
   */
  @SuppressWarnings("unchecked")
  public static <T> Predicate1<T> truePredicate1() {
    return (Predicate1<T>) Predicate1.TRUE;
  }

  /**
   * A predicate with one parameter that always returns {@code false}.
   *
   * @param <T> First parameter type
   *
   * @return A predicate that always returns {@code false}
   */
  @SuppressWarnings("unchecked")
  public static <T> Predicate1<T> falsePredicate1() {
    return (Predicate1<T>) Predicate1.FALSE;
  }

  /**
   * Returns a {@link Comparator} that uses the natural ordering of its
   * arguments and sorts null values before non-null values.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public static <T extends Comparable> Comparator<@Nullable T>
      nullsFirstComparator() {
    return (Comparator<@Nullable T>) NULLS_FIRST_COMPARATOR;
  }

  /** Comparator that sorts null values first, then compares non-null values
   * using their natural order. */
  @SuppressWarnings("rawtypes")
  private static class NullsFirstComparator
      implements Comparator<@Nullable Comparable>, Serializable {
    @SuppressWarnings("unchecked")
    @Override public int compare(@Nullable Comparable o1,
        @Nullable Comparable o2) {
      if (o1 == o2) {
        return 0;
      }
      if (o1 == null) {
        return -1;
      }
      if (o2 == null) {
        return 1;
      }
      return o1.compareTo(o2);
    }
  }
}

// End Functions.java
