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
import net.hydromatic.seq4j.function.Functions;
import net.hydromatic.seq4j.function.Predicate1;
import net.hydromatic.seq4j.trace.Seq4jTrace;

import com.google.common.primitives.Primitives;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkArgument;

import static java.util.Objects.requireNonNull;

/**
 * Implementations of the sequence operators.
 *
 * <p>Every operator checks its arguments when it is called. {@link #filter},
 * {@link #transform} and {@link #castTo} use deferred execution: the
 * immediate return value stores all the information required to perform the
 * action, and no element of the source is read until the result is
 * enumerated. The sort operators read the whole source when they are
 * called.</p>
 */
public abstract class SequenceOperators {
  private SequenceOperators() {}

  private static final Logger LOGGER = Seq4jTrace.getSortTracer();

  /**
   * Filters a sequence of values based on a predicate.
   *
   * <p>The result contains, in their original order, the elements of
   * {@code source} for which {@code predicate} returns true. The predicate is
   * evaluated once per element per enumeration of the result, and not before
   * the result is enumerated.</p>
   *
   * @param source Sequence to filter
   * @param predicate Condition each returned element satisfies
   * @param <TSource> Element type
   *
   * @return Lazy sequence of matching elements
   * @throws NullPointerException if {@code source} or {@code predicate} is
   *         null
   */
  public static <TSource> Enumerable<TSource> filter(
      final Enumerable<TSource> source, final Predicate1<TSource> predicate) {
    requireNonNull(source, "source");
    requireNonNull(predicate, "predicate");
    final Enumerable<TSource> result = new AbstractEnumerable<TSource>() {
      @Override public Enumerator<TSource> enumerator() {
        final Enumerator<TSource> enumerator = source.enumerator();
        return new Enumerator<TSource>() {
          @Override public TSource current() {
            return enumerator.current();
          }

          @Override public boolean moveNext() {
            while (enumerator.moveNext()) {
              if (predicate.apply(enumerator.current())) {
                return true;
              }
            }
            return false;
          }

          @Override public void reset() {
            enumerator.reset();
          }

          @Override public void close() {
            enumerator.close();
          }
        };
      }
    };
    return typedLike(result, source);
  }

  /**
   * Projects each element of a sequence into a new form.
   *
   * <p>The result has as many elements as {@code source}; its element
   * <i>i</i> is {@code transformer} applied to element <i>i</i> of the
   * source. The transformer is applied at most once per element per
   * enumeration, when the element is first read.</p>
   *
   * @param source Sequence of values to transform
   * @param transformer Function to apply to each element
   * @param <TSource> Element type of the source
   * @param <TResult> Element type of the result
   *
   * @return Lazy sequence of transformed elements
   * @throws NullPointerException if {@code source} or {@code transformer} is
   *         null
   */
  public static <TSource, TResult> Enumerable<TResult> transform(
      final Enumerable<TSource> source,
      final Function1<TSource, TResult> transformer) {
    requireNonNull(source, "source");
    requireNonNull(transformer, "transformer");
    if (transformer == Functions.identitySelector()) {
      //noinspection unchecked
      return (Enumerable<TResult>) source;
    }
    return new AbstractEnumerable<TResult>() {
      @Override public Enumerator<TResult> enumerator() {
        return new TransformingEnumerator<>(source.enumerator(), transformer);
      }
    };
  }

  /**
   * Sorts the elements of a sequence in ascending order according to a key,
   * using the natural ordering of the key.
   *
   * <p>Null keys sort before all other keys. The sort is stable.</p>
   *
   * @param source Sequence to sort
   * @param keySelector Function to extract a key from an element
   * @param <TSource> Element type
   * @param <TKey> Key type
   *
   * @return Sorted sequence
   * @throws NullPointerException if {@code source} or {@code keySelector} is
   *         null
   * @throws Seq4jException if a key is not {@link Comparable}, or if two
   *         keys are not mutually comparable; this is a usage error that
   *         calls for an explicit comparator, so it is not reported as
   *         {@link IllegalArgumentException}
   */
  public static <TSource, TKey> Enumerable<TSource> sortBy(
      Enumerable<TSource> source, Function1<TSource, TKey> keySelector) {
    requireNonNull(source, "source");
    requireNonNull(keySelector, "keySelector");
    return sort(source, keySelector, null, false);
  }

  /**
   * Sorts the elements of a sequence in ascending order according to a key,
   * using a specified comparator.
   *
   * @param source Sequence to sort
   * @param keySelector Function to extract a key from an element
   * @param comparator Comparator of keys
   * @param <TSource> Element type
   * @param <TKey> Key type
   *
   * @return Sorted sequence
   * @throws NullPointerException if {@code source}, {@code keySelector} or
   *         {@code comparator} is null
   */
  public static <TSource, TKey> Enumerable<TSource> sortBy(
      Enumerable<TSource> source, Function1<TSource, TKey> keySelector,
      Comparator<TKey> comparator) {
    requireNonNull(source, "source");
    requireNonNull(keySelector, "keySelector");
    requireNonNull(comparator, "comparator");
    return sort(source, keySelector, comparator, false);
  }

  /**
   * Sorts the elements of a sequence in descending order according to a key,
   * using the natural ordering of the key.
   *
   * <p>Null keys sort after all other keys. Elements with equal keys keep
   * their relative order.</p>
   *
   * @throws NullPointerException if {@code source} or {@code keySelector} is
   *         null
   * @throws Seq4jException if a key is not {@link Comparable}, or if two
   *         keys are not mutually comparable
   */
  public static <TSource, TKey> Enumerable<TSource> sortByDescending(
      Enumerable<TSource> source, Function1<TSource, TKey> keySelector) {
    requireNonNull(source, "source");
    requireNonNull(keySelector, "keySelector");
    return sort(source, keySelector, null, true);
  }

  /**
   * Sorts the elements of a sequence in descending order according to a key,
   * using a specified comparator.
   *
   * @throws NullPointerException if {@code source}, {@code keySelector} or
   *         {@code comparator} is null
   */
  public static <TSource, TKey> Enumerable<TSource> sortByDescending(
      Enumerable<TSource> source, Function1<TSource, TKey> keySelector,
      Comparator<TKey> comparator) {
    requireNonNull(source, "source");
    requireNonNull(keySelector, "keySelector");
    requireNonNull(comparator, "comparator");
    return sort(source, keySelector, comparator, true);
  }

  /**
   * Converts the elements of an untyped sequence to the specified type.
   *
   * <p>If {@code source} is a {@link TypedEnumerable} whose element type is
   * assignable to {@code clazz}, returns {@code source} itself. Otherwise
   * each element is converted when it is read, and if it is not an instance
   * of {@code clazz}, reading it throws {@link ClassCastException}; elements
   * already read are unaffected. A primitive class such as {@code int.class}
   * is treated as its wrapper class.</p>
   *
   * @param source Sequence of elements to convert
   * @param clazz Target type
   * @param <TResult> Target type
   *
   * @return Lazy sequence of converted elements
   * @throws NullPointerException if {@code source} or {@code clazz} is null
   */
  public static <TResult> Enumerable<TResult> castTo(final Iterable<?> source,
      Class<TResult> clazz) {
    requireNonNull(source, "source");
    requireNonNull(clazz, "clazz");
    final Class<TResult> boxedClass = Primitives.wrap(clazz);
    if (source instanceof TypedEnumerable
        && boxedClass.isAssignableFrom(
            ((TypedEnumerable<?>) source).getElementType())) {
      //noinspection unchecked
      return (Enumerable<TResult>) source;
    }
    return Seq4j.typedEnumerable(
        new AbstractEnumerable<TResult>() {
          @Override public Enumerator<TResult> enumerator() {
            return new CastingEnumerator<>(enumeratorOf(source), boxedClass);
          }
        }, boxedClass);
  }

  /**
   * Determines whether all elements of a sequence satisfy a condition.
   *
   * <p>Returns true if the sequence is empty. Stops reading the sequence at
   * the first element that does not satisfy the condition.</p>
   *
   * @param source Sequence of values
   * @param predicate Condition to test each element against
   * @param <TSource> Element type
   *
   * @return Whether every element satisfies {@code predicate}
   * @throws NullPointerException if {@code source} or {@code predicate} is
   *         null
   */
  public static <TSource> boolean forAll(Enumerable<TSource> source,
      Predicate1<TSource> predicate) {
    requireNonNull(source, "source");
    requireNonNull(predicate, "predicate");
    try (Enumerator<TSource> os = source.enumerator()) {
      while (os.moveNext()) {
        if (!predicate.apply(os.current())) {
          return false;
        }
      }
      return true;
    }
  }

  /**
   * Generates a sequence of {@code count} consecutive integers, starting at
   * {@code start}.
   *
   * <p>The sequence is computed as it is read. Every enumeration yields
   * the same values.</p>
   *
   * @param count Number of integers; must be positive
   * @param start First integer; any value
   *
   * @return Sequence {@code start, start + 1, ..., start + count - 1}
   * @throws IllegalArgumentException if {@code count} is not positive
   */
  public static TypedEnumerable<Integer> generator(final int count,
      final int start) {
    checkArgument(count > 0, "count must be positive, but was %s", count);
    return Seq4j.typedEnumerable(
        new AbstractEnumerable<Integer>() {
          @Override public Enumerator<Integer> enumerator() {
            return new RangeEnumerator(count, start);
          }

          @Override public int count() {
            return count;
          }
        }, Integer.class);
  }

  /**
   * Creates a {@link List} from a sequence, in order.
   */
  public static <TSource> List<TSource> toList(Enumerable<TSource> source) {
    requireNonNull(source, "source");
    final List<TSource> list = new ArrayList<>();
    try (Enumerator<TSource> os = source.enumerator()) {
      while (os.moveNext()) {
        list.add(os.current());
      }
    }
    return list;
  }

  /**
   * Returns the number of elements in a sequence.
   */
  public static <TSource> int count(Enumerable<TSource> source) {
    requireNonNull(source, "source");
    int n = 0;
    try (Enumerator<TSource> os = source.enumerator()) {
      while (os.moveNext()) {
        ++n;
      }
    }
    return n;
  }

  private static <TSource, TKey> Enumerable<TSource> sort(
      Enumerable<TSource> source, Function1<TSource, TKey> keySelector,
      @Nullable Comparator<TKey> comparator, boolean descending) {
    return sort(source, keySelector, comparator, descending,
        SortAlgorithm.fromProperty());
  }

  /** Copies {@code source}, extracts each element's key once, and sorts the
   * copy using a given algorithm. A null comparator means natural order. */
  static <TSource, TKey> Enumerable<TSource> sort(
      Enumerable<TSource> source, Function1<TSource, TKey> keySelector,
      @Nullable Comparator<TKey> comparator, boolean descending,
      SortAlgorithm algorithm) {
    final List<Keyed<TKey, TSource>> list = new ArrayList<>();
    try (Enumerator<TSource> os = source.enumerator()) {
      while (os.moveNext()) {
        final TSource element = os.current();
        list.add(new Keyed<>(keySelector.apply(element), element));
      }
    }
    final Comparator<TKey> keyComparator =
        comparator != null ? comparator : naturalOrder(list);
    final Comparator<TKey> directed = descending
        ? Collections.reverseOrder(keyComparator)
        : keyComparator;
    final Comparator<Keyed<TKey, TSource>> byKey =
        (k0, k1) -> directed.compare(k0.key, k1.key);
    LOGGER.debug("Sorting {} elements in {} order using {}", list.size(),
        descending ? "descending" : "ascending", algorithm);
    if (comparator != null) {
      algorithm.sort(list, byKey);
    } else {
      try {
        algorithm.sort(list, byKey);
      } catch (ClassCastException e) {
        // Each key is Comparable, but not to every other key
        throw new Seq4jException("Keys of mixed types have no common natural"
            + " ordering; supply a Comparator explicitly", e);
      }
    }

    final List<TSource> sorted = new ArrayList<>(list.size());
    for (Keyed<TKey, TSource> keyed : list) {
      sorted.add(keyed.element);
    }
    return typedLike(
        new Seq4j.CollectionEnumerable<>(Collections.unmodifiableList(sorted)),
        source);
  }

  /** Returns the natural ordering of the keys (nulls first), or throws if a
   * key is not comparable. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  private static <TKey> Comparator<TKey> naturalOrder(
      List<? extends Keyed<TKey, ?>> list) {
    for (Keyed<TKey, ?> keyed : list) {
      if (keyed.key != null && !(keyed.key instanceof Comparable)) {
        throw new Seq4jException("Key of type "
            + keyed.key.getClass().getName()
            + " has no natural ordering; supply a Comparator explicitly");
      }
    }
    return (Comparator<TKey>) (Comparator)
        Functions.<Comparable>nullsFirstComparator();
  }

  /** Returns a result that reports the source's element type, if the
   * source has one. Valid only if every element of the result is an element
   * of the source. */
  private static <T> Enumerable<T> typedLike(Enumerable<T> result,
      Enumerable<T> source) {
    if (source instanceof TypedEnumerable) {
      return Seq4j.typedEnumerable(result,
          ((TypedEnumerable<T>) source).getElementType());
    }
    return result;
  }

  private static Enumerator<?> enumeratorOf(Iterable<?> iterable) {
    if (iterable instanceof Enumerable) {
      return ((Enumerable<?>) iterable).enumerator();
    }
    return Seq4j.iterableEnumerator(iterable);
  }

  /** Element paired with its sort key. */
  private static class Keyed<K, E> {
    final K key;
    final E element;

    Keyed(K key, E element) {
      this.key = key;
      this.element = element;
    }
  }

  /** Enumerator that applies a function to each element of another
   * enumerator, at most once per element. */
  static class TransformingEnumerator<TSource, TResult>
      implements Enumerator<TResult> {
    private final Enumerator<TSource> enumerator;
    private final Function1<TSource, TResult> transformer;
    private boolean computed;
    private @Nullable TResult current;

    TransformingEnumerator(Enumerator<TSource> enumerator,
        Function1<TSource, TResult> transformer) {
      this.enumerator = enumerator;
      this.transformer = transformer;
    }

    @Override public TResult current() {
      if (!computed) {
        current = transformer.apply(enumerator.current());
        computed = true;
      }
      return current;
    }

    @Override public boolean moveNext() {
      computed = false;
      current = null;
      return enumerator.moveNext();
    }

    @Override public void reset() {
      computed = false;
      current = null;
      enumerator.reset();
    }

    @Override public void close() {
      enumerator.close();
    }
  }

  /** Enumerator that casts each element of another enumerator to a given
   * class as it is read. */
  static class CastingEnumerator<T> implements Enumerator<T> {
    private final Enumerator<?> enumerator;
    private final Class<T> clazz;

    CastingEnumerator(Enumerator<?> enumerator, Class<T> clazz) {
      this.enumerator = enumerator;
      this.clazz = clazz;
    }

    @Override public T current() {
      return clazz.cast(enumerator.current());
    }

    @Override public boolean moveNext() {
      return enumerator.moveNext();
    }

    @Override public void reset() {
      enumerator.reset();
    }

    @Override public void close() {
      enumerator.close();
    }
  }

  /** Enumerator over a range of integers. */
  static class RangeEnumerator implements Enumerator<Integer> {
    private final int count;
    private final int start;
    private int i = -1;

    RangeEnumerator(int count, int start) {
      this.count = count;
      this.start = start;
    }

    @Override public Integer current() {
      if (i < 0 || i >= count) {
        throw new NoSuchElementException();
      }
      return start + i;
    }

    @Override public boolean moveNext() {
      if (i + 1 < count) {
        ++i;
        return true;
      }
      i = count;
      return false;
    }

    @Override public void reset() {
      i = -1;
    }

    @Override public void close() {
    }
  }
}

// End SequenceOperators.java
