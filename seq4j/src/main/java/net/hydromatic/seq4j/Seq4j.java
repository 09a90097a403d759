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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;

/**
 * Utility and factory methods for seq4j.
 */
public abstract class Seq4j {
  private Seq4j() {}

  private static final Object DUMMY = new Object();

  private static final Enumerator<Object> EMPTY_ENUMERATOR =
      new Enumerator<Object>() {
        @Override public Object current() {
          throw new NoSuchElementException();
        }

        @Override public boolean moveNext() {
          return false;
        }

        @Override public void reset() {
        }

        @Override public void close() {
        }
      };

  public static final Enumerable<?> EMPTY_ENUMERABLE =
      new AbstractEnumerable<Object>() {
        @Override public Enumerator<Object> enumerator() {
          return EMPTY_ENUMERATOR;
        }
      };

  /**
   * Adapter that converts an enumerator into an iterator.
   *
   * <p>The iterator advances the enumerator only when {@code hasNext} or
   * {@code next} needs the following element, so no element is computed
   * before the consumer asks for it.</p>
   *
   * <p><b>WARNING</b>: The iterator returned by this method does not call
   * {@link Enumerator#close()}, so it is not safe to use
   * with an enumerator that allocates resources.</p>
   *
   * @param enumerator Enumerator
   * @param <T> Element type
   *
   * @return Iterator
   */
  public static <T> Iterator<T> enumeratorIterator(
      final Enumerator<T> enumerator) {
    return new Iterator<T>() {
      /** Whether the enumerator is positioned on an element that has not yet
       * been returned by {@link #next()}; null if not yet known. */
      @Nullable Boolean hasNext;

      @Override public boolean hasNext() {
        if (hasNext == null) {
          hasNext = enumerator.moveNext();
        }
        return hasNext;
      }

      @Override public T next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        hasNext = null;
        return enumerator.current();
      }
    };
  }

  /**
   * Adapter that converts an iterable into an enumerator.
   *
   * @param iterable Iterable
   * @param <T> Element type
   *
   * @return enumerator
   */
  public static <T> Enumerator<T> iterableEnumerator(
      final Iterable<? extends T> iterable) {
    return new IterableEnumerator<>(iterable);
  }

  /**
   * Adapter that converts an {@link Iterable} into an {@link Enumerable}.
   *
   * <p>If the iterable is already an {@code Enumerable}, returns it
   * unchanged.</p>
   *
   * @param iterable Iterable
   * @param <T> Element type
   *
   * @return enumerable
   */
  public static <T> Enumerable<T> asEnumerable(final Iterable<T> iterable) {
    requireNonNull(iterable, "iterable");
    if (iterable instanceof Enumerable) {
      return (Enumerable<T>) iterable;
    }
    if (iterable instanceof Collection) {
      return new CollectionEnumerable<>((Collection<T>) iterable);
    }
    return new IterableEnumerable<>(iterable);
  }

  /**
   * Adapter that converts an array into an enumerable.
   *
   * @param ts Array
   * @param <T> Element type
   *
   * @return enumerable
   */
  @SafeVarargs
  public static <T> Enumerable<T> asEnumerable(final T... ts) {
    return new CollectionEnumerable<>(Arrays.asList(ts));
  }

  /**
   * Adapter that converts a {@link Collection} into an enumerable that knows
   * its element type.
   *
   * <p>The caller asserts that every non-null element of the collection is
   * an instance of {@code elementType}; the assertion is not checked.</p>
   *
   * @param collection Collection
   * @param elementType Element type
   * @param <T> Element type
   *
   * @return typed enumerable
   */
  public static <T> TypedEnumerable<T> asEnumerable(
      final Collection<T> collection, final Class<T> elementType) {
    return typedEnumerable(new CollectionEnumerable<>(collection),
        elementType);
  }

  /**
   * Wraps an enumerable so that it reports its element type.
   *
   * @param enumerable Enumerable
   * @param elementType Class of which every non-null element is an instance
   * @param <T> Element type
   *
   * @return typed enumerable
   */
  public static <T> TypedEnumerable<T> typedEnumerable(
      final Enumerable<T> enumerable, final Class<T> elementType) {
    requireNonNull(enumerable, "enumerable");
    requireNonNull(elementType, "elementType");
    if (enumerable instanceof TypedEnumerable
        && ((TypedEnumerable<T>) enumerable).getElementType() == elementType) {
      return (TypedEnumerable<T>) enumerable;
    }
    return new TypedEnumerableImpl<>(enumerable, elementType);
  }

  /**
   * Returns an {@link Enumerable} that has no elements.
   *
   * @param <T> Element type
   *
   * @return Empty enumerable
   */
  public static <T> Enumerable<T> emptyEnumerable() {
    //noinspection unchecked
    return (Enumerable<T>) EMPTY_ENUMERABLE;
  }

  /**
   * Returns an {@link Enumerator} that has no elements.
   *
   * @param <T> Element type
   *
   * @return Empty enumerator
   */
  public static <T> Enumerator<T> emptyEnumerator() {
    //noinspection unchecked
    return (Enumerator<T>) EMPTY_ENUMERATOR;
  }

  /** Enumerator over an {@link Iterable}; {@link #reset()} starts a new
   * iteration. */
  @SuppressWarnings("unchecked")
  private static class IterableEnumerator<T> implements Enumerator<T> {
    private final Iterable<? extends T> iterable;
    @Nullable Iterator<? extends T> iterator;
    T current;

    IterableEnumerator(Iterable<? extends T> iterable) {
      this.iterable = iterable;
      iterator = iterable.iterator();
      current = (T) DUMMY;
    }

    @Override public T current() {
      if (current == DUMMY) {
        throw new NoSuchElementException();
      }
      return current;
    }

    @Override public boolean moveNext() {
      if (iterator != null && iterator.hasNext()) {
        current = iterator.next();
        return true;
      }
      current = (T) DUMMY;
      return false;
    }

    @Override public void reset() {
      iterator = iterable.iterator();
      current = (T) DUMMY;
    }

    @Override public void close() {
      final Iterator<? extends T> iterator = this.iterator;
      this.iterator = null;
      current = (T) DUMMY;
      if (iterator instanceof AutoCloseable) {
        try {
          ((AutoCloseable) iterator).close();
        } catch (RuntimeException e) {
          throw e;
        } catch (Exception e) {
          throw new RuntimeException(e);
        }
      }
    }
  }

  /** Enumerable backed by an {@link Iterable}. */
  static class IterableEnumerable<T> extends AbstractEnumerable<T> {
    protected final Iterable<T> iterable;

    IterableEnumerable(Iterable<T> iterable) {
      this.iterable = iterable;
    }

    @Override public Enumerator<T> enumerator() {
      return iterableEnumerator(iterable);
    }

    @Override public Iterator<T> iterator() {
      return iterable.iterator();
    }
  }

  /** Enumerable backed by a {@link Collection}; knows its size without
   * iterating. */
  static class CollectionEnumerable<T> extends IterableEnumerable<T> {
    CollectionEnumerable(Collection<T> collection) {
      super(collection);
    }

    protected Collection<T> getCollection() {
      return (Collection<T>) iterable;
    }

    @Override public int count() {
      return getCollection().size();
    }
  }

  /** Enumerable that reports its element type and delegates everything else
   * to another enumerable. */
  private static class TypedEnumerableImpl<T> extends AbstractEnumerable<T>
      implements TypedEnumerable<T> {
    private final Enumerable<T> enumerable;
    private final Class<T> elementType;

    TypedEnumerableImpl(Enumerable<T> enumerable, Class<T> elementType) {
      this.enumerable = enumerable;
      this.elementType = elementType;
    }

    @Override public Class<T> getElementType() {
      return elementType;
    }

    @Override public Enumerator<T> enumerator() {
      return enumerable.enumerator();
    }

    @Override public Iterator<T> iterator() {
      return enumerable.iterator();
    }

    @Override public int count() {
      return enumerable.count();
    }

    @Override public List<T> toList() {
      return enumerable.toList();
    }
  }
}

// End Seq4j.java
