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

import net.hydromatic.seq4j.config.Seq4jSystemProperty;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Algorithm that the sort operators use to reorder their working copy.
 *
 * <p>Every algorithm is stable: elements that compare equal keep their
 * relative order.</p>
 */
public enum SortAlgorithm {
  /** Merge sort as implemented by {@link List#sort(Comparator)};
   * O(n log n). */
  MERGE {
    @Override public <E> void sort(List<E> list,
        Comparator<? super E> comparator) {
      list.sort(comparator);
    }
  },

  /** Adjacent-exchange (bubble) sort; O(n<sup>2</sup>) comparisons, stops
   * after the first pass that makes no exchange. Suitable only for small
   * inputs. */
  EXCHANGE {
    @Override public <E> void sort(List<E> list,
        Comparator<? super E> comparator) {
      for (int end = list.size() - 1; end > 0; end--) {
        boolean swapped = false;
        for (int j = 0; j < end; j++) {
          final E e0 = list.get(j);
          final E e1 = list.get(j + 1);
          // Exchange only if strictly out of order, so ties stay in place.
          if (comparator.compare(e0, e1) > 0) {
            list.set(j, e1);
            list.set(j + 1, e0);
            swapped = true;
          }
        }
        if (!swapped) {
          break;
        }
      }
    }
  };

  /**
   * Sorts a list in place.
   *
   * @param list List; must support {@link List#set}
   * @param comparator Comparator
   * @param <E> Element type
   */
  public abstract <E> void sort(List<E> list,
      Comparator<? super E> comparator);

  /** Returns the algorithm selected by the {@code seq4j.sort.algorithm}
   * property. */
  public static SortAlgorithm fromProperty() {
    return valueOf(
        Seq4jSystemProperty.SORT_ALGORITHM.value().toUpperCase(Locale.ROOT));
  }
}

// End SortAlgorithm.java
