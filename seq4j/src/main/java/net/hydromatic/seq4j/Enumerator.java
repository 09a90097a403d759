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

/**
 * Pull cursor over a sequence.
 *
 * <p>A cursor is positioned before the first element when it is created and
 * after each call to {@link #reset}. Each call to {@link #moveNext} computes
 * at most one element; nothing is computed until it is asked for.</p>
 *
 * @param <T> Element type
 */
public interface Enumerator<T> extends AutoCloseable {
  /**
   * Gets the current element.
   *
   * <p>Consecutive calls return the same element until either
   * {@code moveNext} or {@code reset} is called.</p>
   *
   * @return Current element
   * @throws java.util.NoSuchElementException
   *          if {@code moveNext} has not been called, has not been called
   *          since the most recent call to {@code reset}, or returned false
   */
  T current();

  /**
   * Advances the cursor to the next element.
   *
   * <p>Once {@code moveNext} has returned {@code false}, subsequent calls also
   * return {@code false} until {@link #reset} is called.</p>
   *
   * @return {@code true} if the cursor was advanced to an element;
   *         {@code false} if it has passed the end of the sequence
   */
  boolean moveNext();

  /**
   * Sets the cursor to its initial position, which is before the first
   * element.
   *
   * <p>This method is optional; it may throw
   * {@link UnsupportedOperationException}.</p>
   */
  void reset();

  /**
   * Closes this cursor and releases resources.
   *
   * <p>This method is idempotent.</p>
   */
  @Override void close();
}

// End Enumerator.java
