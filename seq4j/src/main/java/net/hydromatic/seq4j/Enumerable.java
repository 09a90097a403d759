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
 * Sequence that can be traversed any number of times.
 *
 * <p>Each call to {@link #enumerator()} returns a fresh cursor positioned
 * before the first element. Since {@code Enumerable} extends
 * {@link Iterable}, it can be the target of a {@code for} loop.</p>
 *
 * @param <T> Element type
 */
public interface Enumerable<T> extends Iterable<T>, ExtendedEnumerable<T> {
  /**
   * Returns a cursor that iterates over this sequence.
   *
   * @return Cursor
   */
  Enumerator<T> enumerator();
}

// End Enumerable.java
