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
 * Enumerable that knows the run-time class of its elements.
 *
 * <p>{@link SequenceOperators#castTo} returns a typed enumerable unchanged if
 * its element type is assignable to the requested class.</p>
 *
 * @param <T> Element type
 */
public interface TypedEnumerable<T> extends Enumerable<T> {
  /** Returns the class that every non-null element of this sequence is an
   * instance of. */
  Class<T> getElementType();
}

// End TypedEnumerable.java
