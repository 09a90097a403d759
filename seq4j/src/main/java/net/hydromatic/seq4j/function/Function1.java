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

/**
 * Function with one parameter.
 *
 * <p>Used as the transformer of
 * {@link net.hydromatic.seq4j.SequenceOperators#transform} and as the key
 * extractor of the sort operators.</p>
 *
 * @param <T0> Type of parameter 0
 * @param <R> Result type
 */
@FunctionalInterface
public interface Function1<T0, R> extends Function<R> {
  R apply(T0 a0);
}

// End Function1.java
