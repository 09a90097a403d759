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

/**
 * Lazy operators over in-memory sequences.
 *
 * <p>{@link net.hydromatic.seq4j.SequenceOperators} holds the operators:
 * filter, transform, sort by key (ascending and descending, with natural or
 * supplied ordering), cast, universal quantification and integer range
 * generation. They consume and produce
 * {@link net.hydromatic.seq4j.Enumerable}, so calls can be chained, either
 * statically or through the fluent methods of
 * {@link net.hydromatic.seq4j.ExtendedEnumerable}.</p>
 *
 * <p>{@link net.hydromatic.seq4j.Seq4j} adapts Java collections, iterables
 * and arrays to {@code Enumerable}.</p>
 */
package net.hydromatic.seq4j;

// End package-info.java
