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
package net.hydromatic.seq4j.trace;

import net.hydromatic.seq4j.Seq4jException;
import net.hydromatic.seq4j.SequenceOperators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Contains all of the {@link org.slf4j.Logger tracers} used within seq4j.
 *
 * <p>Please ensure that every tracer used in seq4j is obtained from this
 * class. The javadoc here is the primary source of information on what
 * tracers are available and what each reports at each level.</p>
 *
 * <p>In the class where the tracer is used, create a <em>private static
 * final</em> member called {@code LOGGER}.</p>
 */
public abstract class Seq4jTrace {
  private Seq4jTrace() {}

  /**
   * The "net.hydromatic.seq4j.SequenceOperators" tracer reports, at DEBUG
   * level, the number of elements and the algorithm of each sort.
   */
  public static Logger getSortTracer() {
    return LoggerFactory.getLogger(SequenceOperators.class.getName());
  }

  /**
   * The "net.hydromatic.seq4j.Seq4jException" tracer reports each
   * {@link Seq4jException} at TRACE level when it is created, and at ERROR
   * level if the {@code seq4j.debug} property is set.
   */
  public static Logger getExceptionTracer() {
    return LoggerFactory.getLogger(Seq4jException.class.getName());
  }
}

// End Seq4jTrace.java
