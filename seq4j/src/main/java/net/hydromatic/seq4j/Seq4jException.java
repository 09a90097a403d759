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
import net.hydromatic.seq4j.trace.Seq4jTrace;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;

/**
 * Base class for all exceptions originating from seq4j.
 *
 * <p>Invalid arguments are reported using the standard
 * {@link NullPointerException} and {@link IllegalArgumentException}, and
 * elements of the wrong type using {@link ClassCastException}; this class
 * reports an operator invoked in a way that cannot work, such as sorting by a
 * key that has no natural ordering without supplying a comparator.</p>
 */
public class Seq4jException extends RuntimeException {
  private static final long serialVersionUID = 4203617529436412783L;

  private static final Logger LOGGER = Seq4jTrace.getExceptionTracer();

  /**
   * Creates a Seq4jException.
   *
   * @param message error message
   */
  public Seq4jException(String message) {
    this(message, null);
  }

  /**
   * Creates a Seq4jException.
   *
   * @param message error message
   * @param cause   underlying cause
   */
  public Seq4jException(String message, @Nullable Throwable cause) {
    super(message, cause);
    LOGGER.trace("Seq4jException", this);
    if (Seq4jSystemProperty.DEBUG.value()) {
      LOGGER.error(toString());
    }
  }
}

// End Seq4jException.java
