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
package net.hydromatic.seq4j.config;

import com.google.common.collect.ImmutableSet;

import org.junit.jupiter.api.Test;

import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

/**
 * Unit tests for {@link Seq4jSystemProperty}.
 */
class Seq4jSystemPropertyTest {
  @Test void testDefaults() {
    assertThat(Seq4jSystemProperty.DEBUG.value(), is(false));
    assertThat(Seq4jSystemProperty.SORT_ALGORITHM.value(), is("MERGE"));
  }

  @Test void testBooleanParser() {
    final Function<String, Boolean> parser =
        Seq4jSystemProperty.booleanParser(false);
    assertThat(parser.apply(null), is(false));
    assertThat(parser.apply(""), is(true));
    assertThat(parser.apply("true"), is(true));
    assertThat(parser.apply("TRUE"), is(true));
    assertThat(parser.apply("false"), is(false));
    assertThat(parser.apply("yes"), is(false));
    assertThat(Seq4jSystemProperty.booleanParser(true).apply(null), is(true));
  }

  @Test void testStringParser() {
    final Set<String> allowed = ImmutableSet.of("MERGE", "EXCHANGE");
    final Function<String, String> parser =
        Seq4jSystemProperty.stringParser("MERGE", allowed);
    assertThat(parser.apply(null), is("MERGE"));
    assertThat(parser.apply("exchange"), is("EXCHANGE"));
    assertThat(parser.apply(" Exchange "), is("EXCHANGE"));
    assertThat(parser.apply("QUICK"), is("MERGE"));
  }

  @Test void testPropertyFromRawValue() {
    final Seq4jSystemProperty<Boolean> property =
        new Seq4jSystemProperty<>("true",
            Seq4jSystemProperty.booleanParser(false));
    assertThat(property.value(), is(true));
  }

  @Test void testLoadPropertiesFromResource() {
    final Properties properties =
        Seq4jSystemProperty.loadProperties("seq4j-test.properties",
            new Properties());
    assertThat(properties.getProperty("seq4j.sort.algorithm"), is("exchange"));
    assertThat(properties.getProperty("seq4j.debug"), is("false"));

    final Seq4jSystemProperty<String> algorithm =
        new Seq4jSystemProperty<>(
            properties.getProperty("seq4j.sort.algorithm"),
            Seq4jSystemProperty.stringParser("MERGE",
                ImmutableSet.of("MERGE", "EXCHANGE")));
    assertThat(algorithm.value(), is("EXCHANGE"));
  }

  @Test void testSystemPropertiesOverrideResource() {
    final Properties systemProperties = new Properties();
    systemProperties.setProperty("seq4j.sort.algorithm", "MERGE");
    systemProperties.setProperty("seq4j.debug", "");
    systemProperties.setProperty("user.name", "fred");
    final Properties properties =
        Seq4jSystemProperty.loadProperties("seq4j-test.properties",
            systemProperties);
    assertThat(properties.getProperty("seq4j.sort.algorithm"), is("MERGE"));
    assertThat(properties.getProperty("user.name"), nullValue());

    final Seq4jSystemProperty<Boolean> debug =
        new Seq4jSystemProperty<>(properties.getProperty("seq4j.debug"),
            Seq4jSystemProperty.booleanParser(false));
    assertThat(debug.value(), is(true));
  }

  @Test void testLoadPropertiesMissingResource() {
    final Properties systemProperties = new Properties();
    systemProperties.setProperty("seq4j.sort.algorithm", "exchange");
    final Properties properties =
        Seq4jSystemProperty.loadProperties("no-such-seq4j.properties",
            systemProperties);
    assertThat(properties.size(), is(1));
    assertThat(properties.getProperty("seq4j.sort.algorithm"), is("exchange"));
  }
}

// End Seq4jSystemPropertyTest.java
