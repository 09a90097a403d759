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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A seq4j system property.
 *
 * <p>Properties live in the "seq4j" root namespace. A value is taken from the
 * JVM system properties if set there, otherwise from a {@code seq4j.properties}
 * file on the class path, otherwise the property's default applies.</p>
 *
 * @param <T> the type of the property value
 */
public final class Seq4jSystemProperty<T> {
  /**
   * Name of the optional class-path resource that holds property values.
   */
  public static final String RESOURCE = "seq4j.properties";

  private static final Properties PROPERTIES =
      loadProperties(RESOURCE, System.getProperties());

  /**
   * Whether to run seq4j in debug mode.
   *
   * <p>In debug mode every {@link net.hydromatic.seq4j.Seq4jException} is
   * logged at ERROR level when it is created.</p>
   */
  public static final Seq4jSystemProperty<Boolean> DEBUG =
      booleanProperty("seq4j.debug", false);

  /**
   * Algorithm used by the sort operators; one of "MERGE" (the default) or
   * "EXCHANGE". Any other value selects the default.
   *
   * @see net.hydromatic.seq4j.SortAlgorithm
   */
  public static final Seq4jSystemProperty<String> SORT_ALGORITHM =
      stringProperty("seq4j.sort.algorithm", "MERGE",
          ImmutableSet.of("MERGE", "EXCHANGE"));

  private static Seq4jSystemProperty<Boolean> booleanProperty(String key,
      boolean defaultValue) {
    return new Seq4jSystemProperty<>(PROPERTIES.getProperty(key),
        booleanParser(defaultValue));
  }

  private static Seq4jSystemProperty<String> stringProperty(String key,
      String defaultValue, Set<String> allowedValues) {
    return new Seq4jSystemProperty<>(PROPERTIES.getProperty(key),
        stringParser(defaultValue, allowedValues));
  }

  /** Parses a boolean value. Note that "" is true (convenient for
   * command-line flags like '-Dseq4j.debug'). */
  static Function<@Nullable String, Boolean> booleanParser(
      boolean defaultValue) {
    return v -> v == null ? defaultValue
        : "".equals(v) || Boolean.parseBoolean(v);
  }

  /** Parses a value that must be one of a set of upper-case names, ignoring
   * case. */
  static Function<@Nullable String, String> stringParser(String defaultValue,
      Set<String> allowedValues) {
    return v -> {
      if (v == null) {
        return defaultValue;
      }
      String normalizedValue = v.trim().toUpperCase(Locale.ROOT);
      return allowedValues.contains(normalizedValue) ? normalizedValue
          : defaultValue;
    };
  }

  /** Reads a class-path resource, if present, then overlays every property
   * whose name starts with "seq4j." from {@code systemProperties}. */
  static Properties loadProperties(String resource,
      Properties systemProperties) {
    final Properties properties = new Properties();
    ClassLoader classLoader = MoreObjects.firstNonNull(
        Thread.currentThread().getContextClassLoader(),
        Seq4jSystemProperty.class.getClassLoader());
    try (InputStream stream = requireNonNull(classLoader, "classLoader")
        .getResourceAsStream(resource)) {
      if (stream != null) {
        properties.load(stream);
      }
    } catch (IOException e) {
      throw new RuntimeException("while reading from " + resource + " file",
          e);
    }

    // System properties override the file
    systemProperties.stringPropertyNames().forEach(name -> {
      if (name.startsWith("seq4j.")) {
        properties.setProperty(name, systemProperties.getProperty(name));
      }
    });
    return properties;
  }

  private final T value;

  Seq4jSystemProperty(@Nullable String rawValue,
      Function<? super @Nullable String, ? extends T> valueParser) {
    this.value = valueParser.apply(rawValue);
  }

  /**
   * Returns the value of this property.
   */
  public T value() {
    return value;
  }
}

// End Seq4jSystemProperty.java
