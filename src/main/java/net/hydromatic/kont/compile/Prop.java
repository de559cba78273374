/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.kont.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls compilation.
 *
 * <p>Property values are held in a {@code Map<Prop, Object>}; a property that
 * is not in the map has its default value. Every property has a default
 * value, so setting a property to null restores its default.
 */
public enum Prop {
  /**
   * Boolean property "logBuiltIn" controls whether each converted entry of an
   * environment of built-ins is written to the debug log. Default is false.
   */
  LOG_BUILT_IN("logBuiltIn", Boolean.class, false),

  /**
   * Boolean property "logCps" controls whether the converted term is written
   * to the debug log. Default is false.
   */
  LOG_CPS("logCps", Boolean.class, false),

  /**
   * Boolean property "logLift" controls whether the term is written to the
   * debug log after applications have been lifted. Default is false.
   */
  LOG_LIFT("logLift", Boolean.class, false),

  /**
   * String property "nameSeparator" is the string between the hint and the
   * ordinal of a generated variable name, for example the "$" in "k$3".
   * Default is "$".
   */
  NAME_SEPARATOR("nameSeparator", String.class, "$");

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = requireNonNull(defaultValue);
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new RuntimeException("property " + propName + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    Object o = map.get(this);
    return this.<Boolean>typeValue(o);
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    Object o = map.get(this);
    return this.typeValue(o);
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(Object o) {
    return (T) (o != null ? o : defaultValue);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. A null value
   * removes the property from the map, restoring its default value.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new RuntimeException("value for property must have type " + type);
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
