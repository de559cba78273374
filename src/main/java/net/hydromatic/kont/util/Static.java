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
package net.hydromatic.kont.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /** Returns whether a predicate is true for all elements of a list. */
  public static <E> boolean allMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function to
   * each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
      case 0:
        // Save ourselves the effort of creating a Builder.
        return ImmutableList.of();

      case 1:
        return ImmutableList.of(mapper.apply(elements.get(0)));

      default:
        // Optimize by making the builder the same size as the collection.
        final ImmutableList.Builder<T> b =
            ImmutableList.builderWithExpectedSize(elements.size());
        elements.forEach(e -> b.add(mapper.apply(e)));
        return b.build();
    }
  }

  /**
   * Given a {@link Map}, returns an {@link ImmutableMap} with the same keys, in
   * the same order, but with each value transformed by a mapping function.
   */
  public static <K, V, V2> ImmutableMap<K, V2> transformValuesEager(
      Map<K, V> map, Function<V, V2> mapper) {
    if (map.isEmpty()) {
      // Save ourselves the effort of creating a Builder.
      return ImmutableMap.of();
    }
    final ImmutableMap.Builder<K, V2> b =
        ImmutableMap.builderWithExpectedSize(map.size());
    map.forEach((k, v) -> b.put(k, mapper.apply(v)));
    return b.build();
  }

  /** Returns a list with one element appended. */
  public static <E> ImmutableList<E> append(List<? extends E> list, E e) {
    return ImmutableList.<E>builderWithExpectedSize(list.size() + 1)
        .addAll(list)
        .add(e)
        .build();
  }
}

// End Static.java
