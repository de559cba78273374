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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.kont.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Set;
import net.hydromatic.kont.ast.Core;
import net.hydromatic.kont.ast.Visitor;

/**
 * Generates unique names.
 *
 * <p>A name is a hint, a separator and an ordinal, for example "k$3". The
 * ordinal increases with every name generated, so no two names are the same;
 * names that already occur in the program being compiled are reserved and
 * are never generated.
 *
 * <p>Use one generator per compilation unit. A generator is not thread-safe.
 */
public class NameGenerator {
  private int id = 0;
  private final String separator;
  private final Set<String> reserved;

  /** Creates a NameGenerator. */
  public NameGenerator(String separator, Set<String> reserved) {
    this.separator = requireNonNull(separator);
    this.reserved = ImmutableSet.copyOf(reserved);
  }

  /** Creates a NameGenerator that reserves no names. */
  public NameGenerator() {
    this("$", ImmutableSet.of());
  }

  /**
   * Creates a NameGenerator that will not generate any name used in the given
   * terms.
   */
  public static NameGenerator of(String separator,
      Iterable<? extends Core.Term> terms) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    final NameCollector collector = new NameCollector(names);
    terms.forEach(term -> term.accept(collector));
    return new NameGenerator(separator, names.build());
  }

  /** Generates a name that is unique in this program. */
  public String get(String hint) {
    for (;;) {
      final String name = hint + separator + id++;
      if (!reserved.contains(name)) {
        return name;
      }
    }
  }

  /** Generates a variable with a name that is unique in this program. */
  public Core.Var var(String hint) {
    return core.var(get(hint));
  }

  /** Generates a list of variables with unique names. */
  public ImmutableList<Core.Var> vars(String hint, int count) {
    final ImmutableList.Builder<Core.Var> vars =
        ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      vars.add(var(hint));
    }
    return vars.build();
  }

  /**
   * Visitor that collects every name bound or referenced in a term, including
   * names bound by patterns and by closures' environments.
   */
  private static class NameCollector extends Visitor {
    private final ImmutableSet.Builder<String> names;

    NameCollector(ImmutableSet.Builder<String> names) {
      this.names = names;
    }

    @Override
    protected void visit(Core.Var var) {
      names.add(var.name);
    }

    @Override
    protected void visit(Core.Lam lam) {
      names.add(lam.param);
      super.visit(lam);
    }

    @Override
    protected void visit(Core.IdPat idPat) {
      names.add(idPat.name);
    }

    @Override
    protected void visit(Core.Closure closure) {
      names.addAll(closure.env.keySet());
      super.visit(closure);
    }
  }
}

// End NameGenerator.java
