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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.kont.ast.Core;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on a lifted term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnLift(Tracer tracer, Consumer<Core.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onLift(Core.Term term) {
        consumer.accept(term);
        super.onLift(term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on a converted term, then
   * calls the underlying tracer.
   */
  public static Tracer withOnCps(Tracer tracer, Consumer<Core.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCps(Core.Term term) {
        consumer.accept(term);
        super.onCps(term);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each converted
   * environment entry, then calls the underlying tracer.
   */
  public static Tracer withOnBuiltIn(
      Tracer tracer, BiConsumer<String, Core.Term> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBuiltIn(String name, Core.Term term) {
        consumer.accept(name, term);
        super.onBuiltIn(name, term);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onLift(Core.Term term) {}

    @Override
    public void onCps(Core.Term term) {}

    @Override
    public void onBuiltIn(String name, Core.Term term) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    private final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onLift(Core.Term term) {
      tracer.onLift(term);
    }

    @Override
    public void onCps(Core.Term term) {
      tracer.onCps(term);
    }

    @Override
    public void onBuiltIn(String name, Core.Term term) {
      tracer.onBuiltIn(name, term);
    }
  }
}

// End Tracers.java
