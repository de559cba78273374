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

/**
 * Built-in operations.
 *
 * <p>Each operation has a fixed arity: the number of arguments it consumes
 * before it produces a result. Built-ins occur in programs as the value of a
 * {@link net.hydromatic.kont.ast.Core.Const}; they are opaque to the compiler,
 * which only needs their arity.
 */
public enum BuiltIn {
  /** Addition, "add: int -> int -> int" (also for reals). */
  ADD("add", 2),

  /** Subtraction, "sub: int -> int -> int" (also for reals). */
  SUB("sub", 2),

  /** Multiplication, "mul: int -> int -> int" (also for reals). */
  MUL("mul", 2),

  /** Division, "div: int -> int -> int" (also for reals). */
  DIV("div", 2),

  /** Negation, "neg: int -> int" (also for reals). */
  NEG("neg", 1),

  /** Equality, "eq: 'a -> 'a -> bool". */
  EQ("eq", 2),

  /** Less than, "lt: 'a -> 'a -> bool". */
  LT("lt", 2),

  /** Less than or equal, "le: 'a -> 'a -> bool". */
  LE("le", 2),

  /** Logical negation, "not: bool -> bool". */
  NOT("not", 1),

  /** Logical conjunction, "and: bool -> bool -> bool". */
  AND("and", 2),

  /** Logical disjunction, "or: bool -> bool -> bool". */
  OR("or", 2),

  /** Prepends an element to a list, "cons: 'a -> 'a list -> 'a list". */
  CONS("cons", 2),

  /** Exponential function, "exp: real -> real". */
  EXP("exp", 1),

  /** Natural logarithm, "log: real -> real". */
  LOG("log", 1),

  /**
   * Normal distribution with given mean and standard deviation,
   * "normal: real -> real -> real dist".
   */
  NORMAL("normal", 2),

  /**
   * Uniform distribution over an interval, "uniform: real -> real -> real
   * dist".
   */
  UNIFORM("uniform", 2),

  /** Bernoulli distribution, "bernoulli: real -> bool dist". */
  BERNOULLI("bernoulli", 1);

  /** Name as it appears in programs, e.g. "add". */
  public final String mlName;

  /** Number of arguments. */
  public final int arity;

  BuiltIn(String mlName, int arity) {
    this.mlName = mlName;
    this.arity = arity;
  }

  @Override
  public String toString() {
    return mlName;
  }
}

// End BuiltIn.java
