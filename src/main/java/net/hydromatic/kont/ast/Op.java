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
package net.hydromatic.kont.ast;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // terms
  VAR(true),
  FN(" => "),
  APPLY(" ", 8),
  IF,
  CASE,
  MATCH(" => "),
  RECORD(true),
  TUPLE(true),
  LIST(true),
  RECORD_PROJ(" ", 8),
  TUPLE_PROJ(" ", 8),
  CONST(true),
  FIX(true),

  // opaque built-in forms
  CONCAT(true),
  INFER(true),
  LOG_PDF(true),
  UTEST(true),

  // probabilistic primitives, already in CPS shape
  SAMPLE(true),
  WEIGHT(true),
  D_WEIGHT(true),

  /** Function value closed over its environment; occurs only during
   * evaluation. */
  CLOSURE(true),

  // patterns
  ID_PAT(true),
  WILDCARD_PAT(true),
  LITERAL_PAT(true),
  TUPLE_PAT(true),
  RECORD_PAT(true),
  LIST_PAT(true),
  CONS_PAT(" :: ", 5, false),

  // miscellaneous
  BAR(" | ");

  /** Padded name, e.g. " :: ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded) {
    this(padded, 0, 0);
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
