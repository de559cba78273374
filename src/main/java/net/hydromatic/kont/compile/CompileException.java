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

import net.hydromatic.kont.ast.AstNode;
import net.hydromatic.kont.ast.Op;
import net.hydromatic.kont.ast.Pos;

/**
 * An internal error occurred during compilation.
 *
 * <p>Thrown when a term breaks an invariant that an earlier pass (or the
 * caller) should have established; for example, a closure in a source
 * program, or a built-in that has already been given some of its operands.
 * It indicates a bug, not a problem with the user's program, and the
 * compilation is abandoned.
 */
public class CompileException extends RuntimeException {
  private final Pos pos;
  private final Op op;

  public CompileException(String message, Pos pos, Op op) {
    super(message);
    this.pos = pos;
    this.op = op;
  }

  /** Creates an exception describing the node that breaks an invariant. */
  public static CompileException of(String message, AstNode node) {
    return new CompileException(message + ": " + node, node.pos, node.op);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  /** Returns the position of the offending node. */
  public Pos pos() {
    return pos;
  }

  /** Returns the kind of the offending node. */
  public Op op() {
    return op;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End CompileException.java
