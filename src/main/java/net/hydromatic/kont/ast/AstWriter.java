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

import java.util.List;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node, with given left and right precedence. */
  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a prefix operator applied to an argument, e.g. "#1 t". */
  public AstWriter prefix(int left, String prefix, AstNode a, int right) {
    final Op op = Op.APPLY;
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, prefix, a, 0).append(")");
    }
    append(prefix).append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /**
   * Appends a name followed by its operands, as if it were a function applied
   * to each operand in turn.
   */
  public AstWriter applied(
      int left, String name, List<? extends AstNode> args, int right) {
    if (args.isEmpty()) {
      return append(name);
    }
    final Op op = Op.APPLY;
    if (left > op.left || op.right < right) {
      return append("(").applied(0, name, args, 0).append(")");
    }
    append(name);
    for (int i = 0; i < args.size(); i++) {
      append(op.padded);
      args.get(i).unparse(this, op.right, i == args.size() - 1 ? right : 0);
    }
    return this;
  }

  /**
   * Appends a list of nodes between brackets, e.g. "[a, b]" or "(a, b)".
   */
  public AstWriter list(String open, List<? extends AstNode> nodes,
      String close) {
    append(open);
    for (int i = 0; i < nodes.size(); i++) {
      append(i == 0 ? "" : ", ").append(nodes.get(i), 0, 0);
    }
    return append(close);
  }

  /** Appends a literal value. */
  public AstWriter appendLiteral(Object value) {
    if (value instanceof String) {
      return append("\"")
          .append(((String) value).replace("\"", "\\\""))
          .append("\"");
    }
    if (value instanceof Character) {
      return append("#\"").append(value.toString()).append("\"");
    }
    return append(String.valueOf(value));
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
