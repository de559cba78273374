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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.kont.compile.BuiltIn;
import net.hydromatic.kont.eval.Unit;

/** Builds parse tree nodes. */
public enum CoreBuilder {
  /**
   * The singleton instance of the CORE builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  core;

  private final Core.WildcardPat wildcardPat = new Core.WildcardPat();

  private final Core.Fix fix = new Core.Fix(Pos.ZERO);

  private final Core.Const trueLiteral = new Core.Const(Pos.ZERO, true, 0);

  private final Core.Const falseLiteral = new Core.Const(Pos.ZERO, false, 0);

  private final Core.Const unitLiteral =
      new Core.Const(Pos.ZERO, Unit.INSTANCE, 0);

  // terms

  /** Creates a reference to a variable. */
  public Core.Var var(String name) {
    return var(Pos.ZERO, name);
  }

  public Core.Var var(Pos pos, String name) {
    return new Core.Var(pos, name);
  }

  /** Creates a function, "fn param => body". */
  public Core.Lam fn(String param, Core.Term body) {
    return fn(Pos.ZERO, param, body);
  }

  public Core.Lam fn(Pos pos, String param, Core.Term body) {
    return new Core.Lam(pos, param, body);
  }

  /** Creates an application of a function to an argument. */
  public Core.App apply(Core.Term fn, Core.Term arg) {
    return apply(Pos.ZERO, fn, arg);
  }

  public Core.App apply(Pos pos, Core.Term fn, Core.Term arg) {
    return new Core.App(pos, fn, arg);
  }

  /**
   * Creates the application of a curried function to several arguments; for
   * example, {@code apply(f, a, b)} yields "f a b", that is, "(f a) b".
   */
  public Core.App apply(Core.Term fn, Core.Term arg0, Core.Term... args) {
    Core.App app = apply(fn, arg0);
    for (Core.Term arg : args) {
      app = apply(app, arg);
    }
    return app;
  }

  /**
   * Creates a binding of a name to a term within another term, "let name =
   * exp in body", represented as "(fn name => body) exp".
   */
  public Core.App let(String name, Core.Term exp, Core.Term body) {
    return apply(fn(name, body), exp);
  }

  /** Creates an "if ... then ... else ..." term. */
  public Core.If ifThenElse(Core.Term condition, Core.Term ifTrue,
      Core.Term ifFalse) {
    return ifThenElse(Pos.ZERO, condition, ifTrue, ifFalse);
  }

  public Core.If ifThenElse(Pos pos, Core.Term condition, Core.Term ifTrue,
      Core.Term ifFalse) {
    return new Core.If(pos, condition, ifTrue, ifFalse);
  }

  /** Creates a "case" term. */
  public Core.Case caseOf(Core.Term exp, List<Core.Match> matchList) {
    return caseOf(Pos.ZERO, exp, matchList);
  }

  public Core.Case caseOf(Pos pos, Core.Term exp,
      List<Core.Match> matchList) {
    return new Core.Case(pos, exp, ImmutableList.copyOf(matchList));
  }

  /** Creates an arm of a "case" term. */
  public Core.Match match(Core.Pat pat, Core.Term exp) {
    return match(Pos.ZERO, pat, exp);
  }

  public Core.Match match(Pos pos, Core.Pat pat, Core.Term exp) {
    return new Core.Match(pos, pat, exp);
  }

  /** Creates a record; fields keep the order of the map. */
  public Core.Record record(Map<String, ? extends Core.Term> fields) {
    return record(Pos.ZERO, fields);
  }

  public Core.Record record(Pos pos, Map<String, ? extends Core.Term> fields) {
    return new Core.Record(pos, ImmutableMap.copyOf(fields));
  }

  /** Creates a tuple. */
  public Core.Tuple tuple(Core.Term... args) {
    return tuple(Pos.ZERO, ImmutableList.copyOf(args));
  }

  public Core.Tuple tuple(Pos pos, List<? extends Core.Term> args) {
    return new Core.Tuple(pos, ImmutableList.copyOf(args));
  }

  /** Creates a list. */
  public Core.ListExp list(Core.Term... args) {
    return list(Pos.ZERO, ImmutableList.copyOf(args));
  }

  public Core.ListExp list(Pos pos, List<? extends Core.Term> args) {
    return new Core.ListExp(pos, ImmutableList.copyOf(args));
  }

  /** Creates a projection of a field from a record. */
  public Core.RecordProj recordProj(Core.Term exp, String label) {
    return recordProj(Pos.ZERO, exp, label);
  }

  public Core.RecordProj recordProj(Pos pos, Core.Term exp, String label) {
    return new Core.RecordProj(pos, exp, label);
  }

  /** Creates a projection of an element from a tuple. */
  public Core.TupleProj tupleProj(Core.Term exp, int index) {
    return tupleProj(Pos.ZERO, exp, index);
  }

  public Core.TupleProj tupleProj(Pos pos, Core.Term exp, int index) {
    return new Core.TupleProj(pos, exp, index);
  }

  /** Creates a constant with a given arity. */
  public Core.Const constant(Object value, int arity) {
    return new Core.Const(Pos.ZERO, value, arity);
  }

  /** Creates a constant whose value is a built-in operation. */
  public Core.Const constant(BuiltIn builtIn) {
    return constant(builtIn, builtIn.arity);
  }

  /** Creates a {@code boolean} literal. */
  public Core.Const boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  /** Creates an {@code int} literal. */
  public Core.Const intLiteral(int i) {
    return constant(i, 0);
  }

  /** Creates a {@code real} literal. */
  public Core.Const realLiteral(double d) {
    return constant(d, 0);
  }

  /** Creates a {@code char} literal. */
  public Core.Const charLiteral(char c) {
    return constant(c, 0);
  }

  /** Creates a string literal. */
  public Core.Const stringLiteral(String s) {
    return constant(s, 0);
  }

  /** Creates a unit literal. */
  public Core.Const unitLiteral() {
    return unitLiteral;
  }

  /** Returns the fixpoint combinator. */
  public Core.Fix fix() {
    return fix;
  }

  /** Creates a canonical "concat". */
  public Core.Concat concat() {
    return concat(Pos.ZERO, ImmutableList.of());
  }

  public Core.Concat concat(Pos pos, List<? extends Core.Term> args) {
    return new Core.Concat(pos, ImmutableList.copyOf(args));
  }

  /** Creates a canonical "infer". */
  public Core.Infer infer() {
    return infer(Pos.ZERO, ImmutableList.of());
  }

  public Core.Infer infer(Pos pos, List<? extends Core.Term> args) {
    return new Core.Infer(pos, ImmutableList.copyOf(args));
  }

  /** Creates a canonical "logpdf". */
  public Core.LogPdf logPdf() {
    return logPdf(Pos.ZERO, ImmutableList.of());
  }

  public Core.LogPdf logPdf(Pos pos, List<? extends Core.Term> args) {
    return new Core.LogPdf(pos, ImmutableList.copyOf(args));
  }

  /** Creates a canonical "utest". */
  public Core.Utest utest() {
    return utest(Pos.ZERO, ImmutableList.of());
  }

  public Core.Utest utest(Pos pos, List<? extends Core.Term> args) {
    return new Core.Utest(pos, ImmutableList.copyOf(args));
  }

  /** Creates a canonical "sample". */
  public Core.Sample sample() {
    return sample(Pos.ZERO, ImmutableList.of());
  }

  public Core.Sample sample(Pos pos, List<? extends Core.Term> args) {
    return new Core.Sample(pos, ImmutableList.copyOf(args));
  }

  /** Creates a canonical "weight". */
  public Core.Weight weight() {
    return weight(Pos.ZERO, ImmutableList.of());
  }

  public Core.Weight weight(Pos pos, List<? extends Core.Term> args) {
    return new Core.Weight(pos, ImmutableList.copyOf(args));
  }

  /** Creates a canonical "dweight". */
  public Core.DWeight dWeight() {
    return dWeight(Pos.ZERO, ImmutableList.of());
  }

  public Core.DWeight dWeight(Pos pos, List<? extends Core.Term> args) {
    return new Core.DWeight(pos, ImmutableList.copyOf(args));
  }

  /** Creates a closure. */
  public Core.Closure closure(Core.Lam fn, Map<String, ?> env) {
    return new Core.Closure(fn, ImmutableMap.copyOf(env));
  }

  // patterns

  /** Creates a named pattern. */
  public Core.IdPat idPat(String name) {
    return new Core.IdPat(name);
  }

  /** Returns the wildcard pattern. */
  public Core.WildcardPat wildcardPat() {
    return wildcardPat;
  }

  /** Creates a literal pattern. */
  public Core.LiteralPat literalPat(Object value) {
    return new Core.LiteralPat(value);
  }

  /** Creates a tuple pattern. */
  public Core.TuplePat tuplePat(Core.Pat... args) {
    return new Core.TuplePat(ImmutableList.copyOf(args));
  }

  /** Creates a record pattern. */
  public Core.RecordPat recordPat(Map<String, ? extends Core.Pat> args) {
    return new Core.RecordPat(ImmutableMap.copyOf(args));
  }

  /** Creates a list pattern. */
  public Core.ListPat listPat(Core.Pat... args) {
    return new Core.ListPat(ImmutableList.copyOf(args));
  }

  /** Creates a pattern that matches a non-empty list. */
  public Core.ConsPat consPat(Core.Pat head, Core.Pat tail) {
    return new Core.ConsPat(head, tail);
  }
}

// End CoreBuilder.java
