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

import static net.hydromatic.kont.ast.CoreBuilder.core;
import static net.hydromatic.kont.compile.CpsChecker.tailFormViolations;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.kont.ast.Core;
import net.hydromatic.kont.eval.Evaluator;
import net.hydromatic.kont.eval.Unit;
import org.junit.jupiter.api.Test;

/**
 * Tests that a program converted to CPS computes the same value as the
 * original program.
 */
public class CpsEvalTest {
  private static final Core.Const ADD = core.constant(BuiltIn.ADD);
  private static final Core.Const SUB = core.constant(BuiltIn.SUB);
  private static final Core.Const MUL = core.constant(BuiltIn.MUL);
  private static final Core.Const LE = core.constant(BuiltIn.LE);
  private static final Core.Const LT = core.constant(BuiltIn.LT);
  private static final Core.Const EQ = core.constant(BuiltIn.EQ);
  private static final Core.Const CONS = core.constant(BuiltIn.CONS);
  private static final Core.Const NORMAL = core.constant(BuiltIn.NORMAL);

  private static Core.Const i(int i) {
    return core.intLiteral(i);
  }

  private static Core.Const r(double d) {
    return core.realLiteral(d);
  }

  private static Core.Var v(String name) {
    return core.var(name);
  }

  /** Evaluates a program before and after conversion, and checks that both
   * give the expected value. */
  private static void check(Core.Term term, Object expected) {
    assertThat(new Evaluator().eval(term), is(expected));
    assertThat(evalCps(term), is(expected));
  }

  private static Object evalCps(Core.Term term) {
    return evalCps(term, new Evaluator());
  }

  private static Object evalCps(Core.Term term, Evaluator evaluator) {
    final Core.Term converted = Cps.transform(term);
    assertThat(tailFormViolations(converted), empty());
    return evaluator.eval(converted);
  }

  @Test
  void testArithmetic() {
    check(core.apply(ADD, i(1), i(2)), 3);
    check(core.apply(core.fn("x", core.apply(MUL, v("x"), v("x"))), i(7)), 49);
    check(
        core.apply(SUB, core.apply(MUL, i(3), i(4)),
            core.apply(ADD, i(1), i(1))),
        10);
    check(core.apply(core.constant(BuiltIn.NEG), r(2.5)), -2.5);
  }

  @Test
  void testIf() {
    check(
        core.ifThenElse(core.apply(LT, i(1), i(2)), core.stringLiteral("yes"),
            core.stringLiteral("no")),
        "yes");
    // if eq (add 1 1) 2 then (if lt 3 2 then 0 else mul 3 3) else 5
    check(
        core.ifThenElse(core.apply(EQ, core.apply(ADD, i(1), i(1)), i(2)),
            core.ifThenElse(core.apply(LT, i(3), i(2)), i(0),
                core.apply(MUL, i(3), i(3))),
            i(5)),
        9);
  }

  @Test
  void testAggregates() {
    final Core.Term record =
        core.record(
            ImmutableMap.of("a", core.apply(ADD, i(1), i(2)),
                "b",
                core.tuple(core.apply(MUL, i(2), i(3)),
                    core.list(core.apply(core.constant(BuiltIn.NEG), i(4))))));
    check(record,
        ImmutableMap.of("a", 3, "b",
            ImmutableList.of(6, ImmutableList.of(-4))));
    check(core.recordProj(record, "a"), 3);
    check(core.tupleProj(core.tuple(i(1), core.apply(ADD, i(2), i(3))), 1), 5);
    check(core.tuple(), ImmutableList.of());
  }

  @Test
  void testCase() {
    // case add 1 1 of 1 => "one" | 2 => "two" | _ => "many"
    check(
        core.caseOf(core.apply(ADD, i(1), i(1)),
            ImmutableList.of(
                core.match(core.literalPat(1), core.stringLiteral("one")),
                core.match(core.literalPat(2), core.stringLiteral("two")),
                core.match(core.wildcardPat(), core.stringLiteral("many")))),
        "two");
    // case (1, add 1 1) of (a, b) => sub b a
    check(
        core.caseOf(core.tuple(i(1), core.apply(ADD, i(1), i(1))),
            ImmutableList.of(
                core.match(core.tuplePat(core.idPat("a"), core.idPat("b")),
                    core.apply(SUB, v("b"), v("a"))))),
        1);
    // case {a = 1, b = 2} of {a = x, b = y} => add x y
    check(
        core.caseOf(core.record(ImmutableMap.of("a", i(1), "b", i(2))),
            ImmutableList.of(
                core.match(
                    core.recordPat(
                        ImmutableMap.of("a", core.idPat("x"),
                            "b", core.idPat("y"))),
                    core.apply(ADD, v("x"), v("y"))))),
        3);
  }

  /** Returns "fix (fn fact => fn n => if le n 0 then 1
   * else mul n (fact (sub n 1)))". */
  private static Core.Term factorial() {
    return core.apply(core.fix(),
        core.fn("fact",
            core.fn("n",
                core.ifThenElse(core.apply(LE, v("n"), i(0)),
                    i(1),
                    core.apply(MUL, v("n"),
                        core.apply(v("fact"),
                            core.apply(SUB, v("n"), i(1))))))));
  }

  /** Returns "fix (fn map => fn f => fn xs => case xs of [] => []
   * | h :: t => cons (f h) (map f t))". */
  private static Core.Term map() {
    return core.apply(core.fix(),
        core.fn("map",
            core.fn("f",
                core.fn("xs",
                    core.caseOf(v("xs"),
                        ImmutableList.of(
                            core.match(core.listPat(), core.list()),
                            core.match(
                                core.consPat(core.idPat("h"),
                                    core.idPat("t")),
                                core.apply(CONS,
                                    core.apply(v("f"), v("h")),
                                    core.apply(v("map"), v("f"),
                                        v("t"))))))))));
  }

  @Test
  void testRecursion() {
    check(core.apply(factorial(), i(5)), 120);
    check(
        core.apply(map(), core.fn("x", core.apply(MUL, v("x"), i(2))),
            core.list(i(1), i(2), i(3))),
        ImmutableList.of(2, 4, 6));
  }

  @Test
  void testHigherOrder() {
    // let twice = fn f => fn x => f (f x) in twice (fn y => add y 10) 1
    final Core.Term twice =
        core.fn("f",
            core.fn("x", core.apply(v("f"), core.apply(v("f"), v("x")))));
    check(
        core.let("twice", twice,
            core.apply(v("twice"), core.fn("y", core.apply(ADD, v("y"), i(10))),
                i(1))),
        21);
  }

  /** Tests that a converted loop runs in constant stack. */
  @Test
  void testLongLoop() {
    // fix (fn loop => fn n => if le n 0 then 0 else loop (sub n 1)) 20000
    final Core.Term loop =
        core.apply(core.fix(),
            core.fn("loop",
                core.fn("n",
                    core.ifThenElse(core.apply(LE, v("n"), i(0)),
                        core.stringLiteral("done"),
                        core.apply(v("loop"),
                            core.apply(SUB, v("n"), i(1)))))));
    assertThat(evalCps(core.apply(loop, i(20_000))), is("done"));
  }

  @Test
  void testIntrinsics() {
    check(
        core.apply(core.concat(), core.list(i(1), i(2)),
            core.list(core.apply(ADD, i(1), i(2)))),
        ImmutableList.of(1, 2, 3));

    final double logPdf = -0.5 * Math.log(2 * Math.PI);
    final Core.Term term =
        core.apply(core.logPdf(), r(0.0), core.apply(NORMAL, r(0.0), r(1.0)));
    assertThat((Double) new Evaluator().eval(term), closeTo(logPdf, 1e-12));
    assertThat((Double) evalCps(term), closeTo(logPdf, 1e-12));
  }

  @Test
  void testUtest() {
    final Core.Term pass =
        core.apply(core.utest(), core.apply(ADD, i(1), i(2)), i(3));
    check(pass, Unit.INSTANCE);

    final Core.Term fail =
        core.apply(core.utest(), core.apply(ADD, i(1), i(2)), i(4));
    final Evaluator direct = new Evaluator();
    direct.eval(fail);
    assertThat(direct.failures(), hasSize(1));
    final Evaluator converted = new Evaluator();
    evalCps(fail, converted);
    assertThat(converted.failures(), is(direct.failures()));
  }

  /** Tests "sample", which is only meaningful after conversion. */
  @Test
  void testSample() {
    // add (sample (normal 2.0 1.0)) 1.0
    final Core.Term term =
        core.apply(ADD,
            core.apply(core.sample(), core.apply(NORMAL, r(2.0), r(1.0))),
            r(1.0));
    assertThat(evalCps(term), is(3.0));
    assertThat(evalCps(term, new Evaluator(d -> 10.0, 1_000_000)), is(11.0));

    // if sample (bernoulli 0.7) then 1 else 0
    final Core.Term coin =
        core.ifThenElse(
            core.apply(core.sample(),
                core.apply(core.constant(BuiltIn.BERNOULLI), r(0.7))),
            i(1), i(0));
    assertThat(evalCps(coin), is(1));
  }

  @Test
  void testWeight() {
    // let u = weight 1.5 in let w = dweight 0.5 in 7
    final Core.Term term =
        core.let("u", core.apply(core.weight(), r(1.5)),
            core.let("w", core.apply(core.dWeight(), r(0.5)), i(7)));
    final Evaluator evaluator = new Evaluator();
    assertThat(evalCps(term, evaluator), is(7));
    assertThat(evaluator.logWeight(), is(2.0));
  }
}

// End CpsEvalTest.java
