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
import static net.hydromatic.kont.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.kont.ast.Core;
import net.hydromatic.kont.ast.Shuttle;

/**
 * Shuttle that lifts complex terms out of positions where their value is
 * needed by an enclosing term.
 *
 * <p>The condition of an "if", the scrutinee of a "case", the argument of a
 * projection, and the elements of a record, tuple or list are evaluated
 * before their enclosing term can do anything. If such a sub-term is complex,
 * it is bound to a new variable, and the enclosing term refers to the
 * variable instead. For example,
 *
 * <blockquote><pre>{a = f x, b = 1, c = g y}</pre></blockquote>
 *
 * <p>becomes
 *
 * <blockquote><pre>
 * (fn t$0 => (fn t$1 => {a = t$0, b = 1, c = t$1}) (g y)) (f x)</pre>
 * </blockquote>
 *
 * <p>which binds "t$0" before "t$1", preserving the order of evaluation.
 *
 * <p>Branches of "if" and "case", bodies of functions, and both sides of an
 * application are lifted in place. Afterwards, the only terms that may be
 * complex are applications, "if" and "case"; every other term whose
 * sub-terms are atomic is atomic.
 */
public class Lifter extends Shuttle {
  private final NameGenerator nameGenerator;

  private Lifter(NameGenerator nameGenerator) {
    this.nameGenerator = nameGenerator;
  }

  /** Lifts complex terms in a term. */
  public static Core.Term lift(NameGenerator nameGenerator, Core.Term term) {
    return term.accept(new Lifter(nameGenerator));
  }

  /**
   * Lifts a term that is in a position that needs its value. If the result is
   * complex, binds it to a new variable, adds the binding to
   * {@code bindings}, and returns a reference to the variable.
   */
  private Core.Term extract(Core.Term term, Map<String, Core.Term> bindings) {
    final Core.Term term2 = term.accept(this);
    if (term2.isAtomic()) {
      return term2;
    }
    final Core.Var var = nameGenerator.var("t");
    bindings.put(var.name, term2);
    return var;
  }

  /**
   * Wraps a term in bindings. The first binding is outermost, and is therefore
   * evaluated first.
   */
  private static Core.Term wrap(Core.Term term,
      Map<String, Core.Term> bindings) {
    Core.Term t = term;
    for (Map.Entry<String, Core.Term> binding
        : ImmutableList.copyOf(bindings.entrySet()).reverse()) {
      t = core.let(binding.getKey(), binding.getValue(), t);
    }
    return t;
  }

  /** Throws if a built-in form has been given operands. */
  private static Core.Term checkCanonical(Core.Intrinsic intrinsic) {
    if (!intrinsic.isCanonical()) {
      throw CompileException.of(
          "Operands of '" + intrinsic.name()
              + "' should not exist before evaluation",
          intrinsic);
    }
    return intrinsic;
  }

  @Override
  protected Core.Term visit(Core.If anIf) {
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final Core.Term condition = extract(anIf.condition, bindings);
    return wrap(
        anIf.copy(condition,
            anIf.ifTrue.accept(this),
            anIf.ifFalse.accept(this)),
        bindings);
  }

  @Override
  protected Core.Term visit(Core.Case caseOf) {
    final List<Core.Match> matchList = visitList(caseOf.matchList);
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final Core.Term exp = extract(caseOf.exp, bindings);
    return wrap(caseOf.copy(exp, matchList), bindings);
  }

  @Override
  protected Core.Term visit(Core.Record record) {
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final ImmutableMap.Builder<String, Core.Term> fields =
        ImmutableMap.builder();
    record.fields.forEach((label, term) ->
        fields.put(label, extract(term, bindings)));
    return wrap(record.copy(fields.build()), bindings);
  }

  @Override
  protected Core.Term visit(Core.Tuple tuple) {
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final List<Core.Term> args =
        transformEager(tuple.args, arg -> extract(arg, bindings));
    return wrap(tuple.copy(args), bindings);
  }

  @Override
  protected Core.Term visit(Core.ListExp list) {
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final List<Core.Term> args =
        transformEager(list.args, arg -> extract(arg, bindings));
    return wrap(list.copy(args), bindings);
  }

  @Override
  protected Core.Term visit(Core.RecordProj recordProj) {
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final Core.Term exp = extract(recordProj.exp, bindings);
    return wrap(recordProj.copy(exp), bindings);
  }

  @Override
  protected Core.Term visit(Core.TupleProj tupleProj) {
    final Map<String, Core.Term> bindings = new LinkedHashMap<>();
    final Core.Term exp = extract(tupleProj.exp, bindings);
    return wrap(tupleProj.copy(exp), bindings);
  }

  @Override
  protected Core.Term visit(Core.Concat concat) {
    return checkCanonical(concat);
  }

  @Override
  protected Core.Term visit(Core.Infer infer) {
    return checkCanonical(infer);
  }

  @Override
  protected Core.Term visit(Core.LogPdf logPdf) {
    return checkCanonical(logPdf);
  }

  @Override
  protected Core.Term visit(Core.Utest utest) {
    return checkCanonical(utest);
  }

  @Override
  protected Core.Term visit(Core.Sample sample) {
    return checkCanonical(sample);
  }

  @Override
  protected Core.Term visit(Core.Weight weight) {
    return checkCanonical(weight);
  }

  @Override
  protected Core.Term visit(Core.DWeight dWeight) {
    return checkCanonical(dWeight);
  }

  @Override
  protected Core.Term visit(Core.Closure closure) {
    throw CompileException.of("Closure should not exist before evaluation",
        closure);
  }
}

// End Lifter.java
