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

import static net.hydromatic.kont.util.Static.transformEager;
import static net.hydromatic.kont.util.Static.transformValuesEager;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits and transforms terms.
 *
 * <p>Each {@code visit} method returns a copy of its term whose sub-terms have
 * been transformed, or the term itself if nothing changed. Patterns are not
 * visited.
 */
public class Shuttle {
  /** Creates a Shuttle. */
  public Shuttle() {}

  protected <E extends AstNode> ImmutableList<E> visitList(List<E> nodes) {
    //noinspection unchecked
    return transformEager(nodes, node -> (E) node.accept(this));
  }

  protected Core.Term visit(Core.Var var) {
    return var; // leaf
  }

  protected Core.Term visit(Core.Lam lam) {
    return lam.copy(lam.param, lam.body.accept(this));
  }

  protected Core.Term visit(Core.App app) {
    return app.copy(app.fn.accept(this), app.arg.accept(this));
  }

  protected Core.Term visit(Core.If anIf) {
    return anIf.copy(
        anIf.condition.accept(this),
        anIf.ifTrue.accept(this),
        anIf.ifFalse.accept(this));
  }

  protected Core.Term visit(Core.Case caseOf) {
    return caseOf.copy(caseOf.exp.accept(this), visitList(caseOf.matchList));
  }

  protected Core.Match visit(Core.Match match) {
    return match.copy(match.pat, match.exp.accept(this));
  }

  protected Core.Term visit(Core.Record record) {
    return record.copy(
        transformValuesEager(record.fields, t -> t.accept(this)));
  }

  protected Core.Term visit(Core.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }

  protected Core.Term visit(Core.ListExp list) {
    return list.copy(visitList(list.args));
  }

  protected Core.Term visit(Core.RecordProj recordProj) {
    return recordProj.copy(recordProj.exp.accept(this));
  }

  protected Core.Term visit(Core.TupleProj tupleProj) {
    return tupleProj.copy(tupleProj.exp.accept(this));
  }

  protected Core.Term visit(Core.Const constant) {
    return constant; // leaf
  }

  protected Core.Term visit(Core.Fix fix) {
    return fix; // leaf
  }

  // intrinsics

  protected Core.Term visit(Core.Concat concat) {
    return concat.copy(visitList(concat.args));
  }

  protected Core.Term visit(Core.Infer infer) {
    return infer.copy(visitList(infer.args));
  }

  protected Core.Term visit(Core.LogPdf logPdf) {
    return logPdf.copy(visitList(logPdf.args));
  }

  protected Core.Term visit(Core.Utest utest) {
    return utest.copy(visitList(utest.args));
  }

  protected Core.Term visit(Core.Sample sample) {
    return sample.copy(visitList(sample.args));
  }

  protected Core.Term visit(Core.Weight weight) {
    return weight.copy(visitList(weight.args));
  }

  protected Core.Term visit(Core.DWeight dWeight) {
    return dWeight.copy(visitList(dWeight.args));
  }

  protected Core.Term visit(Core.Closure closure) {
    return closure; // leaf
  }
}

// End Shuttle.java
