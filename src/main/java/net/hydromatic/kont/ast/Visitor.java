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

/** Visits terms and patterns. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends AstNode> void accept(E e) {
    e.accept(this);
  }

  // terms

  protected void visit(Core.Var var) {}

  protected void visit(Core.Lam lam) {
    lam.body.accept(this);
  }

  protected void visit(Core.App app) {
    app.fn.accept(this);
    app.arg.accept(this);
  }

  protected void visit(Core.If anIf) {
    anIf.condition.accept(this);
    anIf.ifTrue.accept(this);
    anIf.ifFalse.accept(this);
  }

  protected void visit(Core.Case caseOf) {
    caseOf.exp.accept(this);
    caseOf.matchList.forEach(this::accept);
  }

  protected void visit(Core.Match match) {
    match.pat.accept(this);
    match.exp.accept(this);
  }

  protected void visit(Core.Record record) {
    record.fields.values().forEach(this::accept);
  }

  protected void visit(Core.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }

  protected void visit(Core.ListExp list) {
    list.args.forEach(this::accept);
  }

  protected void visit(Core.RecordProj recordProj) {
    recordProj.exp.accept(this);
  }

  protected void visit(Core.TupleProj tupleProj) {
    tupleProj.exp.accept(this);
  }

  protected void visit(Core.Const constant) {}

  protected void visit(Core.Fix fix) {}

  // intrinsics

  protected void visit(Core.Concat concat) {
    concat.args.forEach(this::accept);
  }

  protected void visit(Core.Infer infer) {
    infer.args.forEach(this::accept);
  }

  protected void visit(Core.LogPdf logPdf) {
    logPdf.args.forEach(this::accept);
  }

  protected void visit(Core.Utest utest) {
    utest.args.forEach(this::accept);
  }

  protected void visit(Core.Sample sample) {
    sample.args.forEach(this::accept);
  }

  protected void visit(Core.Weight weight) {
    weight.args.forEach(this::accept);
  }

  protected void visit(Core.DWeight dWeight) {
    dWeight.args.forEach(this::accept);
  }

  protected void visit(Core.Closure closure) {
    closure.fn.accept(this);
  }

  // patterns

  protected void visit(Core.IdPat idPat) {}

  protected void visit(Core.WildcardPat wildcardPat) {}

  protected void visit(Core.LiteralPat literalPat) {}

  protected void visit(Core.TuplePat tuplePat) {
    tuplePat.args.forEach(this::accept);
  }

  protected void visit(Core.RecordPat recordPat) {
    recordPat.args.values().forEach(this::accept);
  }

  protected void visit(Core.ListPat listPat) {
    listPat.args.forEach(this::accept);
  }

  protected void visit(Core.ConsPat consPat) {
    consPat.head.accept(this);
    consPat.tail.accept(this);
  }
}

// End Visitor.java
