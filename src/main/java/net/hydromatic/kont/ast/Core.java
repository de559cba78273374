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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.kont.ast.CoreBuilder.core;
import static net.hydromatic.kont.util.Static.allMatch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.kont.compile.BuiltIn;

/**
 * Core terms.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. There is one sub-class of {@link Term} per kind of term; each of them
 * is immutable, and transformations build new trees rather than modifying
 * existing ones.
 */
public class Core {
  private Core() {}

  /** Abstract base class of Core nodes. */
  abstract static class BaseNode extends AstNode {
    BaseNode(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public AstNode accept(Shuttle shuttle) {
      throw new UnsupportedOperationException(
          getClass() + " cannot accept " + shuttle.getClass());
    }

    @Override
    public void accept(Visitor visitor) {
      throw new UnsupportedOperationException(
          getClass() + " cannot accept " + visitor.getClass());
    }
  }

  /**
   * Base class for a pattern.
   *
   * <p>For example, "x :: rest" in "case l of [] => 0 | x :: rest => x" is a
   * {@link ConsPat}.
   *
   * <p>Passes that rewrite terms leave patterns as they are; a name bound by a
   * pattern is assumed to be unique in its program.
   */
  public abstract static class Pat extends BaseNode {
    Pat(Op op) {
      super(Pos.ZERO, op);
    }
  }

  /** Named pattern, the pattern analog of the {@link Var} term. */
  public static class IdPat extends Pat {
    public final String name;

    IdPat(String name) {
      super(Op.ID_PAT);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof IdPat && ((IdPat) obj).name.equals(name);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Wildcard pattern, "{@code _}". */
  public static class WildcardPat extends Pat {
    WildcardPat() {
      super(Op.WILDCARD_PAT);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("_");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Literal pattern, the pattern analog of a literal {@link Const}. */
  public static class LiteralPat extends Pat {
    public final Object value;

    LiteralPat(Object value) {
      super(Op.LITERAL_PAT);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Tuple pattern, the pattern analog of the {@link Tuple} term. */
  public static class TuplePat extends Pat {
    public final ImmutableList<Pat> args;

    TuplePat(ImmutableList<Pat> args) {
      super(Op.TUPLE_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.list("(", args, ")");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Record pattern, the pattern analog of the {@link Record} term. */
  public static class RecordPat extends Pat {
    public final ImmutableMap<String, Pat> args;

    RecordPat(ImmutableMap<String, Pat> args) {
      super(Op.RECORD_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      final int[] i = {0};
      args.forEach((label, pat) ->
          w.append(i[0]++ == 0 ? "" : ", ")
              .append(label)
              .append(" = ")
              .append(pat, 0, 0));
      return w.append("}");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** List pattern, the pattern analog of the {@link ListExp} term. */
  public static class ListPat extends Pat {
    public final ImmutableList<Pat> args;

    ListPat(ImmutableList<Pat> args) {
      super(Op.LIST_PAT);
      this.args = requireNonNull(args);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.list("[", args, "]");
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Pattern that matches a non-empty list, binding its head and tail. */
  public static class ConsPat extends Pat {
    public final Pat head;
    public final Pat tail;

    ConsPat(Pat head, Pat tail) {
      super(Op.CONS_PAT);
      this.head = requireNonNull(head);
      this.tail = requireNonNull(tail);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, head, op, tail, right);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Abstract base class of terms. */
  public abstract static class Term extends BaseNode {
    Term(Pos pos, Op op) {
      super(pos, op);
    }

    /**
     * Returns whether this term is atomic.
     *
     * <p>An atomic term produces its value without any computation that needs
     * to be sequenced by a continuation. An application is never atomic;
     * conditionals, matches, aggregates and projections are atomic if all of
     * their immediate sub-terms are atomic; everything else is a value (or is
     * treated as one) and is atomic.
     */
    public abstract boolean isAtomic();

    @Override
    public abstract Term accept(Shuttle shuttle);

    @Override
    public abstract void accept(Visitor visitor);
  }

  /** Reference to a variable. */
  public static class Var extends Term {
    public final String name;

    Var(Pos pos, String name) {
      super(pos, Op.VAR);
      this.name = requireNonNull(name, "name");
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this || obj instanceof Var && ((Var) obj).name.equals(name);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Function with a single parameter, "fn x => body". */
  public static class Lam extends Term {
    public final String param;
    public final Term body;

    Lam(Pos pos, String param, Term body) {
      super(pos, Op.FN);
      this.param = requireNonNull(param, "param");
      this.body = requireNonNull(body, "body");
      checkArgument(!param.isEmpty(), "empty param");
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("fn ").append(param).append(op.padded)
          .append(body, 0, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Lam copy(String param, Term body) {
      return param.equals(this.param) && body == this.body
          ? this
          : core.fn(pos, param, body);
    }
  }

  /** Application of a function to an argument. */
  public static class App extends Term {
    public final Term fn;
    public final Term arg;

    App(Pos pos, Term fn, Term arg) {
      super(pos, Op.APPLY);
      this.fn = requireNonNull(fn, "fn");
      this.arg = requireNonNull(arg, "arg");
    }

    /** {@inheritDoc}
     *
     * <p>Application is where computation happens, so it is never atomic. */
    @Override
    public boolean isAtomic() {
      return false;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, fn, op, arg, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public App copy(Term fn, Term arg) {
      return fn == this.fn && arg == this.arg ? this
          : core.apply(pos, fn, arg);
    }
  }

  /** "If ... then ... else ..." term. */
  public static class If extends Term {
    public final Term condition;
    public final Term ifTrue;
    public final Term ifFalse;

    If(Pos pos, Term condition, Term ifTrue, Term ifFalse) {
      super(pos, Op.IF);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override
    public boolean isAtomic() {
      return condition.isAtomic() && ifTrue.isAtomic() && ifFalse.isAtomic();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.append("if ").append(condition, 0, 0)
          .append(" then ").append(ifTrue, 0, 0)
          .append(" else ").append(ifFalse, 0, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public If copy(Term condition, Term ifTrue, Term ifFalse) {
      return condition == this.condition
              && ifTrue == this.ifTrue
              && ifFalse == this.ifFalse
          ? this
          : core.ifThenElse(pos, condition, ifTrue, ifFalse);
    }
  }

  /** One arm of a {@link Case}, "pat => exp". */
  public static class Match extends BaseNode {
    public final Pat pat;
    public final Term exp;

    Match(Pos pos, Pat pat, Term exp) {
      super(pos, Op.MATCH);
      this.pat = requireNonNull(pat);
      this.exp = requireNonNull(exp);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(pat, 0, 0).append(op.padded).append(exp, 0, right);
    }

    @Override
    public Match accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Match copy(Pat pat, Term exp) {
      return pat == this.pat && exp == this.exp ? this
          : core.match(pos, pat, exp);
    }
  }

  /**
   * "Case" term, matching a scrutinee against a list of arms.
   *
   * <p>The first arm whose pattern matches is chosen, so the order of arms is
   * significant.
   */
  public static class Case extends Term {
    public final Term exp;
    public final ImmutableList<Match> matchList;

    Case(Pos pos, Term exp, ImmutableList<Match> matchList) {
      super(pos, Op.CASE);
      this.exp = requireNonNull(exp);
      this.matchList = requireNonNull(matchList);
      checkArgument(!matchList.isEmpty(), "case with no arms");
    }

    @Override
    public boolean isAtomic() {
      return exp.isAtomic() && allMatch(matchList, m -> m.exp.isAtomic());
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (left > 0 || right > 0) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      w.append("case ").append(exp, 0, 0).append(" of ");
      for (int i = 0; i < matchList.size(); i++) {
        final boolean last = i == matchList.size() - 1;
        w.append(i == 0 ? "" : Op.BAR.padded)
            .append(matchList.get(i), 0, last ? right : 1);
      }
      return w;
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Case copy(Term exp, List<Match> matchList) {
      return exp == this.exp && matchList.equals(this.matchList)
          ? this
          : core.caseOf(pos, exp, matchList);
    }
  }

  /** Record term, "{a = x, b = y}". Fields are kept in the order given. */
  public static class Record extends Term {
    public final ImmutableMap<String, Term> fields;

    Record(Pos pos, ImmutableMap<String, Term> fields) {
      super(pos, Op.RECORD);
      this.fields = requireNonNull(fields);
    }

    @Override
    public boolean isAtomic() {
      return allMatch(fields.values(), Term::isAtomic);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("{");
      final int[] i = {0};
      fields.forEach((label, term) ->
          w.append(i[0]++ == 0 ? "" : ", ")
              .append(label)
              .append(" = ")
              .append(term, 0, 0));
      return w.append("}");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Record copy(Map<String, Term> fields) {
      return fields.equals(this.fields) ? this : core.record(pos, fields);
    }
  }

  /** Tuple term, "(x, y)". */
  public static class Tuple extends Term {
    public final ImmutableList<Term> args;

    Tuple(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    public boolean isAtomic() {
      return allMatch(args, Term::isAtomic);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.list("(", args, ")");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Tuple copy(List<Term> args) {
      return args.equals(this.args) ? this : core.tuple(pos, args);
    }
  }

  /** List term, "[x, y]". */
  public static class ListExp extends Term {
    public final ImmutableList<Term> args;

    ListExp(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.LIST);
      this.args = requireNonNull(args);
    }

    @Override
    public boolean isAtomic() {
      return allMatch(args, Term::isAtomic);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.list("[", args, "]");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public ListExp copy(List<Term> args) {
      return args.equals(this.args) ? this : core.list(pos, args);
    }
  }

  /** Projection of a field from a record, "#label r". */
  public static class RecordProj extends Term {
    public final Term exp;
    public final String label;

    RecordProj(Pos pos, Term exp, String label) {
      super(pos, Op.RECORD_PROJ);
      this.exp = requireNonNull(exp);
      this.label = requireNonNull(label);
    }

    @Override
    public boolean isAtomic() {
      return exp.isAtomic();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, "#" + label, exp, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public RecordProj copy(Term exp) {
      return exp == this.exp ? this : core.recordProj(pos, exp, label);
    }
  }

  /** Projection of an element from a tuple, "#i t". Index is 0-based. */
  public static class TupleProj extends Term {
    public final Term exp;
    public final int index;

    TupleProj(Pos pos, Term exp, int index) {
      super(pos, Op.TUPLE_PROJ);
      this.exp = requireNonNull(exp);
      this.index = index;
      checkArgument(index >= 0, "negative index");
    }

    @Override
    public boolean isAtomic() {
      return exp.isAtomic();
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, "#" + index, exp, right);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public TupleProj copy(Term exp) {
      return exp == this.exp ? this : core.tupleProj(pos, exp, index);
    }
  }

  /**
   * Constant: a literal value (arity 0), or an opaque operation that consumes
   * a fixed number of arguments before it produces its result.
   *
   * <p>Operations are usually values of {@link BuiltIn}.
   */
  public static class Const extends Term {
    public final Object value;
    public final int arity;

    Const(Pos pos, Object value, int arity) {
      super(pos, Op.CONST);
      this.value = requireNonNull(value);
      this.arity = arity;
      checkArgument(arity >= 0, "negative arity");
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(value);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * The fixpoint combinator, "fix".
   *
   * <p>Applied to a function "fn self => e", yields the value of "e" in which
   * "self" refers to that value.
   */
  public static class Fix extends Term {
    Fix(Pos pos) {
      super(pos, Op.FIX);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("fix");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Built-in form that has a fixed arity and keeps the operands it has been
   * given so far.
   *
   * <p>Before evaluation, every intrinsic is in its canonical shape, with no
   * operands. Evaluators fill in operands one at a time as the form is
   * applied.
   */
  public abstract static class Intrinsic extends Term {
    public final ImmutableList<Term> args;

    Intrinsic(Pos pos, Op op, ImmutableList<Term> args) {
      super(pos, op);
      this.args = requireNonNull(args);
      checkArgument(args.size() < arity(), "too many operands");
    }

    /** Returns the name of this form, as it appears in programs. */
    public abstract String name();

    /** Returns the number of operands this form consumes. */
    public abstract int arity();

    /** Returns whether this form has not been given any operands. */
    public boolean isCanonical() {
      return args.isEmpty();
    }

    /** Returns a copy of this form with the given operands. */
    public abstract Intrinsic copy(List<Term> args);

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.applied(left, name(), args, right);
    }
  }

  /** List concatenation, "concat l1 l2". */
  public static class Concat extends Intrinsic {
    Concat(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.CONCAT, args);
    }

    @Override
    public String name() {
      return "concat";
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    public Concat copy(List<Term> args) {
      return args.equals(this.args) ? this : core.concat(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Inference marker, "infer model"; runs inference over a model. */
  public static class Infer extends Intrinsic {
    Infer(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.INFER, args);
    }

    @Override
    public String name() {
      return "infer";
    }

    @Override
    public int arity() {
      return 1;
    }

    @Override
    public Infer copy(List<Term> args) {
      return args.equals(this.args) ? this : core.infer(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Density lookup, "logpdf x dist"; the log of the density of a value. */
  public static class LogPdf extends Intrinsic {
    LogPdf(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.LOG_PDF, args);
    }

    @Override
    public String name() {
      return "logpdf";
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    public LogPdf copy(List<Term> args) {
      return args.equals(this.args) ? this : core.logPdf(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Unit test, "utest actual expected". */
  public static class Utest extends Intrinsic {
    Utest(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.UTEST, args);
    }

    @Override
    public String name() {
      return "utest";
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    public Utest copy(List<Term> args) {
      return args.equals(this.args) ? this : core.utest(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Draws a value from a distribution.
   *
   * <p>Already in CPS shape: its first operand is a continuation, its second
   * the distribution.
   */
  public static class Sample extends Intrinsic {
    Sample(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.SAMPLE, args);
    }

    @Override
    public String name() {
      return "sample";
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    public Sample copy(List<Term> args) {
      return args.equals(this.args) ? this : core.sample(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Adds to the log-weight of the current execution.
   *
   * <p>Already in CPS shape: its first operand is a continuation, its second
   * the weight.
   */
  public static class Weight extends Intrinsic {
    Weight(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.WEIGHT, args);
    }

    @Override
    public String name() {
      return "weight";
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    public Weight copy(List<Term> args) {
      return args.equals(this.args) ? this : core.weight(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Adds to the log-weight of the current execution, in a way that the
   * inference engine may revise on re-execution ("dynamic weight").
   *
   * <p>Already in CPS shape, like {@link Weight}.
   */
  public static class DWeight extends Intrinsic {
    DWeight(Pos pos, ImmutableList<Term> args) {
      super(pos, Op.D_WEIGHT, args);
    }

    @Override
    public String name() {
      return "dweight";
    }

    @Override
    public int arity() {
      return 2;
    }

    @Override
    public DWeight copy(List<Term> args) {
      return args.equals(this.args) ? this : core.dWeight(pos, args);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * A function closed over the environment in which it was evaluated.
   *
   * <p>Closures are values that only exist during evaluation; no compiler
   * pass accepts one as input.
   */
  public static class Closure extends Term {
    public final Lam fn;
    public final ImmutableMap<String, Object> env;

    Closure(Lam fn, ImmutableMap<String, Object> env) {
      super(fn.pos, Op.CLOSURE);
      this.fn = requireNonNull(fn);
      this.env = requireNonNull(env);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("<closure ").append(fn, 0, 0).append(">");
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Core.java
