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
package net.hydromatic.kont.eval;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.kont.ast.CoreBuilder.core;
import static net.hydromatic.kont.util.Static.append;
import static net.hydromatic.kont.util.Static.transformEager;
import static net.hydromatic.kont.util.Static.transformValuesEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import net.hydromatic.kont.ast.Core;
import net.hydromatic.kont.ast.Op;
import net.hydromatic.kont.compile.BuiltIn;

/**
 * Evaluates terms, for testing.
 *
 * <p>The same evaluator runs a program before and after CPS conversion, so
 * that tests can check that conversion preserves meaning. Calls in tail
 * position do not consume Java stack, so converted programs, in which every
 * call is a tail call, can loop for as long as they like.
 *
 * <p>Values are {@link Integer}, {@link Double}, {@link Boolean},
 * {@link String}, {@link Unit}, {@link Distribution}, {@link List} (for tuples
 * and lists), {@link Map} (for records), {@link Core.Closure} (for functions),
 * and partially applied operations.
 *
 * <p>Sampling is deterministic: by default, "sample" yields the
 * {@link Distribution#representative() representative} value of its
 * distribution.
 */
public class Evaluator {
  private final Function<Distribution, Object> sampler;
  private final int maxSteps;

  private int steps;
  private double logWeight;
  private final List<String> failures = new ArrayList<>();

  /** Creates an Evaluator. */
  public Evaluator(Function<Distribution, Object> sampler, int maxSteps) {
    this.sampler = requireNonNull(sampler);
    this.maxSteps = maxSteps;
  }

  /** Creates an Evaluator with a deterministic sampler. */
  public Evaluator() {
    this(Distribution::representative, 10_000_000);
  }

  /** Returns the sum of the weights seen by "weight" and "dweight". */
  public double logWeight() {
    return logWeight;
  }

  /** Returns descriptions of the unit tests that failed. */
  public List<String> failures() {
    return failures;
  }

  /** Evaluates a closed term. */
  public Object eval(Core.Term term) {
    return eval(term, ImmutableMap.of());
  }

  /** Evaluates a term in an environment. */
  public Object eval(Core.Term term, Map<String, Object> env) {
    for (;;) {
      if (++steps > maxSteps) {
        throw new IllegalStateException("too many steps");
      }
      final Map<String, Object> env0 = env;
      switch (term.op) {
      case VAR:
        final String name = ((Core.Var) term).name;
        if (!env.containsKey(name)) {
          throw new IllegalStateException("unbound variable " + name);
        }
        return env.get(name);

      case FN:
        return core.closure((Core.Lam) term, env);

      case CLOSURE:
        return term;

      case APPLY:
        final Core.App app = (Core.App) term;
        final Object fn = eval(app.fn, env);
        final Object arg = eval(app.arg, env);
        final Object result = call(fn, arg);
        if (result instanceof TailCall) {
          term = ((TailCall) result).term;
          env = ((TailCall) result).env;
          continue;
        }
        return result;

      case IF:
        final Core.If anIf = (Core.If) term;
        final Object condition = eval(anIf.condition, env);
        if (!(condition instanceof Boolean)) {
          throw new IllegalStateException("condition is not boolean: "
              + condition);
        }
        term = (Boolean) condition ? anIf.ifTrue : anIf.ifFalse;
        continue;

      case CASE:
        final Core.Case caseOf = (Core.Case) term;
        final Object value = eval(caseOf.exp, env);
        final Core.Match match = chooseArm(caseOf, value);
        term = match.exp;
        env = bindPat(match.pat, value, env);
        continue;

      case RECORD:
        return transformValuesEager(((Core.Record) term).fields,
            t -> eval(t, env0));

      case TUPLE:
        return transformEager(((Core.Tuple) term).args, t -> eval(t, env0));

      case LIST:
        return transformEager(((Core.ListExp) term).args, t -> eval(t, env0));

      case RECORD_PROJ:
        final Core.RecordProj recordProj = (Core.RecordProj) term;
        return ((Map<?, ?>) eval(recordProj.exp, env)).get(recordProj.label);

      case TUPLE_PROJ:
        final Core.TupleProj tupleProj = (Core.TupleProj) term;
        return ((List<?>) eval(tupleProj.exp, env)).get(tupleProj.index);

      case CONST:
        final Core.Const constant = (Core.Const) term;
        return constant.arity == 0
            ? constant.value
            : new Partial(constant.value, constant.arity, ImmutableList.of());

      case FIX:
        return new Partial(Op.FIX, 1, ImmutableList.of());

      case CONCAT:
      case INFER:
      case LOG_PDF:
      case UTEST:
      case SAMPLE:
      case WEIGHT:
      case D_WEIGHT:
        final Core.Intrinsic intrinsic = (Core.Intrinsic) term;
        return new Partial(term.op, intrinsic.arity(),
            transformEager(intrinsic.args, t -> eval(t, env0)));

      default:
        throw new AssertionError("unexpected " + term.op);
      }
    }
  }

  /** Applies a function value to an argument, and evaluates the result. */
  public Object apply(Object fn, Object arg) {
    final Object result = call(fn, arg);
    if (result instanceof TailCall) {
      return eval(((TailCall) result).term, ((TailCall) result).env);
    }
    return result;
  }

  /**
   * Applies a function value to an argument. If the function is a closure,
   * does not evaluate its body but returns a {@link TailCall}.
   */
  private Object call(Object fn, Object arg) {
    for (;;) {
      if (fn instanceof Core.Closure) {
        final Core.Closure closure = (Core.Closure) fn;
        return new TailCall(closure.fn.body,
            bind(closure.env, closure.fn.param, arg));
      }
      if (fn instanceof Recursive) {
        // fix g x = g (fix g) x
        fn = apply(((Recursive) fn).fn, fn);
        continue;
      }
      if (fn instanceof Partial) {
        final Partial partial = ((Partial) fn).plus(arg);
        if (partial.args.size() < partial.arity) {
          return partial;
        }
        if (partial.op == Op.SAMPLE) {
          fn = partial.args.get(0);
          arg = sampler.apply((Distribution) partial.args.get(1));
          continue;
        }
        if (partial.op == Op.WEIGHT || partial.op == Op.D_WEIGHT) {
          logWeight += toDouble(partial.args.get(1));
          fn = partial.args.get(0);
          arg = Unit.INSTANCE;
          continue;
        }
        return operate(partial.op, partial.args);
      }
      throw new IllegalStateException("not a function: " + fn);
    }
  }

  /** Applies an operation to all of its arguments. */
  private Object operate(Object op, List<Object> args) {
    if (op == Op.FIX) {
      return new Recursive(args.get(0));
    }
    if (op == Op.CONCAT) {
      return ImmutableList.builder()
          .addAll((List<?>) args.get(0))
          .addAll((List<?>) args.get(1))
          .build();
    }
    if (op == Op.UTEST) {
      if (!Objects.equals(args.get(0), args.get(1))) {
        failures.add("expected " + args.get(1) + ", got " + args.get(0));
      }
      return Unit.INSTANCE;
    }
    if (op == Op.LOG_PDF) {
      return ((Distribution) args.get(1)).logPdf(args.get(0));
    }
    if (op == Op.INFER) {
      throw new UnsupportedOperationException("infer");
    }
    if (op instanceof BuiltIn) {
      return builtIn((BuiltIn) op, args);
    }
    throw new IllegalStateException("unknown operation " + op);
  }

  private static Object builtIn(BuiltIn builtIn, List<Object> args) {
    switch (builtIn) {
    case ADD:
    case SUB:
    case MUL:
    case DIV:
      return arithmetic(builtIn, args.get(0), args.get(1));
    case NEG:
      if (args.get(0) instanceof Integer) {
        return -(Integer) args.get(0);
      }
      return -toDouble(args.get(0));
    case EQ:
      return Objects.equals(args.get(0), args.get(1));
    case LT:
      return compare(args.get(0), args.get(1)) < 0;
    case LE:
      return compare(args.get(0), args.get(1)) <= 0;
    case NOT:
      return !(Boolean) args.get(0);
    case AND:
      return (Boolean) args.get(0) && (Boolean) args.get(1);
    case OR:
      return (Boolean) args.get(0) || (Boolean) args.get(1);
    case CONS:
      return ImmutableList.builder()
          .add(args.get(0))
          .addAll((List<?>) args.get(1))
          .build();
    case EXP:
      return Math.exp(toDouble(args.get(0)));
    case LOG:
      return Math.log(toDouble(args.get(0)));
    case NORMAL:
      return new Distribution.Normal(toDouble(args.get(0)),
          toDouble(args.get(1)));
    case UNIFORM:
      return new Distribution.Uniform(toDouble(args.get(0)),
          toDouble(args.get(1)));
    case BERNOULLI:
      return new Distribution.Bernoulli(toDouble(args.get(0)));
    default:
      throw new AssertionError("unknown built-in " + builtIn);
    }
  }

  private static Object arithmetic(BuiltIn builtIn, Object a, Object b) {
    if (a instanceof Integer && b instanceof Integer) {
      final int x = (Integer) a;
      final int y = (Integer) b;
      switch (builtIn) {
      case ADD:
        return x + y;
      case SUB:
        return x - y;
      case MUL:
        return x * y;
      default:
        return x / y;
      }
    }
    final double x = toDouble(a);
    final double y = toDouble(b);
    switch (builtIn) {
    case ADD:
      return x + y;
    case SUB:
      return x - y;
    case MUL:
      return x * y;
    default:
      return x / y;
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static int compare(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return Double.compare(toDouble(a), toDouble(b));
    }
    return ((Comparable) a).compareTo(b);
  }

  private static double toDouble(Object o) {
    return ((Number) o).doubleValue();
  }

  private static ImmutableMap<String, Object> bind(Map<String, Object> env,
      String name, Object value) {
    return ImmutableMap.<String, Object>builderWithExpectedSize(env.size() + 1)
        .putAll(env)
        .put(name, value)
        .buildKeepingLast();
  }

  private static Core.Match chooseArm(Core.Case caseOf, Object value) {
    for (Core.Match match : caseOf.matchList) {
      if (matches(match.pat, value)) {
        return match;
      }
    }
    throw new IllegalStateException("no arm matches " + value);
  }

  /** Returns whether a value matches a pattern. */
  private static boolean matches(Core.Pat pat, Object value) {
    switch (pat.op) {
    case ID_PAT:
    case WILDCARD_PAT:
      return true;
    case LITERAL_PAT:
      return ((Core.LiteralPat) pat).value.equals(value);
    case TUPLE_PAT:
      return matchesAll(((Core.TuplePat) pat).args, value);
    case LIST_PAT:
      return matchesAll(((Core.ListPat) pat).args, value);
    case RECORD_PAT:
      final Map<?, ?> record = (Map<?, ?>) value;
      for (Map.Entry<String, Core.Pat> e
          : ((Core.RecordPat) pat).args.entrySet()) {
        if (!record.containsKey(e.getKey())
            || !matches(e.getValue(), record.get(e.getKey()))) {
          return false;
        }
      }
      return true;
    case CONS_PAT:
      final Core.ConsPat consPat = (Core.ConsPat) pat;
      final List<?> list = (List<?>) value;
      return !list.isEmpty()
          && matches(consPat.head, list.get(0))
          && matches(consPat.tail, list.subList(1, list.size()));
    default:
      throw new AssertionError("unexpected " + pat.op);
    }
  }

  private static boolean matchesAll(List<Core.Pat> pats, Object value) {
    final List<?> list = (List<?>) value;
    if (list.size() != pats.size()) {
      return false;
    }
    for (int i = 0; i < pats.size(); i++) {
      if (!matches(pats.get(i), list.get(i))) {
        return false;
      }
    }
    return true;
  }

  /** Binds the names of a pattern that is known to match a value. */
  private static Map<String, Object> bindPat(Core.Pat pat, Object value,
      Map<String, Object> env) {
    switch (pat.op) {
    case ID_PAT:
      return bind(env, ((Core.IdPat) pat).name, value);
    case TUPLE_PAT:
      return bindAll(((Core.TuplePat) pat).args, (List<?>) value, env);
    case LIST_PAT:
      return bindAll(((Core.ListPat) pat).args, (List<?>) value, env);
    case RECORD_PAT:
      Map<String, Object> env2 = env;
      for (Map.Entry<String, Core.Pat> e
          : ((Core.RecordPat) pat).args.entrySet()) {
        env2 = bindPat(e.getValue(), ((Map<?, ?>) value).get(e.getKey()), env2);
      }
      return env2;
    case CONS_PAT:
      final Core.ConsPat consPat = (Core.ConsPat) pat;
      final List<?> list = (List<?>) value;
      return bindPat(consPat.tail,
          ImmutableList.copyOf(list.subList(1, list.size())),
          bindPat(consPat.head, list.get(0), env));
    default:
      return env;
    }
  }

  private static Map<String, Object> bindAll(List<Core.Pat> pats,
      List<?> values, Map<String, Object> env) {
    Map<String, Object> env2 = env;
    for (int i = 0; i < pats.size(); i++) {
      env2 = bindPat(pats.get(i), values.get(i), env2);
    }
    return env2;
  }

  /** Body of a closure that remains to be evaluated. */
  private static class TailCall {
    final Core.Term term;
    final Map<String, Object> env;

    TailCall(Core.Term term, Map<String, Object> env) {
      this.term = term;
      this.env = env;
    }
  }

  /** Operation that has been given some, but not all, of its arguments. */
  private static class Partial {
    final Object op;
    final int arity;
    final ImmutableList<Object> args;

    Partial(Object op, int arity, ImmutableList<Object> args) {
      this.op = op;
      this.arity = arity;
      this.args = args;
    }

    Partial plus(Object arg) {
      return new Partial(op, arity, append(args, arg));
    }

    @Override
    public String toString() {
      return "<" + op + " " + args + ">";
    }
  }

  /** Value of "fix g". */
  private static class Recursive {
    final Object fn;

    Recursive(Object fn) {
      this.fn = fn;
    }

    @Override
    public String toString() {
      return "<fix " + fn + ">";
    }
  }
}

// End Evaluator.java
