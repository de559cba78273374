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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.kont.ast.CoreBuilder.core;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.kont.ast.Core;
import net.hydromatic.kont.ast.Shuttle;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts terms to continuation-passing style (CPS).
 *
 * <p>After conversion, every function takes one extra parameter, before its
 * other parameter: a continuation, which is a function of one argument. A
 * function never returns a value; it applies its continuation to the value
 * instead. For example, "fn x => f x" becomes
 *
 * <blockquote><pre>fn k$0 => fn x => f k$0 x</pre></blockquote>
 *
 * <p>Continuations are not themselves converted; they take a value and
 * return.
 *
 * <p>Terms are first passed through the {@link Lifter}. Atomic terms are then
 * converted directly ({@link #atomic}); complex terms are converted given a
 * continuation that receives their value ({@link #complex}).
 *
 * <p>The probabilistic primitives "sample", "weight" and "dweight" are
 * already in CPS form, and are left as they are.
 */
public class Cps {
  private static final Logger LOGGER = LoggerFactory.getLogger(Cps.class);

  private final NameGenerator nameGenerator;
  private final AtomicConverter atomicConverter = new AtomicConverter();

  /** Creates a Cps that generates names using a given generator. */
  public Cps(NameGenerator nameGenerator) {
    this.nameGenerator = requireNonNull(nameGenerator);
  }

  /** Converts a term to CPS, with default properties. */
  public static Core.Term transform(Core.Term term) {
    return transform(term, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Converts a term to CPS.
   *
   * <p>If the term is complex, its value is passed to the identity function,
   * so that the result of evaluating the converted term is the value of the
   * original term.
   */
  public static Core.Term transform(Core.Term term, Map<Prop, Object> props,
      Tracer tracer) {
    final NameGenerator nameGenerator =
        NameGenerator.of(Prop.NAME_SEPARATOR.stringValue(props),
            ImmutableList.of(term));
    final Core.Term lifted = Lifter.lift(nameGenerator, term);
    if (Prop.LOG_LIFT.booleanValue(props)) {
      LOGGER.debug("After lifting apps: {}", lifted);
    }
    tracer.onLift(lifted);

    final Cps cps = new Cps(nameGenerator);
    final Core.Term converted =
        lifted.isAtomic()
            ? cps.atomic(lifted)
            : cps.complex(cps.identity(), lifted);
    if (Prop.LOG_CPS.booleanValue(props)) {
      LOGGER.debug("After CPS conversion: {}", converted);
    }
    tracer.onCps(converted);
    return converted;
  }

  /**
   * Converts each entry of an environment of built-ins to CPS.
   *
   * <p>Every entry must be atomic. The entries share a name generator, and
   * the result has the same order as the environment.
   */
  public static ImmutableMap<String, Core.Term> transformEnvironment(
      Map<String, ? extends Core.Term> env, Map<Prop, Object> props,
      Tracer tracer) {
    final NameGenerator nameGenerator =
        NameGenerator.of(Prop.NAME_SEPARATOR.stringValue(props), env.values());
    final Cps cps = new Cps(nameGenerator);
    final boolean log = Prop.LOG_BUILT_IN.booleanValue(props);
    final ImmutableMap.Builder<String, Core.Term> b =
        ImmutableMap.builderWithExpectedSize(env.size());
    env.forEach((name, term) -> {
      final Core.Term converted = cps.atomic(term);
      if (log) {
        LOGGER.debug("Built-in {} after CPS conversion: {}", name, converted);
      }
      tracer.onBuiltIn(name, converted);
      b.put(name, converted);
    });
    return b.build();
  }

  /** Converts an environment of built-ins to CPS, with default properties. */
  public static ImmutableMap<String, Core.Term> transformEnvironment(
      Map<String, ? extends Core.Term> env) {
    return transformEnvironment(env, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Returns the identity continuation, "fn x => x", with a parameter name that
   * does not occur elsewhere.
   */
  public Core.Lam identity() {
    final Core.Var x = nameGenerator.var("x");
    return core.fn(x.name, x);
  }

  /**
   * Converts an atomic term. The result is the CPS form of the term's value;
   * no continuation is needed.
   *
   * @throws CompileException if the term is not atomic, or contains a closure
   *     or a built-in that has operands
   */
  public Core.Term atomic(Core.Term term) {
    return term.accept(atomicConverter);
  }

  /**
   * Converts a term, given a continuation that will receive its value.
   *
   * <p>The result applies {@code cont} to the value of {@code term}, as its
   * last action.
   *
   * @param cont Continuation; an atomic term whose value is a function of one
   *     argument
   * @param term Term to convert; must have been lifted
   */
  public Core.Term complex(Core.Term cont, Core.Term term) {
    switch (term.op) {
    case APPLY:
      return complexApply(cont, (Core.App) term);

    case IF:
      if (term.isAtomic()) {
        return core.apply(cont, atomic(term));
      }
      final Core.If anIf = (Core.If) term;
      final Core.Var c = nameGenerator.var("c");
      final Core.Term ifTrue = complex(c, anIf.ifTrue);
      final Core.Term ifFalse = complex(c, anIf.ifFalse);
      return core.let(c.name, cont,
          anIf.copy(atomic(anIf.condition), ifTrue, ifFalse));

    case CASE:
      // All arms share one continuation variable, bound outside the case.
      if (term.isAtomic()) {
        return core.apply(cont, atomic(term));
      }
      final Core.Case caseOf = (Core.Case) term;
      final Core.Var c2 = nameGenerator.var("c");
      final ImmutableList.Builder<Core.Match> matchList =
          ImmutableList.builder();
      caseOf.matchList.forEach(match ->
          matchList.add(match.copy(match.pat, complex(c2, match.exp))));
      return core.let(c2.name, cont,
          caseOf.copy(atomic(caseOf.exp), matchList.build()));

    default:
      // After lifting, everything else is atomic.
      return core.apply(cont, atomic(term));
    }
  }

  /**
   * Converts an application, "f e". The operator is evaluated before the
   * operand; each of them that is complex is evaluated by a continuation that
   * binds its value to a new variable.
   */
  private Core.Term complexApply(Core.Term cont, Core.App app) {
    final Core.@Nullable Var f =
        app.fn.isAtomic() ? null : nameGenerator.var("f");
    final Core.@Nullable Var e =
        app.arg.isAtomic() ? null : nameGenerator.var("e");
    final Core.Term fn = f == null ? atomic(app.fn) : f;
    final Core.Term arg = e == null ? atomic(app.arg) : e;
    final Core.Term apply = core.apply(app.pos, core.apply(fn, cont), arg);
    final Core.Term inner =
        e == null ? apply : complex(core.fn(e.name, apply), app.arg);
    return f == null ? inner : complex(core.fn(f.name, inner), app.fn);
  }

  /**
   * Wraps an opaque operation of a given arity so that it follows the CPS
   * calling convention.
   *
   * <p>For example, if {@code op} has arity 2, returns
   *
   * <blockquote><pre>
   * fn k$3 => fn a$0 => k$3 (fn k$2 => fn a$1 => k$2 (op a$0 a$1))
   * </pre></blockquote>
   *
   * <p>Each function takes a continuation and one argument, and passes the
   * next function (or finally, the result of applying the operation to all
   * arguments) to its continuation. If the arity is 0, returns {@code op}.
   */
  public Core.Term wrapBuiltIn(Core.Term op, int arity) {
    final ImmutableList<Core.Var> args = nameGenerator.vars("a", arity);
    Core.Term term = op;
    for (Core.Var arg : args) {
      term = core.apply(term, arg);
    }
    for (Core.Var arg : args.reverse()) {
      final Core.Var k = nameGenerator.var("k");
      term = core.fn(k.name, core.fn(arg.name, core.apply(k, term)));
    }
    return term;
  }

  /**
   * Wraps the fixpoint combinator so that it follows the CPS calling
   * convention.
   *
   * <p>Returns "fn k => fn v => k (fix (v (fn x => x)))". The argument "v" is
   * a converted function, so it expects a continuation before its own
   * argument; giving it the identity continuation yields a function that
   * "fix" can apply to itself.
   */
  public Core.Term wrapFix(Core.Fix fix) {
    final Core.Var v = nameGenerator.var("v");
    final Core.Var k = nameGenerator.var("k");
    final Core.Term inner = core.apply(fix, core.apply(v, identity()));
    return core.fn(k.name, core.fn(v.name, core.apply(k, inner)));
  }

  /** Throws if a built-in form has been given operands. */
  private static void checkCanonical(Core.Intrinsic intrinsic) {
    if (!intrinsic.isCanonical()) {
      throw CompileException.of(
          "Operands of '" + intrinsic.name()
              + "' should not exist before evaluation",
          intrinsic);
    }
  }

  /** Shuttle that converts atomic terms. */
  private class AtomicConverter extends Shuttle {
    @Override
    protected Core.Term visit(Core.Lam lam) {
      final Core.Var k = nameGenerator.var("k");
      return core.fn(lam.pos, k.name,
          core.fn(lam.param, complex(k, lam.body)));
    }

    @Override
    protected Core.Term visit(Core.App app) {
      throw CompileException.of("Complex term in atomic conversion", app);
    }

    @Override
    protected Core.Term visit(Core.Const constant) {
      return wrapBuiltIn(constant, constant.arity);
    }

    @Override
    protected Core.Term visit(Core.Fix fix) {
      return wrapFix(fix);
    }

    @Override
    protected Core.Term visit(Core.Concat concat) {
      checkCanonical(concat);
      return wrapBuiltIn(concat, concat.arity());
    }

    @Override
    protected Core.Term visit(Core.Infer infer) {
      checkCanonical(infer);
      return wrapBuiltIn(infer, infer.arity());
    }

    @Override
    protected Core.Term visit(Core.LogPdf logPdf) {
      checkCanonical(logPdf);
      return wrapBuiltIn(logPdf, logPdf.arity());
    }

    @Override
    protected Core.Term visit(Core.Utest utest) {
      checkCanonical(utest);
      return wrapBuiltIn(utest, utest.arity());
    }

    @Override
    protected Core.Term visit(Core.Sample sample) {
      checkCanonical(sample);
      return sample;
    }

    @Override
    protected Core.Term visit(Core.Weight weight) {
      checkCanonical(weight);
      return weight;
    }

    @Override
    protected Core.Term visit(Core.DWeight dWeight) {
      checkCanonical(dWeight);
      return dWeight;
    }

    @Override
    protected Core.Term visit(Core.Closure closure) {
      throw CompileException.of("Closure should not exist before evaluation",
          closure);
    }
  }
}

// End Cps.java
