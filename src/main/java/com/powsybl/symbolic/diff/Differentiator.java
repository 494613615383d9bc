/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.diff;

import com.google.common.base.Stopwatch;
import com.powsybl.symbolic.NonTerminatingException;
import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.UnregisteredDerivativeException;
import com.powsybl.symbolic.expr.*;
import com.powsybl.symbolic.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Exact symbolic differentiation.
 * <p>
 * {@link #differentiate} performs a single derivation step: the result may still hold {@link Differential}
 * nodes, either irreducible ones wrapping a state symbol, or deferred ones wrapping a composite expression.
 * {@link #expandDerivatives} eliminates the deferred ones.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Differentiator {

    private static final Logger LOGGER = LoggerFactory.getLogger(Differentiator.class);

    private final OperatorRegistry registry;

    private final SymbolicParameters parameters;

    private final Simplifier simplifier = new Simplifier();

    public Differentiator() {
        this(OperatorRegistry.createDefault(), new SymbolicParameters());
    }

    public Differentiator(OperatorRegistry registry, SymbolicParameters parameters) {
        this.registry = Objects.requireNonNull(registry);
        this.parameters = Objects.requireNonNull(parameters);
    }

    public OperatorRegistry getRegistry() {
        return registry;
    }

    public SymbolicParameters getParameters() {
        return parameters;
    }

    public Simplifier getSimplifier() {
        return simplifier;
    }

    /**
     * Derivative of an expression with respect to a symbol. A symbol declaring a dependency on {@code wrt}
     * is differentiated to an unexpanded differential of itself.
     */
    public Expression differentiate(Expression expr, Symbol wrt) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(wrt);
        return derive(expr, wrt, true);
    }

    /**
     * Partial derivative of an expression with respect to a symbol, declared symbol dependencies being
     * ignored: other symbols are all considered as independent of {@code wrt}.
     */
    public Expression partial(Expression expr, Symbol wrt) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(wrt);
        return derive(expr, wrt, false);
    }

    private Expression derive(Expression expr, Symbol wrt, boolean implicit) {
        switch (expr.getType()) {
            case CONSTANT:
                return Constant.ZERO;
            case SYMBOL:
                Symbol symbol = (Symbol) expr;
                if (symbol.equals(wrt)) {
                    return Constant.ONE;
                }
                if (implicit && symbol.dependsOn(wrt)) {
                    return new Differential(symbol, wrt, 1);
                }
                return Constant.ZERO;
            case DIFFERENTIAL:
                return differentialDerivative((Differential) expr, wrt, implicit);
            case OPERATION:
                return operationDerivative((Operation) expr, wrt, implicit);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }

    private static Expression differentialDerivative(Differential differential, Symbol wrt, boolean implicit) {
        if (differential.isIrreducible()) {
            if (!implicit) {
                // an irreducible differential is an independent quantity
                return Constant.ZERO;
            }
            if (differential.getVariable().equals(wrt)) {
                return Expressions.differential(differential, wrt);
            }
            return differential.getBaseSymbol().dependsOn(wrt) ? new Differential(differential, wrt, 1) : Constant.ZERO;
        }
        // composite target: deferred, the expansion loop applies the chain rule through it
        return Expressions.differential(differential, wrt);
    }

    private Expression operationDerivative(Operation operation, Symbol wrt, boolean implicit) {
        List<Expression> args = operation.getArguments();
        List<Expression> terms = new ArrayList<>(args.size());
        DerivativeRule rule = null;
        for (int i = 0; i < args.size(); i++) {
            Expression inner = derive(args.get(i), wrt, implicit);
            if (Constant.isZero(inner)) {
                continue;
            }
            if (rule == null) {
                int position = i;
                rule = registry.getDerivativeRule(operation.getOperator())
                        .orElseThrow(() -> new UnregisteredDerivativeException(operation.getOperator(), position));
            }
            Expression outer = rule.partial(args, i);
            if (Constant.isZero(outer)) {
                continue;
            }
            if (Constant.isOne(outer)) {
                terms.add(inner);
            } else if (Constant.isOne(inner)) {
                terms.add(outer);
            } else {
                terms.add(Expressions.multiply(outer, inner));
            }
        }
        if (terms.isEmpty()) {
            return Constant.ZERO;
        }
        return terms.size() == 1 ? terms.get(0) : Expressions.add(terms);
    }

    public Expression expandDerivatives(Expression expr) {
        return expandDerivatives(expr, parameters.isSimplify());
    }

    /**
     * Eliminate every differential node which does not wrap a state symbol, repeating bottom-up passes
     * until no reducible differential remains.
     *
     * @throws NonTerminatingException if the iteration budget is exhausted
     */
    public Expression expandDerivatives(Expression expr, boolean simplify) {
        Objects.requireNonNull(expr);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Expression expanded = expr;
        int iteration = 0;
        while (hasReducibleDifferential(expanded)) {
            if (iteration >= parameters.getMaxExpansionIterations()) {
                throw new NonTerminatingException("Derivative expansion of " + expr + " did not terminate after "
                        + iteration + " iterations");
            }
            expanded = expandOnce(expanded);
            iteration++;
        }
        if (simplify) {
            expanded = simplifier.simplify(expanded);
        }

        LOGGER.trace(PERFORMANCE_MARKER, "Derivatives expanded in {} iterations and {} us", iteration,
                stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return expanded;
    }

    /**
     * Fully expanded derivative of an expression.
     */
    public Expression derivative(Expression expr, Symbol wrt, boolean simplify) {
        return expandDerivatives(differentiate(expr, wrt), simplify);
    }

    public List<Expression> gradient(Expression expr, List<Symbol> variables) {
        return gradient(expr, variables, parameters.isSimplify());
    }

    public List<Expression> gradient(Expression expr, List<Symbol> variables, boolean simplify) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(variables);
        List<Expression> gradient = new ArrayList<>(variables.size());
        for (Symbol variable : variables) {
            gradient.add(derivative(expr, variable, simplify));
        }
        return gradient;
    }

    private static boolean hasReducibleDifferential(Expression expr) {
        if (expr instanceof Differential differential && !differential.isIrreducible()) {
            return true;
        }
        for (Expression child : expr.getChildren()) {
            if (hasReducibleDifferential(child)) {
                return true;
            }
        }
        return false;
    }

    private Expression expandOnce(Expression expr) {
        switch (expr.getType()) {
            case CONSTANT:
            case SYMBOL:
                return expr;
            case OPERATION:
                Operation operation = (Operation) expr;
                List<Expression> args = new ArrayList<>(operation.getArguments().size());
                boolean changed = false;
                for (Expression arg : operation.getArguments()) {
                    Expression expandedArg = expandOnce(arg);
                    changed |= expandedArg != arg;
                    args.add(expandedArg);
                }
                return changed ? Expressions.apply(operation.getOperator(), args) : expr;
            case DIFFERENTIAL:
                Differential differential = (Differential) expr;
                Expression arg = expandOnce(differential.getArgument());
                Expression rebuilt = arg == differential.getArgument()
                        ? differential
                        : Expressions.differential(arg, differential.getVariable(), differential.getOrder());
                if (rebuilt instanceof Differential d && d.isIrreducible()) {
                    return d;
                }
                Expression result = arg;
                for (int i = 0; i < differential.getOrder(); i++) {
                    result = derive(result, differential.getVariable(), true);
                }
                return result;
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }
}
