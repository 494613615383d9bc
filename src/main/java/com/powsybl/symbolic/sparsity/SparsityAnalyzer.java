/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.sparsity;

import com.google.common.base.Stopwatch;
import com.powsybl.symbolic.UnknownLinearityException;
import com.powsybl.symbolic.expr.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Structural analysis of expressions: sparsity of first and second derivatives, computed without
 * differentiating. Tracked variables are matched syntactically and may be symbols or differentials.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SparsityAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SparsityAnalyzer.class);

    private final OperatorRegistry registry;

    public SparsityAnalyzer() {
        this(OperatorRegistry.createDefault());
    }

    public SparsityAnalyzer(OperatorRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    public SparsityPattern jacobianSparsity(List<? extends Expression> exprs, List<? extends Expression> variables) {
        Objects.requireNonNull(exprs);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Map<Expression, Integer> variableIndex = indexVariables(variables);
        SparsityPattern.Builder builder = SparsityPattern.builder(exprs.size(), variables.size());
        for (int i = 0; i < exprs.size(); i++) {
            int row = i;
            collectOccurrences(exprs.get(i), variableIndex, column -> builder.set(row, column));
        }
        SparsityPattern pattern = builder.build();

        LOGGER.debug(PERFORMANCE_MARKER, "Jacobian sparsity ({}x{}, {} non zeros) computed in {} us",
                pattern.getRowCount(), pattern.getColumnCount(), pattern.getNonZeroCount(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return pattern;
    }

    private static Map<Expression, Integer> indexVariables(List<? extends Expression> variables) {
        Map<Expression, Integer> variableIndex = new HashMap<>(variables.size());
        for (int i = 0; i < variables.size(); i++) {
            variableIndex.putIfAbsent(Objects.requireNonNull(variables.get(i)), i);
        }
        return variableIndex;
    }

    private static void collectOccurrences(Expression expr, Map<Expression, Integer> variableIndex, IntConsumer handler) {
        Integer index = variableIndex.get(expr);
        if (index != null) {
            handler.accept(index);
            return;
        }
        for (Expression child : expr.getChildren()) {
            collectOccurrences(child, variableIndex, handler);
        }
    }

    /**
     * For each expression of {@code exprs}, tell if it occurs in {@code expr}.
     */
    public boolean[] exprsOccurIn(List<? extends Expression> exprs, Expression expr) {
        SparsityPattern pattern = jacobianSparsity(List.of(expr), exprs);
        boolean[] found = new boolean[exprs.size()];
        for (int j = 0; j < found.length; j++) {
            found[j] = pattern.isNonZero(0, j);
        }
        return found;
    }

    /**
     * Sparsity of the Hessian of a scalar expression.
     *
     * @throws UnknownLinearityException if a function of unknown linearity is applied to a tracked variable
     */
    public SparsityPattern hessianSparsity(Expression expr, List<? extends Expression> variables) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        TermCombination term = propagate(expr, indexVariables(variables));
        SparsityPattern.Builder builder = SparsityPattern.builder(variables.size(), variables.size());
        term.fillHessianPattern(builder);
        SparsityPattern pattern = builder.build();

        LOGGER.debug(PERFORMANCE_MARKER, "Hessian sparsity ({} non zeros) computed in {} us",
                pattern.getNonZeroCount(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return pattern;
    }

    public List<SparsityPattern> hessianSparsity(List<? extends Expression> exprs, List<? extends Expression> variables) {
        List<SparsityPattern> patterns = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            patterns.add(hessianSparsity(expr, variables));
        }
        return patterns;
    }

    public boolean isLinear(Expression expr, List<? extends Expression> variables) {
        return hessianSparsity(expr, variables).getNonZeroCount() == 0;
    }

    private TermCombination propagate(Expression expr, Map<Expression, Integer> variableIndex) {
        Integer index = variableIndex.get(expr);
        if (index != null) {
            return TermCombination.variable(index);
        }
        switch (expr.getType()) {
            case CONSTANT:
            case SYMBOL:
                return TermCombination.ONE;
            case DIFFERENTIAL:
                // differentiation is a linear operator
                return propagate(((Differential) expr).getArgument(), variableIndex);
            case OPERATION:
                return propagateOperation((Operation) expr, variableIndex);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }

    private TermCombination propagateOperation(Operation operation, Map<Expression, Integer> variableIndex) {
        List<TermCombination> args = new ArrayList<>(operation.getArguments().size());
        boolean scalar = true;
        for (Expression arg : operation.getArguments()) {
            TermCombination term = propagate(arg, variableIndex);
            scalar &= term.isScalar();
            args.add(term);
        }
        Operator operator = operation.getOperator();
        if (operator.equals(Operator.ADD)) {
            return args.stream().reduce(TermCombination.ZERO, TermCombination::add);
        }
        if (operator.equals(Operator.MULTIPLY)) {
            return args.stream().reduce(TermCombination.ONE, TermCombination::multiply);
        }
        if (scalar) {
            return TermCombination.ONE;
        }
        if (operator.equals(Operator.POWER) && args.get(1).isScalar()) {
            Expression exponent = operation.getArgument(1);
            if (Constant.isOne(exponent)) {
                return args.get(0);
            }
            if (Constant.isZero(exponent)) {
                return TermCombination.ONE;
            }
            return args.get(0).multiply(args.get(0));
        }
        Linearity linearity = registry.getLinearity(operator)
                .orElseThrow(() -> new UnknownLinearityException(operator));
        if (args.size() == 1 && linearity.arity() == 1) {
            return args.get(0).combine(linearity);
        } else if (args.size() == 2 && linearity.arity() == 2) {
            return TermCombination.combine(linearity, args.get(0), args.get(1));
        }
        throw new UnknownLinearityException(operator);
    }
}
