/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.matrix;

import com.google.common.base.Stopwatch;
import com.powsybl.symbolic.diff.Differentiator;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.sparsity.SparsityAnalyzer;
import com.powsybl.symbolic.sparsity.SparsityPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Jacobian, Hessian and gradient of expressions, entry {@code (i, j)} being the expanded derivative of
 * expression {@code i} with respect to variable {@code j}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Jacobians {

    private static final Logger LOGGER = LoggerFactory.getLogger(Jacobians.class);

    private final Differentiator differentiator;

    private final SparsityAnalyzer sparsityAnalyzer;

    public Jacobians(Differentiator differentiator) {
        this.differentiator = Objects.requireNonNull(differentiator);
        this.sparsityAnalyzer = new SparsityAnalyzer(differentiator.getRegistry());
    }

    public Differentiator getDifferentiator() {
        return differentiator;
    }

    public SparsityAnalyzer getSparsityAnalyzer() {
        return sparsityAnalyzer;
    }

    public SymbolicMatrix jacobian(List<? extends Expression> exprs, List<Symbol> variables, boolean simplify) {
        Objects.requireNonNull(exprs);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(exprs.size(), variables.size());
        for (int i = 0; i < exprs.size(); i++) {
            for (int j = 0; j < variables.size(); j++) {
                builder.set(i, j, differentiator.derivative(exprs.get(i), variables.get(j), simplify));
            }
        }
        SymbolicMatrix jacobian = builder.build();

        LOGGER.debug(PERFORMANCE_MARKER, "Jacobian ({}x{}) computed in {} us",
                exprs.size(), variables.size(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return jacobian;
    }

    /**
     * Only entries of the Jacobian sparsity pattern are differentiated.
     */
    public SymbolicMatrix sparseJacobian(List<? extends Expression> exprs, List<Symbol> variables, boolean simplify) {
        Objects.requireNonNull(exprs);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        SparsityPattern pattern = sparsityAnalyzer.jacobianSparsity(exprs, variables);
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(exprs.size(), variables.size());
        pattern.forEachNonZero((i, j) -> builder.set(i, j, differentiator.derivative(exprs.get(i), variables.get(j), simplify)));
        SymbolicMatrix jacobian = builder.build(pattern);

        LOGGER.debug(PERFORMANCE_MARKER, "Sparse Jacobian ({}x{}, {} non zeros) computed in {} us",
                exprs.size(), variables.size(), pattern.getNonZeroCount(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return jacobian;
    }

    public List<Expression> gradient(Expression expr, List<Symbol> variables, boolean simplify) {
        return differentiator.gradient(expr, variables, simplify);
    }

    public SymbolicMatrix hessian(Expression expr, List<Symbol> variables, boolean simplify) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<Expression> firstDerivatives = gradient(expr, variables, simplify);
        int n = variables.size();
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j <= i; j++) {
                Expression second = differentiator.derivative(firstDerivatives.get(j), variables.get(i), simplify);
                builder.set(i, j, second);
                builder.set(j, i, second);
            }
        }
        SymbolicMatrix hessian = builder.build();

        LOGGER.debug(PERFORMANCE_MARKER, "Hessian ({}x{}) computed in {} us", n, n, stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return hessian;
    }

    /**
     * Only entries of the Hessian sparsity pattern are differentiated, first derivatives being computed
     * once per column.
     */
    public SymbolicMatrix sparseHessian(Expression expr, List<Symbol> variables, boolean simplify) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        SparsityPattern pattern = sparsityAnalyzer.hessianSparsity(expr, variables);
        int n = variables.size();
        List<Expression> firstDerivatives = new ArrayList<>(n);
        for (int j = 0; j < n; j++) {
            firstDerivatives.add(null);
        }
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(n, n);
        pattern.forEachNonZero((i, j) -> {
            Expression first = firstDerivatives.get(j);
            if (first == null) {
                first = differentiator.derivative(expr, variables.get(j), simplify);
                firstDerivatives.set(j, first);
            }
            builder.set(i, j, differentiator.derivative(first, variables.get(i), simplify));
        });
        SymbolicMatrix hessian = builder.build(pattern);

        LOGGER.debug(PERFORMANCE_MARKER, "Sparse Hessian ({}x{}, {} non zeros) computed in {} us",
                n, n, pattern.getNonZeroCount(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return hessian;
    }
}
