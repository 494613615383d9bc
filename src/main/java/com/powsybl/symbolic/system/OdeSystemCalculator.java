/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.diff.Differentiator;
import com.powsybl.symbolic.expr.*;
import com.powsybl.symbolic.matrix.Jacobians;
import com.powsybl.symbolic.matrix.MassMatrix;
import com.powsybl.symbolic.matrix.SymbolicLUDecomposition;
import com.powsybl.symbolic.matrix.SymbolicMatrix;
import com.powsybl.symbolic.simplify.Simplifier;
import com.powsybl.symbolic.sparsity.DependencyGraph;
import com.powsybl.symbolic.sparsity.SparsityPattern;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derivative artifacts of an {@link OdeSystem}, each computed once per system and kept in a
 * {@link DerivativeCache}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class OdeSystemCalculator {

    /**
     * Scaling symbol of the factorized operators.
     */
    public static final Symbol GAMMA = Symbol.scalingFactor("gam");

    private final Differentiator differentiator;

    private final Jacobians jacobians;

    private final DerivativeCache cache;

    public OdeSystemCalculator() {
        this(OperatorRegistry.createDefault(), new SymbolicParameters(), new DerivativeCache());
    }

    public OdeSystemCalculator(OperatorRegistry registry, SymbolicParameters parameters, DerivativeCache cache) {
        this.differentiator = new Differentiator(registry, parameters);
        this.jacobians = new Jacobians(differentiator);
        this.cache = Objects.requireNonNull(cache);
    }

    public SymbolicParameters getParameters() {
        return differentiator.getParameters();
    }

    public DerivativeCache getCache() {
        return cache;
    }

    private boolean isSimplify() {
        return differentiator.getParameters().isSimplify();
    }

    public SymbolicMatrix calculateJacobian(OdeSystem system) {
        return cache.computeIfAbsent(system, ArtifactType.JACOBIAN,
            () -> jacobians.jacobian(system.getRightHandSides(), system.getStates(), isSimplify()));
    }

    public SymbolicMatrix calculateSparseJacobian(OdeSystem system) {
        return cache.computeIfAbsent(system, ArtifactType.SPARSE_JACOBIAN,
            () -> jacobians.sparseJacobian(system.getRightHandSides(), system.getStates(), isSimplify()));
    }

    public SparsityPattern calculateJacobianSparsity(OdeSystem system) {
        return cache.computeIfAbsent(system, ArtifactType.JACOBIAN_SPARSITY,
            () -> jacobians.getSparsityAnalyzer().jacobianSparsity(system.getRightHandSides(), system.getStates()));
    }

    /**
     * Explicit derivative of the right hand sides with respect to the independent variable, states being
     * held constant.
     */
    public List<Expression> calculateTimeGradient(OdeSystem system) {
        return cache.computeIfAbsent(system, ArtifactType.TIME_GRADIENT, () -> {
            Symbol iv = system.getIndependentVariable();
            List<Expression> gradient = new ArrayList<>(system.getEquations().size());
            for (Expression rhs : system.getRightHandSides()) {
                gradient.add(differentiator.expandDerivatives(differentiator.partial(rhs, iv), isSimplify()));
            }
            return List.copyOf(gradient);
        });
    }

    public MassMatrix calculateMassMatrix(OdeSystem system) {
        return cache.computeIfAbsent(system, ArtifactType.MASS_MATRIX,
            () -> MassMatrix.calculate(system.getEquations(), system.getStates()));
    }

    /**
     * LU factors of {@code W = I - gam * J}, or of {@code W_t = I / gam - J} if {@code transformed}.
     */
    public SymbolicLUDecomposition calculateFactorizedW(OdeSystem system, boolean transformed) {
        return cache.computeIfAbsent(system, transformed ? ArtifactType.FACTORIZED_W_T : ArtifactType.FACTORIZED_W,
            () -> SymbolicLUDecomposition.decompose(calculateW(system, transformed), differentiator.getSimplifier()));
    }

    public SymbolicMatrix calculateW(OdeSystem system, boolean transformed) {
        SymbolicMatrix jacobian = getParameters().isSparse() ? calculateSparseJacobian(system) : calculateJacobian(system);
        if (!jacobian.isSquare()) {
            throw new ShapeMismatchException("W requires as many equations as states, got " + jacobian.getRowCount()
                    + " equations and " + jacobian.getColumnCount() + " states");
        }
        Simplifier simplifier = differentiator.getSimplifier();
        int n = jacobian.getRowCount();
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                Expression jij = jacobian.get(i, j);
                Expression wij;
                if (transformed) {
                    wij = i == j ? Expressions.subtract(Expressions.divide(Constant.ONE, GAMMA), jij) : Expressions.negate(jij);
                } else {
                    Expression scaled = Expressions.multiply(GAMMA, jij);
                    wij = i == j ? Expressions.subtract(Constant.ONE, scaled) : Expressions.negate(scaled);
                }
                builder.set(i, j, simplifier.simplify(wij));
            }
        }
        return builder.build();
    }

    /**
     * Recomputed on each call, as it only costs one free symbol collection per equation.
     */
    public DependencyGraph calculateDependencyGraph(OdeSystem system) {
        return DependencyGraph.create(system.getEquations(), system.getStates());
    }
}
