/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.lowering;

import com.google.common.base.Stopwatch;
import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.diff.Differentiator;
import com.powsybl.symbolic.expr.*;
import com.powsybl.symbolic.matrix.Jacobians;
import com.powsybl.symbolic.matrix.SymbolicMatrix;
import com.powsybl.symbolic.simplify.Simplifier;
import com.powsybl.symbolic.system.OdeSystem;
import com.powsybl.symbolic.system.SdeSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Convert the drift of a stochastic system between the Ito and Stratonovich interpretations. The drift
 * {@code f} becomes {@code f + c * sum_k J_k * sigma_k}, where {@code sigma_k} is the {@code k}-th noise
 * column and {@code J_k} its Jacobian with respect to the states. The noise is left unchanged.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class StochasticIntegralTransform {

    private static final Logger LOGGER = LoggerFactory.getLogger(StochasticIntegralTransform.class);

    public static final double ITO_TO_STRATONOVICH = -0.5;

    public static final double STRATONOVICH_TO_ITO = 0.5;

    private final Jacobians jacobians;

    public StochasticIntegralTransform() {
        this(OperatorRegistry.createDefault(), new SymbolicParameters());
    }

    public StochasticIntegralTransform(OperatorRegistry registry, SymbolicParameters parameters) {
        this(new Jacobians(new Differentiator(registry, parameters)));
    }

    public StochasticIntegralTransform(Jacobians jacobians) {
        this.jacobians = Objects.requireNonNull(jacobians);
    }

    public SdeSystem transform(SdeSystem system, double correctionFactor) {
        Objects.requireNonNull(system);
        Stopwatch stopwatch = Stopwatch.createStarted();

        OdeSystem drift = system.getDrift();
        List<Symbol> states = drift.getStates();
        int n = drift.getEquations().size();
        if (states.size() != n) {
            throw new ShapeMismatchException("Stochastic integral transform requires as many equations as states, got "
                    + n + " equations and " + states.size() + " states");
        }

        // sum over noise processes of J_k * sigma_k
        List<List<Expression>> corrections = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            corrections.add(new ArrayList<>());
        }
        for (int k = 0; k < system.getNoise().getColumnCount(); k++) {
            List<Expression> column = system.getNoiseColumn(k);
            SymbolicMatrix jacobian = jacobians.jacobian(column, states, true);
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    Expression jij = jacobian.get(i, j);
                    if (!Constant.isZero(jij)) {
                        corrections.get(i).add(Expressions.multiply(jij, column.get(j)));
                    }
                }
            }
        }

        Simplifier simplifier = jacobians.getDifferentiator().getSimplifier();
        Constant factor = Constant.of(correctionFactor);
        OdeSystem.Builder builder = OdeSystem.builder(drift.getIndependentVariable())
                .setName(drift.getName())
                .setStates(states)
                .setParameters(system.getParameters());
        for (int i = 0; i < n; i++) {
            Equation equation = drift.getEquations().get(i);
            List<Expression> terms = corrections.get(i);
            Expression rhs = equation.getRhs();
            if (!terms.isEmpty()) {
                Expression correction = terms.size() == 1 ? terms.get(0) : Expressions.add(terms);
                rhs = simplifier.simplify(Expressions.add(rhs, Expressions.multiply(factor, correction)));
            }
            builder.addEquation(equation.getLhs(), rhs);
        }
        SdeSystem transformed = system.withDrift(builder.build());

        LOGGER.debug(PERFORMANCE_MARKER, "Stochastic integral transform of system '{}' done in {} us",
                system.getName(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return transformed;
    }
}
