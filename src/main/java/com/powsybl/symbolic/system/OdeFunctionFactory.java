/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.google.common.base.Stopwatch;
import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.codegen.ArgumentGroup;
import com.powsybl.symbolic.codegen.FunctionGenerator;
import com.powsybl.symbolic.matrix.MassMatrix;
import com.powsybl.symbolic.sparsity.DependencyGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Build the callables consumed by numerical solvers for a system: right hand side, Jacobian, time
 * gradient, factorized operators and noise terms, with the mass matrix and the dependency graph.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class OdeFunctionFactory {

    private static final Logger LOGGER = LoggerFactory.getLogger(OdeFunctionFactory.class);

    public static final String STATES_ARGUMENT_NAME = "u";

    public static final String PARAMETERS_ARGUMENT_NAME = "p";

    public static final String GAMMA_ARGUMENT_NAME = "gam";

    public static final String INDEPENDENT_VARIABLE_ARGUMENT_NAME = "t";

    private final OdeSystemCalculator calculator;

    private final FunctionGenerator generator;

    public OdeFunctionFactory() {
        this(new OdeSystemCalculator());
    }

    public OdeFunctionFactory(OdeSystemCalculator calculator) {
        this(calculator, FunctionGenerator.create(calculator.getParameters()));
    }

    public OdeFunctionFactory(OdeSystemCalculator calculator, FunctionGenerator generator) {
        this.calculator = Objects.requireNonNull(calculator);
        this.generator = Objects.requireNonNull(generator);
    }

    private static ArgumentGroup states(OdeSystem system) {
        return ArgumentGroup.vector(STATES_ARGUMENT_NAME, system.getStates());
    }

    private static ArgumentGroup parameters(OdeSystem system) {
        return ArgumentGroup.vector(PARAMETERS_ARGUMENT_NAME, system.getParameters());
    }

    private static ArgumentGroup independentVariable(OdeSystem system) {
        return ArgumentGroup.scalar(INDEPENDENT_VARIABLE_ARGUMENT_NAME, system.getIndependentVariable());
    }

    public OdeFunction<double[], double[]> createRhsFunction(OdeSystem system) {
        Objects.requireNonNull(system);
        Stopwatch stopwatch = Stopwatch.createStarted();

        OdeFunction<double[], double[]> function = new OdeFunction<>(generator.generate(system.getRightHandSides(),
                states(system), parameters(system), independentVariable(system)));

        LOGGER.debug(PERFORMANCE_MARKER, "Right hand side function of system '{}' created in {} us",
                system.getName(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    public OdeFunction<DenseMatrix, DenseMatrix> createJacobianFunction(OdeSystem system) {
        Objects.requireNonNull(system);
        Stopwatch stopwatch = Stopwatch.createStarted();

        var jacobian = calculator.getParameters().isSparse() ? calculator.calculateSparseJacobian(system)
                                                             : calculator.calculateJacobian(system);
        OdeFunction<DenseMatrix, DenseMatrix> function = new OdeFunction<>(generator.generate(jacobian,
                states(system), parameters(system), independentVariable(system)));

        LOGGER.debug(PERFORMANCE_MARKER, "Jacobian function of system '{}' created in {} us",
                system.getName(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    public OdeFunction<double[], double[]> createTimeGradientFunction(OdeSystem system) {
        Objects.requireNonNull(system);
        return new OdeFunction<>(generator.generate(calculator.calculateTimeGradient(system),
                states(system), parameters(system), independentVariable(system)));
    }

    /**
     * Combined LU factors of {@code W}, unit lower factor strictly below the diagonal.
     */
    public ScaledOdeFunction<DenseMatrix, DenseMatrix> createFactorizedWFunction(OdeSystem system, boolean transformed) {
        Objects.requireNonNull(system);
        Stopwatch stopwatch = Stopwatch.createStarted();

        var lu = calculator.calculateFactorizedW(system, transformed);
        ScaledOdeFunction<DenseMatrix, DenseMatrix> function = new ScaledOdeFunction<>(generator.generate(lu.getFactors(),
                states(system), parameters(system),
                ArgumentGroup.scalar(GAMMA_ARGUMENT_NAME, OdeSystemCalculator.GAMMA),
                independentVariable(system)));

        LOGGER.debug(PERFORMANCE_MARKER, "Factorized W{} function of system '{}' created in {} us",
                transformed ? "_t" : "", system.getName(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    /**
     * Noise terms of a system with diagonal noise, one per equation.
     */
    public OdeFunction<double[], double[]> createDiffusionFunction(SdeSystem system) {
        Objects.requireNonNull(system);
        if (!system.isDiagonalNoise()) {
            throw new ShapeMismatchException("System '" + system.getName() + "' has general noise, use a noise matrix function");
        }
        return new OdeFunction<>(generator.generate(system.getNoiseColumn(0),
                states(system.getDrift()), ArgumentGroup.vector(PARAMETERS_ARGUMENT_NAME, system.getParameters()),
                independentVariable(system.getDrift())));
    }

    /**
     * Noise matrix with one row per equation and one column per Wiener process.
     */
    public OdeFunction<DenseMatrix, DenseMatrix> createNoiseMatrixFunction(SdeSystem system) {
        Objects.requireNonNull(system);
        Stopwatch stopwatch = Stopwatch.createStarted();

        OdeFunction<DenseMatrix, DenseMatrix> function = new OdeFunction<>(generator.generate(system.getNoise(),
                states(system.getDrift()), ArgumentGroup.vector(PARAMETERS_ARGUMENT_NAME, system.getParameters()),
                independentVariable(system.getDrift())));

        LOGGER.debug(PERFORMANCE_MARKER, "Noise matrix function of system '{}' created in {} us",
                system.getName(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    public MassMatrix getMassMatrix(OdeSystem system) {
        return calculator.calculateMassMatrix(system);
    }

    public DependencyGraph getDependencyGraph(OdeSystem system) {
        return calculator.calculateDependencyGraph(system);
    }
}
