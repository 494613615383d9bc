/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.OperatorRegistry;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.matrix.SymbolicLUDecomposition;
import com.powsybl.symbolic.matrix.SymbolicMatrix;
import com.powsybl.symbolic.sparsity.DependencyGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class OdeSystemCalculatorTest {

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol x = Symbol.state("x", t);

    private final Symbol y = Symbol.state("y", t);

    private final Symbol z = Symbol.state("z", t);

    private final Symbol sigma = Symbol.parameter("sigma");

    private final Symbol rho = Symbol.parameter("rho");

    private final Symbol beta = Symbol.parameter("beta");

    private OdeSystem system;

    private OdeSystemCalculator calculator;

    @BeforeEach
    void setUp() {
        // Lorenz system with an explicit time dependency
        system = OdeSystem.builder(t)
                .setName("lorenz")
                .addEquation(differential(x, t), multiply(sigma, subtract(y, x)))
                .addEquation(differential(y, t), subtract(multiply(x, subtract(rho, z)), multiply(y, t)))
                .addEquation(differential(z, t), subtract(multiply(x, y), multiply(beta, z)))
                .setStates(List.of(x, y, z))
                .setParameters(List.of(sigma, rho, beta))
                .build();
        calculator = new OdeSystemCalculator();
    }

    private Map<Symbol, Double> values(double gam) {
        Map<Symbol, Double> values = new HashMap<>();
        values.put(x, 1.0);
        values.put(y, 2.0);
        values.put(z, 3.0);
        values.put(sigma, 4.0);
        values.put(rho, 5.0);
        values.put(beta, 6.0);
        values.put(t, 1.0);
        values.put(OdeSystemCalculator.GAMMA, gam);
        return values;
    }

    private static void assertProductEquals(double[][] expected, SymbolicLUDecomposition lu, Map<Symbol, Double> values) {
        DenseMatrix l = lu.getLower().evaluate(values);
        DenseMatrix u = lu.getUpper().evaluate(values);
        for (int i = 0; i < expected.length; i++) {
            for (int j = 0; j < expected.length; j++) {
                double product = 0;
                for (int k = 0; k < expected.length; k++) {
                    product += l.get(i, k) * u.get(k, j);
                }
                assertEquals(expected[i][j], product, 1e-12);
            }
        }
    }

    @Test
    void testCachedArtifacts() {
        SymbolicMatrix jacobian = calculator.calculateJacobian(system);
        assertSame(jacobian, calculator.calculateJacobian(system));
        assertSame(calculator.calculateMassMatrix(system), calculator.calculateMassMatrix(system));
        assertSame(calculator.calculateJacobianSparsity(system), calculator.calculateJacobianSparsity(system));
        assertSame(calculator.calculateFactorizedW(system, false), calculator.calculateFactorizedW(system, false));
        assertNotSame(calculator.calculateFactorizedW(system, false), calculator.calculateFactorizedW(system, true));
        assertEquals(1, calculator.getCache().getEntryCount());
        assertTrue(calculator.getCache().find(system, ArtifactType.JACOBIAN).isPresent());
        assertTrue(calculator.getCache().find(system, ArtifactType.SPARSE_JACOBIAN).isEmpty());
    }

    @Test
    void testJacobian() {
        SymbolicMatrix jacobian = calculator.calculateJacobian(system);
        assertEquals(multiply(Constant.MINUS_ONE, t), jacobian.get(1, 1));
        assertEquals(calculator.calculateJacobianSparsity(system), calculator.calculateSparseJacobian(system).getPattern());
        assertTrue(calculator.calculateMassMatrix(system).isIdentity());
    }

    @Test
    void testTimeGradient() {
        List<Expression> timeGradient = calculator.calculateTimeGradient(system);
        assertEquals(List.of(Constant.ZERO, multiply(Constant.MINUS_ONE, y), Constant.ZERO), timeGradient);
    }

    @Test
    void testFactorizedW() {
        // W = I - gam * J
        double[][] w = {{1.4, -0.4, 0}, {-0.2, 1.1, 0.1}, {-0.2, -0.1, 1.6}};
        assertProductEquals(w, calculator.calculateFactorizedW(system, false), values(0.1));

        // W_t = I / gam - J
        double[][] wt = {{6, -4, 0}, {-2, 3, 1}, {-2, -1, 8}};
        assertProductEquals(wt, calculator.calculateFactorizedW(system, true), values(0.5));
    }

    @Test
    void testSparseW() {
        SymbolicParameters parameters = new SymbolicParameters().setSparse(true);
        OdeSystemCalculator sparseCalculator = new OdeSystemCalculator(OperatorRegistry.createDefault(), parameters, new DerivativeCache());
        assertEquals(calculator.calculateW(system, false), sparseCalculator.calculateW(system, false));
        assertTrue(sparseCalculator.getCache().find(system, ArtifactType.SPARSE_JACOBIAN).isPresent());
        assertTrue(sparseCalculator.getCache().find(system, ArtifactType.JACOBIAN).isEmpty());
    }

    @Test
    void testNonSquareW() {
        OdeSystem nonSquare = OdeSystem.builder(t)
                .addEquation(differential(x, t), x)
                .addEquation(Constant.ZERO, subtract(x, sigma))
                .setStates(List.of(x))
                .build();
        assertThrows(ShapeMismatchException.class, () -> calculator.calculateW(nonSquare, false));
    }

    @Test
    void testDependencyGraph() {
        DependencyGraph graph = calculator.calculateDependencyGraph(system);
        assertEquals(3, graph.getEquationCount());
        assertEquals(Set.of(x, y, z), graph.getVariableDependencySymbols(2));
        assertEquals(Set.of(x, y), graph.getVariableDependencySymbols(0));
    }

    @Test
    void testParameterNamedLikeScalingFactor() {
        Symbol gam = Symbol.parameter("gam");
        OdeSystem decay = OdeSystem.builder(t)
                .addEquation(differential(x, t), multiply(gam, x))
                .build();
        assertEquals(List.of(gam), decay.getParameters());
        assertNotEquals(OdeSystemCalculator.GAMMA, gam);

        SymbolicMatrix w = calculator.calculateW(decay, false);
        assertEquals(Set.of(gam, OdeSystemCalculator.GAMMA), w.get(0, 0).getFreeSymbols());
        Map<Symbol, Double> values = new HashMap<>();
        values.put(gam, 2.0);
        values.put(OdeSystemCalculator.GAMMA, 0.1);
        // 1 - 0.1 * 2
        assertEquals(0.8, w.evaluate(values).get(0, 0), 1e-12);
    }

    @Test
    void testConcurrentJacobian() throws InterruptedException, ExecutionException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<SymbolicMatrix>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> calculator.calculateJacobian(system)));
            }
            SymbolicMatrix first = futures.get(0).get();
            for (Future<SymbolicMatrix> future : futures) {
                assertSame(first, future.get());
            }
            assertSame(first, calculator.calculateJacobian(system));
            assertEquals(1, calculator.getCache().getEntryCount());
        } finally {
            executor.shutdownNow();
        }
    }
}
