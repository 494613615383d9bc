/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.matrix;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.symbolic.diff.Differentiator;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.sparsity.SparsityPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class JacobiansTest {

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol x = Symbol.state("x", t);

    private final Symbol y = Symbol.state("y", t);

    private final Symbol z = Symbol.state("z", t);

    private final Symbol sigma = Symbol.parameter("sigma");

    private final Symbol rho = Symbol.parameter("rho");

    private final Symbol beta = Symbol.parameter("beta");

    private final List<Symbol> states = List.of(x, y, z);

    private List<Expression> lorenz;

    private Map<Symbol, Double> values;

    private Jacobians jacobians;

    @BeforeEach
    void setUp() {
        lorenz = List.of(multiply(sigma, subtract(y, x)),
                         subtract(multiply(x, subtract(rho, z)), y),
                         subtract(multiply(x, y), multiply(beta, z)));
        values = Map.of(x, 1.0, y, 2.0, z, 3.0, sigma, 4.0, rho, 5.0, beta, 6.0);
        jacobians = new Jacobians(new Differentiator());
    }

    private static void assertMatrixEquals(double[][] expected, DenseMatrix actual) {
        assertEquals(expected.length, actual.getRowCount());
        for (int i = 0; i < expected.length; i++) {
            assertEquals(expected[i].length, actual.getColumnCount());
            for (int j = 0; j < expected[i].length; j++) {
                assertEquals(expected[i][j], actual.get(i, j), 1e-12, "(" + i + ", " + j + ")");
            }
        }
    }

    @Test
    void testLorenzJacobian() {
        SymbolicMatrix jacobian = jacobians.jacobian(lorenz, states, true);
        assertFalse(jacobian.isSparse());
        assertEquals(Constant.ZERO, jacobian.get(0, 2));
        assertEquals(Constant.MINUS_ONE, jacobian.get(1, 1));
        assertEquals(multiply(Constant.MINUS_ONE, beta), jacobian.get(2, 2));
        assertMatrixEquals(new double[][] {{-4, 4, 0}, {2, -1, -1}, {2, 1, -6}}, jacobian.evaluate(values));
    }

    @Test
    void testSparseJacobian() {
        SymbolicMatrix dense = jacobians.jacobian(lorenz, states, true);
        SymbolicMatrix sparse = jacobians.sparseJacobian(lorenz, states, true);
        assertTrue(sparse.isSparse());
        SparsityPattern pattern = sparse.getPattern();
        assertEquals(8, pattern.getNonZeroCount());
        assertFalse(pattern.isNonZero(0, 2));
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertEquals(dense.get(i, j), sparse.get(i, j));
            }
        }
        assertEquals(dense, sparse);
    }

    @Test
    void testStructuralZeroInsidePattern() {
        // x occurs in x - x, the entry is stored even if it simplifies to zero
        List<Expression> exprs = List.of(subtract(x, x));
        SymbolicMatrix sparse = jacobians.sparseJacobian(exprs, List.of(x), true);
        assertTrue(sparse.getPattern().isNonZero(0, 0));
        assertEquals(Constant.ZERO, sparse.get(0, 0));
        assertEquals(0, jacobians.jacobian(exprs, List.of(x), true).getPattern().getNonZeroCount());
    }

    @Test
    void testHessian() {
        Symbol a = Symbol.parameter("a");
        Symbol b = Symbol.parameter("b");
        Symbol c = Symbol.parameter("c");
        List<Symbol> variables = List.of(a, b, c);
        Expression expr = add(multiply(a, b), pow(c, 3), sin(a));
        SymbolicMatrix hessian = jacobians.hessian(expr, variables, true);
        SymbolicMatrix sparseHessian = jacobians.sparseHessian(expr, variables, true);
        Map<Symbol, Double> point = Map.of(a, 0.5, b, 2.0, c, 3.0);
        double[][] expected = {{-Math.sin(0.5), 1, 0}, {1, 0, 0}, {0, 0, 18}};
        assertMatrixEquals(expected, hessian.evaluate(point));
        assertMatrixEquals(expected, sparseHessian.evaluate(point));
        assertEquals(hessian.get(0, 1), hessian.get(1, 0));
        assertTrue(sparseHessian.isSparse());
        assertFalse(sparseHessian.getPattern().isNonZero(1, 1));
        assertEquals(hessian, sparseHessian);
    }

    @Test
    void testGradient() {
        List<Expression> gradient = jacobians.gradient(multiply(x, y), states, true);
        assertEquals(List.of(y, x, Constant.ZERO), gradient);
    }
}
