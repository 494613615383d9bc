/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.matrix;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.symbolic.UnsupportedMassMatrixException;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Equation;
import com.powsybl.symbolic.expr.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class MassMatrixTest {

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol x1 = Symbol.state("x1", t);

    private final Symbol x2 = Symbol.state("x2", t);

    @Test
    void testSemiExplicit() {
        List<Equation> equations = List.of(new Equation(differential(x1, t), negate(x1)),
                                           new Equation(Constant.ZERO, subtract(x1, x2)));
        MassMatrix massMatrix = MassMatrix.calculate(equations, List.of(x1, x2));
        assertEquals(1, massMatrix.get(0, 0), 0);
        assertEquals(0, massMatrix.get(1, 1), 0);
        assertEquals(0, massMatrix.get(0, 1), 0);
        assertFalse(massMatrix.isIdentity());
        DenseMatrix dense = massMatrix.toDenseMatrix();
        assertEquals(1, dense.get(0, 0), 0);
        assertEquals(0, dense.get(1, 1), 0);
        assertEquals(Constant.ONE, massMatrix.toSymbolicMatrix().get(0, 0));
        assertEquals(Constant.ZERO, massMatrix.toSymbolicMatrix().get(1, 1));
    }

    @Test
    void testIdentity() {
        // equation order and state order differ
        List<Equation> equations = List.of(new Equation(differential(x2, t), x1),
                                           new Equation(differential(x1, t), x2));
        MassMatrix massMatrix = MassMatrix.calculate(equations, List.of(x2, x1));
        assertTrue(massMatrix.isIdentity());
        assertFalse(MassMatrix.calculate(equations, List.of(x1, x2)).isIdentity());
        assertEquals(1, MassMatrix.calculate(equations, List.of(x1, x2)).get(0, 1), 0);
    }

    @Test
    void testUnsupported() {
        List<Symbol> states = List.of(x1, x2);
        List<Equation> notADifferential = List.of(new Equation(x1, x2));
        UnsupportedMassMatrixException e = assertThrows(UnsupportedMassMatrixException.class,
            () -> MassMatrix.calculate(notADifferential, states));
        assertEquals("Only semi-explicit mass matrices are currently supported: equation 0 has left hand side x1", e.getMessage());

        List<Equation> secondOrder = List.of(new Equation(differential(x1, t, 2), x2));
        assertThrows(UnsupportedMassMatrixException.class, () -> MassMatrix.calculate(secondOrder, states));

        List<Equation> composite = List.of(new Equation(differential(add(x1, x2), t), x2));
        assertThrows(UnsupportedMassMatrixException.class, () -> MassMatrix.calculate(composite, states));

        List<Equation> scaled = List.of(new Equation(multiply(constant(2), differential(x1, t)), x2));
        assertThrows(UnsupportedMassMatrixException.class, () -> MassMatrix.calculate(scaled, states));
    }
}
