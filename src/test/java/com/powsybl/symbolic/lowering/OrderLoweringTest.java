/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.lowering;

import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Differential;
import com.powsybl.symbolic.expr.Equation;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.matrix.MassMatrix;
import com.powsybl.symbolic.system.OdeFunction;
import com.powsybl.symbolic.system.OdeFunctionFactory;
import com.powsybl.symbolic.system.OdeSystem;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class OrderLoweringTest {

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol u = Symbol.state("u", t);

    private final Symbol x = Symbol.state("x", t);

    private final OrderLowering lowering = new OrderLowering();

    private static double[] ones(int size) {
        double[] values = new double[size];
        Arrays.fill(values, 1);
        return values;
    }

    @Test
    void testThirdOrder() {
        OdeSystem system = OdeSystem.builder(t)
                .addEquation(differential(u, t, 3), add(multiply(constant(2), differential(u, t, 2)), differential(u, t), Constant.ONE))
                .build();
        OdeSystem lowered = lowering.lowerOrder(system);

        Symbol ut = lowering.auxiliaryState(u, t, 1);
        Symbol utt = lowering.auxiliaryState(u, t, 2);
        assertEquals("u\u02CDt", ut.getName());
        assertEquals("u\u02CDtt", utt.getName());
        assertEquals(List.of(new Equation(differential(ut, t), utt),
                             new Equation(differential(u, t), ut),
                             new Equation(differential(utt, t), add(multiply(constant(2), utt), ut, Constant.ONE))),
                     lowered.getEquations());
        assertEquals(List.of(ut, u, utt), lowered.getStates());

        OdeFunction<double[], double[]> f = new OdeFunctionFactory().createRhsFunction(lowered);
        assertArrayEquals(new double[] {1, 1, 4}, f.apply(ones(3), new double[0], 0), 0);
        assertTrue(MassMatrix.calculate(lowered.getEquations(), lowered.getStates()).isIdentity());
    }

    @Test
    void testTwoStates() {
        OdeSystem system = OdeSystem.builder(t)
                .addEquation(differential(u, t, 3), add(multiply(constant(2), differential(u, t, 2)), differential(u, t), differential(x, t), Constant.ONE))
                .addEquation(differential(x, t, 2), add(differential(x, t), constant(2)))
                .build();
        OdeSystem lowered = lowering.lowerOrder(system);

        Symbol ut = lowering.auxiliaryState(u, t, 1);
        Symbol utt = lowering.auxiliaryState(u, t, 2);
        Symbol xt = lowering.auxiliaryState(x, t, 1);
        assertEquals(List.of(ut, u, x, utt, xt), lowered.getStates());
        assertEquals(5, lowered.getEquations().size());
        for (Equation equation : lowered.getEquations()) {
            assertTrue(equation.isDifferential());
            assertEquals(1, ((Differential) equation.getLhs()).getOrder());
        }

        OdeFunction<double[], double[]> f = new OdeFunctionFactory().createRhsFunction(lowered);
        assertArrayEquals(new double[] {1, 1, 1, 5, 3}, f.apply(ones(5), new double[0], 0), 0);
    }

    @Test
    void testNestedDifferentials() {
        OdeSystem nested = OdeSystem.builder(t)
                .addEquation(new Differential(differential(u, t), t, 1), negate(u))
                .build();
        OdeSystem flat = OdeSystem.builder(t)
                .addEquation(differential(u, t, 2), negate(u))
                .build();
        assertEquals(lowering.lowerOrder(flat).getEquations(), lowering.lowerOrder(nested).getEquations());
    }

    @Test
    void testIdempotence() {
        OdeSystem system = OdeSystem.builder(t)
                .addEquation(differential(u, t, 2), negate(u))
                .addEquation(Constant.ZERO, subtract(x, u))
                .build();
        OdeSystem once = lowering.lowerOrder(system);
        OdeSystem twice = lowering.lowerOrder(once);
        assertEquals(once.getEquations(), twice.getEquations());
        assertEquals(once.getStates(), twice.getStates());
        assertEquals(once.getParameters(), twice.getParameters());
    }

    @Test
    void testAlgebraicConstraints() {
        Symbol y = Symbol.state("y", t);
        Symbol z = Symbol.state("z", t);
        OdeSystem system = OdeSystem.builder(t)
                .addEquation(differential(x, t), y)
                .addEquation(Constant.ZERO, add(x, z))
                .addEquation(Constant.ZERO, subtract(x, y))
                .setStates(List.of(z, y, x))
                .build();
        OdeSystem lowered = lowering.lowerOrder(system);
        assertEquals(system.getEquations(), lowered.getEquations());
        assertEquals(List.of(x, z, y), lowered.getStates());
        MassMatrix massMatrix = MassMatrix.calculate(lowered.getEquations(), lowered.getStates());
        assertEquals(1, massMatrix.get(0, 0), 0);
        assertEquals(0, massMatrix.get(1, 1), 0);
        assertEquals(0, massMatrix.get(2, 2), 0);
        assertEquals(1, massMatrix.getPattern().getNonZeroCount());
    }

    @Test
    void testCustomSeparator() {
        OrderLowering underscore = new OrderLowering(new SymbolicParameters().setAuxiliaryNameSeparator("_"));
        Symbol ut = underscore.auxiliaryState(u, t, 2);
        assertEquals("u_tt", ut.getName());
        assertEquals(new Symbol.Origin(u, 2), ut.getOrigin().orElseThrow());
        assertSame(u, underscore.auxiliaryState(u, t, 0));
        // identity is the origin, not the name
        assertNotEquals(lowering.auxiliaryState(u, t, 2), Symbol.state("u\u02CDtt", t));
    }
}
