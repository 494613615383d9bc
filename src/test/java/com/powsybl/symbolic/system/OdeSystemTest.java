/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class OdeSystemTest {

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol x = Symbol.state("x", t);

    private final Symbol y = Symbol.state("y", t);

    private final Symbol z = Symbol.state("z", t);

    private final Symbol a = Symbol.parameter("a");

    private final Symbol b = Symbol.parameter("b");

    @Test
    void testInference() {
        OdeSystem system = OdeSystem.builder(t)
                .addEquation(differential(y, t), multiply(b, z))
                .addEquation(Constant.ZERO, add(x, y))
                .addEquation(differential(z, t), multiply(a, x))
                .build();
        assertEquals("system", system.getName());
        // left hand sides first
        assertEquals(List.of(y, z, x), system.getStates());
        assertEquals(List.of(b, a), system.getParameters());
        assertEquals(List.of(multiply(b, z), add(x, y), multiply(a, x)), system.getRightHandSides());
        assertEquals(t, system.getIndependentVariable());
    }

    @Test
    void testExplicitSymbols() {
        OdeSystem system = OdeSystem.builder(t)
                .setName("decay")
                .addEquation(differential(x, t), negate(multiply(a, x)))
                .setStates(List.of(x))
                .setParameters(List.of(a, b))
                .build();
        assertEquals("decay", system.getName());
        assertEquals(List.of(a, b), system.getParameters());
        assertEquals("OdeSystem(name=decay, equations=1, states=[x], parameters=[a, b])", system.toString());
    }

    @Test
    void testInvalidSymbols() {
        OdeSystem.Builder builder = OdeSystem.builder(t);
        List<Symbol> parametersAsStates = List.of(a);
        assertThrows(IllegalArgumentException.class, () -> builder.setStates(parametersAsStates));
        List<Symbol> duplicates = List.of(x, x);
        assertThrows(IllegalArgumentException.class, () -> builder.setStates(duplicates));
        List<Symbol> statesAsParameters = List.of(x);
        assertThrows(IllegalArgumentException.class, () -> builder.setParameters(statesAsParameters));
        assertThrows(IllegalArgumentException.class, () -> OdeSystem.builder(x));
    }
}
