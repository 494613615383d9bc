/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.simplify;

import com.powsybl.symbolic.expr.*;
import net.jafama.FastMath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class SimplifierTest {

    private final Simplifier simplifier = new Simplifier();

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol x = Symbol.state("x", t);

    private final Symbol y = Symbol.state("y", t);

    @Test
    void testIdentities() {
        assertEquals(x, simplifier.simplify(add(x, Constant.ZERO)));
        assertEquals(x, simplifier.simplify(multiply(x, Constant.ONE)));
        assertEquals(Constant.ZERO, simplifier.simplify(multiply(x, Constant.ZERO)));
        assertEquals(x, simplifier.simplify(pow(x, 1)));
        assertEquals(Constant.ONE, simplifier.simplify(pow(x, 0)));
        assertEquals(Constant.ONE, simplifier.simplify(pow(Constant.ONE, x)));
        assertEquals(x, simplifier.simplify(divide(x, Constant.ONE)));
        assertEquals(Constant.ZERO, simplifier.simplify(divide(Constant.ZERO, x)));
        assertEquals(x, simplifier.simplify(negate(negate(x))));
        assertEquals(Constant.ZERO, simplifier.simplify(differential(constant(3), t)));
    }

    @Test
    void testCanonicalForms() {
        assertEquals(add(x, multiply(Constant.MINUS_ONE, y)), simplifier.simplify(subtract(x, y)));
        assertEquals(multiply(Constant.MINUS_ONE, x), simplifier.simplify(negate(x)));
        assertEquals(multiply(constant(0.5), x), simplifier.simplify(divide(x, constant(2))));
        assertEquals(divide(x, y), simplifier.simplify(divide(x, y)));
    }

    @Test
    void testFlattenAndFold() {
        assertEquals(add(x, y, constant(3)), simplifier.simplify(add(add(x, Constant.ONE), add(y, constant(2)))));
        assertEquals(multiply(constant(6), x), simplifier.simplify(multiply(constant(2), multiply(x, constant(3)))));
        assertEquals(8, ((Constant) simplifier.simplify(pow(constant(2), constant(3)))).getValue(), 1e-12);
        assertEquals(Constant.ZERO, simplifier.simplify(sin(Constant.ZERO)));
        assertEquals(Constant.ZERO, simplifier.simplify(add(x, negate(x)).substitute(x, constant(4))));
        assertEquals(differential(x, t, 3), simplifier.simplify(new Differential(new Differential(x, t, 1), t, 2)));
    }

    @Test
    void testPowerFoldedLikeEvaluation() {
        Expression folded = simplifier.simplify(pow(constant(1.1), constant(0.3)));
        assertEquals(constant(FastMath.pow(1.1, 0.3)), folded);
        assertEquals(Expressions.evaluate(pow(x, constant(0.3)), Map.of(x, 1.1)), ((Constant) folded).getValue(), 0);
    }

    @Test
    void testNonFiniteValuesAreKept() {
        assertEquals(log(Constant.ZERO), simplifier.simplify(log(Constant.ZERO)));
        assertEquals(divide(Constant.ONE, Constant.ZERO), simplifier.simplify(divide(Constant.ONE, Constant.ZERO)));
        assertEquals(sqrt(constant(-1)), simplifier.simplify(sqrt(constant(-1))));
    }

    @Test
    void testNestedPowers() {
        assertEquals(pow(x, 6), simplifier.simplify(pow(pow(x, 2), 3)));
        assertEquals(x, simplifier.simplify(pow(pow(x, 0.5), 2)));
        // only valid for integer outer exponents
        assertEquals(pow(pow(x, 2), 0.5), simplifier.simplify(pow(pow(x, 2), 0.5)));
    }

    @Test
    void testIdempotence() {
        List<Expression> exprs = List.of(
                subtract(multiply(x, subtract(constant(28), y)), x),
                divide(add(x, constant(2), y), constant(4)),
                pow(pow(add(x, y), 2), 2),
                negate(add(sin(x), multiply(constant(2), cos(y), constant(0.5)))),
                add(differential(x, t), multiply(Constant.ZERO, differential(y, t))));
        List<Expression> once = simplifier.simplify(exprs);
        assertEquals(once, simplifier.simplify(once));
    }

    @Test
    void testEquation() {
        Equation equation = new Equation(differential(x, t), add(multiply(constant(1), y), Constant.ZERO));
        assertEquals(new Equation(differential(x, t), y), simplifier.simplify(equation));
    }
}
