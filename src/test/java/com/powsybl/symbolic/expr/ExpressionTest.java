/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import com.google.common.testing.EqualsTester;
import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class ExpressionTest {

    private final Symbol t = Symbol.independentVariable("t");

    private final Symbol x = Symbol.state("x", t);

    private final Symbol y = Symbol.state("y", t);

    private final Symbol a = Symbol.parameter("a");

    @Test
    void testEquals() {
        new EqualsTester()
                .addEqualityGroup(add(x, y), add(Symbol.state("x", t), Symbol.state("y", t)))
                .addEqualityGroup(add(y, x))
                .addEqualityGroup(constant(2), Constant.of(2.0))
                .addEqualityGroup(Constant.ZERO, constant(-0.0))
                .addEqualityGroup(x, Symbol.state("x", t))
                .addEqualityGroup(Symbol.parameter("x"))
                .addEqualityGroup(Symbol.state("x"))
                .addEqualityGroup(new Differential(x, t, 1), differential(x, t))
                .addEqualityGroup(new Differential(x, t, 2), differential(differential(x, t), t))
                .addEqualityGroup(subtract(x, y))
                .addEqualityGroup(negate(x))
                .testEquals();
    }

    @Test
    void testAuxiliaryIdentity() {
        Symbol aux1 = Symbol.auxiliary("x_t", x, 1);
        Symbol aux2 = Symbol.auxiliary("x_t", x, 2);
        Symbol plain = Symbol.state("x_t", t);
        assertEquals(Symbol.auxiliary("x_t", x, 1), aux1);
        assertNotEquals(aux1, aux2);
        assertNotEquals(aux1, plain);
        assertEquals(new Symbol.Origin(x, 1), aux1.getOrigin().orElseThrow());
        assertTrue(aux1.dependsOn(t));
        assertTrue(plain.getOrigin().isEmpty());
    }

    @Test
    void testDependsOn() {
        Symbol z = Symbol.state("z", x);
        assertTrue(x.dependsOn(t));
        assertTrue(z.dependsOn(t));
        assertFalse(a.dependsOn(t));
        assertFalse(t.dependsOn(t));
    }

    @Test
    void testFreeSymbols() {
        Expression e = add(multiply(a, y), sin(x), differential(x, t), y);
        assertEquals(List.of(a, y, x, t), List.copyOf(e.getFreeSymbols()));
        assertEquals(Set.of(), constant(3).getFreeSymbols());
        assertTrue(e.contains(sin(x)));
        assertTrue(e.contains(a));
        assertFalse(e.contains(cos(x)));
    }

    @Test
    void testSubstitute() {
        Expression e = add(multiply(x, y), sin(multiply(x, y)));
        Expression substituted = e.substitute(multiply(x, y), a);
        assertEquals(add(a, sin(a)), substituted);
        assertEquals(add(multiply(y, y), sin(multiply(y, y))), e.substitute(x, y));
        // replacements are not visited again
        assertEquals(multiply(x, x), x.substitute(Map.of(x, multiply(x, x))));
        assertSame(e, e.substitute(Map.of(t, a)));
        assertEquals(differential(a, t), differential(x, t).substitute(x, a));
    }

    @Test
    void testToString() {
        assertEquals("x + y * a", add(x, multiply(y, a)).toString());
        assertEquals("(x + y) * a", multiply(add(x, y), a).toString());
        assertEquals("x - (y - a)", subtract(x, subtract(y, a)).toString());
        assertEquals("x ^ 2", pow(x, 2).toString());
        assertEquals("-1 * x", multiply(constant(-1), x).toString());
        assertEquals("sin(x) / 2.5", divide(sin(x), constant(2.5)).toString());
        assertEquals("D(t)(x)", differential(x, t).toString());
        assertEquals("D(t^3)(x)", differential(x, t, 3).toString());
        assertEquals("x ~ 0", new Equation(x, Constant.ZERO).toString());
    }

    @Test
    void testEvaluate() {
        Symbol pi = Symbol.constant("pi", Math.PI);
        Expression e = add(multiply(a, pow(x, 2)), cos(pi), divide(x, y));
        assertEquals(2 * 9 - 1 + 3.0 / 4, evaluate(e, Map.of(x, 3.0, y, 4.0, a, 2.0)), 1e-12);
        Map<Symbol, Double> noValues = Map.of();
        assertThrows(PowsyblException.class, () -> evaluate(x, noValues));
        Expression d = differential(x, t);
        Map<Symbol, Double> values = Map.of(x, 1.0);
        assertThrows(PowsyblException.class, () -> evaluate(d, values));
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> apply(Operator.SIN, x, y));
        assertThrows(IllegalArgumentException.class, () -> apply(Operator.DIVIDE, x));
        assertThrows(IllegalArgumentException.class, () -> new Differential(x, t, 0));
        assertThrows(IllegalArgumentException.class, () -> Symbol.parameter(""));
        assertThrows(NullPointerException.class, () -> add(x, null));
    }

    @Test
    void testEquation() {
        Equation equation = new Equation(differential(x, t), multiply(a, x));
        assertTrue(equation.isDifferential());
        assertFalse(new Equation(Constant.ZERO, subtract(x, y)).isDifferential());
        assertEquals(new Equation(differential(y, t), multiply(a, y)), equation.substitute(Map.of(x, y)));
    }
}
