/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.sparsity;

import com.powsybl.symbolic.UnknownLinearityException;
import com.powsybl.symbolic.expr.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class SparsityAnalyzerTest {

    private final Symbol x = Symbol.parameter("x");

    private final Symbol y = Symbol.parameter("y");

    private final Symbol z = Symbol.parameter("z");

    private final List<Symbol> variables = List.of(x, y, z);

    private final SparsityAnalyzer analyzer = new SparsityAnalyzer();

    private static SparsityPattern pattern(int rowCount, int columnCount, int... entries) {
        SparsityPattern.Builder builder = SparsityPattern.builder(rowCount, columnCount);
        for (int k = 0; k < entries.length; k += 2) {
            builder.set(entries[k], entries[k + 1]);
        }
        return builder.build();
    }

    @Test
    void testJacobianSparsity() {
        SparsityPattern sparsity = analyzer.jacobianSparsity(List.of(multiply(x, y), sin(z), constant(3)), variables);
        assertEquals(pattern(3, 3, 0, 0, 0, 1, 1, 2), sparsity);
        assertEquals(String.join(System.lineSeparator(), "110", "001", "000"), sparsity.toString());
    }

    @Test
    void testJacobianSparsityOfCompositeVariables() {
        Symbol t = Symbol.independentVariable("t");
        Symbol u = Symbol.state("u", t);
        Expression du = differential(u, t);
        // occurrences of u inside D(u) are not counted
        SparsityPattern sparsity = analyzer.jacobianSparsity(List.of(add(du, constant(1)), multiply(u, du)), List.of(u, du));
        assertEquals(pattern(2, 2, 0, 1, 1, 0, 1, 1), sparsity);
    }

    @Test
    void testExprsOccurIn() {
        assertArrayEquals(new boolean[] {true, false, true}, analyzer.exprsOccurIn(variables, multiply(x, cos(z))));
        assertArrayEquals(new boolean[] {false, true}, analyzer.exprsOccurIn(List.of(sin(x), sin(y)), add(sin(y), x)));
    }

    @Test
    void testHessianSparsity() {
        assertEquals(pattern(3, 3, 0, 1, 1, 0), analyzer.hessianSparsity(multiply(x, y), variables));
        assertEquals(pattern(3, 3, 0, 0), analyzer.hessianSparsity(pow(x, 2), variables));
        assertEquals(pattern(3, 3, 0, 0), analyzer.hessianSparsity(add(sin(x), y), variables));
        assertEquals(pattern(3, 3, 0, 0, 0, 1, 1, 0), analyzer.hessianSparsity(multiply(sin(x), y), variables));
        assertEquals(pattern(3, 3, 0, 1, 1, 0, 1, 1), analyzer.hessianSparsity(divide(x, y), variables));
        assertEquals(pattern(3, 3, 0, 1, 0, 2, 1, 0, 1, 2, 2, 0, 2, 1), analyzer.hessianSparsity(multiply(x, y, z), variables));
        assertEquals(pattern(3, 3, 0, 0, 0, 1, 1, 0, 1, 1),
                analyzer.hessianSparsity(pow(x, y), variables));
        assertEquals(pattern(3, 3), analyzer.hessianSparsity(pow(z, 1), variables));
        assertEquals(pattern(3, 3), analyzer.hessianSparsity(exp(constant(2)), variables));
    }

    @Test
    void testHessianSparsityList() {
        List<SparsityPattern> patterns = analyzer.hessianSparsity(List.of(multiply(x, y), z), variables);
        assertEquals(2, patterns.size());
        assertEquals(0, patterns.get(1).getNonZeroCount());
    }

    @Test
    void testIsLinear() {
        assertTrue(analyzer.isLinear(subtract(add(multiply(constant(2), x), multiply(constant(3), y)), z), variables));
        assertTrue(analyzer.isLinear(divide(x, constant(4)), variables));
        assertTrue(analyzer.isLinear(negate(abs(x)), variables));
        assertFalse(analyzer.isLinear(multiply(x, y), variables));
        assertFalse(analyzer.isLinear(divide(constant(1), x), variables));
    }

    @Test
    void testUnknownLinearity() {
        Operator f = Operator.function("f", 1);
        Expression fx = apply(f, x);
        UnknownLinearityException e = assertThrows(UnknownLinearityException.class, () -> analyzer.hessianSparsity(fx, variables));
        assertEquals("Function of unknown linearity used: 'f'", e.getMessage());
        assertSame(f, e.getOperator());

        // no tracked variable reaches f
        assertTrue(analyzer.isLinear(add(apply(f, Symbol.parameter("p")), x), variables));

        OperatorRegistry registry = OperatorRegistry.createDefault().registerLinearity(f, Linearity.LINEAR);
        assertTrue(new SparsityAnalyzer(registry).isLinear(fx, variables));
    }

    @Test
    void testTermCombination() {
        TermCombination tx = TermCombination.variable(0);
        TermCombination ty = TermCombination.variable(1);
        assertTrue(TermCombination.ONE.isScalar());
        assertTrue(TermCombination.ZERO.isScalar());
        assertFalse(tx.isScalar());
        assertEquals(tx, TermCombination.ONE.multiply(tx));
        assertEquals(tx, tx.add(TermCombination.ZERO));
        assertEquals(tx.multiply(ty), ty.multiply(tx));
        // exponents saturate at 2
        assertEquals(tx.multiply(tx), tx.multiply(tx).multiply(tx));
        assertEquals(tx.add(ty), TermCombination.combine(Linearity.binary(true, true, true), tx, ty));
    }
}
