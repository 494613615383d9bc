/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.matrix;

import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.sparsity.SparsityPattern;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.powsybl.symbolic.expr.Expressions.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
class SymbolicMatrixTest {

    private final Symbol a = Symbol.parameter("a");

    private final Symbol b = Symbol.parameter("b");

    @Test
    void test() {
        SymbolicMatrix matrix = SymbolicMatrix.builder(2, 2)
                .set(0, 0, a)
                .set(0, 1, multiply(a, b))
                .set(1, 1, constant(3))
                .build();
        assertEquals("[a, a * b; 0, 3]", matrix.toString());
        assertTrue(matrix.isSquare());
        assertFalse(matrix.isSparse());
        assertEquals(SparsityPattern.builder(2, 2).set(0, 0).set(0, 1).set(1, 1).build(), matrix.getPattern());
        assertEquals(List.of(a, multiply(a, b), Constant.ZERO, constant(3)), matrix.toList());

        DenseMatrix values = matrix.evaluate(Map.of(a, 2.0, b, 5.0));
        assertEquals(10, values.get(0, 1), 0);
        assertEquals(0, values.get(1, 0), 0);

        SymbolicMatrix mapped = matrix.map(e -> e.substitute(a, b));
        assertEquals(multiply(b, b), mapped.get(0, 1));
    }

    @Test
    void testSparse() {
        SparsityPattern pattern = SparsityPattern.builder(2, 2).set(0, 0).build();
        SymbolicMatrix matrix = SymbolicMatrix.builder(2, 2)
                .set(0, 0, a)
                .set(1, 1, b)
                .build(pattern);
        assertTrue(matrix.isSparse());
        assertSame(pattern, matrix.getPattern());
        assertEquals(Constant.ZERO, matrix.get(1, 1));
        SparsityPattern wrongSize = SparsityPattern.dense(1, 2);
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(2, 2);
        assertThrows(IllegalArgumentException.class, () -> builder.build(wrongSize));
    }

    @Test
    void testFactories() {
        SymbolicMatrix identity = SymbolicMatrix.identity(2);
        assertEquals(Constant.ONE, identity.get(1, 1));
        assertEquals(Constant.ZERO, identity.get(0, 1));
        List<Expression> values = List.of(a, b);
        SymbolicMatrix column = SymbolicMatrix.column(values);
        assertEquals(2, column.getRowCount());
        assertEquals(1, column.getColumnCount());
        assertEquals(b, column.get(1, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> column.get(0, 1));
    }
}
