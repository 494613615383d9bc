/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.matrix;

import com.google.common.base.Stopwatch;
import com.powsybl.symbolic.SingularSymbolicFactorizationException;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.Expressions;
import com.powsybl.symbolic.simplify.Simplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * LU decomposition of a square symbolic matrix, without pivoting. Factors are stored combined in one
 * matrix: the unit lower triangular factor strictly below the diagonal, the upper factor on and above.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class SymbolicLUDecomposition {

    private static final Logger LOGGER = LoggerFactory.getLogger(SymbolicLUDecomposition.class);

    private final SymbolicMatrix factors;

    private SymbolicLUDecomposition(SymbolicMatrix factors) {
        this.factors = factors;
    }

    /**
     * @throws SingularSymbolicFactorizationException if a pivot simplifies to the zero constant
     */
    public static SymbolicLUDecomposition decompose(SymbolicMatrix matrix, Simplifier simplifier) {
        Objects.requireNonNull(matrix);
        Objects.requireNonNull(simplifier);
        if (!matrix.isSquare()) {
            throw new IllegalArgumentException("LU decomposition requires a square matrix, got "
                    + matrix.getRowCount() + "x" + matrix.getColumnCount());
        }
        Stopwatch stopwatch = Stopwatch.createStarted();

        int n = matrix.getRowCount();
        Expression[][] a = new Expression[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                a[i][j] = simplifier.simplify(matrix.get(i, j));
            }
        }
        for (int k = 0; k < n; k++) {
            Expression pivot = a[k][k];
            if (Constant.isZero(pivot)) {
                throw new SingularSymbolicFactorizationException("Zero pivot at row " + k);
            }
            for (int i = k + 1; i < n; i++) {
                if (Constant.isZero(a[i][k])) {
                    continue;
                }
                Expression l = simplifier.simplify(Expressions.divide(a[i][k], pivot));
                a[i][k] = l;
                for (int j = k + 1; j < n; j++) {
                    if (!Constant.isZero(a[k][j])) {
                        a[i][j] = simplifier.simplify(Expressions.subtract(a[i][j], Expressions.multiply(l, a[k][j])));
                    }
                }
            }
        }
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                builder.set(i, j, a[i][j]);
            }
        }

        LOGGER.debug(PERFORMANCE_MARKER, "Symbolic LU decomposition of a {}x{} matrix done in {} us",
                n, n, stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return new SymbolicLUDecomposition(builder.build());
    }

    public SymbolicMatrix getFactors() {
        return factors;
    }

    public SymbolicMatrix getLower() {
        int n = factors.getRowCount();
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(n, n);
        for (int i = 0; i < n; i++) {
            builder.set(i, i, Constant.ONE);
            for (int j = 0; j < i; j++) {
                builder.set(i, j, factors.get(i, j));
            }
        }
        return builder.build();
    }

    public SymbolicMatrix getUpper() {
        int n = factors.getRowCount();
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                builder.set(i, j, factors.get(i, j));
            }
        }
        return builder.build();
    }
}
