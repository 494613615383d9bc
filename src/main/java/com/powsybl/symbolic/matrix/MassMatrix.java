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
import com.powsybl.symbolic.expr.*;
import com.powsybl.symbolic.sparsity.SparsityPattern;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 0/1 incidence matrix {@code M} of a semi-explicit system {@code M * du/dt = f(u)}: row {@code i} has a one
 * in the column of the state whose first derivative is the left hand side of equation {@code i}, and is
 * empty for an algebraic equation {@code 0 ~ g(u)}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class MassMatrix {

    private final SparsityPattern pattern;

    private MassMatrix(SparsityPattern pattern) {
        this.pattern = pattern;
    }

    /**
     * @throws UnsupportedMassMatrixException if a left hand side is neither {@code 0} nor the first
     * derivative of one of the states
     */
    public static MassMatrix calculate(List<Equation> equations, List<Symbol> states) {
        Objects.requireNonNull(equations);
        Objects.requireNonNull(states);
        Map<Symbol, Integer> stateIndex = new HashMap<>(states.size());
        for (int j = 0; j < states.size(); j++) {
            stateIndex.putIfAbsent(states.get(j), j);
        }
        SparsityPattern.Builder builder = SparsityPattern.builder(equations.size(), states.size());
        for (int i = 0; i < equations.size(); i++) {
            Expression lhs = equations.get(i).getLhs();
            if (Constant.isZero(lhs)) {
                continue;
            }
            if (lhs instanceof Differential differential
                    && differential.getOrder() == 1
                    && differential.getArgument() instanceof Symbol state
                    && stateIndex.containsKey(state)) {
                builder.set(i, stateIndex.get(state));
            } else {
                throw new UnsupportedMassMatrixException("Only semi-explicit mass matrices are currently supported: equation "
                        + i + " has left hand side " + lhs);
            }
        }
        return new MassMatrix(builder.build());
    }

    public int getRowCount() {
        return pattern.getRowCount();
    }

    public int getColumnCount() {
        return pattern.getColumnCount();
    }

    public double get(int row, int column) {
        return pattern.isNonZero(row, column) ? 1 : 0;
    }

    public SparsityPattern getPattern() {
        return pattern;
    }

    public boolean isIdentity() {
        if (pattern.getRowCount() != pattern.getColumnCount() || pattern.getNonZeroCount() != pattern.getRowCount()) {
            return false;
        }
        for (int i = 0; i < pattern.getRowCount(); i++) {
            if (!pattern.isNonZero(i, i)) {
                return false;
            }
        }
        return true;
    }

    public DenseMatrix toDenseMatrix() {
        DenseMatrix matrix = new DenseMatrix(pattern.getRowCount(), pattern.getColumnCount());
        pattern.forEachNonZero((row, column) -> matrix.set(row, column, 1));
        return matrix;
    }

    public SymbolicMatrix toSymbolicMatrix() {
        SymbolicMatrix.Builder builder = SymbolicMatrix.builder(pattern.getRowCount(), pattern.getColumnCount());
        pattern.forEachNonZero((row, column) -> builder.set(row, column, Constant.ONE));
        return builder.build();
    }

    @Override
    public String toString() {
        return "MassMatrix(" + System.lineSeparator() + pattern + ")";
    }
}
