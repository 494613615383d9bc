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
import com.powsybl.symbolic.expr.Expressions;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.sparsity.SparsityPattern;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Immutable matrix of expressions. A sparse matrix only stores the entries of its pattern, the other
 * ones being structurally zero.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class SymbolicMatrix {

    public static final class Builder {

        private final int rowCount;

        private final int columnCount;

        private final Expression[] entries;

        private Builder(int rowCount, int columnCount) {
            if (rowCount < 0 || columnCount < 0) {
                throw new IllegalArgumentException("Invalid matrix size: " + rowCount + "x" + columnCount);
            }
            this.rowCount = rowCount;
            this.columnCount = columnCount;
            entries = new Expression[rowCount * columnCount];
            Arrays.fill(entries, Constant.ZERO);
        }

        public Builder set(int row, int column, Expression value) {
            Objects.checkIndex(row, rowCount);
            Objects.checkIndex(column, columnCount);
            entries[row * columnCount + column] = Objects.requireNonNull(value);
            return this;
        }

        public SymbolicMatrix build() {
            return new SymbolicMatrix(rowCount, columnCount, entries.clone(), null);
        }

        /**
         * Build a sparse matrix. Entries set outside of the pattern are ignored.
         */
        public SymbolicMatrix build(SparsityPattern pattern) {
            Objects.requireNonNull(pattern);
            if (pattern.getRowCount() != rowCount || pattern.getColumnCount() != columnCount) {
                throw new IllegalArgumentException("Pattern size " + pattern.getRowCount() + "x" + pattern.getColumnCount()
                        + " differs from matrix size " + rowCount + "x" + columnCount);
            }
            Expression[] sparseEntries = entries.clone();
            for (int i = 0; i < rowCount; i++) {
                for (int j = 0; j < columnCount; j++) {
                    if (!pattern.isNonZero(i, j)) {
                        sparseEntries[i * columnCount + j] = Constant.ZERO;
                    }
                }
            }
            return new SymbolicMatrix(rowCount, columnCount, sparseEntries, pattern);
        }
    }

    private final int rowCount;

    private final int columnCount;

    private final Expression[] entries;

    private final SparsityPattern pattern;

    private SymbolicMatrix(int rowCount, int columnCount, Expression[] entries, SparsityPattern pattern) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.entries = entries;
        this.pattern = pattern;
    }

    public static Builder builder(int rowCount, int columnCount) {
        return new Builder(rowCount, columnCount);
    }

    public static SymbolicMatrix identity(int size) {
        Builder builder = builder(size, size);
        for (int i = 0; i < size; i++) {
            builder.set(i, i, Constant.ONE);
        }
        return builder.build();
    }

    public static SymbolicMatrix column(List<? extends Expression> values) {
        Builder builder = builder(values.size(), 1);
        for (int i = 0; i < values.size(); i++) {
            builder.set(i, 0, values.get(i));
        }
        return builder.build();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isSquare() {
        return rowCount == columnCount;
    }

    public Expression get(int row, int column) {
        Objects.checkIndex(row, rowCount);
        Objects.checkIndex(column, columnCount);
        return entries[row * columnCount + column];
    }

    public boolean isSparse() {
        return pattern != null;
    }

    /**
     * Pattern of stored entries for a sparse matrix, or of entries which are not the zero constant for a
     * dense one.
     */
    public SparsityPattern getPattern() {
        if (pattern != null) {
            return pattern;
        }
        SparsityPattern.Builder builder = SparsityPattern.builder(rowCount, columnCount);
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                if (!Constant.isZero(get(i, j))) {
                    builder.set(i, j);
                }
            }
        }
        return builder.build();
    }

    public SymbolicMatrix map(UnaryOperator<Expression> function) {
        Objects.requireNonNull(function);
        Expression[] mapped = new Expression[entries.length];
        for (int k = 0; k < entries.length; k++) {
            mapped[k] = Objects.requireNonNull(function.apply(entries[k]));
        }
        return new SymbolicMatrix(rowCount, columnCount, mapped, pattern);
    }

    public List<Expression> toList() {
        return List.of(entries);
    }

    public DenseMatrix evaluate(Map<Symbol, Double> values) {
        DenseMatrix matrix = new DenseMatrix(rowCount, columnCount);
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                Expression entry = get(i, j);
                if (!Constant.isZero(entry)) {
                    matrix.set(i, j, Expressions.evaluate(entry, values));
                }
            }
        }
        return matrix;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, columnCount, Arrays.hashCode(entries));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof SymbolicMatrix other) {
            return rowCount == other.rowCount && columnCount == other.columnCount && Arrays.equals(entries, other.entries);
        }
        return false;
    }

    @Override
    public String toString() {
        StringJoiner rows = new StringJoiner("; ", "[", "]");
        for (int i = 0; i < rowCount; i++) {
            StringJoiner row = new StringJoiner(", ");
            for (int j = 0; j < columnCount; j++) {
                row.add(get(i, j).toString());
            }
            rows.add(row.toString());
        }
        return rows.toString();
    }
}
