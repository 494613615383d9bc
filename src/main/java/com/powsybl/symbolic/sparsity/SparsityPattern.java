/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.sparsity;

import gnu.trove.list.array.TIntArrayList;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Objects;

/**
 * Immutable boolean matrix of structurally nonzero entries.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class SparsityPattern {

    @FunctionalInterface
    public interface NonZeroHandler {

        void onNonZero(int row, int column);
    }

    public static final class Builder {

        private final int rowCount;

        private final int columnCount;

        private final BitSet[] rows;

        private Builder(int rowCount, int columnCount) {
            this.rowCount = rowCount;
            this.columnCount = columnCount;
            rows = new BitSet[rowCount];
            for (int i = 0; i < rowCount; i++) {
                rows[i] = new BitSet(columnCount);
            }
        }

        public Builder set(int row, int column) {
            Objects.checkIndex(row, rowCount);
            Objects.checkIndex(column, columnCount);
            rows[row].set(column);
            return this;
        }

        public SparsityPattern build() {
            BitSet[] copy = new BitSet[rowCount];
            for (int i = 0; i < rowCount; i++) {
                copy[i] = (BitSet) rows[i].clone();
            }
            return new SparsityPattern(rowCount, columnCount, copy);
        }
    }

    private final int rowCount;

    private final int columnCount;

    private final BitSet[] rows;

    private SparsityPattern(int rowCount, int columnCount, BitSet[] rows) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.rows = rows;
    }

    public static Builder builder(int rowCount, int columnCount) {
        if (rowCount < 0 || columnCount < 0) {
            throw new IllegalArgumentException("Invalid sparsity pattern size: " + rowCount + "x" + columnCount);
        }
        return new Builder(rowCount, columnCount);
    }

    public static SparsityPattern dense(int rowCount, int columnCount) {
        Builder builder = builder(rowCount, columnCount);
        for (int i = 0; i < rowCount; i++) {
            builder.rows[i].set(0, columnCount);
        }
        return builder.build();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public boolean isNonZero(int row, int column) {
        Objects.checkIndex(row, rowCount);
        Objects.checkIndex(column, columnCount);
        return rows[row].get(column);
    }

    public int getNonZeroCount() {
        int count = 0;
        for (BitSet row : rows) {
            count += row.cardinality();
        }
        return count;
    }

    /**
     * Iterate over nonzero entries, row by row.
     */
    public void forEachNonZero(NonZeroHandler handler) {
        Objects.requireNonNull(handler);
        for (int i = 0; i < rowCount; i++) {
            BitSet row = rows[i];
            for (int j = row.nextSetBit(0); j >= 0; j = row.nextSetBit(j + 1)) {
                handler.onNonZero(i, j);
            }
        }
    }

    public TIntArrayList getRowIndices() {
        TIntArrayList indices = new TIntArrayList(getNonZeroCount());
        forEachNonZero((row, column) -> indices.add(row));
        return indices;
    }

    public TIntArrayList getColumnIndices() {
        TIntArrayList indices = new TIntArrayList(getNonZeroCount());
        forEachNonZero((row, column) -> indices.add(column));
        return indices;
    }

    public SparsityPattern transpose() {
        Builder builder = builder(columnCount, rowCount);
        forEachNonZero((row, column) -> builder.set(column, row));
        return builder.build();
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowCount, columnCount, Arrays.hashCode(rows));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof SparsityPattern other) {
            return rowCount == other.rowCount && columnCount == other.columnCount && Arrays.equals(rows, other.rows);
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                builder.append(rows[i].get(j) ? '1' : '0');
            }
            if (i < rowCount - 1) {
                builder.append(System.lineSeparator());
            }
        }
        return builder.toString();
    }
}
