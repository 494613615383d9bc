/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.Collections;
import java.util.List;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Constant extends AbstractExpression {

    public static final Constant ZERO = new Constant(0);

    public static final Constant ONE = new Constant(1);

    public static final Constant MINUS_ONE = new Constant(-1);

    private final double value;

    private Constant(double value) {
        this.value = value;
    }

    public static Constant of(double value) {
        if (value == 0) {
            return ZERO; // also folds -0.0
        }
        if (value == 1) {
            return ONE;
        }
        if (value == -1) {
            return MINUS_ONE;
        }
        return new Constant(value);
    }

    public double getValue() {
        return value;
    }

    public boolean isZero() {
        return value == 0;
    }

    public boolean isOne() {
        return value == 1;
    }

    public boolean isInteger() {
        return !Double.isInfinite(value) && value == Math.rint(value);
    }

    public static boolean isZero(Expression expr) {
        return expr instanceof Constant c && c.isZero();
    }

    public static boolean isOne(Expression expr) {
        return expr instanceof Constant c && c.isOne();
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.CONSTANT;
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    protected Expression withChildren(List<Expression> children) {
        return this;
    }

    @Override
    protected int computeHashCode() {
        return Double.hashCode(value);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Constant other) {
            return Double.compare(value, other.value) == 0;
        }
        return false;
    }

    @Override
    public String toString() {
        if (isInteger() && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
