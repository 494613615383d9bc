/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.Map;
import java.util.Objects;

/**
 * Equality between two expressions. This is not an assignment.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Equation {

    private final Expression lhs;

    private final Expression rhs;

    public Equation(Expression lhs, Expression rhs) {
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    public Expression getLhs() {
        return lhs;
    }

    public Expression getRhs() {
        return rhs;
    }

    /**
     * Check if the left hand side is a derivative, that is if this equation is a differential one and not
     * an algebraic constraint.
     */
    public boolean isDifferential() {
        return lhs instanceof Differential;
    }

    public Equation substitute(Map<? extends Expression, ? extends Expression> substitutions) {
        Expression newLhs = lhs.substitute(substitutions);
        Expression newRhs = rhs.substitute(substitutions);
        return newLhs == lhs && newRhs == rhs ? this : new Equation(newLhs, newRhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, rhs);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Equation other) {
            return lhs.equals(other.lhs) && rhs.equals(other.rhs);
        }
        return false;
    }

    @Override
    public String toString() {
        return lhs + " ~ " + rhs;
    }
}
