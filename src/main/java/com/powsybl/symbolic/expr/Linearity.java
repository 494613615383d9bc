/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

/**
 * Linearity class of a unary or binary function, used by Hessian sparsity analysis.
 * <p>
 * For a unary function only {@code linearInFirst} is meaningful. For a binary function {@code f(a, b)},
 * {@code noInteraction} means that the mixed second derivative is structurally zero.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public record Linearity(int arity, boolean linearInFirst, boolean linearInSecond, boolean noInteraction) {

    public static final Linearity LINEAR = new Linearity(1, true, true, true);

    public static final Linearity NONLINEAR = new Linearity(1, false, true, true);

    public Linearity {
        if (arity != 1 && arity != 2) {
            throw new IllegalArgumentException("Linearity is only defined for unary and binary functions");
        }
    }

    public static Linearity binary(boolean linearInFirst, boolean linearInSecond, boolean noInteraction) {
        return new Linearity(2, linearInFirst, linearInSecond, noInteraction);
    }
}
