/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic;

import com.powsybl.symbolic.expr.Operator;

import java.util.Objects;

/**
 * Raised when an operator has no derivative rule: a missing rule is never silently replaced by zero.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class UnregisteredDerivativeException extends SymbolicException {

    private final transient Operator operator;

    private final int argumentIndex;

    public UnregisteredDerivativeException(Operator operator, int argumentIndex) {
        super("No derivative rule registered for operator '" + Objects.requireNonNull(operator).getName()
                + "' and argument " + argumentIndex);
        this.operator = operator;
        this.argumentIndex = argumentIndex;
    }

    public Operator getOperator() {
        return operator;
    }

    public int getArgumentIndex() {
        return argumentIndex;
    }
}
