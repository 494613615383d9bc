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
 * Raised by Hessian sparsity analysis when an operator has no registered linearity class.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class UnknownLinearityException extends SymbolicException {

    private final transient Operator operator;

    public UnknownLinearityException(Operator operator) {
        super("Function of unknown linearity used: '" + Objects.requireNonNull(operator).getName() + "'");
        this.operator = operator;
    }

    public Operator getOperator() {
        return operator;
    }
}
