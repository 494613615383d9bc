/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.List;

/**
 * Partial derivative of an operator with respect to one of its argument positions, expressed on the
 * actual arguments. The chain rule is applied by the caller.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
@FunctionalInterface
public interface DerivativeRule {

    Expression partial(List<Expression> args, int position);
}
