/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic;

import com.powsybl.commons.PowsyblException;

/**
 * Base class of the fatal errors raised by symbolic operations. Operations being pure and deterministic,
 * retrying without changing the input reproduces the same error.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SymbolicException extends PowsyblException {

    public SymbolicException(String message) {
        super(message);
    }
}
