/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic;

/**
 * Raised when symbolic LU factorization meets a pivot which is structurally zero.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SingularSymbolicFactorizationException extends SymbolicException {

    public SingularSymbolicFactorizationException(String message) {
        super(message);
    }
}
