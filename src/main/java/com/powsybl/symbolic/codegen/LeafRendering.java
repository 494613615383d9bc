/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

/**
 * Built-in leaf rendering strategies.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public enum LeafRendering {
    PLAIN_IDENTIFIER, // arguments unpacked into local variables
    INDEXED; // direct container access like u[0]

    public LeafRenderer createRenderer() {
        return switch (this) {
            case PLAIN_IDENTIFIER -> new PlainIdentifierRenderer();
            case INDEXED -> new IndexedAccessRenderer();
        };
    }
}
