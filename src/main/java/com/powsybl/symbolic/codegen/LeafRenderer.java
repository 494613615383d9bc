/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import java.util.List;

/**
 * Strategy rendering the leaves bound to function arguments in emitted source.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface LeafRenderer {

    /**
     * Statements to emit at the beginning of a function body, one per line, before any leaf is rendered.
     */
    List<String> renderPrologue(List<ArgumentGroup> groups);

    /**
     * Render the symbol at {@code position} of an argument group.
     */
    String renderLeaf(ArgumentGroup group, int position);
}
