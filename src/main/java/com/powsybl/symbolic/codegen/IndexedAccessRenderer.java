/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import java.util.Collections;
import java.util.List;

/**
 * Render leaves as direct array accesses, like {@code u[0]}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class IndexedAccessRenderer implements LeafRenderer {

    @Override
    public List<String> renderPrologue(List<ArgumentGroup> groups) {
        return Collections.emptyList();
    }

    @Override
    public String renderLeaf(ArgumentGroup group, int position) {
        return group.getName() + "[" + position + "]";
    }
}
