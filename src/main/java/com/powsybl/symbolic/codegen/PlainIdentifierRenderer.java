/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import com.powsybl.symbolic.expr.Symbol;

import java.util.*;

import javax.lang.model.SourceVersion;

/**
 * Unpack arguments into local variables named after their symbols, like {@code double x = u[0];}, and
 * render leaves as these locals. Names which are not valid Java identifiers or which collide are
 * made unique with a numeric suffix.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class PlainIdentifierRenderer implements LeafRenderer {

    private final Map<ArgumentGroup, String[]> localNames = new IdentityHashMap<>();

    @Override
    public synchronized List<String> renderPrologue(List<ArgumentGroup> groups) {
        localNames.clear();
        Set<String> usedNames = new HashSet<>();
        usedNames.add(FunctionGenerator.OUTPUT_NAME);
        for (ArgumentGroup group : groups) {
            usedNames.add(group.getName());
        }
        List<String> lines = new ArrayList<>();
        for (ArgumentGroup group : groups) {
            String[] names = new String[group.size()];
            for (int i = 0; i < group.size(); i++) {
                String name = uniqueName(sanitize(group.getSymbols().get(i)), usedNames);
                names[i] = name;
                lines.add("double " + name + " = " + group.getName() + "[" + i + "];");
            }
            localNames.put(group, names);
        }
        return lines;
    }

    private static String sanitize(Symbol symbol) {
        String name = symbol.getName();
        StringBuilder builder = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            builder.append(Character.isJavaIdentifierPart(c) && c != '$' ? c : '_');
        }
        if (!Character.isJavaIdentifierStart(builder.charAt(0))) {
            builder.insert(0, '_');
        }
        if (SourceVersion.isKeyword(builder)) {
            builder.append('_');
        }
        return builder.toString();
    }

    private static String uniqueName(String name, Set<String> usedNames) {
        String uniqueName = name;
        int suffix = 1;
        while (!usedNames.add(uniqueName)) {
            uniqueName = name + "_" + suffix++;
        }
        return uniqueName;
    }

    @Override
    public synchronized String renderLeaf(ArgumentGroup group, int position) {
        String[] names = localNames.get(group);
        if (names == null) {
            throw new IllegalStateException("Prologue has not been rendered for argument group '" + group.getName() + "'");
        }
        return names[position];
    }
}
