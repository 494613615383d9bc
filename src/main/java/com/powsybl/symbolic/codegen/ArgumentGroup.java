/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import com.powsybl.symbolic.expr.Symbol;

import java.util.List;
import java.util.Objects;

/**
 * Ordered group of symbols bound to one argument of a generated function. A scalar group is passed as a
 * one element array.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class ArgumentGroup {

    private final String name;

    private final List<Symbol> symbols;

    private final boolean scalar;

    private ArgumentGroup(String name, List<Symbol> symbols, boolean scalar) {
        this.name = Objects.requireNonNull(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Argument group name is empty");
        }
        this.symbols = List.copyOf(symbols);
        this.scalar = scalar;
    }

    public static ArgumentGroup vector(String name, List<Symbol> symbols) {
        return new ArgumentGroup(name, symbols, false);
    }

    public static ArgumentGroup scalar(String name, Symbol symbol) {
        return new ArgumentGroup(name, List.of(symbol), true);
    }

    public String getName() {
        return name;
    }

    public List<Symbol> getSymbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    public boolean isScalar() {
        return scalar;
    }

    @Override
    public String toString() {
        return name + symbols;
    }
}
