/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.expr.SymbolRole;

import java.util.*;

/**
 * Position of every bound symbol within the argument groups of a generated function.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class ArgumentBindings {

    public record Binding(int group, int position) {
    }

    private final List<ArgumentGroup> groups;

    private final Map<Symbol, Binding> bindings = new HashMap<>();

    public ArgumentBindings(List<ArgumentGroup> groups) {
        this.groups = List.copyOf(groups);
        Set<String> names = new HashSet<>();
        for (int g = 0; g < this.groups.size(); g++) {
            ArgumentGroup group = this.groups.get(g);
            if (!names.add(group.getName())) {
                throw new ShapeMismatchException("Duplicate argument group name '" + group.getName() + "'");
            }
            for (int i = 0; i < group.size(); i++) {
                Symbol symbol = group.getSymbols().get(i);
                Binding previous = bindings.putIfAbsent(symbol, new Binding(g, i));
                if (previous != null) {
                    throw new ShapeMismatchException("Symbol '" + symbol + "' is bound twice: in argument '"
                            + this.groups.get(previous.group()).getName() + "' and in argument '" + group.getName() + "'");
                }
            }
        }
    }

    public List<ArgumentGroup> getGroups() {
        return groups;
    }

    public Optional<Binding> getBinding(Symbol symbol) {
        return Optional.ofNullable(bindings.get(symbol));
    }

    /**
     * Check that every free symbol of the expressions is either bound or a constant with a value.
     */
    public void checkBound(Collection<? extends Expression> exprs) {
        for (Expression expr : exprs) {
            for (Symbol symbol : expr.getFreeSymbols()) {
                if (!bindings.containsKey(symbol)
                        && (symbol.getRole() != SymbolRole.CONSTANT || symbol.getValue().isEmpty())) {
                    throw new ShapeMismatchException("Symbol '" + symbol + "' is not bound to any argument");
                }
            }
        }
    }

    /**
     * Check runtime arguments against the declared groups.
     */
    public void checkArguments(double[][] args) {
        if (args == null || args.length != groups.size()) {
            throw new ShapeMismatchException("Expected " + groups.size() + " arguments, got " + (args == null ? 0 : args.length));
        }
        for (int g = 0; g < args.length; g++) {
            ArgumentGroup group = groups.get(g);
            if (args[g] == null || args[g].length != group.size()) {
                throw new ShapeMismatchException("Argument '" + group.getName() + "' is expected to have length "
                        + group.size() + ", got " + (args[g] == null ? "null" : args[g].length));
            }
        }
    }
}
