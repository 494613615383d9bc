/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.*;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public abstract class AbstractExpression implements Expression {

    private int hash;

    protected abstract int computeHashCode();

    /**
     * Rebuild this node with new children, children count being unchanged.
     */
    protected abstract Expression withChildren(List<Expression> children);

    @Override
    public Expression substitute(Map<? extends Expression, ? extends Expression> substitutions) {
        Objects.requireNonNull(substitutions);
        if (substitutions.isEmpty()) {
            return this;
        }
        Expression replacement = substitutions.get(this);
        if (replacement != null) {
            return replacement;
        }
        List<Expression> children = getChildren();
        if (children.isEmpty()) {
            return this;
        }
        List<Expression> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (Expression child : children) {
            Expression newChild = child.substitute(substitutions);
            changed |= newChild != child;
            newChildren.add(newChild);
        }
        return changed ? withChildren(newChildren) : this;
    }

    @Override
    public Set<Symbol> getFreeSymbols() {
        Set<Symbol> symbols = new LinkedHashSet<>();
        collectFreeSymbols(symbols);
        return symbols;
    }

    protected void collectFreeSymbols(Set<Symbol> symbols) {
        for (Expression child : getChildren()) {
            if (child instanceof AbstractExpression abstractChild) {
                abstractChild.collectFreeSymbols(symbols);
            } else {
                symbols.addAll(child.getFreeSymbols());
            }
        }
    }

    @Override
    public boolean contains(Expression other) {
        Objects.requireNonNull(other);
        if (equals(other)) {
            return true;
        }
        for (Expression child : getChildren()) {
            if (child.contains(other)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = computeHashCode();
            hash = h;
        }
        return h;
    }
}
