/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Not yet expanded derivative of an expression. The differentiation variable is always a symbol.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Differential extends AbstractExpression {

    private final Expression argument;

    private final Symbol variable;

    private final int order;

    public Differential(Expression argument, Symbol variable, int order) {
        this.argument = Objects.requireNonNull(argument);
        this.variable = Objects.requireNonNull(variable);
        if (order < 1) {
            throw new IllegalArgumentException("Invalid differential order: " + order);
        }
        this.order = order;
    }

    public Expression getArgument() {
        return argument;
    }

    public Symbol getVariable() {
        return variable;
    }

    public int getOrder() {
        return order;
    }

    /**
     * A differential is irreducible when it wraps, possibly through other irreducible differentials, a
     * symbol depending on the differentiation variable: it cannot be expanded any further.
     */
    public boolean isIrreducible() {
        Symbol base = getBaseSymbol();
        if (base == null || !base.dependsOn(variable)) {
            return false;
        }
        return !(argument instanceof Differential inner) || inner.isIrreducible();
    }

    /**
     * Get the symbol at the bottom of a chain of differentials, or null if the chain ends on a composite
     * expression.
     */
    public Symbol getBaseSymbol() {
        Expression current = argument;
        while (current instanceof Differential inner) {
            current = inner.argument;
        }
        return current instanceof Symbol symbol ? symbol : null;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.DIFFERENTIAL;
    }

    @Override
    public List<Expression> getChildren() {
        return List.of(argument);
    }

    @Override
    protected Expression withChildren(List<Expression> children) {
        return new Differential(children.get(0), variable, order);
    }

    @Override
    protected void collectFreeSymbols(Set<Symbol> symbols) {
        super.collectFreeSymbols(symbols);
        symbols.add(variable);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(argument, variable, order);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Differential other) {
            return order == other.order && variable.equals(other.variable) && argument.equals(other.argument);
        }
        return false;
    }

    @Override
    public String toString() {
        return "D(" + variable + (order > 1 ? "^" + order : "") + ")(" + argument + ")";
    }
}
