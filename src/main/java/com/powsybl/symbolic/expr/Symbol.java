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
 * Named atomic quantity. A state symbol declares the symbols it implicitly depends on, usually the
 * independent variable, which makes its derivative with respect to them an unexpanded differential.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Symbol extends AbstractExpression {

    /**
     * Origin of a symbol introduced by order lowering: the {@code order}-th derivative of {@code base}.
     */
    public record Origin(Symbol base, int order) {

        public Origin {
            Objects.requireNonNull(base);
            if (order < 1) {
                throw new IllegalArgumentException("Invalid derivative order: " + order);
            }
        }
    }

    private final String name;

    private final SymbolRole role;

    private final List<Symbol> dependencies;

    private final Double value;

    private final Origin origin;

    private Symbol(String name, SymbolRole role, List<Symbol> dependencies, Double value, Origin origin) {
        this.name = Objects.requireNonNull(name);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Symbol name is empty");
        }
        this.role = Objects.requireNonNull(role);
        this.dependencies = List.copyOf(dependencies);
        this.value = value;
        this.origin = origin;
    }

    public static Symbol independentVariable(String name) {
        return new Symbol(name, SymbolRole.INDEPENDENT_VARIABLE, Collections.emptyList(), null, null);
    }

    public static Symbol state(String name, Symbol... dependencies) {
        return new Symbol(name, SymbolRole.STATE, Arrays.asList(dependencies), null, null);
    }

    public static Symbol parameter(String name) {
        return new Symbol(name, SymbolRole.PARAMETER, Collections.emptyList(), null, null);
    }

    public static Symbol parameter(String name, Symbol... dependencies) {
        return new Symbol(name, SymbolRole.PARAMETER, Arrays.asList(dependencies), null, null);
    }

    public static Symbol constant(String name, double value) {
        return new Symbol(name, SymbolRole.CONSTANT, Collections.emptyList(), value, null);
    }

    /**
     * Create a factor introduced by derivative matrix transforms. It never equals a symbol of another role,
     * so it cannot be captured by a user parameter with the same name.
     */
    public static Symbol scalingFactor(String name) {
        return new Symbol(name, SymbolRole.SCALING_FACTOR, Collections.emptyList(), null, null);
    }

    /**
     * Create the state standing for the {@code order}-th derivative of {@code base}. Two auxiliary symbols
     * are equal only if they share base and order, whatever their name.
     */
    public static Symbol auxiliary(String name, Symbol base, int order) {
        Objects.requireNonNull(base);
        return new Symbol(name, SymbolRole.STATE, base.dependencies, null, new Origin(base, order));
    }

    public String getName() {
        return name;
    }

    public SymbolRole getRole() {
        return role;
    }

    public List<Symbol> getDependencies() {
        return dependencies;
    }

    public OptionalDouble getValue() {
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }

    public Optional<Origin> getOrigin() {
        return Optional.ofNullable(origin);
    }

    /**
     * Check if this symbol depends, directly or through its own dependencies, on another one.
     */
    public boolean dependsOn(Symbol other) {
        Objects.requireNonNull(other);
        for (Symbol dependency : dependencies) {
            if (dependency.equals(other) || dependency.dependsOn(other)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.SYMBOL;
    }

    @Override
    public List<Expression> getChildren() {
        return Collections.emptyList();
    }

    @Override
    protected Expression withChildren(List<Expression> children) {
        return this;
    }

    @Override
    protected void collectFreeSymbols(Set<Symbol> symbols) {
        symbols.add(this);
    }

    @Override
    protected int computeHashCode() {
        return Objects.hash(name, role, dependencies, origin);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Symbol other) {
            return name.equals(other.name)
                    && role == other.role
                    && dependencies.equals(other.dependencies)
                    && Objects.equals(value, other.value)
                    && Objects.equals(origin, other.origin);
        }
        return false;
    }

    @Override
    public String toString() {
        return name;
    }
}
