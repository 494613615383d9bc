/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.powsybl.symbolic.expr.*;

import java.util.*;

/**
 * Immutable system of equations with its ordered states, ordered parameters and independent variable.
 * Equality is identity: two systems built from the same equations are distinct cache keys.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class OdeSystem {

    public static final class Builder {

        private final Symbol independentVariable;

        private final List<Equation> equations = new ArrayList<>();

        private List<Symbol> states;

        private List<Symbol> parameters;

        private String name = "system";

        private Builder(Symbol independentVariable) {
            this.independentVariable = Objects.requireNonNull(independentVariable);
            if (independentVariable.getRole() != SymbolRole.INDEPENDENT_VARIABLE) {
                throw new IllegalArgumentException("Symbol '" + independentVariable + "' is not an independent variable");
            }
        }

        public Builder setName(String name) {
            this.name = Objects.requireNonNull(name);
            return this;
        }

        public Builder addEquation(Equation equation) {
            equations.add(Objects.requireNonNull(equation));
            return this;
        }

        public Builder addEquation(Expression lhs, Expression rhs) {
            return addEquation(new Equation(lhs, rhs));
        }

        public Builder addEquations(List<Equation> equations) {
            equations.forEach(this::addEquation);
            return this;
        }

        /**
         * If not set, states are inferred from the equations in order of first appearance.
         */
        public Builder setStates(List<Symbol> states) {
            this.states = checkRole(states, SymbolRole.STATE);
            return this;
        }

        /**
         * If not set, parameters are inferred from the equations in order of first appearance.
         */
        public Builder setParameters(List<Symbol> parameters) {
            this.parameters = checkRole(parameters, SymbolRole.PARAMETER);
            return this;
        }

        private static List<Symbol> checkRole(List<Symbol> symbols, SymbolRole role) {
            Objects.requireNonNull(symbols);
            Set<Symbol> unique = new HashSet<>();
            for (Symbol symbol : symbols) {
                if (Objects.requireNonNull(symbol).getRole() != role) {
                    throw new IllegalArgumentException("Symbol '" + symbol + "' is a " + symbol.getRole() + ", not a " + role);
                }
                if (!unique.add(symbol)) {
                    throw new IllegalArgumentException("Symbol '" + symbol + "' is declared twice");
                }
            }
            return List.copyOf(symbols);
        }

        private List<Symbol> inferSymbols(SymbolRole role) {
            Set<Symbol> symbols = new LinkedHashSet<>();
            for (Equation equation : equations) {
                for (Symbol symbol : equation.getLhs().getFreeSymbols()) {
                    if (symbol.getRole() == role) {
                        symbols.add(symbol);
                    }
                }
            }
            for (Equation equation : equations) {
                for (Symbol symbol : equation.getRhs().getFreeSymbols()) {
                    if (symbol.getRole() == role) {
                        symbols.add(symbol);
                    }
                }
            }
            return List.copyOf(symbols);
        }

        public OdeSystem build() {
            return new OdeSystem(name,
                                 independentVariable,
                                 List.copyOf(equations),
                                 states != null ? states : inferSymbols(SymbolRole.STATE),
                                 parameters != null ? parameters : inferSymbols(SymbolRole.PARAMETER));
        }
    }

    private final String name;

    private final Symbol independentVariable;

    private final List<Equation> equations;

    private final List<Symbol> states;

    private final List<Symbol> parameters;

    private OdeSystem(String name, Symbol independentVariable, List<Equation> equations, List<Symbol> states, List<Symbol> parameters) {
        this.name = name;
        this.independentVariable = independentVariable;
        this.equations = equations;
        this.states = states;
        this.parameters = parameters;
    }

    public static Builder builder(Symbol independentVariable) {
        return new Builder(independentVariable);
    }

    public String getName() {
        return name;
    }

    public Symbol getIndependentVariable() {
        return independentVariable;
    }

    public List<Equation> getEquations() {
        return equations;
    }

    public List<Symbol> getStates() {
        return states;
    }

    public List<Symbol> getParameters() {
        return parameters;
    }

    public List<Expression> getRightHandSides() {
        return equations.stream().map(Equation::getRhs).toList();
    }

    @Override
    public String toString() {
        return "OdeSystem(name=" + name + ", equations=" + equations.size() + ", states=" + states
                + ", parameters=" + parameters + ")";
    }
}
