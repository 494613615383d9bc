/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.lowering;

import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.expr.*;
import com.powsybl.symbolic.system.OdeSystem;
import org.apache.commons.lang3.mutable.MutableInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Rewrite a system with higher order derivatives of its states into an equivalent first order one.
 * <p>
 * For a state {@code u} whose highest derivative on a left hand side has order {@code n}, {@code n - 1}
 * auxiliary states {@code uˍt}, {@code uˍtt}, ... are introduced with the equations
 * {@code D(u) ~ uˍt}, {@code D(uˍt) ~ uˍtt}, .... Derivatives of order lower than {@code n} are replaced
 * by the matching auxiliary state everywhere in the original equations.
 * <p>
 * Auxiliary equations come first, grouped by state in order of first appearance and from the highest
 * order to the first one, followed by the rewritten original equations.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class OrderLowering {

    private static final Logger LOGGER = LoggerFactory.getLogger(OrderLowering.class);

    private final String separator;

    public OrderLowering() {
        this(new SymbolicParameters());
    }

    public OrderLowering(SymbolicParameters parameters) {
        this.separator = Objects.requireNonNull(parameters).getAuxiliaryNameSeparator();
    }

    /**
     * The state standing for the {@code order}-th derivative of {@code base}, {@code base} itself for
     * order 0.
     */
    public Symbol auxiliaryState(Symbol base, Symbol iv, int order) {
        if (order == 0) {
            return base;
        }
        return Symbol.auxiliary(base.getName() + separator + iv.getName().repeat(order), base, order);
    }

    private static Symbol getDifferentiatedState(Expression lhs, Symbol iv) {
        if (lhs instanceof Differential differential
                && differential.getVariable().equals(iv)
                && differential.getArgument() instanceof Symbol state) {
            return state;
        }
        return null;
    }

    public OdeSystem lowerOrder(OdeSystem system) {
        Objects.requireNonNull(system);
        Symbol iv = system.getIndependentVariable();

        List<Equation> equations = new ArrayList<>(system.getEquations().size());
        for (Equation equation : system.getEquations()) {
            equations.add(new Equation(normalize(equation.getLhs()), normalize(equation.getRhs())));
        }

        // highest derivative order of each state, in order of first appearance
        Map<Symbol, Integer> maxOrders = new LinkedHashMap<>();
        for (Equation equation : equations) {
            Symbol state = getDifferentiatedState(equation.getLhs(), iv);
            if (state != null) {
                maxOrders.merge(state, ((Differential) equation.getLhs()).getOrder(), Math::max);
            }
        }

        Map<Expression, Expression> substitutions = new HashMap<>();
        List<Equation> loweredEquations = new ArrayList<>();
        MutableInt auxiliaryCount = new MutableInt();
        maxOrders.forEach((state, maxOrder) -> {
            for (int k = maxOrder - 1; k >= 1; k--) {
                Symbol auxiliary = auxiliaryState(state, iv, k);
                substitutions.put(new Differential(state, iv, k), auxiliary);
                loweredEquations.add(new Equation(new Differential(auxiliaryState(state, iv, k - 1), iv, 1), auxiliary));
                auxiliaryCount.increment();
            }
        });

        for (Equation equation : equations) {
            Expression rhs = equation.getRhs().substitute(substitutions);
            Symbol state = getDifferentiatedState(equation.getLhs(), iv);
            Expression lhs;
            if (state != null && ((Differential) equation.getLhs()).getOrder() == maxOrders.get(state)) {
                lhs = new Differential(auxiliaryState(state, iv, maxOrders.get(state) - 1), iv, 1);
            } else {
                lhs = equation.getLhs().substitute(substitutions);
            }
            loweredEquations.add(new Equation(lhs, rhs));
        }

        Set<Symbol> states = new LinkedHashSet<>();
        for (Equation equation : loweredEquations) {
            Symbol state = getDifferentiatedState(equation.getLhs(), iv);
            if (state != null) {
                states.add(state);
            }
        }
        states.addAll(system.getStates());

        OdeSystem lowered = OdeSystem.builder(iv)
                .setName(system.getName())
                .addEquations(loweredEquations)
                .setStates(new ArrayList<>(states))
                .setParameters(system.getParameters())
                .build();

        LOGGER.debug("System '{}' lowered to first order: {} auxiliary states introduced", system.getName(), auxiliaryCount.intValue());

        return lowered;
    }

    /**
     * Merge nested derivatives with respect to the same variable, so that {@code D(D(u))} and
     * {@code D^2(u)} are matched the same way.
     */
    private static Expression normalize(Expression expr) {
        switch (expr.getType()) {
            case CONSTANT:
            case SYMBOL:
                return expr;
            case DIFFERENTIAL:
                Differential differential = (Differential) expr;
                return Expressions.differential(normalize(differential.getArgument()), differential.getVariable(), differential.getOrder());
            case OPERATION:
                Operation operation = (Operation) expr;
                List<Expression> args = new ArrayList<>(operation.getArguments().size());
                for (Expression arg : operation.getArguments()) {
                    args.add(normalize(arg));
                }
                return Expressions.apply(operation.getOperator(), args);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }
}
