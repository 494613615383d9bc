/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.SymbolicException;
import com.powsybl.symbolic.expr.*;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Render expressions as Java source. Every infix operation is parenthesized.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class JavaSourceEmitter {

    private static final Map<Operator, String> MATH_FUNCTIONS = Map.ofEntries(
            Map.entry(Operator.SIN, "Math.sin"),
            Map.entry(Operator.COS, "Math.cos"),
            Map.entry(Operator.TAN, "Math.tan"),
            Map.entry(Operator.EXP, "Math.exp"),
            Map.entry(Operator.LOG, "Math.log"),
            Map.entry(Operator.SQRT, "Math.sqrt"),
            Map.entry(Operator.SINH, "Math.sinh"),
            Map.entry(Operator.COSH, "Math.cosh"),
            Map.entry(Operator.TANH, "Math.tanh"),
            Map.entry(Operator.ASIN, "Math.asin"),
            Map.entry(Operator.ACOS, "Math.acos"),
            Map.entry(Operator.ATAN, "Math.atan"),
            Map.entry(Operator.ABS, "Math.abs"),
            Map.entry(Operator.SIGN, "Math.signum"),
            Map.entry(Operator.POWER, "Math.pow"));

    private final ArgumentBindings bindings;

    private final LeafRenderer renderer;

    public JavaSourceEmitter(ArgumentBindings bindings, LeafRenderer renderer) {
        this.bindings = Objects.requireNonNull(bindings);
        this.renderer = Objects.requireNonNull(renderer);
    }

    public List<String> emitPrologue() {
        return renderer.renderPrologue(bindings.getGroups());
    }

    public String emit(Expression expr) {
        switch (expr.getType()) {
            case CONSTANT:
                return emitConstant(((Constant) expr).getValue());
            case SYMBOL:
                Symbol symbol = (Symbol) expr;
                ArgumentBindings.Binding binding = bindings.getBinding(symbol).orElse(null);
                if (binding != null) {
                    return renderer.renderLeaf(bindings.getGroups().get(binding.group()), binding.position());
                }
                return emitConstant(symbol.getValue()
                        .orElseThrow(() -> new ShapeMismatchException("Symbol '" + symbol + "' is not bound to any argument")));
            case OPERATION:
                return emitOperation((Operation) expr);
            case DIFFERENTIAL:
                throw new SymbolicException("Cannot emit unexpanded derivative " + expr);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }

    static String emitConstant(double value) {
        if (Double.isNaN(value)) {
            return "Double.NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        }
        String literal = Double.toString(value);
        return value < 0 ? "(" + literal + ")" : literal;
    }

    private String emitOperation(Operation operation) {
        Operator operator = operation.getOperator();
        List<Expression> args = operation.getArguments();
        if (operator.equals(Operator.NEGATE)) {
            return "(-" + emit(args.get(0)) + ")";
        }
        String function = MATH_FUNCTIONS.get(operator);
        if (function == null && operator.getNotation() == Operator.Notation.INFIX) {
            StringJoiner joiner = new StringJoiner(" " + operator.getName() + " ", "(", ")");
            for (Expression arg : args) {
                joiner.add(emit(arg));
            }
            return joiner.toString();
        }
        StringJoiner joiner = new StringJoiner(", ", (function != null ? function : operator.getName()) + "(", ")");
        for (Expression arg : args) {
            joiner.add(emit(arg));
        }
        return joiner.toString();
    }
}
