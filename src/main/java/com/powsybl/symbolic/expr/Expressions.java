/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import com.powsybl.commons.PowsyblException;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Factory of expression nodes. No simplification is done here: {@code add(x, constant(0))} builds a
 * sum of two arguments.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Expressions {

    private Expressions() {
    }

    public static Constant constant(double value) {
        return Constant.of(value);
    }

    public static Expression apply(Operator operator, Expression... arguments) {
        return new Operation(operator, Arrays.asList(arguments));
    }

    public static Expression apply(Operator operator, List<? extends Expression> arguments) {
        return new Operation(operator, arguments);
    }

    public static Expression add(Expression... terms) {
        return apply(Operator.ADD, terms);
    }

    public static Expression add(List<? extends Expression> terms) {
        return apply(Operator.ADD, terms);
    }

    public static Expression multiply(Expression... factors) {
        return apply(Operator.MULTIPLY, factors);
    }

    public static Expression multiply(List<? extends Expression> factors) {
        return apply(Operator.MULTIPLY, factors);
    }

    public static Expression multiply(double factor, Expression expr) {
        return multiply(constant(factor), expr);
    }

    public static Expression subtract(Expression a, Expression b) {
        return apply(Operator.SUBTRACT, a, b);
    }

    public static Expression negate(Expression a) {
        return apply(Operator.NEGATE, a);
    }

    public static Expression divide(Expression a, Expression b) {
        return apply(Operator.DIVIDE, a, b);
    }

    public static Expression pow(Expression base, Expression exponent) {
        return apply(Operator.POWER, base, exponent);
    }

    public static Expression pow(Expression base, double exponent) {
        return pow(base, constant(exponent));
    }

    public static Expression sin(Expression a) {
        return apply(Operator.SIN, a);
    }

    public static Expression cos(Expression a) {
        return apply(Operator.COS, a);
    }

    public static Expression tan(Expression a) {
        return apply(Operator.TAN, a);
    }

    public static Expression exp(Expression a) {
        return apply(Operator.EXP, a);
    }

    public static Expression log(Expression a) {
        return apply(Operator.LOG, a);
    }

    public static Expression sqrt(Expression a) {
        return apply(Operator.SQRT, a);
    }

    public static Expression sinh(Expression a) {
        return apply(Operator.SINH, a);
    }

    public static Expression cosh(Expression a) {
        return apply(Operator.COSH, a);
    }

    public static Expression tanh(Expression a) {
        return apply(Operator.TANH, a);
    }

    public static Expression asin(Expression a) {
        return apply(Operator.ASIN, a);
    }

    public static Expression acos(Expression a) {
        return apply(Operator.ACOS, a);
    }

    public static Expression atan(Expression a) {
        return apply(Operator.ATAN, a);
    }

    public static Expression abs(Expression a) {
        return apply(Operator.ABS, a);
    }

    public static Expression sign(Expression a) {
        return apply(Operator.SIGN, a);
    }

    public static Expression differential(Expression expr, Symbol variable) {
        return differential(expr, variable, 1);
    }

    /**
     * Build the {@code order}-th derivative of an expression. Orders are composed when the expression is
     * already a differential with respect to the same variable.
     */
    public static Expression differential(Expression expr, Symbol variable, int order) {
        if (expr instanceof Differential d && d.getVariable().equals(variable)) {
            return new Differential(d.getArgument(), variable, d.getOrder() + order);
        }
        return new Differential(expr, variable, order);
    }

    /**
     * Numerically evaluate an expression. Every symbol must have a value in the map, except constant
     * symbols which carry their own value.
     */
    public static double evaluate(Expression expr, Map<Symbol, Double> values) {
        Objects.requireNonNull(expr);
        Objects.requireNonNull(values);
        switch (expr.getType()) {
            case CONSTANT:
                return ((Constant) expr).getValue();
            case SYMBOL:
                Symbol symbol = (Symbol) expr;
                Double value = values.get(symbol);
                if (value != null) {
                    return value;
                }
                return symbol.getValue().orElseThrow(() -> new PowsyblException("No value for symbol '" + symbol + "'"));
            case OPERATION:
                Operation operation = (Operation) expr;
                OperatorEvaluator evaluator = operation.getOperator().getEvaluator()
                        .orElseThrow(() -> new PowsyblException("Operator '" + operation.getOperator().getName() + "' cannot be evaluated"));
                List<Expression> arguments = operation.getArguments();
                double[] args = new double[arguments.size()];
                for (int i = 0; i < args.length; i++) {
                    args[i] = evaluate(arguments.get(i), values);
                }
                return evaluator.evaluate(args);
            case DIFFERENTIAL:
                throw new PowsyblException("Cannot evaluate unexpanded derivative " + expr);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }
}
