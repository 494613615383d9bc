/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import net.jafama.FastMath;

import java.util.Objects;
import java.util.Optional;

/**
 * Identity of an operation node. Built-in operators are the static constants of this class, user
 * functions are created with {@link #function(String, int, OperatorEvaluator)}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Operator {

    public static final int VARIADIC = -1;

    public enum Notation {
        INFIX,
        PREFIX,
        FUNCTION,
    }

    public static final Operator ADD = new Operator("+", VARIADIC, Notation.INFIX, 1, true, true, args -> {
        double sum = 0;
        for (double arg : args) {
            sum += arg;
        }
        return sum;
    });

    public static final Operator MULTIPLY = new Operator("*", VARIADIC, Notation.INFIX, 2, true, true, args -> {
        double product = 1;
        for (double arg : args) {
            product *= arg;
        }
        return product;
    });

    public static final Operator SUBTRACT = new Operator("-", 2, Notation.INFIX, 1, false, false, args -> args[0] - args[1]);

    public static final Operator DIVIDE = new Operator("/", 2, Notation.INFIX, 2, false, false, args -> args[0] / args[1]);

    public static final Operator NEGATE = new Operator("-", 1, Notation.PREFIX, 3, false, false, args -> -args[0]);

    public static final Operator POWER = new Operator("^", 2, Notation.INFIX, 4, false, false, args -> FastMath.pow(args[0], args[1]));

    public static final Operator SIN = unary("sin", args -> FastMath.sin(args[0]));

    public static final Operator COS = unary("cos", args -> FastMath.cos(args[0]));

    public static final Operator TAN = unary("tan", args -> FastMath.tan(args[0]));

    public static final Operator EXP = unary("exp", args -> FastMath.exp(args[0]));

    public static final Operator LOG = unary("log", args -> FastMath.log(args[0]));

    public static final Operator SQRT = unary("sqrt", args -> FastMath.sqrt(args[0]));

    public static final Operator SINH = unary("sinh", args -> FastMath.sinh(args[0]));

    public static final Operator COSH = unary("cosh", args -> FastMath.cosh(args[0]));

    public static final Operator TANH = unary("tanh", args -> FastMath.tanh(args[0]));

    public static final Operator ASIN = unary("asin", args -> FastMath.asin(args[0]));

    public static final Operator ACOS = unary("acos", args -> FastMath.acos(args[0]));

    public static final Operator ATAN = unary("atan", args -> FastMath.atan(args[0]));

    public static final Operator ABS = unary("abs", args -> Math.abs(args[0]));

    public static final Operator SIGN = unary("sign", args -> Math.signum(args[0]));

    private final String name;

    private final int arity;

    private final Notation notation;

    private final int precedence;

    private final boolean associative;

    private final boolean commutative;

    private final OperatorEvaluator evaluator;

    private Operator(String name, int arity, Notation notation, int precedence, boolean associative, boolean commutative,
                     OperatorEvaluator evaluator) {
        this.name = Objects.requireNonNull(name);
        if (arity < VARIADIC || arity == 0) {
            throw new IllegalArgumentException("Invalid arity: " + arity);
        }
        this.arity = arity;
        this.notation = Objects.requireNonNull(notation);
        this.precedence = precedence;
        this.associative = associative;
        this.commutative = commutative;
        this.evaluator = evaluator;
    }

    private static Operator unary(String name, OperatorEvaluator evaluator) {
        return new Operator(name, 1, Notation.FUNCTION, Integer.MAX_VALUE, false, false, evaluator);
    }

    /**
     * Create a user function with a numeric evaluator, which may be null if the function is only used
     * symbolically.
     */
    public static Operator function(String name, int arity, OperatorEvaluator evaluator) {
        return new Operator(name, arity, Notation.FUNCTION, Integer.MAX_VALUE, false, false, evaluator);
    }

    public static Operator function(String name, int arity) {
        return function(name, arity, null);
    }

    public String getName() {
        return name;
    }

    public int getArity() {
        return arity;
    }

    public boolean isVariadic() {
        return arity == VARIADIC;
    }

    public Notation getNotation() {
        return notation;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isAssociative() {
        return associative;
    }

    public boolean isCommutative() {
        return commutative;
    }

    public Optional<OperatorEvaluator> getEvaluator() {
        return Optional.ofNullable(evaluator);
    }

    public boolean acceptsArgumentCount(int count) {
        return arity == VARIADIC ? count >= 1 : count == arity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arity, notation);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Operator other) {
            return name.equals(other.name) && arity == other.arity && notation == other.notation;
        }
        return false;
    }

    @Override
    public String toString() {
        return "Operator(name=" + name + ", arity=" + (arity == VARIADIC ? "n" : Integer.toString(arity)) + ")";
    }
}
