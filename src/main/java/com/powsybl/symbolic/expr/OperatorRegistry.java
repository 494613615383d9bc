/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.*;

import static com.powsybl.symbolic.expr.Expressions.*;

/**
 * Derivative rules and linearity classes of operators. A registry is an explicit value: it is created
 * once, populated, then passed to the components which need it.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class OperatorRegistry {

    private static final Map<Operator, DerivativeRule> DEFAULT_DERIVATIVE_RULES;

    private static final Map<Operator, Linearity> DEFAULT_LINEARITIES;

    static {
        Map<Operator, DerivativeRule> rules = new HashMap<>();
        rules.put(Operator.ADD, (args, i) -> Constant.ONE);
        rules.put(Operator.MULTIPLY, OperatorRegistry::productPartial);
        rules.put(Operator.SUBTRACT, (args, i) -> i == 0 ? Constant.ONE : Constant.MINUS_ONE);
        rules.put(Operator.NEGATE, (args, i) -> Constant.MINUS_ONE);
        rules.put(Operator.DIVIDE, (args, i) -> i == 0
                ? divide(Constant.ONE, args.get(1))
                : negate(divide(args.get(0), pow(args.get(1), 2))));
        rules.put(Operator.POWER, (args, i) -> i == 0
                ? multiply(args.get(1), pow(args.get(0), subtract(args.get(1), Constant.ONE)))
                : multiply(pow(args.get(0), args.get(1)), log(args.get(0))));
        rules.put(Operator.SIN, (args, i) -> cos(args.get(0)));
        rules.put(Operator.COS, (args, i) -> negate(sin(args.get(0))));
        rules.put(Operator.TAN, (args, i) -> add(Constant.ONE, pow(tan(args.get(0)), 2)));
        rules.put(Operator.EXP, (args, i) -> exp(args.get(0)));
        rules.put(Operator.LOG, (args, i) -> divide(Constant.ONE, args.get(0)));
        rules.put(Operator.SQRT, (args, i) -> divide(Constant.ONE, multiply(constant(2), sqrt(args.get(0)))));
        rules.put(Operator.SINH, (args, i) -> cosh(args.get(0)));
        rules.put(Operator.COSH, (args, i) -> sinh(args.get(0)));
        rules.put(Operator.TANH, (args, i) -> subtract(Constant.ONE, pow(tanh(args.get(0)), 2)));
        rules.put(Operator.ASIN, (args, i) -> divide(Constant.ONE, sqrt(subtract(Constant.ONE, pow(args.get(0), 2)))));
        rules.put(Operator.ACOS, (args, i) -> negate(divide(Constant.ONE, sqrt(subtract(Constant.ONE, pow(args.get(0), 2))))));
        rules.put(Operator.ATAN, (args, i) -> divide(Constant.ONE, add(Constant.ONE, pow(args.get(0), 2))));
        rules.put(Operator.ABS, (args, i) -> sign(args.get(0)));
        rules.put(Operator.SIGN, (args, i) -> Constant.ZERO);
        DEFAULT_DERIVATIVE_RULES = Collections.unmodifiableMap(rules);

        Map<Operator, Linearity> linearities = new HashMap<>();
        linearities.put(Operator.NEGATE, Linearity.LINEAR);
        linearities.put(Operator.ABS, Linearity.LINEAR);
        linearities.put(Operator.SIGN, Linearity.LINEAR);
        for (Operator operator : List.of(Operator.SIN, Operator.COS, Operator.TAN, Operator.EXP, Operator.LOG, Operator.SQRT,
                                         Operator.SINH, Operator.COSH, Operator.TANH, Operator.ASIN, Operator.ACOS, Operator.ATAN)) {
            linearities.put(operator, Linearity.NONLINEAR);
        }
        linearities.put(Operator.SUBTRACT, Linearity.binary(true, true, true));
        linearities.put(Operator.DIVIDE, Linearity.binary(true, false, false));
        linearities.put(Operator.POWER, Linearity.binary(false, false, false));
        DEFAULT_LINEARITIES = Collections.unmodifiableMap(linearities);
    }

    private final Map<Operator, DerivativeRule> derivativeRules;

    private final Map<Operator, Linearity> linearities;

    public OperatorRegistry() {
        this(Collections.emptyMap(), Collections.emptyMap());
    }

    private OperatorRegistry(Map<Operator, DerivativeRule> derivativeRules, Map<Operator, Linearity> linearities) {
        this.derivativeRules = new HashMap<>(derivativeRules);
        this.linearities = new HashMap<>(linearities);
    }

    /**
     * Create a registry pre-filled with the rules of all the built-in operators.
     */
    public static OperatorRegistry createDefault() {
        return new OperatorRegistry(DEFAULT_DERIVATIVE_RULES, DEFAULT_LINEARITIES);
    }

    private static Expression productPartial(List<Expression> args, int position) {
        List<Expression> others = new ArrayList<>(args.size() - 1);
        for (int i = 0; i < args.size(); i++) {
            if (i != position) {
                others.add(args.get(i));
            }
        }
        if (others.isEmpty()) {
            return Constant.ONE;
        }
        return others.size() == 1 ? others.get(0) : multiply(others);
    }

    public OperatorRegistry registerDerivative(Operator operator, DerivativeRule rule) {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(rule);
        derivativeRules.put(operator, rule);
        return this;
    }

    public Optional<DerivativeRule> getDerivativeRule(Operator operator) {
        return Optional.ofNullable(derivativeRules.get(Objects.requireNonNull(operator)));
    }

    public OperatorRegistry registerLinearity(Operator operator, Linearity linearity) {
        Objects.requireNonNull(operator);
        Objects.requireNonNull(linearity);
        if (!operator.isVariadic() && operator.getArity() != linearity.arity()) {
            throw new IllegalArgumentException("Linearity arity " + linearity.arity() + " does not match operator '"
                    + operator.getName() + "' arity " + operator.getArity());
        }
        linearities.put(operator, linearity);
        return this;
    }

    public Optional<Linearity> getLinearity(Operator operator) {
        return Optional.ofNullable(linearities.get(Objects.requireNonNull(operator)));
    }
}
