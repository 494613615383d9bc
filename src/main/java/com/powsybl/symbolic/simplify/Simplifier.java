/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.simplify;

import com.powsybl.symbolic.expr.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bottom-up rewrite pass: constant folding, flattening of nested sums and products, identity elimination,
 * subtraction and negation normalization and trivial power laws.
 * <p>
 * Constants are gathered into a single factor placed first in products and a single term placed last in
 * sums. The other arguments keep their order, so two expressions equal up to commutativity may still
 * simplify to different trees.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class Simplifier {

    public Expression simplify(Expression expr) {
        Objects.requireNonNull(expr);
        switch (expr.getType()) {
            case CONSTANT:
            case SYMBOL:
                return expr;
            case DIFFERENTIAL:
                return simplifyDifferential((Differential) expr);
            case OPERATION:
                Operation operation = (Operation) expr;
                List<Expression> args = new ArrayList<>(operation.getArguments().size());
                for (Expression arg : operation.getArguments()) {
                    args.add(simplify(arg));
                }
                return simplifyOperation(operation.getOperator(), args);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }

    public List<Expression> simplify(List<? extends Expression> exprs) {
        List<Expression> simplified = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            simplified.add(simplify(expr));
        }
        return simplified;
    }

    public Equation simplify(Equation equation) {
        return new Equation(simplify(equation.getLhs()), simplify(equation.getRhs()));
    }

    private Expression simplifyDifferential(Differential differential) {
        Expression arg = simplify(differential.getArgument());
        if (arg instanceof Constant) {
            return Constant.ZERO;
        }
        return Expressions.differential(arg, differential.getVariable(), differential.getOrder());
    }

    private Expression simplifyOperation(Operator operator, List<Expression> args) {
        if (operator.equals(Operator.ADD)) {
            return simplifySum(args);
        } else if (operator.equals(Operator.MULTIPLY)) {
            return simplifyProduct(args);
        } else if (operator.equals(Operator.SUBTRACT)) {
            return simplifySum(List.of(args.get(0), simplifyProduct(List.of(Constant.MINUS_ONE, args.get(1)))));
        } else if (operator.equals(Operator.NEGATE)) {
            return simplifyProduct(List.of(Constant.MINUS_ONE, args.get(0)));
        } else if (operator.equals(Operator.DIVIDE)) {
            return simplifyDivision(args.get(0), args.get(1));
        } else if (operator.equals(Operator.POWER)) {
            return simplifyPower(args.get(0), args.get(1));
        }
        return fold(operator, args).orElseGet(() -> Expressions.apply(operator, args));
    }

    private static Optional<Expression> fold(Operator operator, List<Expression> args) {
        Optional<OperatorEvaluator> evaluator = operator.getEvaluator();
        if (evaluator.isEmpty()) {
            return Optional.empty();
        }
        double[] values = new double[args.size()];
        for (int i = 0; i < values.length; i++) {
            if (!(args.get(i) instanceof Constant c)) {
                return Optional.empty();
            }
            values[i] = c.getValue();
        }
        double value = evaluator.get().evaluate(values);
        return Double.isFinite(value) ? Optional.of(Constant.of(value)) : Optional.empty();
    }

    private static void flatten(Operator operator, List<Expression> args, List<Expression> flattened) {
        for (Expression arg : args) {
            if (arg instanceof Operation operation && operation.is(operator)) {
                flattened.addAll(operation.getArguments());
            } else {
                flattened.add(arg);
            }
        }
    }

    private static Expression simplifySum(List<Expression> args) {
        List<Expression> flattened = new ArrayList<>(args.size());
        flatten(Operator.ADD, args, flattened);
        List<Expression> terms = new ArrayList<>(flattened.size());
        List<Constant> constants = new ArrayList<>();
        double sum = 0;
        for (Expression term : flattened) {
            if (term instanceof Constant c) {
                constants.add(c);
                sum += c.getValue();
            } else {
                terms.add(term);
            }
        }
        if (Double.isFinite(sum)) {
            if (sum != 0) {
                terms.add(Constant.of(sum));
            }
        } else {
            terms.addAll(constants);
        }
        if (terms.isEmpty()) {
            return Constant.ZERO;
        }
        return terms.size() == 1 ? terms.get(0) : Expressions.add(terms);
    }

    private static Expression simplifyProduct(List<Expression> args) {
        List<Expression> flattened = new ArrayList<>(args.size());
        flatten(Operator.MULTIPLY, args, flattened);
        List<Expression> factors = new ArrayList<>(flattened.size() + 1);
        List<Constant> constants = new ArrayList<>();
        double product = 1;
        for (Expression factor : flattened) {
            if (factor instanceof Constant c) {
                if (c.isZero()) {
                    return Constant.ZERO;
                }
                constants.add(c);
                product *= c.getValue();
            } else {
                factors.add(factor);
            }
        }
        if (Double.isFinite(product)) {
            if (product != 1) {
                factors.add(0, Constant.of(product));
            }
        } else {
            factors.addAll(0, constants);
        }
        if (factors.isEmpty()) {
            return Constant.ONE;
        }
        return factors.size() == 1 ? factors.get(0) : Expressions.multiply(factors);
    }

    private static Expression simplifyDivision(Expression a, Expression b) {
        if (b instanceof Constant cb) {
            if (cb.isOne()) {
                return a;
            }
            if (!cb.isZero()) {
                double inverse = 1 / cb.getValue();
                if (Double.isFinite(inverse)) {
                    return simplifyProduct(List.of(Constant.of(inverse), a));
                }
            }
            return Expressions.divide(a, b);
        }
        if (Constant.isZero(a)) {
            return Constant.ZERO;
        }
        return Expressions.divide(a, b);
    }

    private static Expression simplifyPower(Expression base, Expression exponent) {
        if (exponent instanceof Constant ce) {
            if (ce.isZero()) {
                return Constant.ONE;
            }
            if (ce.isOne()) {
                return base;
            }
        }
        if (Constant.isOne(base)) {
            return Constant.ONE;
        }
        if (base instanceof Constant && exponent instanceof Constant) {
            return fold(Operator.POWER, List.of(base, exponent)).orElseGet(() -> Expressions.pow(base, exponent));
        }
        // (x^a)^b = x^(a*b) holds for any integer b
        if (exponent instanceof Constant ce && ce.isInteger()
                && base instanceof Operation inner && inner.is(Operator.POWER)
                && inner.getArgument(1) instanceof Constant innerExponent) {
            double combined = innerExponent.getValue() * ce.getValue();
            if (Double.isFinite(combined)) {
                return simplifyPower(inner.getArgument(0), Constant.of(combined));
            }
        }
        return Expressions.pow(base, exponent);
    }
}
