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
import java.util.stream.Collectors;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class Operation extends AbstractExpression {

    private final Operator operator;

    private final List<Expression> arguments;

    public Operation(Operator operator, List<? extends Expression> arguments) {
        this.operator = Objects.requireNonNull(operator);
        this.arguments = List.copyOf(arguments);
        if (!operator.acceptsArgumentCount(this.arguments.size())) {
            throw new IllegalArgumentException("Operator '" + operator.getName() + "' does not accept "
                    + this.arguments.size() + " argument(s)");
        }
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public Expression getArgument(int i) {
        return arguments.get(i);
    }

    public boolean is(Operator operator) {
        return this.operator.equals(operator);
    }

    @Override
    public ExpressionType getType() {
        return ExpressionType.OPERATION;
    }

    @Override
    public List<Expression> getChildren() {
        return arguments;
    }

    @Override
    protected Expression withChildren(List<Expression> children) {
        return new Operation(operator, children);
    }

    @Override
    protected int computeHashCode() {
        return 31 * operator.hashCode() + arguments.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Operation other) {
            return hashCode() == other.hashCode()
                    && operator.equals(other.operator)
                    && arguments.equals(other.arguments);
        }
        return false;
    }

    private String toChildString(Expression child, boolean first) {
        String str = child.toString();
        boolean parenthesis = false;
        if (child instanceof Operation childOperation && childOperation.operator.getNotation() != Operator.Notation.FUNCTION) {
            int childPrecedence = childOperation.operator.getPrecedence();
            int precedence = operator.getPrecedence();
            parenthesis = childPrecedence < precedence
                    || childPrecedence == precedence && !(operator.isAssociative() && childOperation.operator.equals(operator)) && !first;
        } else if (child instanceof Constant constant && constant.getValue() < 0) {
            parenthesis = !first || operator.equals(Operator.POWER);
        }
        return parenthesis ? "(" + str + ")" : str;
    }

    @Override
    public String toString() {
        return switch (operator.getNotation()) {
            case INFIX -> {
                StringBuilder builder = new StringBuilder();
                for (int i = 0; i < arguments.size(); i++) {
                    if (i > 0) {
                        builder.append(' ').append(operator.getName()).append(' ');
                    }
                    builder.append(toChildString(arguments.get(i), i == 0));
                }
                yield builder.toString();
            }
            case PREFIX -> operator.getName() + toChildString(arguments.get(0), false);
            case FUNCTION -> operator.getName() + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
        };
    }
}
