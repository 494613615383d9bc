/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.expr;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Node of an immutable symbolic expression tree.
 * <p>
 * Equality is purely syntactic: {@code x + y} and {@code y + x} are different expressions.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public interface Expression {

    ExpressionType getType();

    /**
     * Get the direct sub-expressions of this node: arguments of an operation, the differentiated
     * expression of a differential, nothing for leaves.
     */
    List<Expression> getChildren();

    /**
     * Replace every syntactic occurrence of the map keys by the associated value. Outermost matches win
     * and replacements are not visited again.
     */
    Expression substitute(Map<? extends Expression, ? extends Expression> substitutions);

    default Expression substitute(Expression from, Expression to) {
        return substitute(Map.of(from, to));
    }

    /**
     * Get the symbols this expression depends on syntactically, in first appearance order.
     */
    Set<Symbol> getFreeSymbols();

    boolean contains(Expression other);

    default boolean isConstant() {
        return getType() == ExpressionType.CONSTANT;
    }
}
