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
import java.util.Objects;

/**
 * Compile an expression into a tree of closures. The closures only capture constants, binding positions
 * and operator evaluators, so compiled expressions are stateless.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class ExpressionCompiler {

    private final ArgumentBindings bindings;

    public ExpressionCompiler(ArgumentBindings bindings) {
        this.bindings = Objects.requireNonNull(bindings);
    }

    public CompiledExpression compile(Expression expr) {
        switch (expr.getType()) {
            case CONSTANT: {
                double value = ((Constant) expr).getValue();
                return args -> value;
            }
            case SYMBOL:
                return compileSymbol((Symbol) expr);
            case OPERATION:
                return compileOperation((Operation) expr);
            case DIFFERENTIAL:
                throw new SymbolicException("Cannot compile unexpanded derivative " + expr);
            default:
                throw new IllegalStateException("Unknown expression type: " + expr.getType());
        }
    }

    private CompiledExpression compileSymbol(Symbol symbol) {
        ArgumentBindings.Binding binding = bindings.getBinding(symbol).orElse(null);
        if (binding != null) {
            int group = binding.group();
            int position = binding.position();
            return args -> args[group][position];
        }
        double value = symbol.getValue()
                .orElseThrow(() -> new ShapeMismatchException("Symbol '" + symbol + "' is not bound to any argument"));
        return args -> value;
    }

    private CompiledExpression compileOperation(Operation operation) {
        Operator operator = operation.getOperator();
        OperatorEvaluator evaluator = operator.getEvaluator()
                .orElseThrow(() -> new SymbolicException("Operator '" + operator.getName() + "' has no numeric evaluator"));
        List<Expression> arguments = operation.getArguments();
        CompiledExpression[] compiledArgs = new CompiledExpression[arguments.size()];
        for (int i = 0; i < compiledArgs.length; i++) {
            compiledArgs[i] = compile(arguments.get(i));
        }
        if (compiledArgs.length == 1) {
            CompiledExpression a = compiledArgs[0];
            return args -> evaluator.evaluate(new double[] {a.evaluate(args)});
        }
        return args -> {
            double[] values = new double[compiledArgs.length];
            for (int i = 0; i < values.length; i++) {
                values[i] = compiledArgs[i].evaluate(args);
            }
            return evaluator.evaluate(values);
        };
    }
}
