/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import com.google.common.base.Stopwatch;
import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.SymbolicParameters;
import com.powsybl.symbolic.expr.Constant;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.matrix.SymbolicMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Generate executable functions from expressions, bound to a caller specified ordered list of argument
 * groups, typically the state vector, the parameter vector and the independent variable.
 * <p>
 * Scalar, vector and matrix results are supported. The leaf renderer only affects the emitted source.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class FunctionGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(FunctionGenerator.class);

    public static final String OUTPUT_NAME = "out";

    private static final String INDENT = "    ";

    private final LeafRenderer renderer;

    public FunctionGenerator() {
        this(LeafRendering.INDEXED.createRenderer());
    }

    public FunctionGenerator(LeafRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer);
    }

    public static FunctionGenerator create(SymbolicParameters parameters) {
        return new FunctionGenerator(parameters.getLeafRendering().createRenderer());
    }

    private static ArgumentBindings bind(Collection<? extends Expression> exprs, ArgumentGroup... groups) {
        Objects.requireNonNull(groups);
        for (ArgumentGroup group : groups) {
            if (OUTPUT_NAME.equals(Objects.requireNonNull(group).getName())) {
                throw new IllegalArgumentException("Argument group name '" + OUTPUT_NAME + "' is reserved");
            }
        }
        ArgumentBindings bindings = new ArgumentBindings(Arrays.asList(groups));
        bindings.checkBound(exprs);
        return bindings;
    }

    private static String parameterList(ArgumentBindings bindings) {
        return bindings.getGroups().stream()
                .map(group -> "double[] " + group.getName())
                .collect(Collectors.joining(", "));
    }

    private static void appendMethod(StringBuilder source, String header, List<String> body) {
        source.append(header).append(" {").append(System.lineSeparator());
        for (String line : body) {
            source.append(INDENT).append(line).append(System.lineSeparator());
        }
        source.append('}').append(System.lineSeparator());
    }

    private record EmittedCode(List<String> prologue, List<String> exprs) {
    }

    private EmittedCode emit(ArgumentBindings bindings, List<? extends Expression> exprs) {
        // leaf renderers may keep the local names of the last rendered prologue
        synchronized (renderer) {
            JavaSourceEmitter emitter = new JavaSourceEmitter(bindings, renderer);
            List<String> prologue = emitter.emitPrologue();
            List<String> rendered = new ArrayList<>(exprs.size());
            for (Expression expr : exprs) {
                rendered.add(emitter.emit(expr));
            }
            return new EmittedCode(prologue, rendered);
        }
    }

    private static String emitSource(ArgumentBindings bindings, String resultType, String bufferType, List<String> prologue,
                                     List<String> outOfPlaceStatements, List<String> inPlaceStatements) {
        String parameters = parameterList(bindings);
        StringBuilder source = new StringBuilder();

        List<String> outOfPlaceBody = new ArrayList<>(prologue);
        outOfPlaceBody.addAll(outOfPlaceStatements);
        appendMethod(source, "public " + resultType + " apply(" + parameters + ")", outOfPlaceBody);

        source.append(System.lineSeparator());

        List<String> inPlaceBody = new ArrayList<>(prologue);
        inPlaceBody.addAll(inPlaceStatements);
        appendMethod(source, "public void apply(" + bufferType + " " + OUTPUT_NAME
                + (parameters.isEmpty() ? "" : ", " + parameters) + ")", inPlaceBody);

        return source.toString();
    }

    public GeneratedFunction<Double, double[]> generate(Expression expr, ArgumentGroup... groups) {
        Objects.requireNonNull(expr);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ArgumentBindings bindings = bind(List.of(expr), groups);
        CompiledExpression compiled = new ExpressionCompiler(bindings).compile(expr);
        EmittedCode code = emit(bindings, List.of(expr));
        String source = emitSource(bindings, "double", "double[]", code.prologue(),
                List.of("return " + code.exprs().get(0) + ";"),
                List.of(OUTPUT_NAME + "[0] = " + code.exprs().get(0) + ";"));

        GeneratedFunction<Double, double[]> function = new GeneratedFunction<>(
            args -> {
                bindings.checkArguments(args);
                return compiled.evaluate(args);
            },
            (buffer, args) -> {
                checkBuffer(buffer, 1);
                bindings.checkArguments(args);
                buffer[0] = compiled.evaluate(args);
            },
            source);

        LOGGER.debug(PERFORMANCE_MARKER, "Scalar function generated in {} us", stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    public GeneratedFunction<double[], double[]> generate(List<? extends Expression> exprs, ArgumentGroup... groups) {
        Objects.requireNonNull(exprs);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ArgumentBindings bindings = bind(exprs, groups);
        ExpressionCompiler compiler = new ExpressionCompiler(bindings);
        int size = exprs.size();
        CompiledExpression[] compiled = new CompiledExpression[size];
        for (int i = 0; i < size; i++) {
            compiled[i] = compiler.compile(exprs.get(i));
        }
        EmittedCode code = emit(bindings, exprs);
        List<String> assignments = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            assignments.add(OUTPUT_NAME + "[" + i + "] = " + code.exprs().get(i) + ";");
        }
        List<String> outOfPlaceStatements = new ArrayList<>(size + 2);
        outOfPlaceStatements.add("double[] " + OUTPUT_NAME + " = new double[" + size + "];");
        outOfPlaceStatements.addAll(assignments);
        outOfPlaceStatements.add("return " + OUTPUT_NAME + ";");
        String source = emitSource(bindings, "double[]", "double[]", code.prologue(), outOfPlaceStatements, assignments);

        GeneratedFunction<double[], double[]> function = new GeneratedFunction<>(
            args -> {
                bindings.checkArguments(args);
                double[] result = new double[size];
                evaluate(compiled, args, result);
                return result;
            },
            (buffer, args) -> {
                checkBuffer(buffer, size);
                bindings.checkArguments(args);
                evaluate(compiled, args, buffer);
            },
            source);

        LOGGER.debug(PERFORMANCE_MARKER, "Vector function of size {} generated in {} us", size, stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    public GeneratedFunction<DenseMatrix, DenseMatrix> generate(SymbolicMatrix matrix, ArgumentGroup... groups) {
        Objects.requireNonNull(matrix);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ArgumentBindings bindings = bind(matrix.toList(), groups);
        ExpressionCompiler compiler = new ExpressionCompiler(bindings);
        int rowCount = matrix.getRowCount();
        int columnCount = matrix.getColumnCount();
        List<MatrixEntry> entries = new ArrayList<>();
        List<Expression> exprs = new ArrayList<>();
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                Expression entry = matrix.get(i, j);
                if (!Constant.isZero(entry)) {
                    entries.add(new MatrixEntry(i, j, compiler.compile(entry)));
                    exprs.add(entry);
                }
            }
        }
        EmittedCode code = emit(bindings, exprs);
        List<String> assignments = new ArrayList<>(entries.size());
        for (int k = 0; k < entries.size(); k++) {
            MatrixEntry entry = entries.get(k);
            assignments.add(OUTPUT_NAME + ".set(" + entry.row() + ", " + entry.column() + ", " + code.exprs().get(k) + ");");
        }
        List<String> outOfPlaceStatements = new ArrayList<>(entries.size() + 2);
        outOfPlaceStatements.add("DenseMatrix " + OUTPUT_NAME + " = new DenseMatrix(" + rowCount + ", " + columnCount + ");");
        outOfPlaceStatements.addAll(assignments);
        outOfPlaceStatements.add("return " + OUTPUT_NAME + ";");
        List<String> inPlaceStatements = new ArrayList<>(entries.size() + 1);
        inPlaceStatements.add(OUTPUT_NAME + ".reset();");
        inPlaceStatements.addAll(assignments);
        String source = emitSource(bindings, "DenseMatrix", "DenseMatrix", code.prologue(), outOfPlaceStatements, inPlaceStatements);

        GeneratedFunction<DenseMatrix, DenseMatrix> function = new GeneratedFunction<>(
            args -> {
                bindings.checkArguments(args);
                DenseMatrix result = new DenseMatrix(rowCount, columnCount);
                for (MatrixEntry entry : entries) {
                    result.set(entry.row(), entry.column(), entry.value().evaluate(args));
                }
                return result;
            },
            (buffer, args) -> {
                checkBuffer(buffer, rowCount, columnCount);
                bindings.checkArguments(args);
                buffer.reset();
                for (MatrixEntry entry : entries) {
                    buffer.set(entry.row(), entry.column(), entry.value().evaluate(args));
                }
            },
            source);

        LOGGER.debug(PERFORMANCE_MARKER, "Matrix function {}x{} with {} non zeros generated in {} us",
                rowCount, columnCount, entries.size(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return function;
    }

    private record MatrixEntry(int row, int column, CompiledExpression value) {
    }

    private static void evaluate(CompiledExpression[] compiled, double[][] args, double[] result) {
        for (int i = 0; i < compiled.length; i++) {
            result[i] = compiled[i].evaluate(args);
        }
    }

    private static void checkBuffer(double[] buffer, int size) {
        if (buffer == null || buffer.length != size) {
            throw new ShapeMismatchException("Output buffer is expected to have length " + size + ", got "
                    + (buffer == null ? "null" : buffer.length));
        }
    }

    private static void checkBuffer(DenseMatrix buffer, int rowCount, int columnCount) {
        if (buffer == null || buffer.getRowCount() != rowCount || buffer.getColumnCount() != columnCount) {
            throw new ShapeMismatchException("Output buffer is expected to be a " + rowCount + "x" + columnCount + " matrix, got "
                    + (buffer == null ? "null" : buffer.getRowCount() + "x" + buffer.getColumnCount()));
        }
    }
}
