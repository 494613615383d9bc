/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.sparsity;

import com.google.common.base.Stopwatch;
import com.powsybl.symbolic.expr.Equation;
import com.powsybl.symbolic.expr.Symbol;
import gnu.trove.list.array.TIntArrayList;
import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.AsUnmodifiableGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.TimeUnit;

import static com.powsybl.symbolic.util.Markers.PERFORMANCE_MARKER;

/**
 * Bipartite graph between equations and the variables their right hand side reads, used to schedule
 * recomputations after some variables have been modified.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class DependencyGraph {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyGraph.class);

    public enum NodeType {
        EQUATION,
        VARIABLE
    }

    public record Node(NodeType type, int index) {
    }

    private final List<Symbol> variables;

    private final TIntArrayList[] variablesByEquation;

    private final TIntArrayList[] equationsByVariable;

    private final Graph<Node, DefaultEdge> graph = new SimpleGraph<>(DefaultEdge.class);

    private DependencyGraph(List<Symbol> variables, TIntArrayList[] variablesByEquation, TIntArrayList[] equationsByVariable) {
        this.variables = variables;
        this.variablesByEquation = variablesByEquation;
        this.equationsByVariable = equationsByVariable;
        for (int i = 0; i < variablesByEquation.length; i++) {
            graph.addVertex(new Node(NodeType.EQUATION, i));
        }
        for (int j = 0; j < equationsByVariable.length; j++) {
            graph.addVertex(new Node(NodeType.VARIABLE, j));
        }
        for (int i = 0; i < variablesByEquation.length; i++) {
            TIntArrayList equationVariables = variablesByEquation[i];
            for (int k = 0; k < equationVariables.size(); k++) {
                graph.addEdge(new Node(NodeType.EQUATION, i), new Node(NodeType.VARIABLE, equationVariables.getQuick(k)));
            }
        }
    }

    public static DependencyGraph create(List<Equation> equations, List<Symbol> variables) {
        Objects.requireNonNull(equations);
        Objects.requireNonNull(variables);
        Stopwatch stopwatch = Stopwatch.createStarted();

        Map<Symbol, Integer> variableIndex = new HashMap<>(variables.size());
        for (int j = 0; j < variables.size(); j++) {
            variableIndex.putIfAbsent(variables.get(j), j);
        }
        TIntArrayList[] variablesByEquation = new TIntArrayList[equations.size()];
        TIntArrayList[] equationsByVariable = new TIntArrayList[variables.size()];
        for (int j = 0; j < variables.size(); j++) {
            equationsByVariable[j] = new TIntArrayList();
        }
        for (int i = 0; i < equations.size(); i++) {
            TIntArrayList equationVariables = new TIntArrayList();
            for (Symbol symbol : equations.get(i).getRhs().getFreeSymbols()) {
                Integer j = variableIndex.get(symbol);
                if (j != null) {
                    equationVariables.add(j);
                }
            }
            equationVariables.sort();
            for (int k = 0; k < equationVariables.size(); k++) {
                equationsByVariable[equationVariables.getQuick(k)].add(i);
            }
            variablesByEquation[i] = equationVariables;
        }
        DependencyGraph dependencyGraph = new DependencyGraph(List.copyOf(variables), variablesByEquation, equationsByVariable);

        LOGGER.debug(PERFORMANCE_MARKER, "Dependency graph of {} equations and {} variables built in {} us",
                equations.size(), variables.size(), stopwatch.elapsed(TimeUnit.MICROSECONDS));

        return dependencyGraph;
    }

    public int getEquationCount() {
        return variablesByEquation.length;
    }

    public List<Symbol> getVariables() {
        return variables;
    }

    /**
     * Indices of the variables read by an equation, sorted.
     */
    public TIntArrayList getVariableDependencies(int equation) {
        return new TIntArrayList(variablesByEquation[equation]);
    }

    public Set<Symbol> getVariableDependencySymbols(int equation) {
        Set<Symbol> symbols = new LinkedHashSet<>();
        TIntArrayList indices = variablesByEquation[equation];
        for (int k = 0; k < indices.size(); k++) {
            symbols.add(variables.get(indices.getQuick(k)));
        }
        return symbols;
    }

    /**
     * Indices of the equations reading a variable, sorted.
     */
    public TIntArrayList getEquationDependencies(int variable) {
        return new TIntArrayList(equationsByVariable[variable]);
    }

    /**
     * Equation to equation dependencies: equation {@code i} depends on equation {@code j} when {@code j}
     * modifies a variable that {@code i} reads.
     *
     * @param modifiedVariables for each equation, the indices of the variables it modifies
     * @return for each equation {@code j}, the sorted indices of the equations depending on it
     */
    public List<TIntArrayList> equationDependencies(List<TIntArrayList> modifiedVariables) {
        Objects.requireNonNull(modifiedVariables);
        if (modifiedVariables.size() != getEquationCount()) {
            throw new IllegalArgumentException("Expected modified variables for " + getEquationCount()
                    + " equations, got " + modifiedVariables.size());
        }
        List<TIntArrayList> dependencies = new ArrayList<>(modifiedVariables.size());
        for (TIntArrayList modified : modifiedVariables) {
            BitSet dependents = new BitSet(getEquationCount());
            for (int k = 0; k < modified.size(); k++) {
                for (Node neighbor : Graphs.neighborListOf(graph, new Node(NodeType.VARIABLE, modified.getQuick(k)))) {
                    dependents.set(neighbor.index());
                }
            }
            TIntArrayList equations = new TIntArrayList(dependents.cardinality());
            dependents.stream().forEach(equations::add);
            dependencies.add(equations);
        }
        return dependencies;
    }

    /**
     * Read-only view of the bipartite graph.
     */
    public Graph<Node, DefaultEdge> getGraph() {
        return new AsUnmodifiableGraph<>(graph);
    }
}
