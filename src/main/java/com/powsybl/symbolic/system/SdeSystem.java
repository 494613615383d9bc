/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.powsybl.symbolic.ShapeMismatchException;
import com.powsybl.symbolic.expr.Expression;
import com.powsybl.symbolic.expr.Symbol;
import com.powsybl.symbolic.expr.SymbolRole;
import com.powsybl.symbolic.matrix.SymbolicMatrix;

import java.util.*;

/**
 * Stochastic differential equations: a drift system and the noise terms of its equations. With diagonal
 * noise each equation has its own noise term, stored as a single column. With general noise, column
 * {@code k} holds the terms of the {@code k}-th Wiener process.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class SdeSystem {

    private final OdeSystem drift;

    private final SymbolicMatrix noise;

    private final boolean diagonalNoise;

    private final List<Symbol> parameters;

    private SdeSystem(OdeSystem drift, SymbolicMatrix noise, boolean diagonalNoise) {
        this.drift = Objects.requireNonNull(drift);
        this.noise = Objects.requireNonNull(noise);
        this.diagonalNoise = diagonalNoise;
        if (noise.getRowCount() != drift.getEquations().size()) {
            throw new ShapeMismatchException("Noise has " + noise.getRowCount() + " rows, system '" + drift.getName()
                    + "' has " + drift.getEquations().size() + " equations");
        }
        Set<Symbol> allParameters = new LinkedHashSet<>(drift.getParameters());
        for (Expression term : noise.toList()) {
            for (Symbol symbol : term.getFreeSymbols()) {
                if (symbol.getRole() == SymbolRole.PARAMETER) {
                    allParameters.add(symbol);
                }
            }
        }
        this.parameters = List.copyOf(allParameters);
    }

    public static SdeSystem diagonal(OdeSystem drift, List<? extends Expression> noise) {
        return new SdeSystem(drift, SymbolicMatrix.column(Objects.requireNonNull(noise)), true);
    }

    public static SdeSystem general(OdeSystem drift, SymbolicMatrix noise) {
        return new SdeSystem(drift, noise, false);
    }

    public OdeSystem getDrift() {
        return drift;
    }

    public SymbolicMatrix getNoise() {
        return noise;
    }

    public boolean isDiagonalNoise() {
        return diagonalNoise;
    }

    public int getNoiseProcessCount() {
        return diagonalNoise ? noise.getRowCount() : noise.getColumnCount();
    }

    public List<Expression> getNoiseColumn(int column) {
        Objects.checkIndex(column, noise.getColumnCount());
        List<Expression> terms = new ArrayList<>(noise.getRowCount());
        for (int i = 0; i < noise.getRowCount(); i++) {
            terms.add(noise.get(i, column));
        }
        return terms;
    }

    public String getName() {
        return drift.getName();
    }

    public List<Symbol> getStates() {
        return drift.getStates();
    }

    /**
     * Parameters of the drift followed by those only found in the noise terms.
     */
    public List<Symbol> getParameters() {
        return parameters;
    }

    /**
     * Same noise, another drift.
     */
    public SdeSystem withDrift(OdeSystem newDrift) {
        return new SdeSystem(newDrift, noise, diagonalNoise);
    }

    @Override
    public String toString() {
        return "SdeSystem(name=" + getName() + ", equations=" + drift.getEquations().size()
                + ", noiseProcesses=" + getNoiseProcessCount() + ", diagonalNoise=" + diagonalNoise + ")";
    }
}
