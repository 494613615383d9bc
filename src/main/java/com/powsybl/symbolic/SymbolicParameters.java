/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic;

import com.powsybl.commons.config.PlatformConfig;
import com.powsybl.symbolic.codegen.LeafRendering;

import java.util.*;
import java.util.stream.Collectors;

/**
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class SymbolicParameters {

    public static final String MODULE_NAME = "symbolic-default-parameters";

    public static final String MAX_EXPANSION_ITERATIONS_PARAM_NAME = "maxExpansionIterations";

    public static final String SIMPLIFY_PARAM_NAME = "simplify";

    public static final String SPARSE_PARAM_NAME = "sparse";

    public static final String LEAF_RENDERING_PARAM_NAME = "leafRendering";

    public static final String AUXILIARY_NAME_SEPARATOR_PARAM_NAME = "auxiliaryNameSeparator";

    public static final int MAX_EXPANSION_ITERATIONS_DEFAULT_VALUE = 100;

    public static final boolean SIMPLIFY_DEFAULT_VALUE = true;

    public static final boolean SPARSE_DEFAULT_VALUE = false;

    public static final LeafRendering LEAF_RENDERING_DEFAULT_VALUE = LeafRendering.INDEXED;

    public static final String AUXILIARY_NAME_SEPARATOR_DEFAULT_VALUE = "ˍ";

    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(MAX_EXPANSION_ITERATIONS_PARAM_NAME,
                                                                         SIMPLIFY_PARAM_NAME,
                                                                         SPARSE_PARAM_NAME,
                                                                         LEAF_RENDERING_PARAM_NAME,
                                                                         AUXILIARY_NAME_SEPARATOR_PARAM_NAME);

    private int maxExpansionIterations = MAX_EXPANSION_ITERATIONS_DEFAULT_VALUE;

    private boolean simplify = SIMPLIFY_DEFAULT_VALUE;

    private boolean sparse = SPARSE_DEFAULT_VALUE;

    private LeafRendering leafRendering = LEAF_RENDERING_DEFAULT_VALUE;

    private String auxiliaryNameSeparator = AUXILIARY_NAME_SEPARATOR_DEFAULT_VALUE;

    public static int checkParameterValue(int parameterValue, boolean condition, String parameterName) {
        if (!condition) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": " + parameterValue);
        }
        return parameterValue;
    }

    public int getMaxExpansionIterations() {
        return maxExpansionIterations;
    }

    public SymbolicParameters setMaxExpansionIterations(int maxExpansionIterations) {
        this.maxExpansionIterations = checkParameterValue(maxExpansionIterations,
                maxExpansionIterations >= 1,
                MAX_EXPANSION_ITERATIONS_PARAM_NAME);
        return this;
    }

    public boolean isSimplify() {
        return simplify;
    }

    public SymbolicParameters setSimplify(boolean simplify) {
        this.simplify = simplify;
        return this;
    }

    public boolean isSparse() {
        return sparse;
    }

    public SymbolicParameters setSparse(boolean sparse) {
        this.sparse = sparse;
        return this;
    }

    public LeafRendering getLeafRendering() {
        return leafRendering;
    }

    public SymbolicParameters setLeafRendering(LeafRendering leafRendering) {
        this.leafRendering = Objects.requireNonNull(leafRendering);
        return this;
    }

    public String getAuxiliaryNameSeparator() {
        return auxiliaryNameSeparator;
    }

    public SymbolicParameters setAuxiliaryNameSeparator(String auxiliaryNameSeparator) {
        Objects.requireNonNull(auxiliaryNameSeparator);
        if (auxiliaryNameSeparator.isEmpty()) {
            throw new IllegalArgumentException("Invalid value for parameter " + AUXILIARY_NAME_SEPARATOR_PARAM_NAME + ": empty string");
        }
        this.auxiliaryNameSeparator = auxiliaryNameSeparator;
        return this;
    }

    public static SymbolicParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static SymbolicParameters load(PlatformConfig platformConfig) {
        SymbolicParameters parameters = new SymbolicParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setMaxExpansionIterations(config.getIntProperty(MAX_EXPANSION_ITERATIONS_PARAM_NAME, MAX_EXPANSION_ITERATIONS_DEFAULT_VALUE))
                .setSimplify(config.getBooleanProperty(SIMPLIFY_PARAM_NAME, SIMPLIFY_DEFAULT_VALUE))
                .setSparse(config.getBooleanProperty(SPARSE_PARAM_NAME, SPARSE_DEFAULT_VALUE))
                .setLeafRendering(config.getEnumProperty(LEAF_RENDERING_PARAM_NAME, LeafRendering.class, LEAF_RENDERING_DEFAULT_VALUE))
                .setAuxiliaryNameSeparator(config.getStringProperty(AUXILIARY_NAME_SEPARATOR_PARAM_NAME, AUXILIARY_NAME_SEPARATOR_DEFAULT_VALUE)));
        return parameters;
    }

    public static SymbolicParameters load(Map<String, String> properties) {
        return new SymbolicParameters().update(properties);
    }

    public SymbolicParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(MAX_EXPANSION_ITERATIONS_PARAM_NAME))
                .ifPresent(prop -> this.setMaxExpansionIterations(Integer.parseInt(prop)));
        Optional.ofNullable(properties.get(SIMPLIFY_PARAM_NAME))
                .ifPresent(prop -> this.setSimplify(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(SPARSE_PARAM_NAME))
                .ifPresent(prop -> this.setSparse(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(LEAF_RENDERING_PARAM_NAME))
                .ifPresent(prop -> this.setLeafRendering(LeafRendering.valueOf(prop)));
        Optional.ofNullable(properties.get(AUXILIARY_NAME_SEPARATOR_PARAM_NAME))
                .ifPresent(this::setAuxiliaryNameSeparator);
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(SPECIFIC_PARAMETERS_NAMES.size());
        map.put(MAX_EXPANSION_ITERATIONS_PARAM_NAME, maxExpansionIterations);
        map.put(SIMPLIFY_PARAM_NAME, simplify);
        map.put(SPARSE_PARAM_NAME, sparse);
        map.put(LEAF_RENDERING_PARAM_NAME, leafRendering);
        map.put(AUXILIARY_NAME_SEPARATOR_PARAM_NAME, auxiliaryNameSeparator);
        return map;
    }

    @Override
    public String toString() {
        return "SymbolicParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}
