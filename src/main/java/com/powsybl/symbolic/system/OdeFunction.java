/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.system;

import com.powsybl.symbolic.codegen.GeneratedFunction;

import java.util.Objects;

/**
 * Generated function with the solver calling convention {@code f(u, p, t)} / {@code f(out, u, p, t)}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class OdeFunction<R, B> {

    private final GeneratedFunction<R, B> function;

    public OdeFunction(GeneratedFunction<R, B> function) {
        this.function = Objects.requireNonNull(function);
    }

    public R apply(double[] u, double[] p, double t) {
        return function.outOfPlace().apply(u, p, new double[] {t});
    }

    public void apply(B out, double[] u, double[] p, double t) {
        function.inPlace().apply(out, u, p, new double[] {t});
    }

    public GeneratedFunction<R, B> getFunction() {
        return function;
    }
}
