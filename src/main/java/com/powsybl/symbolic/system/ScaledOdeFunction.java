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
 * Generated function with the calling convention of factorized operators: {@code f(u, p, gam, t)} /
 * {@code f(out, u, p, gam, t)}.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public class ScaledOdeFunction<R, B> {

    private final GeneratedFunction<R, B> function;

    public ScaledOdeFunction(GeneratedFunction<R, B> function) {
        this.function = Objects.requireNonNull(function);
    }

    public R apply(double[] u, double[] p, double gam, double t) {
        return function.outOfPlace().apply(u, p, new double[] {gam}, new double[] {t});
    }

    public void apply(B out, double[] u, double[] p, double gam, double t) {
        function.inPlace().apply(out, u, p, new double[] {gam}, new double[] {t});
    }

    public GeneratedFunction<R, B> getFunction() {
        return function;
    }
}
