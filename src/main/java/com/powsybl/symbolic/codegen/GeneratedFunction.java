/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.codegen;

import java.util.Objects;

/**
 * The two calling conventions of a function generated from one symbolic source, with the Java source
 * text of both.
 *
 * @param <R> result type of the out-of-place variant
 * @param <B> buffer type of the in-place variant
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class GeneratedFunction<R, B> {

    private final OutOfPlaceFunction<R> outOfPlace;

    private final InPlaceFunction<B> inPlace;

    private final String source;

    GeneratedFunction(OutOfPlaceFunction<R> outOfPlace, InPlaceFunction<B> inPlace, String source) {
        this.outOfPlace = Objects.requireNonNull(outOfPlace);
        this.inPlace = Objects.requireNonNull(inPlace);
        this.source = Objects.requireNonNull(source);
    }

    public OutOfPlaceFunction<R> outOfPlace() {
        return outOfPlace;
    }

    public InPlaceFunction<B> inPlace() {
        return inPlace;
    }

    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }
}
