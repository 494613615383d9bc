/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.symbolic.sparsity;

import com.powsybl.symbolic.expr.Linearity;

import java.util.*;

/**
 * Abstract value of an expression for Hessian sparsity inference: the set of monomials, over tracked
 * variable indices, that the expression may contain. Exponents are saturated at 2 since higher powers do
 * not add any second derivative.
 *
 * @author Geoffroy Jamgotchian {@literal <geoffroy.jamgotchian at rte-france.com>}
 */
public final class TermCombination {

    /**
     * Product of variables, indexed by variable, valued by exponent (1 or 2).
     */
    record Monomial(SortedMap<Integer, Integer> exponents) {

        static final Monomial SCALAR = new Monomial(Collections.emptySortedMap());

        static Monomial of(int variable) {
            TreeMap<Integer, Integer> exponents = new TreeMap<>();
            exponents.put(variable, 1);
            return new Monomial(Collections.unmodifiableSortedMap(exponents));
        }

        Monomial multiply(Monomial other) {
            if (exponents.isEmpty()) {
                return other;
            }
            if (other.exponents.isEmpty()) {
                return this;
            }
            TreeMap<Integer, Integer> merged = new TreeMap<>(exponents);
            other.exponents.forEach((variable, exponent) -> merged.merge(variable, exponent, (e1, e2) -> Math.min(e1 + e2, 2)));
            return new Monomial(Collections.unmodifiableSortedMap(merged));
        }
    }

    public static final TermCombination ZERO = new TermCombination(Collections.emptySet());

    public static final TermCombination ONE = new TermCombination(Set.of(Monomial.SCALAR));

    private final Set<Monomial> monomials;

    private TermCombination(Set<Monomial> monomials) {
        this.monomials = monomials;
    }

    public static TermCombination variable(int index) {
        return new TermCombination(Set.of(Monomial.of(index)));
    }

    /**
     * True if no tracked variable appears in this combination.
     */
    public boolean isScalar() {
        for (Monomial monomial : monomials) {
            if (!monomial.exponents().isEmpty()) {
                return false;
            }
        }
        return true;
    }

    public TermCombination add(TermCombination other) {
        if (other.monomials.isEmpty() || other.equals(this)) {
            return this;
        }
        if (monomials.isEmpty()) {
            return other;
        }
        Set<Monomial> union = new LinkedHashSet<>(monomials);
        union.addAll(other.monomials);
        return new TermCombination(union);
    }

    public TermCombination multiply(TermCombination other) {
        if (equals(ONE)) {
            return other;
        }
        if (other.equals(ONE)) {
            return this;
        }
        Set<Monomial> product = new LinkedHashSet<>();
        for (Monomial m1 : monomials) {
            for (Monomial m2 : other.monomials) {
                product.add(m1.multiply(m2));
            }
        }
        return new TermCombination(product);
    }

    public TermCombination combine(Linearity linearity) {
        return linearity.linearInFirst() ? this : multiply(this);
    }

    public static TermCombination combine(Linearity linearity, TermCombination term1, TermCombination term2) {
        TermCombination term = ZERO;
        if (linearity.linearInFirst()) {
            if (!linearity.noInteraction()) {
                term = term.add(term1);
            }
        } else {
            term = term.add(term1.multiply(term1));
        }
        if (linearity.linearInSecond()) {
            if (!linearity.noInteraction()) {
                term = term.add(term2);
            }
        } else {
            term = term.add(term2.multiply(term2));
        }
        if (linearity.noInteraction()) {
            term = term.add(term1).add(term2);
        } else {
            term = term.add(term1.multiply(term2));
        }
        return term;
    }

    /**
     * Fill the symmetric second derivative pattern of this combination.
     */
    void fillHessianPattern(SparsityPattern.Builder builder) {
        for (Monomial monomial : monomials) {
            monomial.exponents().forEach((i, ei) -> monomial.exponents().forEach((j, ej) -> {
                if (!i.equals(j) || ei >= 2) {
                    builder.set(i, j);
                    builder.set(j, i);
                }
            }));
        }
    }

    @Override
    public int hashCode() {
        return monomials.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        return obj instanceof TermCombination other && monomials.equals(other.monomials);
    }

    @Override
    public String toString() {
        return monomials.stream().map(m -> m.exponents().toString()).toList().toString();
    }
}
