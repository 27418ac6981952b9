/*
 * This file is part of ConfSpace.
 * Copyright (c) 2023 The ConfSpace contributors.
 *
 * ConfSpace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * ConfSpace is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ConfSpace. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.confspace;

import static de.tum.in.confspace.bdd.Util.checkArgument;

/**
 * The combination {@code variableA = valueA} and {@code variableB = valueB} of two distinct
 * variables, with {@code variableA < variableB}.
 */
public final class PairwiseObligation {
    private final int variableA;
    private final boolean valueA;
    private final int variableB;
    private final boolean valueB;

    public PairwiseObligation(int variableA, boolean valueA, int variableB, boolean valueB) {
        checkArgument(0 <= variableA && variableA < variableB, "Invalid variable pair %d, %d", variableA, variableB);
        this.variableA = variableA;
        this.valueA = valueA;
        this.variableB = variableB;
        this.valueB = valueB;
    }

    public int variableA() {
        return variableA;
    }

    public boolean valueA() {
        return valueA;
    }

    public int variableB() {
        return variableB;
    }

    public boolean valueB() {
        return valueB;
    }

    public boolean isSatisfiedBy(Configuration configuration) {
        return configuration.get(variableA) == valueA && configuration.get(variableB) == valueB;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PairwiseObligation)) {
            return false;
        }
        PairwiseObligation that = (PairwiseObligation) o;
        return variableA == that.variableA
                && valueA == that.valueA
                && variableB == that.variableB
                && valueB == that.valueB;
    }

    @Override
    public int hashCode() {
        return 4 * (31 * variableA + variableB) + (valueA ? 2 : 0) + (valueB ? 1 : 0);
    }

    @Override
    public String toString() {
        return String.format("(x%d=%d, x%d=%d)", variableA + 1, valueA ? 1 : 0, variableB + 1, valueB ? 1 : 0);
    }
}
