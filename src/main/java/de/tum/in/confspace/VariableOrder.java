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

import java.util.Arrays;
import java.util.BitSet;

/**
 * A bijection between the variables of a formula and the levels of a decision diagram. Level
 * {@code 0} is tested first.
 */
public final class VariableOrder {
    private final int[] variableAtLevel;
    private final int[] levelOfVariable;

    private VariableOrder(int[] variableAtLevel, int[] levelOfVariable) {
        this.variableAtLevel = variableAtLevel;
        this.levelOfVariable = levelOfVariable;
    }

    /**
     * Creates the order which places {@code ranking[i]} at level {@code i}.
     *
     * @throws IllegalArgumentException
     *     If the ranking is not a permutation of {@code 0, ..., ranking.length - 1}.
     */
    public static VariableOrder of(int[] ranking) {
        int size = ranking.length;
        int[] levels = new int[size];
        BitSet seen = new BitSet(size);
        for (int level = 0; level < size; level++) {
            int variable = ranking[level];
            checkArgument(0 <= variable && variable < size, "Variable %d out of range [0, %d)", variable, size);
            checkArgument(!seen.get(variable), "Variable %d ranked twice", variable);
            seen.set(variable);
            levels[variable] = level;
        }
        return new VariableOrder(ranking.clone(), levels);
    }

    public static VariableOrder identity(int size) {
        int[] ranking = new int[size];
        Arrays.setAll(ranking, i -> i);
        return new VariableOrder(ranking, ranking.clone());
    }

    public int size() {
        return variableAtLevel.length;
    }

    public int levelOf(int variable) {
        return levelOfVariable[variable];
    }

    public int variableAt(int level) {
        return variableAtLevel[level];
    }

    /**
     * Returns the variables in level order.
     */
    public int[] ranking() {
        return variableAtLevel.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VariableOrder)) {
            return false;
        }
        return Arrays.equals(variableAtLevel, ((VariableOrder) o).variableAtLevel);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(variableAtLevel);
    }

    @Override
    public String toString() {
        return Arrays.toString(variableAtLevel);
    }
}
