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

import java.util.Arrays;
import java.util.Comparator;

/**
 * Orders variables by descending number of occurrences in the clauses. Ties are broken by the
 * variable index, so the result is deterministic.
 */
public final class FrequencyOrder implements VariableOrderStrategy {
    @Override
    public VariableOrder plan(CnfFormula formula) {
        return VariableOrder.of(rank(formula));
    }

    static int[] rank(CnfFormula formula) {
        Integer[] variables = new Integer[formula.variableCount()];
        Arrays.setAll(variables, i -> i);
        Arrays.sort(variables, Comparator.<Integer>comparingInt(formula::occurrences).reversed()
                .thenComparingInt(Integer::intValue));
        return Arrays.stream(variables).mapToInt(Integer::intValue).toArray();
    }

    @Override
    public String toString() {
        return "frequency";
    }
}
