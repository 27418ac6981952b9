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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Random;

/**
 * Truth-table oracle for small formulas.
 */
final class BruteForce {
    private BruteForce() {}

    static boolean satisfies(CnfFormula formula, Configuration configuration) {
        int variableCount = formula.variableCount();
        for (int[] clause : formula.clauses()) {
            boolean satisfied = false;
            boolean hasValidLiteral = false;
            for (int literal : clause) {
                int variable = Math.abs(literal) - 1;
                if (variable >= variableCount) {
                    continue;
                }
                hasValidLiteral = true;
                if (configuration.get(variable) == (literal > 0)) {
                    satisfied = true;
                    break;
                }
            }
            if (hasValidLiteral && !satisfied) {
                return false;
            }
        }
        return true;
    }

    static List<Configuration> models(CnfFormula formula) {
        int variableCount = formula.variableCount();
        List<Configuration> models = new ArrayList<>();
        for (long bits = 0; bits < (1L << variableCount); bits++) {
            Configuration configuration = new Configuration(BitSet.valueOf(new long[] {bits}), variableCount);
            if (satisfies(formula, configuration)) {
                models.add(configuration);
            }
        }
        return models;
    }

    /**
     * All feasible obligations among the given variables.
     */
    static List<PairwiseObligation> obligations(CnfFormula formula, int[] variables) {
        List<Configuration> models = models(formula);
        int[] sorted = variables.clone();
        Arrays.sort(sorted);
        List<PairwiseObligation> obligations = new ArrayList<>();
        for (int i = 0; i < sorted.length; i++) {
            for (int j = i + 1; j < sorted.length; j++) {
                for (boolean valueA : new boolean[] {false, true}) {
                    for (boolean valueB : new boolean[] {false, true}) {
                        PairwiseObligation obligation = new PairwiseObligation(sorted[i], valueA, sorted[j], valueB);
                        if (models.stream().anyMatch(obligation::isSatisfiedBy)) {
                            obligations.add(obligation);
                        }
                    }
                }
            }
        }
        return obligations;
    }

    /**
     * A random formula with clauses of one to {@code maximumWidth} distinct variables.
     */
    static CnfFormula randomFormula(Random random, int variableCount, int clauseCount, int maximumWidth) {
        List<int[]> clauses = new ArrayList<>();
        for (int i = 0; i < clauseCount; i++) {
            int width = 1 + random.nextInt(Math.min(maximumWidth, variableCount));
            int[] clause = random.ints(0, variableCount).distinct().limit(width)
                    .map(variable -> random.nextBoolean() ? variable + 1 : -(variable + 1))
                    .toArray();
            clauses.add(clause);
        }
        return CnfFormula.of(variableCount, clauses);
    }
}
