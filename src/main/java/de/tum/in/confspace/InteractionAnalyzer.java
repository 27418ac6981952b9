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

import de.tum.in.confspace.bdd.Bdd;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enumerates the feasible pairwise interactions among the most frequent variables of a formula.
 *
 * <p>An interaction {@code (a = x, b = y)} is feasible if some valid configuration sets both
 * values. To keep the satisfiability checks cheap, the function is first projected onto the
 * considered variables by existentially quantifying all others; fixing {@code a} and {@code b} in
 * the projection yields false exactly if it does in the original function.</p>
 */
public final class InteractionAnalyzer {
    private static final Logger logger = Logger.getLogger(InteractionAnalyzer.class.getName());
    private static final boolean[] VALUES = {false, true};

    private final ConfigurationSpace space;
    private final int variableLimit;

    public InteractionAnalyzer(ConfigurationSpace space, int variableLimit) {
        checkArgument(variableLimit >= 0, "Negative variable limit %d", variableLimit);
        this.space = space;
        this.variableLimit = variableLimit;
    }

    /**
     * The {@code min(N, limit)} most frequent variables (ranked as by {@link FrequencyOrder}), in
     * ascending index order.
     */
    public int[] selectedVariables() {
        int[] ranking = FrequencyOrder.rank(space.formula());
        int[] selected = Arrays.copyOf(ranking, Math.min(ranking.length, variableLimit));
        Arrays.sort(selected);
        return selected;
    }

    /**
     * Returns all feasible interactions among the selected variables, ordered by first variable,
     * second variable, first value and second value. Empty if the space is empty.
     */
    public List<PairwiseObligation> obligations() {
        if (space.isUnsatisfiable()) {
            return List.of();
        }
        long start = System.currentTimeMillis();
        Bdd bdd = space.bdd();
        VariableOrder order = space.order();
        int[] selected = selectedVariables();

        BitSet quantified = new BitSet(space.variableCount());
        quantified.set(0, space.variableCount());
        for (int variable : selected) {
            quantified.clear(order.levelOf(variable));
        }
        int projection = bdd.reference(bdd.exists(space.root(), quantified));

        List<PairwiseObligation> obligations = new ArrayList<>();
        for (int i = 0; i < selected.length; i++) {
            int variableA = selected[i];
            for (boolean valueA : VALUES) {
                int restrictedA = bdd.reference(bdd.restrict(projection, order.levelOf(variableA), valueA));
                for (int j = i + 1; j < selected.length; j++) {
                    int variableB = selected[j];
                    for (boolean valueB : VALUES) {
                        int restrictedB = bdd.restrict(restrictedA, order.levelOf(variableB), valueB);
                        if (bdd.isSatisfiable(restrictedB)) {
                            obligations.add(new PairwiseObligation(variableA, valueA, variableB, valueB));
                        }
                    }
                }
                bdd.dereference(restrictedA);
            }
        }
        bdd.dereference(projection);
        // Emit in (a, b, valueA, valueB) order independent of the loop nesting above
        obligations.sort((first, second) -> {
            int compare = Integer.compare(first.variableA(), second.variableA());
            if (compare == 0) {
                compare = Integer.compare(first.variableB(), second.variableB());
            }
            if (compare == 0) {
                compare = Boolean.compare(first.valueA(), second.valueA());
            }
            return compare == 0 ? Boolean.compare(first.valueB(), second.valueB()) : compare;
        });
        logger.log(Level.FINE, "Found {0} feasible interactions among {1} variables in {2} ms", new Object[] {
            obligations.size(), selected.length, System.currentTimeMillis() - start
        });
        return obligations;
    }

    public int countInteractions() {
        return obligations().size();
    }
}
