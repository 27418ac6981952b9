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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The FORCE heuristic: clauses are hyperedges pulling their variables together.
 *
 * <p>Starting from the {@link FrequencyOrder frequency ranking}, each round computes the centre of
 * gravity of every clause (the mean position of its variables), moves every variable to the mean
 * centre of gravity of the clauses it occurs in and re-ranks the variables by their new position.
 * Variables occurring in no clause keep their position; ties are broken by the previous rank. The
 * loop stops after the configured number of rounds or as soon as a round does not change the
 * ranking.</p>
 */
public final class ForceDirectedOrder implements VariableOrderStrategy {
    private static final Logger logger = Logger.getLogger(ForceDirectedOrder.class.getName());

    private final int rounds;

    public ForceDirectedOrder(int rounds) {
        checkArgument(rounds >= 0, "Negative number of rounds %d", rounds);
        this.rounds = rounds;
    }

    @Override
    public VariableOrder plan(CnfFormula formula) {
        int variableCount = formula.variableCount();
        int[][] clauseVariables = clauseVariables(formula);

        int[] ranking = FrequencyOrder.rank(formula);
        int[] rankOf = new int[variableCount];
        for (int rank = 0; rank < variableCount; rank++) {
            rankOf[ranking[rank]] = rank;
        }

        double[] gravitySum = new double[variableCount];
        int[] clauseCount = new int[variableCount];
        double[] position = new double[variableCount];
        Integer[] candidates = new Integer[variableCount];

        int round = 0;
        while (round < rounds) {
            round += 1;
            Arrays.fill(gravitySum, 0.0);
            Arrays.fill(clauseCount, 0);
            for (int[] clause : clauseVariables) {
                double sum = 0.0;
                for (int variable : clause) {
                    sum += rankOf[variable];
                }
                double centreOfGravity = sum / clause.length;
                for (int variable : clause) {
                    gravitySum[variable] += centreOfGravity;
                    clauseCount[variable] += 1;
                }
            }
            for (int variable = 0; variable < variableCount; variable++) {
                position[variable] =
                        clauseCount[variable] == 0 ? rankOf[variable] : gravitySum[variable] / clauseCount[variable];
            }

            int[] previousRankOf = rankOf.clone();
            Arrays.setAll(candidates, i -> i);
            Arrays.sort(candidates, Comparator.<Integer>comparingDouble(v -> position[v])
                    .thenComparingInt(v -> previousRankOf[v]));

            boolean changed = false;
            for (int rank = 0; rank < variableCount; rank++) {
                int variable = candidates[rank];
                if (ranking[rank] != variable) {
                    changed = true;
                }
                ranking[rank] = variable;
                rankOf[variable] = rank;
            }
            logger.log(Level.FINEST, "FORCE round {0}: changed={1}", new Object[] {round, changed});
            if (!changed) {
                break;
            }
        }
        logger.log(Level.FINER, "FORCE ordering of {0} variables finished after {1} rounds", new Object[] {
            variableCount, round
        });
        return VariableOrder.of(ranking);
    }

    /* 0-based variables of each clause, ignoring literals beyond the variable count */
    private static int[][] clauseVariables(CnfFormula formula) {
        int variableCount = formula.variableCount();
        List<int[]> result = new ArrayList<>(formula.clauseCount());
        for (int[] clause : formula.clauses()) {
            int[] variables = Arrays.stream(clause)
                    .map(Math::abs)
                    .filter(magnitude -> magnitude <= variableCount)
                    .map(magnitude -> magnitude - 1)
                    .toArray();
            if (variables.length > 0) {
                result.add(variables);
            }
        }
        return result.toArray(new int[0][]);
    }

    @Override
    public String toString() {
        return "force(" + rounds + ")";
    }
}
