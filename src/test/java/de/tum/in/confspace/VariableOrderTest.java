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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.BufferedReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

public class VariableOrderTest {
    public static Stream<VariableOrderStrategy> strategies() {
        return Stream.of(
                new FrequencyOrder(),
                new ForceDirectedOrder(0),
                new ForceDirectedOrder(100),
                new SuggestedOrder(),
                new NaturalOrder());
    }

    private static boolean isPermutation(int[] ranking) {
        int[] sorted = ranking.clone();
        Arrays.sort(sorted);
        for (int i = 0; i < sorted.length; i++) {
            if (sorted[i] != i) {
                return false;
            }
        }
        return true;
    }

    @Test
    public void testOf() {
        VariableOrder order = VariableOrder.of(new int[] {2, 0, 1});
        assertThat(order.size(), is(3));
        assertThat(order.variableAt(0), is(2));
        assertThat(order.levelOf(2), is(0));
        assertThat(order.levelOf(0), is(1));
        assertThat(order.levelOf(1), is(2));
        assertThat(order.ranking(), is(new int[] {2, 0, 1}));
        assertThat(VariableOrder.identity(3), is(VariableOrder.of(new int[] {0, 1, 2})));
    }

    @Test
    public void testOfRejectsNonPermutation() {
        assertThrows(IllegalArgumentException.class, () -> VariableOrder.of(new int[] {0, 0, 1}));
        assertThrows(IllegalArgumentException.class, () -> VariableOrder.of(new int[] {0, 3, 1}));
        assertThrows(IllegalArgumentException.class, () -> VariableOrder.of(new int[] {-1, 0}));
    }

    @Test
    public void testFrequencyOrder() {
        // Occurrences: x1 twice, x2 once, x3 three times, x4 twice
        CnfFormula formula = CnfFormula.of(4, new int[] {1, 3}, new int[] {-3, 4}, new int[] {2, 3, -4, -1});
        assertThat(new FrequencyOrder().plan(formula).ranking(), is(new int[] {2, 0, 3, 1}));
    }

    @Test
    public void testForceGroupsConnectedVariables() {
        // Two chains x1 - x3 - x5 and x2 - x4 - x6, interleaved by frequency and index
        CnfFormula formula = CnfFormula.of(6,
                new int[] {1, 3}, new int[] {3, 5}, new int[] {-1, -3}, new int[] {-3, -5},
                new int[] {2, 4}, new int[] {4, 6}, new int[] {-2, -4}, new int[] {-4, -6});
        int[] ranking = new ForceDirectedOrder(100).plan(formula).ranking();
        assertThat(isPermutation(ranking), is(true));

        List<Integer> positions = new ArrayList<>();
        for (int variable : ranking) {
            positions.add(variable % 2);
        }
        // Each chain ends up contiguous
        int changes = 0;
        for (int i = 1; i < positions.size(); i++) {
            if (!positions.get(i).equals(positions.get(i - 1))) {
                changes += 1;
            }
        }
        assertThat(changes, is(1));
    }

    @Test
    public void testForceWithoutRoundsIsFrequency() {
        CnfFormula formula = BruteForce.randomFormula(new Random(1L), 12, 20, 3);
        assertThat(new ForceDirectedOrder(0).plan(formula), is(new FrequencyOrder().plan(formula)));
    }

    @Test
    public void testForceIsDeterministic() {
        CnfFormula formula = BruteForce.randomFormula(new Random(2L), 30, 60, 4);
        ForceDirectedOrder force = new ForceDirectedOrder(100);
        assertThat(force.plan(formula), is(force.plan(formula)));
    }

    @Test
    public void testForceKeepsUnusedVariables() {
        // x2 and x4 occur nowhere and keep the positions they have in the frequency order
        CnfFormula formula = CnfFormula.of(4, new int[] {1, 3}, new int[] {-1, -3}, new int[] {1});
        int[] ranking = new ForceDirectedOrder(10).plan(formula).ranking();
        assertThat(ranking[2], is(1));
        assertThat(ranking[3], is(3));
    }

    @Test
    public void testSuggestedOrder() throws Exception {
        CnfFormula formula = CnfReader.read(new BufferedReader(new StringReader(
                "c order 2 3 1\np cnf 3 2\n1 2 0\n1 -3 0\n")));
        assertThat(new SuggestedOrder().plan(formula).ranking(), is(new int[] {1, 2, 0}));

        CnfFormula withoutOrder = CnfFormula.of(3, new int[] {1, 2}, new int[] {1, -3});
        assertThat(new SuggestedOrder().plan(withoutOrder), is(new FrequencyOrder().plan(withoutOrder)));
    }

    @ParameterizedTest
    @MethodSource("strategies")
    public void testStrategiesYieldPermutations(VariableOrderStrategy strategy) {
        Random random = new Random(3L);
        for (int i = 0; i < 20; i++) {
            int variables = 1 + random.nextInt(40);
            CnfFormula formula = BruteForce.randomFormula(random, variables, random.nextInt(80), 5);
            VariableOrder order = strategy.plan(formula);
            assertThat(order.size(), is(variables));
            assertThat(isPermutation(order.ranking()), is(true));
        }
    }

    @Test
    public void testStrategySelection() {
        for (OrderStrategy strategy : OrderStrategy.values()) {
            AnalysisConfiguration configuration =
                    ImmutableAnalysisConfiguration.builder().orderStrategy(strategy).build();
            VariableOrderStrategy planner = VariableOrderStrategies.of(configuration);
            CnfFormula formula = CnfFormula.of(2, new int[] {2});
            assertThat(planner.plan(formula).size(), is(2));
        }
        AnalysisConfiguration natural =
                ImmutableAnalysisConfiguration.builder().orderStrategy(OrderStrategy.NATURAL).build();
        assertThat(VariableOrderStrategies.of(natural).plan(CnfFormula.of(2, new int[] {2})).ranking(),
                is(new int[] {0, 1}));
    }
}
