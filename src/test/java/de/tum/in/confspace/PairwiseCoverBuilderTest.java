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
import static org.hamcrest.Matchers.lessThanOrEqualTo;

import de.tum.in.confspace.bdd.BddFactory;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class PairwiseCoverBuilderTest {
    private static ConfigurationSpace build(CnfFormula formula) {
        return new DiagramBuilder(100).build(BddFactory.buildBdd(), formula, new FrequencyOrder().plan(formula));
    }

    private static PairwiseCover cover(ConfigurationSpace space, List<PairwiseObligation> obligations, long seed) {
        UniformSampler sampler = new UniformSampler(space, new Random(seed));
        return new PairwiseCoverBuilder(space, sampler).build(obligations);
    }

    @Test
    public void testExclusiveOr() {
        CnfFormula formula = CnfFormula.of(2, new int[] {1, 2}, new int[] {-1, -2});
        try (ConfigurationSpace space = build(formula)) {
            List<PairwiseObligation> obligations = new InteractionAnalyzer(space, 50).obligations();
            PairwiseCover cover = cover(space, obligations, 0L);
            assertThat(cover.size(), is(2));
            assertThat(cover.coveredObligations(), is(2));
            assertThat(cover.droppedObligations(), is(0));
            assertThat(cover.configurations().contains(Configuration.parse("10")), is(true));
            assertThat(cover.configurations().contains(Configuration.parse("01")), is(true));
        }
    }

    @Test
    public void testCoverIsComplete() {
        Random random = new Random(1L);
        for (int i = 0; i < 40; i++) {
            int variables = 2 + random.nextInt(30);
            CnfFormula formula = BruteForce.randomFormula(random, variables, random.nextInt(40), 4);
            try (ConfigurationSpace space = build(formula)) {
                List<PairwiseObligation> obligations = new InteractionAnalyzer(space, 50).obligations();
                PairwiseCover cover = cover(space, obligations, i);
                for (PairwiseObligation obligation : obligations) {
                    assertThat(cover.covers(obligation), is(true));
                }
                for (Configuration configuration : cover.configurations()) {
                    assertThat(space.contains(configuration), is(true));
                }
                assertThat(cover.size(), lessThanOrEqualTo(obligations.size()));
                assertThat(cover.droppedObligations(), is(0));
                assertThat(cover.size() == 0, is(obligations.isEmpty()));
            }
        }
    }

    @Test
    public void testEveryConfigurationCoversSomethingNew() {
        CnfFormula formula = BruteForce.randomFormula(new Random(2L), 20, 15, 3);
        try (ConfigurationSpace space = build(formula)) {
            List<PairwiseObligation> obligations = new InteractionAnalyzer(space, 50).obligations();
            List<Configuration> configurations = cover(space, obligations, 3L).configurations();
            for (int i = 0; i < configurations.size(); i++) {
                List<Configuration> previous = configurations.subList(0, i);
                Configuration current = configurations.get(i);
                boolean coversNew = obligations.stream().anyMatch(obligation -> obligation.isSatisfiedBy(current)
                        && previous.stream().noneMatch(obligation::isSatisfiedBy));
                assertThat(coversNew, is(true));
            }
        }
    }

    @Test
    public void testInfeasibleObligationIsDropped() {
        // x1 and x2 can't both be true
        CnfFormula formula = CnfFormula.of(3, new int[] {-1, -2});
        try (ConfigurationSpace space = build(formula)) {
            PairwiseObligation infeasible = new PairwiseObligation(0, true, 1, true);
            PairwiseObligation feasible = new PairwiseObligation(1, true, 2, false);
            PairwiseCover cover = cover(space, List.of(infeasible, feasible), 4L);
            assertThat(cover.size(), is(1));
            assertThat(cover.droppedObligations(), is(1));
            assertThat(cover.coveredObligations(), is(1));
            assertThat(cover.covers(feasible), is(true));
        }
    }

    @Test
    public void testUnsatisfiable() {
        CnfFormula formula = CnfFormula.of(2, new int[] {2}, new int[] {-2});
        try (ConfigurationSpace space = build(formula)) {
            PairwiseCover cover = cover(space, new InteractionAnalyzer(space, 50).obligations(), 5L);
            assertThat(cover.size(), is(0));
            assertThat(cover.configurations().isEmpty(), is(true));
        }
    }
}
