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
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multiset;
import de.tum.in.confspace.bdd.Bdd;
import de.tum.in.confspace.bdd.BddFactory;
import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import org.junit.jupiter.api.Test;

public class UniformSamplerTest {
    private static final int DRAWS = 100_000;

    private static ConfigurationSpace build(CnfFormula formula, VariableOrder order) {
        return new DiagramBuilder(100).build(BddFactory.buildBdd(), formula, order);
    }

    private static Multiset<Configuration> draw(UniformSampler sampler, int draws) {
        Multiset<Configuration> counts = HashMultiset.create();
        for (int i = 0; i < draws; i++) {
            counts.add(sampler.sample().orElseThrow());
        }
        return counts;
    }

    @Test
    public void testUniformWithoutFreeVariables() {
        // x3 = x1 xor x2: four models, every variable tested on every path
        CnfFormula formula = CnfFormula.of(3,
                new int[] {-1, -2, -3}, new int[] {1, 2, -3}, new int[] {1, -2, 3}, new int[] {-1, 2, 3});
        try (ConfigurationSpace space = build(formula, VariableOrder.identity(3))) {
            Multiset<Configuration> counts = draw(new UniformSampler(space, new Random(0L)), DRAWS);
            assertThat(counts.elementSet(), is(ImmutableSet.of(
                    Configuration.parse("000"),
                    Configuration.parse("011"),
                    Configuration.parse("101"),
                    Configuration.parse("110"))));
            for (Configuration model : counts.elementSet()) {
                assertThat((double) counts.count(model) / DRAWS, closeTo(0.25, 0.01));
            }
        }
    }

    @Test
    public void testUniformOnUnbalancedDiagram() {
        // (x1 or x2 or x3) has seven models, but the paths of its diagram are of different length
        CnfFormula formula = CnfFormula.of(3, new int[] {1, 2, 3});
        try (ConfigurationSpace space = build(formula, VariableOrder.identity(3))) {
            Multiset<Configuration> counts = draw(new UniformSampler(space, new Random(1L)), DRAWS);
            assertThat(counts.elementSet().size(), is(7));
            for (Configuration model : counts.elementSet()) {
                assertThat((double) counts.count(model) / DRAWS, closeTo(1.0 / 7, 0.01));
            }
        }
    }

    @Test
    public void testUniformWithDontCares() {
        // x2 and x4 are free, x1 and x3 must differ: eight models
        CnfFormula formula = CnfFormula.of(4, new int[] {1, 3}, new int[] {-1, -3});
        try (ConfigurationSpace space = build(formula, VariableOrder.of(new int[] {3, 0, 1, 2}))) {
            Multiset<Configuration> counts = draw(new UniformSampler(space, new Random(2L)), DRAWS);
            assertThat(counts.elementSet().size(), is(8));
            for (Configuration model : counts.elementSet()) {
                assertThat(BruteForce.satisfies(formula, model), is(true));
                assertThat((double) counts.count(model) / DRAWS, closeTo(0.125, 0.01));
            }
        }
    }

    @Test
    public void testSamplesAreValid() {
        Random random = new Random(3L);
        for (int i = 0; i < 30; i++) {
            CnfFormula formula = BruteForce.randomFormula(random, 1 + random.nextInt(25), random.nextInt(30), 4);
            try (ConfigurationSpace space = build(formula, new ForceDirectedOrder(50).plan(formula))) {
                UniformSampler sampler = new UniformSampler(space, random);
                for (int j = 0; j < 50; j++) {
                    Optional<Configuration> sample = sampler.sample();
                    assertThat(sample.isPresent(), is(!space.isUnsatisfiable()));
                    sample.ifPresent(configuration -> {
                        assertThat(BruteForce.satisfies(formula, configuration), is(true));
                        assertThat(space.contains(configuration), is(true));
                    });
                }
            }
        }
    }

    @Test
    public void testSampleRestriction() {
        CnfFormula formula = CnfFormula.of(3, new int[] {1, 2, 3});
        try (ConfigurationSpace space = build(formula, VariableOrder.identity(3))) {
            Bdd bdd = space.bdd();
            UniformSampler sampler = new UniformSampler(space, new Random(4L));
            int restricted = bdd.reference(bdd.and(space.root(), space.literalNode(0, false)));
            for (int i = 0; i < 100; i++) {
                Configuration sample = sampler.sample(restricted).orElseThrow();
                assertThat(sample.get(0), is(false));
                assertThat(sample.get(1) || sample.get(2), is(true));
            }
            bdd.dereference(restricted);
            assertThat(sampler.sample(bdd.falseNode()), is(Optional.empty()));
        }
    }

    @Test
    public void testUnsatisfiable() {
        CnfFormula formula = CnfFormula.of(2, new int[] {1}, new int[] {-1});
        try (ConfigurationSpace space = build(formula, VariableOrder.identity(2))) {
            UniformSampler sampler = new UniformSampler(space, new Random(5L));
            assertThat(sampler.sample(), is(Optional.empty()));
            SampleResult result = sampler.sampleDistinct(10);
            assertThat(result.obtained(), is(0));
            assertThat(result.isComplete(), is(false));
            assertThat(result.ratio(0), is("N/A"));
        }
    }

    @Test
    public void testSampleDistinct() {
        CnfFormula formula = CnfFormula.of(10, new int[] {1, 2});
        try (ConfigurationSpace space = build(formula, VariableOrder.identity(10))) {
            SampleResult result = new UniformSampler(space, new Random(6L)).sampleDistinct(100);
            assertThat(result.isComplete(), is(true));
            assertThat(result.obtained(), is(100));
            assertThat(ImmutableSet.copyOf(result.samples()).size(), is(100));
            assertThat(result.attempts(), greaterThanOrEqualTo(100L));
        }
    }

    @Test
    public void testSampleDistinctExhausted() {
        // Only three models exist
        CnfFormula formula = CnfFormula.of(2, new int[] {1, 2});
        try (ConfigurationSpace space = build(formula, VariableOrder.identity(2))) {
            SampleResult result = new UniformSampler(space, new Random(7L), 20, 100).sampleDistinct(10);
            assertThat(result.isComplete(), is(false));
            assertThat(result.obtained(), is(3));
            assertThat(result.requested(), is(10));
            assertThat(result.attempts(), is(300L));
        }
        assertThrows(IllegalArgumentException.class, () -> UniformSampler.uniformBelow(BigInteger.ZERO, new Random()));
    }

    @Test
    public void testRatio() {
        List<Configuration> samples = List.of(
                Configuration.parse("11"), Configuration.parse("11"), Configuration.parse("01"));
        SampleResult result = new SampleResult(samples, 3, 3);
        assertThat(result.ratio(0), is("2/1"));
        assertThat(result.ratio(1), is("3/0 (inf)"));
        assertThat(result.ratio(2), is("N/A"));
        assertThat(result.ratio(-1), is("N/A"));
    }

    @Test
    public void testUniformBelow() {
        Random random = new Random(8L);
        BigInteger bound = BigInteger.valueOf(5L);
        int[] counts = new int[5];
        for (int i = 0; i < 50_000; i++) {
            BigInteger value = UniformSampler.uniformBelow(bound, random);
            assertThat(value.signum() >= 0, is(true));
            assertThat(value.compareTo(bound), lessThan(0));
            counts[value.intValueExact()] += 1;
        }
        for (int count : counts) {
            assertThat(count / 50_000.0, closeTo(0.2, 0.01));
        }
    }
}
