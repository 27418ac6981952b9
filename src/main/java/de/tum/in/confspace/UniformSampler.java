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
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Draws valid configurations uniformly at random.
 *
 * <p>A sample is obtained by descending from the root: at each node, the high branch is taken with
 * probability {@code |high| / (|low| + |high|)}, where {@code |child|} is the number of satisfying
 * assignments of the child over all levels below the node. Levels skipped along the path are free
 * and set by a fair coin. Every satisfying assignment thus has the same probability.</p>
 *
 * <p>Model counts of the nodes below the space root are memoised for the lifetime of the sampler.
 * For other nodes (e.g. restrictions of the root) a fresh memo is used on every call, since their
 * node handles may be reused once they are collected.</p>
 */
public final class UniformSampler {
    private static final Logger logger = Logger.getLogger(UniformSampler.class.getName());
    private static final BigInteger TWO = BigInteger.valueOf(2L);

    private final ConfigurationSpace space;
    private final Bdd bdd;
    private final Random random;
    private final Map<Integer, BigInteger> rootCounts = new HashMap<>();
    private final int attemptFactor;
    private final int attemptOffset;

    public UniformSampler(ConfigurationSpace space, Random random) {
        this(space, random, AnalysisConfiguration.DEFAULT_SAMPLE_ATTEMPT_FACTOR,
                AnalysisConfiguration.DEFAULT_SAMPLE_ATTEMPT_OFFSET);
    }

    /**
     * @param attemptFactor
     *     {@link #sampleDistinct(int)} gives up after {@code attemptFactor * k + attemptOffset}
     *     draws.
     */
    public UniformSampler(ConfigurationSpace space, Random random, int attemptFactor, int attemptOffset) {
        checkArgument(attemptFactor >= 0 && attemptOffset >= 0, "Negative attempt budget");
        this.space = space;
        this.bdd = space.bdd();
        this.random = random;
        this.attemptFactor = attemptFactor;
        this.attemptOffset = attemptOffset;
    }

    /**
     * Draws a configuration of the whole space, or nothing if the space is empty.
     */
    public Optional<Configuration> sample() {
        return sample(space.root());
    }

    /**
     * Draws a satisfying assignment of the given node, which must be a function over the variables
     * of the space (e.g. a restriction of the root). The node has to stay valid during the call.
     */
    public Optional<Configuration> sample(int node) {
        if (node == bdd.falseNode()) {
            return Optional.empty();
        }
        Map<Integer, BigInteger> counts = node == space.root() ? rootCounts : new HashMap<>();
        VariableOrder order = space.order();
        int levels = order.size();
        BitSet values = new BitSet(levels);

        int level = 0;
        int current = node;
        while (!bdd.isLeaf(current)) {
            int nodeLevel = bdd.variableOf(current);
            flipFreeLevels(values, order, level, nodeLevel);

            int low = bdd.low(current);
            int high = bdd.high(current);
            BigInteger lowWeight = weight(low, nodeLevel, counts);
            BigInteger highWeight = weight(high, nodeLevel, counts);
            boolean takeHigh = uniformBelow(lowWeight.add(highWeight), random).compareTo(highWeight) < 0;
            values.set(order.variableAt(nodeLevel), takeHigh);

            current = takeHigh ? high : low;
            level = nodeLevel + 1;
        }
        // The descent only enters branches with positive weight
        assert current == bdd.trueNode();
        flipFreeLevels(values, order, level, levels);
        return Optional.of(new Configuration(values, levels));
    }

    /**
     * Draws until {@code count} distinct configurations are found or the attempt budget is used
     * up. Running out of attempts is not an error; the result then is {@link
     * SampleResult#isComplete() incomplete}.
     */
    public SampleResult sampleDistinct(int count) {
        checkArgument(count >= 0, "Negative sample count %d", count);
        if (space.isUnsatisfiable() || count == 0) {
            return new SampleResult(new ArrayList<>(), count, 0);
        }
        long start = System.currentTimeMillis();
        long budget = (long) attemptFactor * count + attemptOffset;
        Set<Configuration> samples = new LinkedHashSet<>();
        long attempts = 0;
        while (samples.size() < count && attempts < budget) {
            attempts += 1;
            sample().ifPresent(samples::add);
        }
        SampleResult result = new SampleResult(new ArrayList<>(samples), count, attempts);
        if (result.isComplete()) {
            logger.log(Level.FINE, "Drew {0} in {1} ms", new Object[] {result, System.currentTimeMillis() - start});
        } else {
            logger.log(Level.WARNING, "Sampling budget exhausted, only got {0}", result);
        }
        return result;
    }

    private void flipFreeLevels(BitSet values, VariableOrder order, int fromLevel, int toLevel) {
        for (int free = fromLevel; free < toLevel; free++) {
            values.set(order.variableAt(free), random.nextBoolean());
        }
    }

    /* Satisfying assignments of child over the levels below parentLevel */
    private BigInteger weight(int child, int parentLevel, Map<Integer, BigInteger> counts) {
        if (child == bdd.falseNode()) {
            return BigInteger.ZERO;
        }
        int levels = bdd.numberOfVariables();
        if (child == bdd.trueNode()) {
            return TWO.pow(levels - parentLevel - 1);
        }
        int childLevel = bdd.variableOf(child);
        BigInteger count = counts.computeIfAbsent(
                child, node -> bdd.countSatisfyingAssignments(node, levels - childLevel));
        return count.shiftLeft(childLevel - parentLevel - 1);
    }

    /* Uniform in [0, bound) by rejection sampling */
    static BigInteger uniformBelow(BigInteger bound, Random random) {
        checkArgument(bound.signum() > 0, "Bound %s must be positive", bound);
        int bits = bound.bitLength();
        BigInteger candidate;
        do {
            candidate = new BigInteger(bits, random);
        } while (candidate.compareTo(bound) >= 0);
        return candidate;
    }
}
