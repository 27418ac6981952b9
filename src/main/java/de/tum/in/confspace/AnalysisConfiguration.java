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

import de.tum.in.confspace.bdd.BddConfiguration;
import de.tum.in.confspace.bdd.ImmutableBddConfiguration;
import de.tum.in.confspace.bdd.Util;
import org.immutables.value.Value;

/**
 * Parameters of a {@link ConfigurationSpaceAnalyzer} run. Obtain instances through
 * {@code ImmutableAnalysisConfiguration.builder()}.
 */
@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public abstract class AnalysisConfiguration {
    public static final int DEFAULT_FORCE_ROUNDS = 100;
    public static final int DEFAULT_BATCH_SIZE = 100;
    public static final int DEFAULT_INTERACTION_VARIABLE_LIMIT = 50;
    public static final int DEFAULT_SAMPLE_COUNT = 10_000;
    public static final int DEFAULT_SAMPLE_ATTEMPT_FACTOR = 20;
    public static final int DEFAULT_SAMPLE_ATTEMPT_OFFSET = 100;
    /* Feature x42 */
    public static final int DEFAULT_RATIO_VARIABLE = 41;
    public static final long DEFAULT_SEED = 42L;

    @Value.Default
    public OrderStrategy orderStrategy() {
        return OrderStrategy.FORCE;
    }

    @Value.Default
    public int forceRounds() {
        return DEFAULT_FORCE_ROUNDS;
    }

    /**
     * Number of clauses conjoined separately before being added to the running conjunction.
     */
    @Value.Default
    public int batchSize() {
        return DEFAULT_BATCH_SIZE;
    }

    /**
     * Number of most frequent variables considered for pairwise interactions.
     */
    @Value.Default
    public int interactionVariableLimit() {
        return DEFAULT_INTERACTION_VARIABLE_LIMIT;
    }

    @Value.Default
    public int sampleCount() {
        return DEFAULT_SAMPLE_COUNT;
    }

    @Value.Default
    public int sampleAttemptFactor() {
        return DEFAULT_SAMPLE_ATTEMPT_FACTOR;
    }

    @Value.Default
    public int sampleAttemptOffset() {
        return DEFAULT_SAMPLE_ATTEMPT_OFFSET;
    }

    /**
     * The 0-based variable whose value distribution among the samples is reported.
     */
    @Value.Default
    public int ratioVariable() {
        return DEFAULT_RATIO_VARIABLE;
    }

    @Value.Default
    public long seed() {
        return DEFAULT_SEED;
    }

    /**
     * Whether a positive declared variable count is authoritative, see
     * {@link CnfReader#read(java.io.BufferedReader, boolean)}.
     */
    @Value.Default
    public boolean strictVariableCount() {
        return false;
    }

    @Value.Default
    public BddConfiguration bddConfiguration() {
        return ImmutableBddConfiguration.builder().build();
    }

    @Value.Check
    protected void check() {
        Util.checkState(forceRounds() >= 0, "Negative number of FORCE rounds");
        Util.checkState(batchSize() > 0, "Batch size must be positive");
        Util.checkState(interactionVariableLimit() >= 0, "Negative interaction variable limit");
        Util.checkState(sampleCount() >= 0, "Negative sample count");
        Util.checkState(sampleAttemptFactor() >= 0 && sampleAttemptOffset() >= 0, "Negative sample budget");
    }
}
