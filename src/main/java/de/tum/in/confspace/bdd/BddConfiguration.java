/*
 * This file is part of ConfSpace.
 * Copyright (c) 2023 Tobias Meggendorfer.
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
package de.tum.in.confspace.bdd;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class BddConfiguration {
    public static final int DEFAULT_CACHE_BINARY_DIVIDER = 32;
    public static final int DEFAULT_CACHE_SATISFACTION_DIVIDER = 32;
    public static final int DEFAULT_CACHE_NEGATION_DIVIDER = 32;
    public static final int DEFAULT_CACHE_RESTRICT_DIVIDER = 32;
    public static final int DEFAULT_CACHE_QUANTIFICATION_DIVIDER = 64;
    public static final double DEFAULT_NODE_TABLE_FREE_NODE_PERCENTAGE = 0.10d;
    public static final double DEFAULT_NODE_TABLE_GROWTH_FACTOR = 1.5d;
    public static final int DEFAULT_MAXIMUM_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;

    @Value.Default
    public int cacheBinaryDivider() {
        return DEFAULT_CACHE_BINARY_DIVIDER;
    }

    @Value.Default
    public int cacheSatisfactionDivider() {
        return DEFAULT_CACHE_SATISFACTION_DIVIDER;
    }

    @Value.Default
    public int cacheNegationDivider() {
        return DEFAULT_CACHE_NEGATION_DIVIDER;
    }

    @Value.Default
    public int cacheRestrictDivider() {
        return DEFAULT_CACHE_RESTRICT_DIVIDER;
    }

    @Value.Default
    public int cacheQuantificationDivider() {
        return DEFAULT_CACHE_QUANTIFICATION_DIVIDER;
    }

    @Value.Default
    public int initialSize() {
        return 1024;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_NODE_TABLE_GROWTH_FACTOR;
    }

    @Value.Default
    public double minimumFreeNodePercentageAfterGc() {
        return DEFAULT_NODE_TABLE_FREE_NODE_PERCENTAGE;
    }

    /**
     * Whether nodes which are no longer referenced may be reclaimed when the table runs full. Live
     * (referenced) nodes are never reclaimed.
     */
    @Value.Default
    public boolean useGarbageCollection() {
        return true;
    }

    /**
     * Upper bound on the node table size. Operations which would need a bigger table fail with a
     * {@link NodeTableCapacityException}.
     */
    @Value.Default
    public int maximumNodeCount() {
        return DEFAULT_MAXIMUM_NODE_COUNT;
    }

    @Value.Check
    protected void check() {
        Util.checkState(growthFactor() > 1.0, "Growth factor %s must be bigger than 1", growthFactor());
        Util.checkState(maximumNodeCount() > 0, "Maximum node count must be positive");
    }
}
