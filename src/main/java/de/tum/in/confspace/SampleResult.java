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

import java.util.List;

/**
 * Distinct configurations drawn by {@link UniformSampler#sampleDistinct(int)}. May hold fewer
 * configurations than requested if the attempt budget ran out.
 */
public final class SampleResult {
    static final String NOT_AVAILABLE = "N/A";

    private final List<Configuration> samples;
    private final int requested;
    private final long attempts;

    SampleResult(List<Configuration> samples, int requested, long attempts) {
        this.samples = List.copyOf(samples);
        this.requested = requested;
        this.attempts = attempts;
    }

    public List<Configuration> samples() {
        return samples;
    }

    public int obtained() {
        return samples.size();
    }

    public int requested() {
        return requested;
    }

    public long attempts() {
        return attempts;
    }

    public boolean isComplete() {
        return samples.size() >= requested;
    }

    /**
     * Summarises how often the given variable is set among the samples as {@code k1/k0}, where
     * {@code k1} and {@code k0} count the samples with the variable set and unset, respectively. If
     * no sample has the variable unset, the result is {@code k1/0 (inf)}. Yields {@code N/A} if the
     * variable does not exist or there are no samples.
     */
    public String ratio(int variable) {
        if (samples.isEmpty() || variable < 0 || variable >= samples.get(0).variableCount()) {
            return NOT_AVAILABLE;
        }
        int set = 0;
        for (Configuration sample : samples) {
            if (sample.get(variable)) {
                set += 1;
            }
        }
        int unset = samples.size() - set;
        return unset == 0 ? set + "/0 (inf)" : set + "/" + unset;
    }

    @Override
    public String toString() {
        return String.format("%d of %d samples (%d attempts)", samples.size(), requested, attempts);
    }
}
