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

import java.math.BigInteger;
import org.immutables.value.Value;

/**
 * Result of analysing one formula.
 */
@Value.Immutable
public abstract class AnalysisReport {
    /** Counts with more digits are rendered in scientific notation. */
    static final int EXACT_DIGIT_LIMIT = 30;
    private static final int MANTISSA_DIGITS = 4;

    public abstract int variableCount();

    public abstract int clauseCount();

    public abstract int diagnosticCount();

    /**
     * Size of the diagram, counting the internal nodes and the terminal nodes reachable from the
     * root.
     */
    public abstract int nodeCount();

    public abstract BigInteger validConfigurationCount();

    /**
     * Distribution of the ratio variable among the samples, {@code k1/k0}, {@code k1/0 (inf)} or
     * {@code N/A}.
     */
    public abstract String sampleRatio();

    public abstract int samplesObtained();

    public abstract int pairwiseInteractionCount();

    public abstract int coverSetSize();

    public abstract boolean unsatisfiable();

    /**
     * Renders the number of valid configurations, exactly if it has at most 30 digits and as
     * {@code d.dddde<exponent> (approximate)} otherwise.
     */
    public String validConfigurationCountString() {
        return renderCount(validConfigurationCount());
    }

    static String renderCount(BigInteger count) {
        String digits = count.toString();
        if (digits.length() <= EXACT_DIGIT_LIMIT) {
            return digits;
        }
        return digits.charAt(0) + "." + digits.substring(1, 1 + MANTISSA_DIGITS) + 'e' + (digits.length() - 1)
                + " (approximate)";
    }
}
