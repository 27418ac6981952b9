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

import java.math.BigInteger;
import org.junit.jupiter.api.Test;

public class AnalysisReportTest {
    @Test
    public void testRenderCount() {
        assertThat(AnalysisReport.renderCount(BigInteger.ZERO), is("0"));
        BigInteger thirtyDigits = BigInteger.TEN.pow(30).subtract(BigInteger.ONE);
        assertThat(AnalysisReport.renderCount(thirtyDigits), is(thirtyDigits.toString()));
        assertThat(AnalysisReport.renderCount(BigInteger.TEN.pow(30)), is("1.0000e30 (approximate)"));
        assertThat(AnalysisReport.renderCount(new BigInteger("123456789").multiply(BigInteger.TEN.pow(100))),
                is("1.2345e108 (approximate)"));
    }

    @Test
    public void testBuilder() {
        AnalysisReport report = ImmutableAnalysisReport.builder()
                .variableCount(2)
                .clauseCount(2)
                .diagnosticCount(0)
                .nodeCount(5)
                .validConfigurationCount(BigInteger.TWO)
                .sampleRatio("N/A")
                .samplesObtained(2)
                .pairwiseInteractionCount(2)
                .coverSetSize(2)
                .unsatisfiable(false)
                .build();
        assertThat(report.validConfigurationCountString(), is("2"));
        assertThat(report, is(ImmutableAnalysisReport.copyOf(report)));
    }
}
