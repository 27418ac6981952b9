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

import de.tum.in.confspace.bdd.Bdd;
import de.tum.in.confspace.bdd.BddFactory;
import de.tum.in.confspace.bdd.NodeTableCapacityException;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the complete analysis of a formula: variable ordering, diagram construction, metrics,
 * sampling, pairwise interactions and the pairwise cover.
 *
 * <p>Every call works on its own diagram, which is released before the call returns, so analyses of
 * unrelated formulas do not share any state.</p>
 */
public final class ConfigurationSpaceAnalyzer {
    private static final Logger logger = Logger.getLogger(ConfigurationSpaceAnalyzer.class.getName());

    private final AnalysisConfiguration configuration;

    public ConfigurationSpaceAnalyzer(AnalysisConfiguration configuration) {
        this.configuration = configuration;
    }

    public AnalysisConfiguration configuration() {
        return configuration;
    }

    public AnalysisReport analyze(Path path) throws IOException, CnfReader.InvalidFormatException {
        logger.log(Level.FINE, "Analysing {0}", path);
        return analyze(CnfReader.read(path, configuration.strictVariableCount()));
    }

    /**
     * Analyses the given formula.
     *
     * @throws NodeTableCapacityException
     *     If the diagram exceeds the configured maximum node count or the formula has more variables
     *     than a node can address.
     */
    public AnalysisReport analyze(CnfFormula formula) {
        long start = System.currentTimeMillis();
        Bdd bdd = BddFactory.buildBdd(configuration.bddConfiguration());
        VariableOrderStrategy strategy = VariableOrderStrategies.of(configuration);
        VariableOrder order = strategy.plan(formula);
        logger.log(Level.FINE, "Planned {0} order in {1} ms", new Object[] {
            strategy, System.currentTimeMillis() - start
        });

        long stage = System.currentTimeMillis();
        try (ConfigurationSpace space = new DiagramBuilder(configuration.batchSize()).build(bdd, formula, order)) {
            ImmutableAnalysisReport.Builder report = ImmutableAnalysisReport.builder()
                    .variableCount(formula.variableCount())
                    .clauseCount(formula.clauseCount())
                    .diagnosticCount(formula.diagnostics().size() + space.diagnostics().size());
            logger.log(Level.FINE, "Build stage took {0} ms", System.currentTimeMillis() - stage);

            stage = System.currentTimeMillis();
            ConfigurationSpaceMetrics metrics = new ConfigurationSpaceMetrics(space);
            int nodeCount = metrics.nodeCount();
            BigInteger modelCount = metrics.modelCount();
            report.nodeCount(nodeCount).validConfigurationCount(modelCount);
            logger.log(Level.FINE, "Metrics stage took {0} ms: {1} nodes, {2} configurations", new Object[] {
                System.currentTimeMillis() - stage, nodeCount, AnalysisReport.renderCount(modelCount)
            });

            if (space.isUnsatisfiable()) {
                logger.log(Level.WARNING, "{0} is unsatisfiable", formula);
                return report.sampleRatio(SampleResult.NOT_AVAILABLE)
                        .samplesObtained(0)
                        .pairwiseInteractionCount(0)
                        .coverSetSize(0)
                        .unsatisfiable(true)
                        .build();
            }

            stage = System.currentTimeMillis();
            UniformSampler sampler = new UniformSampler(space, new Random(configuration.seed()),
                    configuration.sampleAttemptFactor(), configuration.sampleAttemptOffset());
            SampleResult samples = sampler.sampleDistinct(configuration.sampleCount());
            report.sampleRatio(samples.ratio(configuration.ratioVariable())).samplesObtained(samples.obtained());
            logger.log(Level.FINE, "Sampling stage took {0} ms", System.currentTimeMillis() - stage);

            stage = System.currentTimeMillis();
            List<PairwiseObligation> obligations =
                    new InteractionAnalyzer(space, configuration.interactionVariableLimit()).obligations();
            report.pairwiseInteractionCount(obligations.size());
            logger.log(Level.FINE, "Interaction stage took {0} ms", System.currentTimeMillis() - stage);

            stage = System.currentTimeMillis();
            PairwiseCover cover = new PairwiseCoverBuilder(space, sampler).build(obligations);
            report.coverSetSize(cover.size());
            logger.log(Level.FINE, "Cover stage took {0} ms", System.currentTimeMillis() - stage);

            return report.unsatisfiable(false).build();
        } finally {
            logger.log(Level.FINE, "Analysis of {0} took {1} ms", new Object[] {
                formula, System.currentTimeMillis() - start
            });
            if (logger.isLoggable(Level.FINER)) {
                logger.log(Level.FINER, "Diagram statistics:\n{0}", bdd.statistics());
            }
        }
    }
}
