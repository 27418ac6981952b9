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
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Greedily selects configurations until every given obligation is satisfied by one of them.
 *
 * <p>Each step takes the first uncovered obligation, draws a uniform witness among the valid
 * configurations satisfying it and removes every uncovered obligation the witness satisfies.
 * Obligations without any witness are dropped. Each step removes at least one obligation, so there
 * are at most as many steps as obligations.</p>
 */
public final class PairwiseCoverBuilder {
    private static final Logger logger = Logger.getLogger(PairwiseCoverBuilder.class.getName());

    private final ConfigurationSpace space;
    private final UniformSampler sampler;

    public PairwiseCoverBuilder(ConfigurationSpace space, UniformSampler sampler) {
        this.space = space;
        this.sampler = sampler;
    }

    public PairwiseCover build(Collection<PairwiseObligation> universe) {
        if (space.isUnsatisfiable() || universe.isEmpty()) {
            return new PairwiseCover(List.of(), 0, universe.size());
        }
        long start = System.currentTimeMillis();
        Bdd bdd = space.bdd();
        Set<PairwiseObligation> uncovered = new LinkedHashSet<>(universe);
        int obligationCount = uncovered.size();
        List<Configuration> cover = new ArrayList<>();
        int dropped = 0;

        while (!uncovered.isEmpty()) {
            Iterator<PairwiseObligation> iterator = uncovered.iterator();
            PairwiseObligation target = iterator.next();

            int withA = bdd.reference(bdd.and(space.root(), space.literalNode(target.variableA(), target.valueA())));
            int withBoth = bdd.reference(bdd.and(withA, space.literalNode(target.variableB(), target.valueB())));
            bdd.dereference(withA);
            Optional<Configuration> witness = sampler.sample(withBoth);
            bdd.dereference(withBoth);

            if (witness.isEmpty()) {
                logger.log(Level.WARNING, "No valid configuration satisfies {0}, dropping it", target);
                iterator.remove();
                dropped += 1;
                continue;
            }
            Configuration configuration = witness.get();
            assert target.isSatisfiedBy(configuration);
            cover.add(configuration);
            uncovered.removeIf(obligation -> obligation.isSatisfiedBy(configuration));
            logger.log(Level.FINEST, "Selected {0}, {1} obligations left", new Object[] {
                configuration, uncovered.size()
            });
        }

        PairwiseCover result = new PairwiseCover(cover, obligationCount - dropped, dropped);
        logger.log(Level.FINE, "Built {0} in {1} ms", new Object[] {result, System.currentTimeMillis() - start});
        return result;
    }
}
