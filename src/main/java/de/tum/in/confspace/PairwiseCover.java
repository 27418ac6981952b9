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
 * Configurations which together satisfy every feasible pairwise interaction.
 */
public final class PairwiseCover {
    private final List<Configuration> configurations;
    private final int coveredObligations;
    private final int droppedObligations;

    PairwiseCover(List<Configuration> configurations, int coveredObligations, int droppedObligations) {
        this.configurations = List.copyOf(configurations);
        this.coveredObligations = coveredObligations;
        this.droppedObligations = droppedObligations;
    }

    /**
     * The configurations in the order they were selected.
     */
    public List<Configuration> configurations() {
        return configurations;
    }

    public int size() {
        return configurations.size();
    }

    public int coveredObligations() {
        return coveredObligations;
    }

    /**
     * Number of obligations for which no witness could be found.
     */
    public int droppedObligations() {
        return droppedObligations;
    }

    public boolean covers(PairwiseObligation obligation) {
        return configurations.stream().anyMatch(obligation::isSatisfiedBy);
    }

    @Override
    public String toString() {
        return String.format("PairwiseCover(%d configurations, %d obligations covered, %d dropped)",
                configurations.size(), coveredObligations, droppedObligations);
    }
}
