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
import java.math.BigInteger;

/**
 * Size and model count of a {@link ConfigurationSpace}.
 */
public final class ConfigurationSpaceMetrics {
    private final ConfigurationSpace space;

    public ConfigurationSpaceMetrics(ConfigurationSpace space) {
        this.space = space;
    }

    /**
     * Number of internal nodes reachable from the root.
     */
    public int internalNodeCount() {
        return space.bdd().nodeCount(space.root());
    }

    /**
     * Number of nodes reachable from the root, including terminals. A constant function consists of
     * one terminal, every other reduced diagram reaches both terminals.
     */
    public int nodeCount() {
        Bdd bdd = space.bdd();
        int root = space.root();
        return bdd.isLeaf(root) ? 1 : bdd.nodeCount(root) + 2;
    }

    /**
     * Number of valid configurations, i.e. satisfying assignments over all variables.
     */
    public BigInteger modelCount() {
        return space.bdd().countSatisfyingAssignments(space.root());
    }
}
