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

/**
 * Node management part of a decision diagram. Nodes are plain {@code int} handles owned by the
 * diagram; clients only hold them and signal interest through reference counting.
 */
public interface DecisionDiagram {
    /**
     * A special reserved placeholder distinct from any possible node value. Stays constant throughout
     * the life of the diagram.
     */
    int placeholder();

    /**
     * Determines whether the given {@code node} represents a constant.
     */
    boolean isLeaf(int node);

    /**
     * Gets the variable (i.e. the level) of the given {@code node} or {@code -1} for a leaf.
     */
    int variableOf(int node);

    int numberOfVariables();

    /**
     * Returns the reference count of the given node or {@literal -1} if this number can't be
     * determined, e.g. for leaves or saturated nodes.
     */
    int referenceCount(int node);

    /**
     * Marks the node as permanently referenced. Saturated nodes are never collected.
     */
    int saturateNode(int node);

    /**
     * Increases the reference count of the specified {@code node}.
     *
     * @return The given node, to be used for chaining.
     */
    int reference(int node);

    /**
     * Decreases the reference count of the specified {@code node}.
     *
     * @return The given node, to be used for chaining.
     */
    int dereference(int node);

    default void dereference(int... nodes) {
        for (int node : nodes) {
            dereference(node);
        }
    }

    /**
     * Auxiliary function for assignments like {@code node = f(node, ...)}. Dereferences
     * {@code inputNode} and references {@code result}.
     *
     * @return The given {@code result}.
     */
    default int updateWith(int result, int inputNode) {
        if (result != inputNode) {
            reference(result);
            dereference(inputNode);
        }
        return result;
    }

    /**
     * Counts the number of internal nodes reachable from referenced or saturated nodes.
     */
    int activeNodeCount();

    /**
     * Counts the number of internal (non-leaf) nodes below the specified {@code node}, sharing
     * counted once.
     */
    int nodeCount(int node);

    /**
     * Frees all nodes which are neither referenced nor reachable from a referenced node.
     *
     * @return Number of freed nodes.
     */
    int forceGc();

    /**
     * Returns a human-readable string with some statistics. Content and formatting may change at
     * any time.
     */
    String statistics();
}
