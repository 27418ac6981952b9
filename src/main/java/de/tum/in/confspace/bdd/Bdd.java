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

import java.math.BigInteger;
import java.util.BitSet;

/**
 * The binary decision diagram operations consumed by the configuration space analysis.
 *
 * <p>Note that for the sake of performance, most required properties of the arguments are only
 * checked though {@code assert} statements. With disabled assertions, undefined behaviour might
 * occur with invalid arguments.</p>
 *
 * <p>Variables are identified by their level: variable {@code i} is tested before variable
 * {@code j} on every path iff {@code i < j}. Mapping problem variables onto levels is the job of
 * the caller.</p>
 */
public interface Bdd extends DecisionDiagram {
    /**
     * Returns the node representing {@code true}.
     */
    int trueNode();

    /**
     * Returns the node representing {@code false}.
     */
    int falseNode();

    int high(int node);

    int low(int node);

    /**
     * Returns the node which represents the variable with given {@code variableNumber}. The variable
     * must already have been created.
     */
    int variableNode(int variableNumber);

    /**
     * Returns the node which represents the negation of the given variable.
     */
    int negatedVariableNode(int variableNumber);

    /**
     * Creates {@code count} many variables, allocated sequentially after the existing ones, and
     * returns their respective nodes.
     *
     * @throws IllegalArgumentException if count is negative.
     */
    int[] createVariables(int count);

    /**
     * Checks whether the given {@code node} evaluates to {@code true} under the given assignment,
     * where bit {@code i} of the assignment is the value of variable {@code i}.
     */
    boolean evaluate(int node, BitSet assignment);

    /**
     * Returns whether the function represented by {@code node} has a satisfying assignment. Since
     * the representation is canonical this is a constant time check.
     */
    default boolean isSatisfiable(int node) {
        return node != falseNode();
    }

    /**
     * Counts the number of satisfying assignments over all {@link #numberOfVariables() variables}.
     */
    BigInteger countSatisfyingAssignments(int node);

    /**
     * Counts the number of satisfying assignments of the function, assuming that only the last
     * {@code freeVariables} variables are free, i.e. the node may only test variables with index at
     * least {@code numberOfVariables() - freeVariables}.
     */
    BigInteger countSatisfyingAssignments(int node, int freeVariables);

    /**
     * Constructs the node representing {@code node1 AND node2}.
     */
    int and(int node1, int node2);

    /**
     * Constructs the node representing {@code node1 OR node2}.
     */
    int or(int node1, int node2);

    /**
     * Constructs the node representing {@code NOT node}.
     */
    int not(int node);

    /**
     * Computes the cofactor of the given {@code node} obtained by fixing {@code variable} to
     * {@code value}.
     */
    int restrict(int node, int variable, boolean value);

    /**
     * Constructs the node representing the existential quantification of {@code node} over all
     * variables set in {@code quantifiedVariables}.
     */
    int exists(int node, BitSet quantifiedVariables);

    /**
     * Auxiliary function for assignments like {@code node = f(in1, in2)} where both inputs are
     * temporary. References {@code result} and dereferences both inputs.
     *
     * @return The given {@code result}.
     */
    default int consume(int result, int inputNode1, int inputNode2) {
        reference(result);
        dereference(inputNode1);
        dereference(inputNode2);
        return result;
    }
}
